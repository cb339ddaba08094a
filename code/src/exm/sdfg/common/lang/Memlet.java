/*
 * Copyright 2013 University of Chicago and Argonne National Laboratory
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License
 */
package exm.sdfg.common.lang;

/**
 * Data movement descriptor attached to an edge: which elements of which
 * data container are moved along the edge.
 *
 * A memlet with no data name is an empty memlet, used only to connect nodes
 * to scope boundaries without moving any data.
 */
public class Memlet {
  private String data;
  private Subset subset;
  /** View of same elements on the other end of a boundary, or null */
  private Subset otherSubset;
  private SymExpr volume;
  /** Write-conflict resolution function, or null */
  private String wcr;
  /** True if the number of accesses is only known at runtime */
  private boolean dynamic;

  public Memlet(String data, Subset subset, Subset otherSubset,
                SymExpr volume, String wcr, boolean dynamic) {
    this.data = data;
    this.subset = subset;
    this.otherSubset = otherSubset;
    this.volume = volume;
    this.wcr = wcr;
    this.dynamic = dynamic;
  }

  public static Memlet simple(String data, Subset subset) {
    return new Memlet(data, subset, null, subset.numElements(), null, false);
  }

  public static Memlet simple(String data, String subset) {
    return simple(data, Subset.parse(subset));
  }

  public static Memlet withWcr(String data, String subset, String wcr) {
    Memlet m = simple(data, subset);
    m.wcr = wcr;
    return m;
  }

  /**
   * Memlet covering the whole of an array
   */
  public static Memlet fromArray(String name, ArrayDesc desc) {
    return simple(name, Subset.fromShape(desc.getShape()));
  }

  public static Memlet empty() {
    return new Memlet(null, new Subset(), null, SymExpr.ZERO, null, false);
  }

  public Memlet copy() {
    return new Memlet(data, subset, otherSubset, volume, wcr, dynamic);
  }

  public boolean isEmpty() {
    return data == null;
  }

  public String getData() {
    return data;
  }

  public void setData(String data) {
    this.data = data;
  }

  public Subset getSubset() {
    return subset;
  }

  public void setSubset(Subset subset) {
    this.subset = subset;
  }

  public Subset getOtherSubset() {
    return otherSubset;
  }

  public void setOtherSubset(Subset otherSubset) {
    this.otherSubset = otherSubset;
  }

  public SymExpr getVolume() {
    return volume;
  }

  public void setVolume(SymExpr volume) {
    this.volume = volume;
  }

  public String getWcr() {
    return wcr;
  }

  public void setWcr(String wcr) {
    this.wcr = wcr;
  }

  public boolean isDynamic() {
    return dynamic;
  }

  public void setDynamic(boolean dynamic) {
    this.dynamic = dynamic;
  }

  @Override
  public int hashCode() {
    final int prime = 31;
    int result = 1;
    result = prime * result + ((data == null) ? 0 : data.hashCode());
    result = prime * result + subset.hashCode();
    result = prime * result + volume.hashCode();
    return result;
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj)
      return true;
    if (!(obj instanceof Memlet))
      return false;
    Memlet other = (Memlet) obj;
    return eq(data, other.data) && subset.equals(other.subset) &&
        eq(otherSubset, other.otherSubset) && volume.equals(other.volume) &&
        eq(wcr, other.wcr) && dynamic == other.dynamic;
  }

  private static boolean eq(Object a, Object b) {
    return a == null ? b == null : a.equals(b);
  }

  @Override
  public String toString() {
    if (isEmpty()) {
      return "{}";
    }
    StringBuilder sb = new StringBuilder();
    sb.append(data).append("[").append(subset).append("]");
    if (otherSubset != null) {
      sb.append(" -> [").append(otherSubset).append("]");
    }
    if (wcr != null) {
      sb.append(" (CR: ").append(wcr).append(")");
    }
    if (dynamic) {
      sb.append(" (dyn)");
    }
    return sb.toString();
  }
}
