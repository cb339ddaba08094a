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

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import org.apache.commons.lang3.StringUtils;

/**
 * Descriptor for a data container in an SDFG's array table.
 * Owned by exactly one SDFG, looked up by name.
 */
public class ArrayDesc {

  public static enum DataKind {
    ARRAY,
    SCALAR,
    STREAM,
  }

  private String name;
  private final DataKind kind;
  private final DataType dtype;
  private final List<SymExpr> shape;
  private final List<SymExpr> strides;
  private StorageType storage;
  private boolean transient_;

  public ArrayDesc(String name, DataKind kind, DataType dtype,
                   List<SymExpr> shape, List<SymExpr> strides,
                   StorageType storage, boolean transient_) {
    assert(shape.size() == strides.size()) : shape + " " + strides;
    this.name = name;
    this.kind = kind;
    this.dtype = dtype;
    this.shape = Collections.unmodifiableList(new ArrayList<SymExpr>(shape));
    this.strides = Collections.unmodifiableList(
                                        new ArrayList<SymExpr>(strides));
    this.storage = storage;
    this.transient_ = transient_;
  }

  public static ArrayDesc array(String name, DataType dtype,
                                List<SymExpr> shape, boolean transient_) {
    return new ArrayDesc(name, DataKind.ARRAY, dtype, shape,
            defaultStrides(shape), StorageType.DEFAULT, transient_);
  }

  public static ArrayDesc array(String name, DataType dtype,
                                boolean transient_, String ... shape) {
    List<SymExpr> s = new ArrayList<SymExpr>(shape.length);
    for (String extent: shape) {
      s.add(SymExpr.parse(extent));
    }
    return array(name, dtype, s, transient_);
  }

  public static ArrayDesc scalar(String name, DataType dtype,
                                 boolean transient_) {
    List<SymExpr> one = Arrays.asList(SymExpr.ONE);
    return new ArrayDesc(name, DataKind.SCALAR, dtype, one, one,
                        StorageType.REGISTER, transient_);
  }

  /**
   * Row-major (C order) strides
   */
  public static List<SymExpr> defaultStrides(List<SymExpr> shape) {
    SymExpr[] strides = new SymExpr[shape.size()];
    SymExpr acc = SymExpr.ONE;
    for (int i = shape.size() - 1; i >= 0; i--) {
      strides[i] = acc;
      acc = acc.times(shape.get(i));
    }
    return Arrays.asList(strides);
  }

  public ArrayDesc copy() {
    return copyAs(name);
  }

  public ArrayDesc copyAs(String newName) {
    return new ArrayDesc(newName, kind, dtype, shape, strides, storage,
                         transient_);
  }

  public String getName() {
    return name;
  }

  /**
   * Should only be called by the owning array table
   */
  public void setName(String name) {
    this.name = name;
  }

  public DataKind getKind() {
    return kind;
  }

  public DataType getDtype() {
    return dtype;
  }

  public List<SymExpr> getShape() {
    return shape;
  }

  public List<SymExpr> getStrides() {
    return strides;
  }

  public int rank() {
    return shape.size();
  }

  public SymExpr totalSize() {
    SymExpr total = SymExpr.ONE;
    for (SymExpr s: shape) {
      total = total.times(s);
    }
    return total;
  }

  public StorageType getStorage() {
    return storage;
  }

  public void setStorage(StorageType storage) {
    this.storage = storage;
  }

  public boolean isTransient() {
    return transient_;
  }

  public void setTransient(boolean transient_) {
    this.transient_ = transient_;
  }

  @Override
  public int hashCode() {
    final int prime = 31;
    int result = 1;
    result = prime * result + ((name == null) ? 0 : name.hashCode());
    result = prime * result + kind.hashCode();
    result = prime * result + dtype.hashCode();
    result = prime * result + shape.hashCode();
    result = prime * result + (transient_ ? 1231 : 1237);
    return result;
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj)
      return true;
    if (!(obj instanceof ArrayDesc))
      return false;
    ArrayDesc other = (ArrayDesc) obj;
    if (name == null) {
      if (other.name != null)
        return false;
    } else if (!name.equals(other.name))
      return false;
    return kind == other.kind && dtype == other.dtype &&
           shape.equals(other.shape) && strides.equals(other.strides) &&
           storage == other.storage && transient_ == other.transient_;
  }

  @Override
  public String toString() {
    return (transient_ ? "transient " : "") + kind.toString().toLowerCase()
        + " " + name + ": " + dtype.toString().toLowerCase()
        + "[" + StringUtils.join(shape, ", ") + "]";
  }
}
