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

import exm.sdfg.common.exceptions.SDFGRuntimeError;

/**
 * One dimension of a subset: start, inclusive end and step.
 */
public class Range {
  public final SymExpr start;
  /** Inclusive */
  public final SymExpr end;
  public final SymExpr step;

  public Range(SymExpr start, SymExpr end, SymExpr step) {
    assert(start != null && end != null && step != null);
    this.start = start;
    this.end = end;
    this.step = step;
  }

  public Range(SymExpr start, SymExpr end) {
    this(start, end, SymExpr.ONE);
  }

  public static Range of(long start, long end, long step) {
    return new Range(SymExpr.of(start), SymExpr.of(end), SymExpr.of(step));
  }

  /**
   * A single index
   */
  public static Range index(SymExpr i) {
    return new Range(i, i, SymExpr.ONE);
  }

  /**
   * Range covering [0, extent)
   */
  public static Range whole(SymExpr extent) {
    return new Range(SymExpr.ZERO, extent.minus(1), SymExpr.ONE);
  }

  /**
   * Parse "i", "a:b" (exclusive b) or "a:b:s"
   */
  public static Range parse(String text) {
    String parts[] = text.split(":", -1);
    if (parts.length == 1) {
      return index(SymExpr.parse(parts[0]));
    } else if (parts.length == 2 || parts.length == 3) {
      SymExpr start = SymExpr.parse(parts[0]);
      SymExpr end = SymExpr.parse(parts[1]).minus(1);
      SymExpr step = parts.length == 3 ? SymExpr.parse(parts[2])
                                       : SymExpr.ONE;
      return new Range(start, end, step);
    }
    throw new IllegalArgumentException("Invalid range: \"" + text + "\"");
  }

  /**
   * Number of elements in range
   */
  public SymExpr size() {
    SymExpr span = end.plus(1).minus(start);
    if (step.isConstant(1)) {
      return span;
    } else if (step.isConstant() && span.isConstant()) {
      long s = step.constantValue();
      long n = span.constantValue();
      return SymExpr.of(Math.max(0, (n + s - 1) / s));
    } else if (step.isConstant()) {
      return span.divideExact(step.constantValue());
    }
    throw new SDFGRuntimeError("Cannot compute size of range " + this
                            + " with symbolic step");
  }

  public boolean isIndex() {
    return start.equals(end) && step.isConstant(1);
  }

  public Range offset(SymExpr by, boolean negative) {
    SymExpr delta = negative ? by.negate() : by;
    return new Range(start.plus(delta), end.plus(delta), step);
  }

  @Override
  public int hashCode() {
    final int prime = 31;
    int result = 1;
    result = prime * result + start.hashCode();
    result = prime * result + end.hashCode();
    result = prime * result + step.hashCode();
    return result;
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj)
      return true;
    if (!(obj instanceof Range))
      return false;
    Range other = (Range) obj;
    return start.equals(other.start) && end.equals(other.end) &&
           step.equals(other.step);
  }

  @Override
  public String toString() {
    if (isIndex()) {
      return start.toString();
    }
    String res = start + ":" + end.plus(1);
    if (!step.isConstant(1)) {
      res += ":" + step;
    }
    return res;
  }
}
