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

import exm.sdfg.common.exceptions.SDFGRuntimeError;

/**
 * Hyper-rectangular set of array elements: one range per dimension.
 * Immutable: all operations return a new subset.
 */
public class Subset {

  private final List<Range> ranges;

  public Subset(List<Range> ranges) {
    this.ranges = Collections.unmodifiableList(new ArrayList<Range>(ranges));
  }

  public Subset(Range ... ranges) {
    this(Arrays.asList(ranges));
  }

  /**
   * Parse a comma-separated list of ranges, e.g. "0:N, i, 0:10:2"
   */
  public static Subset parse(String text) {
    List<Range> ranges = new ArrayList<Range>();
    if (!StringUtils.isBlank(text)) {
      for (String dim: text.split(",")) {
        ranges.add(Range.parse(dim.trim()));
      }
    }
    return new Subset(ranges);
  }

  /**
   * Subset covering an entire array of given shape
   */
  public static Subset fromShape(List<SymExpr> shape) {
    List<Range> ranges = new ArrayList<Range>(shape.size());
    for (SymExpr extent: shape) {
      ranges.add(Range.whole(extent));
    }
    return new Subset(ranges);
  }

  public int dims() {
    return ranges.size();
  }

  public Range get(int dim) {
    return ranges.get(dim);
  }

  public List<Range> ranges() {
    return ranges;
  }

  /**
   * @return extent of each dimension, in order
   */
  public List<SymExpr> size() {
    List<SymExpr> res = new ArrayList<SymExpr>(ranges.size());
    for (Range r: ranges) {
      res.add(r.size());
    }
    return res;
  }

  public SymExpr numElements() {
    SymExpr total = SymExpr.ONE;
    for (SymExpr s: size()) {
      total = total.times(s);
    }
    return total;
  }

  public List<SymExpr> minElement() {
    List<SymExpr> res = new ArrayList<SymExpr>(ranges.size());
    for (Range r: ranges) {
      res.add(r.start);
    }
    return res;
  }

  /**
   * Shift each dimension by the start of matching dimension of other
   */
  public Subset offset(Subset by, boolean negative) {
    return offset(by.minElement(), negative);
  }

  public Subset offset(List<SymExpr> by, boolean negative) {
    if (by.size() != ranges.size()) {
      throw new SDFGRuntimeError("Cannot offset subset " + this + " of rank "
          + ranges.size() + " by " + by + " of rank " + by.size());
    }
    List<Range> res = new ArrayList<Range>(ranges.size());
    for (int i = 0; i < ranges.size(); i++) {
      res.add(ranges.get(i).offset(by.get(i), negative));
    }
    return new Subset(res);
  }

  /**
   * Insert unit dimensions.  Positions are sorted, then inserted in turn, so
   * each position refers to the subset with all earlier insertions applied.
   * @param positions
   * @return new subset with rank increased by number of positions
   */
  public Subset unsqueeze(List<Integer> positions) {
    List<Integer> sorted = new ArrayList<Integer>(positions);
    Collections.sort(sorted);
    List<Range> res = new ArrayList<Range>(ranges);
    for (int pos: sorted) {
      if (pos < 0 || pos > res.size()) {
        throw new SDFGRuntimeError("Cannot unsqueeze " + this + " at "
            + positions + ": position " + pos + " exceeds resulting rank");
      }
      res.add(pos, Range.index(SymExpr.ZERO));
    }
    return new Subset(res);
  }

  /**
   * Bounding box of both subsets
   * @return the union, or null if bounds can't be compared symbolically
   */
  public Subset union(Subset other) {
    if (other.dims() != dims()) {
      throw new SDFGRuntimeError("Union of subsets of different rank: "
                                + this + " and " + other);
    }
    List<Range> res = new ArrayList<Range>(ranges.size());
    for (int i = 0; i < ranges.size(); i++) {
      Range a = ranges.get(i), b = other.ranges.get(i);
      Long startDiff = a.start.constantDifference(b.start);
      Long endDiff = a.end.constantDifference(b.end);
      if (startDiff == null || endDiff == null) {
        return null;
      }
      SymExpr step = a.step.equals(b.step) ? a.step : SymExpr.ONE;
      res.add(new Range(startDiff <= 0 ? a.start : b.start,
                        endDiff >= 0 ? a.end : b.end, step));
    }
    return new Subset(res);
  }

  @Override
  public int hashCode() {
    return ranges.hashCode();
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj)
      return true;
    if (!(obj instanceof Subset))
      return false;
    return ranges.equals(((Subset)obj).ranges);
  }

  @Override
  public String toString() {
    return StringUtils.join(ranges, ", ");
  }
}
