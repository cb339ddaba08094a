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
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Map.Entry;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;

import org.apache.commons.lang3.StringUtils;

import exm.sdfg.common.exceptions.SDFGRuntimeError;

/**
 * Immutable symbolic integer expression: a polynomial over named symbols
 * with integer coefficients, e.g. "2*N*M - i + 1".
 *
 * Each term is keyed by its monomial: the sorted symbol names joined by '*',
 * with the empty string for the constant term.  Terms with zero coefficient
 * are never stored, so structural equality is semantic equality.
 */
public class SymExpr {

  private static final String MUL = "*";

  public static final SymExpr ZERO = new SymExpr(newTerms());
  public static final SymExpr ONE = of(1);

  private final TreeMap<String, Long> terms;

  private SymExpr(TreeMap<String, Long> terms) {
    this.terms = terms;
  }

  /**
   * Higher degree first, then lexicographic, constant term last
   */
  private static Comparator<String> monomialOrder() {
    return new Comparator<String>() {
      @Override
      public int compare(String a, String b) {
        int da = degree(a), db = degree(b);
        if (da != db) {
          return db - da;
        }
        return a.compareTo(b);
      }
    };
  }

  private static int degree(String monomial) {
    if (monomial.isEmpty()) {
      return 0;
    }
    return StringUtils.countMatches(monomial, MUL) + 1;
  }

  private static TreeMap<String, Long> newTerms() {
    return new TreeMap<String, Long>(monomialOrder());
  }

  public static SymExpr of(long value) {
    TreeMap<String, Long> t = newTerms();
    if (value != 0) {
      t.put("", value);
    }
    return new SymExpr(t);
  }

  public static SymExpr symbol(String name) {
    assert(name != null && name.length() > 0);
    TreeMap<String, Long> t = newTerms();
    t.put(name, 1L);
    return new SymExpr(t);
  }

  public static SymExpr parse(String text) {
    return new SymParser(text).parse();
  }

  public static List<SymExpr> ofAll(long ... values) {
    List<SymExpr> res = new ArrayList<SymExpr>(values.length);
    for (long v: values) {
      res.add(of(v));
    }
    return res;
  }

  public boolean isConstant() {
    return terms.isEmpty() || (terms.size() == 1 && terms.containsKey(""));
  }

  public long constantValue() {
    if (!isConstant()) {
      throw new SDFGRuntimeError("Expression " + this + " is not constant");
    }
    Long c = terms.get("");
    return c == null ? 0 : c;
  }

  public boolean isConstant(long value) {
    return isConstant() && constantValue() == value;
  }

  public SymExpr plus(SymExpr other) {
    TreeMap<String, Long> t = newTerms();
    t.putAll(this.terms);
    for (Entry<String, Long> e: other.terms.entrySet()) {
      addTerm(t, e.getKey(), e.getValue());
    }
    return new SymExpr(t);
  }

  public SymExpr plus(long c) {
    return plus(of(c));
  }

  public SymExpr minus(SymExpr other) {
    return plus(other.negate());
  }

  public SymExpr minus(long c) {
    return plus(-c);
  }

  public SymExpr negate() {
    TreeMap<String, Long> t = newTerms();
    for (Entry<String, Long> e: terms.entrySet()) {
      t.put(e.getKey(), -e.getValue());
    }
    return new SymExpr(t);
  }

  public SymExpr times(SymExpr other) {
    TreeMap<String, Long> t = newTerms();
    for (Entry<String, Long> a: this.terms.entrySet()) {
      for (Entry<String, Long> b: other.terms.entrySet()) {
        addTerm(t, multiplyMonomials(a.getKey(), b.getKey()),
                a.getValue() * b.getValue());
      }
    }
    return new SymExpr(t);
  }

  public SymExpr times(long c) {
    return times(of(c));
  }

  /**
   * Divide by a constant.
   * @throws SDFGRuntimeError if some coefficient is not divisible
   */
  public SymExpr divideExact(long divisor) {
    if (divisor == 0) {
      throw new SDFGRuntimeError("Division of " + this + " by zero");
    }
    TreeMap<String, Long> t = newTerms();
    for (Entry<String, Long> e: terms.entrySet()) {
      if (e.getValue() % divisor != 0) {
        throw new SDFGRuntimeError("Cannot divide " + this + " exactly by "
                                    + divisor);
      }
      t.put(e.getKey(), e.getValue() / divisor);
    }
    return new SymExpr(t);
  }

  /**
   * @return this - other if the difference is a constant, otherwise null
   */
  public Long constantDifference(SymExpr other) {
    SymExpr diff = this.minus(other);
    if (diff.isConstant()) {
      return diff.constantValue();
    }
    return null;
  }

  public Set<String> freeSymbols() {
    Set<String> res = new TreeSet<String>();
    for (String monomial: terms.keySet()) {
      if (!monomial.isEmpty()) {
        res.addAll(Arrays.asList(monomial.split("\\" + MUL)));
      }
    }
    return res;
  }

  /**
   * Substitute a symbol by an expression
   */
  public SymExpr substitute(String symbol, SymExpr value) {
    SymExpr result = ZERO;
    for (Entry<String, Long> e: terms.entrySet()) {
      SymExpr term = of(e.getValue());
      if (!e.getKey().isEmpty()) {
        for (String s: e.getKey().split("\\" + MUL)) {
          term = term.times(s.equals(symbol) ? value : symbol(s));
        }
      }
      result = result.plus(term);
    }
    return result;
  }

  /**
   * Evaluate with concrete values for all symbols
   */
  public long evaluate(Map<String, Long> values) {
    long result = 0;
    for (Entry<String, Long> e: terms.entrySet()) {
      long term = e.getValue();
      if (!e.getKey().isEmpty()) {
        for (String s: e.getKey().split("\\" + MUL)) {
          Long v = values.get(s);
          if (v == null) {
            throw new SDFGRuntimeError("No value for symbol " + s +
                                       " in " + this);
          }
          term *= v;
        }
      }
      result += term;
    }
    return result;
  }

  private static void addTerm(Map<String, Long> t, String monomial,
                              long coeff) {
    Long prev = t.get(monomial);
    long sum = (prev == null ? 0 : prev) + coeff;
    if (sum == 0) {
      t.remove(monomial);
    } else {
      t.put(monomial, sum);
    }
  }

  private static String multiplyMonomials(String a, String b) {
    if (a.isEmpty()) {
      return b;
    } else if (b.isEmpty()) {
      return a;
    }
    List<String> syms = new ArrayList<String>();
    syms.addAll(Arrays.asList(a.split("\\" + MUL)));
    syms.addAll(Arrays.asList(b.split("\\" + MUL)));
    Collections.sort(syms);
    return StringUtils.join(syms, MUL);
  }

  @Override
  public int hashCode() {
    return terms.hashCode();
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj)
      return true;
    if (!(obj instanceof SymExpr))
      return false;
    return terms.equals(((SymExpr)obj).terms);
  }

  @Override
  public String toString() {
    if (terms.isEmpty()) {
      return "0";
    }
    StringBuilder sb = new StringBuilder();
    for (Entry<String, Long> e: terms.entrySet()) {
      long coeff = e.getValue();
      String monomial = e.getKey();
      if (sb.length() == 0) {
        if (coeff < 0) {
          sb.append("-");
        }
      } else {
        sb.append(coeff < 0 ? " - " : " + ");
      }
      long abs = Math.abs(coeff);
      if (monomial.isEmpty()) {
        sb.append(abs);
      } else {
        if (abs != 1) {
          sb.append(abs).append(MUL);
        }
        sb.append(monomial);
      }
    }
    return sb.toString();
  }
}
