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
package exm.sdfg.ir.opt;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;

import com.google.common.base.Function;
import com.google.common.base.Predicate;
import com.google.common.collect.Iterables;

import exm.sdfg.ir.tree.SDFG;
import exm.sdfg.ir.tree.SDFGState;

/**
 * Registered transformations, and enumeration of their candidate matches
 * across a whole nesting tree of SDFGs.
 */
public class TransformationRegistry {
  private final List<Transformation<?>> transformations =
                                  new ArrayList<Transformation<?>>();

  public static TransformationRegistry nestingTransformations() {
    TransformationRegistry reg = new TransformationRegistry();
    reg.register(new InlineNestedSDFG());
    reg.register(new NestSDFG());
    return reg;
  }

  public void register(Transformation<?> t) {
    transformations.add(t);
  }

  public List<Transformation<?>> transformations() {
    return Collections.unmodifiableList(transformations);
  }

  /**
   * Candidates for all registered transformations, in registration order
   */
  public Iterable<Candidate<?>> candidates(final SDFG root) {
    List<Iterable<? extends Candidate<?>>> all =
                  new ArrayList<Iterable<? extends Candidate<?>>>();
    for (Transformation<?> t: transformations) {
      all.add(candidates(root, t));
    }
    return Iterables.concat(all);
  }

  /**
   * Lazily enumerate feasible matches of a transformation in every state
   * of every SDFG nested under root, root included.  Each call to
   * iterator() starts a fresh scan of the current graph.
   */
  public static <R> Iterable<Candidate<R>> candidates(final SDFG root,
                                          final Transformation<R> t) {
    return new Iterable<Candidate<R>>() {
      @Override
      public Iterator<Candidate<R>> iterator() {
        Iterable<Match> matches = Iterables.concat(Iterables.transform(
            root.allSDFGsRecursive(), new Function<SDFG, Iterable<Match>>() {
              @Override
              public Iterable<Match> apply(SDFG sdfg) {
                return matches(sdfg, t);
              }
            }));
        Iterable<Match> feasible = Iterables.filter(matches,
            new Predicate<Match>() {
              @Override
              public boolean apply(Match m) {
                return t.feasible(m.sdfg, m);
              }
            });
        return Iterables.transform(feasible,
            new Function<Match, Candidate<R>>() {
              @Override
              public Candidate<R> apply(Match m) {
                return new Candidate<R>(t, m);
              }
            }).iterator();
      }
    };
  }

  /**
   * All structural matches of a transformation's patterns in one SDFG
   */
  public static Iterable<Match> matches(SDFG sdfg, Transformation<?> t) {
    List<Iterable<Match>> res = new ArrayList<Iterable<Match>>();
    List<Pattern> patterns = t.patterns();
    for (int i = 0; i < patterns.size(); i++) {
      if (t.isStateflow()) {
        res.add(PatternMatcher.matchStateflow(sdfg, patterns.get(i), i));
      } else {
        for (SDFGState state: sdfg.states()) {
          res.add(PatternMatcher.matchState(sdfg, state, patterns.get(i), i));
        }
      }
    }
    return Iterables.concat(res);
  }
}
