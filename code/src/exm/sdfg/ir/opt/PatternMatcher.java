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
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;

import exm.sdfg.common.util.Pair;
import exm.sdfg.common.util.StackLite;
import exm.sdfg.ir.tree.InterstateEdge;
import exm.sdfg.ir.tree.NodeKind;
import exm.sdfg.ir.tree.Nodes.Node;
import exm.sdfg.ir.tree.SDFG;
import exm.sdfg.ir.tree.SDFGState;

/**
 * Backtracking search for subgraphs isomorphic to a pattern.
 * Matches are produced lazily, one search step per match requested.
 */
public class PatternMatcher {

  /**
   * Match a pattern against the dataflow graph of one state
   */
  public static Iterable<Match> matchState(final SDFG sdfg,
        final SDFGState state, final Pattern pattern, final int patternIndex) {
    return new Iterable<Match>() {
      @Override
      public Iterator<Match> iterator() {
        List<Integer> ids = new ArrayList<Integer>();
        List<NodeKind> kinds = new ArrayList<NodeKind>();
        for (Node n: state.nodes()) {
          ids.add(n.getId());
          kinds.add(n.kind);
        }
        return new MatchIterator(sdfg, state, pattern, patternIndex, ids,
                                 kinds);
      }
    };
  }

  /**
   * Match a pattern against the state machine of an SDFG
   */
  public static Iterable<Match> matchStateflow(final SDFG sdfg,
        final Pattern pattern, final int patternIndex) {
    return new Iterable<Match>() {
      @Override
      public Iterator<Match> iterator() {
        List<Integer> ids = new ArrayList<Integer>();
        List<NodeKind> kinds = new ArrayList<NodeKind>();
        for (SDFGState s: sdfg.states()) {
          ids.add(s.getId());
          kinds.add(null);
        }
        return new MatchIterator(sdfg, null, pattern, patternIndex, ids,
                                 kinds);
      }
    };
  }

  private static class MatchIterator implements Iterator<Match> {
    private final SDFG sdfg;
    /** null for state-flow search */
    private final SDFGState state;
    private final Pattern pattern;
    private final int patternIndex;
    private final List<Integer> candidates;
    private final List<NodeKind> kinds;

    /** Candidate positions bound to pattern nodes 0..size-1 */
    private final StackLite<Integer> bound = new StackLite<Integer>();
    private boolean started = false;
    private Match nextMatch = null;

    MatchIterator(SDFG sdfg, SDFGState state, Pattern pattern,
                  int patternIndex, List<Integer> candidates,
                  List<NodeKind> kinds) {
      this.sdfg = sdfg;
      this.state = state;
      this.pattern = pattern;
      this.patternIndex = patternIndex;
      this.candidates = candidates;
      this.kinds = kinds;
    }

    @Override
    public boolean hasNext() {
      if (nextMatch == null) {
        nextMatch = advance();
      }
      return nextMatch != null;
    }

    @Override
    public Match next() {
      if (!hasNext()) {
        throw new NoSuchElementException();
      }
      Match m = nextMatch;
      nextMatch = null;
      return m;
    }

    @Override
    public void remove() {
      throw new UnsupportedOperationException();
    }

    private Match advance() {
      if (pattern.size() == 0) {
        if (started) {
          return null;
        }
        started = true;
        return buildMatch();
      }

      int start;
      if (!started) {
        started = true;
        start = 0;
      } else if (bound.isEmpty()) {
        return null;
      } else {
        // Resume search after last match
        start = bound.pop() + 1;
      }

      while (true) {
        int level = bound.size();
        int found = -1;
        for (int c = start; c < candidates.size(); c++) {
          if (consistent(level, c)) {
            found = c;
            break;
          }
        }

        if (found >= 0) {
          bound.push(found);
          if (bound.size() == pattern.size()) {
            return buildMatch();
          }
          start = 0;
        } else if (bound.isEmpty()) {
          return null;
        } else {
          start = bound.pop() + 1;
        }
      }
    }

    private boolean consistent(int level, int cand) {
      PatternNode pn = pattern.nodes().get(level);
      if (!pn.matchesKind(kinds.get(cand))) {
        return false;
      }
      if (bound.contains(cand)) {
        return false;
      }
      for (Pair<PatternNode, PatternNode> e: pattern.edges()) {
        int a = e.val1.index, b = e.val2.index;
        if (a > level || b > level || (a != level && b != level)) {
          continue;
        }
        int srcPos = a == level ? cand : bound.get(a);
        int dstPos = b == level ? cand : bound.get(b);
        if (!adjacent(candidates.get(srcPos), candidates.get(dstPos))) {
          return false;
        }
      }
      return true;
    }

    private boolean adjacent(int srcId, int dstId) {
      if (state != null) {
        return !state.edgesBetween(state.getNode(srcId),
                                   state.getNode(dstId)).isEmpty();
      }
      for (InterstateEdge e: sdfg.interstateEdges()) {
        if (e.src.getId() == srcId && e.dst.getId() == dstId) {
          return true;
        }
      }
      return false;
    }

    private Match buildMatch() {
      int binding[] = new int[bound.size()];
      for (int i = 0; i < binding.length; i++) {
        binding[i] = candidates.get(bound.get(i));
      }
      return new Match(sdfg, state == null ? -1 : state.getId(),
                       patternIndex, binding);
    }
  }
}
