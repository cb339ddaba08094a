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

import java.util.IdentityHashMap;
import java.util.Map;

import org.apache.log4j.Logger;

import exm.sdfg.common.exceptions.InvariantViolation;
import exm.sdfg.common.lang.ArrayDesc;
import exm.sdfg.common.lang.Memlet;
import exm.sdfg.ir.tree.Edge;
import exm.sdfg.ir.tree.NodeKind;
import exm.sdfg.ir.tree.Nodes.MapExit;
import exm.sdfg.ir.tree.Nodes.MapScope;
import exm.sdfg.ir.tree.Nodes.NestedSDFGNode;
import exm.sdfg.ir.tree.Nodes.Node;
import exm.sdfg.ir.tree.ParentRef;
import exm.sdfg.ir.tree.SDFG;
import exm.sdfg.ir.tree.SDFGState;

/**
 * Perform some sanity checks on an SDFG and everything nested in it:
 * - Check states are acyclic and map scopes are matched
 * - Check every name used resolves to a data descriptor
 * - Check nested SDFG connectors and parent links
 */
public class Validate {
  private final boolean checkConnectors;

  private Validate(boolean checkConnectors) {
    this.checkConnectors = checkConnectors;
  }

  public static Validate standardValidator() {
    return new Validate(true);
  }

  /**
   * @return validator that allows tasklet inputs with no edge, for
   *         graphs still under construction
   */
  public static Validate structuralValidator() {
    return new Validate(false);
  }

  public String getName() {
    return "Validate";
  }

  /**
   * @throws InvariantViolation on the first problem found
   */
  public static void validate(Logger logger, SDFG sdfg) {
    standardValidator().check(logger, sdfg);
  }

  public void check(Logger logger, SDFG sdfg) {
    for (SDFG s: sdfg.allSDFGsRecursive()) {
      if (logger.isTraceEnabled()) {
        logger.trace("validating sdfg " + s.getSDFGId() + " " + s.getName());
      }
      checkSDFG(s);
    }
  }

  private void checkSDFG(SDFG sdfg) {
    if (sdfg.numStates() > 0 && sdfg.getStartState() == null) {
      throw new InvariantViolation("SDFG " + sdfg.getName()
                                  + " has states but no start state");
    }
    for (SDFGState state: sdfg.states()) {
      // Throws on cycle
      state.topologicalSort();
      checkScopes(state);
      for (Node n: state.nodes()) {
        checkNode(sdfg, state, n);
      }
      for (Edge e: state.edges()) {
        checkEdge(sdfg, state, e);
      }
    }
  }

  private static void checkScopes(SDFGState state) {
    Map<MapScope, Integer> entries = new IdentityHashMap<MapScope, Integer>();
    Map<MapScope, Integer> exits = new IdentityHashMap<MapScope, Integer>();
    for (Node n: state.nodes()) {
      if (n.kind == NodeKind.MAP_ENTRY) {
        increment(entries, n.mapEntry().getMap());
      } else if (n.kind == NodeKind.MAP_EXIT) {
        MapExit exit = n.mapExit();
        increment(exits, exit.getMap());
      }
    }
    for (Map.Entry<MapScope, Integer> e: entries.entrySet()) {
      Integer exitCount = exits.get(e.getKey());
      if (e.getValue() != 1 || exitCount == null || exitCount != 1) {
        throw new InvariantViolation("Map " + e.getKey() + " in state " +
            state.getLabel() + " must have exactly one entry and one exit");
      }
    }
    for (MapScope map: exits.keySet()) {
      if (!entries.containsKey(map)) {
        throw new InvariantViolation("Map exit " + map + " in state " +
            state.getLabel() + " has no entry");
      }
    }
  }

  private static void increment(Map<MapScope, Integer> counts, MapScope map) {
    Integer c = counts.get(map);
    counts.put(map, c == null ? 1 : c + 1);
  }

  private void checkNode(SDFG sdfg, SDFGState state, Node n) {
    switch (n.kind) {
      case ACCESS:
        if (!sdfg.containsArray(n.access().getData())) {
          throw new InvariantViolation("Access node " + n + " in state " +
              state.getLabel() + " refers to undefined data");
        }
        break;
      case TASKLET:
        if (checkConnectors) {
          for (String conn: n.inConnectors()) {
            int count = state.inEdgesByConnector(n, conn).size();
            if (count != 1) {
              throw new InvariantViolation("Tasklet connector " + conn +
                  " of " + n + " has " + count + " incoming edges");
            }
          }
        }
        break;
      case NESTED_SDFG:
        checkNested(sdfg, state, n.nestedSDFG());
        break;
      default:
        break;
    }
  }

  private static void checkNested(SDFG sdfg, SDFGState state,
                                  NestedSDFGNode n) {
    SDFG child = n.getSDFG();
    ParentRef expected = new ParentRef(sdfg.getSDFGId(), state.getId(),
                                       n.getId());
    if (!expected.equals(child.getParent())) {
      throw new InvariantViolation("Parent of nested SDFG " + child.getName()
          + " is " + child.getParent() + ", expected " + expected);
    }
    checkConnectorData(child, n, n.inConnectors());
    checkConnectorData(child, n, n.outConnectors());
  }

  private static void checkConnectorData(SDFG child, NestedSDFGNode n,
                                         Iterable<String> conns) {
    for (String conn: conns) {
      ArrayDesc desc = child.getArray(conn);
      if (desc == null || desc.isTransient()) {
        throw new InvariantViolation("Connector " + conn + " of " + n +
            " must name a non-transient array of " + child.getName());
      }
    }
  }

  private static void checkEdge(SDFG sdfg, SDFGState state, Edge e) {
    Memlet mem = e.getMemlet();
    if (mem.isEmpty()) {
      if (!e.src.kind.isScope() && !e.dst.kind.isScope()) {
        throw new InvariantViolation("Empty memlet on edge " + e + " in state "
            + state.getLabel() + " not touching a scope node");
      }
      return;
    }
    if (!sdfg.containsArray(mem.getData())) {
      throw new InvariantViolation("Memlet on edge " + e + " in state " +
          state.getLabel() + " refers to undefined data " + mem.getData());
    }
  }
}
