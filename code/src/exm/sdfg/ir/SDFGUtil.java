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
package exm.sdfg.ir;

import java.util.Collection;
import java.util.Collections;
import java.util.Map;

import exm.sdfg.common.exceptions.InvariantViolation;
import exm.sdfg.common.lang.Memlet;
import exm.sdfg.common.util.Pair;
import exm.sdfg.ir.tree.Edge;
import exm.sdfg.ir.tree.NodeKind;
import exm.sdfg.ir.tree.Nodes.NestedSDFGNode;
import exm.sdfg.ir.tree.Nodes.Node;
import exm.sdfg.ir.tree.ParentRef;
import exm.sdfg.ir.tree.SDFG;
import exm.sdfg.ir.tree.SDFGState;

/**
 * Miscellaneous helpers for working with the IR
 */
public class SDFGUtil {

  public static final String indent = "  ";

  /**
   * Rename data containers referenced by access nodes and memlets.
   * All renames are applied at once, so chains like A->B, B->C don't
   * compose.
   */
  public static void replaceData(Collection<? extends Node> nodes,
        Collection<Edge> edges, Map<String, String> renames) {
    for (Node n: nodes) {
      if (n.kind == NodeKind.ACCESS) {
        String repl = renames.get(n.access().getData());
        if (repl != null) {
          n.access().setData(repl);
        }
      }
    }
    for (Edge e: edges) {
      Memlet m = e.getMemlet();
      if (!m.isEmpty()) {
        String repl = renames.get(m.getData());
        if (repl != null) {
          m.setData(repl);
        }
      }
    }
  }

  public static void replaceData(Collection<? extends Node> nodes,
        Collection<Edge> edges, String oldName, String newName) {
    replaceData(nodes, edges, Collections.singletonMap(oldName, newName));
  }

  /**
   * Resolve parent reference of a nested SDFG
   * @param root root of the nesting tree, with up to date ids
   * @return owning state and node
   */
  public static Pair<SDFGState, NestedSDFGNode> resolveParent(SDFG root,
                                                              SDFG nested) {
    ParentRef ref = nested.getParent();
    if (ref == null) {
      return null;
    }
    SDFG parent = root.sdfgById(ref.sdfgId);
    SDFGState state = parent == null ? null : parent.getState(ref.stateId);
    Node node = state == null ? null : state.getNode(ref.nodeId);
    if (node == null || node.kind != NodeKind.NESTED_SDFG ||
        node.nestedSDFG().getSDFG() != nested) {
      throw new InvariantViolation("Stale parent reference " + ref +
                                   " of SDFG " + nested.getName());
    }
    return Pair.create(state, node.nestedSDFG());
  }
}
