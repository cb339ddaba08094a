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
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Map.Entry;
import java.util.Set;

import org.apache.log4j.Logger;

import exm.sdfg.common.Settings;
import exm.sdfg.common.exceptions.InvalidOptionException;
import exm.sdfg.common.exceptions.PatternMismatchException;
import exm.sdfg.common.exceptions.SDFGRuntimeError;
import exm.sdfg.common.lang.ArrayDesc;
import exm.sdfg.common.lang.Memlet;
import exm.sdfg.ir.tree.Edge;
import exm.sdfg.ir.tree.NodeKind;
import exm.sdfg.ir.tree.Nodes.AccessNode;
import exm.sdfg.ir.tree.Nodes.MapEntry;
import exm.sdfg.ir.tree.Nodes.NestedSDFGNode;
import exm.sdfg.ir.tree.Nodes.Node;
import exm.sdfg.ir.tree.SDFG;
import exm.sdfg.ir.tree.SDFGState;
import exm.sdfg.sourcemap.LineInfo;

/**
 * Wrap a whole SDFG into a nested SDFG node inside a single new state.
 *
 * Non-transient arrays read anywhere become inputs of the nested node and
 * are renamed with an "_in" suffix inside it; arrays written become
 * outputs with an "_out" suffix.  The outer SDFG keeps one descriptor per
 * array under the original name.
 */
public class NestSDFG implements Transformation<NestedSDFGNode> {
  public static final String IN_SUFFIX = "_in";
  public static final String OUT_SUFFIX = "_out";

  private final Boolean promoteGlobalTransients;

  /**
   * Promotion policy taken from settings
   */
  public NestSDFG() {
    this.promoteGlobalTransients = null;
  }

  /**
   * @param promoteGlobalTransients if true, transients outside any map
   *      become outputs, so they are allocated once by the outer SDFG
   */
  public NestSDFG(boolean promoteGlobalTransients) {
    this.promoteGlobalTransients = promoteGlobalTransients;
  }

  @Override
  public String getName() {
    return "NestSDFG";
  }

  @Override
  public String getConfigEnabledKey() {
    return Settings.OPT_NEST_SDFG;
  }

  @Override
  public boolean isStateflow() {
    return true;
  }

  @Override
  public List<Pattern> patterns() {
    return Collections.singletonList(Pattern.empty());
  }

  /**
   * Only a top-level SDFG can be nested, and not one that is already
   * nothing but a wrapper around one nested SDFG
   */
  @Override
  public boolean feasible(SDFG sdfg, Match match) {
    if (match.sdfg != sdfg || match.stateId != -1 || sdfg.isNested()) {
      return false;
    }
    return !isWrapper(sdfg);
  }

  private static boolean isWrapper(SDFG sdfg) {
    if (sdfg.numStates() != 1) {
      return false;
    }
    int nested = 0;
    for (Node n: sdfg.states().get(0).nodes()) {
      if (n.kind == NodeKind.NESTED_SDFG) {
        nested++;
      } else if (n.kind != NodeKind.ACCESS) {
        return false;
      }
    }
    return nested == 1;
  }

  private boolean promote() {
    if (promoteGlobalTransients != null) {
      return promoteGlobalTransients;
    }
    try {
      return Settings.getBoolean(Settings.OPT_PROMOTE_GLOBAL_TRANSIENTS);
    } catch (InvalidOptionException e) {
      throw new SDFGRuntimeError("Expected config key " +
          Settings.OPT_PROMOTE_GLOBAL_TRANSIENTS + " to exist");
    }
  }

  /**
   * @return the new nested SDFG node
   */
  @Override
  public NestedSDFGNode apply(Logger logger, SDFG sdfg, Match match)
      throws PatternMismatchException {
    if (!feasible(sdfg, match)) {
      throw new PatternMismatchException(getName(), match.toString());
    }
    boolean promote = promote();
    SDFG nested = sdfg.deepCopy();
    nested.setLineInfo(null);

    // Original name to name inside nested SDFG
    Map<String, String> inputs = new LinkedHashMap<String, String>();
    Map<String, String> outputs = new LinkedHashMap<String, String>();
    Map<String, String> transients = new LinkedHashMap<String, String>();

    for (SDFGState state: nested.states()) {
      for (AccessNode a: state.accessNodes()) {
        String arrName = a.getData();
        if (nested.getArray(arrName).isTransient()) {
          continue;
        }
        String newName = null;
        if (state.outDegree(a) > 0) {
          inputs.put(arrName, arrName + IN_SUFFIX);
          newName = arrName + IN_SUFFIX;
        }
        if (state.inDegree(a) > 0) {
          outputs.put(arrName, arrName + OUT_SUFFIX);
          newName = arrName + OUT_SUFFIX;
        }
        if (newName != null) {
          a.setData(newName);
        }
      }
    }

    // Isolated access nodes of boundary arrays
    for (SDFGState state: nested.states()) {
      for (AccessNode a: state.accessNodes()) {
        String arrName = a.getData();
        if (outputs.containsKey(arrName)) {
          a.setData(outputs.get(arrName));
        } else if (inputs.containsKey(arrName)) {
          a.setData(inputs.get(arrName));
        }
      }
    }

    if (promote) {
      for (String arrName: globalTransients(nested)) {
        transients.put(arrName, arrName + OUT_SUFFIX);
      }
      for (SDFGState state: nested.states()) {
        for (AccessNode a: state.accessNodes()) {
          String repl = transients.get(a.getData());
          if (repl != null) {
            a.setData(repl);
          }
        }
      }
    }

    // Outer SDFG keeps one descriptor per boundary array
    Map<String, ArrayDesc> outerArrays = new LinkedHashMap<String, ArrayDesc>();
    for (String arrName: inputs.keySet()) {
      outerArrays.put(arrName, nested.getArray(arrName).copy());
    }
    for (String arrName: outputs.keySet()) {
      if (!outerArrays.containsKey(arrName)) {
        outerArrays.put(arrName, nested.getArray(arrName).copy());
      }
    }
    for (String arrName: transients.keySet()) {
      outerArrays.put(arrName, nested.getArray(arrName).copy());
    }

    // Rename arrays inside nested SDFG
    Set<String> renamed = new LinkedHashSet<String>();
    renamed.addAll(inputs.keySet());
    renamed.addAll(outputs.keySet());
    renamed.addAll(transients.keySet());
    Map<String, ArrayDesc> originals = new LinkedHashMap<String, ArrayDesc>();
    for (String arrName: renamed) {
      originals.put(arrName, nested.removeData(arrName));
    }
    for (Entry<String, String> e: inputs.entrySet()) {
      nested.addDatadesc(e.getValue(), originals.get(e.getKey()).copy(),
                         false);
    }
    for (Entry<String, String> e: outputs.entrySet()) {
      nested.addDatadesc(e.getValue(), originals.get(e.getKey()).copy(),
                         false);
    }
    for (Entry<String, String> e: transients.entrySet()) {
      ArrayDesc desc = originals.get(e.getKey()).copy();
      desc.setTransient(false);
      nested.addDatadesc(e.getValue(), desc, false);
    }
    outputs.putAll(transients);

    renameMemlets(nested, inputs, outputs);

    // Replace contents of outer SDFG
    for (SDFGState state: sdfg.states()) {
      sdfg.removeState(state);
    }
    for (String arrName: new ArrayList<String>(sdfg.arrays().keySet())) {
      sdfg.removeData(arrName);
    }
    for (Entry<String, ArrayDesc> e: outerArrays.entrySet()) {
      sdfg.addDatadesc(e.getKey(), e.getValue(), false);
    }

    SDFGState outerState = sdfg.addState(sdfg.getName(), true);
    NestedSDFGNode nestedNode = outerState.addNestedSDFG(nested,
        nested.getName(), inputs.values(), outputs.values());
    LineInfo lineInfo = sdfg.getLineInfo();
    if (lineInfo != null) {
      nestedNode.setDebugInfo(lineInfo.toDebugInfo());
    }

    for (Entry<String, String> e: inputs.entrySet()) {
      AccessNode read = outerState.addRead(e.getKey());
      outerState.addEdge(read, null, nestedNode, e.getValue(),
          Memlet.fromArray(e.getKey(), sdfg.getArray(e.getKey())));
    }
    for (Entry<String, String> e: outputs.entrySet()) {
      AccessNode write = outerState.addWrite(e.getKey());
      outerState.addEdge(nestedNode, e.getValue(), write, null,
          Memlet.fromArray(e.getKey(), sdfg.getArray(e.getKey())));
    }

    logger.debug("nested " + sdfg.getName() + " with inputs " +
        inputs.keySet() + " and outputs " + outputs.keySet());
    return nestedNode;
  }

  /**
   * Transients with an access node outside all map scopes
   */
  private static Set<String> globalTransients(SDFG nested) {
    Set<String> res = new LinkedHashSet<String>();
    for (SDFGState state: nested.states()) {
      Map<Node, MapEntry> scopes = state.scopeDict();
      for (AccessNode a: state.accessNodes()) {
        ArrayDesc desc = nested.getArray(a.getData());
        if (desc != null && desc.isTransient() && scopes.get(a) == null) {
          res.add(a.getData());
        }
      }
    }
    return res;
  }

  /**
   * Point memlets at the renamed arrays, choosing between the input and
   * output name by the access nodes at the ends of each memlet path
   */
  private static void renameMemlets(SDFG nested, Map<String, String> inputs,
                                    Map<String, String> outputs) {
    for (SDFGState state: nested.states()) {
      Map<Edge, String> newNames = new LinkedHashMap<Edge, String>();
      for (Edge e: state.edges()) {
        Memlet mem = e.getMemlet();
        if (mem.isEmpty()) {
          continue;
        }
        String data = mem.getData();
        String in = inputs.get(data);
        String out = outputs.get(data);
        if (in == null && out == null) {
          continue;
        }
        List<Edge> path = state.memletPath(e);
        Node src = path.get(0).src;
        Node dst = path.get(path.size() - 1).dst;
        String newName = null;
        if (src.kind == NodeKind.ACCESS) {
          String srcData = src.access().getData();
          if (srcData.equals(in)) {
            newName = in;
          } else if (srcData.equals(out)) {
            newName = out;
          }
        }
        if (newName == null && dst.kind == NodeKind.ACCESS &&
            dst.access().getData().equals(out)) {
          newName = out;
        }
        if (newName == null) {
          newName = out != null ? out : in;
        }
        newNames.put(e, newName);
      }
      for (Entry<Edge, String> e: newNames.entrySet()) {
        e.getKey().getMemlet().setData(e.getValue());
      }
    }
  }
}
