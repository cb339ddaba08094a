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
package exm.sdfg.ir.tree;

import java.io.PrintStream;
import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import exm.sdfg.common.exceptions.SDFGRuntimeError;
import exm.sdfg.common.lang.ArrayDesc;
import exm.sdfg.common.lang.DataType;
import exm.sdfg.ir.SDFGUtil;
import exm.sdfg.ir.tree.Nodes.MapScope;
import exm.sdfg.ir.tree.Nodes.Node;
import exm.sdfg.sourcemap.LineInfo;

/**
 * Stateful dataflow graph: a state machine whose states are dataflow
 * multigraphs, together with the table of data containers they access.
 *
 * An SDFG owned by a nested SDFG node records its owner as a
 * {@link ParentRef}, resolved by id through the root SDFG.
 */
public class SDFG {
  private String name;
  private final Map<String, ArrayDesc> arrays =
                            new LinkedHashMap<String, ArrayDesc>();
  private final Map<String, DataType> symbols =
                            new LinkedHashMap<String, DataType>();

  /** State arena, null for removed states */
  private final ArrayList<SDFGState> states = new ArrayList<SDFGState>();
  private final List<InterstateEdge> interstateEdges =
                            new ArrayList<InterstateEdge>();
  private SDFGState startState = null;

  private ParentRef parent = null;
  private int sdfgId = 0;

  /** Source-line record for the pass currently running, or null */
  private LineInfo lineInfo = null;

  public SDFG(String name) {
    this.name = name;
  }

  public String getName() {
    return name;
  }

  public void setName(String name) {
    this.name = name;
  }

  public int getSDFGId() {
    return sdfgId;
  }

  public ParentRef getParent() {
    return parent;
  }

  public void setParent(ParentRef parent) {
    this.parent = parent;
  }

  public boolean isNested() {
    return parent != null;
  }

  public LineInfo getLineInfo() {
    return lineInfo;
  }

  public void setLineInfo(LineInfo lineInfo) {
    this.lineInfo = lineInfo;
  }

  /*
   * State machine
   */

  public SDFGState addState(String label) {
    return addState(label, false);
  }

  public SDFGState addState(String label, boolean isStart) {
    SDFGState state = new SDFGState(this, states.size(), label);
    states.add(state);
    if (isStart || startState == null) {
      startState = state;
    }
    return state;
  }

  /**
   * Skip a state slot, as if a state had been added then removed
   */
  public void reserveStateSlot() {
    states.add(null);
  }

  public void removeState(SDFGState state) {
    checkContains(state);
    for (InterstateEdge e: new ArrayList<InterstateEdge>(interstateEdges)) {
      if (e.src == state || e.dst == state) {
        interstateEdges.remove(e);
      }
    }
    states.set(state.id, null);
    if (startState == state) {
      startState = null;
      for (SDFGState s: states) {
        if (s != null) {
          startState = s;
          break;
        }
      }
    }
  }

  private void checkContains(SDFGState state) {
    if (state.getSDFG() != this || getState(state.id) != state) {
      throw new SDFGRuntimeError("State " + state.getLabel() +
                                 " not in SDFG " + name);
    }
  }

  public List<SDFGState> states() {
    List<SDFGState> res = new ArrayList<SDFGState>();
    for (SDFGState s: states) {
      if (s != null) {
        res.add(s);
      }
    }
    return res;
  }

  public SDFGState getState(int stateId) {
    if (stateId < 0 || stateId >= states.size()) {
      return null;
    }
    return states.get(stateId);
  }

  public int numStates() {
    return states().size();
  }

  public SDFGState getStartState() {
    return startState;
  }

  public void setStartState(SDFGState state) {
    checkContains(state);
    this.startState = state;
  }

  public InterstateEdge addInterstateEdge(SDFGState src, SDFGState dst,
                  String condition, Map<String, String> assignments) {
    checkContains(src);
    checkContains(dst);
    InterstateEdge e = new InterstateEdge(src, dst, condition, assignments);
    interstateEdges.add(e);
    return e;
  }

  public InterstateEdge addInterstateEdge(SDFGState src, SDFGState dst) {
    return addInterstateEdge(src, dst, null, null);
  }

  public void removeInterstateEdge(InterstateEdge e) {
    interstateEdges.remove(e);
  }

  public List<InterstateEdge> interstateEdges() {
    return Collections.unmodifiableList(interstateEdges);
  }

  public List<InterstateEdge> inEdges(SDFGState state) {
    List<InterstateEdge> res = new ArrayList<InterstateEdge>();
    for (InterstateEdge e: interstateEdges) {
      if (e.dst == state) {
        res.add(e);
      }
    }
    return res;
  }

  public List<InterstateEdge> outEdges(SDFGState state) {
    List<InterstateEdge> res = new ArrayList<InterstateEdge>();
    for (InterstateEdge e: interstateEdges) {
      if (e.src == state) {
        res.add(e);
      }
    }
    return res;
  }

  /*
   * Array table
   */

  public Map<String, ArrayDesc> arrays() {
    return Collections.unmodifiableMap(arrays);
  }

  public ArrayDesc getArray(String name) {
    return arrays.get(name);
  }

  public boolean containsArray(String name) {
    return arrays.containsKey(name);
  }

  public String addArray(String name, DataType dtype, String ... shape) {
    return addDatadesc(name, ArrayDesc.array(name, dtype, false, shape),
                       false);
  }

  public String addTransient(String name, DataType dtype, String ... shape) {
    return addDatadesc(name, ArrayDesc.array(name, dtype, true, shape),
                       false);
  }

  public String addScalar(String name, DataType dtype, boolean transient_) {
    return addDatadesc(name, ArrayDesc.scalar(name, dtype, transient_),
                       false);
  }

  /**
   * Add a data descriptor to the table
   * @param findNewName if true, pick a fresh name on collision, otherwise
   *        a collision is an error
   * @return name actually used
   */
  public String addDatadesc(String name, ArrayDesc desc, boolean findNewName) {
    if (isNameTaken(name)) {
      if (!findNewName) {
        throw new SDFGRuntimeError("Data " + name + " already exists in SDFG "
                                  + this.name);
      }
      name = findNewName(name);
    }
    desc.setName(name);
    arrays.put(name, desc);
    return name;
  }

  public ArrayDesc removeData(String name) {
    ArrayDesc desc = arrays.remove(name);
    if (desc == null) {
      throw new SDFGRuntimeError("No data " + name + " in SDFG " + this.name);
    }
    return desc;
  }

  /**
   * @return name, or name with the first free numeric suffix _0, _1, ...
   */
  public String findNewName(String name) {
    if (!isNameTaken(name)) {
      return name;
    }
    int i = 0;
    while (isNameTaken(name + "_" + i)) {
      i++;
    }
    return name + "_" + i;
  }

  private boolean isNameTaken(String name) {
    return arrays.containsKey(name) || symbols.containsKey(name);
  }

  public Map<String, DataType> symbols() {
    return Collections.unmodifiableMap(symbols);
  }

  public void addSymbol(String name, DataType type) {
    if (isNameTaken(name)) {
      throw new SDFGRuntimeError("Symbol " + name + " clashes with existing "
                                 + "name in SDFG " + this.name);
    }
    symbols.put(name, type);
  }

  /*
   * Nesting
   */

  /**
   * @return this SDFG followed by all nested SDFGs, pre-order
   */
  public List<SDFG> allSDFGsRecursive() {
    List<SDFG> res = new ArrayList<SDFG>();
    res.add(this);
    for (SDFGState state: states()) {
      for (Node n: state.nodes()) {
        if (n.kind == NodeKind.NESTED_SDFG) {
          res.addAll(n.nestedSDFG().getSDFG().allSDFGsRecursive());
        }
      }
    }
    return res;
  }

  /**
   * Number SDFGs of the nesting tree in pre-order starting from this one
   * at 0, and update parent references to match.
   */
  public void resetSDFGIds() {
    List<SDFG> all = allSDFGsRecursive();
    for (int i = 0; i < all.size(); i++) {
      all.get(i).sdfgId = i;
    }
    for (SDFG s: all) {
      for (SDFGState state: s.states()) {
        for (Node n: state.nodes()) {
          if (n.kind == NodeKind.NESTED_SDFG) {
            n.nestedSDFG().getSDFG().setParent(
                    new ParentRef(s.sdfgId, state.id, n.getId()));
          }
        }
      }
    }
  }

  /**
   * Look up an SDFG by id in the nesting tree rooted here
   */
  public SDFG sdfgById(int id) {
    for (SDFG s: allSDFGsRecursive()) {
      if (s.sdfgId == id) {
        return s;
      }
    }
    return null;
  }

  /**
   * Copy with fresh nodes, edges and descriptors.  Node and state ids are
   * preserved, including freed slots.
   */
  public SDFG deepCopy() {
    SDFG copy = new SDFG(name);
    copy.sdfgId = sdfgId;
    copy.parent = parent;
    copy.lineInfo = lineInfo;
    for (Map.Entry<String, ArrayDesc> e: arrays.entrySet()) {
      copy.arrays.put(e.getKey(), e.getValue().copy());
    }
    copy.symbols.putAll(symbols);

    Map<MapScope, MapScope> scopes =
                    new IdentityHashMap<MapScope, MapScope>();
    for (SDFGState s: states) {
      if (s == null) {
        copy.states.add(null);
        continue;
      }
      SDFGState sc = new SDFGState(copy, s.id, s.getLabel());
      copy.states.add(sc);
      s.copyInto(sc, scopes);
    }
    for (InterstateEdge e: interstateEdges) {
      copy.interstateEdges.add(new InterstateEdge(
          copy.states.get(e.src.id), copy.states.get(e.dst.id),
          e.getCondition(), e.getAssignments()));
    }
    if (startState != null) {
      copy.startState = copy.states.get(startState.id);
    }
    return copy;
  }

  public void prettyPrint(StringBuilder sb, String indent) {
    sb.append(indent).append("sdfg ").append(sdfgId).append(" ")
      .append(name);
    if (parent != null) {
      sb.append(" (parent: ").append(parent).append(")");
    }
    sb.append(" {\n");
    String inner = indent + SDFGUtil.indent;
    for (ArrayDesc desc: arrays.values()) {
      sb.append(inner).append(desc).append("\n");
    }
    for (SDFGState s: states()) {
      s.prettyPrint(sb, inner);
    }
    for (InterstateEdge e: interstateEdges) {
      sb.append(inner).append(e).append("\n");
    }
    sb.append(indent).append("}\n");
  }

  public void log(PrintStream sdfgOutput, String title) {
    StringBuilder sb = new StringBuilder();
    prettyPrint(sb, "");
    sdfgOutput.append("\n\n" + title + ": \n" +
        "============================================\n");
    sdfgOutput.append(sb.toString());
    sdfgOutput.flush();
  }

  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder();
    prettyPrint(sb, "");
    return sb.toString();
  }
}
