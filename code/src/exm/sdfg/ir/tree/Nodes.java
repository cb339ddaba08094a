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

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

import org.apache.commons.lang3.StringUtils;

import exm.sdfg.common.exceptions.SDFGRuntimeError;
import exm.sdfg.common.lang.DebugInfo;
import exm.sdfg.common.lang.ScheduleType;
import exm.sdfg.common.lang.Subset;

/**
 * Definitions of the dataflow node kinds that live in an SDFG state.
 *
 * Node identity is the node's slot in the arena of its owning state:
 * {@link Node#getId()} is -1 until the node is added to a state, and is
 * reset to -1 when it is removed.
 */
public class Nodes {

  /** Prefix of scope connectors on the outside of a map */
  public static final String IN_PREFIX = "IN_";
  /** Prefix of scope connectors on the inside of a map */
  public static final String OUT_PREFIX = "OUT_";

  public static abstract class Node {
    public final NodeKind kind;
    protected String label;
    protected final Set<String> inConnectors = new LinkedHashSet<String>();
    protected final Set<String> outConnectors = new LinkedHashSet<String>();
    protected DebugInfo debugInfo = null;

    /** Slot in owning state, or -1 */
    int id = -1;

    protected Node(NodeKind kind, String label,
                   Collection<String> inConns, Collection<String> outConns) {
      this.kind = kind;
      this.label = label;
      this.inConnectors.addAll(inConns);
      this.outConnectors.addAll(outConns);
    }

    public int getId() {
      return id;
    }

    public String getLabel() {
      return label;
    }

    public void setLabel(String label) {
      this.label = label;
    }

    public Set<String> inConnectors() {
      return Collections.unmodifiableSet(inConnectors);
    }

    public Set<String> outConnectors() {
      return Collections.unmodifiableSet(outConnectors);
    }

    public boolean addInConnector(String conn) {
      return inConnectors.add(conn);
    }

    public boolean addOutConnector(String conn) {
      return outConnectors.add(conn);
    }

    public boolean removeInConnector(String conn) {
      return inConnectors.remove(conn);
    }

    public boolean removeOutConnector(String conn) {
      return outConnectors.remove(conn);
    }

    public DebugInfo getDebugInfo() {
      return debugInfo;
    }

    public void setDebugInfo(DebugInfo debugInfo) {
      this.debugInfo = debugInfo;
    }

    /**
     * @return copy of node not yet attached to any state.  Scope nodes
     *        keep sharing the original map, nested SDFG nodes get a deep
     *        copy of the child
     */
    public abstract Node copy();

    protected <T extends Node> T copyCommon(T copy) {
      copy.debugInfo = this.debugInfo;
      return copy;
    }

    public AccessNode access() {
      throw new SDFGRuntimeError("Not an access node: " + this);
    }

    public Tasklet tasklet() {
      throw new SDFGRuntimeError("Not a tasklet: " + this);
    }

    public MapEntry mapEntry() {
      throw new SDFGRuntimeError("Not a map entry: " + this);
    }

    public MapExit mapExit() {
      throw new SDFGRuntimeError("Not a map exit: " + this);
    }

    public NestedSDFGNode nestedSDFG() {
      throw new SDFGRuntimeError("Not a nested SDFG: " + this);
    }

    public LibraryNode library() {
      throw new SDFGRuntimeError("Not a library node: " + this);
    }

    @Override
    public String toString() {
      return kind.toString().toLowerCase() + " " + label + " (" + id + ")";
    }
  }

  public static class AccessNode extends Node {
    private String data;

    public AccessNode(String data) {
      super(NodeKind.ACCESS, data, Collections.<String>emptySet(),
            Collections.<String>emptySet());
      this.data = data;
    }

    public String getData() {
      return data;
    }

    public void setData(String data) {
      this.data = data;
      this.label = data;
    }

    @Override
    public AccessNode access() {
      return this;
    }

    @Override
    public AccessNode copy() {
      return copyCommon(new AccessNode(data));
    }
  }

  public static class Tasklet extends Node {
    private String code;

    public Tasklet(String label, Collection<String> inConns,
                   Collection<String> outConns, String code) {
      super(NodeKind.TASKLET, label, inConns, outConns);
      this.code = code;
    }

    public String getCode() {
      return code;
    }

    public void setCode(String code) {
      this.code = code;
    }

    @Override
    public Tasklet tasklet() {
      return this;
    }

    @Override
    public Tasklet copy() {
      return copyCommon(new Tasklet(label, inConnectors, outConnectors, code));
    }

    @Override
    public String toString() {
      return super.toString() + " {" + code + "}";
    }
  }

  /**
   * Parallel iteration space, shared by the entry and exit of a map scope.
   */
  public static class MapScope {
    private String label;
    private final List<String> params;
    private Subset range;
    private ScheduleType schedule;

    public MapScope(String label, List<String> params, Subset range,
                    ScheduleType schedule) {
      if (params.size() != range.dims()) {
        throw new SDFGRuntimeError("Map " + label + " has " + params.size()
            + " parameters but range " + range + " has rank " + range.dims());
      }
      this.label = label;
      this.params = Collections.unmodifiableList(
                                      new ArrayList<String>(params));
      this.range = range;
      this.schedule = schedule;
    }

    public MapScope copy() {
      return new MapScope(label, params, range, schedule);
    }

    public String getLabel() {
      return label;
    }

    public List<String> getParams() {
      return params;
    }

    public Subset getRange() {
      return range;
    }

    public void setRange(Subset range) {
      this.range = range;
    }

    public ScheduleType getSchedule() {
      return schedule;
    }

    public void setSchedule(ScheduleType schedule) {
      this.schedule = schedule;
    }

    @Override
    public String toString() {
      return label + "[" + StringUtils.join(params, ", ") + "=" + range + "]";
    }
  }

  public static class MapEntry extends Node {
    private MapScope map;

    public MapEntry(MapScope map) {
      super(NodeKind.MAP_ENTRY, map.getLabel(),
            Collections.<String>emptySet(), Collections.<String>emptySet());
      this.map = map;
    }

    public MapScope getMap() {
      return map;
    }

    public void setMap(MapScope map) {
      this.map = map;
    }

    @Override
    public MapEntry mapEntry() {
      return this;
    }

    @Override
    public MapEntry copy() {
      MapEntry copy = new MapEntry(map);
      copy.inConnectors.addAll(inConnectors);
      copy.outConnectors.addAll(outConnectors);
      return copyCommon(copy);
    }

    @Override
    public String toString() {
      return super.toString() + " " + map;
    }
  }

  public static class MapExit extends Node {
    private MapScope map;

    public MapExit(MapScope map) {
      super(NodeKind.MAP_EXIT, map.getLabel(),
            Collections.<String>emptySet(), Collections.<String>emptySet());
      this.map = map;
    }

    public MapScope getMap() {
      return map;
    }

    public void setMap(MapScope map) {
      this.map = map;
    }

    @Override
    public MapExit mapExit() {
      return this;
    }

    @Override
    public MapExit copy() {
      MapExit copy = new MapExit(map);
      copy.inConnectors.addAll(inConnectors);
      copy.outConnectors.addAll(outConnectors);
      return copyCommon(copy);
    }
  }

  /**
   * Node that exclusively owns a child SDFG.  Connector names are the
   * names of the child's non-transient arrays bound at the boundary.
   */
  public static class NestedSDFGNode extends Node {
    private final SDFG sdfg;

    public NestedSDFGNode(String label, SDFG sdfg, Collection<String> inputs,
                          Collection<String> outputs) {
      super(NodeKind.NESTED_SDFG, label, inputs, outputs);
      this.sdfg = sdfg;
    }

    public SDFG getSDFG() {
      return sdfg;
    }

    @Override
    public NestedSDFGNode nestedSDFG() {
      return this;
    }

    @Override
    public NestedSDFGNode copy() {
      return copyCommon(new NestedSDFGNode(label, sdfg.deepCopy(),
                                           inConnectors, outConnectors));
    }
  }

  public static class LibraryNode extends Node {
    /** Library routine name, e.g. "MatMul" */
    private final String routine;

    public LibraryNode(String label, String routine,
                       Collection<String> inConns, Collection<String> outConns) {
      super(NodeKind.LIBRARY, label, inConns, outConns);
      this.routine = routine;
    }

    public String getRoutine() {
      return routine;
    }

    @Override
    public LibraryNode library() {
      return this;
    }

    @Override
    public LibraryNode copy() {
      return copyCommon(new LibraryNode(label, routine, inConnectors,
                                        outConnectors));
    }
  }

  /**
   * Check if connector is a scope connector, i.e. starts with IN_ or OUT_
   */
  public static boolean isScopeConnector(String conn, boolean in) {
    return conn != null && conn.startsWith(in ? IN_PREFIX : OUT_PREFIX);
  }

  /**
   * Matching connector on other side of a scope node, e.g. IN_A <-> OUT_A
   */
  public static String pairedConnector(String conn) {
    if (conn.startsWith(IN_PREFIX)) {
      return OUT_PREFIX + conn.substring(IN_PREFIX.length());
    } else if (conn.startsWith(OUT_PREFIX)) {
      return IN_PREFIX + conn.substring(OUT_PREFIX.length());
    }
    throw new SDFGRuntimeError("Not a scope connector: " + conn);
  }
}
