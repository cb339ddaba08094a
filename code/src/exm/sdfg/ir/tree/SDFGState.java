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

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.Map.Entry;

import exm.sdfg.common.exceptions.InvariantViolation;
import exm.sdfg.common.exceptions.SDFGRuntimeError;
import exm.sdfg.common.lang.Memlet;
import exm.sdfg.common.lang.Range;
import exm.sdfg.common.lang.ScheduleType;
import exm.sdfg.common.lang.Subset;
import exm.sdfg.common.lang.SymExpr;
import exm.sdfg.common.util.Pair;
import exm.sdfg.ir.SDFGUtil;
import exm.sdfg.ir.tree.Nodes.AccessNode;
import exm.sdfg.ir.tree.Nodes.MapEntry;
import exm.sdfg.ir.tree.Nodes.MapExit;
import exm.sdfg.ir.tree.Nodes.MapScope;
import exm.sdfg.ir.tree.Nodes.NestedSDFGNode;
import exm.sdfg.ir.tree.Nodes.Node;
import exm.sdfg.ir.tree.Nodes.Tasklet;

/**
 * A single dataflow multigraph inside an SDFG.
 *
 * Nodes live in an arena: a node's id is its slot, removed nodes leave a
 * null slot behind and slots are never reused, so ids of untouched nodes
 * stay stable across any mutation.
 */
public class SDFGState {
  private final SDFG sdfg;
  /** Slot in owning SDFG's state arena */
  final int id;
  private String label;

  private final ArrayList<Node> nodes = new ArrayList<Node>();
  private final ArrayList<Edge> edges = new ArrayList<Edge>();
  private final Map<Node, List<Edge>> inEdges =
                            new IdentityHashMap<Node, List<Edge>>();
  private final Map<Node, List<Edge>> outEdges =
                            new IdentityHashMap<Node, List<Edge>>();

  SDFGState(SDFG sdfg, int id, String label) {
    this.sdfg = sdfg;
    this.id = id;
    this.label = label;
  }

  public SDFG getSDFG() {
    return sdfg;
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

  /*
   * Nodes
   */

  public <T extends Node> T addNode(T node) {
    if (node.id != -1) {
      throw new SDFGRuntimeError("Node already in a state: " + node);
    }
    node.id = nodes.size();
    nodes.add(node);
    inEdges.put(node, new ArrayList<Edge>());
    outEdges.put(node, new ArrayList<Edge>());
    if (node.kind == NodeKind.NESTED_SDFG) {
      node.nestedSDFG().getSDFG().setParent(
              new ParentRef(sdfg.getSDFGId(), id, node.id));
    }
    return node;
  }

  /**
   * Keep slot numbering when rebuilding a state: null marks a removed slot
   */
  void addSlot(Node node) {
    if (node == null) {
      nodes.add(null);
    } else {
      addNode(node);
    }
  }

  /**
   * Skip a node slot, as if a node had been added then removed
   */
  public void reserveSlot() {
    addSlot(null);
  }

  /**
   * Remove node and all edges attached to it
   */
  public void removeNode(Node node) {
    checkContains(node);
    for (Edge e: allEdges(node)) {
      removeEdge(e);
    }
    nodes.set(node.id, null);
    inEdges.remove(node);
    outEdges.remove(node);
    node.id = -1;
  }

  public boolean contains(Node node) {
    return node.id >= 0 && node.id < nodes.size() && nodes.get(node.id) == node;
  }

  private void checkContains(Node node) {
    if (!contains(node)) {
      throw new SDFGRuntimeError("Node " + node + " not in state " + label);
    }
  }

  /**
   * @return node in slot, or null if slot was freed
   */
  public Node getNode(int nodeId) {
    if (nodeId < 0 || nodeId >= nodes.size()) {
      return null;
    }
    return nodes.get(nodeId);
  }

  /**
   * @return live nodes in id order
   */
  public List<Node> nodes() {
    List<Node> res = new ArrayList<Node>();
    for (Node n: nodes) {
      if (n != null) {
        res.add(n);
      }
    }
    return res;
  }

  public int numNodes() {
    return inEdges.size();
  }

  /**
   * @return number of slots, including freed ones
   */
  public int numSlots() {
    return nodes.size();
  }

  public List<AccessNode> accessNodes() {
    List<AccessNode> res = new ArrayList<AccessNode>();
    for (Node n: nodes()) {
      if (n.kind == NodeKind.ACCESS) {
        res.add(n.access());
      }
    }
    return res;
  }

  /*
   * Edges
   */

  public Edge addEdge(Node src, String srcConn, Node dst, String dstConn,
                      Memlet memlet) {
    checkContains(src);
    checkContains(dst);
    checkConnector(src, srcConn, false);
    checkConnector(dst, dstConn, true);

    if (dstConn != null && singleInput(dst, dstConn) &&
        !inEdgesByConnector(dst, dstConn).isEmpty()) {
      throw new InvariantViolation("Connector " + dstConn + " of " + dst
                              + " already has an incoming edge");
    }
    if (srcConn != null && src.kind == NodeKind.MAP_EXIT &&
        Nodes.isScopeConnector(srcConn, false) &&
        !outEdgesByConnector(src, srcConn).isEmpty()) {
      throw new InvariantViolation("Connector " + srcConn + " of " + src
                              + " already has an outgoing edge");
    }

    Edge e = new Edge(src, srcConn, dst, dstConn, memlet);
    edges.add(e);
    outEdges.get(src).add(e);
    inEdges.get(dst).add(e);
    return e;
  }

  public Edge addEdge(Edge template, Memlet memlet) {
    return addEdge(template.src, template.srcConn, template.dst,
                   template.dstConn, memlet);
  }

  /**
   * Scope nodes declare connectors on demand, other kinds must already
   * have the connector.
   */
  private static void checkConnector(Node n, String conn, boolean in) {
    if (conn == null) {
      return;
    }
    if (n.kind.isScope()) {
      if (in) {
        n.addInConnector(conn);
      } else {
        n.addOutConnector(conn);
      }
      return;
    }
    if (!(in ? n.inConnectors : n.outConnectors).contains(conn)) {
      throw new InvariantViolation("Undeclared " + (in ? "input" : "output")
                  + " connector " + conn + " on " + n);
    }
  }

  /**
   * @return true if the input connector accepts at most one edge
   */
  public static boolean singleInput(Node n, String conn) {
    switch (n.kind) {
      case TASKLET:
      case LIBRARY:
      case NESTED_SDFG:
        return true;
      case MAP_ENTRY:
        return Nodes.isScopeConnector(conn, true);
      case ACCESS:
      case MAP_EXIT:
        return false;
      default:
        throw new SDFGRuntimeError("Unknown node kind " + n.kind);
    }
  }

  public void removeEdge(Edge e) {
    if (!edges.remove(e)) {
      throw new SDFGRuntimeError("Edge " + e + " not in state " + label);
    }
    outEdges.get(e.src).remove(e);
    inEdges.get(e.dst).remove(e);
  }

  /**
   * Remove edge and any connectors left unused by its removal
   */
  public void removeEdgeAndConnectors(Edge e) {
    removeEdge(e);
    if (e.srcConn != null &&
        outEdgesByConnector(e.src, e.srcConn).isEmpty()) {
      e.src.removeOutConnector(e.srcConn);
    }
    if (e.dstConn != null &&
        inEdgesByConnector(e.dst, e.dstConn).isEmpty()) {
      e.dst.removeInConnector(e.dstConn);
    }
  }

  public boolean containsEdge(Edge e) {
    List<Edge> out = outEdges.get(e.src);
    return out != null && out.contains(e);
  }

  public List<Edge> edges() {
    return Collections.unmodifiableList(edges);
  }

  public List<Edge> inEdges(Node n) {
    checkContains(n);
    return new ArrayList<Edge>(inEdges.get(n));
  }

  public List<Edge> outEdges(Node n) {
    checkContains(n);
    return new ArrayList<Edge>(outEdges.get(n));
  }

  public List<Edge> allEdges(Node n) {
    List<Edge> res = inEdges(n);
    res.addAll(outEdges.get(n));
    return res;
  }

  public List<Edge> inEdgesByConnector(Node n, String conn) {
    List<Edge> res = new ArrayList<Edge>();
    for (Edge e: inEdges.get(n)) {
      if (conn.equals(e.dstConn)) {
        res.add(e);
      }
    }
    return res;
  }

  public List<Edge> outEdgesByConnector(Node n, String conn) {
    List<Edge> res = new ArrayList<Edge>();
    for (Edge e: outEdges.get(n)) {
      if (conn.equals(e.srcConn)) {
        res.add(e);
      }
    }
    return res;
  }

  public List<Edge> edgesBetween(Node src, Node dst) {
    List<Edge> res = new ArrayList<Edge>();
    for (Edge e: outEdges(src)) {
      if (e.dst == dst) {
        res.add(e);
      }
    }
    return res;
  }

  public int inDegree(Node n) {
    checkContains(n);
    return inEdges.get(n).size();
  }

  public int outDegree(Node n) {
    checkContains(n);
    return outEdges.get(n).size();
  }

  public int degree(Node n) {
    return inDegree(n) + outDegree(n);
  }

  public List<Node> sourceNodes() {
    List<Node> res = new ArrayList<Node>();
    for (Node n: nodes()) {
      if (inEdges.get(n).isEmpty()) {
        res.add(n);
      }
    }
    return res;
  }

  public List<Node> sinkNodes() {
    List<Node> res = new ArrayList<Node>();
    for (Node n: nodes()) {
      if (outEdges.get(n).isEmpty()) {
        res.add(n);
      }
    }
    return res;
  }

  /**
   * Kahn's algorithm, ties broken by node id
   * @throws InvariantViolation if the state has a cycle
   */
  public List<Node> topologicalSort() {
    Map<Node, Integer> remaining = new IdentityHashMap<Node, Integer>();
    Deque<Node> ready = new ArrayDeque<Node>();
    for (Node n: nodes()) {
      int deg = inEdges.get(n).size();
      remaining.put(n, deg);
      if (deg == 0) {
        ready.add(n);
      }
    }
    List<Node> order = new ArrayList<Node>(remaining.size());
    while (!ready.isEmpty()) {
      Node n = ready.removeFirst();
      order.add(n);
      for (Edge e: outEdges.get(n)) {
        int deg = remaining.get(e.dst) - 1;
        remaining.put(e.dst, deg);
        if (deg == 0) {
          ready.add(e.dst);
        }
      }
    }
    if (order.size() != remaining.size()) {
      throw new InvariantViolation("Cycle in dataflow state " + label);
    }
    return order;
  }

  /*
   * Memlet paths and trees
   */

  /**
   * Follow an edge through scope nodes in both directions, as long as the
   * path doesn't branch.
   * @return edges from data end to compute end, in dataflow order
   */
  public List<Edge> memletPath(Edge edge) {
    List<Edge> path = new ArrayList<Edge>();
    path.add(edge);

    Edge curr = edge;
    while (curr.src.kind.isScope() &&
           Nodes.isScopeConnector(curr.srcConn, false)) {
      List<Edge> prev = inEdgesByConnector(curr.src,
                              Nodes.pairedConnector(curr.srcConn));
      if (prev.size() != 1) {
        break;
      }
      curr = prev.get(0);
      path.add(0, curr);
    }

    curr = edge;
    while (curr.dst.kind.isScope() &&
           Nodes.isScopeConnector(curr.dstConn, true)) {
      List<Edge> next = outEdgesByConnector(curr.dst,
                              Nodes.pairedConnector(curr.dstConn));
      if (next.size() != 1) {
        break;
      }
      curr = next.get(0);
      path.add(curr);
    }
    return path;
  }

  /**
   * Build the memlet tree containing an edge.  Reads fan out forward
   * through map entries, writes fan in backward through map exits.
   * @return tree node for the given edge; use {@link MemletTree#root()}
   *         to get the whole tree
   */
  public MemletTree memletTree(Edge edge) {
    boolean forward;
    if (edge.src.kind == NodeKind.MAP_ENTRY &&
        Nodes.isScopeConnector(edge.srcConn, false)) {
      forward = true;
    } else if (edge.dst.kind == NodeKind.MAP_EXIT &&
        Nodes.isScopeConnector(edge.dstConn, true)) {
      forward = false;
    } else if (edge.src.kind == NodeKind.MAP_EXIT &&
        Nodes.isScopeConnector(edge.srcConn, false)) {
      forward = false;
    } else {
      forward = true;
    }

    Edge root = edge;
    while (true) {
      List<Edge> parents;
      if (forward && root.src.kind == NodeKind.MAP_ENTRY &&
          Nodes.isScopeConnector(root.srcConn, false)) {
        parents = inEdgesByConnector(root.src,
                          Nodes.pairedConnector(root.srcConn));
      } else if (!forward && root.dst.kind == NodeKind.MAP_EXIT &&
          Nodes.isScopeConnector(root.dstConn, true)) {
        parents = outEdgesByConnector(root.dst,
                          Nodes.pairedConnector(root.dstConn));
      } else {
        break;
      }
      if (parents.size() != 1) {
        break;
      }
      root = parents.get(0);
    }

    MemletTree tree = new MemletTree(root, null);
    MemletTree result = buildTree(tree, forward, edge);
    assert(result != null) : edge;
    return result;
  }

  private MemletTree buildTree(MemletTree node, boolean forward,
                               Edge target) {
    MemletTree found = node.edge == target ? node : null;
    Edge e = node.edge;
    List<Edge> children = Collections.emptyList();
    if (forward && e.dst.kind == NodeKind.MAP_ENTRY &&
        Nodes.isScopeConnector(e.dstConn, true)) {
      children = outEdgesByConnector(e.dst, Nodes.pairedConnector(e.dstConn));
    } else if (!forward && e.src.kind == NodeKind.MAP_EXIT &&
        Nodes.isScopeConnector(e.srcConn, false)) {
      children = inEdgesByConnector(e.src, Nodes.pairedConnector(e.srcConn));
    }
    for (Edge child: children) {
      MemletTree res = buildTree(node.addChild(child), forward, target);
      if (res != null) {
        found = res;
      }
    }
    return found;
  }

  /*
   * Scopes
   */

  /**
   * @return map from every node to the entry of its innermost enclosing
   *        map, or null at the top level.  A map's entry and exit belong
   *        to the scope that contains the map.
   */
  public Map<Node, MapEntry> scopeDict() {
    Map<Node, MapEntry> scope = new IdentityHashMap<Node, MapEntry>();
    for (Node n: topologicalSort()) {
      if (n.kind == NodeKind.MAP_EXIT) {
        MapEntry entry = entryNode(n.mapExit());
        scope.put(n, scope.get(entry));
        continue;
      }
      List<Edge> in = inEdges.get(n);
      if (in.isEmpty()) {
        scope.put(n, null);
        continue;
      }
      Node pred = in.get(0).src;
      if (pred.kind == NodeKind.MAP_ENTRY) {
        scope.put(n, pred.mapEntry());
      } else {
        scope.put(n, scope.get(pred));
      }
    }
    return scope;
  }

  /**
   * @return innermost enclosing map entry of node, or null
   */
  public MapEntry scopeOf(Node n) {
    checkContains(n);
    return scopeDict().get(n);
  }

  /**
   * @return all nodes strictly inside the map, i.e. with the entry as an
   *          enclosing scope at some level
   */
  public List<Node> scopeSubgraph(MapEntry entry) {
    Map<Node, MapEntry> scope = scopeDict();
    List<Node> res = new ArrayList<Node>();
    for (Node n: nodes()) {
      MapEntry s = scope.get(n);
      while (s != null && s != entry) {
        s = scope.get(s);
      }
      if (s == entry) {
        res.add(n);
      }
    }
    return res;
  }

  public MapEntry entryNode(MapExit exit) {
    for (Node n: nodes) {
      if (n != null && n.kind == NodeKind.MAP_ENTRY &&
          n.mapEntry().getMap() == exit.getMap()) {
        return n.mapEntry();
      }
    }
    throw new InvariantViolation("No entry for map exit " + exit);
  }

  public MapExit exitNode(MapEntry entry) {
    for (Node n: nodes) {
      if (n != null && n.kind == NodeKind.MAP_EXIT &&
          n.mapExit().getMap() == entry.getMap()) {
        return n.mapExit();
      }
    }
    throw new InvariantViolation("No exit for map entry " + entry);
  }

  /*
   * Builders
   */

  public AccessNode addAccess(String data) {
    return addNode(new AccessNode(data));
  }

  public AccessNode addRead(String data) {
    return addAccess(data);
  }

  public AccessNode addWrite(String data) {
    return addAccess(data);
  }

  public Tasklet addTasklet(String label, Collection<String> inputs,
                            Collection<String> outputs, String code) {
    return addNode(new Tasklet(label, inputs, outputs, code));
  }

  public Pair<MapEntry, MapExit> addMap(String label, List<String> params,
                                        Subset range, ScheduleType schedule) {
    MapScope map = new MapScope(label, params, range, schedule);
    MapEntry entry = addNode(new MapEntry(map));
    MapExit exit = addNode(new MapExit(map));
    return Pair.create(entry, exit);
  }

  public NestedSDFGNode addNestedSDFG(SDFG child, String label,
                    Collection<String> inputs, Collection<String> outputs) {
    return addNode(new NestedSDFGNode(label, child, inputs, outputs));
  }

  /**
   * Add a chain of edges through scope nodes, creating scope connectors
   * named after the memlet's data.  Every edge gets a copy of the memlet.
   * @param srcConn connector on first node of path
   * @param dstConn connector on last node of path
   * @return edges added, in order
   */
  public List<Edge> addMemletPath(Memlet memlet, String srcConn,
                                  String dstConn, Node ... path) {
    assert(path.length >= 2);
    List<Edge> res = new ArrayList<Edge>();
    String outConn = srcConn;
    for (int i = 0; i < path.length - 1; i++) {
      Node dst = path[i + 1];
      String inConn;
      if (i + 1 == path.length - 1) {
        inConn = dstConn;
      } else if (memlet.isEmpty()) {
        inConn = null;
      } else {
        inConn = Nodes.IN_PREFIX + memlet.getData();
      }
      res.add(addEdge(path[i], outConn, dst, inConn, memlet.copy()));
      if (i + 1 < path.length - 1) {
        outConn = inConn == null ? null : Nodes.pairedConnector(inConn);
      }
    }
    return res;
  }

  /**
   * Add a tasklet inside a fresh map, with access nodes outside the map
   * for every input and output.  Outer memlets cover the inner memlets
   * over the whole map range.
   * @param inputs tasklet connector to memlet inside the map
   * @param outputs tasklet connector to memlet inside the map
   */
  public Tasklet addMappedTasklet(String name, List<String> params,
        Subset range, Map<String, Memlet> inputs, String code,
        Map<String, Memlet> outputs, ScheduleType schedule) {
    Pair<MapEntry, MapExit> map = addMap(name + "_map", params, range,
                                         schedule);
    Tasklet t = addTasklet(name, inputs.keySet(), outputs.keySet(), code);
    Map<String, AccessNode> reads = new HashMap<String, AccessNode>();
    Map<String, AccessNode> writes = new HashMap<String, AccessNode>();

    for (Entry<String, Memlet> in: inputs.entrySet()) {
      Memlet inner = in.getValue();
      AccessNode a = reads.get(inner.getData());
      if (a == null) {
        a = addRead(inner.getData());
        reads.put(inner.getData(), a);
      }
      String conn = Nodes.IN_PREFIX + inner.getData();
      if (!map.val1.inConnectors().contains(conn)) {
        addEdge(a, null, map.val1, conn, propagate(inner, params, range));
      }
      addEdge(map.val1, Nodes.pairedConnector(conn), t, in.getKey(), inner);
    }
    if (inputs.isEmpty()) {
      addEdge(map.val1, null, t, null, Memlet.empty());
    }

    for (Entry<String, Memlet> out: outputs.entrySet()) {
      Memlet inner = out.getValue();
      String conn = Nodes.IN_PREFIX + inner.getData();
      addEdge(t, out.getKey(), map.val2, conn, inner);
      if (!writes.containsKey(inner.getData())) {
        AccessNode a = addWrite(inner.getData());
        writes.put(inner.getData(), a);
        addEdge(map.val2, Nodes.pairedConnector(conn), a, null,
                propagate(inner, params, range));
      }
    }
    if (outputs.isEmpty()) {
      addEdge(t, null, map.val2, null, Memlet.empty());
    }
    return t;
  }

  /**
   * Widen an inner memlet over a map range, assuming subscripts increase
   * with each parameter
   */
  private static Memlet propagate(Memlet inner, List<String> params,
                                  Subset range) {
    List<Range> res = new ArrayList<Range>();
    for (Range r: inner.getSubset().ranges()) {
      SymExpr start = r.start, end = r.end;
      for (int i = 0; i < params.size(); i++) {
        start = start.substitute(params.get(i), range.get(i).start);
        end = end.substitute(params.get(i), range.get(i).end);
      }
      res.add(new Range(start, end, r.step));
    }
    Subset outer = new Subset(res);
    return new Memlet(inner.getData(), outer, null,
                      inner.getVolume().times(range.numElements()),
                      inner.getWcr(), inner.isDynamic());
  }

  /**
   * Copy all live nodes into slots with identical ids, remapping shared
   * map scopes through the given map
   */
  void copyInto(SDFGState copy, Map<MapScope, MapScope> scopes) {
    Map<Node, Node> nodeMap = new IdentityHashMap<Node, Node>();
    for (Node n: nodes) {
      if (n == null) {
        copy.addSlot(null);
        continue;
      }
      Node c = n.copy();
      if (c.kind == NodeKind.MAP_ENTRY) {
        c.mapEntry().setMap(remapScope(n.mapEntry().getMap(), scopes));
      } else if (c.kind == NodeKind.MAP_EXIT) {
        c.mapExit().setMap(remapScope(n.mapExit().getMap(), scopes));
      }
      copy.addSlot(c);
      nodeMap.put(n, c);
    }
    for (Edge e: edges) {
      copy.addEdge(nodeMap.get(e.src), e.srcConn, nodeMap.get(e.dst),
                   e.dstConn, e.getMemlet().copy());
    }
  }

  private static MapScope remapScope(MapScope orig,
                                     Map<MapScope, MapScope> scopes) {
    MapScope res = scopes.get(orig);
    if (res == null) {
      res = orig.copy();
      scopes.put(orig, res);
    }
    return res;
  }

  public void prettyPrint(StringBuilder sb, String indent) {
    sb.append(indent).append("state ").append(id).append(" ")
      .append(label).append(" {\n");
    String inner = indent + SDFGUtil.indent;
    for (Node n: nodes()) {
      sb.append(inner).append(n).append("\n");
      if (n.kind == NodeKind.NESTED_SDFG) {
        n.nestedSDFG().getSDFG().prettyPrint(sb, inner + SDFGUtil.indent);
      }
    }
    for (Edge e: edges) {
      sb.append(inner).append(e).append("\n");
    }
    sb.append(indent).append("}\n");
  }

  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder();
    prettyPrint(sb, "");
    return sb.toString();
  }

  /** Utility for building small lists of connectors */
  public static List<String> conns(String ... names) {
    return Arrays.asList(names);
  }
}
