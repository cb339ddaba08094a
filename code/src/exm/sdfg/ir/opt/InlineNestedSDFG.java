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
import java.util.HashSet;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Map.Entry;
import java.util.Set;

import org.apache.log4j.Logger;

import com.google.common.collect.ArrayListMultimap;
import com.google.common.collect.ListMultimap;

import exm.sdfg.common.Settings;
import exm.sdfg.common.exceptions.PatternMismatchException;
import exm.sdfg.common.exceptions.UnsupportedConfigurationException;
import exm.sdfg.common.lang.ArrayDesc;
import exm.sdfg.common.lang.Memlet;
import exm.sdfg.common.lang.Range;
import exm.sdfg.common.lang.Subset;
import exm.sdfg.common.lang.SymExpr;
import exm.sdfg.ir.SDFGUtil;
import exm.sdfg.ir.tree.Edge;
import exm.sdfg.ir.tree.NodeKind;
import exm.sdfg.ir.tree.Nodes;
import exm.sdfg.ir.tree.Nodes.AccessNode;
import exm.sdfg.ir.tree.Nodes.MapEntry;
import exm.sdfg.ir.tree.Nodes.MapExit;
import exm.sdfg.ir.tree.Nodes.NestedSDFGNode;
import exm.sdfg.ir.tree.Nodes.Node;
import exm.sdfg.ir.tree.SDFG;
import exm.sdfg.ir.tree.SDFGState;

/**
 * Inline a single-state nested SDFG into the state containing it.
 *
 * Boundary access nodes of the child are dropped and the outer edges
 * bound to their connectors are spliced directly onto the inner edges,
 * translating inner subsets into the outer array's index space.
 * Child transients move into the parent's array table under fresh names.
 *
 * All new memlets are computed before the graph is touched, so an
 * unsupported case leaves the graph exactly as it was.
 */
public class InlineNestedSDFG implements Transformation<List<Node>> {

  private final Pattern pattern;
  private final PatternNode nestedNode;

  public InlineNestedSDFG() {
    this.pattern = new Pattern();
    this.nestedNode = pattern.addNode(NodeKind.NESTED_SDFG);
  }

  @Override
  public String getName() {
    return "InlineNestedSDFG";
  }

  @Override
  public String getConfigEnabledKey() {
    return Settings.OPT_INLINE_NESTED;
  }

  @Override
  public boolean isStateflow() {
    return false;
  }

  @Override
  public List<Pattern> patterns() {
    return Collections.singletonList(pattern);
  }

  public PatternNode nestedNode() {
    return nestedNode;
  }

  @Override
  public boolean feasible(SDFG sdfg, Match match) {
    Node n = match.node(nestedNode);
    if (n == null || n.kind != NodeKind.NESTED_SDFG) {
      return false;
    }
    SDFGState state = match.state();
    SDFG child = n.nestedSDFG().getSDFG();
    if (child.numStates() != 1) {
      return false;
    }

    // Every connector has exactly one edge
    for (String conn: n.inConnectors()) {
      if (state.inEdgesByConnector(n, conn).size() != 1) {
        return false;
      }
    }
    for (String conn: n.outConnectors()) {
      if (state.outEdgesByConnector(n, conn).size() != 1) {
        return false;
      }
    }
    for (Edge e: state.allEdges(n)) {
      String conn = e.src == n ? e.srcConn : e.dstConn;
      if (conn == null && !e.getMemlet().isEmpty()) {
        return false;
      }
    }

    // Non-transient data must come through a connector
    SDFGState nstate = child.states().get(0);
    for (AccessNode a: nstate.accessNodes()) {
      ArrayDesc desc = child.getArray(a.getData());
      if (desc == null) {
        return false;
      }
      if (!desc.isTransient() && !n.inConnectors().contains(a.getData()) &&
          !n.outConnectors().contains(a.getData())) {
        return false;
      }
    }
    return true;
  }

  /**
   * @return nodes added to the parent state
   */
  @Override
  public List<Node> apply(Logger logger, SDFG sdfg, Match match)
      throws PatternMismatchException, UnsupportedConfigurationException {
    if (!feasible(sdfg, match)) {
      throw new PatternMismatchException(getName(), match.toString());
    }
    SDFGState state = match.state();
    NestedSDFGNode nnode = match.node(nestedNode).nestedSDFG();
    SDFGState nstate = nnode.getSDFG().states().get(0);

    logger.debug("inlining " + nnode.getLabel() + " into state " +
                 state.getLabel() + " of " + sdfg.getName());

    InlinePlan plan = plan(sdfg, state, nnode, nstate);
    if (logger.isTraceEnabled()) {
      logger.trace("inlining renames: " + plan.renames);
    }
    return execute(logger, sdfg, state, nnode, nstate, plan);
  }

  /**
   * Everything decided before mutation starts
   */
  private static class InlinePlan {
    /** Connector name to the single outer edge bound to it */
    final Map<String, Edge> inputs = new LinkedHashMap<String, Edge>();
    final Map<String, Edge> outputs = new LinkedHashMap<String, Edge>();

    /** Child transient name to new name in parent */
    final Map<String, String> transients =
                                    new LinkedHashMap<String, String>();
    /** All data renames for copied nodes and unmodified edges */
    final Map<String, String> renames = new LinkedHashMap<String, String>();

    final Set<Node> boundary =
          Collections.newSetFromMap(new IdentityHashMap<Node, Boolean>());
    final List<Node> toCopy = new ArrayList<Node>();

    /** Inner edges to splice onto outer edge, by connector */
    final ListMultimap<String, Edge> inSplices = ArrayListMultimap.create();
    final ListMultimap<String, Edge> outSplices = ArrayListMultimap.create();
    /** Inner edges running straight from an input to an output boundary */
    final List<Edge> passThrough = new ArrayList<Edge>();

    /** New memlet for every inner edge whose memlet changes */
    final Map<Edge, Memlet> newMemlets = new IdentityHashMap<Edge, Memlet>();

    MapEntry scopeEntry;
    MapExit scopeExit;
  }

  private InlinePlan plan(SDFG sdfg, SDFGState state, NestedSDFGNode nnode,
      SDFGState nstate) throws UnsupportedConfigurationException {
    SDFG child = nnode.getSDFG();
    InlinePlan plan = new InlinePlan();

    for (Edge e: state.inEdges(nnode)) {
      if (e.dstConn != null) {
        plan.inputs.put(e.dstConn, e);
      }
    }
    for (Edge e: state.outEdges(nnode)) {
      if (e.srcConn != null) {
        plan.outputs.put(e.srcConn, e);
      }
    }

    // Transients get fresh names in the parent
    String sep = Settings.get(Settings.INLINE_TRANSIENT_SEPARATOR);
    Set<String> reserved = new HashSet<String>();
    for (AccessNode a: nstate.accessNodes()) {
      String data = a.getData();
      if (child.getArray(data).isTransient() &&
          !plan.transients.containsKey(data)) {
        String name = freshName(sdfg, child.getName() + sep + data, reserved);
        reserved.add(name);
        plan.transients.put(data, name);
      }
    }
    plan.renames.putAll(plan.transients);
    for (Entry<String, Edge> in: plan.inputs.entrySet()) {
      plan.renames.put(in.getKey(), in.getValue().getMemlet().getData());
    }
    for (Entry<String, Edge> out: plan.outputs.entrySet()) {
      plan.renames.put(out.getKey(), out.getValue().getMemlet().getData());
    }

    // Boundary access nodes are replaced by the outer edges
    Set<Node> sources = Collections.newSetFromMap(
                                new IdentityHashMap<Node, Boolean>());
    Set<Node> sinks = Collections.newSetFromMap(
                                new IdentityHashMap<Node, Boolean>());
    for (Node n: nstate.sourceNodes()) {
      if (n.kind == NodeKind.ACCESS &&
          plan.inputs.containsKey(n.access().getData())) {
        sources.add(n);
      }
    }
    for (Node n: nstate.sinkNodes()) {
      if (n.kind == NodeKind.ACCESS &&
          plan.outputs.containsKey(n.access().getData())) {
        sinks.add(n);
      }
    }
    plan.boundary.addAll(sources);
    plan.boundary.addAll(sinks);
    for (Node n: nstate.nodes()) {
      if (!plan.boundary.contains(n)) {
        plan.toCopy.add(n);
      }
    }

    for (Node src: nstate.nodes()) {
      if (!sources.contains(src)) {
        continue;
      }
      String conn = src.access().getData();
      Edge top = plan.inputs.get(conn);
      for (Edge ie: nstate.outEdges(src)) {
        if (sinks.contains(ie.dst)) {
          plan.passThrough.add(ie);
          planPassThrough(plan, ie);
        } else {
          plan.inSplices.put(conn, ie);
          planSubtree(plan, nstate, ie, conn, top);
        }
      }
    }
    for (Node dst: nstate.nodes()) {
      if (!sinks.contains(dst)) {
        continue;
      }
      String conn = dst.access().getData();
      Edge top = plan.outputs.get(conn);
      for (Edge ie: nstate.inEdges(dst)) {
        if (sources.contains(ie.src)) {
          continue;
        }
        plan.outSplices.put(conn, ie);
        planSubtree(plan, nstate, ie, conn, top);
      }
    }
    checkSpliceArity(plan);

    // Remaining internal edges that move boundary data
    for (Edge ie: nstate.edges()) {
      Memlet m = ie.getMemlet();
      if (plan.newMemlets.containsKey(ie) || m.isEmpty() ||
          plan.boundary.contains(ie.src) || plan.boundary.contains(ie.dst)) {
        continue;
      }
      Edge top = boundaryEdgeFor(plan, nstate, ie);
      if (top != null) {
        plan.newMemlets.put(ie, modifyMemlet(m, top.getMemlet()));
      }
    }

    plan.scopeEntry = state.scopeOf(nnode);
    plan.scopeExit = plan.scopeEntry == null ? null
                                : state.exitNode(plan.scopeEntry);
    return plan;
  }

  /**
   * Plan memlets for a boundary edge and the memlet tree below it
   */
  private static void planSubtree(InlinePlan plan, SDFGState nstate,
      Edge ie, String conn, Edge top)
          throws UnsupportedConfigurationException {
    for (Edge e: nstate.memletTree(ie).traverseChildren(true)) {
      Memlet m = e.getMemlet();
      if (!m.isEmpty() && conn.equals(m.getData())) {
        plan.newMemlets.put(e, modifyMemlet(m, top.getMemlet()));
      } else if (e == ie && !m.isEmpty()) {
        // Memlet names data on other end: other subset is the boundary view
        Memlet renamed = m.copy();
        String repl = plan.renames.get(m.getData());
        if (repl != null) {
          renamed.setData(repl);
        }
        Subset view = m.getOtherSubset() != null ? m.getOtherSubset()
                                                 : m.getSubset();
        renamed.setOtherSubset(translateSubset(view, m, top.getMemlet()));
        plan.newMemlets.put(e, renamed);
      } else if (e == ie) {
        plan.newMemlets.put(e, m.copy());
      }
    }
  }

  /**
   * Plan the outer copy replacing an inner edge that runs from an input
   * boundary node straight to an output boundary node.  The new memlet
   * names the input's outer data, with the output's outer view as its
   * other subset.
   */
  private static void planPassThrough(InlinePlan plan, Edge ie)
          throws UnsupportedConfigurationException {
    String inConn = ie.src.access().getData();
    String outConn = ie.dst.access().getData();
    Memlet m = ie.getMemlet();
    if (m.isEmpty()) {
      throw new UnsupportedConfigurationException("Empty memlet between " +
          "connectors " + inConn + " and " + outConn);
    }
    Subset srcView, dstView;
    if (inConn.equals(m.getData())) {
      srcView = m.getSubset();
      dstView = m.getOtherSubset() != null ? m.getOtherSubset()
                                           : m.getSubset();
    } else {
      dstView = m.getSubset();
      srcView = m.getOtherSubset() != null ? m.getOtherSubset()
                                           : m.getSubset();
    }
    Memlet inOuter = plan.inputs.get(inConn).getMemlet();
    Memlet outOuter = plan.outputs.get(outConn).getMemlet();
    Memlet joined = m.copy();
    joined.setData(inOuter.getData());
    joined.setSubset(translateSubset(srcView, m, inOuter));
    joined.setOtherSubset(translateSubset(dstView, m, outOuter));
    plan.newMemlets.put(ie, joined);
  }

  /**
   * Outer edge whose view applies to an internal edge, or null
   */
  private static Edge boundaryEdgeFor(InlinePlan plan, SDFGState nstate,
                                      Edge ie) {
    String data = ie.getMemlet().getData();
    Edge in = plan.inputs.get(data);
    Edge out = plan.outputs.get(data);
    if (in == null || out == null) {
      return in != null ? in : out;
    }
    // Bound both ways: writes end in an access node for the data
    List<Edge> path = nstate.memletPath(ie);
    Node last = path.get(path.size() - 1).dst;
    if (last.kind == NodeKind.ACCESS && last.access().getData().equals(data)) {
      return out;
    }
    return in;
  }

  /**
   * Splicing must not put several edges on a connector that takes one
   */
  private static void checkSpliceArity(InlinePlan plan)
      throws UnsupportedConfigurationException {
    for (String conn: plan.inSplices.keySet()) {
      Edge top = plan.inputs.get(conn);
      int count = plan.inSplices.get(conn).size() +
                  countPassThrough(plan, conn, true);
      if (count > 1 && top.src.kind == NodeKind.MAP_EXIT &&
          Nodes.isScopeConnector(top.srcConn, false)) {
        throw new UnsupportedConfigurationException("Input connector " + conn
            + " fans out to " + count + " edges from " + top.src);
      }
    }
    for (String conn: plan.outSplices.keySet()) {
      Edge top = plan.outputs.get(conn);
      int count = plan.outSplices.get(conn).size() +
                  countPassThrough(plan, conn, false);
      if (count > 1 && top.dstConn != null &&
          SDFGState.singleInput(top.dst, top.dstConn)) {
        throw new UnsupportedConfigurationException("Output connector " +
            conn + " fans in from " + count + " edges to " + top.dst);
      }
    }
  }

  private static int countPassThrough(InlinePlan plan, String conn,
                                      boolean input) {
    int count = 0;
    for (Edge e: plan.passThrough) {
      Node end = input ? e.src : e.dst;
      if (end.access().getData().equals(conn)) {
        count++;
      }
    }
    return count;
  }

  private static String freshName(SDFG sdfg, String base,
                                  Set<String> reserved) {
    String name = base;
    int i = 0;
    while (sdfg.containsArray(name) || sdfg.symbols().containsKey(name) ||
           reserved.contains(name)) {
      name = base + "_" + i;
      i++;
    }
    return name;
  }

  private List<Node> execute(Logger logger, SDFG sdfg, SDFGState state,
        NestedSDFGNode nnode, SDFGState nstate, InlinePlan plan) {
    SDFG child = nnode.getSDFG();

    for (Entry<String, String> t: plan.transients.entrySet()) {
      ArrayDesc desc = child.getArray(t.getKey()).copy();
      sdfg.addDatadesc(t.getValue(), desc, false);
    }

    // Copy nodes and internal edges
    Map<Node, Node> nodeMap = new IdentityHashMap<Node, Node>();
    List<Node> added = new ArrayList<Node>();
    for (Node n: plan.toCopy) {
      Node c = state.addNode(moveNode(n));
      nodeMap.put(n, c);
      added.add(c);
    }
    List<Edge> toRename = new ArrayList<Edge>();
    for (Edge ie: nstate.edges()) {
      Node src = nodeMap.get(ie.src);
      Node dst = nodeMap.get(ie.dst);
      if (src == null || dst == null) {
        continue;
      }
      Memlet m = plan.newMemlets.get(ie);
      if (m != null) {
        state.addEdge(src, ie.srcConn, dst, ie.dstConn, m);
      } else {
        toRename.add(state.addEdge(src, ie.srcConn, dst, ie.dstConn,
                                   ie.getMemlet().copy()));
      }
    }
    SDFGUtil.replaceData(added, toRename, plan.renames);

    // Reconnect outer edges
    for (String conn: plan.inSplices.keySet()) {
      Edge top = plan.inputs.get(conn);
      removeIfPresent(state, top);
      for (Edge ie: plan.inSplices.get(conn)) {
        state.addEdge(top.src, top.srcConn, nodeMap.get(ie.dst), ie.dstConn,
                      plan.newMemlets.get(ie));
      }
    }
    for (String conn: plan.outSplices.keySet()) {
      Edge top = plan.outputs.get(conn);
      removeIfPresent(state, top);
      for (Edge ie: plan.outSplices.get(conn)) {
        state.addEdge(nodeMap.get(ie.src), ie.srcConn, top.dst, top.dstConn,
                      plan.newMemlets.get(ie));
      }
    }
    for (Edge ie: plan.passThrough) {
      Edge in = plan.inputs.get(ie.src.access().getData());
      Edge out = plan.outputs.get(ie.dst.access().getData());
      removeIfPresent(state, in);
      removeIfPresent(state, out);
      state.addEdge(in.src, in.srcConn, out.dst, out.dstConn,
                    plan.newMemlets.get(ie));
    }

    // Keep copied nodes inside the enclosing scope
    if (plan.scopeEntry != null) {
      for (Node c: added) {
        if (state.inDegree(c) == 0) {
          state.addEdge(plan.scopeEntry, null, c, null, Memlet.empty());
        }
        if (state.outDegree(c) == 0) {
          state.addEdge(c, null, plan.scopeExit, null, Memlet.empty());
        }
      }
    }

    // Copied access nodes in dataflow order, by parent data name
    ListMultimap<String, AccessNode> accessOrder =
                                        ArrayListMultimap.create();
    for (Node n: nstate.topologicalSort()) {
      Node c = nodeMap.get(n);
      if (c != null && c.kind == NodeKind.ACCESS) {
        accessOrder.put(c.access().getData(), c.access());
      }
    }

    Set<String> unusedIn = new HashSet<String>(plan.inputs.keySet());
    Set<String> unusedOut = new HashSet<String>(plan.outputs.keySet());
    unusedIn.removeAll(plan.inSplices.keySet());
    unusedOut.removeAll(plan.outSplices.keySet());
    for (Edge ie: plan.passThrough) {
      unusedIn.remove(ie.src.access().getData());
      unusedOut.remove(ie.dst.access().getData());
    }
    for (String conn: unusedIn) {
      removeEdgePath(logger, state, plan.inputs.get(conn), true, accessOrder);
    }
    for (String conn: unusedOut) {
      removeEdgePath(logger, state, plan.outputs.get(conn), false,
                     accessOrder);
    }

    state.removeNode(nnode);
    logger.debug("inlined " + added.size() + " nodes from " +
                 child.getName());
    return added;
  }

  /**
   * Take a node out of the discarded child.  A nested SDFG node keeps its
   * child SDFG rather than copying it.
   */
  private static Node moveNode(Node n) {
    if (n.kind == NodeKind.NESTED_SDFG) {
      NestedSDFGNode nested = n.nestedSDFG();
      NestedSDFGNode moved = new NestedSDFGNode(nested.getLabel(),
          nested.getSDFG(), nested.inConnectors(), nested.outConnectors());
      moved.setDebugInfo(nested.getDebugInfo());
      return moved;
    }
    return n.copy();
  }

  private static void removeIfPresent(SDFGState state, Edge e) {
    if (state.containsEdge(e)) {
      state.removeEdge(e);
    }
  }

  /**
   * Remove an unused outer path leading to the nested node, walking away
   * from it until reaching an edge with siblings on the same connector.
   * If the whole path goes, the outer access node at its end goes too,
   * and its edges on the far side are moved onto the first (inputs) or last
   * (outputs) inlined access node of the same data.
   */
  private static void removeEdgePath(Logger logger, SDFGState state,
        Edge top, boolean input, ListMultimap<String, AccessNode> order) {
    List<Edge> path = state.memletPath(top);
    if (input) {
      Collections.reverse(path);
    }
    boolean wholePath = true;
    for (Edge pedge: path) {
      Node far = input ? pedge.src : pedge.dst;
      String conn = input ? pedge.srcConn : pedge.dstConn;
      List<Edge> siblings = input ? state.outEdges(far) : state.inEdges(far);
      int sameConn = 0;
      for (Edge s: siblings) {
        String sConn = input ? s.srcConn : s.dstConn;
        if (conn == null ? sConn == null : conn.equals(sConn)) {
          sameConn++;
        }
      }
      if (sameConn != 1) {
        wholePath = false;
        break;
      }
      removePathEdge(state, pedge);
    }

    Edge last = path.get(path.size() - 1);
    Node terminus = input ? last.src : last.dst;
    if (!wholePath || terminus.kind != NodeKind.ACCESS) {
      return;
    }
    List<AccessNode> candidates = order.get(terminus.access().getData());
    List<Edge> toMove = input ? state.inEdges(terminus)
                              : state.outEdges(terminus);
    if (!toMove.isEmpty() && candidates.isEmpty()) {
      // Nowhere to move dependencies to, keep the node
      return;
    }
    logger.trace("removing unused access node " + terminus);
    state.removeNode(terminus);
    for (Edge e: toMove) {
      if (input) {
        state.addEdge(e.src, e.srcConn, candidates.get(0), e.dstConn,
                      e.getMemlet());
      } else {
        state.addEdge(candidates.get(candidates.size() - 1), e.srcConn,
                      e.dst, e.dstConn, e.getMemlet());
      }
    }
  }

  /**
   * Remove edge, dropping scope connectors it leaves unused
   */
  private static void removePathEdge(SDFGState state, Edge e) {
    state.removeEdge(e);
    if (e.src.kind.isScope() && e.srcConn != null &&
        state.outEdgesByConnector(e.src, e.srcConn).isEmpty()) {
      e.src.removeOutConnector(e.srcConn);
    }
    if (e.dst.kind.isScope() && e.dstConn != null &&
        state.inEdgesByConnector(e.dst, e.dstConn).isEmpty()) {
      e.dst.removeInConnector(e.dstConn);
    }
  }

  /**
   * Translate a memlet inside a nested SDFG into the index space of the
   * outer memlet bound to the same connector: add missing unit dimensions,
   * then offset by the outer subset.
   * @throws UnsupportedConfigurationException if the inner memlet has more
   *        dimensions than the outer one, if there aren't enough unit
   *        dimensions in the outer memlet, or if the outer memlet has an
   *        other subset
   */
  public static Memlet modifyMemlet(Memlet inner, Memlet outer)
      throws UnsupportedConfigurationException {
    Memlet result = inner.copy();
    result.setData(outer.getData());
    result.setSubset(translateSubset(inner.getSubset(), inner, outer));
    if (singleElement(inner.getSubset(), outer.getSubset())) {
      result.setVolume(outer.getVolume());
    }
    return result;
  }

  /**
   * Translate one inner view of a connector's data into the outer
   * memlet's index space
   * @param inner memlet the view came from, for messages
   */
  private static Subset translateSubset(Subset in, Memlet inner,
      Memlet outer) throws UnsupportedConfigurationException {
    if (outer.getOtherSubset() != null) {
      throw new UnsupportedConfigurationException("Outer memlet " + outer +
          " with other subset not supported when inlining");
    }
    Subset out = outer.getSubset();
    if (in.dims() > out.dims()) {
      throw new UnsupportedConfigurationException("Unexpected extra " +
          "dimensions in internal memlet " + inner + " for external memlet "
          + outer);
    } else if (in.dims() < out.dims()) {
      if (singleElement(in, out)) {
        // Single element already selected by outer subset
        return out;
      }
      List<Integer> ones = new ArrayList<Integer>();
      List<SymExpr> shape = out.size();
      for (int i = 0; i < shape.size(); i++) {
        if (shape.get(i).isConstant(1)) {
          ones.add(i);
        }
      }
      int missing = out.dims() - in.dims();
      if (ones.size() < missing) {
        throw new UnsupportedConfigurationException("Cannot match internal " +
            "memlet " + inner + " to external memlet " + outer +
            ": not enough unit dimensions");
      }
      in = in.unsqueeze(ones.subList(0, missing));
    }
    return in.offset(out, false);
  }

  private static boolean singleElement(Subset in, Subset out) {
    return in.dims() < out.dims() && in.dims() == 1 &&
           in.get(0).equals(Range.index(SymExpr.ZERO));
  }
}
