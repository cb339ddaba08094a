package exm.sdfg.ir.tree;

import static exm.sdfg.ir.tree.SDFGState.conns;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;

import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.ExpectedException;

import exm.sdfg.common.exceptions.InvariantViolation;
import exm.sdfg.common.lang.DataType;
import exm.sdfg.common.lang.Memlet;
import exm.sdfg.common.lang.ScheduleType;
import exm.sdfg.common.lang.Subset;
import exm.sdfg.common.util.Pair;
import exm.sdfg.ir.tree.Nodes.AccessNode;
import exm.sdfg.ir.tree.Nodes.MapEntry;
import exm.sdfg.ir.tree.Nodes.MapExit;
import exm.sdfg.ir.tree.Nodes.Node;
import exm.sdfg.ir.tree.Nodes.Tasklet;

public class SDFGStateTest {

  @Rule
  public ExpectedException exception = ExpectedException.none();

  private static SDFG newSDFG() {
    SDFG sdfg = new SDFG("test");
    sdfg.addArray("A", DataType.FLOAT64, "N");
    sdfg.addArray("B", DataType.FLOAT64, "N");
    return sdfg;
  }

  @Test
  public void testNodeIdsNotReused() {
    SDFGState state = newSDFG().addState("s0");
    AccessNode a = state.addRead("A");
    AccessNode b = state.addWrite("B");
    assertEquals(0, a.getId());
    assertEquals(1, b.getId());

    state.removeNode(a);
    assertEquals("Removed node is detached", -1, a.getId());
    assertNull(state.getNode(0));
    assertFalse(state.contains(a));
    assertEquals(1, state.numNodes());

    AccessNode c = state.addRead("A");
    assertEquals("Freed slot is not reused", 2, c.getId());
    assertEquals(3, state.numSlots());
    assertEquals(Arrays.<Node>asList(b, c), state.nodes());
  }

  @Test
  public void testTaskletConnectorTakesOneEdge() {
    SDFGState state = newSDFG().addState("s0");
    AccessNode a1 = state.addRead("A");
    AccessNode a2 = state.addRead("A");
    Tasklet t = state.addTasklet("t", conns("a"), conns("b"), "b = a");
    state.addEdge(a1, null, t, "a", Memlet.simple("A", "0"));

    exception.expect(InvariantViolation.class);
    state.addEdge(a2, null, t, "a", Memlet.simple("A", "1"));
  }

  @Test
  public void testUndeclaredConnector() {
    SDFGState state = newSDFG().addState("s0");
    AccessNode a = state.addRead("A");
    Tasklet t = state.addTasklet("t", conns("a"), conns("b"), "b = a");

    exception.expect(InvariantViolation.class);
    state.addEdge(a, null, t, "x", Memlet.simple("A", "0"));
  }

  @Test
  public void testAccessNodeTakesManyEdges() {
    SDFGState state = newSDFG().addState("s0");
    Tasklet t1 = state.addTasklet("t1", conns(), conns("b"), "b = 1");
    Tasklet t2 = state.addTasklet("t2", conns(), conns("b"), "b = 2");
    AccessNode b = state.addWrite("B");
    state.addEdge(t1, "b", b, null, Memlet.simple("B", "0"));
    state.addEdge(t2, "b", b, null, Memlet.simple("B", "1"));
    assertEquals(2, state.inDegree(b));
    assertEquals(Arrays.<Node>asList(t1, t2), state.sourceNodes());
    assertEquals(Arrays.<Node>asList(b), state.sinkNodes());
  }

  @Test
  public void testMapExitOutConnectorTakesOneEdge() {
    SDFG sdfg = newSDFG();
    SDFGState state = sdfg.addState("s0");
    Map<String, Memlet> outs = new LinkedHashMap<String, Memlet>();
    outs.put("b", Memlet.simple("B", "i"));
    state.addMappedTasklet("t", Arrays.asList("i"), Subset.parse("0:N"),
        new LinkedHashMap<String, Memlet>(), "b = i", outs,
        ScheduleType.DEFAULT);
    MapExit exit = null;
    for (Node n: state.nodes()) {
      if (n.kind == NodeKind.MAP_EXIT) {
        exit = n.mapExit();
      }
    }
    AccessNode extra = state.addWrite("B");

    exception.expect(InvariantViolation.class);
    state.addEdge(exit, "OUT_B", extra, null, Memlet.simple("B", "0:N"));
  }

  @Test
  public void testMappedTasklet() {
    SDFG sdfg = newSDFG();
    SDFGState state = sdfg.addState("s0");
    Map<String, Memlet> ins = new LinkedHashMap<String, Memlet>();
    ins.put("a", Memlet.simple("A", "i"));
    Map<String, Memlet> outs = new LinkedHashMap<String, Memlet>();
    outs.put("b", Memlet.simple("B", "i"));
    Tasklet t = state.addMappedTasklet("copy", Arrays.asList("i"),
        Subset.parse("0:N"), ins, "b = a", outs, ScheduleType.DEFAULT);

    assertEquals(5, state.numNodes());
    Edge inner = state.inEdges(t).get(0);
    List<Edge> path = state.memletPath(inner);
    assertEquals(2, path.size());
    assertSame(inner, path.get(1));
    Edge outer = path.get(0);
    assertEquals(NodeKind.ACCESS, outer.src.kind);
    assertEquals("Outer memlet covers whole map range",
        Subset.parse("0:N"), outer.getMemlet().getSubset());
    assertEquals("IN_A", outer.dstConn);
    assertEquals("OUT_A", inner.srcConn);

    Edge write = state.outEdges(t).get(0);
    List<Edge> wpath = state.memletPath(write);
    assertEquals(2, wpath.size());
    assertSame(write, wpath.get(0));
    assertEquals(Subset.parse("0:N"),
                 wpath.get(1).getMemlet().getSubset());
  }

  @Test
  public void testMemletTreeFansOut() {
    SDFGState state = newSDFG().addState("s0");
    Pair<MapEntry, MapExit> map = state.addMap("m", Arrays.asList("i"),
        Subset.parse("0:N"), ScheduleType.DEFAULT);
    AccessNode a = state.addRead("A");
    AccessNode b = state.addWrite("B");
    Tasklet t1 = state.addTasklet("t1", conns("a"), conns("b"), "b = a");
    Tasklet t2 = state.addTasklet("t2", conns("a"), conns(), "");
    Edge outer = state.addEdge(a, null, map.val1, "IN_A",
                               Memlet.simple("A", "0:N"));
    Edge in1 = state.addEdge(map.val1, "OUT_A", t1, "a",
                             Memlet.simple("A", "i"));
    Edge in2 = state.addEdge(map.val1, "OUT_A", t2, "a",
                             Memlet.simple("A", "i"));
    state.addMemletPath(Memlet.simple("B", "i"), "b", null, t1, map.val2, b);
    state.addEdge(t2, null, map.val2, null, Memlet.empty());

    MemletTree tree = state.memletTree(outer);
    assertSame(outer, tree.edge);
    assertEquals(2, tree.getChildren().size());
    assertEquals(Arrays.asList(outer, in1, in2), tree.traverseChildren(true));
    assertEquals(Arrays.asList(in1, in2), tree.traverseChildren(false));
    assertEquals(2, tree.leaves().size());

    MemletTree leaf = state.memletTree(in2);
    assertSame(in2, leaf.edge);
    assertSame(outer, leaf.root().edge);
    assertSame(tree.edge, leaf.getParent().edge);

    assertEquals("Path stops where the tree branches",
        Arrays.asList(outer), state.memletPath(outer));
    assertEquals(Arrays.asList(outer, in1), state.memletPath(in1));
  }

  @Test
  public void testMemletTreeFansIn() {
    SDFGState state = newSDFG().addState("s0");
    Pair<MapEntry, MapExit> map = state.addMap("m", Arrays.asList("i"),
        Subset.parse("0:N"), ScheduleType.DEFAULT);
    AccessNode b = state.addWrite("B");
    Tasklet t1 = state.addTasklet("t1", conns(), conns("b"), "b = 1");
    Tasklet t2 = state.addTasklet("t2", conns(), conns("b"), "b = 2");
    state.addEdge(map.val1, null, t1, null, Memlet.empty());
    state.addEdge(map.val1, null, t2, null, Memlet.empty());
    Edge w1 = state.addEdge(t1, "b", map.val2, "IN_B",
                            Memlet.simple("B", "i"));
    Edge w2 = state.addEdge(t2, "b", map.val2, "IN_B",
                            Memlet.simple("B", "i"));
    Edge outer = state.addEdge(map.val2, "OUT_B", b, null,
                               Memlet.simple("B", "0:N"));

    MemletTree tree = state.memletTree(w1).root();
    assertSame(outer, tree.edge);
    assertEquals(Arrays.asList(outer, w1, w2), tree.traverseChildren(true));
  }

  @Test
  public void testScopeDict() {
    SDFGState state = newSDFG().addState("s0");
    Map<String, Memlet> ins = new LinkedHashMap<String, Memlet>();
    ins.put("a", Memlet.simple("A", "i"));
    Map<String, Memlet> outs = new LinkedHashMap<String, Memlet>();
    outs.put("b", Memlet.simple("B", "i"));
    Tasklet t = state.addMappedTasklet("copy", Arrays.asList("i"),
        Subset.parse("0:N"), ins, "b = a", outs, ScheduleType.DEFAULT);

    MapEntry entry = state.getNode(0).mapEntry();
    MapExit exit = state.getNode(1).mapExit();
    Map<Node, MapEntry> scopes = state.scopeDict();
    assertSame(entry, scopes.get(t));
    assertNull(scopes.get(entry));
    assertNull(scopes.get(exit));
    for (AccessNode a: state.accessNodes()) {
      assertNull(scopes.get(a));
    }
    assertSame(entry, state.scopeOf(t));
    assertSame(exit, state.exitNode(entry));
    assertSame(entry, state.entryNode(exit));
    assertEquals(Arrays.<Node>asList(t), state.scopeSubgraph(entry));
  }

  @Test
  public void testTopologicalSort() {
    SDFGState state = newSDFG().addState("s0");
    AccessNode b = state.addWrite("B");
    Tasklet t = state.addTasklet("t", conns("a"), conns("b"), "b = a");
    AccessNode a = state.addRead("A");
    state.addEdge(a, null, t, "a", Memlet.simple("A", "0"));
    state.addEdge(t, "b", b, null, Memlet.simple("B", "0"));
    assertEquals(Arrays.<Node>asList(a, t, b), state.topologicalSort());
  }

  @Test
  public void testCycleDetected() {
    SDFGState state = newSDFG().addState("s0");
    AccessNode a = state.addAccess("A");
    AccessNode b = state.addAccess("B");
    state.addEdge(a, null, b, null, Memlet.simple("A", "0"));
    state.addEdge(b, null, a, null, Memlet.simple("B", "0"));

    exception.expect(InvariantViolation.class);
    state.topologicalSort();
  }

  @Test
  public void testRemoveEdgeAndConnectors() {
    SDFGState state = newSDFG().addState("s0");
    Pair<MapEntry, MapExit> map = state.addMap("m", Arrays.asList("i"),
        Subset.parse("0:N"), ScheduleType.DEFAULT);
    AccessNode a = state.addRead("A");
    Edge e = state.addEdge(a, null, map.val1, "IN_A",
                           Memlet.simple("A", "0:N"));
    assertTrue("Scope connector declared on demand",
               map.val1.inConnectors().contains("IN_A"));
    state.removeEdgeAndConnectors(e);
    assertFalse(map.val1.inConnectors().contains("IN_A"));
    assertFalse(state.containsEdge(e));
  }

  @Test
  public void testRemoveNodeRemovesEdges() {
    SDFGState state = newSDFG().addState("s0");
    AccessNode a = state.addRead("A");
    Tasklet t = state.addTasklet("t", conns("a"), conns(), "");
    state.addEdge(a, null, t, "a", Memlet.simple("A", "0"));
    state.removeNode(t);
    assertTrue(state.edges().isEmpty());
    assertEquals(0, state.outDegree(a));
  }

  @Test
  public void testMemletPathIntoTaskletConnector() {
    SDFGState state = newSDFG().addState("s0");
    Pair<MapEntry, MapExit> map = state.addMap("m", Arrays.asList("i"),
        Subset.parse("0:N"), ScheduleType.DEFAULT);
    AccessNode a = state.addRead("A");
    Tasklet t = state.addTasklet("t", conns("a"), conns(), "");
    List<Edge> path = state.addMemletPath(Memlet.simple("A", "i"), null, "a",
                                          a, map.val1, t);
    assertEquals(2, path.size());
    assertEquals("IN_A", path.get(0).dstConn);
    assertEquals("OUT_A", path.get(1).srcConn);
    assertEquals("Path ends on the given connector", "a",
                 path.get(1).dstConn);
    assertSame(t, path.get(1).dst);
    assertEquals(path, state.memletPath(path.get(1)));
  }
}
