package exm.sdfg.ir.opt;

import static exm.sdfg.ir.tree.SDFGState.conns;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import org.apache.log4j.Logger;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.ExpectedException;

import exm.sdfg.common.Logging;
import exm.sdfg.common.exceptions.PatternMismatchException;
import exm.sdfg.common.lang.DataType;
import exm.sdfg.common.lang.DebugInfo;
import exm.sdfg.common.lang.Memlet;
import exm.sdfg.ir.tree.Edge;
import exm.sdfg.ir.tree.NodeKind;
import exm.sdfg.ir.tree.Nodes.AccessNode;
import exm.sdfg.ir.tree.Nodes.NestedSDFGNode;
import exm.sdfg.ir.tree.Nodes.Node;
import exm.sdfg.ir.tree.Nodes.Tasklet;
import exm.sdfg.ir.tree.SDFG;
import exm.sdfg.ir.tree.SDFGState;
import exm.sdfg.sourcemap.LineInfo;

public class NestSDFGTest {

  private static final Logger logger = Logging.getSDFGLogger();

  @Rule
  public ExpectedException exception = ExpectedException.none();

  private static Match rootMatch(SDFG sdfg) {
    return new Match(sdfg, -1, 0, new int[0]);
  }

  /**
   * X is read and written, Y only written
   */
  private static SDFG updateProgram() {
    SDFG sdfg = new SDFG("prog");
    sdfg.addArray("X", DataType.FLOAT64, "10");
    sdfg.addArray("Y", DataType.FLOAT64, "10");
    SDFGState s = sdfg.addState("s0");
    AccessNode rx = s.addRead("X");
    Tasklet t = s.addTasklet("t", conns("a"), conns("b", "c"),
                             "b = a + 1; c = a");
    AccessNode wx = s.addWrite("X");
    AccessNode wy = s.addWrite("Y");
    s.addEdge(rx, null, t, "a", Memlet.simple("X", "0:10"));
    s.addEdge(t, "b", wx, null, Memlet.simple("X", "0:10"));
    s.addEdge(t, "c", wy, null, Memlet.simple("Y", "0:10"));
    return sdfg;
  }

  /**
   * A -> t1 -> T -> t2 -> B with T a transient outside any map
   */
  private static SDFG transientProgram() {
    SDFG sdfg = new SDFG("prog");
    sdfg.addArray("A", DataType.FLOAT64, "10");
    sdfg.addArray("B", DataType.FLOAT64, "10");
    sdfg.addTransient("T", DataType.FLOAT64, "10");
    SDFGState s = sdfg.addState("s0");
    AccessNode a = s.addRead("A");
    Tasklet t1 = s.addTasklet("t1", conns("x"), conns("y"), "y = 2 * x");
    AccessNode tmp = s.addAccess("T");
    Tasklet t2 = s.addTasklet("t2", conns("x"), conns("y"), "y = x + 1");
    AccessNode b = s.addWrite("B");
    s.addEdge(a, null, t1, "x", Memlet.simple("A", "0:10"));
    s.addEdge(t1, "y", tmp, null, Memlet.simple("T", "0:10"));
    s.addEdge(tmp, null, t2, "x", Memlet.simple("T", "0:10"));
    s.addEdge(t2, "y", b, null, Memlet.simple("B", "0:10"));
    return sdfg;
  }

  @Test
  public void testNestReadWrite() throws Exception {
    SDFG sdfg = updateProgram();
    NestSDFG nest = new NestSDFG(false);
    assertTrue(nest.feasible(sdfg, rootMatch(sdfg)));
    NestedSDFGNode n = nest.apply(logger, sdfg, rootMatch(sdfg));

    assertEquals(1, sdfg.numStates());
    SDFGState outer = sdfg.getStartState();
    assertEquals("prog", outer.getLabel());
    assertEquals(Arrays.asList("X", "Y"),
                 new ArrayList<String>(sdfg.arrays().keySet()));
    assertEquals("One read, two writes", 4, outer.numNodes());
    assertEquals(1, outer.inDegree(n));
    assertEquals(2, outer.outDegree(n));
    assertEquals(Collections.singleton("X_in"), n.inConnectors());
    assertTrue(n.outConnectors().contains("X_out"));
    assertTrue(n.outConnectors().contains("Y_out"));

    Edge in = outer.inEdges(n).get(0);
    assertEquals("X", in.src.access().getData());
    assertEquals(Memlet.simple("X", "0:10"), in.getMemlet());

    SDFG child = n.getSDFG();
    assertTrue(child.isNested());
    assertEquals(3, child.arrays().size());
    assertFalse(child.containsArray("X"));
    assertFalse(child.containsArray("Y"));
    for (String name: Arrays.asList("X_in", "X_out", "Y_out")) {
      assertFalse(name + " is a boundary array",
                  child.getArray(name).isTransient());
    }

    SDFGState cs = child.states().get(0);
    for (Edge e: cs.edges()) {
      Node t = e.src.kind == NodeKind.TASKLET ? e.src : e.dst;
      Node acc = t == e.src ? e.dst : e.src;
      assertEquals("Memlet follows renamed access node",
                   acc.access().getData(), e.getMemlet().getData());
    }

    sdfg.resetSDFGIds();
    Validate.validate(logger, sdfg);
  }

  @Test
  public void testTransientsStayInside() throws Exception {
    SDFG sdfg = transientProgram();
    NestedSDFGNode n = new NestSDFG(false).apply(logger, sdfg,
                                                 rootMatch(sdfg));
    assertFalse(sdfg.containsArray("T"));
    assertEquals(1, n.outConnectors().size());
    assertTrue(n.getSDFG().getArray("T").isTransient());
  }

  @Test
  public void testPromoteGlobalTransients() throws Exception {
    SDFG sdfg = transientProgram();
    NestedSDFGNode n = new NestSDFG(true).apply(logger, sdfg,
                                                rootMatch(sdfg));
    SDFG child = n.getSDFG();
    assertFalse(child.containsArray("T"));
    assertFalse(child.getArray("T_out").isTransient());
    assertTrue(n.outConnectors().contains("T_out"));
    assertTrue("Allocated by outer SDFG", sdfg.containsArray("T"));
    assertEquals(2, sdfg.getStartState().outDegree(n));

    for (AccessNode a: child.states().get(0).accessNodes()) {
      assertFalse(a.getData().equals("T"));
    }
    sdfg.resetSDFGIds();
    Validate.validate(logger, sdfg);
  }

  @Test
  public void testDebugInfoFromLineInfo() throws Exception {
    SDFG sdfg = updateProgram();
    sdfg.setLineInfo(new LineInfo(12, 20, "prog.py",
                                  Collections.<String>emptyList()));
    NestedSDFGNode n = new NestSDFG(false).apply(logger, sdfg,
                                                 rootMatch(sdfg));
    assertEquals(new DebugInfo("prog.py", 12, 20), n.getDebugInfo());
    assertNull("Line info not copied into child",
               n.getSDFG().getLineInfo());
  }

  @Test
  public void testNotRepeated() throws Exception {
    SDFG sdfg = updateProgram();
    NestSDFG nest = new NestSDFG(false);
    NestedSDFGNode n = nest.apply(logger, sdfg, rootMatch(sdfg));
    sdfg.resetSDFGIds();
    assertFalse("Already a wrapper", nest.feasible(sdfg, rootMatch(sdfg)));
    assertFalse("Nested SDFG", nest.feasible(n.getSDFG(),
                                             rootMatch(n.getSDFG())));
    assertFalse(TransformationRegistry.candidates(sdfg, nest)
                  .iterator().hasNext());
  }

  @Test
  public void testApplyInfeasible() throws Exception {
    SDFG sdfg = updateProgram();
    NestSDFG nest = new NestSDFG(false);
    nest.apply(logger, sdfg, rootMatch(sdfg));
    exception.expect(PatternMismatchException.class);
    nest.apply(logger, sdfg, rootMatch(sdfg));
  }

  private static List<Memlet> memletsOf(SDFGState state) {
    List<Memlet> res = new ArrayList<Memlet>();
    for (Edge e: state.edges()) {
      res.add(e.getMemlet());
    }
    return res;
  }

  @Test
  public void testNestThenInline() throws Exception {
    SDFG sdfg = updateProgram();
    List<Memlet> before = new ArrayList<Memlet>();
    for (Memlet m: memletsOf(sdfg.getState(0))) {
      before.add(m.copy());
    }

    new NestSDFG(false).apply(logger, sdfg, rootMatch(sdfg));
    sdfg.resetSDFGIds();

    SDFGState outer = sdfg.getStartState();
    InlineNestedSDFG inline = new InlineNestedSDFG();
    Candidate<List<Node>> c = TransformationRegistry.candidates(sdfg, inline)
                                      .iterator().next();
    List<Node> added = c.apply(logger);
    assertEquals(1, added.size());

    assertEquals(4, outer.numNodes());
    assertEquals(2, sdfg.arrays().size());
    List<Memlet> after = memletsOf(outer);
    assertEquals(before.size(), after.size());
    assertTrue("Memlets " + after + " expected " + before,
               after.containsAll(before) && before.containsAll(after));

    sdfg.resetSDFGIds();
    Validate.validate(logger, sdfg);
  }
}
