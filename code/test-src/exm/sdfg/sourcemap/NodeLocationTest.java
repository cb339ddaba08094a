package exm.sdfg.sourcemap;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;

import java.util.Arrays;
import java.util.Collections;

import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.ExpectedException;

import exm.sdfg.common.exceptions.SDFGRuntimeError;
import exm.sdfg.common.lang.DataType;
import exm.sdfg.ir.tree.Nodes.AccessNode;
import exm.sdfg.ir.tree.SDFG;
import exm.sdfg.ir.tree.SDFGState;

public class NodeLocationTest {

  @Rule
  public ExpectedException exception = ExpectedException.none();

  @Test
  public void testFormat() {
    NodeLocation loc = new NodeLocation(0, 2, Arrays.asList(4, 7));
    assertEquals("0:2:4,7", loc.format());
    assertEquals(loc, NodeLocation.parse("0:2:4,7"));
    assertEquals(loc, NodeLocation.parse(" 0:2:4, 7 "));
  }

  @Test
  public void testNoNodes() {
    NodeLocation loc = NodeLocation.parse("1:0:");
    assertTrue(loc.nodeIds.isEmpty());
    assertEquals("1:0:", loc.format());
  }

  @Test
  public void testOf() {
    SDFG sdfg = new SDFG("p");
    sdfg.addArray("A", DataType.FLOAT64, "4");
    sdfg.addState("s0");
    SDFGState s = sdfg.addState("s1");
    s.addAccess("A");
    AccessNode a = s.addAccess("A");
    assertEquals(new NodeLocation(0, 1, Collections.singletonList(1)),
                 NodeLocation.of(s, a));
  }

  @Test
  public void testOfMissingNode() {
    SDFG sdfg = new SDFG("p");
    sdfg.addArray("A", DataType.FLOAT64, "4");
    SDFGState s = sdfg.addState("s0");
    AccessNode a = s.addAccess("A");
    s.removeNode(a);
    exception.expect(SDFGRuntimeError.class);
    NodeLocation.of(s, a);
  }

  @Test
  public void testBadFieldCount() {
    exception.expect(IllegalArgumentException.class);
    NodeLocation.parse("0:1");
  }

  @Test
  public void testBadNumber() {
    exception.expect(IllegalArgumentException.class);
    NodeLocation.parse("0:x:1");
  }

  @Test
  public void testLineInfoSource() {
    InMemoryLineInfoSource src = new InMemoryLineInfoSource();
    LineInfo info = new LineInfo(10, 12, "prog.py", Arrays.asList("other"));
    src.put("p", info);
    assertEquals(info, src.lookup("p"));
    assertEquals("prog.py", info.toDebugInfo().filename);
    src.clear("p");
    src.clear("missing");
    assertNull(src.lookup("p"));
    assertTrue(src.isEmpty());
  }
}
