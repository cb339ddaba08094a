package exm.sdfg.ir.opt;

import static exm.sdfg.ir.tree.SDFGState.conns;

import java.util.Arrays;

import org.apache.log4j.Logger;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.ExpectedException;

import exm.sdfg.common.Logging;
import exm.sdfg.common.exceptions.InvariantViolation;
import exm.sdfg.common.lang.DataType;
import exm.sdfg.common.lang.Memlet;
import exm.sdfg.common.lang.ScheduleType;
import exm.sdfg.common.lang.Subset;
import exm.sdfg.common.util.Pair;
import exm.sdfg.ir.tree.Nodes.AccessNode;
import exm.sdfg.ir.tree.Nodes.MapEntry;
import exm.sdfg.ir.tree.Nodes.MapExit;
import exm.sdfg.ir.tree.Nodes.Tasklet;
import exm.sdfg.ir.tree.ParentRef;
import exm.sdfg.ir.tree.SDFG;
import exm.sdfg.ir.tree.SDFGState;

public class ValidateTest {

  private static final Logger logger = Logging.getSDFGLogger();

  @Rule
  public ExpectedException exception = ExpectedException.none();

  @Test
  public void testValid() {
    Validate.validate(logger, OptTestUtil.copyProgram("p", "A", "B"));
    Validate.validate(logger, OptTestUtil.nestedChain());
    Validate.validate(logger, new SDFG("empty"));
  }

  @Test
  public void testUndefinedData() {
    SDFG sdfg = OptTestUtil.copyProgram("p", "A", "B");
    sdfg.getState(0).addAccess("Z");
    exception.expect(InvariantViolation.class);
    exception.expectMessage("undefined data");
    Validate.validate(logger, sdfg);
  }

  @Test
  public void testUnconnectedTaskletInput() {
    SDFG sdfg = OptTestUtil.copyProgram("p", "A", "B");
    sdfg.getState(0).addTasklet("t", conns("x"), conns(), "");
    Validate.structuralValidator().check(logger, sdfg);

    exception.expect(InvariantViolation.class);
    exception.expectMessage("has 0 incoming edges");
    Validate.standardValidator().check(logger, sdfg);
  }

  @Test
  public void testStaleParent() {
    SDFG root = OptTestUtil.nestedChain();
    SDFG mid = root.sdfgById(1);
    mid.setParent(new ParentRef(0, 0, 7));
    exception.expect(InvariantViolation.class);
    exception.expectMessage("Parent of nested SDFG mid");
    Validate.validate(logger, root);
  }

  @Test
  public void testTransientConnector() {
    SDFG root = OptTestUtil.nestedChain();
    SDFG mid = root.sdfgById(1);
    mid.getArray("in").setTransient(true);
    exception.expect(InvariantViolation.class);
    exception.expectMessage("non-transient");
    Validate.validate(logger, root);
  }

  @Test
  public void testUnmatchedMap() {
    SDFG sdfg = OptTestUtil.copyProgram("p", "A", "B");
    SDFGState state = sdfg.getState(0);
    Pair<MapEntry, MapExit> map = state.addMap("m", Arrays.asList("i"),
        Subset.parse("0:10"), ScheduleType.DEFAULT);
    state.removeNode(map.val2);
    exception.expect(InvariantViolation.class);
    exception.expectMessage("exactly one entry and one exit");
    Validate.validate(logger, sdfg);
  }

  @Test
  public void testEmptyMemletOutsideScope() {
    SDFG sdfg = new SDFG("p");
    SDFGState state = sdfg.addState("s0");
    Tasklet t1 = state.addTasklet("t1", conns(), conns(), "");
    Tasklet t2 = state.addTasklet("t2", conns(), conns(), "");
    state.addEdge(t1, null, t2, null, Memlet.empty());
    exception.expect(InvariantViolation.class);
    exception.expectMessage("not touching a scope node");
    Validate.validate(logger, sdfg);
  }

  @Test
  public void testCycle() {
    SDFG sdfg = new SDFG("p");
    sdfg.addArray("A", DataType.FLOAT64, "10");
    SDFGState state = sdfg.addState("s0");
    Tasklet t = state.addTasklet("t", conns("a"), conns("b"), "b = a");
    AccessNode a = state.addAccess("A");
    state.addEdge(a, null, t, "a", Memlet.simple("A", "0:10"));
    state.addEdge(t, "b", a, null, Memlet.simple("A", "0:10"));
    exception.expect(InvariantViolation.class);
    exception.expectMessage("Cycle");
    Validate.validate(logger, sdfg);
  }
}
