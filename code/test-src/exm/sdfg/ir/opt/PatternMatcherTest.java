package exm.sdfg.ir.opt;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNotSame;
import static org.junit.Assert.assertSame;

import java.util.ArrayList;
import java.util.List;

import org.junit.Test;

import exm.sdfg.ir.tree.NodeKind;
import exm.sdfg.ir.tree.SDFG;
import exm.sdfg.ir.tree.SDFGState;

public class PatternMatcherTest {

  private static List<Match> all(Iterable<Match> matches) {
    List<Match> res = new ArrayList<Match>();
    for (Match m: matches) {
      res.add(m);
    }
    return res;
  }

  @Test
  public void testEdgePattern() {
    SDFG sdfg = OptTestUtil.copyProgram("p", "A", "B");
    SDFGState state = sdfg.getState(0);
    Pattern p = new Pattern();
    PatternNode acc = p.addNode(NodeKind.ACCESS);
    PatternNode t = p.addNode(NodeKind.TASKLET);
    p.addEdge(acc, t);

    List<Match> ms = all(PatternMatcher.matchState(sdfg, state, p, 0));
    assertEquals("Only the read feeds a tasklet", 1, ms.size());
    Match m = ms.get(0);
    assertEquals(state.getId(), m.stateId);
    assertEquals("A", m.node(acc).access().getData());
    assertEquals("copy", m.node(t).getLabel());
  }

  @Test
  public void testInjective() {
    SDFG sdfg = OptTestUtil.copyProgram("p", "A", "B");
    SDFGState state = sdfg.getState(0);
    Pattern p = new Pattern();
    PatternNode a1 = p.addNode(NodeKind.ACCESS);
    PatternNode a2 = p.addNode(NodeKind.ACCESS);

    List<Match> ms = all(PatternMatcher.matchState(sdfg, state, p, 0));
    assertEquals("Ordered pairs of distinct access nodes", 2, ms.size());
    for (Match m: ms) {
      assertNotSame(m.node(a1), m.node(a2));
    }
  }

  @Test
  public void testWildcardNode() {
    SDFG sdfg = OptTestUtil.copyProgram("p", "A", "B");
    List<Match> ms = all(PatternMatcher.matchState(sdfg, sdfg.getState(0),
        Pattern.singleNode(null), 0));
    assertEquals(3, ms.size());
  }

  @Test
  public void testEmptyPattern() {
    SDFG sdfg = OptTestUtil.copyProgram("p", "A", "B");
    Iterable<Match> ms = PatternMatcher.matchStateflow(sdfg,
                                                       Pattern.empty(), 0);
    assertEquals(1, all(ms).size());
    assertEquals("Restarts on each iteration", 1, all(ms).size());
    assertEquals(-1, all(ms).get(0).stateId);
  }

  @Test
  public void testStateflow() {
    SDFG sdfg = new SDFG("p");
    SDFGState s0 = sdfg.addState("s0");
    SDFGState s1 = sdfg.addState("s1");
    sdfg.addState("s2");
    sdfg.addInterstateEdge(s0, s1);

    Pattern p = new Pattern();
    PatternNode first = p.addState();
    PatternNode second = p.addState();
    p.addEdge(first, second);

    List<Match> ms = all(PatternMatcher.matchStateflow(sdfg, p, 3));
    assertEquals(1, ms.size());
    assertEquals(3, ms.get(0).patternIndex);
    assertSame(s0, ms.get(0).boundState(first));
    assertSame(s1, ms.get(0).boundState(second));
  }

  @Test
  public void testNoMatch() {
    SDFG sdfg = OptTestUtil.copyProgram("p", "A", "B");
    List<Match> ms = all(PatternMatcher.matchState(sdfg, sdfg.getState(0),
        Pattern.singleNode(NodeKind.NESTED_SDFG), 0));
    assertEquals(0, ms.size());
  }
}
