package exm.sdfg.ir.opt;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;

import java.util.ArrayList;
import java.util.List;

import org.junit.Test;

import exm.sdfg.common.Logging;
import exm.sdfg.ir.tree.Nodes.Node;
import exm.sdfg.ir.tree.SDFG;

public class TransformationRegistryTest {

  private static <T> List<T> all(Iterable<T> it) {
    List<T> res = new ArrayList<T>();
    for (T x: it) {
      res.add(x);
    }
    return res;
  }

  @Test
  public void testNestingTransformations() {
    TransformationRegistry reg =
          TransformationRegistry.nestingTransformations();
    List<Transformation<?>> ts = reg.transformations();
    assertEquals(2, ts.size());
    assertEquals("InlineNestedSDFG", ts.get(0).getName());
    assertEquals("NestSDFG", ts.get(1).getName());
  }

  @Test
  public void testCandidatesInNestedSDFGs() {
    SDFG root = OptTestUtil.nestedChain();
    InlineNestedSDFG inline = new InlineNestedSDFG();
    List<Candidate<List<Node>>> cs =
                    all(TransformationRegistry.candidates(root, inline));
    assertEquals(2, cs.size());
    assertSame("Outermost first", root, cs.get(0).match.sdfg);
    assertEquals("mid", cs.get(1).match.sdfg.getName());
    assertSame(inline, cs.get(0).transformation);
  }

  @Test
  public void testCandidatesRestartable() {
    SDFG root = OptTestUtil.nestedChain();
    Iterable<Candidate<?>> cs =
          TransformationRegistry.nestingTransformations().candidates(root);
    // Root is only a wrapper, so only inlining applies
    assertEquals(2, all(cs).size());
    assertEquals(2, all(cs).size());
  }

  @Test
  public void testCandidatesSeeChanges() throws Exception {
    SDFG root = OptTestUtil.nestedChain();
    InlineNestedSDFG inline = new InlineNestedSDFG();
    Iterable<Candidate<List<Node>>> cs =
        TransformationRegistry.candidates(root, inline);
    cs.iterator().next().apply(Logging.getSDFGLogger());
    root.resetSDFGIds();
    List<Candidate<List<Node>>> after = all(cs);
    assertEquals(1, after.size());
    assertSame("Leaf now nested directly in root", root,
               after.get(0).match.sdfg);
  }

  @Test
  public void testNestCandidate() {
    SDFG sdfg = OptTestUtil.copyProgram("p", "A", "B");
    List<Candidate<?>> cs = all(
        TransformationRegistry.nestingTransformations().candidates(sdfg));
    assertEquals(1, cs.size());
    assertTrue(cs.get(0).transformation instanceof NestSDFG);
    assertEquals(-1, cs.get(0).match.stateId);
  }
}
