package exm.sdfg.ir.opt;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNotNull;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.util.Collections;

import org.apache.log4j.Logger;
import org.junit.After;
import org.junit.Test;

import exm.sdfg.common.Logging;
import exm.sdfg.common.Settings;
import exm.sdfg.ir.tree.NodeKind;
import exm.sdfg.ir.tree.Nodes.Node;
import exm.sdfg.ir.tree.SDFG;
import exm.sdfg.ir.tree.SDFGState;
import exm.sdfg.sourcemap.InMemoryLineInfoSource;
import exm.sdfg.sourcemap.LineInfo;

public class TransformationPipelineTest {

  private static final Logger logger = Logging.getSDFGLogger();

  @After
  public void resetSettings() {
    Settings.reset(Settings.OPT_INLINE_NESTED);
    Settings.reset(Settings.OPT_NEST_SDFG);
    Settings.reset(Settings.OPT_MAX_ITERATIONS);
  }

  private static TransformationPipeline pipeline(PrintStream out,
                                   InMemoryLineInfoSource lineInfo) {
    TransformationPipeline p = new TransformationPipeline(out, lineInfo);
    p.addAll(TransformationRegistry.nestingTransformations());
    return p;
  }

  private static int countKind(SDFGState state, NodeKind kind) {
    int count = 0;
    for (Node n: state.nodes()) {
      if (n.kind == kind) {
        count++;
      }
    }
    return count;
  }

  @Test
  public void testInlineAll() {
    SDFG root = OptTestUtil.nestedChain();
    int applied = pipeline(null, null).run(logger, root);
    assertEquals(2, applied);

    assertEquals(1, root.allSDFGsRecursive().size());
    SDFGState state = root.getState(0);
    assertEquals(3, state.numNodes());
    assertEquals(1, countKind(state, NodeKind.TASKLET));
    assertEquals(0, countKind(state, NodeKind.NESTED_SDFG));
  }

  @Test
  public void testDisabled() {
    Settings.set(Settings.OPT_INLINE_NESTED, "false");
    SDFG root = OptTestUtil.nestedChain();
    String before = root.toString();
    TransformationPipeline p = pipeline(null, null);
    assertFalse(p.transformationEnabled(new InlineNestedSDFG()));
    assertEquals(0, p.run(logger, root));
    assertEquals(before, root.toString());
  }

  @Test
  public void testZeroIterations() {
    Settings.set(Settings.OPT_MAX_ITERATIONS, "0");
    SDFG root = OptTestUtil.nestedChain();
    assertEquals(0, pipeline(null, null).run(logger, root));
    assertEquals(3, root.allSDFGsRecursive().size());
  }

  @Test
  public void testIterationLimit() {
    Settings.set(Settings.OPT_MAX_ITERATIONS, "1");
    SDFG root = OptTestUtil.nestedChain();
    assertEquals("One application per transformation per iteration",
                 1, pipeline(null, null).run(logger, root));
    assertEquals(2, root.allSDFGsRecursive().size());
  }

  @Test
  public void testLineInfoCleared() {
    InMemoryLineInfoSource lineInfo = new InMemoryLineInfoSource();
    LineInfo info = new LineInfo(3, 4, "prog.py",
                                 Collections.<String>emptyList());
    lineInfo.put("root", info);
    lineInfo.put("unrelated", info);

    SDFG root = OptTestUtil.nestedChain();
    pipeline(null, lineInfo).run(logger, root);
    assertNull("Record used by transformation is discarded",
               lineInfo.lookup("root"));
    assertNotNull(lineInfo.lookup("unrelated"));
    assertNull("Line info not left attached", root.getLineInfo());
  }

  @Test
  public void testNestLogged() {
    Settings.set(Settings.OPT_INLINE_NESTED, "false");
    Settings.set(Settings.OPT_NEST_SDFG, "true");
    ByteArrayOutputStream bytes = new ByteArrayOutputStream();
    SDFG sdfg = OptTestUtil.copyProgram("prog", "A", "B");

    int applied = pipeline(new PrintStream(bytes), null).run(logger, sdfg);
    assertEquals("Nesting is not repeated", 1, applied);
    String out = bytes.toString();
    assertTrue(out, out.contains("Iteration 0 SDFG after NestSDFG"));
    assertEquals(2, sdfg.allSDFGsRecursive().size());
  }

  @Test
  public void testNestAndInlineCycle() {
    Settings.set(Settings.OPT_NEST_SDFG, "true");
    Settings.set(Settings.OPT_MAX_ITERATIONS, "3");
    SDFG sdfg = OptTestUtil.copyProgram("prog", "A", "B");
    // Nest in first iteration, then inline and nest again in each
    assertEquals(5, pipeline(null, null).run(logger, sdfg));
    assertEquals(2, sdfg.allSDFGsRecursive().size());
  }
}
