package exm.sdfg.ir.opt;

import static exm.sdfg.ir.tree.SDFGState.conns;

import exm.sdfg.common.lang.DataType;
import exm.sdfg.common.lang.Memlet;
import exm.sdfg.ir.tree.Nodes.AccessNode;
import exm.sdfg.ir.tree.Nodes.NestedSDFGNode;
import exm.sdfg.ir.tree.Nodes.Tasklet;
import exm.sdfg.ir.tree.SDFG;
import exm.sdfg.ir.tree.SDFGState;

/**
 * Small SDFGs shared by transformation tests
 */
class OptTestUtil {

  /**
   * in -> copy -> out
   */
  static SDFG copyProgram(String name, String in, String out) {
    SDFG sdfg = new SDFG(name);
    sdfg.addArray(in, DataType.FLOAT64, "10");
    sdfg.addArray(out, DataType.FLOAT64, "10");
    SDFGState s = sdfg.addState(name + "_s0");
    AccessNode a = s.addRead(in);
    Tasklet t = s.addTasklet("copy", conns("a"), conns("b"), "b = a");
    AccessNode b = s.addWrite(out);
    s.addEdge(a, null, t, "a", Memlet.simple(in, "0:10"));
    s.addEdge(t, "b", b, null, Memlet.simple(out, "0:10"));
    return sdfg;
  }

  /**
   * New SDFG with one state: in -> nested child -> out.  The child must
   * have non-transient arrays named "in" and "out".
   */
  static SDFG wrap(String name, SDFG child, String in, String out) {
    SDFG sdfg = new SDFG(name);
    sdfg.addArray(in, DataType.FLOAT64, "10");
    sdfg.addArray(out, DataType.FLOAT64, "10");
    SDFGState s = sdfg.addState(name + "_s0");
    AccessNode a = s.addRead(in);
    AccessNode b = s.addWrite(out);
    NestedSDFGNode n = s.addNestedSDFG(child,
        child.getName(), conns("in"), conns("out"));
    s.addEdge(a, null, n, "in", Memlet.simple(in, "0:10"));
    s.addEdge(n, "out", b, null, Memlet.simple(out, "0:10"));
    return sdfg;
  }

  /**
   * root (A, B) wraps mid (in, out) wraps leaf (in, out), ids reset
   */
  static SDFG nestedChain() {
    SDFG leaf = copyProgram("leaf", "in", "out");
    SDFG mid = wrap("mid", leaf, "in", "out");
    SDFG root = wrap("root", mid, "A", "B");
    root.resetSDFGIds();
    return root;
  }
}
