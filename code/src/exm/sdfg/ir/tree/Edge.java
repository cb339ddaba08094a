package exm.sdfg.ir.tree;

import exm.sdfg.common.lang.Memlet;
import exm.sdfg.ir.tree.Nodes.Node;

/**
 * Dataflow edge between two connectors.  Edges have identity semantics:
 * two edges with the same endpoints and memlet are still distinct.
 */
public class Edge {
  public final Node src;
  /** Source connector, or null */
  public final String srcConn;
  public final Node dst;
  /** Destination connector, or null */
  public final String dstConn;
  private Memlet memlet;

  public Edge(Node src, String srcConn, Node dst, String dstConn,
              Memlet memlet) {
    assert(src != null && dst != null && memlet != null);
    this.src = src;
    this.srcConn = srcConn;
    this.dst = dst;
    this.dstConn = dstConn;
    this.memlet = memlet;
  }

  public Memlet getMemlet() {
    return memlet;
  }

  public void setMemlet(Memlet memlet) {
    assert(memlet != null);
    this.memlet = memlet;
  }

  @Override
  public String toString() {
    return src.getLabel() + (srcConn == null ? "" : "." + srcConn) + " -> "
         + dst.getLabel() + (dstConn == null ? "" : "." + dstConn)
         + " : " + memlet;
  }
}
