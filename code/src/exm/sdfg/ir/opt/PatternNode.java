package exm.sdfg.ir.opt;

import exm.sdfg.ir.tree.NodeKind;

/**
 * Placeholder in a pattern.  Matches a node of the given kind, or any
 * state in state-flow patterns.
 */
public class PatternNode {
  public final int index;
  /** Null to match anything */
  public final NodeKind kind;

  PatternNode(int index, NodeKind kind) {
    this.index = index;
    this.kind = kind;
  }

  public boolean matchesKind(NodeKind k) {
    return kind == null || kind == k;
  }

  @Override
  public String toString() {
    return "_" + index + (kind == null ? "" : ":" + kind);
  }
}
