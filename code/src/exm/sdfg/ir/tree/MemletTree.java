package exm.sdfg.ir.tree;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Tree of edges fanning out through scope nodes from a common root edge.
 * The root edge is the one touching the data end of the path.
 */
public class MemletTree {
  public final Edge edge;
  private final MemletTree parent;
  private final List<MemletTree> children = new ArrayList<MemletTree>();

  MemletTree(Edge edge, MemletTree parent) {
    this.edge = edge;
    this.parent = parent;
  }

  MemletTree addChild(Edge child) {
    MemletTree t = new MemletTree(child, this);
    children.add(t);
    return t;
  }

  public MemletTree getParent() {
    return parent;
  }

  public List<MemletTree> getChildren() {
    return Collections.unmodifiableList(children);
  }

  public MemletTree root() {
    MemletTree t = this;
    while (t.parent != null) {
      t = t.parent;
    }
    return t;
  }

  /**
   * @param includeSelf
   * @return all edges below this one, pre-order
   */
  public List<Edge> traverseChildren(boolean includeSelf) {
    List<Edge> res = new ArrayList<Edge>();
    if (includeSelf) {
      res.add(edge);
    }
    for (MemletTree child: children) {
      res.addAll(child.traverseChildren(true));
    }
    return res;
  }

  /**
   * @return leaves of the tree, i.e. edges touching compute nodes
   */
  public List<MemletTree> leaves() {
    List<MemletTree> res = new ArrayList<MemletTree>();
    if (children.isEmpty()) {
      res.add(this);
    }
    for (MemletTree child: children) {
      res.addAll(child.leaves());
    }
    return res;
  }
}
