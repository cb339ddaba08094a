package exm.sdfg.ir.opt;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import exm.sdfg.common.util.Pair;
import exm.sdfg.ir.tree.NodeKind;

/**
 * Abstract subgraph shape: pattern nodes plus directed edges between them
 */
public class Pattern {
  private final List<PatternNode> nodes = new ArrayList<PatternNode>();
  private final List<Pair<PatternNode, PatternNode>> edges =
                      new ArrayList<Pair<PatternNode, PatternNode>>();

  public PatternNode addNode(NodeKind kind) {
    PatternNode n = new PatternNode(nodes.size(), kind);
    nodes.add(n);
    return n;
  }

  public PatternNode addState() {
    return addNode(null);
  }

  public void addEdge(PatternNode src, PatternNode dst) {
    assert(nodes.get(src.index) == src && nodes.get(dst.index) == dst);
    edges.add(Pair.create(src, dst));
  }

  public List<PatternNode> nodes() {
    return Collections.unmodifiableList(nodes);
  }

  public List<Pair<PatternNode, PatternNode>> edges() {
    return Collections.unmodifiableList(edges);
  }

  public int size() {
    return nodes.size();
  }

  /**
   * Pattern matching a single node of a kind
   */
  public static Pattern singleNode(NodeKind kind) {
    Pattern p = new Pattern();
    p.addNode(kind);
    return p;
  }

  /**
   * Pattern with no nodes: matches the whole graph once
   */
  public static Pattern empty() {
    return new Pattern();
  }

  @Override
  public String toString() {
    return nodes + " " + edges;
  }
}
