package exm.sdfg.ir.opt;

import java.util.Arrays;

import exm.sdfg.common.exceptions.SDFGRuntimeError;
import exm.sdfg.ir.tree.Nodes.Node;
import exm.sdfg.ir.tree.SDFG;
import exm.sdfg.ir.tree.SDFGState;

/**
 * Binding of a pattern's nodes to node ids in one state, or to state ids
 * for state-flow patterns
 */
public class Match {
  public final SDFG sdfg;
  /** State matched in, or -1 for state-flow matches */
  public final int stateId;
  public final int patternIndex;
  private final int[] binding;

  public Match(SDFG sdfg, int stateId, int patternIndex, int[] binding) {
    this.sdfg = sdfg;
    this.stateId = stateId;
    this.patternIndex = patternIndex;
    this.binding = binding.clone();
  }

  public SDFGState state() {
    if (stateId < 0) {
      throw new SDFGRuntimeError("State-flow match has no state: " + this);
    }
    return sdfg.getState(stateId);
  }

  public int boundId(PatternNode pn) {
    return binding[pn.index];
  }

  /**
   * @return node bound to pattern node, or null if it no longer exists
   */
  public Node node(PatternNode pn) {
    SDFGState state = state();
    return state == null ? null : state.getNode(binding[pn.index]);
  }

  public SDFGState boundState(PatternNode pn) {
    if (stateId >= 0) {
      throw new SDFGRuntimeError("Dataflow match has no bound states: "
                                 + this);
    }
    return sdfg.getState(binding[pn.index]);
  }

  @Override
  public String toString() {
    return sdfg.getName() + ":" + stateId + ":" + Arrays.toString(binding);
  }
}
