package exm.sdfg.ir.tree;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Control-flow transition between two states of an SDFG
 */
public class InterstateEdge {
  public final SDFGState src;
  public final SDFGState dst;
  /** Condition as an opaque expression, "1" if unconditional */
  private String condition;
  /** Symbol assignments performed on the transition */
  private final Map<String, String> assignments;

  public InterstateEdge(SDFGState src, SDFGState dst, String condition,
                        Map<String, String> assignments) {
    this.src = src;
    this.dst = dst;
    this.condition = condition == null ? "1" : condition;
    this.assignments = new LinkedHashMap<String, String>();
    if (assignments != null) {
      this.assignments.putAll(assignments);
    }
  }

  public String getCondition() {
    return condition;
  }

  public void setCondition(String condition) {
    this.condition = condition;
  }

  public boolean isUnconditional() {
    return "1".equals(condition.trim()) || "true".equals(condition.trim());
  }

  public Map<String, String> getAssignments() {
    return assignments;
  }

  @Override
  public String toString() {
    return src.getLabel() + " -> " + dst.getLabel() +
          (isUnconditional() ? "" : " if " + condition) +
          (assignments.isEmpty() ? "" : " " + assignments);
  }
}
