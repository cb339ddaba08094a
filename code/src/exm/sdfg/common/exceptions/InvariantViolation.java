package exm.sdfg.common.exceptions;

/**
 * A structural invariant of the IR does not hold, e.g. an unbalanced scope
 * after a transformation.  Code generation assumes a well-formed graph,
 * so this must never be caught and ignored.
 */
public class InvariantViolation extends SDFGRuntimeError {

  public InvariantViolation(String msg) {
    super(msg);
  }

  private static final long serialVersionUID = 1L;
}
