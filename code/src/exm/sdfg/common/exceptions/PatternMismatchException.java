package exm.sdfg.common.exceptions;

/**
 * Transformation applied to a match that is not feasible.
 */
public class PatternMismatchException extends SDFGException {

  public PatternMismatchException(String transformation, String match) {
    super("Transformation " + transformation + " cannot be applied to "
          + match);
  }

  private static final long serialVersionUID = 1L;
}
