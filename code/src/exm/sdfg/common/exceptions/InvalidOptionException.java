package exm.sdfg.common.exceptions;

public class InvalidOptionException extends SDFGException {

  public InvalidOptionException(String message) {
    super(message);
  }

  private static final long serialVersionUID = 1L;
}
