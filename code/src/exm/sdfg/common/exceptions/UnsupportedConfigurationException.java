package exm.sdfg.common.exceptions;

/**
 * A candidate matched structurally, but the transformation can't handle
 * this configuration.  The graph is left unmodified.
 */
public class UnsupportedConfigurationException extends SDFGException {

  public UnsupportedConfigurationException(String message) {
    super(message);
  }

  private static final long serialVersionUID = 1L;
}
