
package exm.sdfg.common.exceptions;

/**
 * This represents an internal error in the IR or a transformation.
 * These always indicate a compiler bug (or missing feature).
 * */
public class SDFGRuntimeError extends RuntimeException
{
  public SDFGRuntimeError(String msg)
  {
    super(msg);
  }

  private static final long serialVersionUID = 1L;
}
