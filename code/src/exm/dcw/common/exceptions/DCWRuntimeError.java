package exm.dcw.common.exceptions;

/**
 * This represents a writer internal error.
 * These always indicate a malformed source model (a variant
 * without a rendering rule) or a bug in the writer itself.
 * Rendering the same tree again fails the same way.
 * */
public class DCWRuntimeError extends RuntimeException
{
  public DCWRuntimeError(String msg)
  {
    super(msg);
  }

  private static final long serialVersionUID = 1L;
}
