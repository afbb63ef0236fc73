package exm.scriptc.common.exceptions;

/**
 * This represents an analyzer internal error.
 * These always indicate an analyzer bug, or a tree handed over by the
 * parser that breaks its contract with the analyzer.
 * */
public class CompilerRuntimeError extends RuntimeException
{
  public CompilerRuntimeError(String msg)
  {
    super(msg);
  }

  public CompilerRuntimeError(String msg, Throwable cause)
  {
    super(msg, cause);
  }

  private static final long serialVersionUID = 1L;
}
