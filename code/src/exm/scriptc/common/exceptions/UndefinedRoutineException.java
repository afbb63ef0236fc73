package exm.scriptc.common.exceptions;

public class UndefinedRoutineException
extends UserException
{
  public UndefinedRoutineException(String msg)
  {
    super(msg);
  }

  public static UndefinedRoutineException unknownRoutine(String name) {
    return new UndefinedRoutineException("Unable to find routine in scope: "
                                          + name);
  }

  private static final long serialVersionUID = 1L;
}
