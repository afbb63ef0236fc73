package exm.scriptc.common.exceptions;

import exm.scriptc.common.lang.Symbol;

public class VariableUsageException extends UserException {

  private static final long serialVersionUID = 1L;

  public VariableUsageException(Symbol var, String message) {
    super(message + ": " + var);
  }

}
