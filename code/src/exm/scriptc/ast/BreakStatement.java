package exm.scriptc.ast;

import exm.scriptc.common.exceptions.UserException;

public class BreakStatement extends Statement {

  @Override
  public <R> R accept(StatementVisitor<R> visitor) throws UserException {
    return visitor.visitBreak(this);
  }

  @Override
  public String toString() {
    return "break";
  }
}
