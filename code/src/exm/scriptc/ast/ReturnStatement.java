package exm.scriptc.ast;

import exm.scriptc.common.exceptions.UserException;

public class ReturnStatement extends Statement {

  @Override
  public <R> R accept(StatementVisitor<R> visitor) throws UserException {
    return visitor.visitReturn(this);
  }

  @Override
  public String toString() {
    return "return";
  }
}
