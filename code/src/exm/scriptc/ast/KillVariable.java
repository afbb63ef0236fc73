package exm.scriptc.ast;

import exm.scriptc.common.exceptions.UserException;
import exm.scriptc.common.lang.Symbol;

public class KillVariable extends Statement {
  private final Symbol var;

  public KillVariable(Symbol var) {
    this.var = var;
  }

  public Symbol getVar() {
    return var;
  }

  @Override
  public <R> R accept(StatementVisitor<R> visitor) throws UserException {
    return visitor.visitKillVariable(this);
  }

  @Override
  public String toString() {
    return "killvar " + var;
  }
}
