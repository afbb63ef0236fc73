package exm.scriptc.ast;

import exm.scriptc.common.exceptions.UserException;
import exm.scriptc.common.lang.Symbol;

public class WriteVariable extends Statement {
  private final Symbol var;
  private final Expression value;

  public WriteVariable(Symbol var, Expression value) {
    this.var = var;
    this.value = value;
  }

  public Symbol getVar() {
    return var;
  }

  public Expression getValue() {
    return value;
  }

  @Override
  public <R> R accept(StatementVisitor<R> visitor) throws UserException {
    return visitor.visitWriteVariable(this);
  }

  @Override
  public String toString() {
    return "writevar " + var + " = " + value;
  }
}
