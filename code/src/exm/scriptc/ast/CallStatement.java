package exm.scriptc.ast;

import exm.scriptc.common.exceptions.UserException;

public class CallStatement extends Statement {
  private final Expression name;

  public CallStatement(Expression name) {
    this.name = name;
  }

  public static CallStatement byName(String name) {
    return new CallStatement(new IdentExpression(name));
  }

  /**
   * @return IdentExpression before analysis, SymbolExpression after
   */
  public Expression getName() {
    return name;
  }

  @Override
  public <R> R accept(StatementVisitor<R> visitor) throws UserException {
    return visitor.visitCall(this);
  }

  @Override
  public String toString() {
    return "call " + name;
  }
}
