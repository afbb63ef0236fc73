package exm.scriptc.ast;

import exm.scriptc.common.exceptions.UserException;

public class IfStatement extends Statement {
  private final Expression condition;
  private final StatementList trueBranch;
  private final StatementList falseBranch;

  public IfStatement(Expression condition, StatementList trueBranch,
                     StatementList falseBranch) {
    this.condition = condition;
    this.trueBranch = trueBranch;
    this.falseBranch = falseBranch;
  }

  public Expression getCondition() {
    return condition;
  }

  public StatementList getTrueBranch() {
    return trueBranch;
  }

  public StatementList getFalseBranch() {
    return falseBranch;
  }

  @Override
  public <R> R accept(StatementVisitor<R> visitor) throws UserException {
    return visitor.visitIf(this);
  }

  @Override
  public String toString() {
    return "if " + condition + " " + trueBranch + " else " + falseBranch;
  }
}
