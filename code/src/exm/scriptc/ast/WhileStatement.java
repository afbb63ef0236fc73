package exm.scriptc.ast;

import exm.scriptc.common.exceptions.UserException;

public class WhileStatement extends Statement {
  private final Expression condition;
  private final StatementList body;

  public WhileStatement(Expression condition, StatementList body) {
    this.condition = condition;
    this.body = body;
  }

  public Expression getCondition() {
    return condition;
  }

  public StatementList getBody() {
    return body;
  }

  @Override
  public <R> R accept(StatementVisitor<R> visitor) throws UserException {
    return visitor.visitWhile(this);
  }

  @Override
  public String toString() {
    return "while " + condition + " " + body;
  }
}
