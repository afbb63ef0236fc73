package exm.scriptc.ast;

import exm.scriptc.common.exceptions.UserException;

/**
 * Repeat body until guard becomes true.  The guard is checked before
 * every iteration, so the body may run zero times.
 * Removed by analysis.
 */
public class UntilStatement extends Statement {
  private final Expression guard;
  private final StatementList body;

  public UntilStatement(Expression guard, StatementList body) {
    this.guard = guard;
    this.body = body;
  }

  public Expression getGuard() {
    return guard;
  }

  public StatementList getBody() {
    return body;
  }

  @Override
  public <R> R accept(StatementVisitor<R> visitor) throws UserException {
    return visitor.visitUntil(this);
  }

  @Override
  public String toString() {
    return "until " + guard + " " + body;
  }
}
