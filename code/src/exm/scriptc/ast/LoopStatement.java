package exm.scriptc.ast;

import exm.scriptc.common.exceptions.UserException;

/**
 * Unconditional repetition, only left through break or return
 */
public class LoopStatement extends Statement {
  private final StatementList body;

  public LoopStatement(StatementList body) {
    this.body = body;
  }

  public StatementList getBody() {
    return body;
  }

  @Override
  public <R> R accept(StatementVisitor<R> visitor) throws UserException {
    return visitor.visitLoop(this);
  }

  @Override
  public String toString() {
    return "loop " + body;
  }
}
