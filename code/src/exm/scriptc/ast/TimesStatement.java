package exm.scriptc.ast;

import exm.scriptc.common.exceptions.UserException;

/**
 * Run body a fixed number of times.  Removed by analysis.
 */
public class TimesStatement extends Statement {
  private final long count;
  private final StatementList body;

  public TimesStatement(long count, StatementList body) {
    this.count = count;
    this.body = body;
  }

  public long getCount() {
    return count;
  }

  public StatementList getBody() {
    return body;
  }

  @Override
  public <R> R accept(StatementVisitor<R> visitor) throws UserException {
    return visitor.visitTimes(this);
  }

  @Override
  public String toString() {
    return "times " + count + " " + body;
  }
}
