package exm.scriptc.ast;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import org.apache.commons.lang3.StringUtils;

import exm.scriptc.common.exceptions.UserException;

public class StatementList extends Statement {
  private final List<Statement> stmts;

  public StatementList(List<? extends Statement> stmts) {
    this.stmts = Collections.unmodifiableList(
                          new ArrayList<Statement>(stmts));
  }

  public static StatementList of(Statement ...stmts) {
    return new StatementList(Arrays.asList(stmts));
  }

  public static StatementList empty() {
    return new StatementList(Collections.<Statement>emptyList());
  }

  public List<Statement> getStatements() {
    return stmts;
  }

  public boolean isEmpty() {
    return stmts.isEmpty();
  }

  /**
   * @param stmt
   * @return new list with stmt added at the end
   */
  public StatementList append(Statement stmt) {
    List<Statement> res = new ArrayList<Statement>(stmts);
    res.add(stmt);
    return new StatementList(res);
  }

  @Override
  public <R> R accept(StatementVisitor<R> visitor) throws UserException {
    return visitor.visitStatementList(this);
  }

  @Override
  public String toString() {
    if (stmts.isEmpty()) {
      return "{}";
    }
    return "{ " + StringUtils.join(stmts, "; ") + " }";
  }
}
