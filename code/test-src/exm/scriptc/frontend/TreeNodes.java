package exm.scriptc.frontend;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import exm.scriptc.ast.BooleanExpression;
import exm.scriptc.ast.CommandStatement;
import exm.scriptc.ast.IdentExpression;
import exm.scriptc.ast.IfStatement;
import exm.scriptc.ast.LoopStatement;
import exm.scriptc.ast.RoutineDefinition;
import exm.scriptc.ast.Statement;
import exm.scriptc.ast.StatementList;
import exm.scriptc.ast.UntilRegion;
import exm.scriptc.ast.WhileStatement;
import exm.scriptc.common.lang.Command;
import exm.scriptc.common.lang.Selector;

/**
 * Builders and search helpers shared by the analyzer tests
 */
class TreeNodes {

  static CommandStatement cmd(String name) {
    return cmd(name, Selector.of(1));
  }

  static CommandStatement cmd(String name, Selector selector) {
    return new CommandStatement(new Command(name,
                        Collections.<String>emptyList(), selector));
  }

  static StatementList list(Statement ...stmts) {
    return StatementList.of(stmts);
  }

  static RoutineDefinition routine(String name, Statement ...body) {
    return new RoutineDefinition(new IdentExpression(name), list(body));
  }

  static IfStatement ifTrue(Statement ...body) {
    return new IfStatement(BooleanExpression.TRUE, list(body),
                           StatementList.empty());
  }

  static AnalyzedProgram analyze(Statement ...stmts) throws Exception {
    return new Analyzer(Arrays.asList(stmts))
                    .analyzeProgram();
  }

  /**
   * @return all statements of the given class under root, in pre-order
   */
  static <T extends Statement> List<T> find(Statement root, Class<T> cls) {
    List<T> res = new ArrayList<T>();
    find(root, cls, res);
    return res;
  }

  static <T extends Statement> List<T> find(AnalyzedProgram program,
                                            Class<T> cls) {
    List<T> res = new ArrayList<T>();
    for (RoutineDefinition r: program.getRoutines()) {
      find(r, cls, res);
    }
    for (Statement s: program.getStatements()) {
      find(s, cls, res);
    }
    return res;
  }

  private static <T extends Statement> void find(Statement stmt,
                                    Class<T> cls, List<T> res) {
    if (cls.isInstance(stmt)) {
      res.add(cls.cast(stmt));
    }
    if (stmt instanceof StatementList) {
      for (Statement inner: ((StatementList)stmt).getStatements()) {
        find(inner, cls, res);
      }
    } else if (stmt instanceof RoutineDefinition) {
      find(((RoutineDefinition)stmt).getBody(), cls, res);
    } else if (stmt instanceof IfStatement) {
      find(((IfStatement)stmt).getTrueBranch(), cls, res);
      find(((IfStatement)stmt).getFalseBranch(), cls, res);
    } else if (stmt instanceof LoopStatement) {
      find(((LoopStatement)stmt).getBody(), cls, res);
    } else if (stmt instanceof WhileStatement) {
      find(((WhileStatement)stmt).getBody(), cls, res);
    } else if (stmt instanceof UntilRegion) {
      find(((UntilRegion)stmt).getLoop(), cls, res);
    }
  }
}
