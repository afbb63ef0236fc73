package exm.scriptc.frontend;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import exm.scriptc.ast.BinaryExpression;
import exm.scriptc.ast.BooleanExpression;
import exm.scriptc.ast.BreakStatement;
import exm.scriptc.ast.CallStatement;
import exm.scriptc.ast.CommandStatement;
import exm.scriptc.ast.DefineVariable;
import exm.scriptc.ast.Expression;
import exm.scriptc.ast.IfStatement;
import exm.scriptc.ast.KillVariable;
import exm.scriptc.ast.LoopStatement;
import exm.scriptc.ast.NumberExpression;
import exm.scriptc.ast.ReadVariableExpression;
import exm.scriptc.ast.ReturnStatement;
import exm.scriptc.ast.RoutineDefinition;
import exm.scriptc.ast.Statement;
import exm.scriptc.ast.StatementList;
import exm.scriptc.ast.StatementVisitor;
import exm.scriptc.ast.SymbolExpression;
import exm.scriptc.ast.TimesStatement;
import exm.scriptc.ast.UnaryExpression;
import exm.scriptc.ast.UntilRegion;
import exm.scriptc.ast.UntilStatement;
import exm.scriptc.ast.WhileStatement;
import exm.scriptc.ast.WriteVariable;
import exm.scriptc.common.exceptions.UserException;
import exm.scriptc.common.lang.Symbol;

/**
 * Minimal executor for analyzed trees, so tests can check what lowered
 * loops actually do.  Only understands the primitive statements left
 * after analysis.
 */
class TreeInterpreter implements StatementVisitor<Void> {

  private static class BreakSignal extends RuntimeException {
    private static final long serialVersionUID = 1L;
  }

  private static class ReturnSignal extends RuntimeException {
    private static final long serialVersionUID = 1L;
  }

  private final Map<Symbol, Long> vars = new HashMap<Symbol, Long>();
  private final List<String> commands = new ArrayList<String>();
  private final List<Symbol> killed = new ArrayList<Symbol>();

  /** Guard against lowering bugs that never terminate */
  private static final int MAX_ITERATIONS = 10000;

  void run(AnalyzedProgram program) throws UserException {
    for (Statement stmt: program.getStatements()) {
      stmt.accept(this);
    }
  }

  List<String> getCommands() {
    return commands;
  }

  List<Symbol> getKilled() {
    return killed;
  }

  boolean isDefined(Symbol var) {
    return vars.containsKey(var);
  }

  long eval(Expression expr) {
    if (expr instanceof NumberExpression) {
      return ((NumberExpression)expr).getValue();
    } else if (expr instanceof BooleanExpression) {
      return ((BooleanExpression)expr).getValue() ? 1 : 0;
    } else if (expr instanceof ReadVariableExpression) {
      Symbol var = ((ReadVariableExpression)expr).getVar();
      Long val = vars.get(var);
      if (val == null) {
        throw new IllegalStateException("Read of undefined " + var);
      }
      return val;
    } else if (expr instanceof UnaryExpression) {
      UnaryExpression u = (UnaryExpression)expr;
      long v = eval(u.getOperand());
      switch (u.getOp()) {
        case NOT:
          return v == 0 ? 1 : 0;
        case NEGATE:
          return -v;
      }
    } else if (expr instanceof BinaryExpression) {
      BinaryExpression b = (BinaryExpression)expr;
      long l = eval(b.getLhs());
      long r = eval(b.getRhs());
      switch (b.getOp()) {
        case PLUS:
          return l + r;
        case MINUS:
          return l - r;
        case GREATER:
          return l > r ? 1 : 0;
        case GREATER_EQ:
          return l >= r ? 1 : 0;
        case LESS:
          return l < r ? 1 : 0;
        case EQUALS:
          return l == r ? 1 : 0;
      }
    }
    throw new IllegalArgumentException("Can't evaluate " + expr);
  }

  private void loop(Expression cond, StatementList body)
                                          throws UserException {
    int iters = 0;
    try {
      while (cond == null || eval(cond) != 0) {
        if (++iters > MAX_ITERATIONS) {
          throw new IllegalStateException("Loop didn't terminate");
        }
        body.accept(this);
      }
    } catch (BreakSignal e) {
      // loop left early
    }
  }

  @Override
  public Void visitRoutineDefinition(RoutineDefinition stmt) {
    throw new IllegalStateException("Routine left in tree: " + stmt);
  }

  @Override
  public Void visitStatementList(StatementList stmt) throws UserException {
    for (Statement inner: stmt.getStatements()) {
      inner.accept(this);
    }
    return null;
  }

  @Override
  public Void visitCall(CallStatement stmt) throws UserException {
    Symbol sym = ((SymbolExpression)stmt.getName()).getSymbol();
    try {
      sym.defNode().getBody().accept(this);
    } catch (ReturnSignal e) {
      // routine done
    }
    return null;
  }

  @Override
  public Void visitCommand(CommandStatement stmt) {
    commands.add(stmt.getCommand().getName());
    return null;
  }

  @Override
  public Void visitIf(IfStatement stmt) throws UserException {
    if (eval(stmt.getCondition()) != 0) {
      stmt.getTrueBranch().accept(this);
    } else {
      stmt.getFalseBranch().accept(this);
    }
    return null;
  }

  @Override
  public Void visitLoop(LoopStatement stmt) throws UserException {
    loop(null, stmt.getBody());
    return null;
  }

  @Override
  public Void visitWhile(WhileStatement stmt) throws UserException {
    loop(stmt.getCondition(), stmt.getBody());
    return null;
  }

  @Override
  public Void visitUntil(UntilStatement stmt) {
    throw new IllegalStateException("until left in tree: " + stmt);
  }

  @Override
  public Void visitUntilRegion(UntilRegion stmt) throws UserException {
    return stmt.getLoop().accept(this);
  }

  @Override
  public Void visitTimes(TimesStatement stmt) {
    throw new IllegalStateException("times left in tree: " + stmt);
  }

  @Override
  public Void visitReturn(ReturnStatement stmt) {
    throw new ReturnSignal();
  }

  @Override
  public Void visitBreak(BreakStatement stmt) {
    throw new BreakSignal();
  }

  @Override
  public Void visitDefineVariable(DefineVariable stmt) {
    vars.put(stmt.getVar(), 0L);
    return null;
  }

  @Override
  public Void visitWriteVariable(WriteVariable stmt) {
    if (!vars.containsKey(stmt.getVar())) {
      throw new IllegalStateException("Write to undefined " + stmt.getVar());
    }
    vars.put(stmt.getVar(), eval(stmt.getValue()));
    return null;
  }

  @Override
  public Void visitKillVariable(KillVariable stmt) {
    if (vars.remove(stmt.getVar()) == null) {
      throw new IllegalStateException("Kill of undefined " + stmt.getVar());
    }
    killed.add(stmt.getVar());
    return null;
  }
}
