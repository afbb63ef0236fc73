/*
 * Copyright 2013 University of Chicago and Argonne National Laboratory
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License
 */
package exm.scriptc.frontend;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

import org.apache.log4j.Logger;

import com.google.common.collect.Lists;

import exm.scriptc.ast.BinaryExpression;
import exm.scriptc.ast.BreakStatement;
import exm.scriptc.ast.CallStatement;
import exm.scriptc.ast.CommandStatement;
import exm.scriptc.ast.DefineVariable;
import exm.scriptc.ast.Expression;
import exm.scriptc.ast.IdentExpression;
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
import exm.scriptc.common.Logging;
import exm.scriptc.common.Settings;
import exm.scriptc.common.exceptions.CompilerRuntimeError;
import exm.scriptc.common.exceptions.InvalidConstructException;
import exm.scriptc.common.exceptions.InvalidOptionException;
import exm.scriptc.common.exceptions.UserException;
import exm.scriptc.common.exceptions.VariableUsageException;
import exm.scriptc.common.lang.Operators.BinaryOp;
import exm.scriptc.common.lang.Symbol;
import exm.scriptc.common.lang.Symbol.SymbolKind;

/**
 * This class walks the parsed statement tree once.
 * It resolves routine calls, tracks variable lifetimes and lowers
 * times and until loops to while loops as it goes.
 *
 * Visiting a statement returns its replacement, or null if the
 * statement was hoisted out (routine definitions).
 *
 * An analyzer instance handles exactly one program.
 */
public class Analyzer implements StatementVisitor<Statement> {

  private final Logger logger;

  private final List<Statement> stmts;

  /** Base name of counter variables for times loops */
  private final String counterName;

  /** Whether to log the analyzed tree when done */
  private final boolean dumpTree;

  private Scope scope = Scope.root();

  private long nextSymbolId = 0;

  private final List<RoutineDefinition> routines =
                              new ArrayList<RoutineDefinition>();

  /** Number of routine bodies we're inside */
  private int routineDepth = 0;

  /** Number of loops we're inside, within the current routine body */
  private int loopDepth = 0;

  /** Loop depth of enclosing routine bodies */
  private final Deque<Integer> loopDepthStack = new ArrayDeque<Integer>();

  private boolean analyzed = false;

  /**
   * @param stmts top-level statements from the parser
   * @throws InvalidOptionException if an analyzer setting is invalid
   */
  public Analyzer(List<? extends Statement> stmts)
                                    throws InvalidOptionException {
    this.logger = Logging.setupLogging();
    this.stmts = new ArrayList<Statement>(stmts);
    this.counterName = Settings.getIdentifier(Settings.COUNTER_NAME);
    this.dumpTree = Settings.getBoolean(Settings.DUMP_TREE);
  }

  /**
   * Analyze the whole program.  Either succeeds completely or throws.
   * @return rewritten statements and hoisted routines
   * @throws UserException
   */
  public AnalyzedProgram analyzeProgram() throws UserException {
    if (analyzed) {
      throw new CompilerRuntimeError("Analyzer already used for a program");
    }
    analyzed = true;

    logger.debug("Analyzing " + stmts.size() + " top-level statements");
    List<Statement> res = new ArrayList<Statement>();
    for (Statement stmt: stmts) {
      Statement analyzedStmt = stmt.accept(this);
      if (analyzedStmt != null) {
        res.add(analyzedStmt);
      }
    }

    if (scope.getParent() != null || routineDepth != 0 || loopDepth != 0) {
      throw new CompilerRuntimeError("Unbalanced scopes after analysis: " +
                                      scope);
    }

    AnalyzedProgram program = new AnalyzedProgram(res, routines);
    logger.debug("Analysis done: " + program);
    if (dumpTree && LogHelper.isDebugEnabled()) {
      logger.debug("Analyzed program:\n" + program.dump());
    }
    return program;
  }

  /**
   * @return the current scope, the root scope once analysis is done
   */
  public Scope getScope() {
    return scope;
  }

  private void openBlock() {
    scope = scope.newBlock();

    // Loops don't continue into a routine body
    loopDepthStack.push(loopDepth);
    loopDepth = 0;
    routineDepth++;
  }

  private void closeBlock() {
    popScope();
    loopDepth = loopDepthStack.pop();
    routineDepth--;
  }

  private void openLoop() {
    scope = scope.newBranch();
    loopDepth++;
  }

  private void closeLoop() {
    popScope();
    loopDepth--;
  }

  private void openBranch() {
    scope = scope.newBranch();
  }

  private void closeBranch() {
    popScope();
  }

  private void popScope() {
    Scope parent = scope.getParent();
    if (parent == null) {
      throw new CompilerRuntimeError("Tried to leave the root scope");
    }
    scope = parent;
  }

  private long newSymbolId() {
    return nextSymbolId++;
  }

  private Symbol newRoutineSymbol(String name) {
    return scope.declare(new Symbol(name, newSymbolId(),
                                    SymbolKind.ROUTINE));
  }

  private Symbol newVariableSymbol(String name) {
    return scope.declare(new Symbol(Symbol.variableLiteral(name),
                                    newSymbolId(), SymbolKind.VARIABLE));
  }

  /**
   * Declare a label in the current scope
   * @param name
   * @return
   */
  public Symbol newLabelSymbol(String name) {
    return scope.declare(new Symbol(Symbol.labelLiteral(name),
                                    newSymbolId(), SymbolKind.LABEL));
  }

  /**
   * Declare an anonymous variable in the current scope and make it live
   * @return
   * @throws VariableUsageException
   */
  private Symbol defineVariable() throws VariableUsageException {
    Symbol var = newVariableSymbol(counterName);
    scope.activate(var);
    return var;
  }

  /**
   * Kill every live variable, most recently activated first
   * @return kill statements in the order they must run
   * @throws VariableUsageException
   */
  private StatementList cleanupAllVars() throws VariableUsageException {
    List<Statement> res = new ArrayList<Statement>();
    List<Symbol> active = new ArrayList<Symbol>(scope.getActiveVars());
    for (Symbol var: Lists.reverse(active)) {
      scope.kill(var);
      res.add(new KillVariable(var));
    }
    return new StatementList(res);
  }

  private Expression analyzeExpr(Expression expr) {
    // Expressions are left to the execution engine
    return expr;
  }

  private StatementList analyzeList(StatementList list)
                                          throws UserException {
    List<Statement> res = new ArrayList<Statement>();
    for (Statement inner: list.getStatements()) {
      Statement analyzedStmt = inner.accept(this);
      if (analyzedStmt != null) {
        res.add(analyzedStmt);
      }
    }
    return new StatementList(res);
  }

  @Override
  public Statement visitRoutineDefinition(RoutineDefinition stmt)
                                                  throws UserException {
    if (!(stmt.getName() instanceof IdentExpression)) {
      throw new InvalidConstructException(stmt, "Only a plain name is " +
                                 "allowed when defining a routine");
    }
    String name = ((IdentExpression)stmt.getName()).getIdent();
    // Declare before walking body so that routine can call itself
    Symbol sym = newRoutineSymbol(name);
    LogHelper.debug(scope, "routine " + sym + " start");

    // Every routine needs an exit point, even if the author left it out
    StatementList body = stmt.getBody().append(new ReturnStatement());

    openBlock();
    StatementList analyzedBody = analyzeList(body);
    closeBlock();

    RoutineDefinition def = new RoutineDefinition(new SymbolExpression(sym),
                                                  analyzedBody);
    sym.setDefNode(def);
    routines.add(def);
    LogHelper.debug(scope, "routine " + sym + " done");
    return null;
  }

  @Override
  public Statement visitStatementList(StatementList stmt)
                                          throws UserException {
    return analyzeList(stmt);
  }

  @Override
  public Statement visitCall(CallStatement stmt) throws UserException {
    Expression name = stmt.getName();
    if (name instanceof SymbolExpression) {
      return stmt;
    } else if (name instanceof IdentExpression) {
      Symbol sym = scope.lookupRoutine(((IdentExpression)name).getIdent());
      LogHelper.trace(scope, "call resolved to " + sym);
      return new CallStatement(new SymbolExpression(sym));
    } else {
      throw new InvalidConstructException(stmt, "Malformed call");
    }
  }

  @Override
  public Statement visitCommand(CommandStatement stmt) {
    scope.addSelector(stmt.getCommand().getSelector());
    return stmt;
  }

  @Override
  public Statement visitIf(IfStatement stmt) throws UserException {
    LogHelper.trace(scope, "if...");
    Expression cond = analyzeExpr(stmt.getCondition());

    // Each arm gets its own copy of the live variables
    openBranch();
    StatementList trueBranch = analyzeList(stmt.getTrueBranch());
    closeBranch();

    openBranch();
    StatementList falseBranch = analyzeList(stmt.getFalseBranch());
    closeBranch();

    return new IfStatement(cond, trueBranch, falseBranch);
  }

  @Override
  public Statement visitLoop(LoopStatement stmt) throws UserException {
    openLoop();
    StatementList body = analyzeList(stmt.getBody());
    closeLoop();
    return new LoopStatement(body);
  }

  @Override
  public Statement visitWhile(WhileStatement stmt) throws UserException {
    Expression cond = analyzeExpr(stmt.getCondition());
    openLoop();
    StatementList body = analyzeList(stmt.getBody());
    closeLoop();
    return new WhileStatement(cond, body);
  }

  /**
   * until guard { body } becomes
   * if guard {} else { until-region(guard) while not guard { body } }.
   * The same guard node is used in both places.
   */
  @Override
  public Statement visitUntil(UntilStatement stmt) throws UserException {
    openLoop();
    Expression guard = analyzeExpr(stmt.getGuard());
    StatementList body = analyzeList(stmt.getBody());
    closeLoop();

    WhileStatement loop = new WhileStatement(UnaryExpression.not(guard),
                                             body);
    LogHelper.trace(scope, "until lowered to " + loop);
    return new IfStatement(guard, StatementList.empty(),
                           StatementList.of(new UntilRegion(guard, loop)));
  }

  @Override
  public Statement visitUntilRegion(UntilRegion stmt) {
    throw new CompilerRuntimeError("Unexpected statement type, until " +
        "regions are only created by analysis: " + stmt);
  }

  /**
   * times N { body } becomes
   * defvar v; v = N; while v > 0 { body; v = v - 1 }; killvar v
   */
  @Override
  public Statement visitTimes(TimesStatement stmt) throws UserException {
    if (stmt.getCount() < 0) {
      Logging.uniqueWarn("times loop with negative count " +
                         stmt.getCount() + " never runs: " + stmt);
    }
    Symbol var = defineVariable();

    List<Statement> res = new ArrayList<Statement>();
    res.add(new DefineVariable(var));
    res.add(new WriteVariable(var, new NumberExpression(stmt.getCount())));

    Expression cond = new BinaryExpression(BinaryOp.GREATER,
        new ReadVariableExpression(var), new NumberExpression(0));
    StatementList body = stmt.getBody().append(new WriteVariable(var,
        new BinaryExpression(BinaryOp.MINUS,
            new ReadVariableExpression(var), new NumberExpression(1))));
    res.add(visitWhile(new WhileStatement(cond, body)));

    res.add(new KillVariable(var));
    scope.kill(var);
    return new StatementList(res);
  }

  @Override
  public Statement visitReturn(ReturnStatement stmt) throws UserException {
    if (routineDepth <= 0) {
      throw new InvalidConstructException(stmt,
                            "Return used outside of a routine");
    }
    return StatementList.of(cleanupAllVars(), stmt);
  }

  @Override
  public Statement visitBreak(BreakStatement stmt) throws UserException {
    if (loopDepth <= 0) {
      throw new InvalidConstructException(stmt,
                            "Break used outside of a loop");
    }
    return stmt;
  }

  @Override
  public Statement visitDefineVariable(DefineVariable stmt) {
    return stmt;
  }

  @Override
  public Statement visitWriteVariable(WriteVariable stmt) {
    return stmt;
  }

  @Override
  public Statement visitKillVariable(KillVariable stmt) {
    return stmt;
  }
}
