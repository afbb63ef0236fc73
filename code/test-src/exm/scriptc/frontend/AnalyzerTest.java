package exm.scriptc.frontend;

import static exm.scriptc.frontend.TreeNodes.analyze;
import static exm.scriptc.frontend.TreeNodes.cmd;
import static exm.scriptc.frontend.TreeNodes.find;
import static exm.scriptc.frontend.TreeNodes.ifTrue;
import static exm.scriptc.frontend.TreeNodes.list;
import static exm.scriptc.frontend.TreeNodes.routine;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import org.junit.BeforeClass;
import org.junit.Test;

import exm.scriptc.ast.BreakStatement;
import exm.scriptc.ast.CallStatement;
import exm.scriptc.ast.CommandStatement;
import exm.scriptc.ast.DefineVariable;
import exm.scriptc.ast.ExternalExpression;
import exm.scriptc.ast.IfStatement;
import exm.scriptc.ast.KillVariable;
import exm.scriptc.ast.LoopStatement;
import exm.scriptc.ast.NumberExpression;
import exm.scriptc.ast.ReturnStatement;
import exm.scriptc.ast.RoutineDefinition;
import exm.scriptc.ast.Statement;
import exm.scriptc.ast.StatementList;
import exm.scriptc.ast.SymbolExpression;
import exm.scriptc.ast.TimesStatement;
import exm.scriptc.ast.UntilRegion;
import exm.scriptc.ast.UntilStatement;
import exm.scriptc.ast.WhileStatement;
import exm.scriptc.ast.WriteVariable;
import exm.scriptc.common.Logging;
import exm.scriptc.common.exceptions.CompilerRuntimeError;
import exm.scriptc.common.exceptions.InvalidConstructException;
import exm.scriptc.common.exceptions.UndefinedRoutineException;
import exm.scriptc.common.lang.Selector;
import exm.scriptc.common.lang.Symbol;
import exm.scriptc.common.lang.Symbol.SymbolKind;

public class AnalyzerTest {

  private static final ExternalExpression COND =
                                  new ExternalExpression("health < 50");

  @BeforeClass
  public static void setupLogging() throws Exception {
    Logging.setupLogging("target/AnalyzerTest.scriptc.log", true);
  }

  private static Symbol sym(Statement call) {
    return ((SymbolExpression)((CallStatement)call).getName()).getSymbol();
  }

  @Test
  public void testRoutineHoisted() throws Exception {
    AnalyzedProgram prog = analyze(cmd("first"),
                                   routine("a", cmd("inside")),
                                   CallStatement.byName("a"));

    assertEquals("Definition removed from statements",
                 2, prog.getStatements().size());
    assertEquals(1, prog.getRoutines().size());

    RoutineDefinition def = prog.getRoutines().get(0);
    Symbol a = ((SymbolExpression)def.getName()).getSymbol();
    assertEquals("a", a.literal());
    assertEquals(SymbolKind.ROUTINE, a.kind());
    assertSame("Back reference set", def, a.defNode());
    assertEquals("Call resolved to definition", a,
                 sym(prog.getStatements().get(1)));
  }

  @Test
  public void testImplicitReturn() throws Exception {
    AnalyzedProgram prog = analyze(routine("a", cmd("inside")));
    List<Statement> body = prog.getRoutines().get(0).getBody()
                                                    .getStatements();
    assertEquals(2, body.size());
    assertTrue(body.get(0) instanceof CommandStatement);
    StatementList exit = (StatementList)body.get(1);
    assertTrue("Nothing to clean up",
               ((StatementList)exit.getStatements().get(0)).isEmpty());
    assertTrue(exit.getStatements().get(1) instanceof ReturnStatement);
  }

  @Test
  public void testNestedListElidesRoutine() throws Exception {
    AnalyzedProgram prog = analyze(list(cmd("x"), routine("a"), cmd("y")));
    StatementList top = (StatementList)prog.getStatements().get(0);
    assertEquals(2, top.getStatements().size());
    assertEquals(1, prog.getRoutines().size());
  }

  @Test(expected=UndefinedRoutineException.class)
  public void testForwardReference() throws Exception {
    analyze(CallStatement.byName("a"), routine("a"));
  }

  @Test(expected=UndefinedRoutineException.class)
  public void testForwardReferenceBetweenRoutines() throws Exception {
    analyze(routine("x", CallStatement.byName("y")), routine("y"));
  }

  @Test
  public void testRecursion() throws Exception {
    AnalyzedProgram prog = analyze(routine("a", CallStatement.byName("a")));
    RoutineDefinition def = prog.getRoutines().get(0);
    Symbol a = ((SymbolExpression)def.getName()).getSymbol();
    assertEquals(a, sym(def.getBody().getStatements().get(0)));
  }

  @Test
  public void testResolvedCallPassedThrough() throws Exception {
    Symbol s = new Symbol("ext", 1000, SymbolKind.ROUTINE);
    CallStatement call = new CallStatement(new SymbolExpression(s));
    AnalyzedProgram prog = analyze(call);
    assertSame(call, prog.getStatements().get(0));
  }

  @Test(expected=InvalidConstructException.class)
  public void testMalformedCall() throws Exception {
    analyze(new CallStatement(new NumberExpression(3)));
  }

  @Test(expected=InvalidConstructException.class)
  public void testRoutineOverResolvedName() throws Exception {
    Symbol s = new Symbol("a", 1000, SymbolKind.ROUTINE);
    analyze(new RoutineDefinition(new SymbolExpression(s),
                                  StatementList.empty()));
  }

  @Test
  public void testSameNameDisjointScopes() throws Exception {
    AnalyzedProgram prog = analyze(
        routine("outer1", routine("helper", cmd("one")),
                          CallStatement.byName("helper")),
        routine("outer2", routine("helper", cmd("two")),
                          CallStatement.byName("helper")));

    // Inner routines finish first
    List<RoutineDefinition> routines = prog.getRoutines();
    assertEquals(4, routines.size());
    Symbol helper1 = ((SymbolExpression)routines.get(0).getName())
                                                        .getSymbol();
    Symbol helper2 = ((SymbolExpression)routines.get(2).getName())
                                                        .getSymbol();
    assertEquals(helper1.literal(), helper2.literal());
    assertTrue("Distinguished by id", !helper1.equals(helper2));

    RoutineDefinition outer1 = routines.get(1);
    RoutineDefinition outer2 = routines.get(3);
    assertEquals(helper1, sym(outer1.getBody().getStatements().get(0)));
    assertEquals(helper2, sym(outer2.getBody().getStatements().get(0)));
  }

  @Test(expected=UndefinedRoutineException.class)
  public void testInnerRoutineNotVisibleOutside() throws Exception {
    analyze(routine("outer", routine("helper")),
            CallStatement.byName("helper"));
  }

  @Test
  public void testSymbolIdsIncrease() throws Exception {
    AnalyzedProgram prog = analyze(routine("a"),
                                   new TimesStatement(1, list()),
                                   routine("b"),
                                   new TimesStatement(2, list()));
    List<Long> ids = new ArrayList<Long>();
    ids.add(((SymbolExpression)prog.getRoutines().get(0).getName())
                                               .getSymbol().id());
    ids.add(find(prog.getStatements().get(0), DefineVariable.class)
                                               .get(0).getVar().id());
    ids.add(((SymbolExpression)prog.getRoutines().get(1).getName())
                                               .getSymbol().id());
    ids.add(find(prog.getStatements().get(1), DefineVariable.class)
                                               .get(0).getVar().id());
    assertEquals(Arrays.asList(0L, 1L, 2L, 3L), ids);
  }

  @Test
  public void testSymbolIdsUnique() throws Exception {
    AnalyzedProgram prog = analyze(
        routine("a", new TimesStatement(2, list(
                  ifTrue(new TimesStatement(1, list())),
                  new LoopStatement(list(new BreakStatement()))))),
        new TimesStatement(3, list(ifTrue(cmd("x")))),
        routine("b", routine("c", new TimesStatement(1, list()))));

    Set<Long> seen = new HashSet<Long>();
    int count = 0;
    for (RoutineDefinition r: prog.getRoutines()) {
      seen.add(((SymbolExpression)r.getName()).getSymbol().id());
      count++;
    }
    for (DefineVariable d: find(prog, DefineVariable.class)) {
      seen.add(d.getVar().id());
      count++;
    }
    assertEquals(7, count);
    assertEquals("No id reused", count, seen.size());
  }

  @Test(expected=InvalidConstructException.class)
  public void testReturnAtTopLevel() throws Exception {
    analyze(new ReturnStatement());
  }

  @Test(expected=InvalidConstructException.class)
  public void testReturnInTopLevelLoop() throws Exception {
    analyze(new LoopStatement(list(new ReturnStatement())));
  }

  @Test
  public void testReturnInRoutineLoop() throws Exception {
    analyze(routine("a", new LoopStatement(list(new ReturnStatement()))));
  }

  @Test(expected=InvalidConstructException.class)
  public void testBreakAtTopLevel() throws Exception {
    analyze(new BreakStatement());
  }

  @Test(expected=InvalidConstructException.class)
  public void testBreakInRoutineWithoutLoop() throws Exception {
    analyze(routine("a", new BreakStatement()));
  }

  @Test(expected=InvalidConstructException.class)
  public void testBreakInIfWithoutLoop() throws Exception {
    analyze(routine("a", ifTrue(new BreakStatement())));
  }

  @Test(expected=InvalidConstructException.class)
  public void testLoopDoesNotReachIntoRoutine() throws Exception {
    analyze(new LoopStatement(list(routine("a", new BreakStatement()))));
  }

  @Test
  public void testBreakInLoops() throws Exception {
    BreakStatement brk = new BreakStatement();
    AnalyzedProgram prog = analyze(
        new LoopStatement(list(brk)),
        new WhileStatement(COND, list(ifTrue(new BreakStatement()))),
        new UntilStatement(COND, list(new BreakStatement())),
        new TimesStatement(2, list(new BreakStatement())),
        routine("a", new LoopStatement(list(new BreakStatement()))));
    assertSame(brk, ((LoopStatement)prog.getStatements().get(0))
                                  .getBody().getStatements().get(0));
    assertEquals(5, find(prog, BreakStatement.class).size());
  }

  @Test
  public void testLoopDepthRestoredAfterRoutine() throws Exception {
    // Routine inside a loop resets loop depth, closing it restores it
    analyze(new LoopStatement(list(routine("a"), new BreakStatement())));
  }

  @Test
  public void testReturnCleanupOrder() throws Exception {
    ReturnStatement ret = new ReturnStatement();
    AnalyzedProgram prog = analyze(
        routine("r",
          new TimesStatement(1, list(
            new TimesStatement(1, list(
              new TimesStatement(1, list(
                new IfStatement(COND, list(ret), list())))))))));

    List<DefineVariable> defs = find(prog, DefineVariable.class);
    assertEquals(3, defs.size());
    Symbol v1 = defs.get(0).getVar();
    Symbol v2 = defs.get(1).getVar();
    Symbol v3 = defs.get(2).getVar();

    StatementList exit = null;
    for (StatementList l: find(prog, StatementList.class)) {
      List<Statement> s = l.getStatements();
      if (s.size() == 2 && s.get(1) == ret) {
        exit = l;
      }
    }
    assertTrue("Return rewritten", exit != null);
    List<Statement> kills = ((StatementList)exit.getStatements().get(0))
                                                      .getStatements();
    List<Symbol> killed = new ArrayList<Symbol>();
    for (Statement k: kills) {
      killed.add(((KillVariable)k).getVar());
    }
    assertEquals("Most recently activated first",
                 Arrays.asList(v3, v2, v1), killed);
  }

  @Test
  public void testReturnAfterCleanupEmitsNothing() throws Exception {
    AnalyzedProgram prog = analyze(routine("r",
        new TimesStatement(1, list()), new ReturnStatement()));
    // Counter already dead when return is reached
    assertEquals(1, find(prog, KillVariable.class).size());
  }

  @Test
  public void testSiblingBranchesIsolated() throws Exception {
    // Each arm of the if returns, cleaning up the same counter
    AnalyzedProgram prog = analyze(routine("r",
        new TimesStatement(2, list(new IfStatement(COND,
            list(new ReturnStatement()), list(new ReturnStatement()))))));
    IfStatement ifStmt = find(prog, IfStatement.class).get(0);
    Symbol counter = find(prog, DefineVariable.class).get(0).getVar();
    for (StatementList arm: Arrays.asList(ifStmt.getTrueBranch(),
                                          ifStmt.getFalseBranch())) {
      List<KillVariable> kills = find(arm, KillVariable.class);
      assertEquals(1, kills.size());
      assertEquals(counter, kills.get(0).getVar());
    }
  }

  @Test
  public void testVariableStatementsPassThrough() throws Exception {
    Symbol x = new Symbol(Symbol.variableLiteral("x"), 1000,
                          SymbolKind.VARIABLE);
    DefineVariable def = new DefineVariable(x);
    WriteVariable write = new WriteVariable(x, new NumberExpression(1));
    KillVariable kill = new KillVariable(x);
    AnalyzedProgram prog = analyze(def, write, kill);
    assertEquals(Arrays.asList(def, write, kill), prog.getStatements());
  }

  @Test
  public void testUniqueSelectors() throws Exception {
    Analyzer analyzer = new Analyzer(Arrays.asList(
        cmd("a", Selector.of(1)), cmd("b", Selector.of(1)),
        cmd("c", Selector.of(1, 2)), ifTrue(cmd("d", Selector.mass()))));
    analyzer.analyzeProgram();
    Set<Selector> selectors = analyzer.getScope().getUniqueSelectors();
    assertEquals("Selectors inside branches stay in the branch",
        new HashSet<Selector>(Arrays.asList(Selector.of(1),
                                            Selector.of(1, 2))),
        selectors);
  }

  @Test
  public void testLabelSymbol() throws Exception {
    Analyzer analyzer = new Analyzer(Arrays.<Statement>asList());
    Symbol label = analyzer.newLabelSymbol("exit");
    assertEquals(":exit", label.literal());
    assertEquals(SymbolKind.LABEL, label.kind());
    assertEquals(0, label.id());
    assertTrue(analyzer.getScope().getDeclaredSymbols().contains(label));
  }

  @Test
  public void testDumpListsRoutinesFirst() throws Exception {
    AnalyzedProgram prog = analyze(cmd("top"), routine("heal", cmd("cure")));
    String[] lines = prog.dump().split("\n");
    assertEquals(2, lines.length);
    assertEquals(prog.getRoutines().get(0).toString(), lines[0]);
    assertEquals(prog.getStatements().get(0).toString(), lines[1]);
  }

  @Test(expected=CompilerRuntimeError.class)
  public void testAnalyzerSingleUse() throws Exception {
    Analyzer analyzer = new Analyzer(Arrays.asList(cmd("a")));
    analyzer.analyzeProgram();
    analyzer.analyzeProgram();
  }

  @Test(expected=CompilerRuntimeError.class)
  public void testUntilRegionFromParser() throws Exception {
    analyze(new UntilRegion(COND, new WhileStatement(COND, list())));
  }
}
