package exm.scriptc.ast;

import exm.scriptc.common.lang.Symbol;

public class ReadVariableExpression extends Expression {
  private final SymbolExpression var;

  public ReadVariableExpression(SymbolExpression var) {
    this.var = var;
  }

  public ReadVariableExpression(Symbol var) {
    this(new SymbolExpression(var));
  }

  public Symbol getVar() {
    return var.getSymbol();
  }

  @Override
  public String toString() {
    return "readvar " + var;
  }
}
