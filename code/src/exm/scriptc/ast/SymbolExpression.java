package exm.scriptc.ast;

import exm.scriptc.common.lang.Symbol;

/**
 * Reference to an already resolved symbol
 */
public class SymbolExpression extends Expression {
  private final Symbol sym;

  public SymbolExpression(Symbol sym) {
    this.sym = sym;
  }

  public Symbol getSymbol() {
    return sym;
  }

  @Override
  public String toString() {
    return sym.toString();
  }
}
