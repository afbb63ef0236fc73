package exm.scriptc.ast;

import exm.scriptc.common.lang.Operators.BinaryOp;

public class BinaryExpression extends Expression {
  private final BinaryOp op;
  private final Expression lhs;
  private final Expression rhs;

  public BinaryExpression(BinaryOp op, Expression lhs, Expression rhs) {
    this.op = op;
    this.lhs = lhs;
    this.rhs = rhs;
  }

  public BinaryOp getOp() {
    return op;
  }

  public Expression getLhs() {
    return lhs;
  }

  public Expression getRhs() {
    return rhs;
  }

  @Override
  public String toString() {
    return "(" + lhs + " " + op.symbol() + " " + rhs + ")";
  }
}
