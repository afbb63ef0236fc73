package exm.scriptc.ast;

import exm.scriptc.common.lang.Operators.UnaryOp;

public class UnaryExpression extends Expression {
  private final UnaryOp op;
  private final Expression operand;

  public UnaryExpression(UnaryOp op, Expression operand) {
    this.op = op;
    this.operand = operand;
  }

  public static UnaryExpression not(Expression operand) {
    return new UnaryExpression(UnaryOp.NOT, operand);
  }

  public UnaryOp getOp() {
    return op;
  }

  public Expression getOperand() {
    return operand;
  }

  @Override
  public String toString() {
    return "(" + op.symbol() + " " + operand + ")";
  }
}
