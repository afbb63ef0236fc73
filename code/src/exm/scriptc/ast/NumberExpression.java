package exm.scriptc.ast;

public class NumberExpression extends Expression {
  private final long value;

  public NumberExpression(long value) {
    this.value = value;
  }

  public long getValue() {
    return value;
  }

  @Override
  public String toString() {
    return Long.toString(value);
  }
}
