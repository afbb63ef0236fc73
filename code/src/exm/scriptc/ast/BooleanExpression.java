package exm.scriptc.ast;

public class BooleanExpression extends Expression {
  public static final BooleanExpression TRUE = new BooleanExpression(true);
  public static final BooleanExpression FALSE = new BooleanExpression(false);

  private final boolean value;

  private BooleanExpression(boolean value) {
    this.value = value;
  }

  public static BooleanExpression of(boolean value) {
    return value ? TRUE : FALSE;
  }

  public boolean getValue() {
    return value;
  }

  @Override
  public String toString() {
    return Boolean.toString(value);
  }
}
