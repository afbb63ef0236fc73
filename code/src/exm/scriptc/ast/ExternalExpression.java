package exm.scriptc.ast;

/**
 * Expression the parser produced that has no meaning to the analyzer,
 * e.g. a query evaluated by the execution engine.  Kept as source text.
 */
public class ExternalExpression extends Expression {
  private final String text;

  public ExternalExpression(String text) {
    this.text = text;
  }

  public String getText() {
    return text;
  }

  @Override
  public String toString() {
    return text;
  }
}
