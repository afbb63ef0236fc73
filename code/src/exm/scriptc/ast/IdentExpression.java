package exm.scriptc.ast;

/**
 * Unresolved name as written in the source
 */
public class IdentExpression extends Expression {
  private final String ident;

  public IdentExpression(String ident) {
    this.ident = ident;
  }

  public String getIdent() {
    return ident;
  }

  @Override
  public String toString() {
    return ident;
  }
}
