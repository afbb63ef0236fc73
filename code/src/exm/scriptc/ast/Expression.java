package exm.scriptc.ast;

/**
 * Base of expression nodes.  The analyzer doesn't rewrite expressions;
 * it only builds the few it needs for desugaring.
 */
public abstract class Expression {

  Expression() {
  }
}
