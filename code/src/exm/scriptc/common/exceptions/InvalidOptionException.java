package exm.scriptc.common.exceptions;

/**
 * Bad value for one of the analyzer settings
 */
public class InvalidOptionException extends Exception {

  public InvalidOptionException(String msg) {
    super(msg);
  }

  private static final long serialVersionUID = 1L;
}
