package exm.scriptc.ast;

import exm.scriptc.common.exceptions.UserException;
import exm.scriptc.common.lang.Command;

public class CommandStatement extends Statement {
  private final Command command;

  public CommandStatement(Command command) {
    this.command = command;
  }

  public Command getCommand() {
    return command;
  }

  @Override
  public <R> R accept(StatementVisitor<R> visitor) throws UserException {
    return visitor.visitCommand(this);
  }

  @Override
  public String toString() {
    return command.toString();
  }
}
