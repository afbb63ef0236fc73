package exm.scriptc.common.lang;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import org.apache.commons.lang3.StringUtils;

/**
 * A primitive command as produced by the parser: a command name, its raw
 * arguments and the selector it targets.  Only the selector is looked at
 * during analysis.
 */
public class Command {
  private final String name;
  private final List<String> args;
  private final Selector selector;

  public Command(String name, List<String> args, Selector selector) {
    this.name = name;
    this.args = Collections.unmodifiableList(new ArrayList<String>(args));
    this.selector = selector;
  }

  public String getName() {
    return name;
  }

  public List<String> getArgs() {
    return args;
  }

  public Selector getSelector() {
    return selector;
  }

  @Override
  public String toString() {
    String res = selector + " " + name;
    if (!args.isEmpty()) {
      res += " " + StringUtils.join(args, ' ');
    }
    return res;
  }
}
