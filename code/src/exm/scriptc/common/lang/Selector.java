package exm.scriptc.common.lang;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import org.apache.commons.lang3.StringUtils;

/**
 * Target of a primitive command.  Opaque to the analyzer apart from
 * equality: scopes record the distinct selectors they see.
 */
public class Selector {
  private final List<Integer> targets;
  private final boolean mass;
  private final boolean inverted;

  public Selector(List<Integer> targets, boolean mass, boolean inverted) {
    List<Integer> sorted = new ArrayList<Integer>(targets);
    Collections.sort(sorted);
    this.targets = Collections.unmodifiableList(sorted);
    this.mass = mass;
    this.inverted = inverted;
  }

  public static Selector of(Integer ...targets) {
    List<Integer> l = new ArrayList<Integer>();
    Collections.addAll(l, targets);
    return new Selector(l, false, false);
  }

  public static Selector mass() {
    return new Selector(Collections.<Integer>emptyList(), true, false);
  }

  public List<Integer> targets() {
    return targets;
  }

  public boolean isMass() {
    return mass;
  }

  public boolean isInverted() {
    return inverted;
  }

  @Override
  public int hashCode() {
    final int prime = 31;
    int result = 1;
    result = prime * result + targets.hashCode();
    result = prime * result + (mass ? 1231 : 1237);
    result = prime * result + (inverted ? 1231 : 1237);
    return result;
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj)
      return true;
    if (obj == null || getClass() != obj.getClass())
      return false;
    Selector other = (Selector) obj;
    return mass == other.mass && inverted == other.inverted &&
           targets.equals(other.targets);
  }

  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder();
    if (inverted) {
      sb.append("except ");
    }
    if (mass) {
      sb.append("mass");
    } else {
      sb.append("p").append(StringUtils.join(targets, ":p"));
    }
    return sb.toString();
  }
}
