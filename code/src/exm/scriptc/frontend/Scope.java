/*
 * Copyright 2013 University of Chicago and Argonne National Laboratory
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License
 */

package exm.scriptc.frontend;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

import com.google.common.collect.ArrayListMultimap;
import com.google.common.collect.ListMultimap;

import exm.scriptc.common.exceptions.UndefinedRoutineException;
import exm.scriptc.common.exceptions.VariableUsageException;
import exm.scriptc.common.lang.Selector;
import exm.scriptc.common.lang.Symbol;
import exm.scriptc.common.lang.Symbol.SymbolKind;

/**
 * Track symbols and live variables at a point in the tree.  New child
 * scopes are created for routine bodies (blocks) and for conditional
 * arms and loop bodies (branches).
 *
 * A block is a hard boundary: variables declared outside it can't be
 * killed from inside, since we have no notion of a moved variable.
 * A branch starts with a copy of its parent's live variables; killing
 * one in the branch leaves the parent and sibling branches untouched.
 */
public class Scope {

  public static final int ROOT_LEVEL = 0;

  /** null for the root scope */
  private final Scope parent;

  /**
   * How many levels from root: 0 if this is the root
   */
  private final int level;

  private final boolean isBlock;

  /** Symbols declared directly in this scope, in declaration order */
  private final List<Symbol> symbols = new ArrayList<Symbol>();

  /** Routine symbols by literal, in declaration order */
  private final ListMultimap<String, Symbol> routines =
                                          ArrayListMultimap.create();

  /** Distinct command targets seen in this scope */
  private final Set<Selector> uniqueSelectors =
                                          new LinkedHashSet<Selector>();

  /** Live variables, in activation order */
  private final List<Symbol> activeVars;

  /**
   * Variables killed in this scope.  If all branches agree on a cleanup,
   * the same variables must not be cleaned up again.
   */
  private final Set<Symbol> cleanedVars = new HashSet<Symbol>();

  private Scope(Scope parent, boolean isBlock, List<Symbol> activeVars) {
    this.parent = parent;
    this.level = parent == null ? ROOT_LEVEL : parent.level + 1;
    this.isBlock = isBlock;
    this.activeVars = activeVars;
  }

  /**
   * Scope for top-level code
   * @return
   */
  public static Scope root() {
    return new Scope(null, true, new ArrayList<Symbol>());
  }

  public Scope newBlock() {
    return new Scope(this, true, new ArrayList<Symbol>());
  }

  public Scope newBranch() {
    // Variables may still be active in the parent or other branches
    return new Scope(this, false, new ArrayList<Symbol>(activeVars));
  }

  public Scope getParent() {
    return parent;
  }

  public int getLevel() {
    return level;
  }

  public boolean isBlock() {
    return isBlock;
  }

  public Symbol declare(Symbol sym) {
    symbols.add(sym);
    if (sym.kind() == SymbolKind.ROUTINE) {
      routines.put(sym.literal(), sym);
    }
    return sym;
  }

  /**
   * @return the symbols which were declared in this scope
   */
  public List<Symbol> getDeclaredSymbols() {
    return Collections.unmodifiableList(symbols);
  }

  /**
   * Lookup routine by name, innermost scope first.  Only routines
   * declared before this point are visible.
   * @param literal
   * @return the routine symbol
   * @throws UndefinedRoutineException if not found
   */
  public Symbol lookupRoutine(String literal)
      throws UndefinedRoutineException {
    Scope cur = this;
    while (cur != null) {
      List<Symbol> matches = cur.routines.get(literal);
      if (!matches.isEmpty()) {
        // Latest definition wins
        return matches.get(matches.size() - 1);
      }
      cur = cur.parent;
    }
    throw UndefinedRoutineException.unknownRoutine(literal);
  }

  /**
   * @param sym
   * @return true if sym is declared in this scope, or an ancestor
   *          reachable without leaving the enclosing block
   */
  public boolean isLocal(Symbol sym) {
    Scope cur = this;
    while (cur != null) {
      if (cur.symbols.contains(sym)) {
        return true;
      } else if (cur.isBlock) {
        // must be checked after symbols
        break;
      }
      cur = cur.parent;
    }
    return false;
  }

  public void activate(Symbol var) throws VariableUsageException {
    if (activeVars.contains(var)) {
      throw new VariableUsageException(var,
          "Attempted to activate an already active variable");
    }
    activeVars.add(var);
  }

  public void kill(Symbol var) throws VariableUsageException {
    if (!isLocal(var)) {
      throw new VariableUsageException(var,
          "Attempted to kill a variable that isn't local to the " +
          "current block");
    }
    if (!activeVars.contains(var)) {
      throw new VariableUsageException(var,
          "Attempted to kill an inactive variable");
    }
    cleanedVars.add(var);
    activeVars.remove(var);
  }

  public boolean isActive(Symbol var) {
    return activeVars.contains(var);
  }

  /**
   * @return live variables in activation order
   */
  public List<Symbol> getActiveVars() {
    return Collections.unmodifiableList(activeVars);
  }

  public Set<Symbol> getCleanedVars() {
    return Collections.unmodifiableSet(cleanedVars);
  }

  public void addSelector(Selector selector) {
    uniqueSelectors.add(selector);
  }

  public Set<Selector> getUniqueSelectors() {
    return Collections.unmodifiableSet(uniqueSelectors);
  }

  @Override
  public String toString() {
    return (isBlock ? "block" : "branch") + "@" + level + " " +
           "declared=" + symbols + " active=" + activeVars;
  }
}
