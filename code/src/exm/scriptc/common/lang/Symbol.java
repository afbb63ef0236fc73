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
package exm.scriptc.common.lang;

import exm.scriptc.ast.RoutineDefinition;
import exm.scriptc.common.exceptions.CompilerRuntimeError;

/**
 * Identity of a named or anonymous program entity.
 *
 * Two symbols are the same entity iff they have the same id: routines
 * with the same literal in different scopes are distinct symbols.
 */
public class Symbol {

  /** Prefix/suffix that cannot appear in a user identifier */
  public static final String SYNTHETIC_MARKER = ":";

  public static enum SymbolKind {
    ROUTINE,
    VARIABLE,
    LABEL,
  }

  private final String literal;
  private final long id;
  private final SymbolKind kind;

  /** Definition of routine, only set for routines */
  private RoutineDefinition defNode = null;

  public Symbol(String literal, long id, SymbolKind kind) {
    this.literal = literal;
    this.id = id;
    this.kind = kind;
  }

  public static String variableLiteral(String name) {
    return SYNTHETIC_MARKER + name + SYNTHETIC_MARKER;
  }

  public static String labelLiteral(String name) {
    return SYNTHETIC_MARKER + name;
  }

  public String literal() {
    return literal;
  }

  public long id() {
    return id;
  }

  public SymbolKind kind() {
    return kind;
  }

  public RoutineDefinition defNode() {
    return defNode;
  }

  /**
   * Link routine symbol to its definition.  Can only be done once.
   * @param def
   */
  public void setDefNode(RoutineDefinition def) {
    if (kind != SymbolKind.ROUTINE) {
      throw new CompilerRuntimeError("Only routine symbols have a " +
                                     "definition: " + this);
    }
    if (defNode != null) {
      throw new CompilerRuntimeError("Definition already set for " + this);
    }
    this.defNode = def;
  }

  @Override
  public int hashCode() {
    return Long.hashCode(id);
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj)
      return true;
    if (obj == null || !(obj instanceof Symbol)) {
      return false;
    }
    return id == ((Symbol)obj).id;
  }

  @Override
  public String toString() {
    return literal + "<" + kind.toString().toLowerCase() + "#" + id + ">";
  }
}
