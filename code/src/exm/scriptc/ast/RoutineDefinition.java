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
package exm.scriptc.ast;

import exm.scriptc.common.exceptions.UserException;

/**
 * Definition of a named routine.  Before analysis the name is an
 * {@link IdentExpression}; the analyzer produces a copy named by a
 * {@link SymbolExpression} and hoists it out of the statement sequence.
 */
public class RoutineDefinition extends Statement {
  private final Expression name;
  private final StatementList body;

  public RoutineDefinition(Expression name, StatementList body) {
    this.name = name;
    this.body = body;
  }

  public Expression getName() {
    return name;
  }

  public StatementList getBody() {
    return body;
  }

  @Override
  public <R> R accept(StatementVisitor<R> visitor) throws UserException {
    return visitor.visitRoutineDefinition(this);
  }

  @Override
  public String toString() {
    return "block " + name + " " + body;
  }
}
