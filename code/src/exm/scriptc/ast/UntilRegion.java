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
 * Marks the loop an until statement was lowered to, so the execution
 * engine can still tell it apart from a user-written while loop.
 * Only created by the analyzer, never by the parser.
 */
public class UntilRegion extends Statement {
  private final Expression guard;
  private final WhileStatement loop;

  public UntilRegion(Expression guard, WhileStatement loop) {
    this.guard = guard;
    this.loop = loop;
  }

  /**
   * @return the until guard as written, not the negated loop condition
   */
  public Expression getGuard() {
    return guard;
  }

  public WhileStatement getLoop() {
    return loop;
  }

  @Override
  public <R> R accept(StatementVisitor<R> visitor) throws UserException {
    return visitor.visitUntilRegion(this);
  }

  @Override
  public String toString() {
    return "until-region(" + guard + ") " + loop;
  }
}
