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
 * Base of all statement nodes.  The set of statement kinds is closed:
 * every kind has a method in {@link StatementVisitor}, so a new kind
 * can't be added without every walker handling it.
 */
public abstract class Statement {

  Statement() {
  }

  public abstract <R> R accept(StatementVisitor<R> visitor)
                                        throws UserException;
}
