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
 * One method per statement kind.
 * @param <R> result of visiting a statement
 */
public interface StatementVisitor<R> {
  R visitRoutineDefinition(RoutineDefinition stmt) throws UserException;
  R visitStatementList(StatementList stmt) throws UserException;
  R visitCall(CallStatement stmt) throws UserException;
  R visitCommand(CommandStatement stmt) throws UserException;
  R visitIf(IfStatement stmt) throws UserException;
  R visitLoop(LoopStatement stmt) throws UserException;
  R visitWhile(WhileStatement stmt) throws UserException;
  R visitUntil(UntilStatement stmt) throws UserException;
  R visitUntilRegion(UntilRegion stmt) throws UserException;
  R visitTimes(TimesStatement stmt) throws UserException;
  R visitReturn(ReturnStatement stmt) throws UserException;
  R visitBreak(BreakStatement stmt) throws UserException;
  R visitDefineVariable(DefineVariable stmt) throws UserException;
  R visitWriteVariable(WriteVariable stmt) throws UserException;
  R visitKillVariable(KillVariable stmt) throws UserException;
}
