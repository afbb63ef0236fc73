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

import java.util.List;

import com.google.common.collect.ImmutableList;

import exm.scriptc.ast.RoutineDefinition;
import exm.scriptc.ast.Statement;

/**
 * Output of analysis: the top-level statements with all routine
 * definitions hoisted out, and the routine definitions themselves in
 * the order they were analyzed.
 */
public class AnalyzedProgram {
  private final ImmutableList<Statement> statements;
  private final ImmutableList<RoutineDefinition> routines;

  public AnalyzedProgram(List<Statement> statements,
                         List<RoutineDefinition> routines) {
    this.statements = ImmutableList.copyOf(statements);
    this.routines = ImmutableList.copyOf(routines);
  }

  public ImmutableList<Statement> getStatements() {
    return statements;
  }

  public ImmutableList<RoutineDefinition> getRoutines() {
    return routines;
  }

  /**
   * @return routines, then top-level statements, one per line
   */
  public String dump() {
    StringBuilder sb = new StringBuilder();
    for (RoutineDefinition routine: routines) {
      sb.append(routine).append('\n');
    }
    for (Statement stmt: statements) {
      sb.append(stmt).append('\n');
    }
    return sb.toString();
  }

  @Override
  public String toString() {
    return "AnalyzedProgram: " + routines.size() + " routines, " +
           statements.size() + " statements";
  }
}
