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

/**
 * Operators of unary and binary expressions in conditions and counter
 * updates.  The parser may use any of them; loop lowering only builds
 * NOT, GREATER and MINUS.  Operators outside this set reach the
 * analyzer as external expressions.
 */
public class Operators {

  public static enum UnaryOp {
    NOT("not"),
    NEGATE("-");

    private final String symbol;

    private UnaryOp(String symbol) {
      this.symbol = symbol;
    }

    public String symbol() {
      return symbol;
    }
  }

  public static enum BinaryOp {
    PLUS("+"),
    MINUS("-"),
    GREATER(">"),
    GREATER_EQ(">="),
    LESS("<"),
    EQUALS("==");

    private final String symbol;

    private BinaryOp(String symbol) {
      this.symbol = symbol;
    }

    public String symbol() {
      return symbol;
    }
  }
}
