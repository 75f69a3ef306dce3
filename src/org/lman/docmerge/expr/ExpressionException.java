// Copyright 2012 Benjamin Kalman
//
// Licensed under the Apache License, Version 2.0 (the "License");
// you may not use this file except in compliance with the License.
// You may obtain a copy of the License at
//
//     http://www.apache.org/licenses/LICENSE-2.0
//
// Unless required by applicable law or agreed to in writing, software
// distributed under the License is distributed on an "AS IS" BASIS,
// WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
// See the License for the specific language governing permissions and
// limitations under the License.

package org.lman.docmerge.expr;

import org.lman.docmerge.MergeException;

/**
 * Thrown if a condition can't be tokenized, parsed or evaluated.
 */
public class ExpressionException extends MergeException {

  private static final long serialVersionUID = 1L;

  private final String expression;

  public ExpressionException(String error, String expression) {
    super(error + " in condition '" + expression + "'");
    this.expression = expression;
  }

  /** The condition text exactly as written in the template. */
  public String getExpression() {
    return expression;
  }
}
