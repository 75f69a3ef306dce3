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

import java.util.List;

import org.lman.docmerge.context.MergeContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Evaluates template conditions against a {@link MergeContext}.
 *
 * What happens to a condition that can't be tokenized, parsed or evaluated is decided by the
 * evaluator's {@link ErrorPolicy}. Under the default, {@link ErrorPolicy#FALSE_WITH_WARNING},
 * such a condition is simply false and a warning is recorded; a malformed condition therefore
 * hides its branch rather than failing the merge.
 */
public class ExpressionEvaluator {

  private static final Logger logger = LoggerFactory.getLogger(ExpressionEvaluator.class);

  public enum ErrorPolicy {
    /** Malformed conditions are false; a warning is logged and recorded. */
    FALSE_WITH_WARNING,
    /** Malformed conditions throw {@link ExpressionException}. */
    THROW
  }

  private final ErrorPolicy errorPolicy;

  public ExpressionEvaluator(ErrorPolicy errorPolicy) {
    this.errorPolicy = errorPolicy;
  }

  public ExpressionEvaluator() {
    this(ErrorPolicy.FALSE_WITH_WARNING);
  }

  public ErrorPolicy getErrorPolicy() {
    return errorPolicy;
  }

  /**
   * Parses a condition. Always throws on malformed input, whatever the policy.
   */
  public static Expression parse(String condition) throws ExpressionException {
    return new ExpressionParser(condition).parse();
  }

  /**
   * Parses and evaluates |condition|, applying the error policy. |warnings| may be null.
   */
  public boolean evaluate(String condition, MergeContext context, List<String> warnings) {
    try {
      return parse(condition).test(context);
    } catch (ExpressionException e) {
      if (errorPolicy == ErrorPolicy.THROW)
        throw e;
      String warning = e.getMessage() + "; treating it as false";
      logger.warn(warning);
      if (warnings != null)
        warnings.add(warning);
      return false;
    }
  }
}
