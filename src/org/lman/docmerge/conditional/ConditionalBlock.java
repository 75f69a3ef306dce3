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

package org.lman.docmerge.conditional;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import org.lman.docmerge.context.MergeContext;
import org.lman.docmerge.expr.ExpressionEvaluator;

/**
 * An IF / ELSEIF* / ELSE? chain. At most one branch is selected: the first whose condition is
 * true, or else the trailing unconditional branch.
 *
 * @param <C> what a branch holds: text for inline conditionals, nodes for block ones
 */
public class ConditionalBlock<C> {

  public static class Branch<C> {
    /** Null for ELSE. */
    public final String condition;
    public final C content;

    public Branch(String condition, C content) {
      this.condition = condition;
      this.content = content;
    }
  }

  private final List<Branch<C>> branches = new ArrayList<Branch<C>>();

  public ConditionalBlock<C> addBranch(String condition, C content) {
    branches.add(new Branch<C>(condition, content));
    return this;
  }

  public List<Branch<C>> getBranches() {
    return Collections.unmodifiableList(branches);
  }

  /**
   * Evaluates conditions in order, stopping at the first true one. Returns null if no branch
   * is selected.
   */
  public Branch<C> select(
      ExpressionEvaluator evaluator, MergeContext context, List<String> warnings) {
    for (Branch<C> branch : branches) {
      if (branch.condition == null || evaluator.evaluate(branch.condition, context, warnings))
        return branch;
    }
    return null;
  }
}
