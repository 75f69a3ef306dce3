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

import org.lman.docmerge.MergeException;

/**
 * Thrown if a block-level {{IF}} has no {{/IF}} paragraph among its siblings.
 */
public class UnclosedBlockException extends MergeException {

  private static final long serialVersionUID = 1L;

  private final String condition;

  public UnclosedBlockException(String condition, String problem) {
    super("{{IF " + condition + "}} " + problem);
    this.condition = condition;
  }

  public UnclosedBlockException(String condition) {
    this(condition, "has no matching {{/IF}}");
  }

  public String getCondition() {
    return condition;
  }
}
