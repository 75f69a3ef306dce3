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

package org.lman.docmerge;

import java.util.List;

import org.lman.docmerge.document.DocumentNode;

/**
 * Inserts images where a merge left image markers. Runs after every other stage, once per
 * section (table or paragraph) holding markers, because inserting an image restructures the
 * section's children.
 */
public interface DeferredImagePass {

  /**
   * @param section the fully expanded table, or the paragraph, holding the markers
   * @param placements the section's markers in document order, each with its resolved value
   */
  void process(DocumentNode section, List<ImagePlacement> placements);
}
