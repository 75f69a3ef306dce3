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

package org.lman.docmerge.repeater;

import org.lman.docmerge.MergeState;
import org.lman.docmerge.context.MergeContext;
import org.lman.docmerge.document.DocumentNode;
import org.lman.docmerge.document.DocumentTree;

/**
 * Runs the whole merge pipeline over the children of a container. Block sections use it to
 * merge each replayed copy of their body in the record's context.
 */
public interface ContainerMerger {
  void mergeContainer(
      DocumentTree tree, DocumentNode container, MergeContext context, MergeState state);
}
