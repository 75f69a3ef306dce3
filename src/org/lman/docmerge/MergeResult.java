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

import org.lman.docmerge.common.Struct;

/**
 * Return value from {@link DocumentMerger#merge}; the merged document itself is the tree that
 * was passed in.
 */
public class MergeResult extends Struct {
  public final List<String> warnings;
  public final List<ImagePlacement> images;

  public MergeResult(List<String> warnings, List<ImagePlacement> images) {
    this.warnings = warnings;
    this.images = images;
  }
}
