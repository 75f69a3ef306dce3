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

import org.lman.docmerge.common.Struct;
import org.lman.docmerge.common.Transient;
import org.lman.docmerge.document.DocumentNode;
import org.lman.docmerge.field.FieldSpec;
import org.lman.docmerge.json.JsonView;

/**
 * An image marker left in place by the merge, with the value its field resolved to.
 */
public class ImagePlacement extends Struct {

  /** The expanded table, or the paragraph, that holds the marker. */
  @Transient
  public final DocumentNode section;
  /** The marker text exactly as it appears in the section, e.g. "{{Logo:image}}". */
  public final String marker;
  public final FieldSpec spec;
  public final JsonView value;

  public ImagePlacement(DocumentNode section, String marker, FieldSpec spec, JsonView value) {
    this.section = section;
    this.marker = marker;
    this.spec = spec;
    this.value = value;
  }
}
