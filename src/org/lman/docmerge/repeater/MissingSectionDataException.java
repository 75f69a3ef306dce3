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

import org.lman.docmerge.MergeException;

/**
 * Thrown if a section's binding is missing, isn't a list, or is an empty list. Optional
 * sections must be guarded by a conditional.
 */
public class MissingSectionDataException extends MergeException {

  private static final long serialVersionUID = 1L;

  private final String section;

  public MissingSectionDataException(RepeaterSection section, String problem) {
    super("Section " + section.getMarker() + " has no records to repeat: " + problem);
    this.section = section.bindingName;
  }

  /** The binding name of the section, without marker syntax. */
  public String getSection() {
    return section;
  }
}
