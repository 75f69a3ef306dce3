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

import java.util.List;

import org.lman.docmerge.context.MergeContext;
import org.lman.docmerge.json.JsonView;
import org.lman.docmerge.json.JsonViews;

/**
 * Finds the records a section repeats over: an array-valued member of the current record
 * first (child collections), then an array anywhere in the merge context (named sources and
 * top-level collections).
 */
public class SectionBinder {

  /**
   * @throws MissingSectionDataException unless the binding is a non-empty list
   */
  public List<JsonView> bind(RepeaterSection section, MergeContext context) {
    JsonView binding = null;

    JsonView own = context.resolveOnRecord(section.bindingName);
    if (JsonViews.isArray(own))
      binding = own;

    if (binding == null) {
      JsonView fromContext = context.resolve(section.bindingName);
      if (fromContext == null || fromContext.isNull())
        throw new MissingSectionDataException(section, "'" + section.bindingName + "' is missing");
      if (!JsonViews.isArray(fromContext)) {
        throw new MissingSectionDataException(section,
            "'" + section.bindingName + "' is a " + fromContext.getType() + ", not a list");
      }
      binding = fromContext;
    }

    List<JsonView> records = JsonViews.toList(binding);
    if (records.isEmpty())
      throw new MissingSectionDataException(section, "'" + section.bindingName + "' is empty");
    return records;
  }
}
