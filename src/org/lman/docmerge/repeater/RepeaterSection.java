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

import org.lman.docmerge.document.DocumentNode;
import org.lman.docmerge.template.Tag;

/**
 * A repeating section found in a template: what it binds to, and the node it was found in
 * (a table row, the opening paragraph of a block, or null for a span of text).
 */
public class RepeaterSection {

  public enum BindingKind {
    /** {{#Name}}: a collection of the current record. */
    COLLECTION,
    /** {{@Alias}}: an external source attached to the merge context. */
    NAMED_SOURCE
  }

  public final String bindingName;
  public final BindingKind bindingKind;
  public final DocumentNode templateNode;

  public RepeaterSection(Tag opener, DocumentNode templateNode) {
    if (!opener.isSectionOpener())
      throw new IllegalArgumentException(opener + " doesn't open a section");
    this.bindingName = opener.argument;
    this.bindingKind = opener.kind == Tag.Kind.OPEN_NAMED_SECTION ?
        BindingKind.NAMED_SOURCE : BindingKind.COLLECTION;
    this.templateNode = templateNode;
  }

  public String getMarker() {
    return (bindingKind == BindingKind.NAMED_SOURCE ? "{{@" : "{{#") + bindingName + "}}";
  }

  @Override
  public String toString() {
    return getMarker();
  }
}
