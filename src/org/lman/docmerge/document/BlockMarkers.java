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

package org.lman.docmerge.document;

import org.lman.docmerge.template.Tag;
import org.lman.docmerge.template.TagScanner;

/**
 * Helpers for block-level markers: paragraphs whose whole text is a single tag.
 */
public class BlockMarkers {

  private BlockMarkers() {}

  /** The tag |node| consists of, or null if it isn't a paragraph holding just one tag. */
  public static Tag markerOf(DocumentTree tree, DocumentNode node, TextCache cache) {
    if (node.getKind() != DocumentNode.Kind.PARAGRAPH)
      return null;
    return TagScanner.wholeTag(cache.getText(tree, node));
  }

  /**
   * The index of the child of |container| closing the section opened by the block marker
   * |opener| at |start|, counting nested sections of the same name. -1 if there is none.
   */
  public static int findSectionEnd(
      DocumentTree tree, DocumentNode container, int start, Tag opener, TextCache cache) {
    int depth = 1;
    for (int j = start + 1; j < container.getChildCount(); j++) {
      Tag marker = markerOf(tree, container.getChild(j), cache);
      if (marker == null)
        continue;
      if (marker.kind == opener.kind && marker.argument.equals(opener.argument)) {
        depth++;
      } else if (marker.closes(opener)) {
        depth--;
        if (depth == 0)
          return j;
      }
    }
    return -1;
  }
}
