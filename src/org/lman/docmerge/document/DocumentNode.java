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

/**
 * A node of a {@link DocumentTree}. Only PARAGRAPHs hold text directly; every other kind
 * reports the text of its children joined with newlines, and a CELL can also be given new text
 * (one paragraph per line).
 *
 * Attributes and run styles are opaque: the merge engine copies them between nodes without
 * looking inside.
 */
public interface DocumentNode {

  enum Kind {
    BODY,
    PARAGRAPH,
    TABLE,
    ROW,
    CELL,
    PAGE_BREAK
  }

  Kind getKind();

  int getChildCount();

  DocumentNode getChild(int index);

  void insertChild(int index, DocumentNode child);

  DocumentNode removeChild(int index);

  String getText();

  /**
   * Sets the text of a PARAGRAPH, or replaces the paragraphs of a CELL.
   *
   * @throws UnsupportedOperationException for any other kind of node
   */
  void setText(String text);

  Object getAttributes();

  void setAttributes(Object attributes);

  /** The style of the run at character |offset| of a PARAGRAPH, or null if it has none. */
  Object getRunStyle(int offset);

  /** Applies |style| to the whole text of a PARAGRAPH. */
  void setRunStyle(Object style);
}
