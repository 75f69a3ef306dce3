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

import java.util.HashMap;
import java.util.IdentityHashMap;
import java.util.Map;

/**
 * Memoizes node text per document. Nodes are keyed by identity, documents by
 * {@link DocumentTree#getId}. Whoever mutates a tree must {@link #invalidate} it afterwards.
 */
public class TextCache {

  private final Map<String, Map<DocumentNode, String>> texts =
      new HashMap<String, Map<DocumentNode, String>>();

  public String getText(DocumentTree tree, DocumentNode node) {
    Map<DocumentNode, String> forTree = texts.get(tree.getId());
    if (forTree == null) {
      forTree = new IdentityHashMap<DocumentNode, String>();
      texts.put(tree.getId(), forTree);
    }
    String text = forTree.get(node);
    if (text == null) {
      text = node.getText();
      forTree.put(node, text);
    }
    return text;
  }

  public void invalidate(DocumentTree tree) {
    texts.remove(tree.getId());
  }

  public void clear() {
    texts.clear();
  }

  int size(DocumentTree tree) {
    Map<DocumentNode, String> forTree = texts.get(tree.getId());
    return forTree == null ? 0 : forTree.size();
  }
}
