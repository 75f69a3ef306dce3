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

import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Set;

import org.lman.docmerge.document.DocumentNode;
import org.lman.docmerge.document.DocumentTree;
import org.lman.docmerge.document.TextCache;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * The state of one {@link DocumentMerger#merge} call.
 */
public class MergeState {

  private static final Logger logger = LoggerFactory.getLogger(MergeState.class);

  public final DocumentTree tree;
  public final TextCache cache;
  public final List<String> warnings = new ArrayList<String>();

  // Nodes produced by a repeater, already fully merged.
  private final Set<DocumentNode> expanded =
      Collections.newSetFromMap(new IdentityHashMap<DocumentNode, Boolean>());
  private final List<ImagePlacement> images = new ArrayList<ImagePlacement>();

  public MergeState(DocumentTree tree, TextCache cache) {
    this.tree = tree;
    this.cache = cache;
  }

  public MergeState addWarning(Object... messages) {
    StringBuilder buf = new StringBuilder();
    for (Object message : messages)
      buf.append(message);
    logger.warn(buf.toString());
    warnings.add(buf.toString());
    return this;
  }

  public void markExpanded(DocumentNode node) {
    expanded.add(node);
  }

  public boolean isExpanded(DocumentNode node) {
    return expanded.contains(node);
  }

  public void addImage(ImagePlacement image) {
    images.add(image);
  }

  public List<ImagePlacement> getImages() {
    return images;
  }

  public MergeResult getResult() {
    return new MergeResult(warnings, images);
  }
}
