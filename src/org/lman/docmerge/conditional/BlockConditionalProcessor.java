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

package org.lman.docmerge.conditional;

import java.util.ArrayList;
import java.util.List;

import org.lman.docmerge.context.MergeContext;
import org.lman.docmerge.document.BlockMarkers;
import org.lman.docmerge.document.DocumentNode;
import org.lman.docmerge.document.DocumentTree;
import org.lman.docmerge.document.TextCache;
import org.lman.docmerge.expr.ExpressionEvaluator;
import org.lman.docmerge.template.Tag;
import org.lman.docmerge.template.TagScanner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Resolves conditionals whose markers are paragraphs of their own, and whose branches are
 * runs of sibling nodes (tables included):
 *
 * <pre>
 *   {{IF HasDiscount}}
 *   | ... a whole table ... |
 *   {{ELSE}}
 *   No discount applies.
 *   {{/IF}}
 * </pre>
 *
 * Sections whose markers are paragraphs of their own ({{#Name}} ... {{/Name}}) are skipped:
 * the repeater resolves their conditionals once per record.
 */
public class BlockConditionalProcessor {

  private static final Logger logger = LoggerFactory.getLogger(BlockConditionalProcessor.class);

  private final ExpressionEvaluator evaluator;

  public BlockConditionalProcessor(ExpressionEvaluator evaluator) {
    this.evaluator = evaluator;
  }

  /**
   * Resolves the block conditionals among the children of |container|.
   *
   * @throws UnclosedBlockException if an opener has no closing paragraph
   */
  public void process(
      DocumentTree tree,
      DocumentNode container,
      MergeContext context,
      TextCache cache,
      List<String> warnings) {
    int i = 0;
    while (i < container.getChildCount()) {
      Tag marker = BlockMarkers.markerOf(tree, container.getChild(i), cache);
      if (marker == null) {
        i++;
      } else if (marker.isSectionOpener()) {
        // An opener with no closing paragraph is just text.
        i = Math.max(i, BlockMarkers.findSectionEnd(tree, container, i, marker, cache)) + 1;
      } else if (marker.kind == Tag.Kind.IF) {
        // The selected branch replaces the span at |i| and is scanned again for nested blocks.
        resolve(tree, container, i, marker, context, cache, warnings);
      } else {
        i++;
      }
    }
  }

  private void resolve(
      DocumentTree tree,
      DocumentNode container,
      int start,
      Tag opener,
      MergeContext context,
      TextCache cache,
      List<String> warnings) {
    // Branch markers at depth 1, then the closer.
    List<Integer> markers = new ArrayList<Integer>();
    markers.add(start);
    int end = -1;
    int depth = 1;
    for (int j = start + 1; j < container.getChildCount() && end == -1; j++) {
      DocumentNode node = container.getChild(j);
      Tag marker = BlockMarkers.markerOf(tree, node, cache);
      if (depth == 1 && marker != null) {
        if (marker.kind == Tag.Kind.ELSE_IF || marker.kind == Tag.Kind.ELSE) {
          markers.add(j);
          continue;
        }
        if (marker.kind == Tag.Kind.END_IF) {
          end = j;
          continue;
        }
      }

      for (Tag tag : TagScanner.scan(cache.getText(tree, node))) {
        if (tag.kind == Tag.Kind.IF) {
          depth++;
        } else if (tag.kind == Tag.Kind.END_IF) {
          depth--;
          if (depth == 0) {
            throw new UnclosedBlockException(
                opener.argument, "is closed inside a paragraph with other content");
          }
        }
      }
    }
    if (end == -1)
      throw new UnclosedBlockException(opener.argument);
    markers.add(end);

    ConditionalBlock<List<DocumentNode>> block = new ConditionalBlock<List<DocumentNode>>();
    for (int m = 0; m < markers.size() - 1; m++) {
      int from = markers.get(m);
      Tag marker = BlockMarkers.markerOf(tree, container.getChild(from), cache);
      List<DocumentNode> body = new ArrayList<DocumentNode>();
      for (int j = from + 1; j < markers.get(m + 1); j++)
        body.add(container.getChild(j));
      block.addBranch(marker.kind == Tag.Kind.ELSE ? null : marker.argument, body);
    }

    ConditionalBlock.Branch<List<DocumentNode>> selected =
        block.select(evaluator, context, warnings);
    logger.debug("{{IF {}}} spanning {} nodes: {}", opener.argument, end - start + 1,
        selected == null ? "removed" : "kept " + selected.content.size());

    // Remove the whole span, highest index first, then put the selected branch back.
    for (int j = end; j >= start; j--)
      container.removeChild(j);
    if (selected != null) {
      for (int k = 0; k < selected.content.size(); k++)
        container.insertChild(start + k, selected.content.get(k));
    }
  }
}
