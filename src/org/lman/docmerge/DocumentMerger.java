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
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;

import org.lman.docmerge.conditional.BlockConditionalProcessor;
import org.lman.docmerge.conditional.InlineConditionalProcessor;
import org.lman.docmerge.context.MergeContext;
import org.lman.docmerge.document.DocumentNode;
import org.lman.docmerge.document.DocumentTree;
import org.lman.docmerge.document.TextCache;
import org.lman.docmerge.expr.ExpressionEvaluator;
import org.lman.docmerge.field.FieldResolver;
import org.lman.docmerge.field.ValueFormatter;
import org.lman.docmerge.repeater.ContainerMerger;
import org.lman.docmerge.repeater.RepeaterEngine;
import org.lman.docmerge.repeater.SectionBinder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Merges a template document with data. The stages always run in this order:
 *
 * <ol>
 *   <li>block conditionals (so a conditional can guard a section with no data),
 *   <li>repeating sections,
 *   <li>inline conditionals, outside replayed content,
 *   <li>fields, outside replayed content,
 *   <li>the {@link DeferredImagePass}, if one is set.
 * </ol>
 *
 * Any {@link MergeException} other than a recovered condition error aborts the merge. A merger
 * keeps a {@link TextCache}, so it must not be used by several threads at once.
 */
public class DocumentMerger implements ContainerMerger {

  private static final Logger logger = LoggerFactory.getLogger(DocumentMerger.class);

  private abstract static class TextRewriter {
    abstract String rewrite(String text, DocumentNode section);
  }

  private final MergeOptions options;
  private final BlockConditionalProcessor blockConditionals;
  private final InlineConditionalProcessor inlineConditionals;
  private final FieldResolver fields;
  private final RepeaterEngine repeaters;
  private final TextCache cache = new TextCache();

  private DeferredImagePass imagePass = null;

  public DocumentMerger(MergeOptions options) {
    this.options = options;
    ExpressionEvaluator evaluator = new ExpressionEvaluator(options.expressionErrorPolicy);
    this.blockConditionals = new BlockConditionalProcessor(evaluator);
    this.inlineConditionals =
        new InlineConditionalProcessor(evaluator, options.maxConditionalIterations);
    this.fields = new FieldResolver(new ValueFormatter(options));
    this.repeaters = new RepeaterEngine(
        new SectionBinder(),
        fields,
        inlineConditionals,
        this,
        options.oversizedSectionThreshold);
  }

  public DocumentMerger() {
    this(new MergeOptions());
  }

  public DocumentMerger setImagePass(DeferredImagePass imagePass) {
    this.imagePass = imagePass;
    return this;
  }

  public MergeOptions getOptions() {
    return options;
  }

  /**
   * Merges |tree| with |context|. The body is merged as a copy and swapped in once every stage
   * has succeeded, so a failed merge leaves the tree as it was.
   *
   * @throws MergeException if the merge fails
   */
  public MergeResult merge(DocumentTree tree, MergeContext context) {
    cache.clear();
    MergeState state = new MergeState(tree, cache);
    logger.debug("Merging document {}", tree.getId());
    DocumentNode copy = tree.copy(tree.getBody());
    mergeContainer(tree, copy, context, state);

    List<DocumentNode> merged = new ArrayList<DocumentNode>();
    while (copy.getChildCount() > 0)
      merged.add(copy.removeChild(0));
    replaceBody(tree, merged);

    runImagePass(state);
    return state.getResult();
  }

  /**
   * Merges the body of |tree| once per context, replacing it with the merged copies separated
   * by page breaks. Either every copy merges or the tree is left as it was.
   */
  public MergeResult mergeAll(DocumentTree tree, List<MergeContext> contexts) {
    if (contexts.isEmpty())
      throw new IllegalArgumentException("Nothing to merge " + tree.getId() + " with");

    cache.clear();
    MergeState state = new MergeState(tree, cache);
    DocumentNode body = tree.getBody();

    List<DocumentNode> merged = new ArrayList<DocumentNode>();
    for (int k = 0; k < contexts.size(); k++) {
      logger.debug("Merging document {}, copy {} of {}", tree.getId(), k + 1, contexts.size());
      DocumentNode copy = tree.copy(body);
      mergeContainer(tree, copy, contexts.get(k), state);
      if (k > 0)
        merged.add(tree.createNode(DocumentNode.Kind.PAGE_BREAK));
      while (copy.getChildCount() > 0)
        merged.add(copy.removeChild(0));
    }
    replaceBody(tree, merged);

    runImagePass(state);
    return state.getResult();
  }

  private void replaceBody(DocumentTree tree, List<DocumentNode> children) {
    DocumentNode body = tree.getBody();
    while (body.getChildCount() > 0)
      body.removeChild(body.getChildCount() - 1);
    for (int i = 0; i < children.size(); i++)
      body.insertChild(i, children.get(i));
    cache.invalidate(tree);
  }

  @Override
  public void mergeContainer(
      DocumentTree tree, DocumentNode container, MergeContext context, final MergeState state) {
    blockConditionals.process(tree, container, context, state.cache, state.warnings);
    state.cache.invalidate(tree);

    repeaters.expand(tree, container, context, state);
    state.cache.invalidate(tree);

    final MergeContext outer = context;
    rewriteText(container, state, new TextRewriter() {
      @Override
      String rewrite(String text, DocumentNode section) {
        return inlineConditionals.process(text, outer, state.warnings);
      }
    });
    rewriteText(container, state, new TextRewriter() {
      @Override
      String rewrite(String text, DocumentNode section) {
        return fields.substitute(
            text, outer, repeaters.imageCollector(section, state), state.warnings);
      }
    });
    state.cache.invalidate(tree);
  }

  /** Applies |rewriter| to every paragraph and table cell not produced by a repeater. */
  private static void rewriteText(
      DocumentNode container, MergeState state, TextRewriter rewriter) {
    for (int i = 0; i < container.getChildCount(); i++) {
      DocumentNode node = container.getChild(i);
      if (state.isExpanded(node))
        continue;
      if (node.getKind() == DocumentNode.Kind.PARAGRAPH) {
        rewrite(node, node, rewriter);
      } else if (node.getKind() == DocumentNode.Kind.TABLE) {
        for (int r = 0; r < node.getChildCount(); r++) {
          DocumentNode row = node.getChild(r);
          if (state.isExpanded(row))
            continue;
          for (int c = 0; c < row.getChildCount(); c++)
            rewrite(row.getChild(c), node, rewriter);
        }
      }
    }
  }

  private static void rewrite(DocumentNode node, DocumentNode section, TextRewriter rewriter) {
    String text = node.getText();
    String rewritten = rewriter.rewrite(text, section);
    if (!rewritten.equals(text))
      node.setText(rewritten);
  }

  private void runImagePass(MergeState state) {
    if (imagePass == null || state.getImages().isEmpty())
      return;

    // Sections in the order their first marker was met.
    List<DocumentNode> sections = new ArrayList<DocumentNode>();
    Map<DocumentNode, List<ImagePlacement>> bySection =
        new IdentityHashMap<DocumentNode, List<ImagePlacement>>();
    for (ImagePlacement image : state.getImages()) {
      List<ImagePlacement> placements = bySection.get(image.section);
      if (placements == null) {
        placements = new ArrayList<ImagePlacement>();
        bySection.put(image.section, placements);
        sections.add(image.section);
      }
      placements.add(image);
    }
    for (DocumentNode section : sections)
      imagePass.process(section, bySection.get(section));
  }
}
