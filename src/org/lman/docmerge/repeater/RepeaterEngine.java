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

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.lman.docmerge.ImagePlacement;
import org.lman.docmerge.MergeState;
import org.lman.docmerge.conditional.InlineConditionalProcessor;
import org.lman.docmerge.context.MergeContext;
import org.lman.docmerge.document.BlockMarkers;
import org.lman.docmerge.document.DocumentNode;
import org.lman.docmerge.document.DocumentTree;
import org.lman.docmerge.field.FieldResolver;
import org.lman.docmerge.field.FieldResolver.ImageVisitor;
import org.lman.docmerge.field.FieldSpec;
import org.lman.docmerge.json.JsonView;
import org.lman.docmerge.template.Tag;
import org.lman.docmerge.template.TagScanner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Expands repeating sections, replaying their template once per bound record. Sections come in
 * three shapes:
 *
 * <ul>
 *   <li>Table rows: the first row holding a {{#Name}} or {{@Alias}} opener is the template;
 *       record 0 is written into it and records 1..N-1 into new rows inserted after it.
 *   <li>Blocks: an opener paragraph and its closer paragraph delimit a run of sibling nodes,
 *       which are copied and fully merged once per record.
 *   <li>Text spans: an opener and its closer within one text.
 * </ul>
 *
 * Replayed content is merged in its row's context (the record's fields, then ROW_NUM,
 * ROW_INDEX and, when nested, PARENT_ROW_NUM) and marked as expanded so that later stages leave
 * it alone. Sections nested in a replayed text are expanded first, to any depth.
 */
public class RepeaterEngine {

  private static final Logger logger = LoggerFactory.getLogger(RepeaterEngine.class);

  private final SectionBinder binder;
  private final FieldResolver fields;
  private final InlineConditionalProcessor inlineConditionals;
  private final ContainerMerger containerMerger;
  private final int oversizedThreshold;

  public RepeaterEngine(
      SectionBinder binder,
      FieldResolver fields,
      InlineConditionalProcessor inlineConditionals,
      ContainerMerger containerMerger,
      int oversizedThreshold) {
    this.binder = binder;
    this.fields = fields;
    this.inlineConditionals = inlineConditionals;
    this.containerMerger = containerMerger;
    this.oversizedThreshold = oversizedThreshold;
  }

  /** Expands every section among the children of |container|. */
  public void expand(
      DocumentTree tree, DocumentNode container, MergeContext context, MergeState state) {
    int i = 0;
    while (i < container.getChildCount()) {
      DocumentNode node = container.getChild(i);
      if (state.isExpanded(node)) {
        i++;
        continue;
      }

      switch (node.getKind()) {
        case TABLE:
          expandTable(tree, node, context, state);
          i++;
          break;

        case PARAGRAPH: {
          Tag marker = BlockMarkers.markerOf(tree, node, state.cache);
          if (marker != null && marker.isSectionOpener()) {
            int end = BlockMarkers.findSectionEnd(tree, container, i, marker, state.cache);
            if (end != -1) {
              i += expandBlock(tree, container, i, end, marker, context, state);
              break;
            }
          }
          String text = node.getText();
          if (hasSection(text)) {
            node.setText(processText(text, context, node, state));
            state.markExpanded(node);
          }
          i++;
          break;
        }

        default:
          i++;
          break;
      }
    }
  }

  /**
   * Merges one text in |context|: conditionals guarding sections, nested sections, the
   * remaining conditionals, then fields. Image markers are recorded against |section|.
   */
  public String processText(
      String text, MergeContext context, DocumentNode section, MergeState state) {
    String result = inlineConditionals.resolveSectionGuards(text, context, state.warnings);
    result = expandSpans(result, context, section, state);
    result = inlineConditionals.process(result, context, state.warnings);
    return fields.substitute(result, context, imageCollector(section, state), state.warnings);
  }

  public ImageVisitor imageCollector(final DocumentNode section, final MergeState state) {
    return new ImageVisitor() {
      @Override
      public void visit(String marker, FieldSpec spec, JsonView value) {
        state.addImage(new ImagePlacement(section, marker, spec, value));
      }
    };
  }

  private void expandTable(
      DocumentTree tree, DocumentNode table, MergeContext context, MergeState state) {
    int r = 0;
    while (r < table.getChildCount()) {
      DocumentNode row = table.getChild(r);
      int produced = state.isExpanded(row) ? 0 : expandRow(tree, table, r, context, state);
      r += Math.max(produced, 1);
    }
  }

  /** Returns the number of rows the row at |r| became, or 0 if it isn't a template row. */
  private int expandRow(
      DocumentTree tree, DocumentNode table, int r, MergeContext context, MergeState state) {
    DocumentNode row = table.getChild(r);
    List<String> texts = new ArrayList<String>();
    // A conditional in a cell may guard the section itself.
    for (int c = 0; c < row.getChildCount(); c++) {
      texts.add(inlineConditionals.resolveSectionGuards(
          row.getChild(c).getText(), context, state.warnings));
    }

    int openerCell = -1;
    Tag opener = null;
    for (int c = 0; c < texts.size() && opener == null; c++) {
      for (Tag tag : TagScanner.scan(texts.get(c))) {
        if (tag.isSectionOpener()) {
          opener = tag;
          openerCell = c;
          break;
        }
      }
    }
    if (opener == null)
      return 0;

    // The matching closer, in the opener's cell or a later one.
    int closerCell = -1;
    Tag closer = null;
    int depth = 1;
    for (int c = openerCell; c < texts.size() && closer == null; c++) {
      int from = (c == openerCell) ? opener.end : 0;
      for (Tag tag : TagScanner.scan(texts.get(c), from)) {
        if (tag.kind == opener.kind && tag.argument.equals(opener.argument)) {
          depth++;
        } else if (tag.closes(opener) && --depth == 0) {
          closer = tag;
          closerCell = c;
          break;
        }
      }
    }

    // Strip the closer first: when both share a cell, the opener's bounds stay valid.
    if (closer != null)
      texts.set(closerCell, cut(texts.get(closerCell), closer));
    else
      state.addWarning("Section ", opener, " has no closing marker in its row");
    texts.set(openerCell, cut(texts.get(openerCell), opener));

    RepeaterSection section = new RepeaterSection(opener, row);
    List<JsonView> records = bind(section, context, state);
    RowTemplate template = RowTemplate.capture(row, texts);

    List<List<String>> rows = new ArrayList<List<String>>(records.size());
    for (int k = 0; k < records.size(); k++) {
      MergeContext rowContext = context.forRecord(records.get(k), rowVariables(k, context));
      List<String> filled = new ArrayList<String>(texts.size());
      for (String text : template.getCellTexts())
        filled.add(processText(text, rowContext, table, state));
      rows.add(filled);
    }

    template.fill(row, rows.get(0));
    state.markExpanded(row);
    for (int k = 1; k < rows.size(); k++) {
      DocumentNode replayed = template.replay(tree, rows.get(k));
      table.insertChild(r + k, replayed);
      state.markExpanded(replayed);
    }
    return rows.size();
  }

  /** Returns the number of nodes the section's span became. */
  private int expandBlock(
      DocumentTree tree,
      DocumentNode container,
      int start,
      int end,
      Tag opener,
      MergeContext context,
      MergeState state) {
    RepeaterSection section = new RepeaterSection(opener, container.getChild(start));
    List<JsonView> records = bind(section, context, state);

    List<DocumentNode> body = new ArrayList<DocumentNode>();
    for (int j = start + 1; j < end; j++)
      body.add(container.getChild(j));

    List<DocumentNode> produced = new ArrayList<DocumentNode>();
    for (int k = 0; k < records.size(); k++) {
      MergeContext rowContext = context.forRecord(records.get(k), rowVariables(k, context));
      DocumentNode copy = tree.createNode(DocumentNode.Kind.BODY);
      for (DocumentNode node : body)
        copy.insertChild(copy.getChildCount(), tree.copy(node));
      containerMerger.mergeContainer(tree, copy, rowContext, state);
      while (copy.getChildCount() > 0)
        produced.add(copy.removeChild(0));
    }

    for (int j = end; j >= start; j--)
      container.removeChild(j);
    for (int p = 0; p < produced.size(); p++) {
      container.insertChild(start + p, produced.get(p));
      state.markExpanded(produced.get(p));
    }
    return produced.size();
  }

  /** Replaces each section span of |text| with its body merged once per record. */
  private String expandSpans(
      String text, MergeContext context, DocumentNode section, MergeState state) {
    if (!hasSection(text))
      return text;

    List<Tag> tags = TagScanner.scan(text);
    StringBuilder buf = new StringBuilder();
    int position = 0;
    int i = 0;
    while (i < tags.size()) {
      Tag opener = tags.get(i);
      if (!opener.isSectionOpener()) {
        i++;
        continue;
      }
      int close = TagScanner.findCloser(tags, i);
      if (close == -1) {
        state.addWarning("Section ", opener, " has no closing marker");
        i++;
        continue;
      }

      Tag closer = tags.get(close);
      List<JsonView> records = bind(new RepeaterSection(opener, null), context, state);
      String body = text.substring(opener.end, closer.start);
      buf.append(text, position, opener.start);
      for (int k = 0; k < records.size(); k++) {
        MergeContext rowContext = context.forRecord(records.get(k), rowVariables(k, context));
        buf.append(processText(body, rowContext, section, state));
      }
      position = closer.end;
      i = close + 1;
    }
    buf.append(text, position, text.length());
    return buf.toString();
  }

  private List<JsonView> bind(RepeaterSection section, MergeContext context, MergeState state) {
    List<JsonView> records = binder.bind(section, context);
    if (records.size() > oversizedThreshold) {
      state.addWarning("Section ", section, " repeats ", records.size(),
          " records, more than the ", oversizedThreshold, " expected");
    }
    logger.debug("Expanding {} over {} records", section, records.size());
    return records;
  }

  /** ROW_NUM and ROW_INDEX for record |index|, and PARENT_ROW_NUM inside another section. */
  private static Map<String, Object> rowVariables(int index, MergeContext outer) {
    Map<String, Object> variables = new LinkedHashMap<String, Object>();
    variables.put(MergeContext.ROW_NUM, Integer.valueOf(index + 1));
    variables.put(MergeContext.ROW_INDEX, Integer.valueOf(index));
    if (outer.getRecord() != null) {
      JsonView parent = outer.resolve(MergeContext.ROW_NUM);
      if (parent != null)
        variables.put(MergeContext.PARENT_ROW_NUM, parent);
    }
    return variables;
  }

  private static boolean hasSection(String text) {
    if (text.indexOf("{{") == -1)
      return false;
    for (Tag tag : TagScanner.scan(text)) {
      if (tag.isSectionOpener())
        return true;
    }
    return false;
  }

  private static String cut(String text, Tag tag) {
    return text.substring(0, tag.start) + text.substring(tag.end);
  }
}
