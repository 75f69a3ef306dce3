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
import java.util.Collections;
import java.util.List;

import org.lman.docmerge.document.DocumentNode;
import org.lman.docmerge.document.DocumentTree;

/**
 * What a table row looked like before it was replayed: the text of each cell (section markers
 * already stripped), the row's and each cell's attributes, and one run style per cell.
 *
 * Only the style of the first character of a cell's first paragraph is kept, so a template
 * cell mixing several styles replays in a single one.
 */
public class RowTemplate {

  private final Object rowAttributes;
  private final List<String> cellTexts;
  private final List<Object> cellAttributes;
  private final List<Object> runStyles;

  private RowTemplate(
      Object rowAttributes,
      List<String> cellTexts,
      List<Object> cellAttributes,
      List<Object> runStyles) {
    this.rowAttributes = rowAttributes;
    this.cellTexts = cellTexts;
    this.cellAttributes = cellAttributes;
    this.runStyles = runStyles;
  }

  /** Captures |row|, taking the cells' text from |cellTexts| rather than the row itself. */
  public static RowTemplate capture(DocumentNode row, List<String> cellTexts) {
    List<Object> cellAttributes = new ArrayList<Object>();
    List<Object> runStyles = new ArrayList<Object>();
    for (int c = 0; c < row.getChildCount(); c++) {
      DocumentNode cell = row.getChild(c);
      cellAttributes.add(cell.getAttributes());
      runStyles.add(sampleRunStyle(cell));
    }
    return new RowTemplate(
        row.getAttributes(), new ArrayList<String>(cellTexts), cellAttributes, runStyles);
  }

  private static Object sampleRunStyle(DocumentNode cell) {
    if (cell.getChildCount() == 0)
      return null;
    DocumentNode first = cell.getChild(0);
    return first.getKind() == DocumentNode.Kind.PARAGRAPH ? first.getRunStyle(0) : null;
  }

  public List<String> getCellTexts() {
    return Collections.unmodifiableList(cellTexts);
  }

  /** Writes |texts| into the cells of the template's own row. Unchanged cells are untouched. */
  public void fill(DocumentNode row, List<String> texts) {
    for (int c = 0; c < row.getChildCount() && c < texts.size(); c++) {
      DocumentNode cell = row.getChild(c);
      if (texts.get(c).equals(cell.getText()))
        continue;
      cell.setText(texts.get(c));
      applyRunStyle(cell, runStyles.get(c));
    }
  }

  /** A new row with the captured attributes and style, holding |texts|. */
  public DocumentNode replay(DocumentTree tree, List<String> texts) {
    DocumentNode row = tree.createNode(DocumentNode.Kind.ROW);
    row.setAttributes(rowAttributes);
    for (int c = 0; c < texts.size(); c++) {
      DocumentNode cell = tree.createNode(DocumentNode.Kind.CELL);
      cell.setAttributes(cellAttributes.get(c));
      cell.setText(texts.get(c));
      applyRunStyle(cell, runStyles.get(c));
      row.insertChild(c, cell);
    }
    return row;
  }

  private static void applyRunStyle(DocumentNode cell, Object style) {
    if (style == null)
      return;
    for (int p = 0; p < cell.getChildCount(); p++) {
      DocumentNode paragraph = cell.getChild(p);
      if (paragraph.getKind() == DocumentNode.Kind.PARAGRAPH)
        paragraph.setRunStyle(style);
    }
  }
}
