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

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * An in-memory {@link DocumentTree}, with a plain text form for fixtures:
 *
 * <pre>
 *   Each line is a paragraph.
 *   | Consecutive | lines like this |
 *   | form the    | rows of a table |
 *   &lt;&lt;page-break&gt;&gt;
 * </pre>
 *
 * Within a table cell, {@code <br>} separates paragraphs. Attributes and run styles have no
 * text form; they are set through the node API.
 */
public class SimpleDocument implements DocumentTree {

  static final String PAGE_BREAK = "<<page-break>>";
  static final String LINE_BREAK = "<br>";

  private final String id;
  private final SimpleNode body = new SimpleNode(DocumentNode.Kind.BODY);

  public SimpleDocument(String id) {
    this.id = id;
  }

  public SimpleDocument() {
    this(UUID.randomUUID().toString());
  }

  public static SimpleDocument parse(String text) {
    SimpleDocument document = new SimpleDocument();
    SimpleNode table = null;
    for (String line : text.split("\n", -1)) {
      String trimmed = line.trim();
      if (trimmed.startsWith("|") && trimmed.endsWith("|") && trimmed.length() > 1) {
        if (table == null) {
          table = new SimpleNode(DocumentNode.Kind.TABLE);
          document.body.append(table);
        }
        table.append(parseRow(trimmed));
        continue;
      }

      table = null;
      if (trimmed.equals(PAGE_BREAK)) {
        document.body.append(new SimpleNode(DocumentNode.Kind.PAGE_BREAK));
      } else {
        SimpleNode paragraph = new SimpleNode(DocumentNode.Kind.PARAGRAPH);
        paragraph.text = line;
        document.body.append(paragraph);
      }
    }
    return document;
  }

  private static SimpleNode parseRow(String line) {
    SimpleNode row = new SimpleNode(DocumentNode.Kind.ROW);
    String inner = line.substring(1, line.length() - 1);
    for (String cellText : inner.split("\\|", -1)) {
      SimpleNode cell = new SimpleNode(DocumentNode.Kind.CELL);
      cell.setText(cellText.trim().replace(LINE_BREAK, "\n"));
      row.append(cell);
    }
    return row;
  }

  @Override
  public String getId() {
    return id;
  }

  @Override
  public DocumentNode getBody() {
    return body;
  }

  @Override
  public DocumentNode createNode(DocumentNode.Kind kind) {
    return new SimpleNode(kind);
  }

  @Override
  public DocumentNode copy(DocumentNode node) {
    return cast(node).deepCopy();
  }

  /** The text form; see the class comment. Attributes and styles are not included. */
  @Override
  public String toString() {
    List<String> lines = new ArrayList<String>();
    for (SimpleNode child : body.children) {
      switch (child.kind) {
        case TABLE:
          for (SimpleNode row : child.children)
            lines.add(formatRow(row));
          break;
        case PAGE_BREAK:
          lines.add(PAGE_BREAK);
          break;
        default:
          lines.add(child.getText());
          break;
      }
    }
    return join(lines, "\n");
  }

  private static String formatRow(SimpleNode row) {
    StringBuilder buf = new StringBuilder("|");
    for (SimpleNode cell : row.children)
      buf.append(' ').append(cell.getText().replace("\n", LINE_BREAK)).append(" |");
    return buf.toString();
  }

  private static String join(List<String> parts, String separator) {
    StringBuilder buf = new StringBuilder();
    for (int i = 0; i < parts.size(); i++) {
      if (i > 0)
        buf.append(separator);
      buf.append(parts.get(i));
    }
    return buf.toString();
  }

  private static SimpleNode cast(DocumentNode node) {
    if (!(node instanceof SimpleNode))
      throw new IllegalArgumentException("Not a node of a SimpleDocument: " + node);
    return (SimpleNode) node;
  }

  private static class SimpleNode implements DocumentNode {
    private final Kind kind;
    private final List<SimpleNode> children = new ArrayList<SimpleNode>();
    private String text = "";
    private Object attributes = null;
    private Object runStyle = null;

    SimpleNode(Kind kind) {
      this.kind = kind;
    }

    void append(SimpleNode child) {
      children.add(child);
    }

    SimpleNode deepCopy() {
      SimpleNode copy = new SimpleNode(kind);
      copy.text = text;
      copy.attributes = attributes;
      copy.runStyle = runStyle;
      for (SimpleNode child : children)
        copy.children.add(child.deepCopy());
      return copy;
    }

    @Override
    public Kind getKind() {
      return kind;
    }

    @Override
    public int getChildCount() {
      return children.size();
    }

    @Override
    public DocumentNode getChild(int index) {
      return children.get(index);
    }

    @Override
    public void insertChild(int index, DocumentNode child) {
      children.add(index, cast(child));
    }

    @Override
    public DocumentNode removeChild(int index) {
      return children.remove(index);
    }

    @Override
    public String getText() {
      if (kind == Kind.PARAGRAPH)
        return text;
      List<String> texts = new ArrayList<String>(children.size());
      for (SimpleNode child : children)
        texts.add(child.getText());
      return join(texts, "\n");
    }

    @Override
    public void setText(String text) {
      if (kind == Kind.PARAGRAPH) {
        this.text = text;
        return;
      }
      if (kind != Kind.CELL)
        throw new UnsupportedOperationException("Cannot set the text of a " + kind);

      // New paragraphs take the look of the cell's first one.
      SimpleNode model = children.isEmpty() ? null : children.get(0);
      children.clear();
      for (String line : text.split("\n", -1)) {
        SimpleNode paragraph = new SimpleNode(Kind.PARAGRAPH);
        paragraph.text = line;
        if (model != null) {
          paragraph.attributes = model.attributes;
          paragraph.runStyle = model.runStyle;
        }
        children.add(paragraph);
      }
    }

    @Override
    public Object getAttributes() {
      return attributes;
    }

    @Override
    public void setAttributes(Object attributes) {
      this.attributes = attributes;
    }

    @Override
    public Object getRunStyle(int offset) {
      if (kind != Kind.PARAGRAPH || offset < 0 || offset > text.length())
        return null;
      return runStyle;
    }

    @Override
    public void setRunStyle(Object style) {
      if (kind != Kind.PARAGRAPH)
        throw new UnsupportedOperationException("Runs only exist in paragraphs, not a " + kind);
      this.runStyle = style;
    }

    @Override
    public String toString() {
      return kind + "(" + getText() + ")";
    }
  }
}
