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

package org.lman.docmerge.template;

import java.util.ArrayList;
import java.util.List;

/**
 * Splits text into its {{...}} markers, left to right. Quoted strings inside a marker may
 * contain braces; a "{{" that is never closed is plain text.
 */
public class TagScanner {

  private static final String OPEN = "{{";
  private static final String CLOSE = "}}";

  private TagScanner() {}

  public static List<Tag> scan(String text) {
    return scan(text, 0);
  }

  /** Tags whose opening braces start at or after |from|. */
  public static List<Tag> scan(String text, int from) {
    List<Tag> tags = new ArrayList<Tag>();
    int position = from;
    while (true) {
      int start = text.indexOf(OPEN, position);
      if (start == -1)
        break;

      int end = findClose(text, start + OPEN.length());
      if (end == -1)
        break;

      // A later "{{" before the close means this one was stray text.
      int reopened = text.lastIndexOf(OPEN, end - CLOSE.length());
      if (reopened > start && !insideQuotes(text, start + OPEN.length(), reopened)) {
        position = reopened;
        continue;
      }

      tags.add(classify(text.substring(start + OPEN.length(), end - CLOSE.length()), start, end));
      position = end;
    }
    return tags;
  }

  /**
   * If |text| consists of exactly one tag (ignoring surrounding whitespace) returns it,
   * otherwise null.
   */
  public static Tag wholeTag(String text) {
    String trimmed = text.trim();
    if (!trimmed.startsWith(OPEN) || !trimmed.endsWith(CLOSE))
      return null;
    List<Tag> tags = scan(text);
    if (tags.size() != 1)
      return null;
    Tag tag = tags.get(0);
    int leading = text.indexOf(trimmed);
    return (tag.start == leading && tag.end == leading + trimmed.length()) ? tag : null;
  }

  /**
   * The index in |tags| of the closer of the section opened at |openerIndex|, counting nested
   * sections of the same name, or -1 if it is never closed.
   */
  public static int findCloser(List<Tag> tags, int openerIndex) {
    Tag opener = tags.get(openerIndex);
    int depth = 1;
    for (int j = openerIndex + 1; j < tags.size(); j++) {
      Tag tag = tags.get(j);
      if (tag.kind == opener.kind && tag.argument.equals(opener.argument)) {
        depth++;
      } else if (tag.closes(opener) && --depth == 0) {
        return j;
      }
    }
    return -1;
  }

  /** The index just past the "}}" closing a tag whose content starts at |from|, or -1. */
  private static int findClose(String text, int from) {
    char quote = 0;
    for (int i = from; i < text.length(); i++) {
      char c = text.charAt(i);
      if (quote != 0) {
        if (c == quote)
          quote = 0;
      } else if (c == '\'' || c == '"') {
        quote = c;
      } else if (text.startsWith(CLOSE, i)) {
        return i + CLOSE.length();
      }
    }
    // An unbalanced quote (e.g. an apostrophe) shouldn't hide the close.
    int close = text.indexOf(CLOSE, from);
    return close == -1 ? -1 : close + CLOSE.length();
  }

  private static boolean insideQuotes(String text, int from, int index) {
    char quote = 0;
    for (int i = from; i < index; i++) {
      char c = text.charAt(i);
      if (quote != 0) {
        if (c == quote)
          quote = 0;
      } else if (c == '\'' || c == '"') {
        quote = c;
      }
    }
    return quote != 0;
  }

  private static Tag classify(String content, int start, int end) {
    for (Tag.Kind kind : Tag.Kind.values()) {
      String argument = kind.match(content);
      if (argument != null)
        return new Tag(kind, start, end, argument);
    }
    throw new AssertionError("FIELD matches everything");
  }
}
