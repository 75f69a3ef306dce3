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

package org.lman.docmerge.field;

import org.lman.docmerge.common.Struct;

/**
 * The parsed content of a field marker: {@code path[:format] [?? 'default']}.
 */
public class FieldSpec extends Struct {

  private static final String DEFAULT_OPERATOR = "??";

  public final String path;
  /** Null if the marker names no format. */
  public final String format;
  /** The unquoted default, or null if the marker has none. */
  public final String defaultValue;

  public FieldSpec(String path, String format, String defaultValue) {
    this.path = path;
    this.format = format;
    this.defaultValue = defaultValue;
  }

  public static FieldSpec parse(String content) {
    String reference = content;
    String defaultValue = null;

    int operator = indexOfUnquoted(content, DEFAULT_OPERATOR);
    if (operator != -1) {
      reference = content.substring(0, operator);
      defaultValue = unquote(content.substring(operator + DEFAULT_OPERATOR.length()).trim());
    }

    reference = reference.trim();
    String format = null;
    int colon = reference.indexOf(':');
    if (colon != -1) {
      format = reference.substring(colon + 1).trim();
      reference = reference.substring(0, colon).trim();
      if (format.isEmpty())
        format = null;
    }
    return new FieldSpec(reference, format, defaultValue);
  }

  public boolean hasDefault() {
    return defaultValue != null;
  }

  private static int indexOfUnquoted(String text, String needle) {
    char quote = 0;
    for (int i = 0; i < text.length(); i++) {
      char c = text.charAt(i);
      if (quote != 0) {
        if (c == quote)
          quote = 0;
      } else if (c == '\'' || c == '"') {
        quote = c;
      } else if (text.startsWith(needle, i)) {
        return i;
      }
    }
    return -1;
  }

  private static String unquote(String text) {
    if (text.length() >= 2) {
      char first = text.charAt(0);
      if ((first == '\'' || first == '"') && text.charAt(text.length() - 1) == first)
        return text.substring(1, text.length() - 1);
    }
    return text;
  }
}
