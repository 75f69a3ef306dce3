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

/**
 * One {{...}} marker found in a text, with its exact bounds.
 */
public final class Tag {

  public enum Kind {
    // List in order of longest to shortest prefix, to avoid any prefix matching issues.
    ELSE_IF            ("ELSEIF", true),
    ELSE               ("ELSE", false),
    IF                 ("IF", true),
    END_IF             ("/IF", false),
    CLOSE_NAMED_SECTION("/@", false),
    CLOSE_SECTION      ("/", false),
    OPEN_NAMED_SECTION ("@", false),
    OPEN_SECTION       ("#", false),
    FIELD              ("", false);

    final String prefix;
    final boolean takesCondition;

    Kind(String prefix, boolean takesCondition) {
      this.prefix = prefix;
      this.takesCondition = takesCondition;
    }

    /**
     * Returns the argument of |content| if it is a tag of this kind, else null. Keyword kinds
     * without an argument must match exactly; IF and ELSEIF need whitespace or a parenthesis
     * after the keyword so that fields such as {{IFRS}} stay fields.
     */
    String match(String content) {
      if (this == FIELD)
        return content.trim();
      if (this == ELSE || this == END_IF)
        return content.trim().equals(prefix) ? "" : null;
      if (!content.startsWith(prefix))
        return null;
      String rest = content.substring(prefix.length());
      if (takesCondition) {
        if (rest.isEmpty())
          return null;
        char c = rest.charAt(0);
        if (!Character.isWhitespace(c) && c != '(')
          return null;
      }
      return rest.trim();
    }
  }

  public final Kind kind;
  /** Offset of the first '{'. */
  public final int start;
  /** Offset just past the last '}'. */
  public final int end;
  /** The condition, section name or field spec; empty for ELSE and /IF. */
  public final String argument;

  Tag(Kind kind, int start, int end, String argument) {
    this.kind = kind;
    this.start = start;
    this.end = end;
    this.argument = argument;
  }

  public boolean isConditional() {
    return kind == Kind.IF || kind == Kind.ELSE_IF || kind == Kind.ELSE || kind == Kind.END_IF;
  }

  public boolean isSectionOpener() {
    return kind == Kind.OPEN_SECTION || kind == Kind.OPEN_NAMED_SECTION;
  }

  public boolean isSectionCloser() {
    return kind == Kind.CLOSE_SECTION || kind == Kind.CLOSE_NAMED_SECTION;
  }

  /** Whether this tag closes the section opened by |opener|. */
  public boolean closes(Tag opener) {
    if (opener.kind == Kind.OPEN_SECTION)
      return kind == Kind.CLOSE_SECTION && argument.equals(opener.argument);
    if (opener.kind == Kind.OPEN_NAMED_SECTION)
      return kind == Kind.CLOSE_NAMED_SECTION && argument.equals(opener.argument);
    return false;
  }

  @Override
  public String toString() {
    switch (kind) {
      case ELSE:
        return "{{ELSE}}";
      case END_IF:
        return "{{/IF}}";
      case IF:
      case ELSE_IF:
        return "{{" + kind.prefix + " " + argument + "}}";
      default:
        return "{{" + kind.prefix + argument + "}}";
    }
  }
}
