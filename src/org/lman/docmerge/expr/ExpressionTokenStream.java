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

package org.lman.docmerge.expr;

import java.util.Locale;

/** Tokeniser for conditions. */
class ExpressionTokenStream {

  enum Token {
    OPEN_PAREN,
    CLOSE_PAREN,
    COMPARISON,
    STRING_OPERATOR,
    ISBLANK,
    AND,
    OR,
    NOT,
    TRUE,
    FALSE,
    NULL,
    NUMBER,
    STRING,
    IDENTIFIER
  }

  // Longest first, to avoid any prefix matching issues.
  private static final String[] COMPARISONS = { "==", "!=", ">=", "<=", ">", "<" };

  private final String source;
  private int position = 0;

  public Token nextToken = null;
  /** Raw text of the next token; the unquoted value for STRING tokens. */
  public String nextContents = null;

  public ExpressionTokenStream(String source) {
    this.source = source;
    advance();
  }

  /**
   * Gets whether there are any more tokens in the stream.
   */
  public boolean hasNext() {
    return nextToken != null;
  }

  /**
   * Like {@link #advance} but asserts that the next token is the one given.
   */
  public ExpressionTokenStream advanceOver(Token token) {
    if (nextToken != token)
      throw error("Expecting " + token + " but got " + describeNext());
    return advance();
  }

  /**
   * Advances the stream by 1 token, setting nextToken/nextContents as needed.
   */
  public ExpressionTokenStream advance() {
    nextToken = null;
    nextContents = null;

    while (position < source.length() && Character.isWhitespace(source.charAt(position)))
      position++;
    if (position >= source.length())
      return this;

    char c = source.charAt(position);
    if (c == '(') {
      take(Token.OPEN_PAREN, 1);
    } else if (c == ')') {
      take(Token.CLOSE_PAREN, 1);
    } else if (c == '\'' || c == '"') {
      readString(c);
    } else if (isDigit(c) || ((c == '-' || c == '.') && isDigit(peek(1)))
        || (c == '-' && peek(1) == '.' && isDigit(peek(2)))) {
      readNumber();
    } else if (Character.isLetter(c) || c == '_') {
      readWord();
    } else {
      for (String comparison : COMPARISONS) {
        if (source.startsWith(comparison, position)) {
          take(Token.COMPARISON, comparison.length());
          return this;
        }
      }
      throw error("Unexpected character '" + c + "' at " + position);
    }
    return this;
  }

  String describeNext() {
    return nextToken == null ? "end of condition" : "'" + nextContents + "'";
  }

  ExpressionException error(String message) {
    return new ExpressionException(message, source);
  }

  private void take(Token token, int length) {
    nextToken = token;
    nextContents = source.substring(position, position + length);
    position += length;
  }

  private char peek(int offset) {
    int index = position + offset;
    return index < source.length() ? source.charAt(index) : 0;
  }

  private static boolean isDigit(char c) {
    return c >= '0' && c <= '9';
  }

  private void readString(char quote) {
    StringBuilder buf = new StringBuilder();
    int i = position + 1;
    while (i < source.length()) {
      char c = source.charAt(i);
      if (c == '\\' && i + 1 < source.length()) {
        buf.append(source.charAt(i + 1));
        i += 2;
        continue;
      }
      if (c == quote) {
        nextToken = Token.STRING;
        nextContents = buf.toString();
        position = i + 1;
        return;
      }
      buf.append(c);
      i++;
    }
    throw error("Unterminated string starting at " + position);
  }

  private void readNumber() {
    int start = position;
    int i = position;
    if (source.charAt(i) == '-')
      i++;
    boolean seenDot = false;
    while (i < source.length()) {
      char c = source.charAt(i);
      if (c == '.' && !seenDot && i + 1 < source.length() && isDigit(source.charAt(i + 1))) {
        seenDot = true;
      } else if (!isDigit(c)) {
        break;
      }
      i++;
    }
    if (i < source.length() && (Character.isLetter(source.charAt(i)) || source.charAt(i) == '_'))
      throw error("Malformed number '" + source.substring(start, i + 1) + "'");
    nextToken = Token.NUMBER;
    nextContents = source.substring(start, i);
    position = i;
  }

  private void readWord() {
    int start = position;
    int i = position;
    while (i < source.length()) {
      char c = source.charAt(i);
      if (Character.isLetterOrDigit(c) || c == '_' || c == '.')
        i++;
      else
        break;
    }
    String word = source.substring(start, i);
    position = i;
    nextContents = word;

    String upper = word.toUpperCase(Locale.ROOT);
    if (upper.equals("AND"))
      nextToken = Token.AND;
    else if (upper.equals("OR"))
      nextToken = Token.OR;
    else if (upper.equals("NOT"))
      nextToken = Token.NOT;
    else if (upper.equals("TRUE"))
      nextToken = Token.TRUE;
    else if (upper.equals("FALSE"))
      nextToken = Token.FALSE;
    else if (upper.equals("NULL"))
      nextToken = Token.NULL;
    else if (upper.equals("ISBLANK"))
      nextToken = Token.ISBLANK;
    else if (upper.equals("CONTAINS") || upper.equals("STARTSWITH") ||
             upper.equals("ENDSWITH") || upper.equals("IEQUALS"))
      nextToken = Token.STRING_OPERATOR;
    else if (isPath(word))
      nextToken = Token.IDENTIFIER;
    else
      throw error("'" + word + "' is not a valid field reference");
  }

  private static boolean isPath(String word) {
    if (word.startsWith(".") || word.endsWith(".") || word.contains(".."))
      return false;
    return true;
  }
}
