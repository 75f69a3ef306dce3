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

import java.math.BigDecimal;
import java.util.Locale;

import org.lman.docmerge.expr.Expression.Comparison;
import org.lman.docmerge.expr.Expression.ComparisonOperator;
import org.lman.docmerge.expr.Expression.FieldRef;
import org.lman.docmerge.expr.Expression.Literal;
import org.lman.docmerge.expr.Expression.StringOp;
import org.lman.docmerge.expr.Expression.StringOperator;
import org.lman.docmerge.expr.ExpressionTokenStream.Token;

/**
 * Recursive descent parser for conditions. Precedence, lowest first:
 *
 * <pre>
 *   or      := and (OR and)*
 *   and     := not (AND not)*
 *   not     := NOT not | atom
 *   atom    := '(' or ')'
 *            | ISBLANK field | ISBLANK '(' field ')'
 *            | operand (COMPARISON operand | STRING_OPERATOR operand)?
 *   operand := field | TRUE | FALSE | NULL | number | string
 * </pre>
 */
class ExpressionParser {

  private final String source;
  private final ExpressionTokenStream tokens;

  ExpressionParser(String source) {
    this.source = source;
    this.tokens = new ExpressionTokenStream(source);
  }

  Expression parse() {
    if (!tokens.hasNext())
      throw new ExpressionException("Empty condition", source);
    Expression expression = parseOr();
    if (tokens.hasNext())
      throw tokens.error("Unexpected " + tokens.describeNext());
    return expression;
  }

  private Expression parseOr() {
    Expression left = parseAnd();
    while (tokens.nextToken == Token.OR) {
      tokens.advance();
      left = new Expression.Or(left, parseAnd());
    }
    return left;
  }

  private Expression parseAnd() {
    Expression left = parseNot();
    while (tokens.nextToken == Token.AND) {
      tokens.advance();
      left = new Expression.And(left, parseNot());
    }
    return left;
  }

  private Expression parseNot() {
    if (tokens.nextToken == Token.NOT) {
      tokens.advance();
      return new Expression.Not(parseNot());
    }
    return parseAtom();
  }

  private Expression parseAtom() {
    if (!tokens.hasNext())
      throw tokens.error("Unexpected end of condition");

    switch (tokens.nextToken) {
      case OPEN_PAREN: {
        tokens.advance();
        Expression inner = parseOr();
        tokens.advanceOver(Token.CLOSE_PAREN);
        return inner;
      }

      case ISBLANK: {
        tokens.advance();
        boolean parenthesised = tokens.nextToken == Token.OPEN_PAREN;
        if (parenthesised)
          tokens.advance();
        FieldRef field = parseField();
        if (parenthesised)
          tokens.advanceOver(Token.CLOSE_PAREN);
        return new StringOp(StringOperator.ISBLANK, field, null);
      }

      case IDENTIFIER:
      case TRUE:
      case FALSE:
      case NULL:
      case NUMBER:
      case STRING: {
        Expression left = parseOperand();
        if (tokens.nextToken == Token.COMPARISON) {
          ComparisonOperator op = ComparisonOperator.fromSymbol(tokens.nextContents);
          tokens.advance();
          return new Comparison(op, left, parseOperand());
        }
        if (tokens.nextToken == Token.STRING_OPERATOR) {
          StringOperator op =
              StringOperator.valueOf(tokens.nextContents.toUpperCase(Locale.ROOT));
          tokens.advance();
          return new StringOp(op, left, parseOperand());
        }
        if (left instanceof FieldRef)
          return new Expression.Truthy((FieldRef) left);
        return left;
      }

      default:
        throw tokens.error("Unexpected " + tokens.describeNext());
    }
  }

  private FieldRef parseField() {
    if (tokens.nextToken != Token.IDENTIFIER)
      throw tokens.error("Expecting a field but got " + tokens.describeNext());
    FieldRef field = new FieldRef(tokens.nextContents);
    tokens.advance();
    return field;
  }

  /**
   * A field if the token lexically is one (unquoted identifier or dot path), otherwise a
   * literal.
   */
  private Expression parseOperand() {
    if (!tokens.hasNext())
      throw tokens.error("Expecting a value but got end of condition");

    Expression operand;
    switch (tokens.nextToken) {
      case IDENTIFIER:
        return parseField();
      case TRUE:
        operand = new Literal(Boolean.TRUE);
        break;
      case FALSE:
        operand = new Literal(Boolean.FALSE);
        break;
      case NULL:
        operand = new Literal(null);
        break;
      case NUMBER:
        operand = new Literal(new BigDecimal(tokens.nextContents));
        break;
      case STRING:
        operand = new Literal(tokens.nextContents);
        break;
      default:
        throw tokens.error("Expecting a value but got " + tokens.describeNext());
    }
    tokens.advance();
    return operand;
  }
}
