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

import org.lman.docmerge.context.MergeContext;

/**
 * A parsed condition. Operand nodes ({@link Literal}, {@link FieldRef}) evaluate to values,
 * every other node to a Boolean. Trees are built per evaluation and never cached.
 */
public abstract class Expression {

  public abstract Object evaluate(MergeContext context);

  /** Evaluates and reduces the result to a boolean by truthiness. */
  public final boolean test(MergeContext context) {
    return Values.isTruthy(evaluate(context));
  }

  /** TRUE, FALSE, NULL, a number or a quoted string. */
  public static class Literal extends Expression {
    public final Object value;

    public Literal(Object value) {
      this.value = value;
    }

    @Override
    public Object evaluate(MergeContext context) {
      return value;
    }

    @Override
    public String toString() {
      if (value == null)
        return "NULL";
      if (value instanceof String)
        return "'" + value + "'";
      if (value instanceof Number)
        return Values.numberText((Number) value);
      return value.toString().toUpperCase(Locale.ROOT);
    }
  }

  /** A dot path into the merge context; unresolved paths evaluate to {@link Values#UNDEFINED}. */
  public static class FieldRef extends Expression {
    public final String path;

    public FieldRef(String path) {
      this.path = path;
    }

    @Override
    public Object evaluate(MergeContext context) {
      return Values.fromView(context.resolve(path));
    }

    @Override
    public String toString() {
      return path;
    }
  }

  public enum ComparisonOperator {
    EQ("=="), NE("!="), GE(">="), LE("<="), GT(">"), LT("<");

    final String symbol;

    ComparisonOperator(String symbol) {
      this.symbol = symbol;
    }

    static ComparisonOperator fromSymbol(String symbol) {
      for (ComparisonOperator op : values()) {
        if (op.symbol.equals(symbol))
          return op;
      }
      return null;
    }

    boolean apply(Object left, Object right) {
      switch (this) {
        case EQ:
          return Values.looseEquals(left, right);
        case NE:
          return !Values.looseEquals(left, right);
        default:
          break;
      }
      // NaN makes every ordering false.
      double l = Values.toNumber(left);
      double r = Values.toNumber(right);
      switch (this) {
        case GT:
          return l > r;
        case LT:
          return l < r;
        case GE:
          return l >= r;
        case LE:
          return l <= r;
        default:
          throw new AssertionError(this);
      }
    }
  }

  /** {@code left op right}. */
  public static class Comparison extends Expression {
    public final ComparisonOperator op;
    public final Expression left;
    public final Expression right;

    public Comparison(ComparisonOperator op, Expression left, Expression right) {
      this.op = op;
      this.left = left;
      this.right = right;
    }

    @Override
    public Object evaluate(MergeContext context) {
      return Boolean.valueOf(op.apply(left.evaluate(context), right.evaluate(context)));
    }

    @Override
    public String toString() {
      return "(" + left + " " + op.symbol + " " + right + ")";
    }
  }

  public enum StringOperator {
    CONTAINS, STARTSWITH, ENDSWITH, IEQUALS, ISBLANK;

    boolean apply(Object field, Object value) {
      if (this == ISBLANK)
        return Values.isBlank(field);
      String text = Values.toText(field);
      String other = Values.toText(value);
      switch (this) {
        case CONTAINS:
          return text.contains(other);
        case STARTSWITH:
          return text.startsWith(other);
        case ENDSWITH:
          return text.endsWith(other);
        case IEQUALS:
          return text.toLowerCase(Locale.ROOT).equals(other.toLowerCase(Locale.ROOT));
        default:
          throw new AssertionError(this);
      }
    }
  }

  /** {@code field CONTAINS value} and friends, or {@code ISBLANK field} (with a null value). */
  public static class StringOp extends Expression {
    public final StringOperator op;
    public final Expression field;
    public final Expression value;

    public StringOp(StringOperator op, Expression field, Expression value) {
      this.op = op;
      this.field = field;
      this.value = value;
    }

    @Override
    public Object evaluate(MergeContext context) {
      Object fieldValue = field.evaluate(context);
      Object operand = (value == null) ? null : value.evaluate(context);
      return Boolean.valueOf(op.apply(fieldValue, operand));
    }

    @Override
    public String toString() {
      if (op == StringOperator.ISBLANK)
        return "ISBLANK(" + field + ")";
      return "(" + field + " " + op + " " + value + ")";
    }
  }

  public static class And extends Expression {
    public final Expression left;
    public final Expression right;

    public And(Expression left, Expression right) {
      this.left = left;
      this.right = right;
    }

    @Override
    public Object evaluate(MergeContext context) {
      return Boolean.valueOf(left.test(context) && right.test(context));
    }

    @Override
    public String toString() {
      return "(" + left + " AND " + right + ")";
    }
  }

  public static class Or extends Expression {
    public final Expression left;
    public final Expression right;

    public Or(Expression left, Expression right) {
      this.left = left;
      this.right = right;
    }

    @Override
    public Object evaluate(MergeContext context) {
      return Boolean.valueOf(left.test(context) || right.test(context));
    }

    @Override
    public String toString() {
      return "(" + left + " OR " + right + ")";
    }
  }

  public static class Not extends Expression {
    public final Expression operand;

    public Not(Expression operand) {
      this.operand = operand;
    }

    @Override
    public Object evaluate(MergeContext context) {
      return Boolean.valueOf(!operand.test(context));
    }

    @Override
    public String toString() {
      return "NOT " + operand;
    }
  }

  /** A bare field with no operator. */
  public static class Truthy extends Expression {
    public final FieldRef field;

    public Truthy(FieldRef field) {
      this.field = field;
    }

    @Override
    public Object evaluate(MergeContext context) {
      return Boolean.valueOf(Values.isTruthy(field.evaluate(context)));
    }

    @Override
    public String toString() {
      return field.toString();
    }
  }
}
