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
import java.util.regex.Pattern;

import org.lman.docmerge.json.JsonView;
import org.lman.docmerge.json.JsonView.ArrayVisitor;

/**
 * Coercions between the loosely typed values conditions compare: null, {@link #UNDEFINED},
 * Boolean, Number, String, and (for arrays and objects) the {@link JsonView} itself.
 */
public class Values {

  /** The value of a path that didn't resolve. Distinct from a present null. */
  public static final Object UNDEFINED = new Object() {
    @Override
    public String toString() {
      return "undefined";
    }
  };

  private static final Pattern NUMERIC =
      Pattern.compile("[+-]?(\\d+\\.?\\d*|\\.\\d+)([eE][+-]?\\d+)?");

  private Values() {}

  /** Converts a resolved view (or null, for unresolved) into a comparable value. */
  public static Object fromView(JsonView view) {
    if (view == null)
      return UNDEFINED;
    switch (view.getType()) {
      case NULL:
        return null;
      case BOOLEAN:
        return Boolean.valueOf(view.asBoolean());
      case NUMBER:
        return view.asNumber();
      case STRING:
        return view.asString();
      default:
        return view;
    }
  }

  public static boolean isNullish(Object value) {
    return value == null || value == UNDEFINED;
  }

  /** Anything but null, undefined, false and the empty string. */
  public static boolean isTruthy(Object value) {
    if (isNullish(value))
      return false;
    if (value instanceof Boolean)
      return ((Boolean) value).booleanValue();
    if (value instanceof String)
      return !((String) value).isEmpty();
    return true;
  }

  /** Null, undefined, or a string of only whitespace. */
  public static boolean isBlank(Object value) {
    if (isNullish(value))
      return true;
    return value instanceof String && ((String) value).trim().isEmpty();
  }

  /**
   * Loose equality: null and undefined only equal each other, booleans compare as 1/0,
   * numbers and numeric strings compare numerically, anything else by string form.
   */
  public static boolean looseEquals(Object left, Object right) {
    if (isNullish(left) || isNullish(right))
      return isNullish(left) && isNullish(right);
    if (left instanceof Boolean)
      return looseEquals(Double.valueOf(toNumber(left)), right);
    if (right instanceof Boolean)
      return looseEquals(left, Double.valueOf(toNumber(right)));
    if (left instanceof Number || right instanceof Number) {
      if (left instanceof JsonView || right instanceof JsonView)
        return toText(left).equals(toText(right));
      return toNumber(left) == toNumber(right);
    }
    if (left instanceof JsonView && right instanceof JsonView)
      return left.equals(right);
    return toText(left).equals(toText(right));
  }

  /**
   * Numeric coercion: null and blank strings are 0, booleans 1/0, numeric strings their value,
   * and everything else (including undefined) NaN.
   */
  public static double toNumber(Object value) {
    if (value == null)
      return 0;
    if (value instanceof Number)
      return ((Number) value).doubleValue();
    if (value instanceof Boolean)
      return ((Boolean) value).booleanValue() ? 1 : 0;
    if (value instanceof String) {
      String trimmed = ((String) value).trim();
      if (trimmed.isEmpty())
        return 0;
      if (NUMERIC.matcher(trimmed).matches())
        return Double.parseDouble(trimmed);
    }
    return Double.NaN;
  }

  /** String form for string operators; null and undefined become the empty string. */
  public static String toText(Object value) {
    if (isNullish(value))
      return "";
    if (value instanceof Number)
      return numberText((Number) value);
    if (value instanceof JsonView) {
      final JsonView view = (JsonView) value;
      if (view.getType() != JsonView.Type.ARRAY)
        return view.toString();
      final StringBuilder buf = new StringBuilder();
      view.asArrayForeach(new ArrayVisitor() {
        @Override
        public void visit(JsonView item, int index) {
          if (index > 0)
            buf.append(',');
          buf.append(toText(fromView(item)));
        }
      });
      return buf.toString();
    }
    return value.toString();
  }

  /** The shortest plain rendering of a number: no exponent, no trailing zeros. */
  public static String numberText(Number number) {
    if (number instanceof Double || number instanceof Float) {
      double d = number.doubleValue();
      if (Double.isNaN(d) || Double.isInfinite(d))
        return Double.toString(d);
    }
    BigDecimal decimal = (number instanceof BigDecimal) ?
        (BigDecimal) number : new BigDecimal(number.toString());
    if (decimal.signum() == 0)
      return "0";
    return decimal.stripTrailingZeros().toPlainString();
  }
}
