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

package org.lman.docmerge.common;

import java.lang.reflect.Field;
import java.util.Arrays;

/**
 * Base class for value objects (field specs, merge results, options) whose public fields define
 * equals/hashCode/toString. Fields marked {@link Transient} are ignored.
 */
public abstract class Struct {

  @Override
  public final boolean equals(final Object other) {
    if (this == other)
      return true;
    if (other == null || getClass() != other.getClass())
      return false;

    Object result = ReflectionHelper.forEach(this, new ReflectionHelper.FieldVisitor() {
      @Override
      protected Control visit(Field field, Object value) {
        Object otherValue;
        try {
          otherValue = field.get(other);
        } catch (IllegalAccessException e) {
          return breakAndReturn(Boolean.FALSE);
        }
        if (!valueEquals(value, otherValue))
          return breakAndReturn(Boolean.FALSE);
        return Control.CONTINUE;
      }
    });

    return result == null;
  }

  private static boolean valueEquals(Object value, Object otherValue) {
    if (value == null)
      return otherValue == null;
    if (otherValue == null)
      return false;
    if (value instanceof Object[] && otherValue instanceof Object[])
      return Arrays.deepEquals((Object[]) value, (Object[]) otherValue);
    return value.equals(otherValue);
  }

  @Override
  public final int hashCode() {
    final int[] result = { 1 };
    ReflectionHelper.forEach(this, new ReflectionHelper.FieldVisitor() {
      @Override
      protected Control visit(Field field, Object value) {
        int fieldHash = 0;
        if (value instanceof Object[])
          fieldHash = Arrays.deepHashCode((Object[]) value);
        else if (value != null)
          fieldHash = value.hashCode();
        result[0] = 31 * result[0] + fieldHash;
        return Control.CONTINUE;
      }
    });
    return result[0];
  }

  @Override
  public final String toString() {
    final StringBuilder buf = new StringBuilder(getClass().getSimpleName()).append("{ ");
    final boolean[] needsComma = { false };

    ReflectionHelper.forEach(this, new ReflectionHelper.FieldVisitor() {
      @Override
      protected Control visit(Field field, Object value) {
        if (needsComma[0])
          buf.append(", ");
        needsComma[0] = true;
        buf.append(field.getName()).append(": ");
        if (value == null)
          buf.append("(null)");
        else if (value instanceof Object[])
          buf.append(Arrays.deepToString((Object[]) value));
        else
          buf.append(value);
        return Control.CONTINUE;
      }
    });

    return buf.append(" }").toString();
  }
}
