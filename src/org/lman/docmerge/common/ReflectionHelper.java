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
import java.lang.reflect.Modifier;
import java.util.ArrayList;
import java.util.List;

/**
 * Reflection over the public instance fields of value objects ({@link Struct}s, merge data
 * POJOs and option holders).
 */
public class ReflectionHelper {

  private ReflectionHelper() {}

  public static abstract class FieldVisitor {
    protected enum Control { CONTINUE, BREAK }

    private Object returnValue = null;

    protected abstract Control visit(Field field, Object value);

    protected Control breakAndReturn(Object value) {
      returnValue = value;
      return Control.BREAK;
    }
  }

  /**
   * Public, non-static fields of |clazz| in declaration order, optionally skipping those
   * annotated {@link Transient}.
   */
  public static List<Field> publicFields(Class<?> clazz, boolean includeTransient) {
    List<Field> fields = new ArrayList<Field>();
    for (Field field : clazz.getFields()) {
      if (Modifier.isStatic(field.getModifiers()))
        continue;
      if (!includeTransient && field.getAnnotation(Transient.class) != null)
        continue;
      fields.add(field);
    }
    return fields;
  }

  /**
   * Visits each non-transient public field of |obj| until the visitor breaks, and returns
   * whatever the visitor returned on breaking (or null).
   */
  public static Object forEach(Object obj, FieldVisitor visitor) {
    for (Field field : publicFields(obj.getClass(), false)) {
      Object fieldValue;
      try {
        fieldValue = field.get(obj);
      } catch (IllegalAccessException e) {
        throw new IllegalArgumentException(e);
      }

      if (visitor.visit(field, fieldValue) == FieldVisitor.Control.BREAK)
        break;
    }

    return visitor.returnValue;
  }

  /**
   * Returns the value of the public field |fieldName| on |obj|, or null if there is no such
   * accessible field.
   */
  public static Object getOrNull(Object obj, String fieldName) {
    try {
      Field field = obj.getClass().getField(fieldName);
      if (Modifier.isStatic(field.getModifiers()))
        return null;
      return field.get(obj);
    } catch (SecurityException e) {
      return null;
    } catch (IllegalAccessException e) {
      return null;
    } catch (NoSuchFieldException e) {
      return null;
    }
  }

  /** Whether |obj| declares a public instance field called |fieldName|. */
  public static boolean hasField(Object obj, String fieldName) {
    try {
      return !Modifier.isStatic(obj.getClass().getField(fieldName).getModifiers());
    } catch (NoSuchFieldException e) {
      return false;
    }
  }

}
