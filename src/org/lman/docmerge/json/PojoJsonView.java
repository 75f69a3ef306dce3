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

package org.lman.docmerge.json;

import java.lang.reflect.Field;
import java.time.temporal.TemporalAccessor;
import java.util.Collection;
import java.util.Date;
import java.util.Map;

import org.lman.docmerge.common.ReflectionHelper;

/**
 * A JSON view over a plain Java value: boxed scalars, strings and enums, arrays and
 * collections, maps with string keys, dates, and objects with public fields.
 *
 * Dates ({@link Date} and {@link TemporalAccessor}) are OBJECTs with no members; formatters
 * recognise them through {@link #asInstance}.
 */
public class PojoJsonView extends AbstractJsonView {

  private final Object pojo;

  // Lazily-determined type.
  private Type type = null;

  public PojoJsonView(Object pojo) {
    this.pojo = pojo;
  }

  @Override
  public Type getType() {
    if (type == null) {
      if (pojo == null) {
        type = Type.NULL;
      } else if (pojo instanceof Boolean) {
        type = Type.BOOLEAN;
      } else if (pojo instanceof Number) {
        type = Type.NUMBER;
      } else if (pojo instanceof Enum || pojo instanceof CharSequence) {
        type = Type.STRING;
      } else if (pojo instanceof Object[] || pojo instanceof Collection) {
        type = Type.ARRAY;
      } else {
        type = Type.OBJECT;
      }
    }
    return type;
  }

  @Override
  public <E> E asInstance(Class<E> clazz) {
    if (pojo != null && clazz.isInstance(pojo))
      return clazz.cast(pojo);
    return null;
  }

  @Override
  public boolean asBoolean() {
    checkIsType(Type.BOOLEAN);
    return ((Boolean) pojo).booleanValue();
  }

  @Override
  public Number asNumber() {
    checkIsType(Type.NUMBER);
    return (Number) pojo;
  }

  @Override
  public String asString() {
    checkIsType(Type.STRING);
    if (pojo instanceof Enum)
      return ((Enum<?>) pojo).name();
    return pojo.toString();
  }

  @Override
  public int asArraySize() {
    checkIsType(Type.ARRAY);
    if (pojo instanceof Object[])
      return ((Object[]) pojo).length;
    return ((Collection<?>) pojo).size();
  }

  @Override
  public void asArrayForeach(ArrayVisitor visitor) {
    checkIsType(Type.ARRAY);
    if (pojo instanceof Object[]) {
      Object[] array = (Object[]) pojo;
      for (int i = 0; i < array.length; i++)
        visitor.visit(JsonViews.wrap(array[i]), i);
    } else {
      int i = 0;
      for (Object value : (Collection<?>) pojo)
        visitor.visit(JsonViews.wrap(value), i++);
    }
  }

  @Override
  public boolean asObjectIsEmpty() {
    checkIsType(Type.OBJECT);
    if (pojo instanceof Map)
      return ((Map<?, ?>) pojo).isEmpty();
    return ReflectionHelper.publicFields(pojo.getClass(), false).isEmpty();
  }

  @Override
  public void asObjectForeach(ObjectVisitor visitor) {
    checkIsType(Type.OBJECT);
    if (pojo instanceof Map) {
      for (Map.Entry<?, ?> entry : ((Map<?, ?>) pojo).entrySet()) {
        if (!(entry.getKey() instanceof String))
          throw new UnsupportedOperationException("Illegal key type: " + entry.getKey().getClass());
        visitor.visit((String) entry.getKey(), JsonViews.wrap(entry.getValue()));
      }
    } else {
      for (Field field : ReflectionHelper.publicFields(pojo.getClass(), false)) {
        try {
          visitor.visit(field.getName(), JsonViews.wrap(field.get(pojo)));
        } catch (IllegalAccessException e) {
          throw new UnsupportedOperationException(e);
        }
      }
    }
  }

  @Override
  protected JsonView member(String key) {
    if (pojo instanceof Map) {
      Map<?, ?> map = (Map<?, ?>) pojo;
      if (!map.containsKey(key))
        return null;
      return JsonViews.wrap(map.get(key));
    }
    if (!ReflectionHelper.hasField(pojo, key))
      return null;
    return JsonViews.wrap(ReflectionHelper.getOrNull(pojo, key));
  }

  @Override
  public boolean equals(Object o) {
    if (o == this)
      return true;
    if (o == null || o.getClass() != getClass())
      return false;
    PojoJsonView other = (PojoJsonView) o;
    if (pojo == null)
      return other.pojo == null;
    else
      return pojo.equals(other.pojo);
  }

  @Override
  public int hashCode() {
    return pojo == null ? 0 : pojo.hashCode();
  }

  @Override
  public String toString() {
    return pojo + "";
  }

}
