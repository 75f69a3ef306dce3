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
import java.lang.reflect.InvocationTargetException;
import java.time.temporal.TemporalAccessor;
import java.util.Date;

import org.json.JSONException;
import org.json.JSONObject;
import org.json.JSONStringer;
import org.lman.docmerge.common.ReflectionHelper;
import org.lman.docmerge.json.JsonView.ArrayVisitor;
import org.lman.docmerge.json.JsonView.ObjectVisitor;

/**
 * Conversion between JSON text and Java: reading flat option objects (public fields of
 * strings, numbers, booleans and enums) and writing any {@link JsonView} as JSON text.
 */
public class JsonConverter {

  private JsonConverter() {}

  /**
   * Reads |json| into a new instance of |clazz|, which needs a public no-arg constructor. Keys
   * missing from the JSON leave the field's initial value in place; unknown keys are ignored.
   *
   * @throws IllegalArgumentException if the text isn't a JSON object or a value doesn't fit
   *     the field it is read into.
   */
  public static <E> E fromJson(String json, Class<E> clazz) {
    JSONObject object;
    try {
      object = new JSONObject(json);
    } catch (JSONException e) {
      throw new IllegalArgumentException("Not a JSON object: " + e.getMessage(), e);
    }

    E instance;
    try {
      instance = clazz.getConstructor().newInstance();
    } catch (NoSuchMethodException e) {
      throw new IllegalArgumentException(clazz + " has no public no-arg constructor", e);
    } catch (InstantiationException e) {
      throw new IllegalArgumentException(e);
    } catch (IllegalAccessException e) {
      throw new IllegalArgumentException(e);
    } catch (InvocationTargetException e) {
      throw new IllegalArgumentException(e.getCause());
    }

    for (Field field : ReflectionHelper.publicFields(clazz, true)) {
      if (!object.has(field.getName()))
        continue;
      try {
        field.set(instance, readValue(object.get(field.getName()), field));
      } catch (IllegalAccessException e) {
        throw new IllegalArgumentException("Cannot set " + field.getName(), e);
      }
    }
    return instance;
  }

  private static Object readValue(Object json, Field field) {
    Class<?> clazz = field.getType();
    if (JSONObject.NULL.equals(json)) {
      if (clazz.isPrimitive())
        throw new IllegalArgumentException(field.getName() + " cannot be null");
      return null;
    }

    if (clazz == String.class)
      return json.toString();
    if (clazz == Boolean.class || clazz == boolean.class) {
      if (json instanceof Boolean)
        return json;
      throw mismatch(field, json, "a boolean");
    }
    if (clazz == Integer.class || clazz == int.class) {
      if (json instanceof Number)
        return Integer.valueOf(((Number) json).intValue());
      throw mismatch(field, json, "a number");
    }
    if (clazz == Long.class || clazz == long.class) {
      if (json instanceof Number)
        return Long.valueOf(((Number) json).longValue());
      throw mismatch(field, json, "a number");
    }
    if (clazz.isEnum())
      return readEnum(json, field);
    throw new IllegalArgumentException(
        "Unsupported field type " + clazz.getSimpleName() + " for " + field.getName());
  }

  private static Enum<?> readEnum(Object json, Field field) {
    if (!(json instanceof String))
      throw mismatch(field, json, "a string");
    for (Object asObject : field.getType().getEnumConstants()) {
      Enum<?> asEnum = (Enum<?>) asObject;
      if (asEnum.name().equalsIgnoreCase((String) json))
        return asEnum;
    }
    throw new IllegalArgumentException(
        field.getType().getSimpleName() + " has no matching constant for " + json);
  }

  private static IllegalArgumentException mismatch(Field field, Object json, String expected) {
    return new IllegalArgumentException(
        field.getName() + " should be " + expected + " but was " + json);
  }

  /**
   * Writes a view as compact JSON text. Dates are written as their string form, object
   * members that are null are left out.
   */
  public static String toJson(JsonView json) {
    JSONStringer out = new JSONStringer();
    writeJson(json, out);
    return out.toString();
  }

  public static String toJson(Object object) {
    return toJson(JsonViews.wrap(object));
  }

  private static void writeJson(JsonView json, final JSONStringer out) {
    switch (json.getType()) {
      case NULL:
        out.value(null);
        break;

      case BOOLEAN:
        out.value(json.asBoolean());
        break;

      case NUMBER:
        out.value(json.asNumber());
        break;

      case STRING:
        out.value(json.asString());
        break;

      case ARRAY:
        out.array();
        json.asArrayForeach(new ArrayVisitor() {
          @Override
          public void visit(JsonView value, int index) {
            writeJson(value, out);
          }
        });
        out.endArray();
        break;

      case OBJECT:
        if (json.asInstance(TemporalAccessor.class) != null
            || json.asInstance(Date.class) != null) {
          out.value(json.toString());
          break;
        }
        out.object();
        json.asObjectForeach(new ObjectVisitor() {
          @Override
          public void visit(String key, JsonView value) {
            if (value.isNull())
              return;
            out.key(key);
            writeJson(value, out);
          }
        });
        out.endObject();
        break;
    }
  }
}
