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

import java.util.Collections;
import java.util.HashMap;
import java.util.Locale;
import java.util.Map;

import org.lman.docmerge.json.JsonView;
import org.lman.docmerge.json.JsonView.ObjectVisitor;

/**
 * The path-to-type table supplied by the data provider, used to pick an implicit format for
 * fields that don't name one. Types are data-source type names (CURRENCY, DOUBLE, PHONE, ...)
 * and are matched case-insensitively.
 */
public class FieldTypes {

  public static final FieldTypes EMPTY = new FieldTypes(Collections.<String, String>emptyMap());

  private static final Map<String, String> FORMAT_FOR_TYPE = new HashMap<String, String>();

  static {
    FORMAT_FOR_TYPE.put("currency", ValueFormatter.CURRENCY);
    FORMAT_FOR_TYPE.put("percent", ValueFormatter.PERCENT);
    FORMAT_FOR_TYPE.put("date", ValueFormatter.DATE);
    FORMAT_FOR_TYPE.put("datetime", ValueFormatter.DATETIME);
    FORMAT_FOR_TYPE.put("time", ValueFormatter.TIME);
    FORMAT_FOR_TYPE.put("phone", ValueFormatter.PHONE);
    FORMAT_FOR_TYPE.put("number", ValueFormatter.NUMBER);
    FORMAT_FOR_TYPE.put("double", ValueFormatter.NUMBER);
    FORMAT_FOR_TYPE.put("decimal", ValueFormatter.NUMBER);
    FORMAT_FOR_TYPE.put("integer", ValueFormatter.NUMBER);
    FORMAT_FOR_TYPE.put("int", ValueFormatter.NUMBER);
    FORMAT_FOR_TYPE.put("image", ValueFormatter.IMAGE);
  }

  private final Map<String, String> types;

  public FieldTypes(Map<String, String> types) {
    this.types = new HashMap<String, String>(types);
  }

  /** Reads a table from an object view whose members map paths to type names. */
  public static FieldTypes fromView(JsonView view) {
    final Map<String, String> types = new HashMap<String, String>();
    view.asObjectForeach(new ObjectVisitor() {
      @Override
      public void visit(String key, JsonView value) {
        if (value.getType() == JsonView.Type.STRING)
          types.put(key, value.asString());
      }
    });
    return new FieldTypes(types);
  }

  /**
   * The declared type of |path|: an exact path entry first, then an entry for the path's
   * trailing field name. Null if neither exists.
   */
  public String typeOf(String path) {
    String type = types.get(path);
    if (type != null)
      return type;
    int dot = path.lastIndexOf('.');
    return dot == -1 ? null : types.get(path.substring(dot + 1));
  }

  /** The format implied by the type of |path|, or null for none (generic stringification). */
  public String implicitFormat(String path) {
    String type = typeOf(path);
    if (type == null)
      return null;
    return FORMAT_FOR_TYPE.get(type.toLowerCase(Locale.ROOT));
  }
}
