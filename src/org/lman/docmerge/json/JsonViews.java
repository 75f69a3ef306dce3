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

import java.util.ArrayList;
import java.util.List;

import org.json.JSONArray;
import org.json.JSONObject;
import org.lman.docmerge.json.JsonView.ArrayVisitor;

/** Static helpers over {@link JsonView}s. */
public class JsonViews {

  private JsonViews() {}

  /**
   * Wraps an arbitrary value as a view: views are returned as-is, org.json values get a
   * {@link JSONObjectJsonView}, everything else a {@link PojoJsonView}.
   */
  public static JsonView wrap(Object value) {
    if (value instanceof JsonView)
      return (JsonView) value;
    if (value instanceof JSONObject || value instanceof JSONArray || JSONObject.NULL == value)
      return JSONObjectJsonView.wrap(value);
    return new PojoJsonView(value);
  }

  /** The elements of an ARRAY view, in order. */
  public static List<JsonView> toList(JsonView array) {
    final List<JsonView> items = new ArrayList<JsonView>(array.asArraySize());
    array.asArrayForeach(new ArrayVisitor() {
      @Override
      public void visit(JsonView value, int index) {
        items.add(value);
      }
    });
    return items;
  }

  public static boolean isArray(JsonView view) {
    return view != null && view.getType() == JsonView.Type.ARRAY;
  }
}
