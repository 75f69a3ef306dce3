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

import java.util.Iterator;

import org.json.JSONArray;
import org.json.JSONObject;

/**
 * A JSON view of merge data parsed by org.json, e.g. a record exported from a data provider.
 *
 * @author kalman
 *
 */
public class JSONObjectJsonView extends AbstractJsonView {

  private static class JSONArrayJsonView extends AbstractJsonView {
    private final JSONArray array;

    private JSONArrayJsonView(JSONArray array) {
      this.array = array;
    }

    @Override
    public Type getType() {
      return Type.ARRAY;
    }

    @Override
    public <E> E asInstance(Class<E> clazz) {
      return clazz.isInstance(array) ? clazz.cast(array) : null;
    }

    @Override
    public int asArraySize() {
      return array.length();
    }

    @Override
    public void asArrayForeach(ArrayVisitor visitor) {
      for (int i = 0, length = array.length(); i < length; i++)
        visitor.visit(wrap(array.opt(i)), i);
    }

    @Override
    protected JsonView member(String key) {
      return null;
    }

    @Override
    public String toString() {
      return array.toString();
    }
  }

  private final JSONObject json;

  public JSONObjectJsonView(JSONObject json) {
    this.json = json;
  }

  public JSONObjectJsonView(String json) {
    this(new JSONObject(json));
  }

  @Override
  public Type getType() {
    return Type.OBJECT;
  }

  @Override
  public <E> E asInstance(Class<E> clazz) {
    return clazz.isInstance(json) ? clazz.cast(json) : null;
  }

  @Override
  public boolean asObjectIsEmpty() {
    return json.isEmpty();
  }

  @Override
  public void asObjectForeach(ObjectVisitor visitor) {
    Iterator<String> keys = json.keys();
    while (keys.hasNext()) {
      String key = keys.next();
      visitor.visit(key, wrap(json.opt(key)));
    }
  }

  @Override
  protected JsonView member(String key) {
    if (!json.has(key))
      return null;
    return wrap(json.opt(key));
  }

  @Override
  public String toString() {
    return json.toString();
  }

  static JsonView wrap(Object item) {
    if (item instanceof JSONObject)
      return new JSONObjectJsonView((JSONObject) item);
    else if (item instanceof JSONArray)
      return new JSONArrayJsonView((JSONArray) item);
    else if (item == null || JSONObject.NULL.equals(item))
      return new PojoJsonView(null);
    else
      return new PojoJsonView(item);
  }

}
