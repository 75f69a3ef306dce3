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

/**
 * Shared behaviour for {@link JsonView} implementations: type checks, and dot-path walking in
 * terms of a single-key {@link #member} lookup.
 */
public abstract class AbstractJsonView implements JsonView {

  /**
   * Looks up a direct member of this (object-typed) view. Returns null if there is no such
   * member, and a NULL-typed view if the member is present but null.
   */
  protected abstract JsonView member(String key);

  @Override
  public boolean isNull() {
    return getType() == Type.NULL;
  }

  @Override
  public boolean asBoolean() {
    throw unexpectedType(Type.BOOLEAN);
  }

  @Override
  public Number asNumber() {
    throw unexpectedType(Type.NUMBER);
  }

  @Override
  public String asString() {
    throw unexpectedType(Type.STRING);
  }

  @Override
  public int asArraySize() {
    throw unexpectedType(Type.ARRAY);
  }

  @Override
  public void asArrayForeach(ArrayVisitor visitor) {
    throw unexpectedType(Type.ARRAY);
  }

  @Override
  public boolean asObjectIsEmpty() {
    throw unexpectedType(Type.OBJECT);
  }

  @Override
  public void asObjectForeach(ObjectVisitor visitor) {
    throw unexpectedType(Type.OBJECT);
  }

  @Override
  public final JsonView get(String path) {
    if (path == null || path.isEmpty())
      return null;

    JsonView current = this;
    int start = 0;
    while (true) {
      int dot = path.indexOf('.', start);
      String key = (dot == -1) ? path.substring(start) : path.substring(start, dot);
      if (key.isEmpty() || current.getType() != Type.OBJECT)
        return null;

      current = (current instanceof AbstractJsonView) ?
          ((AbstractJsonView) current).member(key) : current.get(key);
      if (current == null)
        return null;
      if (dot == -1)
        return current;
      start = dot + 1;
    }
  }

  protected final void checkIsType(Type type) {
    if (getType() != type)
      throw unexpectedType(type);
  }

  private UnsupportedOperationException unexpectedType(Type expected) {
    return new UnsupportedOperationException(
        "Unexpected type " + getType() + ", expected " + expected);
  }
}
