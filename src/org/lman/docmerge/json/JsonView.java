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
 * A read-only, tagged view over merge data as JSON: every value is exactly one of
 * {@link Type}'s kinds.
 *
 * Path resolution ({@link #get}) distinguishes two kinds of "nothing": it returns Java
 * {@code null} when a path is unresolved (a missing key, or an intermediate value that is null
 * or not an object), and a view whose type is {@link Type#NULL} when the final value is present
 * but null.
 *
 * @author kalman
 *
 */
public interface JsonView {

  interface ArrayVisitor {
    void visit(JsonView value, int index);
  }

  interface ObjectVisitor {
    void visit(String key, JsonView value);
  }

  enum Type {
    NULL,
    BOOLEAN,
    NUMBER,
    STRING,
    ARRAY,
    OBJECT
  }

  Type getType();

  /**
   * If the underlying object is of class |clazz|, returns the object as that class. Otherwise
   * returns null.
   */
  <E> E asInstance(Class<E> clazz);

  // Cast operations to non-collections.
  boolean isNull();
  boolean asBoolean();
  Number asNumber();
  String asString();

  // Operations over collections.
  int asArraySize();
  void asArrayForeach(ArrayVisitor visitor);
  boolean asObjectIsEmpty();
  void asObjectForeach(ObjectVisitor visitor);

  /**
   * Resolves a dot-separated path against this view. Never throws and never has side effects;
   * see the class comment for the unresolved/null distinction.
   */
  JsonView get(String path);
}
