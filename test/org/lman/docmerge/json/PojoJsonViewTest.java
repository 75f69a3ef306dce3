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

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNotNull;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.junit.Before;
import org.junit.Test;
import org.lman.docmerge.common.Struct;
import org.lman.docmerge.json.JsonView.ObjectVisitor;
import org.lman.docmerge.json.JsonView.Type;

public class PojoJsonViewTest {

  public static class EmptyObject extends Struct {
  }

  public enum Status { OPEN, CLOSED }

  public static class TestObject extends Struct {
    public boolean boolean1 = false;
    public Boolean boolean2 = true;

    public int number1 = 0;
    public Double number2 = 42.42;

    public String string1 = "";
    public String string2 = "hello world";
    public String string3 = null;
    public Status status = Status.OPEN;

    public List<TestObject> array1 = new ArrayList<TestObject>();
    public TestObject[] array2 = new TestObject[1];

    public Map<String, TestObject> object1 = new HashMap<String, TestObject>();
    public TestObject object2 = null;
  }

  private TestObject test;

  @Before
  public void setUp() {
    test = new TestObject();
    test.array2[0] = new TestObject();
    test.object1.put("key1", new TestObject());
    test.object1.put("key2", new TestObject());
    test.object1.get("key2").object2 = new TestObject();
    test.object2 = new TestObject();
    test.object2.object2 = new TestObject();
  }

  @Test
  public void emptyObject() {
    EmptyObject empty = new EmptyObject();
    JsonView json = new PojoJsonView(empty);

    assertEquals(Type.OBJECT, json.getType());
    assertEquals(empty, json.asInstance(EmptyObject.class));
    assertNull(json.asInstance(TestObject.class));
    assertTrue(json.asObjectIsEmpty());
  }

  @Test
  public void types() {
    assertEquals(Type.NULL, new PojoJsonView(null).getType());
    assertEquals(Type.BOOLEAN, new PojoJsonView(true).getType());
    assertEquals(Type.NUMBER, new PojoJsonView(3L).getType());
    assertEquals(Type.STRING, new PojoJsonView("x").getType());
    assertEquals(Type.STRING, new PojoJsonView(Status.CLOSED).getType());
    assertEquals("CLOSED", new PojoJsonView(Status.CLOSED).asString());
    assertEquals(Type.ARRAY, new PojoJsonView(Arrays.asList(1, 2)).getType());
    assertEquals(Type.ARRAY, new PojoJsonView(new String[] { "a" }).getType());
    assertEquals(Type.OBJECT, new PojoJsonView(new HashMap<String, Object>()).getType());

    // Dates have no members but can be recovered.
    JsonView date = new PojoJsonView(LocalDate.of(2024, 3, 15));
    assertEquals(Type.OBJECT, date.getType());
    assertNotNull(date.asInstance(LocalDate.class));
  }

  @Test(expected = UnsupportedOperationException.class)
  public void wrongTypeAccess() {
    new PojoJsonView("x").asNumber();
  }

  @Test
  public void testObject() {
    JsonView json = new PojoJsonView(test);
    assertEquals(Type.OBJECT, json.getType());
    assertEquals(test, json.asInstance(TestObject.class));

    final Map<String, JsonView> seen = new HashMap<String, JsonView>();
    json.asObjectForeach(new ObjectVisitor() {
      @Override
      public void visit(String key, JsonView value) {
        assertNull(seen.put(key, value));
      }
    });

    assertEquals(test.boolean1, seen.remove("boolean1").asBoolean());
    assertEquals(test.boolean2, seen.remove("boolean2").asBoolean());
    assertEquals(test.number1, seen.remove("number1").asNumber());
    assertEquals(test.number2, seen.remove("number2").asNumber());
    assertEquals(test.string1, seen.remove("string1").asString());
    assertEquals(test.string2, seen.remove("string2").asString());
    assertTrue(seen.remove("string3").isNull());
    assertEquals("OPEN", seen.remove("status").asString());
    assertEquals(0, seen.remove("array1").asArraySize());
    assertEquals(1, seen.remove("array2").asArraySize());
    assertEquals(2, JsonViews.toList(new PojoJsonView(Arrays.asList("a", "b"))).size());
    assertFalse(seen.remove("object1").asObjectIsEmpty());
    assertEquals(test.object2, seen.remove("object2").asInstance(TestObject.class));

    assertTrue(seen.isEmpty());
  }

  @Test
  public void get() {
    JsonView json = new PojoJsonView(test);
    assertEquals("", json.get("string1").asString());
    assertEquals("", json.get("object1.key1.string1").asString());
    assertEquals("", json.get("object1.key2.object2.string1").asString());
    assertEquals("hello world", json.get("string2").asString());
    assertEquals("hello world", json.get("object2.object2.string2").asString());
    assertNull(json.get("asdasd"));
    assertNull(json.get("asdasd.blah"));
    assertNull(json.get("object1.askjdhjas"));
    assertNull(json.get("object2.object2.dddds"));
  }

  @Test
  public void unresolvedIsNotPresentNull() {
    JsonView json = new PojoJsonView(test);

    // Present, but null.
    assertNotNull(json.get("string3"));
    assertTrue(json.get("string3").isNull());
    assertTrue(json.get("object2.object2.object2").isNull());

    // Walking through a null, or through a non-object, doesn't resolve.
    assertNull(json.get("object2.object2.object2.string1"));
    assertNull(json.get("string2.length"));
    assertNull(json.get("object2..string1"));
    assertNull(json.get(""));
  }

  @Test
  public void maps() {
    Map<String, Object> map = new LinkedHashMap<String, Object>();
    map.put("present", null);
    map.put("nested", new LinkedHashMap<String, Object>(map));

    JsonView json = new PojoJsonView(map);
    assertTrue(json.get("present").isNull());
    assertTrue(json.get("nested.present").isNull());
    assertNull(json.get("absent"));
    assertNull(json.get("nested.absent"));
  }
}
