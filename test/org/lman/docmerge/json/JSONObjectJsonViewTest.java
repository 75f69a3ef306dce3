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
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;

import java.math.BigDecimal;

import org.json.JSONObject;
import org.junit.Test;
import org.lman.docmerge.json.JsonView.Type;

public class JSONObjectJsonViewTest {

  private final JsonView json = new JSONObjectJsonView(
      "{ \"Account\": { \"Name\": \"Acme\", \"Phone\": null, \"Tags\": [\"a\", \"b\"] },"
      + "  \"Total\": 93150.00, \"Count\": 3, \"Active\": true }");

  @Test
  public void types() {
    assertEquals(Type.OBJECT, json.getType());
    assertEquals(Type.OBJECT, json.get("Account").getType());
    assertEquals(Type.ARRAY, json.get("Account.Tags").getType());
    assertEquals(Type.NUMBER, json.get("Total").getType());
    assertEquals(Type.BOOLEAN, json.get("Active").getType());
    BigDecimal total = new BigDecimal(json.get("Total").asNumber().toString());
    assertEquals(0, new BigDecimal("93150").compareTo(total));
    assertEquals(3, json.get("Count").asNumber().intValue());
  }

  @Test
  public void paths() {
    assertEquals("Acme", json.get("Account.Name").asString());
    assertTrue(json.get("Account.Phone").isNull());
    assertNull(json.get("Account.Fax"));
    assertNull(json.get("Account.Phone.Extension"));
    assertNull(json.get("Account.Tags.0"));
    assertEquals(2, json.get("Account.Tags").asArraySize());
  }

  @Test
  public void wrapping() {
    assertTrue(JsonViews.wrap(JSONObject.NULL).isNull());
    assertEquals(Type.OBJECT, JsonViews.wrap(new JSONObject()).getType());
    assertTrue(JsonViews.wrap(new JSONObject()).asObjectIsEmpty());
    assertTrue(JsonViews.wrap(json) == json);
  }
}
