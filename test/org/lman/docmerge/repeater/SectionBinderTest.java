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

package org.lman.docmerge.repeater;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.fail;

import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.junit.Test;
import org.lman.docmerge.context.MergeContext;
import org.lman.docmerge.json.JsonView;
import org.lman.docmerge.template.TagScanner;

public class SectionBinderTest {

  private final SectionBinder binder = new SectionBinder();

  private static Map<String, Object> map(Object... keysAndValues) {
    Map<String, Object> map = new LinkedHashMap<String, Object>();
    for (int i = 0; i < keysAndValues.length; i += 2)
      map.put((String) keysAndValues[i], keysAndValues[i + 1]);
    return map;
  }

  private static RepeaterSection section(String marker) {
    return new RepeaterSection(TagScanner.wholeTag(marker), null);
  }

  private static MergeContext context() {
    return new MergeContext.Builder()
        .addRecord(map(
            "Name", "Acme",
            "Nothing", null,
            "Empty", Collections.emptyList(),
            "LineItems", Arrays.asList(
                map("Product", "Widget", "Parts", Arrays.asList("bolt", "nut")),
                map("Product", "Gadget"))))
        .addNamedSource("Contacts", Arrays.asList(map("Name", "Ann")))
        .build();
  }

  @Test
  public void collections() {
    List<JsonView> items = binder.bind(section("{{#LineItems}}"), context());
    assertEquals(2, items.size());
    assertEquals("Gadget", items.get(1).get("Product").asString());
  }

  @Test
  public void namedSources() {
    RepeaterSection contacts = section("{{@Contacts}}");
    assertEquals(RepeaterSection.BindingKind.NAMED_SOURCE, contacts.bindingKind);
    assertEquals("Ann", binder.bind(contacts, context()).get(0).get("Name").asString());
  }

  @Test
  public void childCollectionsOfTheCurrentRecord() {
    MergeContext outer = context();
    JsonView widget = binder.bind(section("{{#LineItems}}"), outer).get(0);
    MergeContext row = outer.forRecord(widget, Collections.<String, Object>emptyMap());

    List<JsonView> parts = binder.bind(section("{{#Parts}}"), row);
    assertEquals(2, parts.size());
    assertEquals("nut", parts.get(1).asString());
    // The enclosing context is still visible.
    assertEquals(1, binder.bind(section("{{@Contacts}}"), row).size());
  }

  @Test
  public void recordCollectionsWinOverNamedSources() {
    MergeContext context = new MergeContext.Builder()
        .addRecord(map("Items", Arrays.asList(map("N", "rec"))))
        .addNamedSource("Items", Arrays.asList(map("N", "src")))
        .build();
    assertEquals("rec", binder.bind(section("{{#Items}}"), context).get(0).get("N").asString());

    // Without an array on the record, the named source is used.
    MergeContext scalar = new MergeContext.Builder()
        .addRecord(map("Items", "none"))
        .addNamedSource("Items", Arrays.asList(map("N", "src")))
        .build();
    assertEquals("src", binder.bind(section("{{#Items}}"), scalar).get(0).get("N").asString());
  }

  @Test
  public void noRecords() {
    assertMissing("{{#Missing}}", "Missing", "'Missing' is missing");
    assertMissing("{{#Nothing}}", "Nothing", "'Nothing' is missing");
    assertMissing("{{#Name}}", "Name", "'Name' is a STRING, not a list");
    assertMissing("{{#Empty}}", "Empty", "'Empty' is empty");
    assertMissing("{{@Missing}}", "Missing", "'Missing' is missing");
  }

  private void assertMissing(String marker, String name, String problem) {
    try {
      binder.bind(section(marker), context());
      fail("Expected " + marker + " to have no records");
    } catch (MissingSectionDataException e) {
      assertEquals(name, e.getSection());
      assertEquals("Section " + marker + " has no records to repeat: " + problem, e.getMessage());
    }
  }
}
