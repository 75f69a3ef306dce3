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

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.junit.Before;
import org.junit.Test;
import org.lman.docmerge.MergeOptions;
import org.lman.docmerge.json.JsonViews;

public class ValueFormatterTest {

  // 2024-03-15T18:30:00Z
  private static final long EPOCH_MILLIS = 1710527400000L;

  private final ValueFormatter formatter = new ValueFormatter();
  private List<String> warnings;

  @Before
  public void setUp() {
    warnings = new ArrayList<String>();
  }

  private String format(Object value, String format) {
    return formatter.format(JsonViews.wrap(value), format, warnings);
  }

  private void assertNoWarnings() {
    assertTrue(warnings.toString(), warnings.isEmpty());
  }

  @Test
  public void currency() {
    assertEquals("$93,150.00", format(93150.0, "currency"));
    assertEquals("$0.50", format(0.5, "currency"));
    assertEquals("-$1,234.50", format(-1234.5, "currency"));
    assertEquals("$1,234.50", format("$1,234.5", "currency"));
    assertEquals("$1,000.00", format(1000, "CURRENCY"));
    assertNoWarnings();
  }

  @Test
  public void currencyKeepsTheSymbolItCarries() {
    assertEquals("€1,234.50", format("€1,234.5", "currency"));
    assertEquals("-£12.00", format("-£12", "currency"));
    assertNoWarnings();
  }

  @Test
  public void currencyInAnotherLocale() {
    MergeOptions options = new MergeOptions();
    options.locale = "de-DE";
    options.currencySymbol = "€";
    assertEquals("€93.150,00",
        new ValueFormatter(options).format(JsonViews.wrap(93150), "currency", null));
  }

  @Test
  public void numbers() {
    assertEquals("1,234.568", format(1234.5678, "number"));
    assertEquals("1,000,000", format(1000000, "number"));
    assertEquals("3.14", format(3.14159, "2"));
    assertEquals("3", format(2.5, "0"));
    assertEquals("12.000", format("12", "3"));
    assertEquals("1.50", format(1.5, "02"));
    assertNoWarnings();
  }

  @Test
  public void tooManyDecimalPlaces() {
    assertEquals("1.5", format(1.5, "99999999999"));
    assertEquals("1.5", format(1.5, "100000000"));
    assertEquals(Arrays.asList(
        "Cannot format '1.5' as 99999999999; rendering it as is",
        "Cannot format '1.5' as 100000000; rendering it as is"), warnings);
  }

  @Test
  public void percent() {
    assertEquals("5.0%", format(5.0, "percent"));
    assertEquals("50.0%", format(0.5, "percent"));
    assertEquals("12.3%", format(12.345, "percent"));
    assertEquals("0.0%", format(0, "percent"));
    assertEquals("150.0%", format(150, "percent"));
    assertNoWarnings();
  }

  @Test
  public void dates() {
    assertEquals("March 15, 2024", format("2024-03-15", "date"));
    assertEquals("March 5, 2024", format("3/5/2024", "date"));
    assertEquals("March 15, 2024", format(LocalDate.of(2024, 3, 15), "date"));
    assertEquals("March 15, 2024 6:30 PM", format(EPOCH_MILLIS, "datetime"));
    assertEquals("March 15, 2024 6:30 PM", format(String.valueOf(EPOCH_MILLIS), "datetime"));
    assertEquals("March 15, 2024 6:30 PM", format("2024-03-15T18:30:00", "datetime"));
    assertEquals("9:05 AM", format("09:05", "time"));
    // Offsets are converted to the configured zone, UTC by default.
    assertEquals("March 16, 2024", format("2024-03-15T23:30:00-05:00", "date"));
    assertNoWarnings();
  }

  @Test
  public void datesInAnotherZone() {
    MergeOptions options = new MergeOptions();
    options.timeZone = "America/New_York";
    assertEquals("March 15, 2024 2:30 PM",
        new ValueFormatter(options).format(JsonViews.wrap(EPOCH_MILLIS), "datetime", null));
  }

  @Test
  public void phone() {
    assertEquals("(415) 555-1234", format("4155551234", "phone"));
    assertEquals("(415) 555-1234", format("1-415-555-1234", "phone"));
    assertEquals("(415) 555-1234", format("+1 (415) 555 1234", "phone"));
    assertEquals("(415) 555-1234", format(4155551234L, "phone"));
    assertEquals("555-1234", format("555-1234", "phone"));
    assertEquals("555-1234 ext. 12", format("555-1234 ext. 12", "phone"));
    assertNoWarnings();
  }

  @Test
  public void casing() {
    assertEquals("ACME CORP", format("Acme Corp", "uppercase"));
    assertEquals("acme corp", format("Acme Corp", "lowercase"));
    assertEquals("Hello world", format("hELLO WORLD", "capitalize"));
    assertEquals("", format("", "capitalize"));
    assertNoWarnings();
  }

  @Test
  public void casingFollowsTheLocale() {
    MergeOptions options = new MergeOptions();
    options.locale = "tr-TR";
    ValueFormatter turkish = new ValueFormatter(options);
    assertEquals("\u0130stanbul", turkish.format(JsonViews.wrap("istanbul"), "capitalize", null));
    assertEquals("\u0130ZM\u0130R", turkish.format(JsonViews.wrap("izmir"), "uppercase", null));
  }

  @Test
  public void uninterpretableValuesRenderAsIs() {
    assertEquals("abc", format("abc", "currency"));
    assertEquals("soon", format("soon", "date"));
    assertEquals("Yes", format(true, "number"));
    assertEquals(3, warnings.size());
    assertEquals("Cannot format 'abc' as currency; rendering it as is", warnings.get(0));
  }

  @Test
  public void unknownFormat() {
    assertEquals("Acme", format("Acme", "fancy"));
    assertEquals(Arrays.asList("Unknown format 'fancy'; rendering the value as is"), warnings);
  }

  @Test
  public void stringify() {
    assertEquals("Yes", formatter.stringify(JsonViews.wrap(true)));
    assertEquals("No", formatter.stringify(JsonViews.wrap(false)));
    assertEquals("5", formatter.stringify(JsonViews.wrap(5.0)));
    assertEquals("2.5", formatter.stringify(JsonViews.wrap(2.50)));
    assertEquals("a, 1, Yes", formatter.stringify(JsonViews.wrap(Arrays.asList("a", 1, true))));
    assertEquals("March 15, 2024", formatter.stringify(JsonViews.wrap(LocalDate.of(2024, 3, 15))));
    assertEquals("", formatter.stringify(JsonViews.wrap(null)));

    Map<String, Object> object = new LinkedHashMap<String, Object>();
    object.put("a", 1);
    assertEquals("{\"a\":1}", formatter.stringify(JsonViews.wrap(object)));
  }
}
