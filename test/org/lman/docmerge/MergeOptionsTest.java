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

package org.lman.docmerge;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.fail;

import java.io.File;
import java.io.IOException;
import java.time.ZoneId;
import java.util.Locale;

import org.junit.Test;
import org.lman.docmerge.expr.ExpressionEvaluator.ErrorPolicy;

public class MergeOptionsTest {

  @Test
  public void defaults() {
    MergeOptions options = MergeOptions.fromJson("{}");
    assertEquals(new MergeOptions(), options);
    assertEquals(20, options.maxConditionalIterations);
    assertEquals(100, options.oversizedSectionThreshold);
    assertEquals(Locale.US, options.getLocale());
    assertEquals(ZoneId.of("UTC"), options.getZoneId());
    assertEquals("$", options.currencySymbol);
    assertEquals(ErrorPolicy.FALSE_WITH_WARNING, options.expressionErrorPolicy);
  }

  @Test
  public void load() throws IOException {
    MergeOptions options = MergeOptions.load(new File("test/org/lman/docmerge/options.json"));
    assertEquals(30, options.maxConditionalIterations);
    assertEquals(100, options.oversizedSectionThreshold);
    assertEquals(ErrorPolicy.THROW, options.expressionErrorPolicy);
    assertEquals(Locale.GERMANY, options.getLocale());
    assertEquals("€", options.currencySymbol);
    assertEquals(ErrorPolicy.THROW, new DocumentMerger(options).getOptions().expressionErrorPolicy);
  }

  @Test
  public void badValues() {
    for (String json : new String[] {
        "not json",
        "{\"maxConditionalIterations\": \"many\"}",
        "{\"expressionErrorPolicy\": \"sometimes\"}",
        "{\"oversizedSectionThreshold\": null}" }) {
      try {
        MergeOptions.fromJson(json);
        fail("Expected " + json + " to be rejected");
      } catch (IllegalArgumentException e) {
        // Expected.
      }
    }
  }
}
