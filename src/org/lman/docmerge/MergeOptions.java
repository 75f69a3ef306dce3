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

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.time.ZoneId;
import java.util.Locale;

import org.lman.docmerge.common.Struct;
import org.lman.docmerge.expr.ExpressionEvaluator.ErrorPolicy;
import org.lman.docmerge.json.JsonConverter;

/**
 * Tunables of a {@link DocumentMerger}. Every field has a default, so an options file only
 * needs the keys it changes, e.g.
 *
 * <pre>
 *   { "maxConditionalIterations": 30, "expressionErrorPolicy": "throw" }
 * </pre>
 */
public class MergeOptions extends Struct {

  /** Passes the inline conditional processor may make over one text before giving up. */
  public int maxConditionalIterations = 20;

  /** Sections bound to more records than this are merged with a warning. */
  public int oversizedSectionThreshold = 100;

  /** BCP 47 tag for number and date rendering. */
  public String locale = "en-US";

  /** Zone that instants (epoch millis, offset date-times) are rendered in. */
  public String timeZone = "UTC";

  public String currencySymbol = "$";

  public ErrorPolicy expressionErrorPolicy = ErrorPolicy.FALSE_WITH_WARNING;

  public static MergeOptions fromJson(String json) {
    return JsonConverter.fromJson(json, MergeOptions.class);
  }

  public static MergeOptions load(File file) throws IOException {
    return fromJson(new String(Files.readAllBytes(file.toPath()), StandardCharsets.UTF_8));
  }

  public Locale getLocale() {
    return Locale.forLanguageTag(locale);
  }

  public ZoneId getZoneId() {
    return ZoneId.of(timeZone);
  }
}
