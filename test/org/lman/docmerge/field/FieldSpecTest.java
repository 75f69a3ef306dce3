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
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;

import org.junit.Test;

public class FieldSpecTest {

  @Test
  public void plainPath() {
    FieldSpec spec = FieldSpec.parse("Account.Name");
    assertEquals("Account.Name", spec.path);
    assertNull(spec.format);
    assertNull(spec.defaultValue);
    assertFalse(spec.hasDefault());
  }

  @Test
  public void format() {
    assertEquals(new FieldSpec("Amount", "currency", null), FieldSpec.parse("Amount:currency"));
    assertEquals(new FieldSpec("Amount", "2", null), FieldSpec.parse(" Amount : 2 "));
    assertEquals(new FieldSpec("Amount", null, null), FieldSpec.parse("Amount:"));
  }

  @Test
  public void defaults() {
    assertEquals(new FieldSpec("Amount", "currency", "N/A"),
        FieldSpec.parse("Amount:currency ?? 'N/A'"));
    assertEquals(new FieldSpec("Note", null, "none"), FieldSpec.parse("Note ?? none"));
    assertEquals(new FieldSpec("Note", null, "a ?? b"), FieldSpec.parse("Note ?? \"a ?? b\""));
    assertEquals(new FieldSpec("Note", null, "it's"), FieldSpec.parse("Note ?? \"it's\""));

    FieldSpec empty = FieldSpec.parse("Note ?? ''");
    assertTrue(empty.hasDefault());
    assertEquals("", empty.defaultValue);
  }
}
