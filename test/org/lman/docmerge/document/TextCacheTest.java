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

package org.lman.docmerge.document;

import static org.junit.Assert.assertEquals;

import org.junit.Test;

public class TextCacheTest {

  @Test
  public void memoizesUntilInvalidated() {
    SimpleDocument document = SimpleDocument.parse("one\ntwo");
    DocumentNode first = document.getBody().getChild(0);
    TextCache cache = new TextCache();

    assertEquals("one", cache.getText(document, first));
    assertEquals(1, cache.size(document));

    first.setText("changed");
    assertEquals("one", cache.getText(document, first));

    cache.invalidate(document);
    assertEquals(0, cache.size(document));
    assertEquals("changed", cache.getText(document, first));
  }

  @Test
  public void documentsAreKeptApart() {
    SimpleDocument a = SimpleDocument.parse("a");
    SimpleDocument b = SimpleDocument.parse("b");
    TextCache cache = new TextCache();
    cache.getText(a, a.getBody().getChild(0));
    cache.getText(b, b.getBody().getChild(0));

    cache.invalidate(a);
    assertEquals(0, cache.size(a));
    assertEquals(1, cache.size(b));

    cache.clear();
    assertEquals(0, cache.size(b));
  }
}
