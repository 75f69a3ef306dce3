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

import org.json.JSONObject;
import org.junit.Assert;
import org.junit.Test;
import org.lman.docmerge.context.MergeContext;
import org.lman.docmerge.document.SimpleDocument;
import org.lman.docmerge.field.FieldTypes;
import org.lman.docmerge.json.JsonViews;

/**
 * Runs all merge cases found in the "data" directory. A case "name" or "name_suffix" merges
 * name.document with name[_suffix].json and compares the result to name[_suffix].expected.
 *
 * The JSON holds the "record", and optionally named "sources" and "fieldTypes".
 */
public class DocumentMergerDataTest {

  private static final File DATA = new File("test/org/lman/docmerge/data");
  private static final String DOCUMENT_EXT = ".document";
  private static final String JSON_EXT = ".json";
  private static final String EXPECTED_EXT = ".expected";

  static {
    if (!DATA.isDirectory()) {
      throw new AssertionError(DATA + " is not a directory");
    }
  }

  private static class MergeCase {
    private final File documentFile;
    private final File jsonFile;
    private final String expected;

    public MergeCase(String name) throws IOException {
      String[] parts = name.split("_");
      String base = parts[0];
      String suffix = "";
      if (parts.length > 1)
        suffix = "_" + parts[1];

      String dataParent = DATA.getPath() + File.separator;
      this.documentFile = new File(dataParent + base + DOCUMENT_EXT);
      this.jsonFile = new File(dataParent + base + suffix + JSON_EXT);
      this.expected = getContents(new File(dataParent + base + suffix + EXPECTED_EXT));
    }

    public void run() throws IOException {
      SimpleDocument document = SimpleDocument.parse(getContents(documentFile));
      new DocumentMerger().merge(document, toContext(new JSONObject(getContents(jsonFile))));
      Assert.assertEquals(expected, document.toString());
    }
  }

  private static MergeContext toContext(JSONObject json) {
    MergeContext.Builder builder = new MergeContext.Builder()
        .addRecord(json.getJSONObject("record"));
    JSONObject sources = json.optJSONObject("sources");
    if (sources != null) {
      for (String alias : sources.keySet())
        builder.addNamedSource(alias, sources.get(alias));
    }
    JSONObject fieldTypes = json.optJSONObject("fieldTypes");
    if (fieldTypes != null)
      builder.setFieldTypes(FieldTypes.fromView(JsonViews.wrap(fieldTypes)));
    return builder.build();
  }

  /** The file's text, without the final line break. */
  private static String getContents(File file) throws IOException {
    String contents = new String(Files.readAllBytes(file.toPath()), StandardCharsets.UTF_8);
    return contents.endsWith("\n") ? contents.substring(0, contents.length() - 1) : contents;
  }

  private void test(String caseName) {
    try {
      new MergeCase(caseName).run();
    } catch (IOException e) {
      throw new RuntimeException(e);
    }
  }

  @Test
  public void quote() {
    test("quote");
  }

  @Test
  public void quote_1() {
    test("quote_1");
  }

  @Test
  public void guarded() {
    test("guarded");
  }

  @Test
  public void guarded_1() {
    test("guarded_1");
  }

  @Test
  public void nested() {
    test("nested");
  }

  @Test
  public void contacts() {
    test("contacts");
  }
}
