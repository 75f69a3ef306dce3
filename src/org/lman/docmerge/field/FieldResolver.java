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

import java.util.List;

import org.lman.docmerge.context.MergeContext;
import org.lman.docmerge.json.JsonView;
import org.lman.docmerge.json.JsonViews;
import org.lman.docmerge.template.Tag;
import org.lman.docmerge.template.TagScanner;

/**
 * Resolves field markers against a {@link MergeContext} and substitutes them into text.
 *
 * Resolution is all-or-nothing: a field either renders (its value, or its default) or the merge
 * fails with an {@link UnresolvedFieldException}.
 */
public class FieldResolver {

  /** Told about each image marker that {@link #substitute} leaves in place. */
  public interface ImageVisitor {
    void visit(String marker, FieldSpec spec, JsonView value);
  }

  private final ValueFormatter formatter;

  public FieldResolver(ValueFormatter formatter) {
    this.formatter = formatter;
  }

  public ValueFormatter getFormatter() {
    return formatter;
  }

  /**
   * Renders one field. Defaults are used verbatim, never formatted.
   *
   * @throws UnresolvedFieldException if the field has no value and no default
   */
  public String resolve(FieldSpec spec, MergeContext context, List<String> warnings) {
    JsonView value = context.resolve(spec.path);
    if (value == null || value.isNull()) {
      if (spec.hasDefault())
        return spec.defaultValue;
      throw new UnresolvedFieldException(spec.path);
    }

    String format = formatOf(spec, context);
    if (format == null)
      return formatter.stringify(value);
    return formatter.format(value, format, warnings);
  }

  /** Whether |spec| names an image, explicitly or through its declared type. */
  public boolean isImage(FieldSpec spec, MergeContext context) {
    String format = formatOf(spec, context);
    return format != null && format.trim().equalsIgnoreCase(ValueFormatter.IMAGE);
  }

  /**
   * Replaces every field marker in |text|. Image markers are left untouched and reported to
   * |images| (if non-null) with their value; other markers (conditionals, sections) are left
   * alone. Text without field markers is returned unchanged.
   */
  public String substitute(
      String text, MergeContext context, ImageVisitor images, List<String> warnings) {
    if (text.indexOf("{{") == -1)
      return text;

    StringBuilder buf = new StringBuilder(text.length());
    int position = 0;
    for (Tag tag : TagScanner.scan(text)) {
      if (tag.kind != Tag.Kind.FIELD || tag.argument.isEmpty())
        continue;

      FieldSpec spec = FieldSpec.parse(tag.argument);
      if (isImage(spec, context)) {
        if (images != null)
          images.visit(text.substring(tag.start, tag.end), spec, imageValue(spec, context));
        continue;
      }

      buf.append(text, position, tag.start).append(resolve(spec, context, warnings));
      position = tag.end;
    }
    if (position == 0)
      return text;
    return buf.append(text, position, text.length()).toString();
  }

  private JsonView imageValue(FieldSpec spec, MergeContext context) {
    JsonView value = context.resolve(spec.path);
    if (value != null && !value.isNull())
      return value;
    if (spec.hasDefault())
      return JsonViews.wrap(spec.defaultValue);
    throw new UnresolvedFieldException(spec.path);
  }

  private static String formatOf(FieldSpec spec, MergeContext context) {
    if (spec.format != null)
      return spec.format;
    return context.getFieldTypes().implicitFormat(spec.path);
  }
}
