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

package org.lman.docmerge.context;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.Map;

import org.lman.docmerge.field.FieldTypes;
import org.lman.docmerge.json.JsonView;
import org.lman.docmerge.json.JsonViews;

/**
 * The data a merge evaluates fields and conditions against.
 *
 * A context is a stack of object-typed layers merged shallowly: the topmost layer that has the
 * first segment of a path owns it (even when its value is a present null), and the rest of the
 * path is walked inside that value. Contexts are never mutated; {@link #forRecord} derives the
 * context of one repeated row.
 */
public final class MergeContext {

  public static final String ROW_NUM = "ROW_NUM";
  public static final String ROW_INDEX = "ROW_INDEX";
  public static final String PARENT_ROW_NUM = "PARENT_ROW_NUM";

  /**
   * Builds the top-level context of a merge. Layers added later override earlier ones: records
   * first, then system variables, then named sources.
   */
  public static class Builder {
    private final Deque<JsonView> records = new ArrayDeque<JsonView>();
    private final Map<String, Object> systemVariables = new LinkedHashMap<String, Object>();
    private final Map<String, Object> namedSources = new LinkedHashMap<String, Object>();
    private FieldTypes fieldTypes = FieldTypes.EMPTY;

    /** Adds the fields of a record: a map, a POJO, an org.json object or a {@link JsonView}. */
    public Builder addRecord(Object record) {
      JsonView view = JsonViews.wrap(record);
      if (view.getType() != JsonView.Type.OBJECT)
        throw new IllegalArgumentException("A record must be an object, not " + view.getType());
      records.addFirst(view);
      return this;
    }

    public Builder addSystemVariables(Map<String, ?> variables) {
      systemVariables.putAll(variables);
      return this;
    }

    /** Attaches an external collection under |alias|, for {{@alias}} sections. */
    public Builder addNamedSource(String alias, Object items) {
      namedSources.put(alias, items);
      return this;
    }

    public Builder setFieldTypes(FieldTypes fieldTypes) {
      this.fieldTypes = fieldTypes == null ? FieldTypes.EMPTY : fieldTypes;
      return this;
    }

    public MergeContext build() {
      Deque<JsonView> layers = new ArrayDeque<JsonView>();
      if (!namedSources.isEmpty())
        layers.addLast(JsonViews.wrap(new LinkedHashMap<String, Object>(namedSources)));
      if (!systemVariables.isEmpty())
        layers.addLast(JsonViews.wrap(new LinkedHashMap<String, Object>(systemVariables)));
      layers.addAll(records);
      return new MergeContext(layers, new ArrayDeque<JsonView>(records), null, fieldTypes);
    }
  }

  private final Deque<JsonView> layers;
  private final Deque<JsonView> records;
  private final JsonView record;
  private final FieldTypes fieldTypes;

  private MergeContext(
      Deque<JsonView> layers, Deque<JsonView> records, JsonView record, FieldTypes fieldTypes) {
    this.layers = layers;
    this.records = records;
    this.record = record;
    this.fieldTypes = fieldTypes;
  }

  /** A context over a single data view, with no field types. */
  public static MergeContext of(Object data) {
    return new Builder().addRecord(data).build();
  }

  /**
   * Resolves a dot path. Returns null if unresolved, a NULL-typed view for a present null.
   */
  public JsonView resolve(String path) {
    if (path == null || path.isEmpty())
      return null;
    int dot = path.indexOf('.');
    String head = (dot == -1) ? path : path.substring(0, dot);

    for (JsonView layer : layers) {
      JsonView value = layer.get(head);
      if (value == null)
        continue;
      if (dot == -1)
        return value;
      if (value.getType() != JsonView.Type.OBJECT)
        return null;
      return value.get(path.substring(dot + 1));
    }
    return null;
  }

  /**
   * The context of one repeated row: this context, overlaid by the record's own fields (when
   * the record is an object), overlaid by the positional |variables|.
   */
  public MergeContext forRecord(JsonView record, Map<String, ?> variables) {
    Deque<JsonView> rowLayers = new ArrayDeque<JsonView>(layers);
    if (record.getType() == JsonView.Type.OBJECT)
      rowLayers.addFirst(record);
    rowLayers.addFirst(JsonViews.wrap(new LinkedHashMap<String, Object>(variables)));
    return new MergeContext(rowLayers, records, record, fieldTypes);
  }

  /**
   * Looks up |name| on the current record only: the repeated row's record inside a repeater,
   * otherwise the top-level records (a later record wins). Named sources and system variables
   * are not consulted. Returns null if no record has the member.
   */
  public JsonView resolveOnRecord(String name) {
    if (record != null)
      return record.getType() == JsonView.Type.OBJECT ? record.get(name) : null;
    for (JsonView topLevel : records) {
      JsonView value = topLevel.get(name);
      if (value != null)
        return value;
    }
    return null;
  }

  /** The record of the innermost repeated row, or null outside of any repeater. */
  public JsonView getRecord() {
    return record;
  }

  public FieldTypes getFieldTypes() {
    return fieldTypes;
  }
}
