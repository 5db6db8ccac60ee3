/*
 * Copyright 2025 Google LLC
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *       http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package com.google.cloud.spannerclient;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.rpc.Code;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * An immutable row of decoded column values. All rows produced by the same stream share one
 * column name list. An empty {@link Row} marks the end of a {@link RowStream}.
 */
public final class Row {
  private static final Row EMPTY = new Row(ImmutableList.of(), Collections.emptyList());

  private final ImmutableList<String> columns;
  private final List<Object> values;

  private Row(ImmutableList<String> columns, List<Object> values) {
    this.columns = columns;
    this.values = values;
  }

  /**
   * Creates a row that takes ownership of {@code values}. The caller must not modify the list
   * afterwards. Values may be null.
   */
  public static Row create(ImmutableList<String> columns, List<Object> values) {
    Preconditions.checkNotNull(columns);
    Preconditions.checkNotNull(values);
    Preconditions.checkArgument(
        columns.size() == values.size(),
        "row has %s columns but %s values",
        columns.size(),
        values.size());
    return new Row(columns, Collections.unmodifiableList(values));
  }

  /** Returns the terminal empty row. */
  public static Row empty() {
    return EMPTY;
  }

  public int size() {
    return values.size();
  }

  public boolean isEmpty() {
    return values.isEmpty();
  }

  public ImmutableList<String> getColumns() {
    return columns;
  }

  public List<Object> getValues() {
    return values;
  }

  public Object getValue(int index) {
    Preconditions.checkElementIndex(index, values.size());
    return values.get(index);
  }

  public Object getValue(String column) {
    int index = columns.indexOf(column);
    if (index < 0) {
      throw new SpannerClientException(Code.NOT_FOUND, "column not found: " + column);
    }
    return values.get(index);
  }

  /**
   * Returns the value at {@code index} as a {@code type}. Null values are returned as null.
   *
   * @throws SpannerClientException with code INVALID_ARGUMENT if the value has another type
   */
  public <T> T get(int index, Class<T> type) {
    Object value = getValue(index);
    if (value == null) {
      return null;
    }
    if (!type.isInstance(value)) {
      throw new SpannerClientException(
          Code.INVALID_ARGUMENT,
          String.format(
              "column %s (%s) holds a %s, not a %s",
              index,
              columns.get(index),
              value.getClass().getSimpleName(),
              type.getSimpleName()));
    }
    return type.cast(value);
  }

  public Long getLong(int index) {
    return get(index, Long.class);
  }

  public String getString(int index) {
    return get(index, String.class);
  }

  public Boolean getBoolean(int index) {
    return get(index, Boolean.class);
  }

  public Double getDouble(int index) {
    return get(index, Double.class);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof Row)) {
      return false;
    }
    Row other = (Row) o;
    return columns.equals(other.columns) && values.equals(other.values);
  }

  @Override
  public int hashCode() {
    return Objects.hash(columns, values);
  }

  @Override
  public String toString() {
    StringBuilder builder = new StringBuilder("{");
    for (int i = 0; i < values.size(); i++) {
      if (i > 0) {
        builder.append(", ");
      }
      builder.append(columns.get(i)).append('=').append(values.get(i));
    }
    return builder.append('}').toString();
  }
}
