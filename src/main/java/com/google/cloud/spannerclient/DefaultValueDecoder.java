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

import com.google.common.collect.ImmutableList;
import com.google.common.io.BaseEncoding;
import com.google.protobuf.ByteString;
import com.google.protobuf.ListValue;
import com.google.protobuf.Value;
import com.google.protobuf.Value.KindCase;
import com.google.rpc.Code;
import com.google.spanner.v1.StructType;
import com.google.spanner.v1.Type;
import java.math.BigDecimal;
import java.time.DateTimeException;
import java.time.Instant;
import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Decodes Spanner wire values into Java objects.
 *
 * <ul>
 *   <li>BOOL to {@link Boolean}, INT64 to {@link Long}, FLOAT64 to {@link Double}, FLOAT32 to
 *       {@link Float}
 *   <li>STRING, JSON and ENUM to {@link String}, BYTES to {@link ByteString}
 *   <li>DATE to {@link LocalDate}, TIMESTAMP to {@link Instant}, NUMERIC to {@link BigDecimal}
 *   <li>ARRAY to an unmodifiable {@link List}, STRUCT to a nested {@link Row}
 * </ul>
 *
 * A null wire value decodes to null for every type.
 */
public class DefaultValueDecoder implements ValueDecoder {
  public static final DefaultValueDecoder INSTANCE = new DefaultValueDecoder();

  @Override
  public Object decode(Type type, Value value) {
    if (value.getKindCase() == KindCase.NULL_VALUE) {
      return null;
    }
    switch (type.getCode()) {
      case BOOL:
        return expect(type, value, KindCase.BOOL_VALUE).getBoolValue();
      case INT64:
        return parse(type, value, () -> Long.parseLong(value.getStringValue()));
      case FLOAT64:
        return decodeDouble(type, value);
      case FLOAT32:
        return (float) decodeDouble(type, value);
      case STRING:
      case JSON:
      case ENUM:
        return expect(type, value, KindCase.STRING_VALUE).getStringValue();
      case BYTES:
        return parse(
            type,
            value,
            () -> ByteString.copyFrom(BaseEncoding.base64().decode(value.getStringValue())));
      case DATE:
        return parse(type, value, () -> LocalDate.parse(value.getStringValue()));
      case TIMESTAMP:
        return parse(
            type, value, () -> OffsetDateTime.parse(value.getStringValue()).toInstant());
      case NUMERIC:
        return parse(type, value, () -> new BigDecimal(value.getStringValue()));
      case ARRAY:
        return decodeArray(type, expect(type, value, KindCase.LIST_VALUE).getListValue());
      case STRUCT:
        return decodeStruct(type, expect(type, value, KindCase.LIST_VALUE).getListValue());
      default:
        throw new SpannerClientException(
            Code.INVALID_ARGUMENT, "unsupported column type " + type.getCode());
    }
  }

  private double decodeDouble(Type type, Value value) {
    if (value.getKindCase() == KindCase.NUMBER_VALUE) {
      return value.getNumberValue();
    }
    String text = expect(type, value, KindCase.STRING_VALUE).getStringValue();
    switch (text) {
      case "NaN":
        return Double.NaN;
      case "Infinity":
        return Double.POSITIVE_INFINITY;
      case "-Infinity":
        return Double.NEGATIVE_INFINITY;
      default:
        throw mismatch(type, value);
    }
  }

  private List<Object> decodeArray(Type type, ListValue list) {
    Type elementType = type.getArrayElementType();
    List<Object> elements = new ArrayList<>(list.getValuesCount());
    for (Value element : list.getValuesList()) {
      elements.add(decode(elementType, element));
    }
    return Collections.unmodifiableList(elements);
  }

  private Row decodeStruct(Type type, ListValue list) {
    StructType structType = type.getStructType();
    if (structType.getFieldsCount() != list.getValuesCount()) {
      throw new SpannerClientException(
          Code.INVALID_ARGUMENT,
          String.format(
              "struct has %d fields but %d values",
              structType.getFieldsCount(), list.getValuesCount()));
    }
    ImmutableList.Builder<String> names = ImmutableList.builder();
    List<Object> fields = new ArrayList<>(list.getValuesCount());
    for (int i = 0; i < list.getValuesCount(); i++) {
      StructType.Field field = structType.getFields(i);
      names.add(field.getName());
      fields.add(decode(field.getType(), list.getValues(i)));
    }
    return Row.create(names.build(), fields);
  }

  private static Value expect(Type type, Value value, KindCase kind) {
    if (value.getKindCase() != kind) {
      throw mismatch(type, value);
    }
    return value;
  }

  private interface Parser {
    Object parse();
  }

  private static Object parse(Type type, Value value, Parser parser) {
    expect(type, value, KindCase.STRING_VALUE);
    try {
      return parser.parse();
    } catch (IllegalArgumentException | DateTimeException exception) {
      throw new SpannerClientException(
          Code.INVALID_ARGUMENT,
          String.format("cannot parse '%s' as %s", value.getStringValue(), type.getCode()),
          exception);
    }
  }

  private static SpannerClientException mismatch(Type type, Value value) {
    return new SpannerClientException(
        Code.INVALID_ARGUMENT,
        String.format(
            "value of kind %s does not match type %s", value.getKindCase(), type.getCode()));
  }
}
