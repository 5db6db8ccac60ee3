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

package com.google.cloud.spannerclient.internal;

import com.google.cloud.spannerclient.SpannerClientException;
import com.google.protobuf.ListValue;
import com.google.protobuf.Value;
import com.google.protobuf.Value.KindCase;
import com.google.rpc.Code;
import java.util.List;

/**
 * Joins the pieces of a value that the server split across two {@code PartialResultSet}s. Only
 * strings and lists are ever chunked. For lists, the last element of the first piece is joined
 * with the first element of the second piece when both are strings or lists, recursively.
 */
final class ValueMerger {
  private ValueMerger() {}

  /** Returns {@code value} with {@code chunk} appended to it. */
  static Value merge(Value value, Value chunk) {
    switch (value.getKindCase()) {
      case STRING_VALUE:
        checkSameKind(value, chunk);
        return Value.newBuilder()
            .setStringValue(value.getStringValue().concat(chunk.getStringValue()))
            .build();
      case LIST_VALUE:
        checkSameKind(value, chunk);
        return Value.newBuilder()
            .setListValue(mergeLists(value.getListValue(), chunk.getListValue()))
            .build();
      case NULL_VALUE:
      case BOOL_VALUE:
      case NUMBER_VALUE:
      case STRUCT_VALUE:
      case KIND_NOT_SET:
      default:
        throw new SpannerClientException(Code.INVALID_ARGUMENT, "invalid type");
    }
  }

  private static ListValue mergeLists(ListValue value, ListValue chunk) {
    if (value.getValuesCount() == 0) {
      return chunk;
    }
    if (chunk.getValuesCount() == 0) {
      return value;
    }
    ListValue.Builder merged = value.toBuilder();
    List<Value> incoming = chunk.getValuesList();
    int next = 0;
    int last = merged.getValuesCount() - 1;
    KindCase tailKind = merged.getValues(last).getKindCase();
    if (tailKind == KindCase.STRING_VALUE || tailKind == KindCase.LIST_VALUE) {
      merged.setValues(last, merge(merged.getValues(last), incoming.get(0)));
      next = 1;
    }
    merged.addAllValues(incoming.subList(next, incoming.size()));
    return merged.build();
  }

  private static void checkSameKind(Value value, Value chunk) {
    if (value.getKindCase() != chunk.getKindCase()) {
      throw new SpannerClientException(Code.INVALID_ARGUMENT, "mismatched types");
    }
  }
}
