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

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertThrows;
import static org.junit.Assert.assertTrue;

import com.google.cloud.spannerclient.internal.StreamReader;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.Iterables;
import com.google.protobuf.ByteString;
import com.google.protobuf.Value;
import com.google.rpc.Code;
import com.google.spanner.v1.PartialResultSet;
import com.google.spanner.v1.ResultSetMetadata;
import com.google.spanner.v1.StructType;
import com.google.spanner.v1.Transaction;
import com.google.spanner.v1.Type;
import com.google.spanner.v1.TypeCode;
import io.grpc.Status;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Optional;
import org.junit.Test;

public class RowStreamTest {
  private static final ResultSetMetadata SINGERS =
      ResultSetMetadata.newBuilder()
          .setRowType(
              StructType.newBuilder()
                  .addFields(
                      StructType.Field.newBuilder()
                          .setName("SingerId")
                          .setType(Type.newBuilder().setCode(TypeCode.INT64)))
                  .addFields(
                      StructType.Field.newBuilder()
                          .setName("Name")
                          .setType(Type.newBuilder().setCode(TypeCode.STRING))))
          .build();

  /** Returns the given responses and then ends with the given status. */
  private static final class ListStreamReader implements StreamReader {
    private final Deque<PartialResultSet> responses;
    private final Status status;
    private boolean cancelled;

    ListStreamReader(Status status, PartialResultSet... responses) {
      this.status = status;
      this.responses = new ArrayDeque<>(Arrays.asList(responses));
    }

    @Override
    public Optional<PartialResultSet> read() {
      return cancelled ? Optional.empty() : Optional.ofNullable(responses.poll());
    }

    @Override
    public Status finish() {
      return cancelled ? Status.CANCELLED : status;
    }

    @Override
    public void tryCancel() {
      cancelled = true;
    }
  }

  private static Value str(String value) {
    return Value.newBuilder().setStringValue(value).build();
  }

  private static PartialResultSet singers(ResultSetMetadata metadata) {
    return PartialResultSet.newBuilder()
        .setMetadata(metadata)
        .addAllValues(Arrays.asList(str("1"), str("Marc"), str("2"), str("Catalina")))
        .setResumeToken(ByteString.copyFromUtf8("after-2"))
        .build();
  }

  private static RowStream stream(StreamReader reader) {
    return RowStream.create(token -> reader, StreamingReadOptions.getDefault());
  }

  @Test
  public void testIterate() {
    List<String> names = new ArrayList<>();
    try (RowStream rows = stream(new ListStreamReader(Status.OK, singers(SINGERS)))) {
      for (Row row : rows) {
        names.add(row.getString(1));
      }
      assertTrue(rows.nextRow().isEmpty());
    }
    assertEquals(ImmutableList.of("Marc", "Catalina"), names);
  }

  @Test
  public void testIteratorCanOnlyBeCreatedOnce() {
    RowStream rows = stream(new ListStreamReader(Status.OK, singers(SINGERS)));
    rows.iterator();

    SpannerClientException exception =
        assertThrows(SpannerClientException.class, rows::iterator);
    assertEquals(Code.FAILED_PRECONDITION, exception.getCode());
  }

  @Test
  public void testIteratorEnd() {
    Iterator<Row> iterator = stream(new ListStreamReader(Status.OK, singers(SINGERS))).iterator();

    assertEquals(Long.valueOf(1L), iterator.next().getLong(0));
    assertEquals(Long.valueOf(2L), iterator.next().getLong(0));
    assertFalse(iterator.hasNext());
    assertThrows(NoSuchElementException.class, iterator::next);
  }

  @Test
  public void testMap() {
    RowStream rows = stream(new ListStreamReader(Status.OK, singers(SINGERS)));

    Iterable<String> names = rows.map(row -> row.getLong(0) + ":" + row.getString(1));
    assertEquals(ImmutableList.of("1:Marc", "2:Catalina"), ImmutableList.copyOf(names));
  }

  @Test
  public void testErrorDuringIteration() {
    RowStream rows =
        stream(
            new ListStreamReader(
                Status.PERMISSION_DENIED.withDescription("no access"), singers(SINGERS)));
    Iterator<Row> iterator = rows.iterator();
    iterator.next();
    iterator.next();

    SpannerClientException exception =
        assertThrows(SpannerClientException.class, iterator::hasNext);
    assertEquals(Code.PERMISSION_DENIED, exception.getCode());
    assertEquals("no access", exception.getMessage());
  }

  @Test
  public void testMetadataAndTransactionId() {
    ResultSetMetadata withTransaction =
        SINGERS.toBuilder()
            .setTransaction(Transaction.newBuilder().setId(ByteString.copyFromUtf8("tx-1")))
            .build();
    try (RowStream rows = stream(new ListStreamReader(Status.OK, singers(withTransaction)))) {
      assertEquals(Optional.of(withTransaction), rows.getMetadata());
      assertEquals(Optional.of(ByteString.copyFromUtf8("tx-1")), rows.getTransactionId());
      assertEquals(2, Iterables.size(rows));
    }
  }

  @Test
  public void testNoTransactionId() {
    try (RowStream rows = stream(new ListStreamReader(Status.OK, singers(SINGERS)))) {
      assertEquals(Optional.empty(), rows.getTransactionId());
      assertFalse(rows.getStats().isPresent());
    }
  }

  @Test
  public void testCloseCancelsTheStream() {
    ListStreamReader reader = new ListStreamReader(Status.OK, singers(SINGERS), singers(SINGERS));
    RowStream rows = stream(reader);
    rows.nextRow();
    rows.close();

    assertTrue(reader.cancelled);
    assertTrue(rows.nextRow().isEmpty());
  }
}
