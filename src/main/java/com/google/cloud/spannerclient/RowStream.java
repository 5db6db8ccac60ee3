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

import com.google.cloud.spannerclient.internal.PartialResultSetSource;
import com.google.cloud.spannerclient.internal.StreamReaderFactory;
import com.google.common.base.Preconditions;
import com.google.common.collect.Iterators;
import com.google.protobuf.ByteString;
import com.google.rpc.Code;
import com.google.spanner.v1.ResultSetMetadata;
import com.google.spanner.v1.ResultSetStats;
import java.util.Iterator;
import java.util.NoSuchElementException;
import java.util.Optional;

/**
 * The rows of a single read or query. A {@link RowStream} can be consumed once, either with
 * {@link #nextRow()} or by iterating over it. Close it to cancel the underlying RPC when it is
 * not read to the end.
 */
public class RowStream implements Iterable<Row>, AutoCloseable {
  private final PartialResultSetSource source;
  private boolean iteratorCreated;

  RowStream(PartialResultSetSource source) {
    this.source = Preconditions.checkNotNull(source);
  }

  /**
   * Creates a {@link RowStream} that reads from the attempts that {@code factory} starts, resuming
   * after transient failures as allowed by {@code options}.
   */
  public static RowStream create(StreamReaderFactory factory, StreamingReadOptions options) {
    return new RowStream(PartialResultSetSource.create(factory, options));
  }

  /** Returns the next row, or an empty {@link Row} once all rows have been returned. */
  public Row nextRow() {
    return source.nextRow();
  }

  /** Returns the metadata of the stream, which is present once the first response arrived. */
  public Optional<ResultSetMetadata> getMetadata() {
    return source.getMetadata();
  }

  /** Returns the query statistics, which are only available once all rows have been read. */
  public Optional<ResultSetStats> getStats() {
    return source.getStats();
  }

  /** Returns the id of the read-only transaction that the server started for this stream. */
  public Optional<ByteString> getTransactionId() {
    return source
        .getMetadata()
        .filter(ResultSetMetadata::hasTransaction)
        .map(metadata -> metadata.getTransaction().getId());
  }

  @Override
  public Iterator<Row> iterator() {
    if (iteratorCreated) {
      throw new SpannerClientException(
          Code.FAILED_PRECONDITION, "a RowStream can only be iterated once");
    }
    iteratorCreated = true;
    return new RowIterator();
  }

  /** Returns a single-pass view of this stream that converts every row with {@code mapper}. */
  public <T> Iterable<T> map(RowMapper<T> mapper) {
    Preconditions.checkNotNull(mapper);
    return () -> Iterators.transform(iterator(), mapper::map);
  }

  @Override
  public void close() {
    source.close();
  }

  private final class RowIterator implements Iterator<Row> {
    private Row next;
    private boolean done;

    @Override
    public boolean hasNext() {
      if (done) {
        return false;
      }
      if (next == null) {
        Row row = nextRow();
        if (row.isEmpty()) {
          done = true;
          return false;
        }
        next = row;
      }
      return true;
    }

    @Override
    public Row next() {
      if (!hasNext()) {
        throw new NoSuchElementException();
      }
      Row row = next;
      next = null;
      return row;
    }
  }
}
