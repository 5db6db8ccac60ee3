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

import com.google.cloud.spannerclient.Row;
import com.google.cloud.spannerclient.SpannerClientException;
import com.google.cloud.spannerclient.StreamingReadOptions;
import com.google.cloud.spannerclient.ValueDecoder;
import com.google.common.annotations.VisibleForTesting;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.protobuf.ByteString;
import com.google.protobuf.Value;
import com.google.rpc.Code;
import com.google.spanner.v1.PartialResultSet;
import com.google.spanner.v1.ResultSetMetadata;
import com.google.spanner.v1.ResultSetStats;
import com.google.spanner.v1.StructType;
import com.google.spanner.v1.Type;
import io.grpc.Status;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Assembles the values of a stream of {@link PartialResultSet}s into {@link Row}s.
 *
 * <p>Values that the server split across responses are merged back together. Rows are held back
 * until a response carries a resume token, so that a restarted stream never replays a row the
 * caller has already seen. If more than {@link
 * StreamingReadOptions#getResumabilityBufferSizeLimit()} bytes are buffered without a token, rows
 * are handed out anyway and the stream stops being resumable until the next token arrives.
 *
 * <p>Instances are not thread-safe. A source that is abandoned before the end of the stream must
 * be closed, which cancels the RPC.
 */
public final class PartialResultSetSource implements AutoCloseable {
  private static final Logger logger = LoggerFactory.getLogger(PartialResultSetSource.class);

  private enum State {
    READING,
    END_OF_STREAM,
    FINISHED,
  }

  private final PartialResultSetReader reader;
  private final ValueDecoder decoder;
  private final long bufferSizeLimit;

  private ResultSetMetadata metadata;
  private ResultSetStats stats;
  private ImmutableList<String> columns = ImmutableList.of();
  private ImmutableList<Type> fieldTypes = ImmutableList.of();

  private final List<Value> pendingValues = new ArrayList<>();
  private boolean valuesBackIncomplete;
  private long bufferedBytes;
  // Empty once rows were handed out that no resume token covers.
  private Optional<ByteString> resumeToken = Optional.of(ByteString.EMPTY);
  private final Deque<PendingRow> readyRows = new ArrayDeque<>();

  private State state = State.READING;
  // The response read by create(), absorbed on the first call to nextRow().
  private PartialResult firstResponse;
  private SpannerClientException terminalError;

  private PartialResultSetSource(PartialResultSetReader reader, StreamingReadOptions options) {
    this.reader = Preconditions.checkNotNull(reader);
    this.decoder = options.getValueDecoder();
    this.bufferSizeLimit = options.getResumabilityBufferSizeLimit();
  }

  /**
   * Starts a resumable stream that calls {@code factory} for every attempt, and waits for the
   * first response.
   *
   * @throws SpannerClientException if the stream fails before its first response, or the first
   *     response carries no metadata
   */
  public static PartialResultSetSource create(
      StreamReaderFactory factory, StreamingReadOptions options) {
    StreamReaderFactory attempts = factory;
    if (options.isRpcStreamTracing()) {
      int limit = options.getTracingMessageLimit();
      attempts = token -> new LoggingStreamReader(factory.newReader(token), limit);
    }
    return create(
        new ResumableStreamReader(
            attempts,
            options.getIdempotency(),
            options.getRetryPolicy().copy(),
            options.getBackoffPolicy().copy()),
        options);
  }

  @VisibleForTesting
  static PartialResultSetSource create(
      PartialResultSetReader reader, StreamingReadOptions options) {
    PartialResultSetSource source = new PartialResultSetSource(reader, options);
    try {
      source.readFirstResponse();
    } catch (SpannerClientException exception) {
      source.close();
      throw exception;
    }
    return source;
  }

  private void readFirstResponse() {
    Optional<PartialResult> first = reader.read(resumeToken);
    if (first.isPresent()) {
      firstResponse = first.get();
      if (firstResponse.getResult().hasMetadata()) {
        setMetadata(firstResponse.getResult().getMetadata());
      }
    } else {
      state = State.END_OF_STREAM;
      Status status = reader.finish();
      if (!status.isOk()) {
        throw SpannerClientException.fromGrpcStatus(status);
      }
    }
    if (metadata == null) {
      throw internal("response contained no metadata");
    }
  }

  /**
   * Returns the next row, or an empty row once the stream has ended successfully.
   *
   * @throws SpannerClientException if the stream failed, in which case every later call throws
   *     the same error, or if the values of this row could not be decoded, in which case the next
   *     call continues with the following row
   */
  public Row nextRow() {
    if (terminalError != null) {
      throw terminalError;
    }
    try {
      while (readyRows.isEmpty() && state != State.FINISHED) {
        advance();
      }
    } catch (SpannerClientException exception) {
      close();
      terminalError = exception;
      throw exception;
    }
    PendingRow row = readyRows.poll();
    return row == null ? Row.empty() : row.get();
  }

  public Optional<ResultSetMetadata> getMetadata() {
    return Optional.ofNullable(metadata);
  }

  public Optional<ResultSetStats> getStats() {
    return Optional.ofNullable(stats);
  }

  /** Cancels the RPC if it is still running. Rows that were already assembled are discarded. */
  @Override
  public void close() {
    if (state == State.READING) {
      reader.tryCancel();
      Status status = reader.finish();
      if (!status.isOk() && status.getCode() != Status.Code.CANCELLED) {
        logger.warn("Stream closed before its end finished with {}", status);
      }
    }
    state = State.FINISHED;
    firstResponse = null;
    readyRows.clear();
  }

  private void advance() {
    if (firstResponse != null) {
      PartialResult first = firstResponse;
      firstResponse = null;
      absorb(first);
      return;
    }
    if (state == State.READING) {
      Optional<PartialResult> result = reader.read(resumeToken);
      if (result.isPresent()) {
        absorb(result.get());
        return;
      }
      state = State.END_OF_STREAM;
    }
    if (valuesBackIncomplete) {
      throw endOfStreamError("incomplete chunked_value at end of stream");
    }
    if (pendingValues.isEmpty()) {
      state = State.FINISHED;
      Status status = reader.finish();
      if (!status.isOk()) {
        throw SpannerClientException.fromGrpcStatus(status);
      }
      return;
    }
    // The last response does not always carry a resume token, so the remaining
    // rows are delivered here.
    int rows = completeRows();
    if (rows == 0) {
      throw endOfStreamError("incomplete row at end of stream");
    }
    deliver(rows);
  }

  private void absorb(PartialResult partialResult) {
    PartialResultSet result = partialResult.getResult();
    if (result.hasMetadata()) {
      if (metadata == null) {
        setMetadata(result.getMetadata());
      } else if (metadata.equals(result.getMetadata())) {
        logger.debug("Ignoring repeated metadata");
      } else {
        logger.warn("Ignoring metadata that differs from the first metadata received");
      }
    }
    if (result.hasStats()) {
      if (stats != null) {
        logger.warn("Replacing previously received stats");
      }
      stats = result.getStats();
    }

    if (partialResult.isResumption()) {
      if (!resumeToken.isPresent()) {
        throw internal("stream was resumed after rows were delivered without a resume token");
      }
      pendingValues.clear();
      valuesBackIncomplete = false;
      bufferedBytes = 0;
    }

    if (result.getValuesCount() == 0) {
      if (result.getChunkedValue()) {
        throw internal("PartialResultSet had chunked_value set true but contained no values");
      }
      if (valuesBackIncomplete) {
        throw internal("PartialResultSet contained no values to merge with prior chunked_value");
      }
    } else {
      appendValues(result);
    }

    int rows = completeRows();
    ByteString token = result.getResumeToken();
    if (token.isEmpty() && bufferedBytes < bufferSizeLimit) {
      return;
    }
    if (!token.isEmpty()) {
      if (rows * columns.size() != pendingValues.size() - (valuesBackIncomplete ? 1 : 0)) {
        throw internal("PartialResultSet contained a resume token that is not at a row boundary");
      }
      resumeToken = Optional.of(token);
    } else if (rows > 0) {
      resumeToken = Optional.empty();
    }
    deliver(rows);
  }

  private void setMetadata(ResultSetMetadata metadata) {
    this.metadata = metadata;
    ImmutableList.Builder<String> names = ImmutableList.builder();
    ImmutableList.Builder<Type> types = ImmutableList.builder();
    for (StructType.Field field : metadata.getRowType().getFieldsList()) {
      names.add(field.getName());
      types.add(field.getType());
    }
    this.columns = names.build();
    this.fieldTypes = types.build();
  }

  private void appendValues(PartialResultSet result) {
    int start = 0;
    if (valuesBackIncomplete) {
      int last = pendingValues.size() - 1;
      Value previous = pendingValues.get(last);
      Value merged = ValueMerger.merge(previous, result.getValues(0));
      bufferedBytes += merged.getSerializedSize() - previous.getSerializedSize();
      pendingValues.set(last, merged);
      start = 1;
    }
    for (int i = start; i < result.getValuesCount(); i++) {
      Value value = result.getValues(i);
      bufferedBytes += value.getSerializedSize();
      pendingValues.add(value);
    }
    valuesBackIncomplete = result.getChunkedValue();
  }

  private int completeRows() {
    int complete = pendingValues.size() - (valuesBackIncomplete ? 1 : 0);
    if (columns.isEmpty()) {
      if (!pendingValues.isEmpty()) {
        throw internal("PartialResultSet contained values but missing row type information");
      }
      return 0;
    }
    return complete / columns.size();
  }

  private void deliver(int rows) {
    if (rows == 0) {
      return;
    }
    int width = columns.size();
    List<Value> consumed = pendingValues.subList(0, rows * width);
    for (int row = 0; row < rows; row++) {
      List<Object> values = new ArrayList<>(width);
      try {
        for (int column = 0; column < width; column++) {
          values.add(decoder.decode(fieldTypes.get(column), consumed.get(row * width + column)));
        }
        readyRows.add(new PendingRow(Row.create(columns, values), null));
      } catch (SpannerClientException exception) {
        readyRows.add(new PendingRow(null, exception));
      } catch (RuntimeException exception) {
        // Custom decoders may throw anything; it still only fails this row.
        readyRows.add(
            new PendingRow(
                null,
                new SpannerClientException(
                    Code.INVALID_ARGUMENT,
                    "failed to decode row: " + exception.getMessage(),
                    exception)));
      }
    }
    consumed.clear();
    bufferedBytes = 0;
    for (Value value : pendingValues) {
      bufferedBytes += value.getSerializedSize();
    }
  }

  private SpannerClientException endOfStreamError(String message) {
    Status status = reader.finish();
    return status.isOk() ? internal(message) : SpannerClientException.fromGrpcStatus(status);
  }

  private static SpannerClientException internal(String message) {
    return new SpannerClientException(Code.INTERNAL, message);
  }

  /** Either a decoded row or the error that decoding it produced. */
  private static final class PendingRow {
    private final Row row;
    private final SpannerClientException error;

    PendingRow(Row row, SpannerClientException error) {
      this.row = row;
      this.error = error;
    }

    Row get() {
      if (error != null) {
        throw error;
      }
      return row;
    }
  }
}
