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

import com.google.common.base.CharMatcher;
import com.google.common.base.MoreObjects;
import com.google.common.base.Preconditions;
import com.google.common.base.Splitter;
import com.google.rpc.Code;
import java.time.Duration;
import java.time.format.DateTimeParseException;
import java.util.Map;

/**
 * Options for a single resumable stream. Instances are immutable; the retry and backoff policies
 * are prototypes that are copied for every stream.
 */
public final class StreamingReadOptions {
  /** The maximum size of a single row. */
  public static final long MAX_ROW_SIZE_BYTES = 100L * 1024 * 1024;

  /**
   * The default number of buffered bytes after which rows are handed out without a covering
   * resume token, which makes the stream non-resumable.
   */
  public static final long DEFAULT_RESUMABILITY_BUFFER_SIZE_LIMIT = 2 * MAX_ROW_SIZE_BYTES;

  public static final int DEFAULT_TRACING_MESSAGE_LIMIT = 512;

  private static final StreamingReadOptions DEFAULT = newBuilder().build();

  private final long resumabilityBufferSizeLimit;
  private final RetryPolicy retryPolicy;
  private final BackoffPolicy backoffPolicy;
  private final Idempotency idempotency;
  private final boolean rpcStreamTracing;
  private final int tracingMessageLimit;
  private final ValueDecoder valueDecoder;

  private StreamingReadOptions(Builder builder) {
    this.resumabilityBufferSizeLimit = builder.resumabilityBufferSizeLimit;
    this.retryPolicy = builder.retryPolicy;
    this.backoffPolicy = builder.backoffPolicy;
    this.idempotency = builder.idempotency;
    this.rpcStreamTracing = builder.rpcStreamTracing;
    this.tracingMessageLimit = builder.tracingMessageLimit;
    this.valueDecoder = builder.valueDecoder;
  }

  public static StreamingReadOptions getDefault() {
    return DEFAULT;
  }

  public static Builder newBuilder() {
    return new Builder();
  }

  /**
   * Parses the options in the query part of a connection string, for example {@code
   * localhost:9010/projects/p/instances/i/databases/d?maxRetryFailures=3&rpcStreamTracing=true}.
   * Parameters are separated by {@code &} or {@code ;}. Supported keys are {@code
   * resumabilityBufferSizeLimit}, {@code maxRetryFailures}, {@code retryTimeout}, {@code
   * initialBackoff}, {@code maxBackoff}, {@code backoffScaling}, {@code idempotent}, {@code
   * rpcStreamTracing} and {@code tracingMessageLimit}. Durations use the ISO-8601 format ({@code
   * PT30S}).
   */
  public static StreamingReadOptions fromConnectionString(String connectionString) {
    Preconditions.checkNotNull(connectionString);
    int start = connectionString.indexOf('?');
    if (start < 0 || start == connectionString.length() - 1) {
      return getDefault();
    }
    Map<String, String> params;
    try {
      params =
          Splitter.on(CharMatcher.anyOf("&;"))
              .omitEmptyStrings()
              .trimResults()
              .withKeyValueSeparator('=')
              .split(connectionString.substring(start + 1));
    } catch (IllegalArgumentException exception) {
      throw new SpannerClientException(
          Code.INVALID_ARGUMENT, "invalid connection string parameters: " + connectionString);
    }
    Builder builder = newBuilder();
    Duration initialBackoff = Duration.ofMillis(100);
    Duration maxBackoff = Duration.ofMinutes(1);
    double scaling = 1.3;
    boolean customBackoff = false;
    for (Map.Entry<String, String> param : params.entrySet()) {
      String value = param.getValue();
      try {
        switch (param.getKey()) {
          case "resumabilityBufferSizeLimit":
            builder.setResumabilityBufferSizeLimit(Long.parseLong(value));
            break;
          case "maxRetryFailures":
            builder.setRetryPolicy(new LimitedErrorCountRetryPolicy(Integer.parseInt(value)));
            break;
          case "retryTimeout":
            builder.setRetryPolicy(new LimitedTimeRetryPolicy(Duration.parse(value)));
            break;
          case "initialBackoff":
            initialBackoff = Duration.parse(value);
            customBackoff = true;
            break;
          case "maxBackoff":
            maxBackoff = Duration.parse(value);
            customBackoff = true;
            break;
          case "backoffScaling":
            scaling = Double.parseDouble(value);
            customBackoff = true;
            break;
          case "idempotent":
            builder.setIdempotency(
                parseBoolean(param.getKey(), value)
                    ? Idempotency.IDEMPOTENT
                    : Idempotency.NON_IDEMPOTENT);
            break;
          case "rpcStreamTracing":
            builder.setRpcStreamTracing(parseBoolean(param.getKey(), value));
            break;
          case "tracingMessageLimit":
            builder.setTracingMessageLimit(Integer.parseInt(value));
            break;
          default:
            throw new SpannerClientException(
                Code.INVALID_ARGUMENT, "unknown connection string parameter: " + param.getKey());
        }
      } catch (IllegalArgumentException | DateTimeParseException exception) {
        throw new SpannerClientException(
            Code.INVALID_ARGUMENT,
            String.format("invalid value for %s: %s", param.getKey(), value),
            exception);
      }
    }
    if (customBackoff) {
      try {
        builder.setBackoffPolicy(new ExponentialBackoffPolicy(initialBackoff, maxBackoff, scaling));
      } catch (IllegalArgumentException exception) {
        throw new SpannerClientException(
            Code.INVALID_ARGUMENT, "invalid backoff parameters: " + exception.getMessage());
      }
    }
    return builder.build();
  }

  private static boolean parseBoolean(String key, String value) {
    if ("true".equalsIgnoreCase(value)) {
      return true;
    }
    if ("false".equalsIgnoreCase(value)) {
      return false;
    }
    throw new SpannerClientException(
        Code.INVALID_ARGUMENT, String.format("invalid value for %s: %s", key, value));
  }

  public long getResumabilityBufferSizeLimit() {
    return resumabilityBufferSizeLimit;
  }

  public RetryPolicy getRetryPolicy() {
    return retryPolicy;
  }

  public BackoffPolicy getBackoffPolicy() {
    return backoffPolicy;
  }

  public Idempotency getIdempotency() {
    return idempotency;
  }

  public boolean isRpcStreamTracing() {
    return rpcStreamTracing;
  }

  public int getTracingMessageLimit() {
    return tracingMessageLimit;
  }

  public ValueDecoder getValueDecoder() {
    return valueDecoder;
  }

  public Builder toBuilder() {
    return new Builder(this);
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
        .add("resumabilityBufferSizeLimit", resumabilityBufferSizeLimit)
        .add("retryPolicy", retryPolicy)
        .add("backoffPolicy", backoffPolicy)
        .add("idempotency", idempotency)
        .add("rpcStreamTracing", rpcStreamTracing)
        .add("tracingMessageLimit", tracingMessageLimit)
        .toString();
  }

  public static final class Builder {
    private long resumabilityBufferSizeLimit = DEFAULT_RESUMABILITY_BUFFER_SIZE_LIMIT;
    private RetryPolicy retryPolicy = new LimitedTimeRetryPolicy(Duration.ofMinutes(10));
    private BackoffPolicy backoffPolicy =
        new ExponentialBackoffPolicy(Duration.ofMillis(100), Duration.ofMinutes(1), 1.3);
    private Idempotency idempotency = Idempotency.IDEMPOTENT;
    private boolean rpcStreamTracing;
    private int tracingMessageLimit = DEFAULT_TRACING_MESSAGE_LIMIT;
    private ValueDecoder valueDecoder = DefaultValueDecoder.INSTANCE;

    private Builder() {}

    private Builder(StreamingReadOptions options) {
      this.resumabilityBufferSizeLimit = options.resumabilityBufferSizeLimit;
      this.retryPolicy = options.retryPolicy;
      this.backoffPolicy = options.backoffPolicy;
      this.idempotency = options.idempotency;
      this.rpcStreamTracing = options.rpcStreamTracing;
      this.tracingMessageLimit = options.tracingMessageLimit;
      this.valueDecoder = options.valueDecoder;
    }

    /**
     * Sets the number of bytes that may be buffered while waiting for a resume token. Zero hands
     * out rows as soon as they are complete.
     */
    public Builder setResumabilityBufferSizeLimit(long resumabilityBufferSizeLimit) {
      Preconditions.checkArgument(
          resumabilityBufferSizeLimit >= 0, "resumabilityBufferSizeLimit must be >= 0");
      this.resumabilityBufferSizeLimit = resumabilityBufferSizeLimit;
      return this;
    }

    public Builder setRetryPolicy(RetryPolicy retryPolicy) {
      this.retryPolicy = Preconditions.checkNotNull(retryPolicy);
      return this;
    }

    public Builder setBackoffPolicy(BackoffPolicy backoffPolicy) {
      this.backoffPolicy = Preconditions.checkNotNull(backoffPolicy);
      return this;
    }

    public Builder setIdempotency(Idempotency idempotency) {
      this.idempotency = Preconditions.checkNotNull(idempotency);
      return this;
    }

    /** Logs every message received on the underlying RPC stream at DEBUG level. */
    public Builder setRpcStreamTracing(boolean rpcStreamTracing) {
      this.rpcStreamTracing = rpcStreamTracing;
      return this;
    }

    /** Sets the maximum number of characters of each traced message that are logged. */
    public Builder setTracingMessageLimit(int tracingMessageLimit) {
      Preconditions.checkArgument(tracingMessageLimit > 0, "tracingMessageLimit must be > 0");
      this.tracingMessageLimit = tracingMessageLimit;
      return this;
    }

    public Builder setValueDecoder(ValueDecoder valueDecoder) {
      this.valueDecoder = Preconditions.checkNotNull(valueDecoder);
      return this;
    }

    public StreamingReadOptions build() {
      return new StreamingReadOptions(this);
    }
  }
}
