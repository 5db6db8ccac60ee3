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

import com.google.cloud.spannerclient.BackoffPolicy;
import com.google.cloud.spannerclient.Idempotency;
import com.google.cloud.spannerclient.RetryPolicy;
import com.google.common.base.Preconditions;
import com.google.protobuf.ByteString;
import com.google.spanner.v1.PartialResultSet;
import io.grpc.Status;
import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Presents a single logical stream over any number of attempts of the underlying RPC. When an
 * attempt fails with a transient error, and the operation is idempotent, and the caller still
 * holds a resume token, a new attempt is started from that token after a backoff delay.
 */
final class ResumableStreamReader implements PartialResultSetReader {
  private static final Logger logger = LoggerFactory.getLogger(ResumableStreamReader.class);

  private final StreamReaderFactory factory;
  private final Idempotency idempotency;
  private final RetryPolicy retryPolicy;
  private final BackoffPolicy backoffPolicy;

  private ByteString lastResumeToken = ByteString.EMPTY;
  private StreamReader child;
  private boolean resumption;
  private int attempts = 1;
  // Null until the logical stream has ended.
  private Status finalStatus;

  ResumableStreamReader(
      StreamReaderFactory factory,
      Idempotency idempotency,
      RetryPolicy retryPolicy,
      BackoffPolicy backoffPolicy) {
    this.factory = Preconditions.checkNotNull(factory);
    this.idempotency = Preconditions.checkNotNull(idempotency);
    this.retryPolicy = Preconditions.checkNotNull(retryPolicy);
    this.backoffPolicy = Preconditions.checkNotNull(backoffPolicy);
    this.child = factory.newReader(lastResumeToken);
  }

  @Override
  public Optional<PartialResult> read(Optional<ByteString> resumeToken) {
    if (finalStatus != null) {
      return Optional.empty();
    }
    resumeToken.ifPresent(token -> lastResumeToken = token);
    boolean resumable = resumeToken.isPresent();
    while (true) {
      Optional<PartialResultSet> response = child.read();
      if (response.isPresent()) {
        PartialResultSet result = response.get();
        if (!result.getResumeToken().isEmpty()) {
          lastResumeToken = result.getResumeToken();
        }
        boolean restarted = resumption;
        resumption = false;
        return Optional.of(new PartialResult(result, restarted));
      }
      Status status = child.finish();
      if (status.isOk()) {
        finalStatus = status;
        return Optional.empty();
      }
      if (idempotency != Idempotency.IDEMPOTENT || !resumable) {
        finalStatus = status;
        return Optional.empty();
      }
      if (!retryPolicy.onFailure(status)) {
        finalStatus =
            retryPolicy.isTransientFailure(status) && retryPolicy.isExhausted()
                ? exhausted(status)
                : status;
        return Optional.empty();
      }
      Duration delay = backoffPolicy.onCompletion();
      logger.debug(
          "Resuming stream after {} (attempt {}, delay {}, token {} bytes)",
          status,
          attempts + 1,
          delay,
          lastResumeToken.size());
      try {
        TimeUnit.NANOSECONDS.sleep(delay.toNanos());
      } catch (InterruptedException exception) {
        Thread.currentThread().interrupt();
        finalStatus =
            Status.CANCELLED.withDescription("interrupted while resuming").withCause(exception);
        return Optional.empty();
      }
      child = factory.newReader(lastResumeToken);
      attempts++;
      resumption = true;
    }
  }

  @Override
  public Status finish() {
    if (finalStatus == null) {
      finalStatus = child.finish();
    }
    return finalStatus;
  }

  @Override
  public void tryCancel() {
    child.tryCancel();
  }

  private static Status exhausted(Status status) {
    String description = status.getDescription() == null ? "" : status.getDescription();
    return status.withDescription(description + " (retry policy exhausted)");
  }
}
