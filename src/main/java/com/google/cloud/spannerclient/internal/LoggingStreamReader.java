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

import com.google.common.annotations.VisibleForTesting;
import com.google.common.base.Preconditions;
import com.google.protobuf.TextFormat;
import com.google.spanner.v1.PartialResultSet;
import io.grpc.Status;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** A {@link StreamReader} decorator that logs every call at DEBUG level. */
final class LoggingStreamReader implements StreamReader {
  private static final Logger logger = LoggerFactory.getLogger(LoggingStreamReader.class);

  private final StreamReader delegate;
  private final int messageLimit;

  LoggingStreamReader(StreamReader delegate, int messageLimit) {
    this.delegate = Preconditions.checkNotNull(delegate);
    this.messageLimit = messageLimit;
  }

  @Override
  public Optional<PartialResultSet> read() {
    Optional<PartialResultSet> result = delegate.read();
    if (logger.isDebugEnabled()) {
      logger.debug(
          "read() >> {}", result.isPresent() ? truncate(result.get()) : "[end of stream]");
    }
    return result;
  }

  @Override
  public Status finish() {
    Status status = delegate.finish();
    logger.debug("finish() >> {}", status);
    return status;
  }

  @Override
  public void tryCancel() {
    logger.debug("tryCancel()");
    delegate.tryCancel();
  }

  @VisibleForTesting
  String truncate(PartialResultSet result) {
    String text = TextFormat.shortDebugString(result);
    if (text.length() <= messageLimit) {
      return text;
    }
    return text.substring(0, messageLimit) + "...<truncated>...";
  }
}
