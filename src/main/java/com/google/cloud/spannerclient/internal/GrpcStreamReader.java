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

import com.google.common.base.Preconditions;
import com.google.spanner.v1.PartialResultSet;
import io.grpc.Status;
import io.grpc.StatusException;
import io.grpc.stub.BlockingClientCall;
import java.util.Optional;

/** A {@link StreamReader} on top of a blocking server-streaming gRPC call. */
public final class GrpcStreamReader implements StreamReader {
  private final BlockingClientCall<?, PartialResultSet> call;
  // Null while the call is still running.
  private Status status;

  public GrpcStreamReader(BlockingClientCall<?, PartialResultSet> call) {
    this.call = Preconditions.checkNotNull(call);
  }

  @Override
  public Optional<PartialResultSet> read() {
    if (status != null) {
      return Optional.empty();
    }
    try {
      PartialResultSet result = call.read();
      if (result == null) {
        status = Status.OK;
        return Optional.empty();
      }
      return Optional.of(result);
    } catch (StatusException exception) {
      status = exception.getStatus();
      return Optional.empty();
    } catch (InterruptedException exception) {
      Thread.currentThread().interrupt();
      call.cancel("read() was interrupted", exception);
      status = Status.CANCELLED.withDescription("read() was interrupted").withCause(exception);
      return Optional.empty();
    }
  }

  @Override
  public Status finish() {
    if (status == null) {
      // Only reached after tryCancel(), or when the caller stops early.
      call.cancel("stream finished before the end", null);
      status = Status.CANCELLED.withDescription("stream finished before the end");
    }
    return status;
  }

  @Override
  public void tryCancel() {
    if (status == null) {
      call.cancel("stream cancelled by the client", null);
    }
  }
}
