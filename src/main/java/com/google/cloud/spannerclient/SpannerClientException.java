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

import com.google.common.base.MoreObjects;
import com.google.rpc.Code;
import com.google.rpc.Status;

/**
 * The single exception type thrown by the streaming client. The {@link Status} carries the
 * canonical error code and message of the failure.
 */
public class SpannerClientException extends RuntimeException {
  private final Status status;

  public SpannerClientException(Status status) {
    this(status, null);
  }

  public SpannerClientException(Status status, Throwable cause) {
    super(status.getMessage(), cause);
    this.status = status;
  }

  public SpannerClientException(Code code, String message) {
    this(code, message, null);
  }

  public SpannerClientException(Code code, String message, Throwable cause) {
    this(toStatus(code.getNumber(), message), cause);
  }

  /**
   * Converts a gRPC status into a {@link SpannerClientException}. A status without a description
   * uses the name of its code as message.
   */
  public static SpannerClientException fromGrpcStatus(io.grpc.Status grpcStatus) {
    String message =
        MoreObjects.firstNonNull(grpcStatus.getDescription(), grpcStatus.getCode().name());
    return new SpannerClientException(
        toStatus(grpcStatus.getCode().value(), message), grpcStatus.getCause());
  }

  private static Status toStatus(int code, String message) {
    return Status.newBuilder().setCode(code).setMessage(message).build();
  }

  /** Returns the code and message of this error as a {@code google.rpc.Status}. */
  public Status getStatus() {
    return status;
  }

  /** Returns the canonical code of this error, or {@link Code#UNRECOGNIZED} if unknown. */
  public Code getCode() {
    Code code = Code.forNumber(status.getCode());
    return code == null ? Code.UNRECOGNIZED : code;
  }
}
