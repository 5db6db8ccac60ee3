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

import io.grpc.Status;

/** Classifies gRPC statuses as transient for the retry policies in this package. */
final class TransientErrors {
  private TransientErrors() {}

  static boolean isTransient(Status status) {
    switch (status.getCode()) {
      case UNAVAILABLE:
      case RESOURCE_EXHAUSTED:
        return true;
      case INTERNAL:
        // The server resets the HTTP/2 stream on some internal restarts.
        String description = status.getDescription();
        return description != null
            && (description.contains("RST_STREAM")
                || description.contains("Received unexpected EOS on DATA frame from server"));
      default:
        return false;
    }
  }
}
