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

import com.google.protobuf.ByteString;
import io.grpc.Status;
import java.util.Optional;

/** The logical stream that {@link PartialResultSetSource} assembles rows from. */
interface PartialResultSetReader {

  /**
   * Returns the next response, or empty at the end of the stream.
   *
   * @param resumeToken the token that covers all data the caller has consumed so far, or empty if
   *     the caller has consumed data that no token covers, in which case the stream can no longer
   *     be resumed
   */
  Optional<PartialResult> read(Optional<ByteString> resumeToken);

  /** Returns the final status of the logical stream. Repeated calls return the same status. */
  Status finish();

  void tryCancel();
}
