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

import com.google.spanner.v1.PartialResultSet;
import io.grpc.Status;
import java.util.Optional;

/** One attempt of a server-streaming RPC that returns {@link PartialResultSet}s. */
public interface StreamReader {

  /**
   * Blocks until the next response arrives. Returns an empty {@link Optional} once the stream has
   * ended, after which {@link #finish()} reports how it ended.
   */
  Optional<PartialResultSet> read();

  /**
   * Returns the final status of the stream. Must only be called once {@link #read()} has returned
   * empty or after {@link #tryCancel()}.
   */
  Status finish();

  /** Asks the transport to cancel the stream. Does not block. */
  void tryCancel();
}
