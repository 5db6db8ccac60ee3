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

/**
 * A {@link PartialResultSet} together with whether it is the first response after the stream was
 * restarted. After a restart the server replays everything after the last resume token, so any
 * data buffered since that token must be discarded.
 */
final class PartialResult {
  private final PartialResultSet result;
  private final boolean resumption;

  PartialResult(PartialResultSet result, boolean resumption) {
    this.result = Preconditions.checkNotNull(result);
    this.resumption = resumption;
  }

  PartialResultSet getResult() {
    return result;
  }

  boolean isResumption() {
    return resumption;
  }
}
