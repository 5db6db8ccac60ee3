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

import com.google.common.base.Preconditions;
import io.grpc.Status;

/** A {@link RetryPolicy} that tolerates a fixed number of transient failures. */
public class LimitedErrorCountRetryPolicy implements RetryPolicy {
  private final int maximumFailures;
  private int failureCount;

  public LimitedErrorCountRetryPolicy(int maximumFailures) {
    Preconditions.checkArgument(maximumFailures >= 0, "maximumFailures must be >= 0");
    this.maximumFailures = maximumFailures;
  }

  public int getMaximumFailures() {
    return maximumFailures;
  }

  @Override
  public boolean onFailure(Status status) {
    if (!isTransientFailure(status)) {
      return false;
    }
    failureCount++;
    return failureCount <= maximumFailures;
  }

  @Override
  public boolean isExhausted() {
    return failureCount > maximumFailures;
  }

  @Override
  public boolean isTransientFailure(Status status) {
    return TransientErrors.isTransient(status);
  }

  @Override
  public RetryPolicy copy() {
    return new LimitedErrorCountRetryPolicy(maximumFailures);
  }

  @Override
  public String toString() {
    return "LimitedErrorCountRetryPolicy{maximumFailures=" + maximumFailures + "}";
  }
}
