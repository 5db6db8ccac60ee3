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

import com.google.common.annotations.VisibleForTesting;
import com.google.common.base.Preconditions;
import com.google.common.base.Stopwatch;
import com.google.common.base.Ticker;
import io.grpc.Status;
import java.time.Duration;

/**
 * A {@link RetryPolicy} that tolerates transient failures until a maximum duration has elapsed.
 * The clock starts when the policy is created (or copied).
 */
public class LimitedTimeRetryPolicy implements RetryPolicy {
  private final Duration maximumDuration;
  private final Ticker ticker;
  private final Stopwatch stopwatch;

  public LimitedTimeRetryPolicy(Duration maximumDuration) {
    this(maximumDuration, Ticker.systemTicker());
  }

  @VisibleForTesting
  LimitedTimeRetryPolicy(Duration maximumDuration, Ticker ticker) {
    Preconditions.checkNotNull(maximumDuration);
    Preconditions.checkArgument(!maximumDuration.isNegative(), "maximumDuration must be >= 0");
    this.maximumDuration = maximumDuration;
    this.ticker = Preconditions.checkNotNull(ticker);
    this.stopwatch = Stopwatch.createStarted(ticker);
  }

  public Duration getMaximumDuration() {
    return maximumDuration;
  }

  @Override
  public boolean onFailure(Status status) {
    return isTransientFailure(status) && !isExhausted();
  }

  @Override
  public boolean isExhausted() {
    return stopwatch.elapsed().compareTo(maximumDuration) >= 0;
  }

  @Override
  public boolean isTransientFailure(Status status) {
    return TransientErrors.isTransient(status);
  }

  @Override
  public RetryPolicy copy() {
    return new LimitedTimeRetryPolicy(maximumDuration, ticker);
  }

  @Override
  public String toString() {
    return "LimitedTimeRetryPolicy{maximumDuration=" + maximumDuration + "}";
  }
}
