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
import java.time.Duration;
import java.util.concurrent.ThreadLocalRandom;

/**
 * A {@link BackoffPolicy} with exponentially growing, jittered delays. Each delay is drawn
 * uniformly from {@code [current / scaling, current]}, after which the current delay grows by
 * {@code scaling} up to {@code maximumDelay}.
 */
public class ExponentialBackoffPolicy implements BackoffPolicy {
  private final Duration initialDelay;
  private final Duration maximumDelay;
  private final double scaling;
  private long currentDelayNanos;

  public ExponentialBackoffPolicy(Duration initialDelay, Duration maximumDelay, double scaling) {
    Preconditions.checkArgument(!initialDelay.isNegative(), "initialDelay must be >= 0");
    Preconditions.checkArgument(
        maximumDelay.compareTo(initialDelay) >= 0, "maximumDelay must be >= initialDelay");
    Preconditions.checkArgument(scaling >= 1.0, "scaling must be >= 1.0");
    this.initialDelay = initialDelay;
    this.maximumDelay = maximumDelay;
    this.scaling = scaling;
    this.currentDelayNanos = initialDelay.toNanos();
  }

  @Override
  public Duration onCompletion() {
    long upper = currentDelayNanos;
    long lower = (long) (upper / scaling);
    long delay = upper > lower ? ThreadLocalRandom.current().nextLong(lower, upper + 1) : upper;
    currentDelayNanos = Math.min(maximumDelay.toNanos(), (long) (currentDelayNanos * scaling));
    return Duration.ofNanos(delay);
  }

  @Override
  public BackoffPolicy copy() {
    return new ExponentialBackoffPolicy(initialDelay, maximumDelay, scaling);
  }

  @Override
  public String toString() {
    return "ExponentialBackoffPolicy{initialDelay="
        + initialDelay
        + ", maximumDelay="
        + maximumDelay
        + ", scaling="
        + scaling
        + "}";
  }
}
