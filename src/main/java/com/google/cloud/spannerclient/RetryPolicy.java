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

/**
 * Decides whether a failed stream may be resumed. Implementations are stateful; every logical
 * stream works on its own {@link #copy()} of a prototype policy.
 */
public interface RetryPolicy {

  /**
   * Records a failure and returns true if the operation should be attempted again. Returns false
   * for permanent errors and once the policy is exhausted.
   */
  boolean onFailure(Status status);

  /** Returns true if no further attempts are allowed, regardless of the failure. */
  boolean isExhausted();

  /** Returns true if the status is one this policy would retry. */
  boolean isTransientFailure(Status status);

  /** Returns a fresh copy of this policy, with its state reset. */
  RetryPolicy copy();
}
