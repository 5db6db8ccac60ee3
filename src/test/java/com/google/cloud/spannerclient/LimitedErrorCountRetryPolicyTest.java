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

import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

import io.grpc.Status;
import org.junit.Test;

public class LimitedErrorCountRetryPolicyTest {

  @Test
  public void testAllowsConfiguredNumberOfTransientFailures() {
    RetryPolicy policy = new LimitedErrorCountRetryPolicy(2);

    assertTrue(policy.onFailure(Status.UNAVAILABLE));
    assertFalse(policy.isExhausted());
    assertTrue(policy.onFailure(Status.RESOURCE_EXHAUSTED));
    assertFalse(policy.isExhausted());
    assertFalse(policy.onFailure(Status.UNAVAILABLE));
    assertTrue(policy.isExhausted());
  }

  @Test
  public void testPermanentFailuresAreNotRetried() {
    RetryPolicy policy = new LimitedErrorCountRetryPolicy(5);

    assertFalse(policy.onFailure(Status.PERMISSION_DENIED));
    assertFalse(policy.onFailure(Status.INVALID_ARGUMENT));
    assertFalse(policy.onFailure(Status.INTERNAL.withDescription("something broke")));
    assertFalse(policy.isExhausted());
  }

  @Test
  public void testTransientClassification() {
    RetryPolicy policy = new LimitedErrorCountRetryPolicy(0);

    assertTrue(policy.isTransientFailure(Status.UNAVAILABLE));
    assertTrue(policy.isTransientFailure(Status.RESOURCE_EXHAUSTED));
    assertTrue(
        policy.isTransientFailure(
            Status.INTERNAL.withDescription("HTTP/2 error code: INTERNAL_ERROR Received Rst"
                + " Stream RST_STREAM closed stream")));
    assertFalse(policy.isTransientFailure(Status.INTERNAL));
    assertFalse(policy.isTransientFailure(Status.DEADLINE_EXCEEDED));
    assertFalse(policy.isTransientFailure(Status.OK));
  }

  @Test
  public void testCopyStartsFresh() {
    RetryPolicy policy = new LimitedErrorCountRetryPolicy(1);
    policy.onFailure(Status.UNAVAILABLE);
    policy.onFailure(Status.UNAVAILABLE);
    assertTrue(policy.isExhausted());

    RetryPolicy copy = policy.copy();
    assertFalse(copy.isExhausted());
    assertTrue(copy.onFailure(Status.UNAVAILABLE));
  }
}
