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

import static com.google.cloud.spannerclient.internal.TestResults.response;
import static com.google.cloud.spannerclient.internal.TestResults.str;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;

import com.google.cloud.spannerclient.ExponentialBackoffPolicy;
import com.google.cloud.spannerclient.Idempotency;
import com.google.cloud.spannerclient.LimitedErrorCountRetryPolicy;
import com.google.common.collect.ImmutableList;
import com.google.protobuf.ByteString;
import com.google.spanner.v1.PartialResultSet;
import io.grpc.Status;
import java.time.Duration;
import java.util.Optional;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public class ResumableStreamReaderTest {
  private static final Optional<ByteString> START = Optional.of(ByteString.EMPTY);

  private final PartialResultSet r12 = response("resume-after-2", str("value-1"), str("value-2"));
  private final PartialResultSet r34 = response("resume-after-4", str("value-3"), str("value-4"));

  private static ResumableStreamReader newReader(
      FakeStreamReaderFactory factory, Idempotency idempotency) {
    return new ResumableStreamReader(
        factory,
        idempotency,
        new LimitedErrorCountRetryPolicy(2),
        new ExponentialBackoffPolicy(Duration.ofNanos(1), Duration.ofNanos(1), 2.0));
  }

  private static Optional<ByteString> token(String token) {
    return Optional.of(ByteString.copyFromUtf8(token));
  }

  @Test
  public void testSuccess() {
    FakeStreamReader attempt = FakeStreamReader.ok(r12);
    ResumableStreamReader reader =
        newReader(new FakeStreamReaderFactory(attempt), Idempotency.IDEMPOTENT);

    Optional<PartialResult> result = reader.read(START);
    assertTrue(result.isPresent());
    assertEquals(r12, result.get().getResult());
    assertFalse(result.get().isResumption());
    assertFalse(reader.read(token("resume-after-2")).isPresent());
    assertTrue(reader.finish().isOk());
    assertEquals(1, attempt.finishCount);
  }

  @Test
  public void testSuccessWithRestart() {
    FakeStreamReaderFactory factory =
        new FakeStreamReaderFactory(
            new FakeStreamReader(Status.UNAVAILABLE.withDescription("Try again 1"), r12),
            new FakeStreamReader(Status.UNAVAILABLE.withDescription("Try again 2"), r34),
            FakeStreamReader.ok());
    ResumableStreamReader reader = newReader(factory, Idempotency.IDEMPOTENT);

    PartialResult first = reader.read(START).get();
    assertEquals(r12, first.getResult());
    assertFalse(first.isResumption());
    PartialResult second = reader.read(token("resume-after-2")).get();
    assertEquals(r34, second.getResult());
    assertTrue(second.isResumption());
    assertFalse(reader.read(token("resume-after-4")).isPresent());
    assertTrue(reader.finish().isOk());
    assertEquals(ImmutableList.of("", "resume-after-2", "resume-after-4"), factory.resumeTokens);
  }

  @Test
  public void testPermanentError() {
    FakeStreamReaderFactory factory =
        new FakeStreamReaderFactory(
            new FakeStreamReader(Status.UNAVAILABLE.withDescription("Try again"), r12),
            new FakeStreamReader(Status.PERMISSION_DENIED.withDescription("uh-oh")));
    ResumableStreamReader reader = newReader(factory, Idempotency.IDEMPOTENT);

    assertEquals(r12, reader.read(START).get().getResult());
    assertFalse(reader.read(token("resume-after-2")).isPresent());
    Status status = reader.finish();
    assertEquals(Status.Code.PERMISSION_DENIED, status.getCode());
    assertEquals("uh-oh", status.getDescription());
  }

  @Test
  public void testTransientNonIdempotent() {
    FakeStreamReaderFactory factory =
        new FakeStreamReaderFactory(
            new FakeStreamReader(Status.UNAVAILABLE.withDescription("Try again"), r12));
    ResumableStreamReader reader = newReader(factory, Idempotency.NON_IDEMPOTENT);

    assertEquals(r12, reader.read(START).get().getResult());
    assertFalse(reader.read(token("resume-after-2")).isPresent());
    Status status = reader.finish();
    assertEquals(Status.Code.UNAVAILABLE, status.getCode());
    assertEquals("Try again", status.getDescription());
    assertEquals(1, factory.resumeTokens.size());
  }

  @Test
  public void testTooManyTransients() {
    FakeStreamReaderFactory factory =
        new FakeStreamReaderFactory(
            new FakeStreamReader(Status.UNAVAILABLE.withDescription("Try again")),
            new FakeStreamReader(Status.UNAVAILABLE.withDescription("Try again")),
            new FakeStreamReader(Status.UNAVAILABLE.withDescription("Try again")));
    ResumableStreamReader reader = newReader(factory, Idempotency.IDEMPOTENT);

    assertFalse(reader.read(START).isPresent());
    Status status = reader.finish();
    assertEquals(Status.Code.UNAVAILABLE, status.getCode());
    assertTrue(status.getDescription().startsWith("Try again"));
    assertTrue(status.getDescription().contains("retry policy exhausted"));
    assertEquals(ImmutableList.of("", "", ""), factory.resumeTokens);
  }

  @Test
  public void testTransientFailureIsTerminalWithoutResumeToken() {
    FakeStreamReaderFactory factory =
        new FakeStreamReaderFactory(
            new FakeStreamReader(Status.UNAVAILABLE.withDescription("Try again"), r12));
    ResumableStreamReader reader = newReader(factory, Idempotency.IDEMPOTENT);

    assertEquals(r12, reader.read(START).get().getResult());
    assertFalse(reader.read(Optional.empty()).isPresent());
    assertEquals(Status.Code.UNAVAILABLE, reader.finish().getCode());
    assertEquals(1, factory.resumeTokens.size());
  }

  @Test
  public void testFinishReturnsTheSameStatus() {
    FakeStreamReader attempt =
        new FakeStreamReader(Status.INVALID_ARGUMENT.withDescription("invalid"));
    ResumableStreamReader reader =
        newReader(new FakeStreamReaderFactory(attempt), Idempotency.IDEMPOTENT);

    assertFalse(reader.read(START).isPresent());
    Status first = reader.finish();
    assertSame(first, reader.finish());
    assertEquals(Status.Code.INVALID_ARGUMENT, first.getCode());
    assertEquals(1, attempt.finishCount);
    assertFalse(reader.read(START).isPresent());
  }

  @Test
  public void testTryCancelCancelsCurrentAttempt() {
    FakeStreamReader attempt = FakeStreamReader.ok(r12, r34);
    ResumableStreamReader reader =
        newReader(new FakeStreamReaderFactory(attempt), Idempotency.IDEMPOTENT);

    assertTrue(reader.read(START).isPresent());
    reader.tryCancel();
    assertEquals(Status.Code.CANCELLED, reader.finish().getCode());
    assertEquals(1, attempt.cancelCount);
  }
}
