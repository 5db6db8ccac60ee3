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

import com.google.cloud.spannerclient.internal.GrpcStreamReader;
import com.google.common.base.Preconditions;
import com.google.spanner.v1.ExecuteSqlRequest;
import com.google.spanner.v1.ReadRequest;
import com.google.spanner.v1.SpannerGrpc;
import io.grpc.CallOptions;
import io.grpc.Channel;
import io.grpc.ManagedChannel;
import io.grpc.stub.ClientCalls;
import java.io.Closeable;

/**
 * Runs streaming reads and queries against Spanner through a gRPC {@link Channel}. Every attempt
 * re-sends the original request with the resume token of the last complete row.
 */
public class SpannerStreamingClient implements Closeable {
  private final Channel channel;
  private final CallOptions callOptions;
  private final StreamingReadOptions defaultOptions;

  public SpannerStreamingClient(Channel channel) {
    this(channel, CallOptions.DEFAULT, StreamingReadOptions.getDefault());
  }

  public SpannerStreamingClient(
      Channel channel, CallOptions callOptions, StreamingReadOptions defaultOptions) {
    this.channel = Preconditions.checkNotNull(channel);
    this.callOptions = Preconditions.checkNotNull(callOptions);
    this.defaultOptions = Preconditions.checkNotNull(defaultOptions);
  }

  public StreamingReadOptions getDefaultOptions() {
    return defaultOptions;
  }

  /** Executes the given query with ExecuteStreamingSql. */
  public RowStream executeStreamingSql(ExecuteSqlRequest request) {
    return executeStreamingSql(request, defaultOptions);
  }

  public RowStream executeStreamingSql(ExecuteSqlRequest request, StreamingReadOptions options) {
    Preconditions.checkNotNull(request);
    return RowStream.create(
        token ->
            new GrpcStreamReader(
                ClientCalls.blockingV2ServerStreamingCall(
                    channel,
                    SpannerGrpc.getExecuteStreamingSqlMethod(),
                    callOptions,
                    request.toBuilder().setResumeToken(token).build())),
        options);
  }

  /** Reads rows from a table or index with StreamingRead. */
  public RowStream read(ReadRequest request) {
    return read(request, defaultOptions);
  }

  public RowStream read(ReadRequest request, StreamingReadOptions options) {
    Preconditions.checkNotNull(request);
    return RowStream.create(
        token ->
            new GrpcStreamReader(
                ClientCalls.blockingV2ServerStreamingCall(
                    channel,
                    SpannerGrpc.getStreamingReadMethod(),
                    callOptions,
                    request.toBuilder().setResumeToken(token).build())),
        options);
  }

  /** Shuts down the channel if it is a {@link ManagedChannel}. */
  @Override
  public void close() {
    if (channel instanceof ManagedChannel) {
      ((ManagedChannel) channel).shutdown();
    }
  }
}
