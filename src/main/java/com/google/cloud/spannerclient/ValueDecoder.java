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

import com.google.protobuf.Value;
import com.google.spanner.v1.Type;

/**
 * Converts a wire {@link Value} into the Java representation of a column of the given {@link
 * Type}. Implementations throw a {@link SpannerClientException} if the value does not match the
 * declared type.
 */
@FunctionalInterface
public interface ValueDecoder {
  Object decode(Type type, Value value);
}
