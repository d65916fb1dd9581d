/*
 * Copyright 2025 Andrew Aylett
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package eu.aylett.backoff;

import org.jspecify.annotations.Nullable;

import java.time.Duration;

/**
 * Tracks how long a client should wait before its next attempt against each
 * destination it talks to.
 * <p>
 * Call {@link #calculateBackoff(String)} before every attempt and wait for
 * the duration it returns, then report the outcome of the attempt with
 * {@link #updateBackoff(String, Throwable, int)}. Neither method ever blocks
 * on I/O or throws; the waiting is always up to the caller.
 * </p>
 * <p>
 * Implementations must be safe to call from any number of threads at once.
 * </p>
 */
public interface BackoffManager {
  /**
   * The time to wait before the next attempt against {@code destination}.
   *
   * @param destination
   *          the destination key, see {@link DestinationKeys}
   * @return the required delay, {@link Duration#ZERO} if none
   */
  Duration calculateBackoff(String destination);

  /**
   * Record the outcome of one attempt against {@code destination}.
   *
   * @param destination
   *          the destination key, see {@link DestinationKeys}
   * @param error
   *          the transport-level error the attempt failed with, if any
   * @param statusCode
   *          the HTTP status code of the response, or {@code 0} if no
   *          response was received
   */
  void updateBackoff(String destination, @Nullable Throwable error, int statusCode);
}
