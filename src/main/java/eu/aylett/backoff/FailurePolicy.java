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

/**
 * Decides whether the outcome of an attempt should increase the backoff for
 * its destination. Anything that isn't a failure clears it.
 */
@FunctionalInterface
public interface FailurePolicy {
  /**
   * Transport errors, attempts that got no response at all (status
   * {@code 0}), server errors (5xx) and {@code 429 Too Many Requests}.
   */
  FailurePolicy DEFAULT = (error, statusCode) -> error != null || statusCode == 0 || statusCode >= 500
      || statusCode == 429;

  /**
   * Server errors (5xx) only. Useful where connection failures are already
   * handled by a lower layer; they, and attempts without a response, clear
   * the backoff like any other non-failure.
   */
  FailurePolicy SERVER_ERRORS_ONLY = (error, statusCode) -> statusCode >= 500;

  /**
   * @param error
   *          the transport-level error, if any
   * @param statusCode
   *          the HTTP status code, or {@code 0} if no response was received
   * @return true if the destination should be backed off further
   */
  boolean isFailure(@Nullable Throwable error, int statusCode);
}
