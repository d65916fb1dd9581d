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

import java.time.Duration;

/**
 * Thrown when an attempt is abandoned instead of waiting out its backoff.
 */
public class BackoffException extends RuntimeException {
  /**
   * The destination the attempt was for.
   */
  public final String destination;
  /**
   * The backoff that was required before the attempt.
   */
  public final Duration delay;

  /**
   * @param message
   *          the detail message
   * @param destination
   *          the destination the attempt was for
   * @param delay
   *          the backoff required at the time
   */
  public BackoffException(String message, String destination, Duration delay) {
    super(message + " (" + destination + " requires a backoff of " + delay + ")");
    this.destination = destination;
    this.delay = delay;
  }

  /**
   * @param cause
   *          why the wait was abandoned
   */
  public BackoffException(String message, String destination, Duration delay, Throwable cause) {
    super(message + " (" + destination + " requires a backoff of " + delay + ")", cause);
    this.destination = destination;
    this.delay = delay;
  }
}
