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

import org.jetbrains.annotations.Contract;
import org.jspecify.annotations.Nullable;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * The backoff state for a single destination.
 * <p>
 * Entries are immutable: the manager replaces them rather than mutating them,
 * so a reader never observes a half-updated entry.
 * </p>
 */
final class BackoffEntry {
  private static final Duration LONGEST = Duration.ofSeconds(Long.MAX_VALUE, 999_999_999);

  final Duration delay;
  final Instant lastUpdate;

  BackoffEntry(Duration delay, Instant lastUpdate) {
    this.delay = delay;
    this.lastUpdate = lastUpdate;
  }

  static BackoffEntry initial(Duration baseDelay, Instant now) {
    return new BackoffEntry(baseDelay, now);
  }

  /**
   * The entry to store after another failure at {@code now}.
   */
  BackoffEntry next(Instant now, Duration baseDelay, Duration maxDelay) {
    if (isStale(now, baseDelay)) {
      return initial(min(baseDelay, maxDelay), now);
    }
    return new BackoffEntry(min(doubled(delay), maxDelay), now);
  }

  /**
   * Whether more than the stale-entry window, twice the current delay but
   * never less than the base delay, has passed since the last update.
   */
  boolean isStale(Instant now, Duration baseDelay) {
    var window = max(doubled(delay), baseDelay);
    return Duration.between(lastUpdate, now).compareTo(window) > 0;
  }

  private static Duration doubled(Duration duration) {
    try {
      return duration.multipliedBy(2);
    } catch (ArithmeticException e) {
      // Saturate; the caller caps this at the max delay anyway.
      return LONGEST;
    }
  }

  private static Duration min(Duration a, Duration b) {
    return a.compareTo(b) <= 0 ? a : b;
  }

  private static Duration max(Duration a, Duration b) {
    return a.compareTo(b) >= 0 ? a : b;
  }

  @Override
  @Contract(value = "null -> false", pure = true)
  public boolean equals(@Nullable Object obj) {
    if (obj instanceof BackoffEntry that) {
      return delay.equals(that.delay) && lastUpdate.equals(that.lastUpdate);
    }
    return false;
  }

  @Override
  public int hashCode() {
    return Objects.hash(delay, lastUpdate);
  }

  @Override
  public String toString() {
    return "BackoffEntry{delay=" + delay + ", lastUpdate=" + lastUpdate + "}";
  }
}
