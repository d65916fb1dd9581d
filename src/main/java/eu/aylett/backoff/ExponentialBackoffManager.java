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
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.InstantSource;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Backs off each destination exponentially while it keeps failing.
 * <p>
 * The first failure against a destination asks for {@code baseDelay}; every
 * further failure doubles the delay, up to {@code maxDelay}. A successful
 * attempt clears it. A failure that arrives after the destination has been
 * left alone for longer than twice its current delay (and never less than
 * {@code baseDelay}) starts again from {@code baseDelay}; until then, such
 * an idle destination reports no backoff at all.
 * </p>
 * <p>
 * If either delay is zero, the manager is disabled and behaves exactly like
 * {@link NullBackoffManager}.
 * </p>
 */
public class ExponentialBackoffManager implements BackoffManager {
  private static final Logger LOGGER = LoggerFactory.getLogger(ExponentialBackoffManager.class);

  private final Duration baseDelay;
  private final Duration maxDelay;
  private final InstantSource clock;
  private final FailurePolicy failurePolicy;
  private final ConcurrentHashMap<String, BackoffEntry> entries = new ConcurrentHashMap<>();
  private final AtomicReference<Instant> lastPrune;
  private final Duration pruneInterval;

  /**
   * A fully configurable manager.
   *
   * @param baseDelay
   *          the delay after the first failure
   * @param maxDelay
   *          the longest delay the manager will ever ask for
   * @param clock
   *          the time source used to age entries (mainly for testing)
   * @param failurePolicy
   *          decides which outcomes count as failures
   * @throws IllegalArgumentException
   *           if either delay is negative
   */
  public ExponentialBackoffManager(Duration baseDelay, Duration maxDelay, InstantSource clock,
      FailurePolicy failurePolicy) {
    if (baseDelay.isNegative() || maxDelay.isNegative()) {
      throw new IllegalArgumentException(
          "Backoff delays must not be negative (base " + baseDelay + ", max " + maxDelay + ")");
    }
    this.baseDelay = baseDelay;
    this.maxDelay = maxDelay;
    this.clock = Objects.requireNonNull(clock, "clock");
    this.failurePolicy = Objects.requireNonNull(failurePolicy, "failurePolicy");
    this.lastPrune = new AtomicReference<>(clock.instant());
    this.pruneInterval = maxDelay.compareTo(Duration.ofSeconds(Long.MAX_VALUE / 2)) < 0
        ? maxDelay.multipliedBy(2)
        : maxDelay;
  }

  /**
   * Manager using the system clock and {@link FailurePolicy#DEFAULT}.
   */
  public ExponentialBackoffManager(Duration baseDelay, Duration maxDelay) {
    this(baseDelay, maxDelay, Clock.systemUTC(), FailurePolicy.DEFAULT);
  }

  /**
   * Whether this manager will ever ask for a non-zero delay.
   */
  public boolean isEnabled() {
    return !baseDelay.isZero() && !maxDelay.isZero();
  }

  @Override
  public Duration calculateBackoff(String destination) {
    if (!isEnabled()) {
      return Duration.ZERO;
    }
    var entry = entries.get(destination);
    if (entry == null || entry.isStale(clock.instant(), baseDelay)) {
      return Duration.ZERO;
    }
    return entry.delay;
  }

  @Override
  public void updateBackoff(String destination, @Nullable Throwable error, int statusCode) {
    if (!isEnabled()) {
      return;
    }
    var now = clock.instant();
    if (failurePolicy.isFailure(error, statusCode)) {
      var updated = entries.compute(destination,
          (key, old) -> old == null ? BackoffEntry.initial(min(baseDelay, maxDelay), now)
              : old.next(now, baseDelay, maxDelay));
      LOGGER.debug("Backing off {} for {} (status {}, error {})", destination, updated.delay, statusCode,
          error == null ? "none" : error.toString());
    } else {
      if (statusCode >= 300) {
        LOGGER.debug("{} is returning errors (status {}), not backing off", destination, statusCode);
      }
      reset(destination);
    }
    maybePrune(now);
  }

  /**
   * Forget any backoff for {@code destination}.
   */
  public void reset(String destination) {
    if (entries.remove(destination) != null) {
      LOGGER.debug("Backoff for {} cleared", destination);
    }
  }

  /**
   * Whether an attempt made at {@code eventTime} against {@code destination}
   * would still be inside its backoff period now.
   */
  public boolean isInBackoffSince(String destination, Instant eventTime) {
    var entry = entries.get(destination);
    if (entry == null || entry.isStale(eventTime, baseDelay)) {
      return false;
    }
    return Duration.between(eventTime, clock.instant()).compareTo(entry.delay) < 0;
  }

  /**
   * Drop the entries that have been idle long enough that the next failure
   * would start from scratch anyway.
   *
   * @return the number of entries removed
   */
  public int prune() {
    return prune(clock.instant());
  }

  /**
   * The number of destinations currently backed off.
   */
  public int size() {
    return entries.size();
  }

  private void maybePrune(Instant now) {
    var last = lastPrune.get();
    if (Duration.between(last, now).compareTo(pruneInterval) > 0 && lastPrune.compareAndSet(last, now)) {
      prune(now);
    }
  }

  private int prune(Instant now) {
    var removed = new AtomicInteger();
    entries.forEach((destination, entry) -> {
      // Only remove the entry we looked at, not one a concurrent update replaced it with.
      if (entry.isStale(now, baseDelay) && entries.remove(destination, entry)) {
        removed.incrementAndGet();
      }
    });
    if (removed.get() > 0) {
      LOGGER.debug("Pruned {} idle backoff entries", removed.get());
    }
    return removed.get();
  }

  private static Duration min(Duration a, Duration b) {
    return a.compareTo(b) <= 0 ? a : b;
  }

  @Override
  public String toString() {
    return "ExponentialBackoffManager{base=" + baseDelay + ", max=" + maxDelay + ", destinations=" + entries.size()
        + "}";
  }
}
