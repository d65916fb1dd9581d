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
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * The two settings that control backoff: the delay after a first failure,
 * and the longest delay ever asked for. Either may be unset, in which case
 * {@link BackoffManagerFactory} disables backoff.
 */
public final class BackoffConfig {
  private static final Logger LOGGER = LoggerFactory.getLogger(BackoffConfig.class);

  /**
   * Environment variable holding the base delay, in whole seconds.
   */
  public static final String ENV_BASE = "CLIENT_BACKOFF_BASE";
  /**
   * Environment variable holding the maximum delay, in whole seconds.
   */
  public static final String ENV_DURATION = "CLIENT_BACKOFF_DURATION";

  private static final BackoffConfig UNSET = new BackoffConfig(null, null);

  private final @Nullable Duration baseDelay;
  private final @Nullable Duration maxDelay;

  private BackoffConfig(@Nullable Duration baseDelay, @Nullable Duration maxDelay) {
    this.baseDelay = baseDelay;
    this.maxDelay = maxDelay;
  }

  /**
   * @throws IllegalArgumentException
   *           if either delay is negative
   */
  public static BackoffConfig of(@Nullable Duration baseDelay, @Nullable Duration maxDelay) {
    if ((baseDelay != null && baseDelay.isNegative()) || (maxDelay != null && maxDelay.isNegative())) {
      throw new IllegalArgumentException("Backoff delays must not be negative");
    }
    return new BackoffConfig(baseDelay, maxDelay);
  }

  public static BackoffConfig unset() {
    return UNSET;
  }

  /**
   * Read {@value #ENV_BASE} and {@value #ENV_DURATION} from {@code env}.
   * <p>
   * Values are whole numbers of seconds. Anything absent, blank, negative or
   * not a number leaves that setting unset.
   * </p>
   */
  public static BackoffConfig fromEnvironment(Map<String, String> env) {
    return new BackoffConfig(parseSeconds(env, ENV_BASE), parseSeconds(env, ENV_DURATION));
  }

  public static BackoffConfig fromSystemEnvironment() {
    return fromEnvironment(System.getenv());
  }

  private static @Nullable Duration parseSeconds(Map<String, String> env, String name) {
    var raw = env.get(name);
    if (raw == null || raw.isBlank()) {
      return null;
    }
    long seconds;
    try {
      seconds = Long.parseLong(raw.trim());
    } catch (NumberFormatException e) {
      LOGGER.info("Ignoring {}={}: not a whole number of seconds", name, raw);
      return null;
    }
    if (seconds < 0) {
      LOGGER.info("Ignoring {}={}: negative", name, raw);
      return null;
    }
    return Duration.ofSeconds(seconds);
  }

  public Optional<Duration> baseDelay() {
    return Optional.ofNullable(baseDelay);
  }

  public Optional<Duration> maxDelay() {
    return Optional.ofNullable(maxDelay);
  }

  @Override
  @Contract(value = "null -> false", pure = true)
  public boolean equals(@Nullable Object obj) {
    if (obj instanceof BackoffConfig that) {
      return Objects.equals(baseDelay, that.baseDelay) && Objects.equals(maxDelay, that.maxDelay);
    }
    return false;
  }

  @Override
  public int hashCode() {
    return Objects.hash(baseDelay, maxDelay);
  }

  @Override
  public String toString() {
    return "BackoffConfig{base=" + baseDelay + ", max=" + maxDelay + "}";
  }
}
