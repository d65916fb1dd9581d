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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.InstantSource;

/**
 * Builds the {@link BackoffManager} a client should use for a given
 * configuration.
 * <p>
 * Incomplete configuration never fails: it just turns backoff off.
 * </p>
 */
public final class BackoffManagerFactory {
  private static final Logger LOGGER = LoggerFactory.getLogger(BackoffManagerFactory.class);

  private BackoffManagerFactory() {
  }

  public static BackoffManager build(BackoffConfig config) {
    return build(config, Clock.systemUTC(), FailurePolicy.DEFAULT);
  }

  /**
   * Build a manager for {@code config}.
   *
   * @return {@link NullBackoffManager#INSTANCE} if either delay is unset or
   *         zero, otherwise a new {@link ExponentialBackoffManager}
   */
  public static BackoffManager build(BackoffConfig config, InstantSource clock, FailurePolicy failurePolicy) {
    var base = config.baseDelay();
    var max = config.maxDelay();
    if (base.isEmpty() || max.isEmpty()) {
      LOGGER.info("Client backoff disabled: base and max delay must both be set ({})", config);
      return NullBackoffManager.INSTANCE;
    }
    if (max.get().isZero() || base.get().isZero()) {
      LOGGER.info("Client backoff disabled: zero delay configured ({})", config);
      return NullBackoffManager.INSTANCE;
    }
    LOGGER.info("Client backoff enabled with base {} and max {}", base.get(), max.get());
    return new ExponentialBackoffManager(base.get(), max.get(), clock, failurePolicy);
  }
}
