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

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.Callable;
import java.util.function.Supplier;
import java.util.function.ToIntFunction;

import static eu.aylett.backoff.SneakyThrows.sneakyThrow;

/**
 * Runs attempts against a destination, waiting out its backoff first and
 * reporting the outcome afterwards.
 * <p>
 * This doesn't retry anything: whether to try again after a failure is up to
 * the caller.
 * </p>
 */
public class BackoffExecutor {
  private static final Logger LOGGER = LoggerFactory.getLogger(BackoffExecutor.class);

  private final BackoffManager manager;
  private final Sleeper sleeper;
  private final @Nullable Duration maxWait;

  /**
   * Waits for the current thread to sleep for a while.
   */
  @FunctionalInterface
  public interface Sleeper {
    Sleeper THREAD_SLEEP = duration -> Thread.sleep(toMillis(duration));

    void sleep(Duration duration) throws InterruptedException;
  }

  /**
   * A fully configurable executor.
   *
   * @param manager
   *          the backoff state to consult and update
   * @param sleeper
   *          how to wait (mainly for testing)
   * @param maxWait
   *          the longest backoff to wait out; attempts needing longer fail
   *          with a {@link BackoffException}. {@code null} waits however long
   *          it takes.
   */
  public BackoffExecutor(BackoffManager manager, Sleeper sleeper, @Nullable Duration maxWait) {
    this.manager = Objects.requireNonNull(manager, "manager");
    this.sleeper = Objects.requireNonNull(sleeper, "sleeper");
    this.maxWait = maxWait;
  }

  /**
   * Executor that sleeps the current thread for as long as required.
   */
  public BackoffExecutor(BackoffManager manager) {
    this(manager, Sleeper.THREAD_SLEEP, null);
  }

  /**
   * Wait out the backoff for {@code destination}, then call {@code attempt}
   * and report the status code it returns.
   * <p>
   * If the attempt throws, or its status code can't be read from the result,
   * the exception is reported as a transport error and rethrown. Interruption is rethrown without being reported, as it says
   * nothing about the destination.
   * </p>
   *
   * @throws BackoffException
   *           if the backoff is longer than the maximum wait, or the wait is
   *           interrupted
   */
  public <T> T checkedAttempt(String destination, Callable<T> attempt, ToIntFunction<? super T> statusCode)
      throws Exception {
    awaitBackoff(destination);
    T result;
    int status;
    try {
      result = attempt.call();
      status = statusCode.applyAsInt(result);
    } catch (InterruptedException e) {
      throw e;
    } catch (Exception e) {
      manager.updateBackoff(destination, e, 0);
      throw e;
    }
    manager.updateBackoff(destination, null, status);
    return result;
  }

  /**
   * As {@link #checkedAttempt(String, Callable, ToIntFunction)}, for attempts
   * that return just their status code.
   */
  public int checkedAttempt(String destination, Callable<Integer> attempt) throws Exception {
    return checkedAttempt(destination, attempt, Integer::intValue);
  }

  /**
   * As {@link #checkedAttempt(String, Callable, ToIntFunction)}, rethrowing
   * any exception unchanged without declaring it.
   */
  public <T> T attempt(String destination, Supplier<T> attempt, ToIntFunction<? super T> statusCode) {
    try {
      return checkedAttempt(destination, attempt::get, statusCode);
    } catch (Exception e) {
      throw sneakyThrow(e);
    }
  }

  /**
   * As {@link #attempt(String, Supplier, ToIntFunction)}, for attempts that
   * return just their status code.
   */
  public int attempt(String destination, Supplier<Integer> attempt) {
    return attempt(destination, attempt, Integer::intValue);
  }

  /**
   * Wrap a Supplier so that every call to it goes through
   * {@link #attempt(String, Supplier, ToIntFunction)}.
   */
  public <T> Supplier<T> wrap(String destination, Supplier<T> attempt, ToIntFunction<? super T> statusCode) {
    return () -> attempt(destination, attempt, statusCode);
  }

  private void awaitBackoff(String destination) {
    var delay = manager.calculateBackoff(destination);
    if (delay.isZero() || delay.isNegative()) {
      return;
    }
    if (maxWait != null && delay.compareTo(maxWait) > 0) {
      throw new BackoffException("Backoff longer than maximum wait of " + maxWait, destination, delay);
    }
    LOGGER.debug("Waiting {} before attempting {}", delay, destination);
    try {
      sleeper.sleep(delay);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new BackoffException("Interrupted while backing off", destination, delay, e);
    }
  }

  private static long toMillis(Duration duration) {
    try {
      return duration.toMillis();
    } catch (ArithmeticException e) {
      return Long.MAX_VALUE;
    }
  }
}
