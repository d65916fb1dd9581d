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

import com.google.common.testing.EqualsTester;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.time.Duration;
import java.util.Map;
import java.util.Optional;

import static eu.aylett.backoff.BackoffConfig.ENV_BASE;
import static eu.aylett.backoff.BackoffConfig.ENV_DURATION;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.equalTo;
import static org.junit.jupiter.api.Assertions.assertThrows;

class BackoffConfigTest {
  @Test
  void readsSecondsFromEnvironment() {
    var config = BackoffConfig.fromEnvironment(Map.of(ENV_BASE, "1", ENV_DURATION, "2"));
    assertThat(config, equalTo(BackoffConfig.of(Duration.ofSeconds(1), Duration.ofSeconds(2))));
  }

  @Test
  void trimsWhitespace() {
    var config = BackoffConfig.fromEnvironment(Map.of(ENV_BASE, " 3 ", ENV_DURATION, "60\n"));
    assertThat(config.baseDelay(), equalTo(Optional.of(Duration.ofSeconds(3))));
    assertThat(config.maxDelay(), equalTo(Optional.of(Duration.ofSeconds(60))));
  }

  @Test
  void zeroIsAValue() {
    var config = BackoffConfig.fromEnvironment(Map.of(ENV_BASE, "1", ENV_DURATION, "0"));
    assertThat(config.maxDelay(), equalTo(Optional.of(Duration.ZERO)));
  }

  @Test
  void emptyEnvironmentIsUnset() {
    assertThat(BackoffConfig.fromEnvironment(Map.of()), equalTo(BackoffConfig.unset()));
  }

  @Test
  void onlyOneValue() {
    var config = BackoffConfig.fromEnvironment(Map.of(ENV_BASE, "1"));
    assertThat(config.baseDelay(), equalTo(Optional.of(Duration.ofSeconds(1))));
    assertThat(config.maxDelay(), equalTo(Optional.empty()));
  }

  @ParameterizedTest
  @ValueSource(strings = {"", "  ", "one", "1.5", "-1", "1s", "99999999999999999999"})
  void unparsableValuesAreUnset(String value) {
    var config = BackoffConfig.fromEnvironment(Map.of(ENV_BASE, value, ENV_DURATION, value));
    assertThat(config, equalTo(BackoffConfig.unset()));
  }

  @Test
  void negativeDurationsAreRejected() {
    assertThrows(IllegalArgumentException.class, () -> BackoffConfig.of(Duration.ofSeconds(-1), null));
    assertThrows(IllegalArgumentException.class, () -> BackoffConfig.of(null, Duration.ofSeconds(-1)));
  }

  @Test
  void equalityAndHashcodeTest() {
    new EqualsTester().addEqualityGroup(BackoffConfig.unset(), BackoffConfig.of(null, null))
        .addEqualityGroup(BackoffConfig.of(Duration.ofSeconds(1), null))
        .addEqualityGroup(BackoffConfig.of(null, Duration.ofSeconds(1)))
        .addEqualityGroup(BackoffConfig.of(Duration.ofSeconds(1), Duration.ofSeconds(2)),
            BackoffConfig.of(Duration.ofMillis(1000), Duration.ofSeconds(2)))
        .testEquals();
  }
}
