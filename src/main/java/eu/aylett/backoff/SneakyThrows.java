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

final class SneakyThrows {
  private SneakyThrows() {
  }

  /**
   * Rethrow {@code t} without the compiler noticing that it may be checked.
   * Declared to return an exception so callers can write
   * {@code throw sneakyThrow(e)}.
   */
  static RuntimeException sneakyThrow(Throwable t) {
    throw SneakyThrows.<RuntimeException>rethrow(t);
  }

  @SuppressWarnings("unchecked")
  private static <T extends Throwable> T rethrow(Throwable t) throws T {
    throw (T) t;
  }
}
