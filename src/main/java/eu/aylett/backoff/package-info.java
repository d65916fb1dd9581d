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

/**
 * When a service starts failing, clients that keep sending requests at full
 * rate only make its recovery slower.
 * <p>
 * A {@link eu.aylett.backoff.BackoffManager} remembers, per destination, how
 * long a client should wait before its next attempt. The wait doubles with
 * every consecutive failure up to a configured ceiling, and is forgotten as
 * soon as the destination answers successfully again.
 * </p>
 * <p>
 * Use one manager per client, shared between every request it makes. Derive
 * destination keys with {@link eu.aylett.backoff.DestinationKeys} so that
 * requests to the same host share their state regardless of path.
 * </p>
 * <p>
 * The manager only computes durations: the caller does the waiting. If you
 * don't want to do that yourself, {@link eu.aylett.backoff.BackoffExecutor}
 * and {@link eu.aylett.backoff.BackoffHttpClient} wrap the whole
 * wait/attempt/report cycle.
 * </p>
 */
@NullMarked
package eu.aylett.backoff;

import org.jspecify.annotations.NullMarked;
