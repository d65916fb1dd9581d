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

import java.io.IOException;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.util.Objects;

import static eu.aylett.backoff.SneakyThrows.sneakyThrow;

/**
 * Sends requests through an {@link HttpClient}, backing off each host that
 * keeps failing.
 */
public class BackoffHttpClient {
  private final HttpClient delegate;
  private final BackoffExecutor executor;

  public BackoffHttpClient(HttpClient delegate, BackoffExecutor executor) {
    this.delegate = Objects.requireNonNull(delegate, "delegate");
    this.executor = Objects.requireNonNull(executor, "executor");
  }

  public BackoffHttpClient(HttpClient delegate, BackoffManager manager) {
    this(delegate, new BackoffExecutor(manager));
  }

  /**
   * Wait out any backoff for the request's host, send the request, and record
   * the response status (or the I/O error) against the host.
   *
   * @throws BackoffException
   *           if the executor refuses to wait out the backoff
   * @see HttpClient#send(HttpRequest, HttpResponse.BodyHandler)
   */
  public <T> HttpResponse<T> send(HttpRequest request, HttpResponse.BodyHandler<T> responseBodyHandler)
      throws IOException, InterruptedException {
    var destination = DestinationKeys.of(request.uri());
    try {
      return executor.checkedAttempt(destination, () -> delegate.send(request, responseBodyHandler),
          HttpResponse::statusCode);
    } catch (Exception e) {
      // HttpClient#send only throws IOException, InterruptedException or unchecked exceptions.
      throw sneakyThrow(e);
    }
  }
}
