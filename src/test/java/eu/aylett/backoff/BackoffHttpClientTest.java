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

import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.net.ConnectException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.equalTo;
import static org.hamcrest.Matchers.sameInstance;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doReturn;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class BackoffHttpClientTest {
  private final InstantAnswer time = new InstantAnswer();
  private final List<Duration> sleeps = new ArrayList<>();
  private final ExponentialBackoffManager manager = new ExponentialBackoffManager(Duration.ofSeconds(1),
      Duration.ofSeconds(2), time.clock(), FailurePolicy.DEFAULT);
  private final HttpClient delegate = mock(HttpClient.class);
  private final BackoffHttpClient client = new BackoffHttpClient(delegate,
      new BackoffExecutor(manager, duration -> {
        sleeps.add(duration);
        time.plus(duration);
      }, null));

  @SuppressWarnings("unchecked")
  private static HttpResponse<String> response(int statusCode) {
    HttpResponse<String> response = mock(HttpResponse.class);
    when(response.statusCode()).thenReturn(statusCode);
    return response;
  }

  private static HttpRequest get(String uri) {
    return HttpRequest.newBuilder(URI.create(uri)).GET().build();
  }

  @Test
  void serverErrorsBackOffTheHost() throws Exception {
    var unavailable = response(503);
    doReturn(unavailable).when(delegate).send(any(), any());

    var first = client.send(get("http://localhost/api/v1/pods"), HttpResponse.BodyHandlers.ofString());
    client.send(get("http://localhost/api/v1/services"), HttpResponse.BodyHandlers.ofString());
    client.send(get("http://localhost/healthz"), HttpResponse.BodyHandlers.ofString());

    assertThat(first, sameInstance(unavailable));
    assertThat(sleeps, contains(Duration.ofSeconds(1), Duration.ofSeconds(2)));
    assertThat(manager.calculateBackoff("http://localhost:80"), equalTo(Duration.ofSeconds(2)));
  }

  @Test
  void successClearsTheBackoff() throws Exception {
    doReturn(response(500)).when(delegate).send(any(), any());
    client.send(get("https://api.example.com/a"), HttpResponse.BodyHandlers.ofString());

    doReturn(response(200)).when(delegate).send(any(), any());
    client.send(get("https://api.example.com/b"), HttpResponse.BodyHandlers.ofString());

    assertThat(manager.calculateBackoff("https://api.example.com:443"), equalTo(Duration.ZERO));
  }

  @Test
  void hostsAreBackedOffIndependently() throws Exception {
    doReturn(response(500)).when(delegate).send(any(), any());
    client.send(get("http://a.example.com/"), HttpResponse.BodyHandlers.ofString());
    client.send(get("http://b.example.com/"), HttpResponse.BodyHandlers.ofString());

    assertThat(sleeps.isEmpty(), equalTo(true));
    assertThat(manager.calculateBackoff("http://a.example.com:80"), equalTo(Duration.ofSeconds(1)));
    assertThat(manager.calculateBackoff("http://b.example.com:80"), equalTo(Duration.ofSeconds(1)));
  }

  @Test
  void ioErrorsBackOffAndPropagate() throws Exception {
    var failure = new ConnectException("connection refused");
    doThrow(failure).when(delegate).send(any(), any());

    var thrown = assertThrows(IOException.class,
        () -> client.send(get("http://localhost:8080/"), HttpResponse.BodyHandlers.ofString()));
    assertThat(thrown, sameInstance(failure));
    assertThat(manager.calculateBackoff("http://localhost:8080"), equalTo(Duration.ofSeconds(1)));
  }
}
