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

import java.net.URI;
import java.util.Locale;

/**
 * Derives the key requests share backoff state under: their scheme, host and
 * port. Paths, queries and credentials are ignored.
 * <p>
 * The port is filled in for the schemes whose default port is known (http,
 * https, ws, wss and ftp). For any other scheme a URI without a port gets a
 * key without one, distinct from the same host with its port spelled out.
 * </p>
 */
public final class DestinationKeys {
  private DestinationKeys() {
  }

  /**
   * @return a key of the form {@code scheme://host:port}
   * @throws IllegalArgumentException
   *           if {@code uri} has no scheme or no host
   */
  public static String of(URI uri) {
    var scheme = uri.getScheme();
    var host = uri.getHost();
    if (scheme == null || host == null) {
      throw new IllegalArgumentException("Cannot derive a destination from " + uri);
    }
    scheme = scheme.toLowerCase(Locale.ROOT);
    var port = uri.getPort();
    if (port == -1) {
      port = defaultPort(scheme);
    }
    var key = scheme + "://" + host.toLowerCase(Locale.ROOT);
    return port == -1 ? key : key + ":" + port;
  }

  public static String of(String uri) {
    return of(URI.create(uri));
  }

  private static int defaultPort(String scheme) {
    return switch (scheme) {
      case "http", "ws" -> 80;
      case "https", "wss" -> 443;
      case "ftp" -> 21;
      default -> -1;
    };
  }
}
