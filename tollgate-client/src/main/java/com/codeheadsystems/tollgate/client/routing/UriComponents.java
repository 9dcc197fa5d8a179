package com.codeheadsystems.tollgate.client.routing;

import java.net.URLDecoder;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Percent-encoding with the same output as JavaScript's {@code encodeURIComponent}, plus query
 * parameter lookup.
 */
public final class UriComponents {

  private static final Logger log = LoggerFactory.getLogger(UriComponents.class);

  private UriComponents() {
  }

  /**
   * Encodes everything except {@code A-Z a-z 0-9 - _ . ! ~ * ' ( )}. Spaces become {@code %20}.
   *
   * @param value the raw value
   * @return the encoded value
   */
  public static String encode(final String value) {
    return URLEncoder.encode(value, StandardCharsets.UTF_8)
        .replace("+", "%20")
        .replace("%21", "!")
        .replace("%27", "'")
        .replace("%28", "(")
        .replace("%29", ")")
        .replace("%7E", "~");
  }

  public static String decode(final String value) {
    return URLDecoder.decode(value, StandardCharsets.UTF_8);
  }

  /**
   * Finds the first value of a query parameter.
   *
   * @param url  a path with optional query and fragment
   * @param name the parameter name
   * @return the decoded value, empty when absent or not validly percent-encoded
   */
  public static Optional<String> queryParameter(final String url, final String name) {
    int q = url.indexOf('?');
    if (q < 0) {
      return Optional.empty();
    }
    int hash = url.indexOf('#', q);
    String query = hash < 0 ? url.substring(q + 1) : url.substring(q + 1, hash);
    for (String pair : query.split("&")) {
      int eq = pair.indexOf('=');
      String key = eq < 0 ? pair : pair.substring(0, eq);
      if (tryDecode(key).filter(name::equals).isPresent()) {
        return eq < 0 ? Optional.of("") : tryDecode(pair.substring(eq + 1));
      }
    }
    return Optional.empty();
  }

  private static Optional<String> tryDecode(String value) {
    try {
      return Optional.of(decode(value));
    } catch (IllegalArgumentException e) {
      log.debug("Ignoring badly escaped query component '{}': {}", value, e.getMessage());
      return Optional.empty();
    }
  }

  /**
   * The path of a URL without leading slash, query or fragment.
   *
   * @param url the URL
   * @return the bare path, empty for the root
   */
  public static String path(final String url) {
    int end = url.length();
    int q = url.indexOf('?');
    if (q >= 0) {
      end = q;
    }
    int hash = url.indexOf('#');
    if (hash >= 0 && hash < end) {
      end = hash;
    }
    String path = url.substring(0, end);
    while (path.startsWith("/")) {
      path = path.substring(1);
    }
    while (path.endsWith("/")) {
      path = path.substring(0, path.length() - 1);
    }
    return path;
  }
}
