package com.codeheadsystems.tollgate.server.token;

/**
 * Parses {@code Authorization: Bearer <token>} headers.
 */
public final class BearerToken {

  private static final String PREFIX = "Bearer ";

  private BearerToken() {
  }

  /**
   * Extracts the token. The scheme is matched case-insensitively.
   *
   * @param authorization the raw header, may be null
   * @return the token, or null if the header is absent, empty or uses another scheme
   */
  public static String parse(final String authorization) {
    if (authorization == null
        || !authorization.regionMatches(true, 0, PREFIX, 0, PREFIX.length())) {
      return null;
    }
    String token = authorization.substring(PREFIX.length()).trim();
    return token.isEmpty() ? null : token;
  }
}
