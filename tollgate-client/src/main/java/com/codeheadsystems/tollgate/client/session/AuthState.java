package com.codeheadsystems.tollgate.client.session;

import com.codeheadsystems.tollgate.model.auth.UserProfile;
import java.util.Optional;

/**
 * A snapshot of the client's authentication state.
 *
 * @param authenticated whether a non-expired session exists
 * @param profile       the signed-in account, null when unauthenticated
 */
public record AuthState(boolean authenticated, UserProfile profile) {

  public static final AuthState UNAUTHENTICATED = new AuthState(false, null);

  public static AuthState of(final UserProfile profile) {
    return new AuthState(true, profile);
  }

  public Optional<UserProfile> user() {
    return Optional.ofNullable(profile);
  }
}
