package com.codeheadsystems.tollgate.client.session;

/**
 * Receives authentication state transitions from {@link ClientSession}.
 */
@FunctionalInterface
public interface AuthStateListener {

  void onAuthStateChanged(AuthState state);
}
