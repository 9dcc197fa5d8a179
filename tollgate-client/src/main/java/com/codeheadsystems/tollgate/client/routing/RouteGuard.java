package com.codeheadsystems.tollgate.client.routing;

import com.codeheadsystems.tollgate.client.session.AuthState;

/**
 * Decides whether a navigation may enter a destination. Guards are pure functions of their
 * inputs; the caller reads the session once per navigation attempt and passes the snapshot.
 */
@FunctionalInterface
public interface RouteGuard {

  /**
   * Checks a navigation.
   *
   * @param url   the destination including query and fragment, e.g. {@code /inventory?sort=name}
   * @param state the authentication snapshot for this attempt
   * @return allow, or where to go instead
   */
  GuardDecision canEnter(String url, AuthState state);
}
