package com.codeheadsystems.tollgate.client.routing;

/**
 * Outcome of a {@link RouteGuard} check.
 */
public sealed interface GuardDecision permits GuardDecision.Allow, GuardDecision.Redirect {

  GuardDecision ALLOW = new Allow();

  /**
   * Navigation may proceed to the requested destination.
   */
  record Allow() implements GuardDecision {
  }

  /**
   * Navigation is replaced by a navigation to {@code location}.
   *
   * @param location the path (with query) to go to instead
   */
  record Redirect(String location) implements GuardDecision {
  }
}
