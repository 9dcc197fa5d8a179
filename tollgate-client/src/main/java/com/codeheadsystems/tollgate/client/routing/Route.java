package com.codeheadsystems.tollgate.client.routing;

import java.util.List;

/**
 * One entry of a {@link RouteTable}.
 *
 * @param path       the path without leading slash, or {@link RouteTable#WILDCARD}
 * @param name       the destination's name, null for pure redirects
 * @param guards     guards checked in order before entering
 * @param redirectTo where to go instead, null when the route is a destination
 */
public record Route(String path, String name, List<RouteGuard> guards, String redirectTo) {

  public Route {
    guards = List.copyOf(guards);
  }

  public static Route open(final String path, final String name) {
    return new Route(path, name, List.of(), null);
  }

  public static Route guarded(final String path, final String name, final RouteGuard... guards) {
    return new Route(path, name, List.of(guards), null);
  }

  public static Route redirect(final String path, final String redirectTo) {
    return new Route(path, null, List.of(), redirectTo);
  }

  public boolean isRedirect() {
    return redirectTo != null;
  }
}
