package com.codeheadsystems.tollgate.client.routing;

import java.util.List;
import java.util.Optional;

/**
 * Ordered mapping from paths to routes. Exact paths win over the wildcard.
 */
public class RouteTable {

  /**
   * Matches any path no other route matched.
   */
  public static final String WILDCARD = "**";

  private final List<Route> routes;

  public RouteTable(final List<Route> routes) {
    this.routes = List.copyOf(routes);
  }

  /**
   * The application's routes: the landing page, login and registration are open; the
   * feature pages require authentication; anything else goes to the landing page.
   *
   * @param authGuard the guard protecting feature pages
   * @return the table
   */
  public static RouteTable defaultTable(final RouteGuard authGuard) {
    return new RouteTable(List.of(
        Route.open("", "landing"),
        Route.open("login", "login"),
        Route.open("register", "register"),
        Route.guarded("inventory", "inventory", authGuard),
        Route.guarded("locations", "locations", authGuard),
        Route.guarded("categories", "categories", authGuard),
        Route.guarded("reports", "reports", authGuard),
        Route.guarded("profile", "profile", authGuard),
        Route.guarded("settings", "settings", authGuard),
        Route.redirect(WILDCARD, "/")));
  }

  /**
   * Finds the route for a URL.
   *
   * @param url the destination, query and fragment are ignored
   * @return the matching route
   */
  public Optional<Route> resolve(final String url) {
    String path = UriComponents.path(url);
    Optional<Route> exact = routes.stream().filter(r -> r.path().equals(path)).findFirst();
    if (exact.isPresent()) {
      return exact;
    }
    return routes.stream().filter(r -> WILDCARD.equals(r.path())).findFirst();
  }

  public List<Route> routes() {
    return routes;
  }
}
