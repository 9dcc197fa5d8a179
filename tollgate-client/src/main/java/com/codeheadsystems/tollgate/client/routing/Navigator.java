package com.codeheadsystems.tollgate.client.routing;

import com.codeheadsystems.tollgate.client.session.AuthState;
import com.codeheadsystems.tollgate.client.session.ClientSession;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.atomic.AtomicReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs navigation attempts against a {@link RouteTable}.
 * <p>
 * Each attempt reads the session state once and evaluates every guard and redirect against that
 * snapshot. Attempts run independently on the executor; whichever completes last sets
 * {@link #currentLocation()}.
 */
public class Navigator {

  static final int MAX_REDIRECTS = 10;

  private static final Logger log = LoggerFactory.getLogger(Navigator.class);

  private final RouteTable routeTable;
  private final ClientSession session;
  private final Executor executor;
  private final AtomicReference<String> currentLocation = new AtomicReference<>("/");

  public Navigator(final RouteTable routeTable,
                   final ClientSession session,
                   final Executor executor) {
    this.routeTable = routeTable;
    this.session = session;
    this.executor = executor;
  }

  /**
   * Navigates to a destination.
   *
   * @param url the destination including query and fragment
   * @return the outcome, failing with {@link IllegalArgumentException} when no route matches
   *     and {@link IllegalStateException} on a redirect loop
   */
  public CompletableFuture<NavigationResult> navigate(final String url) {
    log.debug("navigate({})", url);
    return CompletableFuture.supplyAsync(() -> resolve(url, session.state()), executor)
        .thenApply(result -> {
          currentLocation.set(result.location());
          return result;
        });
  }

  /**
   * Navigates to the destination carried by the current location's {@code returnUrl}, or to
   * the landing page when there is none. Called after a successful login.
   *
   * @return the outcome
   */
  public CompletableFuture<NavigationResult> resumeAfterLogin() {
    return navigate(returnUrl(currentLocation.get()).orElse("/"));
  }

  public String currentLocation() {
    return currentLocation.get();
  }

  /**
   * Extracts the destination a login page should resume. Only same-origin paths are returned.
   *
   * @param loginUrl the login URL, e.g. {@code /login?returnUrl=%2Finventory}
   * @return the decoded destination
   */
  public static Optional<String> returnUrl(final String loginUrl) {
    return UriComponents.queryParameter(loginUrl, AuthGuard.RETURN_URL_PARAM)
        .filter(u -> u.startsWith("/") && !u.startsWith("//"));
  }

  NavigationResult resolve(String url, AuthState snapshot) {
    String location = url;
    boolean redirected = false;
    for (int hops = 0; hops <= MAX_REDIRECTS; hops++) {
      String target = location;
      Route route = routeTable.resolve(target)
          .orElseThrow(() -> new IllegalArgumentException("No route for " + target));
      if (route.isRedirect()) {
        location = route.redirectTo();
        redirected = true;
        continue;
      }
      Optional<String> redirect = firstRedirect(route, target, snapshot);
      if (redirect.isEmpty()) {
        return new NavigationResult(url, target, route.name(), redirected);
      }
      location = redirect.get();
      redirected = true;
    }
    throw new IllegalStateException("Too many redirects navigating to " + url);
  }

  private Optional<String> firstRedirect(Route route, String url, AuthState snapshot) {
    for (RouteGuard guard : route.guards()) {
      if (guard.canEnter(url, snapshot) instanceof GuardDecision.Redirect redirect) {
        return Optional.of(redirect.location());
      }
    }
    return Optional.empty();
  }
}
