package com.codeheadsystems.tollgate.client.routing;

import com.codeheadsystems.tollgate.client.session.AuthState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Admits authenticated sessions; sends everyone else to the login entry point with the
 * original destination in {@code returnUrl}.
 */
public class AuthGuard implements RouteGuard {

  public static final String DEFAULT_LOGIN_PATH = "/login";
  public static final String RETURN_URL_PARAM = "returnUrl";

  private static final Logger log = LoggerFactory.getLogger(AuthGuard.class);

  private final String loginPath;

  public AuthGuard() {
    this(DEFAULT_LOGIN_PATH);
  }

  public AuthGuard(final String loginPath) {
    this.loginPath = loginPath;
  }

  @Override
  public GuardDecision canEnter(final String url, final AuthState state) {
    if (state.authenticated()) {
      return GuardDecision.ALLOW;
    }
    log.debug("canEnter({}): not authenticated, redirecting to {}", url, loginPath);
    return new GuardDecision.Redirect(
        loginPath + "?" + RETURN_URL_PARAM + "=" + UriComponents.encode(url));
  }

  public String loginPath() {
    return loginPath;
  }
}
