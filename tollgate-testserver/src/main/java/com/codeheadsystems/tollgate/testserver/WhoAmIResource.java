package com.codeheadsystems.tollgate.testserver;

import com.codeheadsystems.tollgate.dropwizard.auth.TollgatePrincipal;
import io.dropwizard.auth.Auth;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.MediaType;
import java.util.Map;

/**
 * Bearer-protected endpoint echoing the caller's identity.
 */
@Path("/api/whoami")
@Produces(MediaType.APPLICATION_JSON)
public class WhoAmIResource {

  /**
   * Returns the account id and username of the authenticated token.
   *
   * @param principal the principal injected by the Dropwizard auth filter
   * @return a map containing {@code accountId} and {@code username}
   */
  @GET
  public Map<String, String> whoAmI(@Auth TollgatePrincipal principal) {
    return Map.of("accountId", principal.accountId(), "username", principal.username());
  }
}
