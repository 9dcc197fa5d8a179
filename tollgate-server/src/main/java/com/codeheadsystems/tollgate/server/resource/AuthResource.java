package com.codeheadsystems.tollgate.server.resource;

import com.codeheadsystems.tollgate.model.auth.ChangePasswordRequest;
import com.codeheadsystems.tollgate.model.auth.ErrorCode;
import com.codeheadsystems.tollgate.model.auth.ErrorResponse;
import com.codeheadsystems.tollgate.model.auth.LoginRequest;
import com.codeheadsystems.tollgate.model.auth.LoginResponse;
import com.codeheadsystems.tollgate.model.auth.RegisterRequest;
import com.codeheadsystems.tollgate.model.auth.UserProfile;
import com.codeheadsystems.tollgate.server.exceptions.AuthException;
import com.codeheadsystems.tollgate.server.exceptions.AuthenticationException;
import com.codeheadsystems.tollgate.server.exceptions.ConflictException;
import com.codeheadsystems.tollgate.server.manager.AuthManager;
import com.codeheadsystems.tollgate.server.token.BearerToken;
import jakarta.ws.rs.Consumes;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.HeaderParam;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.WebApplicationException;
import jakarta.ws.rs.core.HttpHeaders;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * JAX-RS resource exposing {@link AuthManager}.
 * <p>
 * Endpoints:
 * <ul>
 *   <li>{@code POST /api/auth/register}       : create an account (201)</li>
 *   <li>{@code POST /api/auth/login}          : exchange credentials for a token</li>
 *   <li>{@code POST /api/auth/refresh}        : exchange the bearer token for a new one</li>
 *   <li>{@code POST /api/auth/logout}         : revoke the bearer token, always 200</li>
 *   <li>{@code GET  /api/auth/me}             : profile of the bearer token's account</li>
 *   <li>{@code POST /api/auth/change-password}: replace the password (204)</li>
 * </ul>
 * Failures carry an {@link ErrorResponse} body.
 */
@Path("/api/auth")
@Produces(MediaType.APPLICATION_JSON)
@Consumes(MediaType.APPLICATION_JSON)
public class AuthResource {

  private static final Logger log = LoggerFactory.getLogger(AuthResource.class);

  private final AuthManager authManager;

  public AuthResource(final AuthManager authManager) {
    this.authManager = authManager;
  }

  @POST
  @Path("/register")
  public Response register(final RegisterRequest req) {
    log.debug("register()");
    UserProfile profile = call(() -> authManager.register(req));
    return Response.status(Response.Status.CREATED).entity(profile).build();
  }

  @POST
  @Path("/login")
  public LoginResponse login(final LoginRequest req) {
    log.debug("login()");
    return call(() -> authManager.login(req));
  }

  @POST
  @Path("/refresh")
  public LoginResponse refresh(@HeaderParam(HttpHeaders.AUTHORIZATION) final String authorization) {
    log.debug("refresh()");
    return call(() -> authManager.refresh(bearerToken(authorization)));
  }

  /**
   * Always succeeds, whatever the state of the presented token.
   */
  @POST
  @Path("/logout")
  public Response logout(@HeaderParam(HttpHeaders.AUTHORIZATION) final String authorization) {
    log.debug("logout()");
    authManager.logout(bearerToken(authorization));
    return Response.ok().build();
  }

  /**
   * Reports every rejection as the generic {@link ErrorCode#UNAUTHORIZED}.
   */
  @GET
  @Path("/me")
  public UserProfile me(@HeaderParam(HttpHeaders.AUTHORIZATION) final String authorization) {
    log.debug("me()");
    try {
      return authManager.currentProfile(bearerToken(authorization));
    } catch (AuthenticationException e) {
      log.debug("me(): {} {}", e.code(), e.getMessage());
      throw error(Response.Status.UNAUTHORIZED, ErrorCode.UNAUTHORIZED, "Unauthorized");
    }
  }

  @POST
  @Path("/change-password")
  public Response changePassword(@HeaderParam(HttpHeaders.AUTHORIZATION) final String authorization,
                                 final ChangePasswordRequest req) {
    log.debug("changePassword()");
    call(() -> {
      authManager.changePassword(bearerToken(authorization), req);
      return null;
    });
    return Response.noContent().build();
  }

  // ── Helpers ───────────────────────────────────────────────────────────────

  /**
   * Extracts the token from an {@code Authorization: Bearer <token>} header.
   *
   * @param authorization the raw header, may be null
   * @return the token, or null if the header is absent or uses another scheme
   */
  public static String bearerToken(final String authorization) {
    return BearerToken.parse(authorization);
  }

  /**
   * The HTTP status for a manager failure.
   *
   * @param e the failure
   * @return 400, 409 or 401
   */
  public static Response.Status statusFor(final AuthException e) {
    if (e instanceof ConflictException) {
      return Response.Status.CONFLICT;
    }
    if (e instanceof AuthenticationException) {
      return Response.Status.UNAUTHORIZED;
    }
    return Response.Status.BAD_REQUEST;
  }

  private static <T> T call(Supplier<T> action) {
    try {
      return action.get();
    } catch (AuthException e) {
      log.debug("Request failed: {} {}", e.code(), e.getMessage());
      throw error(statusFor(e), e.code(), e.getMessage());
    }
  }

  private static WebApplicationException error(Response.Status status, ErrorCode code,
                                               String message) {
    return new WebApplicationException(message, Response.status(status)
        .type(MediaType.APPLICATION_JSON_TYPE)
        .entity(new ErrorResponse(code, message))
        .build());
  }
}
