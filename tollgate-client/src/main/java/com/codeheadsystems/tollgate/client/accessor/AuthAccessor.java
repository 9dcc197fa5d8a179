package com.codeheadsystems.tollgate.client.accessor;

import com.codeheadsystems.tollgate.client.exceptions.AuthAccessorException;
import com.codeheadsystems.tollgate.client.exceptions.AuthRejectedException;
import com.codeheadsystems.tollgate.client.exceptions.AuthRequestException;
import com.codeheadsystems.tollgate.client.model.ServerConnectionInfo;
import com.codeheadsystems.tollgate.model.auth.ChangePasswordRequest;
import com.codeheadsystems.tollgate.model.auth.ErrorCode;
import com.codeheadsystems.tollgate.model.auth.ErrorResponse;
import com.codeheadsystems.tollgate.model.auth.LoginRequest;
import com.codeheadsystems.tollgate.model.auth.LoginResponse;
import com.codeheadsystems.tollgate.model.auth.RegisterRequest;
import com.codeheadsystems.tollgate.model.auth.UserProfile;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import javax.inject.Inject;
import javax.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * HTTP client for the {@code /api/auth} endpoints.
 * <p>
 * Handles request serialization, HTTP dispatch, status-code checking, and response
 * deserialization. Calls are blocking; {@code ClientSession} runs them on its executor.
 * <p>
 * Status mapping:
 * <ul>
 *   <li>401 / 403 → {@link AuthRejectedException} (a {@link SecurityException})</li>
 *   <li>other 4xx → {@link AuthRequestException} carrying the server's {@link ErrorResponse}</li>
 *   <li>5xx, I/O errors and interruptions → {@link AuthAccessorException}</li>
 * </ul>
 */
@Singleton
public class AuthAccessor {

  private static final Logger log = LoggerFactory.getLogger(AuthAccessor.class);

  private static final String BASE_PATH = "/api/auth";

  private final HttpClient httpClient;
  private final ObjectMapper objectMapper;
  private final ServerConnectionInfo server;

  /**
   * Instantiates a new auth accessor.
   *
   * @param httpClient   the http client
   * @param objectMapper the object mapper, see {@link #newObjectMapper()}
   * @param server       the server connection
   */
  @Inject
  public AuthAccessor(final HttpClient httpClient,
                      final ObjectMapper objectMapper,
                      final ServerConnectionInfo server) {
    log.info("AuthAccessor({})", server.endpoint());
    this.httpClient = httpClient;
    this.objectMapper = objectMapper;
    this.server = server;
  }

  /**
   * An ObjectMapper configured for the wire models: ISO-8601 instants, unknown fields ignored.
   *
   * @return a new object mapper
   */
  public static ObjectMapper newObjectMapper() {
    return new ObjectMapper()
        .registerModule(new JavaTimeModule())
        .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
        .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
  }

  // ── Account ───────────────────────────────────────────────────────────────

  /**
   * Registers a new account.
   *
   * @param request the registration data
   * @return the created profile
   */
  public UserProfile register(final RegisterRequest request) {
    log.debug("register()");
    return exchange(post("/register", request, null), UserProfile.class);
  }

  /**
   * Fetches the profile of the token's account.
   *
   * @param token the bearer token
   * @return the profile
   */
  public UserProfile me(final String token) {
    log.debug("me()");
    HttpRequest request = builder("/me", token)
        .header("Accept", "application/json")
        .GET()
        .build();
    return exchange(request, UserProfile.class);
  }

  /**
   * Changes the password of the token's account.
   *
   * @param token   the bearer token
   * @param request the current and new passwords
   */
  public void changePassword(final String token, final ChangePasswordRequest request) {
    log.debug("changePassword()");
    exchange(post("/change-password", request, token), null);
  }

  // ── Session ───────────────────────────────────────────────────────────────

  /**
   * Exchanges credentials for a token.
   *
   * @param request the credentials
   * @return the token, profile and expiry
   */
  public LoginResponse login(final LoginRequest request) {
    log.debug("login()");
    return exchange(post("/login", request, null), LoginResponse.class);
  }

  /**
   * Exchanges a token for a new one.
   *
   * @param token the current token
   * @return the new token, profile and expiry
   */
  public LoginResponse refresh(final String token) {
    log.debug("refresh()");
    return exchange(post("/refresh", null, token), LoginResponse.class);
  }

  /**
   * Revokes the token on the server.
   *
   * @param token the token
   */
  public void logout(final String token) {
    log.debug("logout()");
    exchange(post("/logout", null, token), null);
  }

  // ── Helpers ───────────────────────────────────────────────────────────────

  private HttpRequest.Builder builder(String path, String bearerToken) {
    URI base = server.endpoint();
    HttpRequest.Builder builder = HttpRequest.newBuilder()
        .uri(base.resolve(base.getPath() + BASE_PATH + path));
    if (bearerToken != null) {
      builder.header("Authorization", "Bearer " + bearerToken);
    }
    return builder;
  }

  private HttpRequest post(String path, Object body, String bearerToken) {
    try {
      String requestBody = body == null ? "" : objectMapper.writeValueAsString(body);
      return builder(path, bearerToken)
          .header("Content-Type", "application/json")
          .header("Accept", "application/json")
          .POST(HttpRequest.BodyPublishers.ofString(requestBody))
          .build();
    } catch (IOException e) {
      throw new AuthAccessorException("Could not serialize request for " + path, e);
    }
  }

  private <T> T exchange(HttpRequest request, Class<T> responseType) {
    try {
      HttpResponse<String> response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
      checkStatus(response);
      if (responseType == null) {
        return null;
      }
      return objectMapper.readValue(response.body(), responseType);
    } catch (IOException e) {
      throw new AuthAccessorException("HTTP request failed for server: " + server.endpoint(), e);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new AuthAccessorException("HTTP request interrupted for server: " + server.endpoint(), e);
    }
  }

  private void checkStatus(HttpResponse<String> response) {
    int statusCode = response.statusCode();
    if (statusCode < 400) {
      return;
    }
    if (statusCode >= 500) {
      throw new AuthAccessorException(
          "Server returned HTTP " + statusCode + " for server: " + server.endpoint(), null);
    }
    ErrorResponse error = errorBody(response.body(), statusCode);
    if (statusCode == 401 || statusCode == 403) {
      throw new AuthRejectedException(statusCode, error);
    }
    throw new AuthRequestException(statusCode, error);
  }

  private ErrorResponse errorBody(String body, int statusCode) {
    ErrorCode fallbackCode = statusCode == 401 || statusCode == 403
        ? ErrorCode.UNAUTHORIZED : ErrorCode.VALIDATION;
    ErrorResponse fallback = new ErrorResponse(fallbackCode, "Server returned HTTP " + statusCode);
    if (body == null || body.isBlank()) {
      return fallback;
    }
    try {
      ErrorResponse parsed = objectMapper.readValue(body, ErrorResponse.class);
      return parsed == null || parsed.message() == null ? fallback : parsed;
    } catch (IOException e) {
      log.debug("Unparseable error body for HTTP {}: {}", statusCode, e.getMessage());
      return fallback;
    }
  }
}
