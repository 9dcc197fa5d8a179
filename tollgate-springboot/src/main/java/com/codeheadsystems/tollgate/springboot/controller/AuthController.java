package com.codeheadsystems.tollgate.springboot.controller;

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
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Spring MVC twin of the JAX-RS {@code AuthResource}: same paths, statuses and error bodies.
 */
@RestController
@RequestMapping("/api/auth")
public class AuthController {

  private static final Logger log = LoggerFactory.getLogger(AuthController.class);

  private final AuthManager authManager;

  public AuthController(AuthManager authManager) {
    this.authManager = authManager;
  }

  @PostMapping("/register")
  public ResponseEntity<UserProfile> register(@RequestBody RegisterRequest req) {
    log.debug("register()");
    return ResponseEntity.status(HttpStatus.CREATED).body(authManager.register(req));
  }

  @PostMapping("/login")
  public LoginResponse login(@RequestBody LoginRequest req) {
    log.debug("login()");
    return authManager.login(req);
  }

  @PostMapping("/refresh")
  public LoginResponse refresh(
      @RequestHeader(value = HttpHeaders.AUTHORIZATION, required = false) String authorization) {
    log.debug("refresh()");
    return authManager.refresh(BearerToken.parse(authorization));
  }

  @PostMapping("/logout")
  public ResponseEntity<Void> logout(
      @RequestHeader(value = HttpHeaders.AUTHORIZATION, required = false) String authorization) {
    log.debug("logout()");
    authManager.logout(BearerToken.parse(authorization));
    return ResponseEntity.ok().build();
  }

  @GetMapping("/me")
  public UserProfile me(
      @RequestHeader(value = HttpHeaders.AUTHORIZATION, required = false) String authorization) {
    log.debug("me()");
    try {
      return authManager.currentProfile(BearerToken.parse(authorization));
    } catch (AuthenticationException e) {
      log.debug("me(): {} {}", e.code(), e.getMessage());
      throw new AuthenticationException(ErrorCode.UNAUTHORIZED, "Unauthorized");
    }
  }

  @PostMapping("/change-password")
  public ResponseEntity<Void> changePassword(
      @RequestHeader(value = HttpHeaders.AUTHORIZATION, required = false) String authorization,
      @RequestBody ChangePasswordRequest req) {
    log.debug("changePassword()");
    authManager.changePassword(BearerToken.parse(authorization), req);
    return ResponseEntity.noContent().build();
  }

  @ExceptionHandler(AuthException.class)
  public ResponseEntity<ErrorResponse> handle(AuthException e) {
    log.debug("Request failed: {} {}", e.code(), e.getMessage());
    return ResponseEntity.status(statusFor(e)).body(new ErrorResponse(e.code(), e.getMessage()));
  }

  static HttpStatus statusFor(AuthException e) {
    if (e instanceof ConflictException) {
      return HttpStatus.CONFLICT;
    }
    if (e instanceof AuthenticationException) {
      return HttpStatus.UNAUTHORIZED;
    }
    return HttpStatus.BAD_REQUEST;
  }
}
