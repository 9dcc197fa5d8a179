package com.codeheadsystems.tollgate.server.manager;

import com.codeheadsystems.tollgate.model.auth.ChangePasswordRequest;
import com.codeheadsystems.tollgate.model.auth.ErrorCode;
import com.codeheadsystems.tollgate.model.auth.LoginRequest;
import com.codeheadsystems.tollgate.model.auth.LoginResponse;
import com.codeheadsystems.tollgate.model.auth.RegisterRequest;
import com.codeheadsystems.tollgate.model.auth.UserProfile;
import com.codeheadsystems.tollgate.server.directory.Account;
import com.codeheadsystems.tollgate.server.directory.UserDirectory;
import com.codeheadsystems.tollgate.server.exceptions.AuthenticationException;
import com.codeheadsystems.tollgate.server.exceptions.ValidationException;
import com.codeheadsystems.tollgate.server.hash.PasswordHasher;
import com.codeheadsystems.tollgate.server.token.IdentityClaims;
import com.codeheadsystems.tollgate.server.token.IssuedToken;
import com.codeheadsystems.tollgate.server.token.TokenCodec;
import com.codeheadsystems.tollgate.server.token.TokenErrorKind;
import com.codeheadsystems.tollgate.server.token.TokenValidation;
import com.codeheadsystems.tollgate.server.token.VerifiedClaims;
import java.time.Clock;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.Optional;
import java.util.UUID;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Framework-agnostic service implementing registration, login, token refresh, logout, profile
 * lookup and password change.
 * <p>
 * Framework-specific adapters ({@code AuthResource} for JAX-RS / Dropwizard,
 * {@code AuthController} for Spring Boot) stay thin wrappers that only translate exceptions
 * into HTTP error responses.
 * <p>
 * <strong>Exception contract</strong> (callers should map these to HTTP responses):
 * <ul>
 *   <li>{@link ValidationException}: missing or malformed input → HTTP 400</li>
 *   <li>{@link com.codeheadsystems.tollgate.server.exceptions.ConflictException}
 *       : duplicate email or username → HTTP 409</li>
 *   <li>{@link AuthenticationException}: rejected credentials or token → HTTP 401</li>
 * </ul>
 * {@link #logout} never throws.
 */
public class AuthManager {

  private static final Logger log = LoggerFactory.getLogger(AuthManager.class);

  static final String INVALID_CREDENTIALS = "Invalid username or password";

  private static final Pattern EMAIL = Pattern.compile("^[^@\\s]+@[^@\\s]+\\.[^@\\s]+$");
  private static final Pattern UPPER = Pattern.compile("[A-Z]");
  private static final Pattern LOWER = Pattern.compile("[a-z]");
  private static final Pattern DIGIT = Pattern.compile("\\d");
  private static final Pattern SPECIAL = Pattern.compile("[!@#$%^&*(),.?\"':;{}|<>]");
  private static final int MIN_PASSWORD_LENGTH = 8;

  private final UserDirectory userDirectory;
  private final PasswordHasher passwordHasher;
  private final TokenCodec tokenCodec;
  private final Clock clock;
  // Verified against when the login identifier is unknown, so both failures cost the same.
  private final String dummyDigest;

  public AuthManager(final UserDirectory userDirectory,
                     final PasswordHasher passwordHasher,
                     final TokenCodec tokenCodec,
                     final Clock clock) {
    this.userDirectory = userDirectory;
    this.passwordHasher = passwordHasher;
    this.tokenCodec = tokenCodec;
    this.clock = clock;
    this.dummyDigest = passwordHasher.hash(UUID.randomUUID().toString());
  }

  // ── Registration ─────────────────────────────────────────────────────────

  /**
   * Creates an active account.
   *
   * @param req the registration data
   * @return the new account's profile
   * @throws ValidationException if a field fails validation; the first failing rule is named
   * @throws com.codeheadsystems.tollgate.server.exceptions.ConflictException if the email or
   *                                                                          username exists
   */
  public UserProfile register(final RegisterRequest req) {
    log.debug("register({})", req);
    if (req == null) {
      throw new ValidationException("Email is required");
    }
    if (isBlank(req.email())) {
      throw new ValidationException("Email is required");
    }
    if (!EMAIL.matcher(req.email()).matches()) {
      throw new ValidationException("Invalid email format");
    }
    if (isBlank(req.password())) {
      throw new ValidationException("Password is required");
    }
    requireComplexPassword(req.password());
    if (isBlank(req.firstName())) {
      throw new ValidationException("First name is required");
    }
    if (isBlank(req.lastName())) {
      throw new ValidationException("Last name is required");
    }
    if (isBlank(req.username())) {
      throw new ValidationException("Username is required");
    }

    Account account = new Account(
        UUID.randomUUID().toString(),
        req.username(),
        req.email(),
        req.firstName(),
        req.lastName(),
        passwordHasher.hash(req.password()),
        true,
        now(),
        null);
    // The directory enforces uniqueness atomically: email first, then username.
    Account created = userDirectory.create(account);
    log.info("Registered account id={}", created.id());
    return toProfile(created);
  }

  // ── Login ────────────────────────────────────────────────────────────────

  /**
   * Authenticates by username, falling back to email, and issues a token.
   *
   * @param req the credentials
   * @return the token, profile and expiry
   * @throws ValidationException     if either field is blank
   * @throws AuthenticationException {@link ErrorCode#INVALID_CREDENTIALS} for an unknown account
   *                                 or wrong password, {@link ErrorCode#INACTIVE_ACCOUNT} for a
   *                                 deactivated account whose credentials verified
   */
  public LoginResponse login(final LoginRequest req) {
    log.debug("login({})", req);
    if (req == null || isBlank(req.usernameOrEmail())) {
      throw new ValidationException("Username is required");
    }
    if (isBlank(req.password())) {
      throw new ValidationException("Password is required");
    }

    Optional<Account> found = userDirectory.findByUsername(req.usernameOrEmail())
        .or(() -> userDirectory.findByEmail(req.usernameOrEmail()));
    if (found.isEmpty()) {
      passwordHasher.verify(req.password(), dummyDigest);
      throw new AuthenticationException(ErrorCode.INVALID_CREDENTIALS, INVALID_CREDENTIALS);
    }
    Account account = found.get();
    if (!passwordHasher.verify(req.password(), account.passwordHash())) {
      throw new AuthenticationException(ErrorCode.INVALID_CREDENTIALS, INVALID_CREDENTIALS);
    }
    if (!account.active()) {
      throw new AuthenticationException(ErrorCode.INACTIVE_ACCOUNT, "Account is inactive");
    }
    return startSession(account);
  }

  // ── Refresh ──────────────────────────────────────────────────────────────

  /**
   * Exchanges a valid token for a new one. The old token is revoked; a token can be exchanged
   * at most once.
   *
   * @param token the current token
   * @return the new token, profile and expiry
   * @throws AuthenticationException {@link ErrorCode#TOKEN_EXPIRED} for an expired token,
   *                                 {@link ErrorCode#TOKEN_INVALID} for any other rejection,
   *                                 {@link ErrorCode#ACCOUNT_NOT_FOUND} or
   *                                 {@link ErrorCode#ACCOUNT_INACTIVE} for account problems
   */
  public LoginResponse refresh(final String token) {
    log.debug("refresh()");
    VerifiedClaims claims = requireValid(token);
    Account account = requireActiveAccount(claims);
    if (!tokenCodec.revokeOnce(claims)) {
      log.debug("refresh(): token jti={} was already exchanged", claims.tokenId());
      throw new AuthenticationException(ErrorCode.TOKEN_INVALID, "Invalid token");
    }
    return startSession(account);
  }

  // ── Logout ───────────────────────────────────────────────────────────────

  /**
   * Revokes the token. Best effort: null, blank, malformed, expired or already revoked tokens
   * are ignored.
   *
   * @param token the token to revoke
   */
  public void logout(final String token) {
    log.debug("logout()");
    TokenValidation validation = tokenCodec.validate(token);
    if (validation instanceof TokenValidation.Valid valid) {
      tokenCodec.revoke(valid.verifiedClaims());
      log.info("Logged out token jti={}", valid.verifiedClaims().tokenId());
    } else if (validation instanceof TokenValidation.Invalid invalid) {
      log.debug("logout(): nothing to revoke ({})", invalid.kind());
    }
  }

  // ── Profile ──────────────────────────────────────────────────────────────

  /**
   * Returns the profile of the token's account.
   *
   * @param token the bearer token
   * @return the profile
   * @throws AuthenticationException if the token or the account is not acceptable
   */
  public UserProfile currentProfile(final String token) {
    log.debug("currentProfile()");
    return toProfile(requireActiveAccount(requireValid(token)));
  }

  /**
   * Replaces the password of the token's account and revokes every token issued before the
   * change, including the one presented.
   *
   * @param token the bearer token
   * @param req   the current and new passwords
   * @throws AuthenticationException if the token or the account is not acceptable
   * @throws ValidationException     if a field is blank, the new password fails the policy or the
   *                                 current password is wrong
   */
  public void changePassword(final String token, final ChangePasswordRequest req) {
    log.debug("changePassword()");
    VerifiedClaims claims = requireValid(token);
    Account account = requireActiveAccount(claims);
    if (req == null || isBlank(req.currentPassword())) {
      throw new ValidationException("Current password is required");
    }
    if (isBlank(req.newPassword())) {
      throw new ValidationException("New password is required");
    }
    requireComplexPassword(req.newPassword());
    if (!passwordHasher.verify(req.currentPassword(), account.passwordHash())) {
      throw new ValidationException("Current password is incorrect");
    }
    userDirectory.update(account.withPasswordHash(passwordHasher.hash(req.newPassword())));
    tokenCodec.revokeAllIssuedBefore(account.id(), now());
    log.info("Changed password for account id={}", account.id());
  }

  // ── Helpers ──────────────────────────────────────────────────────────────

  /**
   * Projects an account onto its public profile.
   *
   * @param account the account
   * @return the profile, without credential material
   */
  public static UserProfile toProfile(final Account account) {
    return new UserProfile(
        account.id(),
        account.username(),
        account.email(),
        account.firstName(),
        account.lastName(),
        account.fullName(),
        account.active(),
        account.lastLoginAt(),
        account.createdAt());
  }

  private LoginResponse startSession(Account account) {
    Account updated = userDirectory.update(account.withLastLoginAt(now()));
    IssuedToken issued = tokenCodec.issue(new IdentityClaims(
        updated.id(),
        updated.username(),
        updated.email(),
        updated.firstName(),
        updated.lastName(),
        updated.fullName()));
    return new LoginResponse(issued.token(), toProfile(updated), issued.expiresAt());
  }

  private VerifiedClaims requireValid(String token) {
    TokenValidation validation = tokenCodec.validate(token);
    if (validation instanceof TokenValidation.Invalid invalid) {
      if (invalid.kind() == TokenErrorKind.EXPIRED) {
        throw new AuthenticationException(ErrorCode.TOKEN_EXPIRED, "Token has expired");
      }
      throw new AuthenticationException(ErrorCode.TOKEN_INVALID, "Invalid token");
    }
    return ((TokenValidation.Valid) validation).verifiedClaims();
  }

  private Account requireActiveAccount(VerifiedClaims claims) {
    Account account = userDirectory.findById(claims.subject())
        .orElseThrow(() -> new AuthenticationException(ErrorCode.ACCOUNT_NOT_FOUND,
            "Account not found"));
    if (!account.active()) {
      throw new AuthenticationException(ErrorCode.ACCOUNT_INACTIVE, "Account is inactive");
    }
    return account;
  }

  private static void requireComplexPassword(String password) {
    if (password.length() < MIN_PASSWORD_LENGTH
        || !UPPER.matcher(password).find()
        || !LOWER.matcher(password).find()
        || !DIGIT.matcher(password).find()
        || !SPECIAL.matcher(password).find()) {
      throw new ValidationException("Password does not meet security requirements");
    }
  }

  private Instant now() {
    return clock.instant().truncatedTo(ChronoUnit.MILLIS);
  }

  private static boolean isBlank(String s) {
    return s == null || s.isBlank();
  }
}
