package com.codeheadsystems.tollgate.server.token;

import com.auth0.jwt.JWT;
import com.auth0.jwt.algorithms.Algorithm;
import com.auth0.jwt.exceptions.JWTDecodeException;
import com.auth0.jwt.exceptions.JWTVerificationException;
import com.auth0.jwt.interfaces.DecodedJWT;
import com.codeheadsystems.tollgate.server.store.RevocationStore;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.Date;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Issues and validates HMAC-SHA256 signed JWT identity tokens.
 * <p>
 * Every token carries a random {@code jti}, so two tokens issued for the same identity within
 * the same second still differ. Validation checks, in order: encoding, algorithm and signature,
 * issuer, expiry (no leeway), and finally the {@link RevocationStore}. The signature is checked
 * before expiry, so a tampered token is reported as {@link TokenErrorKind#BAD_SIGNATURE} even
 * when it has also expired.
 */
public class TokenCodec {

  /**
   * Minimum HMAC secret length. Shorter secrets are refused at construction.
   */
  public static final int MIN_SECRET_BYTES = 32;

  /**
   * Token lifetime used when none is configured.
   */
  public static final Duration DEFAULT_TTL = Duration.ofHours(24);

  static final String CLAIM_USERNAME = "username";
  static final String CLAIM_EMAIL = "email";
  static final String CLAIM_GIVEN_NAME = "given_name";
  static final String CLAIM_FAMILY_NAME = "family_name";
  static final String CLAIM_NAME = "name";
  // iat is carried in whole seconds; revocation fences need the exact issuance instant.
  static final String CLAIM_ISSUED_AT_MS = "iat_ms";

  private static final Logger log = LoggerFactory.getLogger(TokenCodec.class);

  private final Algorithm algorithm;
  private final String issuer;
  private final Duration defaultTtl;
  private final RevocationStore revocationStore;
  private final Clock clock;

  /**
   * Creates a new TokenCodec.
   *
   * @param secret          HMAC-SHA256 signing secret, at least {@value #MIN_SECRET_BYTES} bytes
   * @param issuer          JWT issuer claim, required on validation
   * @param defaultTtl      lifetime of tokens issued without an explicit ttl
   * @param revocationStore the revocation list consulted on every validation
   * @param clock           time source for issuance and expiry checks
   * @throws IllegalStateException if the secret is missing or too short
   */
  public TokenCodec(final byte[] secret,
                    final String issuer,
                    final Duration defaultTtl,
                    final RevocationStore revocationStore,
                    final Clock clock) {
    if (secret == null || secret.length < MIN_SECRET_BYTES) {
      throw new IllegalStateException(
          "Token signing secret must be at least " + MIN_SECRET_BYTES + " bytes");
    }
    if (issuer == null || issuer.isBlank()) {
      throw new IllegalStateException("Token issuer must be configured");
    }
    requirePositive(defaultTtl);
    this.algorithm = Algorithm.HMAC256(secret);
    this.issuer = issuer;
    this.defaultTtl = defaultTtl;
    this.revocationStore = revocationStore;
    this.clock = clock;
  }

  // ── Issuance ──────────────────────────────────────────────────────────────

  /**
   * Issues a token with the default lifetime.
   *
   * @param identity the identity snapshot to embed
   * @return the signed token
   */
  public IssuedToken issue(final IdentityClaims identity) {
    return issue(identity, defaultTtl);
  }

  /**
   * Issues a token.
   *
   * @param identity the identity snapshot to embed
   * @param ttl      lifetime, must be positive
   * @return the signed token
   */
  public IssuedToken issue(final IdentityClaims identity, final Duration ttl) {
    requirePositive(ttl);
    String jti = UUID.randomUUID().toString();
    Instant now = clock.instant().truncatedTo(ChronoUnit.MILLIS);
    Instant expiresAt = now.plus(ttl).truncatedTo(ChronoUnit.SECONDS);

    String token = JWT.create()
        .withIssuer(issuer)
        .withJWTId(jti)
        .withSubject(identity.subject())
        .withClaim(CLAIM_USERNAME, identity.username())
        .withClaim(CLAIM_EMAIL, identity.email())
        .withClaim(CLAIM_GIVEN_NAME, identity.givenName())
        .withClaim(CLAIM_FAMILY_NAME, identity.familyName())
        .withClaim(CLAIM_NAME, identity.displayName())
        .withClaim(CLAIM_ISSUED_AT_MS, now.toEpochMilli())
        .withIssuedAt(now)
        .withExpiresAt(expiresAt)
        .sign(algorithm);

    log.debug("Issued token jti={} for subject={}", jti, identity.subject());
    return new IssuedToken(token, jti, now, expiresAt);
  }

  // ── Validation ────────────────────────────────────────────────────────────

  /**
   * Validates a token. Never throws for untrusted input.
   *
   * @param token the compact JWT, may be null
   * @return the typed outcome
   */
  public TokenValidation validate(final String token) {
    if (token == null || token.isBlank()) {
      return invalid(TokenErrorKind.MALFORMED_ENCODING, "token is empty");
    }
    DecodedJWT decoded;
    try {
      decoded = JWT.decode(token);
    } catch (JWTDecodeException e) {
      return invalid(TokenErrorKind.MALFORMED_ENCODING, e.getMessage());
    }
    if (!algorithm.getName().equals(decoded.getAlgorithm())) {
      return invalid(TokenErrorKind.BAD_SIGNATURE, "unexpected algorithm " + decoded.getAlgorithm());
    }
    try {
      algorithm.verify(decoded);
    } catch (JWTVerificationException e) {
      return invalid(TokenErrorKind.BAD_SIGNATURE, e.getMessage());
    }
    if (!issuer.equals(decoded.getIssuer())) {
      return invalid(TokenErrorKind.BAD_SIGNATURE, "unexpected issuer " + decoded.getIssuer());
    }

    String jti = decoded.getId();
    String subject = decoded.getSubject();
    Date exp = decoded.getExpiresAt();
    Long issuedAtMs = decoded.getClaim(CLAIM_ISSUED_AT_MS).asLong();
    if (jti == null || subject == null || exp == null || issuedAtMs == null) {
      return invalid(TokenErrorKind.MALFORMED_ENCODING, "required claim missing");
    }
    Instant expiresAt = exp.toInstant();
    if (!clock.instant().isBefore(expiresAt)) {
      return invalid(TokenErrorKind.EXPIRED, "expired at " + expiresAt);
    }
    Instant issuedAt = Instant.ofEpochMilli(issuedAtMs);
    if (revocationStore.isRevoked(jti) || revocationStore.isRevokedBefore(subject, issuedAt)) {
      return invalid(TokenErrorKind.REVOKED, "jti " + jti + " revoked");
    }

    IdentityClaims identity = new IdentityClaims(
        subject,
        decoded.getClaim(CLAIM_USERNAME).asString(),
        decoded.getClaim(CLAIM_EMAIL).asString(),
        decoded.getClaim(CLAIM_GIVEN_NAME).asString(),
        decoded.getClaim(CLAIM_FAMILY_NAME).asString(),
        decoded.getClaim(CLAIM_NAME).asString());
    return new TokenValidation.Valid(new VerifiedClaims(identity, jti, issuedAt, expiresAt));
  }

  // ── Revocation ────────────────────────────────────────────────────────────

  /**
   * Revokes a single validated token until its natural expiry. Idempotent.
   *
   * @param claims the claims of the token to revoke
   */
  public void revoke(final VerifiedClaims claims) {
    revocationStore.revoke(claims.tokenId(), claims.expiresAt());
  }

  /**
   * Revokes a token only if nobody revoked it before.
   *
   * @param claims the claims of the token to revoke
   * @return true if this call performed the revocation
   */
  public boolean revokeOnce(final VerifiedClaims claims) {
    return revocationStore.revokeIfAbsent(claims.tokenId(), claims.expiresAt());
  }

  /**
   * Revokes every token for the subject issued before the given instant.
   *
   * @param subject the account id
   * @param cutoff  tokens issued strictly before this instant are revoked
   */
  public void revokeAllIssuedBefore(final String subject, final Instant cutoff) {
    revocationStore.revokeAllIssuedBefore(subject, cutoff);
  }

  public String issuer() {
    return issuer;
  }

  public Duration defaultTtl() {
    return defaultTtl;
  }

  private static TokenValidation invalid(TokenErrorKind kind, String detail) {
    log.debug("Token rejected: {} ({})", kind, detail);
    return new TokenValidation.Invalid(kind, detail);
  }

  private static void requirePositive(Duration ttl) {
    if (ttl == null || ttl.isZero() || ttl.isNegative()) {
      throw new IllegalArgumentException("ttl must be positive: " + ttl);
    }
  }
}
