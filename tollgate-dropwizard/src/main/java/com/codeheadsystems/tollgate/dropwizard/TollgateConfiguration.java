package com.codeheadsystems.tollgate.dropwizard;

import com.fasterxml.jackson.annotation.JsonProperty;
import io.dropwizard.core.Configuration;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotEmpty;

/**
 * Dropwizard configuration for the tollgate authentication endpoints.
 * <p>
 * For production, supply {@code jwtSecretHex} (a hex-encoded random value of at least 32 bytes)
 * so issued tokens survive restarts. Omitting it causes a random secret to be generated on each
 * startup (dev/test only, every outstanding token becomes invalid after a restart).
 * <p>
 * Generate a secret with: {@code openssl rand -hex 32}
 */
public class TollgateConfiguration extends Configuration {

  /**
   * Hex-encoded HMAC-SHA256 signing secret for tokens.
   * Leave empty for random generation (dev only).
   */
  private String jwtSecretHex = "";

  /**
   * Token issuer claim. Tokens from other issuers are rejected.
   */
  @NotEmpty
  private String jwtIssuer = "tollgate";

  /**
   * Token time-to-live in seconds.
   */
  @Min(1)
  private long tokenTtlSeconds = 86400;

  /**
   * Argon2id memory cost in kibibytes.
   */
  @Min(8)
  private int argon2MemoryKib = 65536;

  /**
   * Argon2id iteration count.
   */
  @Min(1)
  private int argon2Iterations = 3;

  /**
   * Argon2id parallelism.
   */
  @Min(1)
  private int argon2Parallelism = 1;

  /**
   * How often expired revocation entries are purged, in seconds.
   */
  @Min(1)
  private long revocationSweepSeconds = 60;

  @JsonProperty
  public String getJwtSecretHex() {
    return jwtSecretHex;
  }

  @JsonProperty
  public void setJwtSecretHex(String jwtSecretHex) {
    this.jwtSecretHex = jwtSecretHex;
  }

  @JsonProperty
  public String getJwtIssuer() {
    return jwtIssuer;
  }

  @JsonProperty
  public void setJwtIssuer(String jwtIssuer) {
    this.jwtIssuer = jwtIssuer;
  }

  @JsonProperty
  public long getTokenTtlSeconds() {
    return tokenTtlSeconds;
  }

  @JsonProperty
  public void setTokenTtlSeconds(long tokenTtlSeconds) {
    this.tokenTtlSeconds = tokenTtlSeconds;
  }

  @JsonProperty
  public int getArgon2MemoryKib() {
    return argon2MemoryKib;
  }

  @JsonProperty
  public void setArgon2MemoryKib(int argon2MemoryKib) {
    this.argon2MemoryKib = argon2MemoryKib;
  }

  @JsonProperty
  public int getArgon2Iterations() {
    return argon2Iterations;
  }

  @JsonProperty
  public void setArgon2Iterations(int argon2Iterations) {
    this.argon2Iterations = argon2Iterations;
  }

  @JsonProperty
  public int getArgon2Parallelism() {
    return argon2Parallelism;
  }

  @JsonProperty
  public void setArgon2Parallelism(int argon2Parallelism) {
    this.argon2Parallelism = argon2Parallelism;
  }

  @JsonProperty
  public long getRevocationSweepSeconds() {
    return revocationSweepSeconds;
  }

  @JsonProperty
  public void setRevocationSweepSeconds(long revocationSweepSeconds) {
    this.revocationSweepSeconds = revocationSweepSeconds;
  }
}
