package com.codeheadsystems.tollgate.dropwizard.health;

import com.codahale.metrics.health.HealthCheck;
import com.codeheadsystems.tollgate.server.token.IdentityClaims;
import com.codeheadsystems.tollgate.server.token.IssuedToken;
import com.codeheadsystems.tollgate.server.token.TokenCodec;
import com.codeheadsystems.tollgate.server.token.TokenValidation;
import java.time.Duration;

/**
 * Health check that issues a short-lived probe token and validates it.
 */
public class TokenCodecHealthCheck extends HealthCheck {

  private static final IdentityClaims PROBE =
      new IdentityClaims("health-probe", "health-probe", "", "", "", "");

  private final TokenCodec tokenCodec;

  public TokenCodecHealthCheck(TokenCodec tokenCodec) {
    this.tokenCodec = tokenCodec;
  }

  @Override
  protected Result check() {
    IssuedToken probe = tokenCodec.issue(PROBE, Duration.ofMinutes(1));
    TokenValidation validation = tokenCodec.validate(probe.token());
    if (validation instanceof TokenValidation.Invalid invalid) {
      return Result.unhealthy("Probe token rejected: %s", invalid.kind());
    }
    return Result.healthy("issuer=%s", tokenCodec.issuer());
  }
}
