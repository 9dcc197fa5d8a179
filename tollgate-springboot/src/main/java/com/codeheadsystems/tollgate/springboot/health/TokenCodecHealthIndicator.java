package com.codeheadsystems.tollgate.springboot.health;

import com.codeheadsystems.tollgate.server.token.IdentityClaims;
import com.codeheadsystems.tollgate.server.token.TokenCodec;
import com.codeheadsystems.tollgate.server.token.TokenValidation;
import java.time.Duration;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;

/**
 * Issues a short-lived probe token and validates it.
 */
public class TokenCodecHealthIndicator implements HealthIndicator {

  private static final IdentityClaims PROBE =
      new IdentityClaims("health-probe", "health-probe", "", "", "", "");

  private final TokenCodec tokenCodec;

  public TokenCodecHealthIndicator(TokenCodec tokenCodec) {
    this.tokenCodec = tokenCodec;
  }

  @Override
  public Health health() {
    TokenValidation validation =
        tokenCodec.validate(tokenCodec.issue(PROBE, Duration.ofMinutes(1)).token());
    if (validation instanceof TokenValidation.Invalid invalid) {
      return Health.down().withDetail("reason", invalid.kind().name()).build();
    }
    return Health.up().withDetail("issuer", tokenCodec.issuer()).build();
  }
}
