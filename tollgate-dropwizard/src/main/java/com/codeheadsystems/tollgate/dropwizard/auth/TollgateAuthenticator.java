package com.codeheadsystems.tollgate.dropwizard.auth;

import com.codeheadsystems.tollgate.server.token.TokenCodec;
import io.dropwizard.auth.Authenticator;
import java.util.Optional;

/**
 * Dropwizard {@link Authenticator} that validates bearer tokens using {@link TokenCodec}.
 * Expired, tampered and revoked tokens all yield an empty result.
 */
public class TollgateAuthenticator implements Authenticator<String, TollgatePrincipal> {

  private final TokenCodec tokenCodec;

  public TollgateAuthenticator(TokenCodec tokenCodec) {
    this.tokenCodec = tokenCodec;
  }

  @Override
  public Optional<TollgatePrincipal> authenticate(String token) {
    return tokenCodec.validate(token).claims()
        .map(claims -> new TollgatePrincipal(claims.subject(), claims.identity().username(),
            claims.identity().email(), claims.tokenId()));
  }
}
