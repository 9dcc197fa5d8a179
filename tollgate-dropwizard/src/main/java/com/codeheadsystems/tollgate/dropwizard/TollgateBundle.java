package com.codeheadsystems.tollgate.dropwizard;

import com.codeheadsystems.tollgate.dropwizard.auth.TollgateAuthenticator;
import com.codeheadsystems.tollgate.dropwizard.auth.TollgatePrincipal;
import com.codeheadsystems.tollgate.dropwizard.health.TokenCodecHealthCheck;
import com.codeheadsystems.tollgate.server.directory.InMemoryUserDirectory;
import com.codeheadsystems.tollgate.server.directory.UserDirectory;
import com.codeheadsystems.tollgate.server.hash.Argon2idPasswordHasher;
import com.codeheadsystems.tollgate.server.manager.AuthManager;
import com.codeheadsystems.tollgate.server.resource.AuthResource;
import com.codeheadsystems.tollgate.server.store.InMemoryRevocationStore;
import com.codeheadsystems.tollgate.server.store.RevocationStore;
import com.codeheadsystems.tollgate.server.token.TokenCodec;
import io.dropwizard.auth.AuthDynamicFeature;
import io.dropwizard.auth.AuthValueFactoryProvider;
import io.dropwizard.auth.oauth.OAuthCredentialAuthFilter;
import io.dropwizard.core.ConfiguredBundle;
import io.dropwizard.core.setup.Bootstrap;
import io.dropwizard.core.setup.Environment;
import io.dropwizard.lifecycle.Managed;
import jakarta.inject.Inject;
import jakarta.inject.Singleton;
import java.security.SecureRandom;
import java.time.Clock;
import java.time.Duration;
import java.util.HexFormat;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Dropwizard bundle that wires the tollgate authentication endpoints into an existing
 * Dropwizard application.
 * <p>
 * Registers {@link AuthResource}, a token health check and a bearer-token authentication
 * filter, so application resources can take an {@code @Auth TollgatePrincipal} parameter.
 * Requires a {@link TollgateConfiguration} block in the application's YAML config.
 * <p>
 * Embed in your application with in-memory stores (dev/test only):
 * <pre>{@code
 *   bootstrap.addBundle(new TollgateBundle<>());
 * }</pre>
 * <p>
 * Or supply persistent stores:
 * <pre>{@code
 *   bootstrap.addBundle(new TollgateBundle<>(myUserDirectory, myRevocationStore));
 * }</pre>
 */
@Singleton
public class TollgateBundle<C extends TollgateConfiguration> implements ConfiguredBundle<C> {

  private static final Logger log = LoggerFactory.getLogger(TollgateBundle.class);

  private final UserDirectory userDirectory;
  private final RevocationStore revocationStore;
  private AuthManager authManager;
  private TokenCodec tokenCodec;

  /**
   * Creates a bundle backed by in-memory stores. Accounts and revocations are lost on restart.
   */
  public TollgateBundle() {
    this.userDirectory = new InMemoryUserDirectory();
    this.revocationStore = null;
    log.warn("""
        #################################################################
        # WARNING: Using in-memory account and revocation stores.       #
        # All accounts will be lost on restart.                         #
        # Do not use in production.                                     #
        #################################################################
        """);
  }

  /**
   * Creates a bundle backed by the supplied stores.
   *
   * @param userDirectory   the account store
   * @param revocationStore the revocation list
   */
  @Inject
  public TollgateBundle(UserDirectory userDirectory, RevocationStore revocationStore) {
    this.userDirectory = userDirectory;
    this.revocationStore = revocationStore;
  }

  @Override
  public void initialize(Bootstrap<?> bootstrap) {
    // No additional bootstrapping needed
  }

  @Override
  public void run(C configuration, Environment environment) {
    RevocationStore store = revocationStore != null
        ? revocationStore
        : managedRevocationStore(configuration, environment);
    tokenCodec = buildTokenCodec(configuration, store);
    Argon2idPasswordHasher hasher = new Argon2idPasswordHasher(
        configuration.getArgon2MemoryKib(),
        configuration.getArgon2Iterations(),
        configuration.getArgon2Parallelism());
    authManager = new AuthManager(userDirectory, hasher, tokenCodec, Clock.systemUTC());

    environment.jersey().register(new AuthResource(authManager));
    environment.healthChecks().register("token-codec", new TokenCodecHealthCheck(tokenCodec));

    environment.jersey().register(new AuthDynamicFeature(
        new OAuthCredentialAuthFilter.Builder<TollgatePrincipal>()
            .setAuthenticator(new TollgateAuthenticator(tokenCodec))
            .setPrefix("Bearer")
            .buildAuthFilter()));
    environment.jersey().register(new AuthValueFactoryProvider.Binder<>(TollgatePrincipal.class));
  }

  /**
   * The manager built by {@link #run}, for applications that call it directly.
   *
   * @return the manager, null before the bundle has run
   */
  public AuthManager authManager() {
    return authManager;
  }

  public TokenCodec tokenCodec() {
    return tokenCodec;
  }

  private RevocationStore managedRevocationStore(C configuration, Environment environment) {
    InMemoryRevocationStore store = new InMemoryRevocationStore(Clock.systemUTC(),
        Duration.ofSeconds(configuration.getRevocationSweepSeconds()));
    environment.lifecycle().manage(new Managed() {
      @Override
      public void start() {
        // Sweeper starts with the store
      }

      @Override
      public void stop() {
        store.shutdown();
      }
    });
    return store;
  }

  private TokenCodec buildTokenCodec(C configuration, RevocationStore store) {
    String secretHex = configuration.getJwtSecretHex();
    byte[] secret;
    if (secretHex == null || secretHex.isEmpty()) {
      log.warn("No JWT secret configured, generating randomly. "
          + "Tokens will be invalidated on restart. Do not use in production.");
      secret = new byte[TokenCodec.MIN_SECRET_BYTES];
      new SecureRandom().nextBytes(secret);
    } else {
      secret = HexFormat.of().parseHex(secretHex);
    }
    return new TokenCodec(secret, configuration.getJwtIssuer(),
        Duration.ofSeconds(configuration.getTokenTtlSeconds()), store, Clock.systemUTC());
  }
}
