package com.codeheadsystems.tollgate.springboot.config;

import com.codeheadsystems.tollgate.server.directory.InMemoryUserDirectory;
import com.codeheadsystems.tollgate.server.directory.UserDirectory;
import com.codeheadsystems.tollgate.server.hash.Argon2idPasswordHasher;
import com.codeheadsystems.tollgate.server.hash.PasswordHasher;
import com.codeheadsystems.tollgate.server.manager.AuthManager;
import com.codeheadsystems.tollgate.server.store.InMemoryRevocationStore;
import com.codeheadsystems.tollgate.server.store.RevocationStore;
import com.codeheadsystems.tollgate.server.token.TokenCodec;
import com.codeheadsystems.tollgate.springboot.controller.AuthController;
import com.codeheadsystems.tollgate.springboot.health.TokenCodecHealthIndicator;
import com.codeheadsystems.tollgate.springboot.security.TollgateSecurityConfig;
import java.security.SecureRandom;
import java.time.Clock;
import java.time.Duration;
import java.util.HexFormat;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Import;

/**
 * Wires the tollgate authentication endpoints, bearer-token security and health indicator.
 * Every bean backs off when the application defines its own, so persistent stores replace the
 * in-memory ones by simply declaring a {@link UserDirectory} or {@link RevocationStore} bean.
 */
@AutoConfiguration
@EnableConfigurationProperties(TollgateProperties.class)
@Import({AuthController.class, TollgateSecurityConfig.class})
public class TollgateAutoConfiguration {

  private static final Logger log = LoggerFactory.getLogger(TollgateAutoConfiguration.class);

  @Bean
  @ConditionalOnMissingBean
  public Clock clock() {
    return Clock.systemUTC();
  }

  @Bean
  @ConditionalOnMissingBean
  public UserDirectory userDirectory() {
    log.warn("Using in-memory user directory. All accounts will be lost on restart. Do not use in production.");
    return new InMemoryUserDirectory();
  }

  @Bean(destroyMethod = "shutdown")
  @ConditionalOnMissingBean(RevocationStore.class)
  public InMemoryRevocationStore revocationStore(TollgateProperties props, Clock clock) {
    return new InMemoryRevocationStore(clock, Duration.ofSeconds(props.getRevocationSweepSeconds()));
  }

  @Bean
  @ConditionalOnMissingBean
  public PasswordHasher passwordHasher(TollgateProperties props) {
    return new Argon2idPasswordHasher(
        props.getArgon2MemoryKib(),
        props.getArgon2Iterations(),
        props.getArgon2Parallelism());
  }

  @Bean
  @ConditionalOnMissingBean
  public TokenCodec tokenCodec(TollgateProperties props, RevocationStore revocationStore,
                               Clock clock) {
    String secretHex = props.getJwtSecretHex();
    byte[] secret;
    if (secretHex == null || secretHex.isEmpty()) {
      log.warn("No JWT secret configured, generating randomly. "
          + "Tokens will be invalidated on restart. Do not use in production.");
      secret = new byte[TokenCodec.MIN_SECRET_BYTES];
      new SecureRandom().nextBytes(secret);
    } else {
      secret = HexFormat.of().parseHex(secretHex);
    }
    return new TokenCodec(secret, props.getJwtIssuer(),
        Duration.ofSeconds(props.getTokenTtlSeconds()), revocationStore, clock);
  }

  @Bean
  @ConditionalOnMissingBean
  public AuthManager authManager(UserDirectory userDirectory, PasswordHasher passwordHasher,
                                 TokenCodec tokenCodec, Clock clock) {
    return new AuthManager(userDirectory, passwordHasher, tokenCodec, clock);
  }

  @Bean
  @ConditionalOnMissingBean
  public TokenCodecHealthIndicator tokenCodecHealthIndicator(TokenCodec tokenCodec) {
    return new TokenCodecHealthIndicator(tokenCodec);
  }
}
