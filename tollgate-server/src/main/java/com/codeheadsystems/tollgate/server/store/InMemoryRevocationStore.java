package com.codeheadsystems.tollgate.server.store;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Non-persistent in-memory {@link RevocationStore} backed by {@link ConcurrentHashMap}s.
 * <p>
 * Token entries are evicted lazily on {@link #isRevoked} and by a background sweeper once the
 * token they describe has expired. All entries are lost on restart, which un-revokes every
 * logged-out token that has not expired yet. Suitable for development and single-node
 * deployments only.
 */
public class InMemoryRevocationStore implements RevocationStore {

  private static final Logger log = LoggerFactory.getLogger(InMemoryRevocationStore.class);

  /**
   * Default interval between sweeps of expired entries.
   */
  public static final Duration DEFAULT_SWEEP_INTERVAL = Duration.ofSeconds(60);

  private final ConcurrentHashMap<String, Instant> revokedTokens = new ConcurrentHashMap<>();
  private final ConcurrentHashMap<String, Instant> subjectFences = new ConcurrentHashMap<>();
  private final Clock clock;

  private final ScheduledExecutorService sweeper =
      Executors.newSingleThreadScheduledExecutor(r -> {
        Thread t = new Thread(r, "revocation-sweeper");
        t.setDaemon(true);
        return t;
      });

  /**
   * Creates a store on the system clock sweeping every {@link #DEFAULT_SWEEP_INTERVAL}.
   */
  public InMemoryRevocationStore() {
    this(Clock.systemUTC(), DEFAULT_SWEEP_INTERVAL);
  }

  /**
   * Creates a store.
   *
   * @param clock         time source deciding when entries have expired
   * @param sweepInterval interval between background sweeps
   */
  public InMemoryRevocationStore(final Clock clock, final Duration sweepInterval) {
    this.clock = clock;
    long millis = sweepInterval.toMillis();
    sweeper.scheduleAtFixedRate(this::sweep, millis, millis, TimeUnit.MILLISECONDS);
  }

  /**
   * Stops the background sweeper.
   * <p>
   * In Dropwizard the bundle registers this as part of a {@code Managed} component.
   * In Spring Boot, declare the bean with {@code @Bean(destroyMethod = "shutdown")}.
   */
  public void shutdown() {
    sweeper.shutdown();
  }

  @Override
  public void revoke(final String tokenId, final Instant expiresAt) {
    revokedTokens.put(tokenId, expiresAt);
    log.debug("Revoked token jti={}", tokenId);
  }

  @Override
  public boolean revokeIfAbsent(final String tokenId, final Instant expiresAt) {
    boolean added = revokedTokens.putIfAbsent(tokenId, expiresAt) == null;
    log.debug("revokeIfAbsent(jti={}) added={}", tokenId, added);
    return added;
  }

  @Override
  public boolean isRevoked(final String tokenId) {
    Instant expiresAt = revokedTokens.get(tokenId);
    if (expiresAt == null) {
      return false;
    }
    if (!clock.instant().isBefore(expiresAt)) {
      revokedTokens.remove(tokenId, expiresAt);
    }
    // An expired token stays rejected by the expiry check itself.
    return true;
  }

  @Override
  public void revokeAllIssuedBefore(final String subject, final Instant cutoff) {
    subjectFences.merge(subject, cutoff, (a, b) -> a.isAfter(b) ? a : b);
    log.debug("Revoked tokens issued before {} for subject={}", cutoff, subject);
  }

  @Override
  public boolean isRevokedBefore(final String subject, final Instant issuedAt) {
    Instant fence = subjectFences.get(subject);
    return fence != null && issuedAt.isBefore(fence);
  }

  /**
   * Number of individually revoked tokens currently held.
   *
   * @return the entry count
   */
  public int size() {
    return revokedTokens.size();
  }

  void sweep() {
    Instant now = clock.instant();
    int before = revokedTokens.size();
    revokedTokens.values().removeIf(expiresAt -> !now.isBefore(expiresAt));
    int removed = before - revokedTokens.size();
    if (removed > 0) {
      log.debug("Swept {} expired revocation entries", removed);
    }
  }
}
