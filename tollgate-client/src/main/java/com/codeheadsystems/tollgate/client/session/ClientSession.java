package com.codeheadsystems.tollgate.client.session;

import com.codeheadsystems.tollgate.client.accessor.AuthAccessor;
import com.codeheadsystems.tollgate.client.exceptions.AuthRejectedException;
import com.codeheadsystems.tollgate.client.exceptions.SessionStorageException;
import com.codeheadsystems.tollgate.model.auth.LoginRequest;
import com.codeheadsystems.tollgate.model.auth.LoginResponse;
import com.codeheadsystems.tollgate.model.auth.RegisterRequest;
import com.codeheadsystems.tollgate.model.auth.UserProfile;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executor;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import javax.inject.Inject;
import javax.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * The single source of truth for client-side authentication state.
 * <p>
 * The token, the account snapshot and the expiry are kept in a {@link SessionStorage} under
 * {@link #TOKEN_KEY}, {@link #USER_KEY} and {@link #EXPIRES_AT_KEY}, always written and cleared
 * together. "Authenticated" is computed on every read: a session exists and its expiry is in
 * the future. An expired or corrupted session found on read is cleared and an unauthenticated
 * state is published; when a scheduler is supplied the same check also runs at the expiry instant.
 * <p>
 * Remote calls run on the supplied executor and are exposed as {@link CompletableFuture}s.
 * Refreshes are single-flight. Every local state change bumps a generation counter; a login or
 * refresh response that arrives after the generation moved on (logout, a newer login, expiry)
 * is dropped and its future fails with {@link CancellationException}.
 * <p>
 * Clearing never fails. When the storage cannot be rewritten the session is still treated as
 * gone until the next sign-in, and removal is retried on later reads.
 * <p>
 * Listeners are called outside every lock, one at a time and in publication order.
 */
@Singleton
public class ClientSession {

  public static final String TOKEN_KEY = "auth_token";
  public static final String USER_KEY = "auth_user";
  public static final String EXPIRES_AT_KEY = "auth_expires_at";

  /**
   * Default window before expiry in which {@link #shouldRefresh()} turns true.
   */
  public static final Duration DEFAULT_REFRESH_THRESHOLD = Duration.ofMinutes(15);

  private static final Logger log = LoggerFactory.getLogger(ClientSession.class);
  private static final List<String> KEYS = List.of(TOKEN_KEY, USER_KEY, EXPIRES_AT_KEY);

  private final AuthAccessor accessor;
  private final SessionStorage storage;
  private final ObjectMapper objectMapper;
  private final Executor executor;
  private final ScheduledExecutorService scheduler;
  private final Clock clock;
  private final Duration refreshThreshold;

  private final Object lock = new Object();
  private final Object publishLock = new Object();
  private final CopyOnWriteArrayList<AuthStateListener> listeners = new CopyOnWriteArrayList<>();
  private final ConcurrentLinkedQueue<Runnable> deliveries = new ConcurrentLinkedQueue<>();
  private final AtomicBoolean delivering = new AtomicBoolean();

  // Guarded by lock.
  private long generation;
  private CompletableFuture<LoginResponse> refreshInFlight;
  private ScheduledFuture<?> expiryTimer;
  // The storage still holds keys of a session that was cleared.
  private boolean clearPending;

  // Guarded by publishLock.
  private AuthState lastPublished;

  /**
   * Instantiates a client session on the system clock with the default refresh threshold.
   *
   * @param accessor     the remote endpoints
   * @param storage      durable storage for the session keys
   * @param objectMapper serializes the stored profile
   * @param executor     runs remote calls
   * @param scheduler    fires the expiry check, may be null to rely on passive detection only
   */
  @Inject
  public ClientSession(final AuthAccessor accessor,
                       final SessionStorage storage,
                       final ObjectMapper objectMapper,
                       final Executor executor,
                       final ScheduledExecutorService scheduler) {
    this(accessor, storage, objectMapper, executor, scheduler, Clock.systemUTC(),
        DEFAULT_REFRESH_THRESHOLD);
  }

  /**
   * Instantiates a client session.
   *
   * @param accessor         the remote endpoints
   * @param storage          durable storage for the session keys
   * @param objectMapper     serializes the stored profile
   * @param executor         runs remote calls
   * @param scheduler        fires the expiry check, may be null
   * @param clock            time source for expiry decisions
   * @param refreshThreshold window before expiry in which a refresh is due
   */
  public ClientSession(final AuthAccessor accessor,
                       final SessionStorage storage,
                       final ObjectMapper objectMapper,
                       final Executor executor,
                       final ScheduledExecutorService scheduler,
                       final Clock clock,
                       final Duration refreshThreshold) {
    this.accessor = accessor;
    this.storage = storage;
    this.objectMapper = objectMapper;
    this.executor = executor;
    this.scheduler = scheduler;
    this.clock = clock;
    this.refreshThreshold = refreshThreshold;
    Optional<StoredSession> restored = currentSession();
    restored.ifPresent(s -> {
      synchronized (lock) {
        scheduleExpiryLocked(s.expiresAt());
      }
    });
    synchronized (publishLock) {
      lastPublished = stateOf(restored);
    }
    log.debug("ClientSession() restored={}", restored.isPresent());
  }

  // ── Queries ───────────────────────────────────────────────────────────────

  /**
   * True iff a session exists and has not expired.
   *
   * @return the computed authentication flag
   */
  public boolean isAuthenticated() {
    return currentSession().isPresent();
  }

  /**
   * True when the session expires within the refresh threshold but has not expired yet.
   *
   * @return whether a proactive refresh is due
   */
  public boolean shouldRefresh() {
    return currentSession()
        .map(s -> !clock.instant().isBefore(s.expiresAt().minus(refreshThreshold)))
        .orElse(false);
  }

  public Optional<String> token() {
    return currentSession().map(StoredSession::token);
  }

  public Optional<UserProfile> currentUser() {
    return currentSession().map(StoredSession::profile);
  }

  public Optional<Instant> expiresAt() {
    return currentSession().map(StoredSession::expiresAt);
  }

  /**
   * A consistent snapshot of the current state.
   *
   * @return the state
   */
  public AuthState state() {
    return stateOf(currentSession());
  }

  // ── Commands ──────────────────────────────────────────────────────────────

  /**
   * Registers an account. Does not sign in.
   *
   * @param request the registration data
   * @return the created profile
   */
  public CompletableFuture<UserProfile> register(final RegisterRequest request) {
    log.debug("register()");
    return CompletableFuture.supplyAsync(() -> accessor.register(request), executor);
  }

  /**
   * Signs in. On success the session is stored and an authenticated state is published. On
   * failure the server's error is propagated and the state is left unchanged.
   *
   * @param usernameOrEmail the username or email
   * @param password        the password
   * @return the login response
   */
  public CompletableFuture<LoginResponse> login(final String usernameOrEmail,
                                                final String password) {
    log.debug("login({})", usernameOrEmail);
    long gen;
    synchronized (lock) {
      gen = ++generation;
    }
    return CompletableFuture
        .supplyAsync(() -> accessor.login(new LoginRequest(usernameOrEmail, password)), executor)
        .thenApply(response -> {
          applyIfCurrent(gen, response);
          return response;
        });
  }

  /**
   * Signs out. Local state is cleared and published immediately; the server is told afterwards
   * and its outcome is only logged. The returned future never completes exceptionally.
   *
   * @return completes when the remote call finishes
   */
  public CompletableFuture<Void> logout() {
    log.debug("logout()");
    Optional<String> token;
    synchronized (lock) {
      token = clearPending ? Optional.empty() : storage.get(TOKEN_KEY);
      clearLocked();
    }
    publishState();
    if (token.isEmpty()) {
      return CompletableFuture.completedFuture(null);
    }
    String bearer = token.get();
    return CompletableFuture.runAsync(() -> accessor.logout(bearer), executor)
        .exceptionally(e -> {
          log.warn("Remote logout failed: {}", unwrap(e).getMessage());
          return null;
        });
  }

  /**
   * Exchanges the current token for a new one. Concurrent callers share one request and its
   * result. A 401 or 403 answer clears the session.
   *
   * @return the refresh response, failing with {@link IllegalStateException} when there is no
   *     session to refresh
   */
  public CompletableFuture<LoginResponse> refresh() {
    Optional<StoredSession> session = currentSession();
    CompletableFuture<LoginResponse> result;
    long gen;
    String token;
    synchronized (lock) {
      if (refreshInFlight != null) {
        log.debug("refresh(): joining in-flight refresh");
        return refreshInFlight;
      }
      if (session.isEmpty()) {
        return CompletableFuture.failedFuture(new IllegalStateException("Not authenticated"));
      }
      log.debug("refresh()");
      gen = generation;
      token = session.get().token();
      result = new CompletableFuture<>();
      refreshInFlight = result;
    }
    CompletableFuture
        .supplyAsync(() -> accessor.refresh(token), executor)
        .whenComplete((response, error) -> completeRefresh(result, gen, response, error));
    return result;
  }

  /**
   * Clears the session locally without contacting the server. Used when the server has already
   * rejected the token.
   */
  public void invalidate() {
    log.debug("invalidate()");
    synchronized (lock) {
      clearLocked();
    }
    publishState();
  }

  /**
   * Clears the session only if it still holds the given token. A rejection of a token from an
   * earlier session leaves the current one alone.
   *
   * @param token the token the server rejected
   * @return true if the session was cleared
   */
  public boolean invalidate(final String token) {
    boolean cleared = false;
    synchronized (lock) {
      Optional<StoredSession> current = readLocked();
      if (current.isPresent() && current.get().token().equals(token)) {
        clearLocked();
        cleared = true;
      }
    }
    log.debug("invalidate(token) cleared={}", cleared);
    if (cleared) {
      publishState();
    }
    return cleared;
  }

  /**
   * Registers a listener. It receives the current state immediately and then every transition.
   *
   * @param listener the listener
   * @return a handle that unsubscribes when closed
   */
  public Subscription subscribe(final AuthStateListener listener) {
    // Reading first publishes any pending expiry before the listener joins.
    state();
    synchronized (publishLock) {
      listeners.add(listener);
      AuthState initial = lastPublished;
      deliveries.add(() -> notifyListener(listener, initial));
    }
    deliver();
    return () -> listeners.remove(listener);
  }

  /**
   * Cancels the pending expiry check. The scheduler itself belongs to the caller.
   */
  public void shutdown() {
    synchronized (lock) {
      cancelExpiryLocked();
    }
  }

  // ── Internals ─────────────────────────────────────────────────────────────

  private void applyIfCurrent(long gen, LoginResponse response) {
    synchronized (lock) {
      if (generation != gen) {
        log.debug("Dropping stale session response (generation {} != {})", gen, generation);
        throw new CancellationException("Session changed while the request was in flight");
      }
      storeLocked(response);
    }
    publishState();
  }

  private void completeRefresh(CompletableFuture<LoginResponse> result, long gen,
                               LoginResponse response, Throwable error) {
    Throwable failure = null;
    boolean publish = false;
    synchronized (lock) {
      if (refreshInFlight == result) {
        refreshInFlight = null;
      }
      if (error != null) {
        failure = unwrap(error);
        if (failure instanceof AuthRejectedException && generation == gen) {
          log.info("Refresh rejected by server, clearing session");
          clearLocked();
          publish = true;
        }
      } else if (generation != gen) {
        log.debug("Dropping stale refresh response (generation {} != {})", gen, generation);
        failure = new CancellationException("Session changed while refreshing");
      } else {
        try {
          storeLocked(response);
          publish = true;
        } catch (RuntimeException e) {
          failure = e;
        }
      }
    }
    if (publish) {
      publishState();
    }
    if (failure != null) {
      result.completeExceptionally(failure);
    } else {
      result.complete(response);
    }
  }

  private Optional<StoredSession> currentSession() {
    boolean cleared = false;
    Optional<StoredSession> session;
    synchronized (lock) {
      session = readLocked();
      if (clearPending) {
        removeKeysLocked();
      } else if (session.isEmpty() && KEYS.stream().anyMatch(k -> storage.get(k).isPresent())) {
        clearLocked();
        cleared = true;
      }
    }
    if (cleared) {
      publishState();
    }
    return session;
  }

  /**
   * Reads and validates the stored session. Expired, partial or corrupted data reads as empty;
   * the caller clears it.
   */
  private Optional<StoredSession> readLocked() {
    if (clearPending) {
      return Optional.empty();
    }
    Optional<String> token = storage.get(TOKEN_KEY);
    Optional<String> user = storage.get(USER_KEY);
    Optional<String> expires = storage.get(EXPIRES_AT_KEY);
    if (token.isEmpty() || user.isEmpty() || expires.isEmpty() || token.get().isBlank()) {
      return Optional.empty();
    }
    Instant expiresAt;
    UserProfile profile;
    try {
      expiresAt = Instant.parse(expires.get());
      profile = objectMapper.readValue(user.get(), UserProfile.class);
    } catch (DateTimeParseException | JsonProcessingException e) {
      log.warn("Discarding corrupted stored session: {}", e.getMessage());
      return Optional.empty();
    }
    if (profile == null || !clock.instant().isBefore(expiresAt)) {
      return Optional.empty();
    }
    return Optional.of(new StoredSession(token.get(), profile, expiresAt));
  }

  private void storeLocked(LoginResponse response) {
    String userJson;
    try {
      userJson = objectMapper.writeValueAsString(response.user());
    } catch (JsonProcessingException e) {
      throw new SessionStorageException("Could not serialize profile", e);
    }
    storage.putAll(Map.of(
        TOKEN_KEY, response.token(),
        USER_KEY, userJson,
        EXPIRES_AT_KEY, response.expiresAt().toString()));
    clearPending = false;
    scheduleExpiryLocked(response.expiresAt());
  }

  private void clearLocked() {
    generation++;
    refreshInFlight = null;
    cancelExpiryLocked();
    clearPending = true;
    removeKeysLocked();
  }

  private void removeKeysLocked() {
    try {
      storage.removeAll(KEYS);
      clearPending = false;
    } catch (SessionStorageException e) {
      log.warn("Could not remove stored session, ignoring it until the next sign-in: {}",
          e.getMessage());
    }
  }

  private void scheduleExpiryLocked(Instant expiresAt) {
    cancelExpiryLocked();
    if (scheduler == null) {
      return;
    }
    long delayMillis = Math.max(0, Duration.between(clock.instant(), expiresAt).toMillis());
    expiryTimer = scheduler.schedule(this::onExpiryTimer, delayMillis, TimeUnit.MILLISECONDS);
  }

  private void cancelExpiryLocked() {
    if (expiryTimer != null) {
      expiryTimer.cancel(false);
      expiryTimer = null;
    }
  }

  private void onExpiryTimer() {
    Optional<StoredSession> session = currentSession();
    session.ifPresent(s -> {
      synchronized (lock) {
        scheduleExpiryLocked(s.expiresAt());
      }
    });
  }

  private void publishState() {
    synchronized (publishLock) {
      AuthState state;
      synchronized (lock) {
        state = stateOf(readLocked());
      }
      if (state.equals(lastPublished)) {
        return;
      }
      lastPublished = state;
      log.debug("Publishing authenticated={}", state.authenticated());
      List<AuthStateListener> snapshot = List.copyOf(listeners);
      deliveries.add(() -> snapshot.forEach(l -> notifyListener(l, state)));
    }
    deliver();
  }

  /**
   * Runs queued deliveries unless another thread already is. A listener that triggers a new
   * publication from inside its callback has it queued behind the current one.
   */
  private void deliver() {
    while (!deliveries.isEmpty() && delivering.compareAndSet(false, true)) {
      try {
        Runnable next;
        while ((next = deliveries.poll()) != null) {
          next.run();
        }
      } finally {
        delivering.set(false);
      }
    }
  }

  private static void notifyListener(AuthStateListener listener, AuthState state) {
    try {
      listener.onAuthStateChanged(state);
    } catch (RuntimeException e) {
      log.warn("Auth state listener failed", e);
    }
  }

  private static AuthState stateOf(Optional<StoredSession> session) {
    return session.map(s -> AuthState.of(s.profile())).orElse(AuthState.UNAUTHENTICATED);
  }

  private static Throwable unwrap(Throwable e) {
    return e instanceof CompletionException && e.getCause() != null ? e.getCause() : e;
  }
}
