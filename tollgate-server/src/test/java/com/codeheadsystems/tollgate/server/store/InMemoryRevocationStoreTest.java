package com.codeheadsystems.tollgate.server.store;

import static org.assertj.core.api.Assertions.assertThat;

import com.codeheadsystems.tollgate.server.MutableClock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class InMemoryRevocationStoreTest {

  private static final Instant START = Instant.parse("2026-03-01T10:00:00Z");

  private MutableClock clock;
  private InMemoryRevocationStore store;

  @BeforeEach
  void setUp() {
    clock = new MutableClock(START);
    store = new InMemoryRevocationStore(clock, Duration.ofHours(1));
  }

  @AfterEach
  void tearDown() {
    store.shutdown();
  }

  @Test
  void revoke_isIdempotent() {
    store.revoke("jti-1", START.plusSeconds(60));
    store.revoke("jti-1", START.plusSeconds(60));

    assertThat(store.isRevoked("jti-1")).isTrue();
    assertThat(store.isRevoked("jti-2")).isFalse();
    assertThat(store.size()).isEqualTo(1);
  }

  @Test
  void revokeIfAbsent_onlyFirstCallerWins() throws Exception {
    ExecutorService pool = Executors.newFixedThreadPool(8);
    try {
      List<Callable<Boolean>> calls = new ArrayList<>();
      for (int i = 0; i < 32; i++) {
        calls.add(() -> store.revokeIfAbsent("jti-1", START.plusSeconds(60)));
      }
      long winners = 0;
      for (Future<Boolean> f : pool.invokeAll(calls)) {
        if (f.get()) {
          winners++;
        }
      }
      assertThat(winners).isEqualTo(1);
    } finally {
      pool.shutdownNow();
    }
  }

  @Test
  void sweep_dropsEntriesOfExpiredTokens() {
    store.revoke("short", START.plusSeconds(60));
    store.revoke("long", START.plusSeconds(3600));

    clock.advance(Duration.ofMinutes(2));
    store.sweep();

    assertThat(store.size()).isEqualTo(1);
    assertThat(store.isRevoked("long")).isTrue();
  }

  @Test
  void isRevoked_expiredEntry_isEvictedLazily() {
    store.revoke("jti-1", START.plusSeconds(60));
    clock.advance(Duration.ofMinutes(2));

    assertThat(store.isRevoked("jti-1")).isTrue();
    assertThat(store.size()).isZero();
  }

  @Test
  void revokeAllIssuedBefore_keepsLatestFence() {
    store.revokeAllIssuedBefore("acct-1", START.plusSeconds(10));
    store.revokeAllIssuedBefore("acct-1", START.plusSeconds(5));

    assertThat(store.isRevokedBefore("acct-1", START.plusSeconds(9))).isTrue();
    assertThat(store.isRevokedBefore("acct-1", START.plusSeconds(10))).isFalse();
    assertThat(store.isRevokedBefore("acct-2", START)).isFalse();
  }
}
