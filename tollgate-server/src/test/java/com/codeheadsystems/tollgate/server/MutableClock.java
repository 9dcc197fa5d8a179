package com.codeheadsystems.tollgate.server;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;

/**
 * A clock tests can move.
 */
public class MutableClock extends Clock {

  private volatile Instant now;

  public MutableClock(final Instant now) {
    this.now = now;
  }

  public static MutableClock atNow() {
    return new MutableClock(Instant.now());
  }

  public void advance(final Duration duration) {
    now = now.plus(duration);
  }

  public void set(final Instant instant) {
    now = instant;
  }

  @Override
  public ZoneId getZone() {
    return ZoneOffset.UTC;
  }

  @Override
  public Clock withZone(final ZoneId zone) {
    return this;
  }

  @Override
  public Instant instant() {
    return now;
  }
}
