package com.codeheadsystems.tollgate.client.session;

/**
 * Handle returned by {@link ClientSession#subscribe}. Closing it stops further notifications.
 */
@FunctionalInterface
public interface Subscription extends AutoCloseable {

  @Override
  void close();
}
