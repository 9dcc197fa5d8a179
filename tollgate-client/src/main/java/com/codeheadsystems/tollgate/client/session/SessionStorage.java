package com.codeheadsystems.tollgate.client.session;

import java.util.Collection;
import java.util.Map;
import java.util.Optional;

/**
 * Durable key/value storage for the client session.
 * <p>
 * {@link #putAll} and {@link #removeAll} must apply all of their keys together, so a reader
 * never observes a half-written session after a crash.
 */
public interface SessionStorage {

  Optional<String> get(String key);

  void putAll(Map<String, String> entries);

  void removeAll(Collection<String> keys);
}
