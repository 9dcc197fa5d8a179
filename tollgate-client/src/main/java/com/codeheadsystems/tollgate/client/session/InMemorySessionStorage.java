package com.codeheadsystems.tollgate.client.session;

import java.util.Collection;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * {@link SessionStorage} that lives only as long as the process.
 */
public class InMemorySessionStorage implements SessionStorage {

  private final Map<String, String> values = new HashMap<>();

  @Override
  public synchronized Optional<String> get(final String key) {
    return Optional.ofNullable(values.get(key));
  }

  @Override
  public synchronized void putAll(final Map<String, String> entries) {
    values.putAll(entries);
  }

  @Override
  public synchronized void removeAll(final Collection<String> keys) {
    keys.forEach(values::remove);
  }
}
