package com.finly.common.store;

import java.util.Collection;
import java.util.Optional;
import java.util.Set;

/**
 * Durable string key-value storage used for session tokens and cached responses.
 *
 * <p>Only per-key atomicity is expected; there are no multi-key transactions.
 */
public interface PersistentKeyValueStore {

  Optional<String> get(String key);

  void set(String key, String value);

  void delete(String key);

  void deleteMany(Collection<String> keys);

  /** Returns every stored key that starts with {@code prefix}. */
  Set<String> keys(String prefix);
}
