package com.finly.common.store;

import java.util.Collection;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

public class InMemoryKeyValueStore implements PersistentKeyValueStore {

  private final Map<String, String> entries = new ConcurrentHashMap<>();

  @Override
  public Optional<String> get(String key) {
    requireKey(key);
    return Optional.ofNullable(entries.get(key));
  }

  @Override
  public void set(String key, String value) {
    requireKey(key);
    if (value == null) {
      throw new IllegalArgumentException("value is required");
    }
    entries.put(key, value);
  }

  @Override
  public void delete(String key) {
    requireKey(key);
    entries.remove(key);
  }

  @Override
  public void deleteMany(Collection<String> keys) {
    if (keys == null) {
      return;
    }
    keys.forEach(entries::remove);
  }

  @Override
  public Set<String> keys(String prefix) {
    final String safePrefix = prefix == null ? "" : prefix;
    return entries.keySet().stream()
        .filter(key -> key.startsWith(safePrefix))
        .collect(Collectors.toUnmodifiableSet());
  }

  private void requireKey(String key) {
    if (key == null || key.isBlank()) {
      throw new IllegalArgumentException("key is required");
    }
  }
}
