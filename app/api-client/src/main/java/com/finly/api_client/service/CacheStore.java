/*
 * どこで: API クライアントのキャッシュ層
 * 何を: GET 応答を永続 KVS に保存し、鮮度判定・前方一致無効化・件数上限を扱う
 * なぜ: オフラインや 429 時にも直近の応答を返しつつ、更新後の古い表示を防ぐため
 */
package com.finly.api_client.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.finly.api_client.model.CacheEntry;
import com.finly.api_client.model.CacheLookup;
import com.finly.api_client.model.Freshness;
import com.finly.common.store.PersistentKeyValueStore;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.locks.ReentrantLock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

@SuppressFBWarnings(
    value = "EI_EXPOSE_REP2",
    justification = "ストアと ObjectMapper は Spring 管理の共有コンポーネントのため")
public class CacheStore {

  private static final Logger logger = LoggerFactory.getLogger(CacheStore.class);

  private static final String FIELD_KEY = "key";
  private static final String FIELD_STORED_AT = "storedAt";
  private static final String FIELD_PAYLOAD = "payload";
  private static final int UNKNOWN_COUNT = -1;

  private final PersistentKeyValueStore store;
  private final ObjectMapper objectMapper;
  private final CachePolicies policies;
  private final Clock clock;
  private final int maxEntries;

  // 書き込み・無効化・件数管理は writeLock で直列化する
  private final ReentrantLock writeLock = new ReentrantLock();
  private final Map<String, Long> invalidatedAt = new HashMap<>();
  private long invalidationEpoch;
  private int knownEntries = UNKNOWN_COUNT;

  public CacheStore(
      PersistentKeyValueStore store,
      ObjectMapper objectMapper,
      CachePolicies policies,
      Clock clock,
      int maxEntries) {
    if (maxEntries < 1) {
      throw new IllegalArgumentException("maxEntries must be >= 1");
    }
    this.store = store;
    this.objectMapper = objectMapper;
    this.policies = policies;
    this.clock = clock;
    this.maxEntries = maxEntries;
  }

  /** Classifies the stored entry for {@code key}; absent and expired entries are a miss. */
  public CacheLookup lookup(String key) {
    final Optional<CacheEntry> entry = read(key);
    if (entry.isEmpty()) {
      return CacheLookup.miss();
    }
    final Duration age = ageOf(entry.get());
    final Freshness freshness = policies.resolve(key).classify(age);
    logger.debug("cache lookup key={} freshness={} ageMs={}", key, freshness, age.toMillis());
    if (freshness == Freshness.MISS) {
      // 期限切れでも削除しない。429 時のフォールバックで peek される
      return CacheLookup.miss();
    }
    return new CacheLookup(entry.get().payload(), freshness, age);
  }

  /** Returns the stored entry regardless of its age. */
  public Optional<CacheEntry> peek(String key) {
    return read(key);
  }

  public void put(String key, JsonNode payload) {
    writeLock.lock();
    try {
      write(key, payload);
    } finally {
      writeLock.unlock();
    }
  }

  /** Marker to pass to {@link #putIfNotInvalidatedSince} before a network read starts. */
  public long currentEpoch() {
    writeLock.lock();
    try {
      return invalidationEpoch;
    } finally {
      writeLock.unlock();
    }
  }

  /**
   * Stores {@code payload} unless an invalidation covering {@code key} ran after {@code epoch}
   * was taken.
   *
   * @return false when the payload was discarded
   */
  public boolean putIfNotInvalidatedSince(String key, JsonNode payload, long epoch) {
    writeLock.lock();
    try {
      for (Map.Entry<String, Long> invalidation : invalidatedAt.entrySet()) {
        if (invalidation.getValue() > epoch && key.startsWith(invalidation.getKey())) {
          logger.debug(
              "cache write discarded key={} invalidatedPrefix={}", key, invalidation.getKey());
          return false;
        }
      }
      write(key, payload);
      return true;
    } finally {
      writeLock.unlock();
    }
  }

  /**
   * Deletes every entry whose key starts with {@code prefix}.
   *
   * @return number of deleted entries
   */
  public int invalidate(String prefix) {
    final String normalized = CacheKeys.normalizePath(prefix);
    writeLock.lock();
    try {
      final int deleted = deleteUnder(normalized);
      logger.debug("cache invalidated prefix={} count={}", prefix, deleted);
      return deleted;
    } finally {
      writeLock.unlock();
    }
  }

  public void clear() {
    writeLock.lock();
    try {
      final int deleted = deleteUnder("");
      knownEntries = 0;
      logger.info("cache cleared count={}", deleted);
    } finally {
      writeLock.unlock();
    }
  }

  private int deleteUnder(String prefix) {
    invalidationEpoch++;
    invalidatedAt.put(prefix, invalidationEpoch);
    final Set<String> keys = store.keys(StorageKeys.CACHE_PREFIX + prefix);
    if (!keys.isEmpty()) {
      store.deleteMany(keys);
    }
    if (knownEntries != UNKNOWN_COUNT) {
      knownEntries = Math.max(0, knownEntries - keys.size());
    }
    return keys.size();
  }

  private void write(String key, JsonNode payload) {
    final ObjectNode document = objectMapper.createObjectNode();
    document.put(FIELD_KEY, key);
    document.put(FIELD_STORED_AT, clock.instant().toString());
    document.set(FIELD_PAYLOAD, payload);
    final String serialized;
    try {
      serialized = objectMapper.writeValueAsString(document);
    } catch (JsonProcessingException ex) {
      throw new IllegalStateException("cache entry is not serializable key=" + key, ex);
    }
    final boolean created = store.get(storageKey(key)).isEmpty();
    store.set(storageKey(key), serialized);
    if (knownEntries == UNKNOWN_COUNT) {
      knownEntries = store.keys(StorageKeys.CACHE_PREFIX).size();
    } else if (created) {
      knownEntries++;
    }
    if (knownEntries > maxEntries) {
      evictOldest();
    }
  }

  // 件数が上限を超えたときだけ全件を走査する。他プロセスの書き込みによるずれもここで補正される
  private void evictOldest() {
    final Set<String> storageKeys = store.keys(StorageKeys.CACHE_PREFIX);
    final List<CacheEntry> entries = new ArrayList<>();
    for (String storageKey : storageKeys) {
      read(storageKey.substring(StorageKeys.CACHE_PREFIX.length())).ifPresent(entries::add);
    }
    final int overflow = entries.size() - maxEntries;
    if (overflow <= 0) {
      knownEntries = entries.size();
      return;
    }
    entries.sort(Comparator.comparing(CacheEntry::storedAt));
    final List<String> evicted =
        entries.subList(0, overflow).stream().map(entry -> storageKey(entry.key())).toList();
    store.deleteMany(evicted);
    knownEntries = maxEntries;
    logger.debug("cache evicted count={} maxEntries={}", evicted.size(), maxEntries);
  }

  private Optional<CacheEntry> read(String key) {
    final String storageKey = storageKey(key);
    final Optional<String> raw = store.get(storageKey);
    if (raw.isEmpty()) {
      return Optional.empty();
    }
    try {
      final JsonNode document = objectMapper.readTree(raw.get());
      final JsonNode storedAt = document.path(FIELD_STORED_AT);
      if (!storedAt.isTextual() || !document.has(FIELD_PAYLOAD)) {
        throw new IllegalStateException("cache entry is incomplete");
      }
      return Optional.of(
          new CacheEntry(key, document.get(FIELD_PAYLOAD), Instant.parse(storedAt.asText())));
    } catch (JsonProcessingException | DateTimeParseException | IllegalStateException ex) {
      logger.warn("cache entry unreadable, dropping key={}", key, ex);
      store.delete(storageKey);
      return Optional.empty();
    }
  }

  private Duration ageOf(CacheEntry entry) {
    final Duration age = Duration.between(entry.storedAt(), clock.instant());
    return age.isNegative() ? Duration.ZERO : age;
  }

  private static String storageKey(String key) {
    return StorageKeys.CACHE_PREFIX + key;
  }
}
