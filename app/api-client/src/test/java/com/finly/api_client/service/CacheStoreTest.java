/*
 * どこで: API クライアントのキャッシュ層テスト
 * 何を: 鮮度境界・前方一致無効化・件数上限・壊れたエントリの扱いを検証する
 * なぜ: FRESH/STALE/MISS の判定境界と無効化範囲の退行を防ぐため
 */
package com.finly.api_client.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.TextNode;
import com.finly.api_client.config.CacheProperties;
import com.finly.api_client.model.CacheLookup;
import com.finly.api_client.model.Freshness;
import com.finly.common.store.InMemoryKeyValueStore;
import java.time.Duration;
import java.time.Instant;
import org.junit.jupiter.api.Test;
import org.mockito.Mockito;

class CacheStoreTest {

  private final InMemoryKeyValueStore store = new InMemoryKeyValueStore();
  private final ObjectMapper objectMapper = new ObjectMapper();
  private final MutableClock clock = new MutableClock(Instant.parse("2026-03-01T10:00:00Z"));
  private final CachePolicies policies = new CachePolicies(CacheProperties.defaults());
  private final CacheStore cacheStore = new CacheStore(store, objectMapper, policies, clock, 100);

  @Test
  void classifiesEntryAtInclusiveBoundaries() {
    // expenses: fresh 2m / stale 5m
    cacheStore.put("expenses", payload("v1"));

    assertThat(cacheStore.lookup("expenses").freshness()).isEqualTo(Freshness.FRESH);
    clock.advance(Duration.ofMinutes(2));
    assertThat(cacheStore.lookup("expenses").freshness()).isEqualTo(Freshness.FRESH);
    clock.advance(Duration.ofMillis(1));
    assertThat(cacheStore.lookup("expenses").freshness()).isEqualTo(Freshness.STALE);
    clock.advance(Duration.ofMinutes(3).minusMillis(1));
    final CacheLookup atStaleLimit = cacheStore.lookup("expenses");
    assertThat(atStaleLimit.freshness()).isEqualTo(Freshness.STALE);
    assertThat(atStaleLimit.age()).isEqualTo(Duration.ofMinutes(5));
    assertThat(atStaleLimit.payload().path("value").asText()).isEqualTo("v1");
    clock.advance(Duration.ofMillis(1));
    assertThat(cacheStore.lookup("expenses").freshness()).isEqualTo(Freshness.MISS);
  }

  @Test
  void expiredEntryIsStillAvailableThroughPeek() {
    cacheStore.put("categories", payload("old"));
    clock.advance(Duration.ofHours(1));

    assertThat(cacheStore.lookup("categories").isUsable()).isFalse();
    assertThat(cacheStore.peek("categories"))
        .hasValueSatisfying(
            entry -> {
              assertThat(entry.payload().path("value").asText()).isEqualTo("old");
              assertThat(entry.storedAt()).isEqualTo(Instant.parse("2026-03-01T10:00:00Z"));
            });
  }

  @Test
  void putOverwritesAndResetsAge() {
    cacheStore.put("tags", payload("v1"));
    clock.advance(Duration.ofMinutes(7));
    cacheStore.put("tags", payload("v2"));

    final CacheLookup lookup = cacheStore.lookup("tags");
    assertThat(lookup.freshness()).isEqualTo(Freshness.FRESH);
    assertThat(lookup.age()).isEqualTo(Duration.ZERO);
    assertThat(lookup.payload().path("value").asText()).isEqualTo("v2");
  }

  @Test
  void invalidateDropsEveryKeyStartingWithPrefix() {
    cacheStore.put("expenses", payload("a"));
    cacheStore.put("expenses?page=2", payload("b"));
    cacheStore.put("expenses/42", payload("c"));
    cacheStore.put("categories", payload("d"));

    final int deleted = cacheStore.invalidate("expenses");

    assertThat(deleted).isEqualTo(3);
    assertThat(cacheStore.peek("expenses")).isEmpty();
    assertThat(cacheStore.peek("expenses?page=2")).isEmpty();
    assertThat(cacheStore.peek("expenses/42")).isEmpty();
    assertThat(cacheStore.peek("categories")).isPresent();
  }

  @Test
  void clearKeepsSessionKeys() {
    store.set(StorageKeys.ACCESS_TOKEN, "access-1");
    cacheStore.put("categories", payload("d"));
    cacheStore.put("income", payload("e"));

    cacheStore.clear();

    assertThat(store.keys(StorageKeys.CACHE_PREFIX)).isEmpty();
    assertThat(store.get(StorageKeys.ACCESS_TOKEN)).contains("access-1");
  }

  @Test
  void unreadableEntryIsDroppedAndTreatedAsMiss() {
    store.set(StorageKeys.CACHE_PREFIX + "income", "{not json");

    assertThat(cacheStore.lookup("income")).isEqualTo(CacheLookup.miss());
    assertThat(store.get(StorageKeys.CACHE_PREFIX + "income")).isEmpty();
  }

  @Test
  void evictsOldestEntriesAboveMaxEntries() {
    final CacheStore small = new CacheStore(store, objectMapper, policies, clock, 2);
    small.put("categories", payload("1"));
    clock.advance(Duration.ofSeconds(1));
    small.put("expenses", payload("2"));
    clock.advance(Duration.ofSeconds(1));
    small.put("income", payload("3"));

    assertThat(store.keys(StorageKeys.CACHE_PREFIX))
        .containsExactlyInAnyOrder(
            StorageKeys.CACHE_PREFIX + "expenses", StorageKeys.CACHE_PREFIX + "income");
  }

  @Test
  void overwritingAnEntryDoesNotCountTowardsMaxEntries() {
    final CacheStore small = new CacheStore(store, objectMapper, policies, clock, 2);
    small.put("categories", payload("1"));
    clock.advance(Duration.ofSeconds(1));
    small.put("categories", payload("2"));
    small.put("expenses", payload("3"));

    assertThat(small.peek("categories")).isPresent();
    assertThat(small.peek("expenses")).isPresent();
  }

  @Test
  void listsKeysOnlyOnceWhileBelowMaxEntries() {
    final InMemoryKeyValueStore spiedStore = Mockito.spy(new InMemoryKeyValueStore());
    final CacheStore counted = new CacheStore(spiedStore, objectMapper, policies, clock, 100);

    counted.put("categories", payload("1"));
    counted.put("expenses", payload("2"));
    counted.put("income", payload("3"));
    counted.put("tags", payload("4"));

    verify(spiedStore, times(1)).keys(StorageKeys.CACHE_PREFIX);
  }

  @Test
  void discardsWriteWhenCoveringPrefixWasInvalidatedAfterEpoch() {
    final long epoch = cacheStore.currentEpoch();
    cacheStore.invalidate("income");

    assertThat(cacheStore.putIfNotInvalidatedSince("categories", payload("1"), epoch)).isTrue();

    cacheStore.invalidate("categories");

    assertThat(cacheStore.putIfNotInvalidatedSince("categories?page=2", payload("2"), epoch))
        .isFalse();
    assertThat(cacheStore.peek("categories?page=2")).isEmpty();
    assertThat(
            cacheStore.putIfNotInvalidatedSince(
                "categories?page=2", payload("3"), cacheStore.currentEpoch()))
        .isTrue();
  }

  @Test
  void clearDiscardsWritesStartedBeforeIt() {
    final long epoch = cacheStore.currentEpoch();
    cacheStore.clear();

    assertThat(cacheStore.putIfNotInvalidatedSince("tags", payload("1"), epoch)).isFalse();
    assertThat(cacheStore.peek("tags")).isEmpty();
  }

  private JsonNode payload(String value) {
    return objectMapper.createObjectNode().set("value", TextNode.valueOf(value));
  }
}
