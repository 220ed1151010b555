/*
 * どこで: API クライアント設定
 * 何を: 応答キャッシュの TTL・上限・再検証対象・無効化表を保持する
 * なぜ: エンドポイント単位の鮮度と mutation 後の無効化範囲をレビュー可能な設定にするため
 */
package com.finly.api_client.config;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "finly.api.cache")
public record CacheProperties(
    Duration defaultFresh,
    Duration defaultStale,
    Integer maxEntries,
    List<String> revalidate,
    Map<String, EndpointTtl> endpoints,
    Map<String, List<String>> invalidation) {

  private static final Map<String, EndpointTtl> DEFAULT_ENDPOINTS =
      orderedMap(
          Map.entry("categories", EndpointTtl.ofMinutes(5, 15)),
          Map.entry("categories/setup-status", EndpointTtl.ofMinutes(2, 5)),
          Map.entry("expenses", EndpointTtl.ofMinutes(2, 5)),
          Map.entry("analytics/stats", EndpointTtl.ofMinutes(2, 5)),
          Map.entry("analytics/insights", EndpointTtl.ofMinutes(5, 10)),
          Map.entry("analytics/daily-spending", EndpointTtl.ofMinutes(2, 5)),
          Map.entry("analytics/trend", EndpointTtl.ofMinutes(2, 5)),
          Map.entry("analytics/transactions", EndpointTtl.ofMinutes(1, 3)));

  // categories は支出合計、analytics は支出集計に依存する
  private static final Map<String, List<String>> DEFAULT_INVALIDATION =
      orderedMap(
          Map.entry("expenses", List.of("expenses", "categories", "analytics")),
          Map.entry("categories", List.of("categories", "expenses", "analytics")),
          Map.entry("income", List.of("income", "analytics")),
          Map.entry("tags", List.of("tags", "expenses")),
          Map.entry("subscriptions", List.of("subscriptions")),
          Map.entry("auth", List.of("auth")),
          Map.entry("import", List.of("expenses", "categories", "analytics", "income")));

  private static final List<String> DEFAULT_REVALIDATE =
      List.of("categories", "expenses", "analytics", "income", "tags");

  public CacheProperties {
    defaultFresh = defaultFresh == null ? Duration.ofMinutes(5) : defaultFresh;
    defaultStale = defaultStale == null ? Duration.ofMinutes(10) : defaultStale;
    maxEntries = maxEntries == null || maxEntries < 1 ? 100 : maxEntries;
    revalidate = revalidate == null ? DEFAULT_REVALIDATE : List.copyOf(revalidate);
    endpoints = merge(DEFAULT_ENDPOINTS, endpoints);
    invalidation = merge(DEFAULT_INVALIDATION, invalidation);
  }

  public static CacheProperties defaults() {
    return new CacheProperties(null, null, null, null, null, null);
  }

  public record EndpointTtl(Duration fresh, Duration stale) {

    static EndpointTtl ofMinutes(long fresh, long stale) {
      return new EndpointTtl(Duration.ofMinutes(fresh), Duration.ofMinutes(stale));
    }
  }

  private static <V> Map<String, V> merge(Map<String, V> defaults, Map<String, V> overrides) {
    final Map<String, V> merged = new LinkedHashMap<>(defaults);
    if (overrides != null) {
      merged.putAll(overrides);
    }
    return Map.copyOf(merged);
  }

  @SafeVarargs
  private static <V> Map<String, V> orderedMap(Map.Entry<String, V>... entries) {
    final Map<String, V> map = new LinkedHashMap<>();
    for (Map.Entry<String, V> entry : entries) {
      map.put(entry.getKey(), entry.getValue());
    }
    return map;
  }
}
