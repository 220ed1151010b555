/*
 * どこで: API クライアントのキャッシュ層
 * 何を: パスから TTL と再検証可否を解決する
 * なぜ: エンドポイント別の鮮度設定と再検証許可リストを一箇所で判定するため
 */
package com.finly.api_client.service;

import com.finly.api_client.config.CacheProperties;
import com.finly.api_client.model.CachePolicy;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public class CachePolicies {

  private final CachePolicy defaultPolicy;
  private final Map<String, CachePolicy> endpointPolicies;
  private final List<String> revalidationAllowlist;

  public CachePolicies(CacheProperties properties) {
    this.defaultPolicy = new CachePolicy(properties.defaultFresh(), properties.defaultStale());
    final Map<String, CachePolicy> policies = new LinkedHashMap<>();
    properties
        .endpoints()
        .forEach(
            (path, ttl) ->
                policies.put(
                    CacheKeys.normalizePath(path),
                    new CachePolicy(
                        ttl.fresh() == null ? defaultPolicy.ttlFresh() : ttl.fresh(),
                        ttl.stale() == null ? defaultPolicy.ttlStale() : ttl.stale())));
    this.endpointPolicies = Map.copyOf(policies);
    this.revalidationAllowlist =
        properties.revalidate().stream().map(CacheKeys::normalizePath).toList();
  }

  /** Policy of the longest configured path prefix covering the key, or the default policy. */
  public CachePolicy resolve(String key) {
    final String path = CacheKeys.pathOf(key);
    String bestMatch = null;
    for (String prefix : endpointPolicies.keySet()) {
      if (CacheKeys.isUnder(path, prefix)
          && (bestMatch == null || prefix.length() > bestMatch.length())) {
        bestMatch = prefix;
      }
    }
    return bestMatch == null ? defaultPolicy : endpointPolicies.get(bestMatch);
  }

  public boolean revalidates(String path) {
    final String normalized = CacheKeys.normalizePath(path);
    return revalidationAllowlist.stream().anyMatch(prefix -> CacheKeys.isUnder(normalized, prefix));
  }
}
