/*
 * どこで: API クライアントのキャッシュモデル
 * 何を: fresh/stale の閾値と経過時間による鮮度分類を表現する
 * なぜ: エンドポイントごとに異なる TTL を同じ規則で判定するため
 */
package com.finly.api_client.model;

import java.time.Duration;
import java.util.Objects;

public record CachePolicy(Duration ttlFresh, Duration ttlStale) {

  public CachePolicy {
    Objects.requireNonNull(ttlFresh, "ttlFresh is required");
    Objects.requireNonNull(ttlStale, "ttlStale is required");
    if (ttlFresh.isNegative()) {
      throw new IllegalArgumentException("ttlFresh must not be negative");
    }
    if (ttlFresh.compareTo(ttlStale) > 0) {
      throw new IllegalArgumentException("ttlFresh must not exceed ttlStale");
    }
  }

  public Freshness classify(Duration age) {
    if (age.compareTo(ttlFresh) <= 0) {
      return Freshness.FRESH;
    }
    if (age.compareTo(ttlStale) <= 0) {
      return Freshness.STALE;
    }
    return Freshness.MISS;
  }
}
