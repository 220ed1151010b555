/*
 * どこで: API クライアントのサービス層
 * 何を: リクエスト結果・キャッシュ判定・リトライ・トークン更新のメトリクスを記録する
 * なぜ: キャッシュ効果と下流障害の傾向を Prometheus から直接観測できるようにするため
 */
package com.finly.api_client.service;

import com.finly.api_client.model.Freshness;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import java.util.Locale;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

@SuppressFBWarnings(
    value = "EI_EXPOSE_REP2",
    justification = "MeterRegistry は Spring 管理の共有コンポーネントで防御的コピーが不可能なため")
public class ApiClientMetrics {

  private static final String METRIC_REQUEST_TOTAL = "finly.api.request.total";
  private static final String METRIC_CACHE_LOOKUP_TOTAL = "finly.api.cache.lookup.total";
  private static final String METRIC_RETRY_TOTAL = "finly.api.retry.total";
  private static final String METRIC_TOKEN_REFRESH_TOTAL = "finly.api.token.refresh.total";
  private static final String METRIC_REVALIDATION_TOTAL = "finly.api.revalidation.total";

  private final MeterRegistry meterRegistry;
  private final ConcurrentMap<String, Counter> requestCounters = new ConcurrentHashMap<>();
  private final ConcurrentMap<Freshness, Counter> cacheLookupCounters = new ConcurrentHashMap<>();
  private final ConcurrentMap<String, Counter> retryCounters = new ConcurrentHashMap<>();
  private final ConcurrentMap<String, Counter> tokenRefreshCounters = new ConcurrentHashMap<>();
  private final ConcurrentMap<String, Counter> revalidationCounters = new ConcurrentHashMap<>();

  public ApiClientMetrics(MeterRegistry meterRegistry) {
    this.meterRegistry = meterRegistry;
  }

  /**
   * @param outcome {@code network}, {@code cache_fresh}, {@code cache_stale}, {@code
   *     rate_limited_fallback} or a lower-cased failure reason
   */
  public void recordRequest(String method, String outcome) {
    final String key = method + "|" + outcome;
    requestCounters
        .computeIfAbsent(
            key,
            ignored ->
                Counter.builder(METRIC_REQUEST_TOTAL)
                    .description("API client request outcomes")
                    .tags(Tags.of("method", method, "outcome", outcome))
                    .register(meterRegistry))
        .increment();
  }

  public void recordRequestFailure(String method, ApiClientException.Reason reason) {
    recordRequest(method, reason.name().toLowerCase(Locale.ROOT));
  }

  public void recordCacheLookup(Freshness freshness) {
    cacheLookupCounters
        .computeIfAbsent(
            freshness,
            ignored ->
                Counter.builder(METRIC_CACHE_LOOKUP_TOTAL)
                    .description("API client cache lookups by freshness")
                    .tags(Tags.of("freshness", freshness.name().toLowerCase(Locale.ROOT)))
                    .register(meterRegistry))
        .increment();
  }

  public void recordRetry(RuntimeException failure) {
    final String reason =
        failure instanceof ApiClientException ex
            ? ex.reason().name().toLowerCase(Locale.ROOT)
            : "unknown";
    retryCounters
        .computeIfAbsent(
            reason,
            ignored ->
                Counter.builder(METRIC_RETRY_TOTAL)
                    .description("API client retries by failure reason")
                    .tags(Tags.of("reason", reason))
                    .register(meterRegistry))
        .increment();
  }

  public void recordTokenRefresh(String result) {
    tokenRefreshCounters
        .computeIfAbsent(
            result,
            ignored ->
                Counter.builder(METRIC_TOKEN_REFRESH_TOTAL)
                    .description("API client token refresh outcomes")
                    .tags(Tags.of("result", result))
                    .register(meterRegistry))
        .increment();
  }

  public void recordRevalidation(String result) {
    revalidationCounters
        .computeIfAbsent(
            result,
            ignored ->
                Counter.builder(METRIC_REVALIDATION_TOTAL)
                    .description("API client background revalidation outcomes")
                    .tags(Tags.of("result", result))
                    .register(meterRegistry))
        .increment();
  }
}
