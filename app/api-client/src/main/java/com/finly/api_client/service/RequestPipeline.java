/*
 * どこで: API クライアントのサービス層
 * 何を: 全 HTTP 呼び出しの入口として、キャッシュ・認証・リトライ・無効化を順に適用する
 * なぜ: 画面側が通信失敗やトークン期限切れを意識せずに API を呼べるようにするため
 */
package com.finly.api_client.service;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.finly.api_client.config.AuthEndpointProperties;
import com.finly.api_client.model.CacheEntry;
import com.finly.api_client.model.CacheLookup;
import com.finly.api_client.model.Freshness;
import com.finly.api_client.model.RequestOptions;
import com.finly.common.retry.RetryExecutor;
import com.finly.common.retry.RetryPolicy;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.FutureTask;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpMethod;

@SuppressFBWarnings(
    value = "EI_EXPOSE_REP2",
    justification = "依存コンポーネントはすべて Spring 管理の共有インスタンスのため")
public class RequestPipeline {

  private static final Logger logger = LoggerFactory.getLogger(RequestPipeline.class);

  private final TokenManager tokenManager;
  private final CacheStore cacheStore;
  private final ApiExchange apiExchange;
  private final RetryExecutor retryExecutor;
  private final RetryPolicies retryPolicies;
  private final CachePolicies cachePolicies;
  private final InvalidationRules invalidationRules;
  private final List<String> publicPaths;
  private final Executor revalidationExecutor;
  private final Executor timeoutExecutor;
  private final ApiClientMetrics metrics;
  private final ObjectMapper objectMapper;

  private final Set<String> revalidating = ConcurrentHashMap.newKeySet();

  public RequestPipeline(
      TokenManager tokenManager,
      CacheStore cacheStore,
      ApiExchange apiExchange,
      RetryExecutor retryExecutor,
      RetryPolicies retryPolicies,
      CachePolicies cachePolicies,
      InvalidationRules invalidationRules,
      AuthEndpointProperties authProperties,
      Executor revalidationExecutor,
      Executor timeoutExecutor,
      ApiClientMetrics metrics,
      ObjectMapper objectMapper) {
    this.tokenManager = tokenManager;
    this.cacheStore = cacheStore;
    this.apiExchange = apiExchange;
    this.retryExecutor = retryExecutor;
    this.retryPolicies = retryPolicies;
    this.cachePolicies = cachePolicies;
    this.invalidationRules = invalidationRules;
    this.publicPaths =
        authProperties.publicPaths().stream().map(CacheKeys::normalizePath).toList();
    this.revalidationExecutor = revalidationExecutor;
    this.timeoutExecutor = timeoutExecutor;
    this.metrics = metrics;
    this.objectMapper = objectMapper;
  }

  public <T> T get(String path, Class<T> type) {
    return get(path, RequestOptions.defaults(), type);
  }

  public <T> T get(String path, RequestOptions options, Class<T> type) {
    return convert(getNode(path, options), constructType(type));
  }

  public <T> T get(String path, RequestOptions options, TypeReference<T> type) {
    return convert(getNode(path, options), constructType(type));
  }

  public <T> T post(String path, Object body, Class<T> type) {
    return post(path, body, RequestOptions.defaults(), type);
  }

  public <T> T post(String path, Object body, RequestOptions options, Class<T> type) {
    return convert(send(HttpMethod.POST, path, body, options), constructType(type));
  }

  public <T> T post(String path, Object body, RequestOptions options, TypeReference<T> type) {
    return convert(send(HttpMethod.POST, path, body, options), constructType(type));
  }

  public <T> T put(String path, Object body, Class<T> type) {
    return put(path, body, RequestOptions.defaults(), type);
  }

  public <T> T put(String path, Object body, RequestOptions options, Class<T> type) {
    return convert(send(HttpMethod.PUT, path, body, options), constructType(type));
  }

  public <T> T put(String path, Object body, RequestOptions options, TypeReference<T> type) {
    return convert(send(HttpMethod.PUT, path, body, options), constructType(type));
  }

  public <T> T patch(String path, Object body, Class<T> type) {
    return patch(path, body, RequestOptions.defaults(), type);
  }

  public <T> T patch(String path, Object body, RequestOptions options, Class<T> type) {
    return convert(send(HttpMethod.PATCH, path, body, options), constructType(type));
  }

  public <T> T patch(String path, Object body, RequestOptions options, TypeReference<T> type) {
    return convert(send(HttpMethod.PATCH, path, body, options), constructType(type));
  }

  public <T> T delete(String path, Class<T> type) {
    return delete(path, RequestOptions.defaults(), type);
  }

  public <T> T delete(String path, RequestOptions options, Class<T> type) {
    return convert(send(HttpMethod.DELETE, path, null, options), constructType(type));
  }

  public <T> T delete(String path, RequestOptions options, TypeReference<T> type) {
    return convert(send(HttpMethod.DELETE, path, null, options), constructType(type));
  }

  /**
   * Read-through GET. Fresh entries are returned without a network call; stale entries are
   * returned immediately and refreshed in the background when the path allows it.
   */
  public JsonNode getNode(String path, RequestOptions options) {
    final RequestOptions resolved = options == null ? RequestOptions.defaults() : options;
    final String key = CacheKeys.of(path, resolved.params());
    if (!resolved.skipCache()) {
      final CacheLookup lookup = cacheStore.lookup(key);
      metrics.recordCacheLookup(lookup.freshness());
      if (lookup.freshness() == Freshness.FRESH) {
        metrics.recordRequest(HttpMethod.GET.name(), "cache_fresh");
        return lookup.payload();
      }
      if (lookup.freshness() == Freshness.STALE) {
        maybeRevalidate(path, key, resolved);
        metrics.recordRequest(HttpMethod.GET.name(), "cache_stale");
        return lookup.payload();
      }
    }
    final long epoch = cacheStore.currentEpoch();
    try {
      final JsonNode data = fetch(HttpMethod.GET, path, null, resolved, readPolicy(resolved));
      storeQuietly(key, data, epoch);
      metrics.recordRequest(HttpMethod.GET.name(), "network");
      return data;
    } catch (ApiClientException ex) {
      if (ex.reason() == ApiClientException.Reason.RATE_LIMITED) {
        final Optional<CacheEntry> fallback = cacheStore.peek(key);
        if (fallback.isPresent()) {
          logger.warn("api GET {} rate limited, serving cached response", key);
          metrics.recordRequest(HttpMethod.GET.name(), "rate_limited_fallback");
          return fallback.get().payload();
        }
      }
      metrics.recordRequestFailure(HttpMethod.GET.name(), ex.reason());
      throw ex;
    }
  }

  /**
   * Sends a mutation and, once it succeeded, drops every cache prefix mapped from the path's
   * resource before returning.
   */
  public JsonNode send(HttpMethod method, String path, Object body, RequestOptions options) {
    if (HttpMethod.GET.equals(method)) {
      throw new IllegalArgumentException("GET must go through getNode");
    }
    final RequestOptions resolved = options == null ? RequestOptions.defaults() : options;
    final RetryPolicy policy =
        resolved.retryPolicy() == null ? retryPolicies.forMethod(method) : resolved.retryPolicy();
    final JsonNode data;
    try {
      data = fetch(method, path, body, resolved, policy);
    } catch (ApiClientException ex) {
      metrics.recordRequestFailure(method.name(), ex.reason());
      throw ex;
    }
    for (String prefix : invalidationRules.prefixesFor(path)) {
      cacheStore.invalidate(prefix);
    }
    metrics.recordRequest(method.name(), "network");
    return data;
  }

  private JsonNode fetch(
      HttpMethod method, String path, Object body, RequestOptions options, RetryPolicy policy) {
    final AtomicReference<String> attachedToken = new AtomicReference<>();
    final Supplier<JsonNode> attempt =
        () -> sendOnce(method, path, options.params(), body, options.timeout(), attachedToken);
    try {
      return retryExecutor.execute(attempt, policy);
    } catch (ApiClientException ex) {
      if (ex.reason() != ApiClientException.Reason.UNAUTHORIZED || isPublic(path)) {
        throw ex;
      }
      try {
        tokenManager.refreshAfterRejection(attachedToken.get());
      } catch (ApiClientException refreshFailure) {
        logger.warn("api {} {} unauthorized and token refresh failed", method.name(), path);
        ex.addSuppressed(refreshFailure);
        throw ex;
      }
      logger.info("api {} {} replaying after token refresh", method.name(), path);
      return retryExecutor.execute(attempt, policy);
    }
  }

  private JsonNode sendOnce(
      HttpMethod method,
      String path,
      Map<String, String> params,
      Object body,
      Duration timeout,
      AtomicReference<String> attachedToken) {
    final Supplier<JsonNode> call =
        () ->
            apiExchange.exchange(
                method,
                path,
                params,
                body,
                headers -> attachedToken.set(tokenManager.attachAuth(headers).orElse(null)));
    if (timeout == null) {
      return call.get();
    }
    return callWithTimeout(call, timeout, method.name() + " " + path);
  }

  private JsonNode callWithTimeout(Supplier<JsonNode> call, Duration timeout, String operation) {
    final FutureTask<JsonNode> task = new FutureTask<>(call::get);
    timeoutExecutor.execute(task);
    try {
      return task.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
    } catch (TimeoutException ex) {
      task.cancel(true);
      logger.warn("api {} exceeded request timeout={}ms", operation, timeout.toMillis());
      throw new ApiClientException(ApiClientException.Reason.TIMEOUT, "api request timeout", ex);
    } catch (ExecutionException ex) {
      if (ex.getCause() instanceof RuntimeException failure) {
        throw failure;
      }
      if (ex.getCause() instanceof Error error) {
        throw error;
      }
      throw new ApiClientException(
          ApiClientException.Reason.TRANSPORT, "api request failed", ex.getCause());
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      task.cancel(true);
      throw new ApiClientException(
          ApiClientException.Reason.TRANSPORT, "api request interrupted", ex);
    }
  }

  private void maybeRevalidate(String path, String key, RequestOptions options) {
    if (!cachePolicies.revalidates(path)) {
      return;
    }
    if (!revalidating.add(key)) {
      logger.debug("cache revalidation already running key={}", key);
      return;
    }
    try {
      revalidationExecutor.execute(() -> revalidate(path, key, options));
    } catch (RejectedExecutionException ex) {
      revalidating.remove(key);
      logger.warn("cache revalidation rejected key={}", key);
      metrics.recordRevalidation("rejected");
    }
  }

  private void revalidate(String path, String key, RequestOptions options) {
    final long epoch = cacheStore.currentEpoch();
    try {
      final JsonNode data = fetch(HttpMethod.GET, path, null, options, readPolicy(options));
      if (cacheStore.putIfNotInvalidatedSince(key, data, epoch)) {
        metrics.recordRevalidation("success");
        logger.debug("cache revalidated key={}", key);
      } else {
        // 取得中に mutation が走った応答は古い可能性があるため保存しない
        metrics.recordRevalidation("discarded");
      }
    } catch (RuntimeException ex) {
      metrics.recordRevalidation("failure");
      logger.warn("cache revalidation failed key={}", key, ex);
    } finally {
      revalidating.remove(key);
    }
  }

  // キャッシュ書き込み失敗で取得済みの応答を失わない
  private void storeQuietly(String key, JsonNode data, long epoch) {
    try {
      cacheStore.putIfNotInvalidatedSince(key, data, epoch);
    } catch (RuntimeException ex) {
      logger.warn("cache write failed key={}", key, ex);
    }
  }

  private RetryPolicy readPolicy(RequestOptions options) {
    return options.retryPolicy() == null ? retryPolicies.read() : options.retryPolicy();
  }

  private boolean isPublic(String path) {
    final String normalized = CacheKeys.normalizePath(path);
    return publicPaths.stream().anyMatch(prefix -> CacheKeys.isUnder(normalized, prefix));
  }

  private JavaType constructType(Class<?> type) {
    return objectMapper.getTypeFactory().constructType(type);
  }

  private JavaType constructType(TypeReference<?> type) {
    return objectMapper.getTypeFactory().constructType(type);
  }

  private <T> T convert(JsonNode data, JavaType type) {
    try {
      return objectMapper.convertValue(data, type);
    } catch (IllegalArgumentException ex) {
      throw new ApiClientException(
          ApiClientException.Reason.INVALID_RESPONSE,
          "api response does not match " + type.getTypeName(),
          ex);
    }
  }
}
