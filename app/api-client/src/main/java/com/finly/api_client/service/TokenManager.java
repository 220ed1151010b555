/*
 * どこで: API クライアントのサービス層
 * 何を: アクセストークン/リフレッシュトークンの保持と単一フライトでの再取得を行う
 * なぜ: 同時に多数の 401 が返ってもリフレッシュ API 呼び出しを 1 回に抑えるため
 */
package com.finly.api_client.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.finly.api_client.config.AuthEndpointProperties;
import com.finly.api_client.model.SessionExpiredEvent;
import com.finly.api_client.model.TokenPair;
import com.finly.api_client.model.TokensRefreshedEvent;
import com.finly.common.store.PersistentKeyValueStore;
import com.google.common.annotations.VisibleForTesting;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.time.Clock;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.locks.ReentrantLock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;

@SuppressFBWarnings(
    value = "EI_EXPOSE_REP2",
    justification = "ストア・クライアント・イベント発行器は Spring 管理の共有コンポーネントのため")
public class TokenManager {

  private static final Logger logger = LoggerFactory.getLogger(TokenManager.class);

  private final PersistentKeyValueStore store;
  private final ApiExchange apiExchange;
  private final AuthEndpointProperties authProperties;
  private final ApplicationEventPublisher eventPublisher;
  private final Clock clock;
  private final ApiClientMetrics metrics;

  private final ReentrantLock refreshLock = new ReentrantLock();

  // refreshLock で保護する
  private CompletableFuture<TokenPair> inFlight;

  public TokenManager(
      PersistentKeyValueStore store,
      ApiExchange apiExchange,
      AuthEndpointProperties authProperties,
      ApplicationEventPublisher eventPublisher,
      Clock clock,
      ApiClientMetrics metrics) {
    this.store = store;
    this.apiExchange = apiExchange;
    this.authProperties = authProperties;
    this.eventPublisher = eventPublisher;
    this.clock = clock;
    this.metrics = metrics;
  }

  public Optional<String> getAccessToken() {
    return store.get(StorageKeys.ACCESS_TOKEN).filter(token -> !token.isBlank());
  }

  public Optional<String> getRefreshToken() {
    return store.get(StorageKeys.REFRESH_TOKEN).filter(token -> !token.isBlank());
  }

  public boolean hasSession() {
    return getAccessToken().isPresent();
  }

  /**
   * Sets {@code Authorization: Bearer} when an access token is stored.
   *
   * @return the token that was attached, so a later 401 can be matched against it
   */
  public Optional<String> attachAuth(HttpHeaders headers) {
    final Optional<String> token = getAccessToken();
    token.ifPresent(headers::setBearerAuth);
    return token;
  }

  public void storeTokens(TokenPair tokens) {
    store.set(StorageKeys.ACCESS_TOKEN, tokens.accessToken());
    store.set(StorageKeys.REFRESH_TOKEN, tokens.refreshToken());
  }

  public void clearTokens() {
    store.deleteMany(StorageKeys.SESSION_KEYS);
  }

  /**
   * Obtains a new token pair, joining a refresh that is already running.
   *
   * @throws ApiClientException with reason {@code REFRESH_FAILED} when the refresh fails; the
   *     stored session has been cleared by then
   */
  public TokenPair refresh() {
    return refreshAfterRejection(null);
  }

  /**
   * Same as {@link #refresh()}, but returns the stored pair without calling the backend when the
   * rejected token has already been replaced by a refresh that finished in the meantime.
   */
  public TokenPair refreshAfterRejection(String rejectedAccessToken) {
    final CompletableFuture<TokenPair> future;
    boolean leader = false;
    refreshLock.lock();
    try {
      if (inFlight != null) {
        future = inFlight;
      } else {
        final Optional<TokenPair> replaced = replacedPair(rejectedAccessToken);
        if (replaced.isPresent()) {
          logger.debug("token already refreshed by a concurrent caller");
          return replaced.get();
        }
        future = new CompletableFuture<>();
        inFlight = future;
        leader = true;
      }
    } finally {
      refreshLock.unlock();
    }
    if (leader) {
      runRefresh(future);
    }
    return await(future);
  }

  @VisibleForTesting
  boolean isRefreshInFlight() {
    refreshLock.lock();
    try {
      return inFlight != null;
    } finally {
      refreshLock.unlock();
    }
  }

  private Optional<TokenPair> replacedPair(String rejectedAccessToken) {
    if (rejectedAccessToken == null) {
      return Optional.empty();
    }
    final Optional<String> current = getAccessToken();
    final Optional<String> refreshToken = getRefreshToken();
    if (current.isEmpty()
        || refreshToken.isEmpty()
        || current.get().equals(rejectedAccessToken)) {
      return Optional.empty();
    }
    return Optional.of(new TokenPair(current.get(), refreshToken.get()));
  }

  private void runRefresh(CompletableFuture<TokenPair> future) {
    final TokenPair refreshed;
    try {
      refreshed = requestNewTokens();
      storeTokens(refreshed);
    } catch (RuntimeException ex) {
      final ApiClientException failure = toRefreshFailure(ex);
      logger.warn(
          "token refresh failed reason={} status={}", failure.reason(), failure.status(), ex);
      try {
        clearTokens();
      } finally {
        finish(future, null, failure);
      }
      metrics.recordTokenRefresh("failure");
      publish(new SessionExpiredEvent("refresh_failed", clock.instant()));
      return;
    }
    finish(future, refreshed, null);
    logger.info("token refresh succeeded");
    metrics.recordTokenRefresh("success");
    publish(new TokensRefreshedEvent(clock.instant()));
  }

  private TokenPair requestNewTokens() {
    final String refreshToken =
        getRefreshToken()
            .orElseThrow(
                () ->
                    new ApiClientException(
                        ApiClientException.Reason.REFRESH_FAILED, "no refresh token stored"));
    final JsonNode data =
        apiExchange.exchange(
            HttpMethod.POST,
            authProperties.refreshTokenPath(),
            null,
            Map.of("refreshToken", refreshToken),
            null);
    final JsonNode tokens = data.path("tokens");
    final String accessToken = tokens.path("accessToken").asText("");
    final String newRefreshToken = tokens.path("refreshToken").asText("");
    if (accessToken.isBlank() || newRefreshToken.isBlank()) {
      throw new ApiClientException(
          ApiClientException.Reason.INVALID_RESPONSE, "refresh response has no tokens");
    }
    return new TokenPair(accessToken, newRefreshToken);
  }

  private void finish(
      CompletableFuture<TokenPair> future, TokenPair refreshed, ApiClientException failure) {
    refreshLock.lock();
    try {
      inFlight = null;
    } finally {
      refreshLock.unlock();
    }
    if (failure == null) {
      future.complete(refreshed);
    } else {
      future.completeExceptionally(failure);
    }
  }

  private TokenPair await(CompletableFuture<TokenPair> future) {
    try {
      return future.join();
    } catch (CompletionException ex) {
      if (ex.getCause() instanceof ApiClientException failure) {
        throw failure;
      }
      throw toRefreshFailure(ex);
    }
  }

  private ApiClientException toRefreshFailure(RuntimeException ex) {
    if (ex instanceof ApiClientException api) {
      if (api.reason() == ApiClientException.Reason.REFRESH_FAILED) {
        return api;
      }
      return new ApiClientException(
          ApiClientException.Reason.REFRESH_FAILED,
          api.status(),
          api.errorCode(),
          "token refresh failed",
          null,
          api);
    }
    return new ApiClientException(
        ApiClientException.Reason.REFRESH_FAILED, "token refresh failed", ex);
  }

  private void publish(Object event) {
    try {
      eventPublisher.publishEvent(event);
    } catch (RuntimeException ex) {
      logger.warn("auth event listener failed event={}", event.getClass().getSimpleName(), ex);
    }
  }
}
