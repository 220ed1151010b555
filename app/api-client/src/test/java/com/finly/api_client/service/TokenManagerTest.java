/*
 * どこで: API クライアントのサービス層テスト
 * 何を: トークン保存・単一フライトのリフレッシュ・失敗時のセッション破棄を検証する
 * なぜ: 同時 401 でリフレッシュ API が多重に呼ばれる退行を防ぐため
 */
package com.finly.api_client.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.finly.api_client.config.AuthEndpointProperties;
import com.finly.api_client.model.SessionExpiredEvent;
import com.finly.api_client.model.TokenPair;
import com.finly.api_client.model.TokensRefreshedEvent;
import com.finly.common.store.InMemoryKeyValueStore;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.mockito.Mockito;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;

class TokenManagerTest {

  private static final Map<String, String> REFRESH_BODY = Map.of("refreshToken", "refresh-1");

  private final InMemoryKeyValueStore store = new InMemoryKeyValueStore();
  private final ApiExchange apiExchange = Mockito.mock(ApiExchange.class);
  private final ApplicationEventPublisher eventPublisher =
      Mockito.mock(ApplicationEventPublisher.class);
  private final SimpleMeterRegistry registry = new SimpleMeterRegistry();
  private final ObjectMapper objectMapper = new ObjectMapper();
  private final TokenManager tokenManager =
      new TokenManager(
          store,
          apiExchange,
          AuthEndpointProperties.defaults(),
          eventPublisher,
          new MutableClock(Instant.parse("2026-03-01T10:00:00Z")),
          new ApiClientMetrics(registry));

  private ExecutorService pool;

  @AfterEach
  void shutdownPool() {
    if (pool != null) {
      pool.shutdownNow();
    }
  }

  @Test
  void attachAuthSetsBearerOnlyWhenTokenIsStored() {
    final HttpHeaders anonymous = new HttpHeaders();
    assertThat(tokenManager.attachAuth(anonymous)).isEmpty();
    assertThat(anonymous.containsKey(HttpHeaders.AUTHORIZATION)).isFalse();

    tokenManager.storeTokens(new TokenPair("access-1", "refresh-1"));
    final HttpHeaders headers = new HttpHeaders();

    assertThat(tokenManager.attachAuth(headers)).contains("access-1");
    assertThat(headers.getFirst(HttpHeaders.AUTHORIZATION)).isEqualTo("Bearer access-1");
    assertThat(tokenManager.hasSession()).isTrue();
  }

  @Test
  void refreshStoresNewPairAndPublishesEvent() {
    tokenManager.storeTokens(new TokenPair("access-1", "refresh-1"));
    when(apiExchange.exchange(
            eq(HttpMethod.POST), eq("auth/refresh-token"), isNull(), eq(REFRESH_BODY), isNull()))
        .thenReturn(tokensData("access-2", "refresh-2"));

    final TokenPair refreshed = tokenManager.refresh();

    assertThat(refreshed).isEqualTo(new TokenPair("access-2", "refresh-2"));
    assertThat(tokenManager.getAccessToken()).contains("access-2");
    assertThat(tokenManager.getRefreshToken()).contains("refresh-2");
    assertThat(tokenManager.isRefreshInFlight()).isFalse();
    verify(eventPublisher).publishEvent(any(TokensRefreshedEvent.class));
    assertThat(refreshes("success")).isEqualTo(1.0d);
  }

  @Test
  void concurrentRejectionsShareOneRefreshCall() throws Exception {
    tokenManager.storeTokens(new TokenPair("access-old", "refresh-1"));
    final CountDownLatch refreshStarted = new CountDownLatch(1);
    final CountDownLatch releaseRefresh = new CountDownLatch(1);
    when(apiExchange.exchange(any(), anyString(), any(), any(), any()))
        .thenAnswer(
            invocation -> {
              refreshStarted.countDown();
              releaseRefresh.await(5, TimeUnit.SECONDS);
              return tokensData("access-new", "refresh-new");
            });
    final int callers = 8;
    pool = Executors.newFixedThreadPool(callers);
    final CountDownLatch startGate = new CountDownLatch(1);
    final List<Future<TokenPair>> results = new ArrayList<>();
    for (int i = 0; i < callers; i++) {
      results.add(
          pool.submit(
              () -> {
                startGate.await();
                return tokenManager.refreshAfterRejection("access-old");
              }));
    }

    startGate.countDown();
    assertThat(refreshStarted.await(5, TimeUnit.SECONDS)).isTrue();
    assertThat(tokenManager.isRefreshInFlight()).isTrue();
    releaseRefresh.countDown();

    for (Future<TokenPair> result : results) {
      assertThat(result.get(5, TimeUnit.SECONDS))
          .isEqualTo(new TokenPair("access-new", "refresh-new"));
    }
    verify(apiExchange, times(1)).exchange(any(), anyString(), any(), any(), any());
    assertThat(tokenManager.isRefreshInFlight()).isFalse();
  }

  @Test
  void rejectionOfAlreadyReplacedTokenReturnsStoredPairWithoutCallingBackend() {
    tokenManager.storeTokens(new TokenPair("access-2", "refresh-2"));

    final TokenPair current = tokenManager.refreshAfterRejection("access-1");

    assertThat(current).isEqualTo(new TokenPair("access-2", "refresh-2"));
    verify(apiExchange, never()).exchange(any(), anyString(), any(), any(), any());
  }

  @Test
  void failedRefreshClearsSessionAndPublishesSessionExpired() {
    tokenManager.storeTokens(new TokenPair("access-1", "refresh-1"));
    store.set(StorageKeys.USER_DATA, "{\"id\":\"u-1\"}");
    store.set(StorageKeys.TOKEN_EXPIRY, "1767225600000");
    when(apiExchange.exchange(any(), anyString(), any(), any(), any()))
        .thenThrow(
            new ApiClientException(
                ApiClientException.Reason.UNAUTHORIZED, 401, "INVALID_TOKEN", "bad", null, null));

    assertThatThrownBy(tokenManager::refresh)
        .isInstanceOfSatisfying(
            ApiClientException.class,
            ex -> {
              assertThat(ex.reason()).isEqualTo(ApiClientException.Reason.REFRESH_FAILED);
              assertThat(ex.status()).isEqualTo(401);
              assertThat(ex.errorCode()).isEqualTo("INVALID_TOKEN");
            });

    for (String key : StorageKeys.SESSION_KEYS) {
      assertThat(store.get(key)).isEmpty();
    }
    assertThat(tokenManager.isRefreshInFlight()).isFalse();
    final ArgumentCaptor<Object> event = ArgumentCaptor.forClass(Object.class);
    verify(eventPublisher).publishEvent(event.capture());
    assertThat(event.getValue()).isInstanceOf(SessionExpiredEvent.class);
    assertThat(refreshes("failure")).isEqualTo(1.0d);
  }

  @Test
  void refreshWithoutStoredRefreshTokenFailsWithoutCallingBackend() {
    assertThatThrownBy(tokenManager::refresh)
        .isInstanceOf(ApiClientException.class)
        .extracting(ex -> ((ApiClientException) ex).reason())
        .isEqualTo(ApiClientException.Reason.REFRESH_FAILED);

    verify(apiExchange, never()).exchange(any(), anyString(), any(), any(), any());
  }

  @Test
  void responseWithoutTokensIsRefreshFailure() {
    tokenManager.storeTokens(new TokenPair("access-1", "refresh-1"));
    when(apiExchange.exchange(any(), anyString(), any(), any(), any()))
        .thenReturn(objectMapper.createObjectNode().put("message", "ok"));

    assertThatThrownBy(tokenManager::refresh)
        .isInstanceOfSatisfying(
            ApiClientException.class,
            ex -> {
              assertThat(ex.reason()).isEqualTo(ApiClientException.Reason.REFRESH_FAILED);
              assertThat(ex.getCause())
                  .isInstanceOf(ApiClientException.class)
                  .extracting(cause -> ((ApiClientException) cause).reason())
                  .isEqualTo(ApiClientException.Reason.INVALID_RESPONSE);
            });
    assertThat(tokenManager.hasSession()).isFalse();
  }

  private JsonNode tokensData(String accessToken, String refreshToken) {
    final var data = objectMapper.createObjectNode();
    data.putObject("tokens").put("accessToken", accessToken).put("refreshToken", refreshToken);
    return data;
  }

  private double refreshes(String result) {
    return registry.get("finly.api.token.refresh.total").tag("result", result).counter().count();
  }
}
