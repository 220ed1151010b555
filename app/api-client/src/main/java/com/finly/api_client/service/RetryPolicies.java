/*
 * どこで: API クライアントのサービス層
 * 何を: HTTP 動詞ごとのリトライ方針を組み立てる
 * なぜ: 作成系の重複副作用を避けつつ読み取り系は粘り強く再試行するため
 */
package com.finly.api_client.service;

import com.finly.api_client.config.RetryProperties;
import com.finly.common.retry.RetryPolicy;
import java.util.EnumSet;
import java.util.Set;
import java.util.function.Predicate;
import org.springframework.http.HttpMethod;

public class RetryPolicies {

  private static final Set<ApiClientException.Reason> TRANSIENT_REASONS =
      EnumSet.of(
          ApiClientException.Reason.TRANSPORT,
          ApiClientException.Reason.TIMEOUT,
          ApiClientException.Reason.SERVER_ERROR);

  /** Network failures and 5xx responses; 4xx (including 401 and 429) are never retried. */
  public static final Predicate<RuntimeException> TRANSIENT_FAILURE =
      failure ->
          failure instanceof ApiClientException ex && TRANSIENT_REASONS.contains(ex.reason());

  /** Only 503 Service Unavailable. */
  public static final Predicate<RuntimeException> SERVICE_UNAVAILABLE =
      failure -> failure instanceof ApiClientException ex && ex.status() == 503;

  private final RetryPolicy read;
  private final RetryPolicy create;
  private final RetryPolicy modify;

  public RetryPolicies(RetryProperties properties) {
    this.read =
        new RetryPolicy(
            properties.maxAttempts(),
            properties.baseDelay(),
            properties.backoffMultiplier(),
            TRANSIENT_FAILURE);
    this.create = read.withRetryPredicate(SERVICE_UNAVAILABLE);
    this.modify = read.withMaxAttempts(properties.mutationMaxAttempts());
  }

  public RetryPolicy read() {
    return read;
  }

  public RetryPolicy create() {
    return create;
  }

  public RetryPolicy update() {
    return modify;
  }

  public RetryPolicy delete() {
    return modify;
  }

  public RetryPolicy forMethod(HttpMethod method) {
    if (HttpMethod.GET.equals(method)) {
      return read;
    }
    if (HttpMethod.POST.equals(method)) {
      return create;
    }
    if (HttpMethod.PUT.equals(method) || HttpMethod.PATCH.equals(method)) {
      return update();
    }
    if (HttpMethod.DELETE.equals(method)) {
      return delete();
    }
    throw new IllegalArgumentException("unsupported method: " + method);
  }
}
