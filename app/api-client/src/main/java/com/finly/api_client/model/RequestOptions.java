package com.finly.api_client.model;

import com.finly.common.retry.RetryPolicy;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Per-request knobs recognised by the request pipeline.
 *
 * @param params query parameters; null values are dropped
 * @param skipCache bypass the cache read for a GET (the response is still cached)
 * @param timeout bound for a single attempt, or {@code null} for the client default
 * @param retryPolicy override of the verb's retry policy, or {@code null}
 */
public record RequestOptions(
    Map<String, String> params, boolean skipCache, Duration timeout, RetryPolicy retryPolicy) {

  private static final RequestOptions DEFAULTS = new RequestOptions(Map.of(), false, null, null);

  public RequestOptions {
    params = params == null ? Map.of() : copyWithoutNulls(params);
    if (timeout != null && (timeout.isNegative() || timeout.isZero())) {
      throw new IllegalArgumentException("timeout must be positive");
    }
  }

  public static RequestOptions defaults() {
    return DEFAULTS;
  }

  public static RequestOptions withParams(Map<String, String> params) {
    return new RequestOptions(params, false, null, null);
  }

  public RequestOptions skippingCache() {
    return new RequestOptions(params, true, timeout, retryPolicy);
  }

  public RequestOptions withTimeout(Duration value) {
    return new RequestOptions(params, skipCache, value, retryPolicy);
  }

  public RequestOptions withRetryPolicy(RetryPolicy value) {
    return new RequestOptions(params, skipCache, timeout, value);
  }

  private static Map<String, String> copyWithoutNulls(Map<String, String> source) {
    final Map<String, String> copy = new LinkedHashMap<>();
    source.forEach(
        (key, value) -> {
          if (key != null && value != null) {
            copy.put(key, value);
          }
        });
    return Map.copyOf(copy);
  }
}
