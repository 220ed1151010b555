package com.finly.api_client.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.finly.api_client.config.RetryProperties;
import com.finly.common.retry.RetryPolicy;
import java.time.Duration;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpMethod;

class RetryPoliciesTest {

  private final RetryPolicies policies = new RetryPolicies(RetryProperties.defaults());

  @Test
  void readPolicyRetriesTransientFailuresWithDoublingDelay() {
    final RetryPolicy read = policies.read();

    assertThat(read.maxAttempts()).isEqualTo(4);
    assertThat(read.delayAfter(1)).isEqualTo(Duration.ofSeconds(1));
    assertThat(read.delayAfter(2)).isEqualTo(Duration.ofSeconds(2));
    assertThat(read.delayAfter(3)).isEqualTo(Duration.ofSeconds(4));
    assertThat(read.shouldRetry(1, failure(ApiClientException.Reason.TRANSPORT, 0))).isTrue();
    assertThat(read.shouldRetry(1, failure(ApiClientException.Reason.TIMEOUT, 0))).isTrue();
    assertThat(read.shouldRetry(1, failure(ApiClientException.Reason.SERVER_ERROR, 502))).isTrue();
    assertThat(read.shouldRetry(4, failure(ApiClientException.Reason.SERVER_ERROR, 502)))
        .isFalse();
  }

  @Test
  void unauthorizedRateLimitedAndClientErrorsAreNeverRetried() {
    final RetryPolicy read = policies.read();

    assertThat(read.shouldRetry(1, failure(ApiClientException.Reason.UNAUTHORIZED, 401)))
        .isFalse();
    assertThat(read.shouldRetry(1, failure(ApiClientException.Reason.RATE_LIMITED, 429)))
        .isFalse();
    assertThat(read.shouldRetry(1, failure(ApiClientException.Reason.CLIENT_ERROR, 422)))
        .isFalse();
    assertThat(read.shouldRetry(1, new IllegalStateException("bug"))).isFalse();
  }

  @Test
  void createPolicyRetriesOnlyServiceUnavailable() {
    final RetryPolicy create = policies.forMethod(HttpMethod.POST);

    assertThat(create.maxAttempts()).isEqualTo(4);
    assertThat(create.shouldRetry(1, failure(ApiClientException.Reason.SERVER_ERROR, 503)))
        .isTrue();
    assertThat(create.shouldRetry(1, failure(ApiClientException.Reason.SERVER_ERROR, 500)))
        .isFalse();
    assertThat(create.shouldRetry(1, failure(ApiClientException.Reason.TRANSPORT, 0))).isFalse();
  }

  @Test
  void updateAndDeleteAllowOneRetry() {
    for (HttpMethod method : List.of(HttpMethod.PUT, HttpMethod.PATCH, HttpMethod.DELETE)) {
      final RetryPolicy policy = policies.forMethod(method);
      assertThat(policy.maxAttempts()).isEqualTo(2);
      assertThat(policy.shouldRetry(1, failure(ApiClientException.Reason.TIMEOUT, 0))).isTrue();
      assertThat(policy.shouldRetry(2, failure(ApiClientException.Reason.TIMEOUT, 0))).isFalse();
    }
    assertThat(policies.forMethod(HttpMethod.GET)).isSameAs(policies.read());
  }

  @Test
  void unsupportedMethodIsRejected() {
    assertThatThrownBy(() -> policies.forMethod(HttpMethod.OPTIONS))
        .isInstanceOf(IllegalArgumentException.class);
  }

  private static ApiClientException failure(ApiClientException.Reason reason, int status) {
    return new ApiClientException(reason, status, null, "failure", null, null);
  }
}
