/*
 * どこで: Common リトライ
 * 何を: 試行回数・指数バックオフ・リトライ可否判定をまとめて表現する
 * なぜ: 操作種別ごとに異なるリトライ方針を同じ実行器で扱うため
 */
package com.finly.common.retry;

import java.time.Duration;
import java.util.Objects;
import java.util.function.Predicate;

public record RetryPolicy(
    int maxAttempts,
    Duration baseDelay,
    double backoffMultiplier,
    Predicate<RuntimeException> retryPredicate) {

  public static final double DEFAULT_BACKOFF_MULTIPLIER = 2.0d;

  public RetryPolicy {
    if (maxAttempts < 1) {
      throw new IllegalArgumentException("maxAttempts must be >= 1");
    }
    Objects.requireNonNull(baseDelay, "baseDelay is required");
    if (baseDelay.isNegative()) {
      throw new IllegalArgumentException("baseDelay must not be negative");
    }
    if (backoffMultiplier < 1.0d) {
      throw new IllegalArgumentException("backoffMultiplier must be >= 1");
    }
    Objects.requireNonNull(retryPredicate, "retryPredicate is required");
  }

  public static RetryPolicy of(
      int maxAttempts, Duration baseDelay, Predicate<RuntimeException> retryPredicate) {
    return new RetryPolicy(maxAttempts, baseDelay, DEFAULT_BACKOFF_MULTIPLIER, retryPredicate);
  }

  public static RetryPolicy noRetry() {
    return of(1, Duration.ZERO, failure -> false);
  }

  /**
   * Delay slept after the given failed attempt (1-indexed): {@code baseDelay *
   * backoffMultiplier^(failedAttempt - 1)}.
   */
  public Duration delayAfter(int failedAttempt) {
    if (failedAttempt < 1) {
      throw new IllegalArgumentException("failedAttempt must be >= 1");
    }
    final double millis = baseDelay.toMillis() * Math.pow(backoffMultiplier, failedAttempt - 1);
    return Duration.ofMillis((long) Math.ceil(millis));
  }

  public boolean shouldRetry(int failedAttempt, RuntimeException failure) {
    return failedAttempt < maxAttempts && retryPredicate.test(failure);
  }

  public RetryPolicy withMaxAttempts(int attempts) {
    return new RetryPolicy(attempts, baseDelay, backoffMultiplier, retryPredicate);
  }

  public RetryPolicy withRetryPredicate(Predicate<RuntimeException> predicate) {
    return new RetryPolicy(maxAttempts, baseDelay, backoffMultiplier, predicate);
  }
}
