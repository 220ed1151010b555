package com.finly.common.retry;

import java.time.Duration;

/** Notified once per scheduled retry, before the backoff sleep starts. */
@FunctionalInterface
public interface RetryListener {

  RetryListener NONE = (failedAttempt, delay, failure) -> {};

  void onRetry(int failedAttempt, Duration delay, RuntimeException failure);
}
