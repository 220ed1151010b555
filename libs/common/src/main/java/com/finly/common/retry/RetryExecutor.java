/*
 * どこで: Common リトライ
 * 何を: 任意の失敗しうる操作を RetryPolicy に従って再実行する
 * なぜ: 一時的な障害を呼び出し側に見せずに吸収するため
 */
package com.finly.common.retry;

import java.time.Duration;
import java.util.Objects;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class RetryExecutor {

  private static final Logger logger = LoggerFactory.getLogger(RetryExecutor.class);

  private final Sleeper sleeper;
  private final RetryListener listener;

  public RetryExecutor(Sleeper sleeper) {
    this(sleeper, RetryListener.NONE);
  }

  public RetryExecutor(Sleeper sleeper, RetryListener listener) {
    this.sleeper = Objects.requireNonNull(sleeper, "sleeper is required");
    this.listener = listener == null ? RetryListener.NONE : listener;
  }

  public <T> T execute(Supplier<T> operation, RetryPolicy policy) {
    Objects.requireNonNull(operation, "operation is required");
    Objects.requireNonNull(policy, "policy is required");
    int attempt = 1;
    while (true) {
      try {
        return operation.get();
      } catch (RuntimeException ex) {
        // 最終試行または判定 NG の場合は待機せずに即座に伝播する
        if (!policy.shouldRetry(attempt, ex)) {
          throw ex;
        }
        final Duration delay = policy.delayAfter(attempt);
        logger.debug(
            "retrying after failure attempt={} maxAttempts={} delayMs={}",
            attempt,
            policy.maxAttempts(),
            delay.toMillis());
        listener.onRetry(attempt, delay, ex);
        pause(delay, ex);
        attempt++;
      }
    }
  }

  private void pause(Duration delay, RuntimeException lastFailure) {
    if (delay.isZero()) {
      return;
    }
    try {
      sleeper.sleep(delay);
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      lastFailure.addSuppressed(ex);
      throw lastFailure;
    }
  }
}
