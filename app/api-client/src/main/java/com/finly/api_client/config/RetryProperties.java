package com.finly.api_client.config;

import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "finly.api.retry")
public record RetryProperties(
    Integer maxAttempts,
    Duration baseDelay,
    Double backoffMultiplier,
    Integer mutationMaxAttempts) {

  public RetryProperties {
    maxAttempts = maxAttempts == null || maxAttempts < 1 ? 4 : maxAttempts;
    baseDelay = baseDelay == null ? Duration.ofSeconds(1) : baseDelay;
    backoffMultiplier =
        backoffMultiplier == null || backoffMultiplier < 1.0d ? 2.0d : backoffMultiplier;
    mutationMaxAttempts =
        mutationMaxAttempts == null || mutationMaxAttempts < 1 ? 2 : mutationMaxAttempts;
  }

  public static RetryProperties defaults() {
    return new RetryProperties(null, null, null, null);
  }
}
