package com.finly.api_client.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "finly.api.revalidation")
public record RevalidationProperties(
    Integer corePoolSize, Integer maxPoolSize, Integer queueCapacity) {

  public RevalidationProperties {
    corePoolSize = corePoolSize == null || corePoolSize < 1 ? 2 : corePoolSize;
    maxPoolSize =
        maxPoolSize == null || maxPoolSize < corePoolSize
            ? Math.max(4, corePoolSize)
            : maxPoolSize;
    queueCapacity = queueCapacity == null || queueCapacity < 0 ? 50 : queueCapacity;
  }
}
