/*
 * どこで: API クライアント設定
 * 何を: RestClient・トークン管理・キャッシュ・リクエストパイプラインを Bean として組み立てる
 * なぜ: jar を追加して finly.api.base-url を設定するだけで利用できるようにするため
 */
package com.finly.api_client.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.finly.api_client.service.ApiClientMetrics;
import com.finly.api_client.service.ApiExchange;
import com.finly.api_client.service.AuthClient;
import com.finly.api_client.service.CachePolicies;
import com.finly.api_client.service.CacheStore;
import com.finly.api_client.service.InvalidationRules;
import com.finly.api_client.service.RequestPipeline;
import com.finly.api_client.service.RetryPolicies;
import com.finly.api_client.service.TokenManager;
import com.finly.api_client.store.RedisKeyValueStore;
import com.finly.common.config.TimeConfig;
import com.finly.common.retry.RetryExecutor;
import com.finly.common.retry.Sleeper;
import com.finly.common.store.InMemoryKeyValueStore;
import com.finly.common.store.PersistentKeyValueStore;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.net.http.HttpClient;
import java.time.Clock;
import java.util.concurrent.Executor;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Import;
import org.springframework.core.task.SimpleAsyncTaskExecutor;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.http.client.JdkClientHttpRequestFactory;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.web.client.RestClient;

@AutoConfiguration
@Import(TimeConfig.class)
@EnableConfigurationProperties({
  ApiClientProperties.class,
  AuthEndpointProperties.class,
  RetryProperties.class,
  CacheProperties.class,
  RevalidationProperties.class
})
public class ApiClientAutoConfiguration {

  @Bean
  @ConditionalOnMissingBean(name = "finlyApiRestClient")
  RestClient finlyApiRestClient(
      ObjectProvider<RestClient.Builder> builderProvider, ApiClientProperties properties) {
    final HttpClient httpClient =
        HttpClient.newBuilder().connectTimeout(properties.connectTimeout()).build();
    final JdkClientHttpRequestFactory requestFactory = new JdkClientHttpRequestFactory(httpClient);
    requestFactory.setReadTimeout(properties.timeout());
    return builderProvider
        .getIfAvailable(RestClient::builder)
        .baseUrl(properties.versionedBaseUrl())
        .requestFactory(requestFactory)
        .requestInterceptor(new RequestIdInterceptor())
        .build();
  }

  @Bean
  @ConditionalOnMissingBean
  ApiClientMetrics apiClientMetrics(ObjectProvider<MeterRegistry> meterRegistry) {
    return new ApiClientMetrics(meterRegistry.getIfAvailable(SimpleMeterRegistry::new));
  }

  @Bean
  @ConditionalOnMissingBean
  ApiExchange apiExchange(
      @Qualifier("finlyApiRestClient") RestClient finlyApiRestClient,
      ObjectProvider<ObjectMapper> objectMapper) {
    return new ApiExchange(finlyApiRestClient, objectMapper(objectMapper));
  }

  @Bean
  @ConditionalOnMissingBean
  RetryExecutor apiRetryExecutor(Sleeper sleeper, ApiClientMetrics metrics) {
    return new RetryExecutor(
        sleeper, (failedAttempt, delay, failure) -> metrics.recordRetry(failure));
  }

  @Bean
  @ConditionalOnMissingBean
  RetryPolicies retryPolicies(RetryProperties properties) {
    return new RetryPolicies(properties);
  }

  @Bean
  @ConditionalOnMissingBean
  CachePolicies cachePolicies(CacheProperties properties) {
    return new CachePolicies(properties);
  }

  @Bean
  @ConditionalOnMissingBean
  InvalidationRules invalidationRules(CacheProperties properties) {
    return new InvalidationRules(properties);
  }

  @Bean
  @ConditionalOnMissingBean
  TokenManager tokenManager(
      PersistentKeyValueStore store,
      ApiExchange apiExchange,
      AuthEndpointProperties authProperties,
      ApplicationEventPublisher eventPublisher,
      Clock clock,
      ApiClientMetrics metrics) {
    return new TokenManager(store, apiExchange, authProperties, eventPublisher, clock, metrics);
  }

  @Bean
  @ConditionalOnMissingBean
  CacheStore cacheStore(
      PersistentKeyValueStore store,
      ObjectProvider<ObjectMapper> objectMapper,
      CachePolicies cachePolicies,
      Clock clock,
      CacheProperties properties) {
    return new CacheStore(
        store, objectMapper(objectMapper), cachePolicies, clock, properties.maxEntries());
  }

  // 再検証は呼び出し元を待たせない。キュー満杯時は投入側で破棄する
  @Bean(name = "finlyRevalidationExecutor")
  @ConditionalOnMissingBean(name = "finlyRevalidationExecutor")
  ThreadPoolTaskExecutor finlyRevalidationExecutor(RevalidationProperties properties) {
    final ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
    executor.setCorePoolSize(properties.corePoolSize());
    executor.setMaxPoolSize(properties.maxPoolSize());
    executor.setQueueCapacity(properties.queueCapacity());
    executor.setThreadNamePrefix("finly-revalidate-");
    executor.setWaitForTasksToCompleteOnShutdown(false);
    executor.initialize();
    return executor;
  }

  @Bean
  @ConditionalOnMissingBean
  RequestPipeline requestPipeline(
      TokenManager tokenManager,
      CacheStore cacheStore,
      ApiExchange apiExchange,
      RetryExecutor retryExecutor,
      RetryPolicies retryPolicies,
      CachePolicies cachePolicies,
      InvalidationRules invalidationRules,
      AuthEndpointProperties authProperties,
      @Qualifier("finlyRevalidationExecutor") Executor revalidationExecutor,
      ApiClientMetrics metrics,
      ObjectProvider<ObjectMapper> objectMapper) {
    final SimpleAsyncTaskExecutor timeoutExecutor = new SimpleAsyncTaskExecutor("finly-request-");
    timeoutExecutor.setDaemon(true);
    return new RequestPipeline(
        tokenManager,
        cacheStore,
        apiExchange,
        retryExecutor,
        retryPolicies,
        cachePolicies,
        invalidationRules,
        authProperties,
        revalidationExecutor,
        timeoutExecutor,
        metrics,
        objectMapper(objectMapper));
  }

  @Bean
  @ConditionalOnMissingBean
  AuthClient authClient(
      RequestPipeline pipeline,
      TokenManager tokenManager,
      CacheStore cacheStore,
      PersistentKeyValueStore store,
      AuthEndpointProperties authProperties,
      ObjectProvider<ObjectMapper> objectMapper) {
    return new AuthClient(
        pipeline, tokenManager, cacheStore, store, authProperties, objectMapper(objectMapper));
  }

  private static ObjectMapper objectMapper(ObjectProvider<ObjectMapper> provider) {
    return provider.getIfAvailable(() -> new ObjectMapper().registerModule(new JavaTimeModule()));
  }

  @Configuration(proxyBeanMethods = false)
  @ConditionalOnProperty(
      prefix = "finly.api.store",
      name = "type",
      havingValue = "memory",
      matchIfMissing = true)
  static class InMemoryStoreConfiguration {

    @Bean
    @ConditionalOnMissingBean
    PersistentKeyValueStore persistentKeyValueStore() {
      return new InMemoryKeyValueStore();
    }
  }

  @Configuration(proxyBeanMethods = false)
  @ConditionalOnClass(StringRedisTemplate.class)
  @ConditionalOnProperty(prefix = "finly.api.store", name = "type", havingValue = "redis")
  static class RedisStoreConfiguration {

    @Bean
    @ConditionalOnMissingBean
    PersistentKeyValueStore persistentKeyValueStore(
        StringRedisTemplate redisTemplate,
        @Value("${finly.api.store.namespace:finly:}") String namespace) {
      return new RedisKeyValueStore(redisTemplate, namespace);
    }
  }
}
