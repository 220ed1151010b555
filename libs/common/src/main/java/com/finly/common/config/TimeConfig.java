/*
 * どこで: Common 共通設定
 * 何を: Clock と Sleeper を DI 可能にする
 * なぜ: キャッシュ鮮度判定とリトライ待機をテストで固定・記録できるようにするため
 */
package com.finly.common.config;

import com.finly.common.retry.Sleeper;
import java.time.Clock;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration(proxyBeanMethods = false)
public class TimeConfig {

  @Bean
  @ConditionalOnMissingBean
  public Clock clock() {
    return Clock.systemUTC();
  }

  @Bean
  @ConditionalOnMissingBean
  public Sleeper sleeper() {
    return Sleeper.threadSleeper();
  }
}
