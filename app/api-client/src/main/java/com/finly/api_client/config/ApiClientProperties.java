/*
 * どこで: API クライアント設定
 * 何を: バックエンド接続先とタイムアウト設定を保持する
 * なぜ: 環境ごとの baseUrl/timeout を外部化するため
 */
package com.finly.api_client.config;

import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "finly.api")
public record ApiClientProperties(
    String baseUrl, String apiVersion, Duration connectTimeout, Duration timeout) {

  public ApiClientProperties {
    baseUrl = baseUrl == null || baseUrl.isBlank() ? "https://api.finly.app" : trimSlash(baseUrl);
    apiVersion = apiVersion == null || apiVersion.isBlank() ? "v1" : apiVersion;
    connectTimeout = connectTimeout == null ? Duration.ofSeconds(10) : connectTimeout;
    timeout = timeout == null ? Duration.ofSeconds(30) : timeout;
  }

  public String versionedBaseUrl() {
    return baseUrl + "/api/" + apiVersion;
  }

  private static String trimSlash(String value) {
    return value.endsWith("/") ? value.substring(0, value.length() - 1) : value;
  }
}
