/*
 * どこで: API クライアントの応答モデル
 * 何を: バックエンド共通の応答エンベロープを表現する
 * なぜ: success=false を非 2xx と同じ失敗として扱うため
 */
package com.finly.api_client.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.JsonNode;

@JsonIgnoreProperties(ignoreUnknown = true)
public record ApiEnvelope(Boolean success, JsonNode data, String message, ErrorBody error) {

  public boolean isSuccess() {
    return Boolean.TRUE.equals(success);
  }

  @JsonIgnoreProperties(ignoreUnknown = true)
  public record ErrorBody(String code, String message, Integer statusCode, JsonNode details) {}
}
