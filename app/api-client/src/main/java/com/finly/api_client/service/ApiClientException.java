/*
 * どこで: API クライアントのサービス層
 * 何を: バックエンド呼び出しの最終的な失敗を分類付きで表現する
 * なぜ: 呼び出し側がステータス・エラーコード・メッセージで UI 挙動を決められるようにするため
 */
package com.finly.api_client.service;

import com.fasterxml.jackson.databind.JsonNode;

public class ApiClientException extends RuntimeException {

  public enum Reason {
    TRANSPORT,
    TIMEOUT,
    SERVER_ERROR,
    CLIENT_ERROR,
    UNAUTHORIZED,
    RATE_LIMITED,
    REFRESH_FAILED,
    INVALID_RESPONSE
  }

  private final Reason reason;
  private final int status;
  private final String errorCode;
  private final transient JsonNode details;

  public ApiClientException(Reason reason, String message) {
    this(reason, 0, null, message, null, null);
  }

  public ApiClientException(Reason reason, String message, Throwable cause) {
    this(reason, 0, null, message, null, cause);
  }

  public ApiClientException(
      Reason reason,
      int status,
      String errorCode,
      String message,
      JsonNode details,
      Throwable cause) {
    super(message, cause);
    this.reason = reason;
    this.status = status;
    this.errorCode = errorCode;
    this.details = details;
  }

  public static Reason reasonForStatus(int status) {
    if (status == 401) {
      return Reason.UNAUTHORIZED;
    }
    if (status == 429) {
      return Reason.RATE_LIMITED;
    }
    if (status >= 500 && status <= 599) {
      return Reason.SERVER_ERROR;
    }
    return Reason.CLIENT_ERROR;
  }

  public Reason reason() {
    return reason;
  }

  /** HTTP status, or 0 when no response was received. */
  public int status() {
    return status;
  }

  public String errorCode() {
    return errorCode;
  }

  public JsonNode details() {
    return details;
  }
}
