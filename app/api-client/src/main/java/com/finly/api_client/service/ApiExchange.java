/*
 * どこで: API クライアントのサービス層
 * 何を: RestClient で 1 回の HTTP 呼び出しを行い、応答エンベロープを解釈する
 * なぜ: 下流失敗を ApiClientException の分類へ一貫変換するため
 */
package com.finly.api_client.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.NullNode;
import com.finly.api_client.model.ApiEnvelope;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.net.SocketTimeoutException;
import java.net.http.HttpTimeoutException;
import java.util.HashMap;
import java.util.Map;
import java.util.TreeMap;
import java.util.function.Consumer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientResponseException;

public class ApiExchange {

  private static final Logger logger = LoggerFactory.getLogger(ApiExchange.class);

  @SuppressFBWarnings(
      value = "EI_EXPOSE_REP2",
      justification = "RestClient は Spring 管理の共有コンポーネントで防御的コピーが不可能なため")
  private final RestClient apiRestClient;

  @SuppressFBWarnings(
      value = "EI_EXPOSE_REP2",
      justification = "ObjectMapper はスレッドセーフな共有コンポーネントのため")
  private final ObjectMapper objectMapper;

  public ApiExchange(RestClient apiRestClient, ObjectMapper objectMapper) {
    this.apiRestClient = apiRestClient;
    this.objectMapper = objectMapper;
  }

  /**
   * Sends one request and returns the envelope's {@code data} node ({@link NullNode} when the
   * response carries none).
   *
   * @throws ApiClientException for non-2xx responses, {@code success:false} envelopes, transport
   *     failures and unreadable bodies
   */
  public JsonNode exchange(
      HttpMethod method,
      String path,
      Map<String, String> params,
      Object body,
      Consumer<HttpHeaders> headers) {
    final String normalizedPath = CacheKeys.normalizePath(path);
    final String operation = method.name() + " " + normalizedPath;
    try {
      final RestClient.RequestBodySpec spec =
          apiRestClient
              .method(method)
              .uri(
                  uriBuilder -> {
                    uriBuilder.path("/" + normalizedPath);
                    // 値は URI テンプレートとして解釈させず、変数として展開・エンコードする
                    final Map<String, String> values = new HashMap<>();
                    if (params != null) {
                      new TreeMap<>(params)
                          .forEach(
                              (name, value) -> {
                                final String variable = "p" + values.size();
                                uriBuilder.queryParam(name, "{" + variable + "}");
                                values.put(variable, value);
                              });
                    }
                    return uriBuilder.build(values);
                  })
              .accept(MediaType.APPLICATION_JSON)
              .headers(headers == null ? ignored -> {} : headers);
      if (body != null) {
        spec.contentType(MediaType.APPLICATION_JSON).body(serialize(body));
      }
      return readData(spec.retrieve().body(String.class), operation);
    } catch (RestClientResponseException ex) {
      throw mapResponseException(ex, operation);
    } catch (ResourceAccessException ex) {
      throw mapResourceException(ex, operation);
    } catch (ApiClientException | IllegalArgumentException ex) {
      throw ex;
    } catch (RuntimeException ex) {
      logger.warn("api {} response parse failed", operation, ex);
      throw new ApiClientException(
          ApiClientException.Reason.INVALID_RESPONSE, "api response parse failed", ex);
    }
  }

  private String serialize(Object body) {
    if (body instanceof String text) {
      return text;
    }
    try {
      return objectMapper.writeValueAsString(body);
    } catch (JsonProcessingException ex) {
      throw new IllegalArgumentException("request body is not serializable", ex);
    }
  }

  private JsonNode readData(String raw, String operation) {
    if (raw == null || raw.isBlank()) {
      return NullNode.getInstance();
    }
    final JsonNode tree = readTree(raw);
    if (!tree.isObject() || !tree.has("success")) {
      return tree;
    }
    final ApiEnvelope envelope = toEnvelope(tree);
    if (!envelope.isSuccess()) {
      throw fromFailedEnvelope(envelope, operation);
    }
    return envelope.data() == null ? NullNode.getInstance() : envelope.data();
  }

  private ApiClientException fromFailedEnvelope(ApiEnvelope envelope, String operation) {
    final ApiEnvelope.ErrorBody error = envelope.error();
    // ステータス未指定の success=false は再試行しないクライアントエラーとして扱う
    final int status =
        error != null && error.statusCode() != null && error.statusCode() > 0
            ? error.statusCode()
            : 400;
    final ApiClientException.Reason reason = ApiClientException.reasonForStatus(status);
    logger.warn("api {} returned success=false status={} reason={}", operation, status, reason);
    return new ApiClientException(
        reason,
        status,
        error == null ? null : error.code(),
        resolveMessage(envelope, reason),
        error == null ? null : error.details(),
        null);
  }

  private ApiClientException mapResponseException(
      RestClientResponseException ex, String operation) {
    final int status = ex.getStatusCode().value();
    final ApiClientException.Reason reason = ApiClientException.reasonForStatus(status);
    logger.warn(
        "api {} failed with http status={} statusText={}", operation, status, ex.getStatusText());
    final ApiEnvelope envelope = parseErrorEnvelope(ex.getResponseBodyAsString());
    final ApiEnvelope.ErrorBody error = envelope == null ? null : envelope.error();
    return new ApiClientException(
        reason,
        status,
        error == null ? null : error.code(),
        resolveMessage(envelope, reason),
        error == null ? null : error.details(),
        ex);
  }

  private ApiClientException mapResourceException(ResourceAccessException ex, String operation) {
    if (isTimeout(ex)) {
      logger.warn("api {} timed out", operation);
      return new ApiClientException(ApiClientException.Reason.TIMEOUT, "api request timeout", ex);
    }
    logger.warn("api {} connection failed", operation, ex);
    return new ApiClientException(
        ApiClientException.Reason.TRANSPORT, "api connection failed", ex);
  }

  private ApiEnvelope parseErrorEnvelope(String raw) {
    if (raw == null || raw.isBlank()) {
      return null;
    }
    try {
      final JsonNode tree = objectMapper.readTree(raw);
      return tree.isObject() ? toEnvelope(tree) : null;
    } catch (JsonProcessingException | ApiClientException ex) {
      // エラー応答が JSON でない場合はステータスのみで分類する
      return null;
    }
  }

  private String resolveMessage(ApiEnvelope envelope, ApiClientException.Reason reason) {
    if (envelope != null) {
      if (envelope.error() != null && !isBlank(envelope.error().message())) {
        return envelope.error().message();
      }
      if (!isBlank(envelope.message())) {
        return envelope.message();
      }
    }
    return switch (reason) {
      case UNAUTHORIZED -> "api rejected credentials";
      case RATE_LIMITED -> "api rate limit exceeded";
      case SERVER_ERROR -> "api server error";
      default -> "api request failed";
    };
  }

  private JsonNode readTree(String raw) {
    try {
      return objectMapper.readTree(raw);
    } catch (JsonProcessingException ex) {
      throw new ApiClientException(
          ApiClientException.Reason.INVALID_RESPONSE, "api response is not json", ex);
    }
  }

  private ApiEnvelope toEnvelope(JsonNode tree) {
    try {
      return objectMapper.convertValue(tree, ApiEnvelope.class);
    } catch (IllegalArgumentException ex) {
      throw new ApiClientException(
          ApiClientException.Reason.INVALID_RESPONSE, "api response envelope is invalid", ex);
    }
  }

  private boolean isTimeout(ResourceAccessException ex) {
    Throwable current = ex;
    while (current != null) {
      if (current instanceof SocketTimeoutException || current instanceof HttpTimeoutException) {
        return true;
      }
      current = current.getCause();
    }
    return false;
  }

  private boolean isBlank(String value) {
    return value == null || value.isBlank();
  }
}
