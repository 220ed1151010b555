package com.finly.api_client.config;

import com.finly.common.RequestIds;
import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.Map;
import org.slf4j.MDC;
import org.springframework.http.HttpRequest;
import org.springframework.http.client.ClientHttpRequestExecution;
import org.springframework.http.client.ClientHttpRequestInterceptor;
import org.springframework.http.client.ClientHttpResponse;

/**
 * Tags every outgoing request with an {@code X-Request-Id} header and exposes it, together with
 * the method and path, in the MDC while the call is running.
 */
public class RequestIdInterceptor implements ClientHttpRequestInterceptor {

  static final String MDC_REQUEST_ID = "request_id";
  static final String MDC_HTTP_METHOD = "http_method";
  static final String MDC_HTTP_PATH = "http_path";

  @Override
  public ClientHttpResponse intercept(
      HttpRequest request, byte[] body, ClientHttpRequestExecution execution) throws IOException {
    final String requestId = resolveRequestId(request);
    request.getHeaders().set(RequestIds.HEADER_NAME, requestId);

    final Map<String, String> previous = new LinkedHashMap<>();
    put(previous, MDC_REQUEST_ID, requestId);
    put(previous, MDC_HTTP_METHOD, request.getMethod().name());
    put(previous, MDC_HTTP_PATH, request.getURI().getPath());
    try {
      return execution.execute(request, body);
    } finally {
      previous.forEach(
          (key, value) -> {
            if (value == null) {
              MDC.remove(key);
            } else {
              MDC.put(key, value);
            }
          });
    }
  }

  private String resolveRequestId(HttpRequest request) {
    final String requestId = request.getHeaders().getFirst(RequestIds.HEADER_NAME);
    if (RequestIds.isPresent(requestId)) {
      return requestId;
    }
    return RequestIds.newRequestId();
  }

  private void put(Map<String, String> previous, String key, String value) {
    if (value == null || value.isBlank()) {
      return;
    }
    previous.put(key, MDC.get(key));
    MDC.put(key, value);
  }
}
