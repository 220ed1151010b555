package com.finly.common;

import java.util.UUID;

public final class RequestIds {

  public static final String HEADER_NAME = "X-Request-Id";

  private RequestIds() {}

  public static String newRequestId() {
    return UUID.randomUUID().toString();
  }

  public static boolean isPresent(String requestId) {
    return requestId != null && !requestId.isBlank();
  }
}
