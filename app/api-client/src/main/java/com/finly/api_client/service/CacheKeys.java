package com.finly.api_client.service;

import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.TreeMap;
import java.util.stream.Collectors;
import org.springframework.web.util.UriUtils;

public final class CacheKeys {

  private CacheKeys() {}

  /**
   * Derives the cache key for a request. Query parameters are sorted by name so that two
   * logically identical requests always map to the same key. Names and values are
   * percent-encoded, so {@code &} and {@code =} inside a value cannot split it into two
   * parameters.
   */
  public static String of(String path, Map<String, String> params) {
    final String normalizedPath = normalizePath(path);
    if (params == null || params.isEmpty()) {
      return normalizedPath;
    }
    final String query =
        new TreeMap<>(params)
            .entrySet().stream()
                .filter(entry -> entry.getValue() != null)
                .map(entry -> encode(entry.getKey()) + "=" + encode(entry.getValue()))
                .collect(Collectors.joining("&"));
    return query.isEmpty() ? normalizedPath : normalizedPath + "?" + query;
  }

  private static String encode(String value) {
    return UriUtils.encodeQueryParam(value, StandardCharsets.UTF_8);
  }

  public static String normalizePath(String path) {
    if (path == null || path.isBlank()) {
      throw new IllegalArgumentException("path is required");
    }
    String normalized = path.trim();
    while (normalized.startsWith("/")) {
      normalized = normalized.substring(1);
    }
    while (normalized.endsWith("/")) {
      normalized = normalized.substring(0, normalized.length() - 1);
    }
    if (normalized.isEmpty()) {
      throw new IllegalArgumentException("path is required");
    }
    if (normalized.indexOf('?') >= 0) {
      throw new IllegalArgumentException("query must be passed as params");
    }
    return normalized;
  }

  /** Path portion of a cache key, without the canonical query. */
  public static String pathOf(String key) {
    final int queryIndex = key.indexOf('?');
    return queryIndex < 0 ? key : key.substring(0, queryIndex);
  }

  /** First path segment, e.g. {@code expenses} for {@code expenses/42}. */
  public static String resourceOf(String path) {
    final String normalized = normalizePath(path);
    final int slash = normalized.indexOf('/');
    return slash < 0 ? normalized : normalized.substring(0, slash);
  }

  /** True when {@code path} equals {@code prefix} or lies below it. */
  public static boolean isUnder(String path, String prefix) {
    return path.equals(prefix) || path.startsWith(prefix + "/");
  }
}
