package com.finly.api_client.service;

import com.finly.api_client.config.CacheProperties;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/** Maps a mutated resource to the cache-key prefixes that a successful mutation must drop. */
public class InvalidationRules {

  private final Map<String, List<String>> rules;

  public InvalidationRules(CacheProperties properties) {
    final Map<String, List<String>> normalized = new LinkedHashMap<>();
    properties
        .invalidation()
        .forEach(
            (resource, prefixes) ->
                normalized.put(
                    CacheKeys.normalizePath(resource),
                    prefixes.stream().map(CacheKeys::normalizePath).distinct().toList()));
    this.rules = Map.copyOf(normalized);
  }

  public List<String> prefixesFor(String path) {
    final String resource = CacheKeys.resourceOf(path);
    return rules.getOrDefault(resource, List.of(resource));
  }
}
