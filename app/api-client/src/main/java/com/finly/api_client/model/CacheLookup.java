package com.finly.api_client.model;

import com.fasterxml.jackson.databind.JsonNode;
import java.time.Duration;

public record CacheLookup(JsonNode payload, Freshness freshness, Duration age) {

  public static CacheLookup miss() {
    return new CacheLookup(null, Freshness.MISS, Duration.ZERO);
  }

  public boolean isUsable() {
    return freshness != Freshness.MISS;
  }
}
