package com.finly.api_client.model;

import com.fasterxml.jackson.databind.JsonNode;
import java.time.Instant;

public record CacheEntry(String key, JsonNode payload, Instant storedAt) {}
