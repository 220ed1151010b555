package com.finly.api_client.model;

public enum Freshness {
  FRESH,
  STALE,
  MISS
}
