package com.finly.api_client.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record TokenPair(String accessToken, String refreshToken) {

  public TokenPair {
    if (accessToken == null || accessToken.isBlank()) {
      throw new IllegalArgumentException("accessToken is required");
    }
    if (refreshToken == null || refreshToken.isBlank()) {
      throw new IllegalArgumentException("refreshToken is required");
    }
  }

  // トークン値はログへ出さない
  @Override
  public String toString() {
    return "TokenPair[accessToken=***, refreshToken=***]";
  }
}
