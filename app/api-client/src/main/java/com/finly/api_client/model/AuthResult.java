package com.finly.api_client.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record AuthResult(AuthUser user, TokenPair tokens) {}
