package com.finly.api_client.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record AuthUser(
    String id, String name, String email, boolean emailVerified, String createdAt) {}
