package com.finly.api_client.model;

import java.time.Instant;

public record TokensRefreshedEvent(Instant refreshedAt) {}
