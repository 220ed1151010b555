package com.finly.api_client.model;

import java.time.Instant;

/** Published after a failed token refresh wiped the local session. */
public record SessionExpiredEvent(String reason, Instant occurredAt) {}
