package io.b2mash.opsdesk.projection;

public record ProjectionStatus(
    int pending,
    Long oldestPendingAgeMillis,
    long projected,
    long superseded,
    long failedAttempts) {}
