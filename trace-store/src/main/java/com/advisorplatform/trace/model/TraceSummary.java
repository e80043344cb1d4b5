package com.advisorplatform.trace.model;

import java.time.LocalDateTime;

/**
 * One line of the recent-correlations listing used by replay tooling.
 */
public record TraceSummary(
    String correlationId,
    long hopCount,
    LocalDateTime firstRecordedAt,
    LocalDateTime lastRecordedAt
) {}
