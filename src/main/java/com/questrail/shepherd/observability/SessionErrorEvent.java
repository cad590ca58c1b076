package com.questrail.shepherd.observability;

import java.time.Instant;

/**
 * Record representing a session failure.
 */
public record SessionErrorEvent(
    Instant timestamp,
    String sessionId,
    SessionErrorKind kind,
    String message,
    Throwable cause
) {
}
