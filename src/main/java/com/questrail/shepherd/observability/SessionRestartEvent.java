package com.questrail.shepherd.observability;

import java.time.Duration;
import java.time.Instant;

/**
 * A restart was scheduled.
 *
 * @param restartCount restarts used, including this one
 * @param maxRestarts  the session's budget
 * @param delay        how long until SPAWN is sent
 */
public record SessionRestartEvent(
    Instant timestamp,
    String sessionId,
    int restartCount,
    int maxRestarts,
    Duration delay
) {
}
