package com.questrail.shepherd.observability;

import java.time.Instant;

/**
 * A session's worker exited.
 *
 * @param code   exit status, {@code null} if unavailable
 * @param signal terminating signal name, {@code null} if none
 */
public record SessionExitEvent(
    Instant timestamp,
    String sessionId,
    Integer code,
    String signal
) {
}
