package com.questrail.shepherd.session;

import java.nio.file.Path;
import java.time.Instant;

/**
 * Snapshot of a registered session.
 *
 * @param pid          shepherd process id
 * @param startTime    shepherd start time in epoch milliseconds
 * @param restartCount restarts used in the current reset window
 */
public record SessionInfo(
    String sessionId,
    long pid,
    long startTime,
    Path socketPath,
    Instant createdAt,
    boolean restartOnExit,
    int restartCount
) {
}
