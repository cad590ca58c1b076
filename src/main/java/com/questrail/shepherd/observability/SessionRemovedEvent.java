package com.questrail.shepherd.observability;

import java.time.Instant;

public record SessionRemovedEvent(
    Instant timestamp,
    String sessionId,
    RemovalReason reason
) {
}
