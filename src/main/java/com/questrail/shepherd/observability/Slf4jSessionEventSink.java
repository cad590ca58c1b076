package com.questrail.shepherd.observability;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Production implementation of SessionEventSink that emits logs via SLF4J.
 */
public final class Slf4jSessionEventSink implements SessionEventSink {
    private static final Logger log = LoggerFactory.getLogger(Slf4jSessionEventSink.class);

    @Override
    public void onSessionExit(SessionExitEvent event) {
        log.info("Session {} exited: code={}, signal={}", event.sessionId(), event.code(), event.signal());
    }

    @Override
    public void onSessionRestart(SessionRestartEvent event) {
        log.info("Session {} restarting in {} ms ({}/{})",
            event.sessionId(),
            event.delay().toMillis(),
            event.restartCount(),
            event.maxRestarts());
    }

    @Override
    public void onSessionError(SessionErrorEvent event) {
        if (event.kind() == SessionErrorKind.CLIENT_ERROR) {
            log.warn("Session {} client error: {}", event.sessionId(), event.message(), event.cause());
        } else {
            log.error("Session {} {}: {}", event.sessionId(), event.kind(), event.message(), event.cause());
        }
    }

    @Override
    public void onSessionRemoved(SessionRemovedEvent event) {
        log.debug("Session {} removed ({})", event.sessionId(), event.reason());
    }
}
