package com.questrail.shepherd.observability;

/**
 * Receives session lifecycle notifications from the session manager.
 * Implementations can provide logging, metrics, or UI updates.
 *
 * <p>Callbacks run on the manager's callback thread and must not block. An
 * exception thrown by a sink is logged and ignored.</p>
 */
public interface SessionEventSink {
    /**
     * The worker of a session exited (reported by its shepherd).
     */
    void onSessionExit(SessionExitEvent event);

    /**
     * A restart has been scheduled for a session whose worker exited.
     */
    void onSessionRestart(SessionRestartEvent event);

    /**
     * A session failed: its shepherd went away, the restart budget ran out,
     * or its client reported an error.
     */
    void onSessionError(SessionErrorEvent event);

    /**
     * A session left the registry.
     */
    void onSessionRemoved(SessionRemovedEvent event);
}
