package com.questrail.shepherd.session;

/**
 * Carried by the terminal error notice of a session whose worker exited with
 * no restarts left. Never thrown to a caller.
 */
public final class RestartBudgetExhaustedException extends Exception {
    private final String sessionId;
    private final int maxRestarts;

    public RestartBudgetExhaustedException(String sessionId, int maxRestarts) {
        super("Session " + sessionId + " exhausted its restart budget (" + maxRestarts + ")");
        this.sessionId = sessionId;
        this.maxRestarts = maxRestarts;
    }

    public String sessionId() {
        return sessionId;
    }

    public int maxRestarts() {
        return maxRestarts;
    }
}
