package com.questrail.shepherd.observability;

public enum SessionErrorKind {
    /** The connection closed without a preceding EXIT. */
    DISCONNECTED_UNEXPECTEDLY,
    /** The worker exited with no restarts left. */
    RESTART_BUDGET_EXHAUSTED,
    /** The client reported a protocol or socket error. */
    CLIENT_ERROR
}
