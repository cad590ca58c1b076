package com.questrail.shepherd.observability;

public enum RemovalReason {
    KILLED,
    EXITED,
    RESTART_BUDGET_EXHAUSTED,
    DISCONNECTED
}
