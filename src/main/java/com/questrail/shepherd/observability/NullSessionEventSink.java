package com.questrail.shepherd.observability;

/**
 * No-op implementation of SessionEventSink.
 */
public final class NullSessionEventSink implements SessionEventSink {
    public static final NullSessionEventSink INSTANCE = new NullSessionEventSink();

    private NullSessionEventSink() {}

    @Override
    public void onSessionExit(SessionExitEvent event) {}

    @Override
    public void onSessionRestart(SessionRestartEvent event) {}

    @Override
    public void onSessionError(SessionErrorEvent event) {}

    @Override
    public void onSessionRemoved(SessionRemovedEvent event) {}
}
