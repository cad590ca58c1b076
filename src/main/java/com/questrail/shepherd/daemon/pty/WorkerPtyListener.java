package com.questrail.shepherd.daemon.pty;

/**
 * Receives a worker's output and its exit, in that order.
 */
public interface WorkerPtyListener
{
    void onData(byte[] bytes);

    /**
     * Called exactly once, after the last {@link #onData}.
     *
     * @param code   exit status, or {@code null} if unavailable
     * @param signal terminating signal name, or {@code null}
     */
    void onExit(Integer code, String signal);
}
