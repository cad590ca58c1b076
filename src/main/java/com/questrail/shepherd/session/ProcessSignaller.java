package com.questrail.shepherd.session;

import java.time.Duration;

/**
 * Signals shepherd processes by pid.
 */
public interface ProcessSignaller {
    /**
     * @return {@code true} if the signal was delivered
     */
    boolean signal(long pid, int signal);

    boolean isAlive(long pid);

    /**
     * Block until the process is gone or the timeout elapses.
     *
     * @return {@code true} if the process is gone
     */
    boolean awaitExit(long pid, Duration timeout);
}
