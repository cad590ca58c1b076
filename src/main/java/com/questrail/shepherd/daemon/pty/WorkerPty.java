package com.questrail.shepherd.daemon.pty;

/**
 * WorkerPty
 * -----------------------------------------------------------------------------
 * A running worker process attached to a pseudo-terminal.
 *
 * <p>Calls after the worker has exited are ignored. Output and exit are
 * reported to the {@link WorkerPtyListener} given at spawn time, from a
 * thread owned by the implementation.</p>
 */
public interface WorkerPty
{
    long pid();

    void write(byte[] bytes);

    void resize(int cols, int rows);

    /**
     * Deliver a signal to the worker.
     */
    void kill(int signal);

    boolean isAlive();
}
