package com.questrail.shepherd.internal.exec;

import java.util.concurrent.Executor;

/**
 * An {@link Executor} that runs tasks one at a time, in submission order, on a
 * single callback context.
 *
 * <p>State confined to that context needs no locking. Work submitted from
 * inside the context is still queued behind the task currently running.</p>
 */
public interface SerialExecutor extends Executor
{
    /**
     * {@code true} when the calling thread is the one running this executor's
     * tasks. Blocking waits must not be issued from that thread.
     */
    boolean inSerialContext();
}
