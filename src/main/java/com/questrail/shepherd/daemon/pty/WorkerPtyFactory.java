package com.questrail.shepherd.daemon.pty;

import java.io.IOException;

/**
 * Port for starting workers. The production implementation is
 * {@link Pty4jWorkerPtyFactory}; tests substitute an in-memory fake.
 */
@FunctionalInterface
public interface WorkerPtyFactory
{
    WorkerPty spawn(WorkerCommand command, int cols, int rows, WorkerPtyListener listener) throws IOException;
}
