package com.questrail.shepherd.daemon;

/**
 * Optional hook into shepherd lifecycle events. Callbacks run while the
 * shepherd holds its monitor and must return quickly.
 */
public interface ShepherdProcessObserver
{
    ShepherdProcessObserver NOOP = new ShepherdProcessObserver() { };

    default void onHello(int clientVersion) {
    }

    default void onSpawn(long workerPid) {
    }

    default void onWorkerExit(Integer code, String signal) {
    }

    default void onProtocolError(String reason) {
    }
}
