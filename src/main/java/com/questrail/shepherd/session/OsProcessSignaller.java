package com.questrail.shepherd.session;

import com.questrail.shepherd.internal.os.ProcessSignals;

import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * {@link ProcessSignaller} for real processes.
 */
public final class OsProcessSignaller implements ProcessSignaller {
    public static final OsProcessSignaller INSTANCE = new OsProcessSignaller();

    private OsProcessSignaller() {}

    @Override
    public boolean signal(long pid, int signal) {
        return ProcessSignals.send(pid, signal);
    }

    @Override
    public boolean isAlive(long pid) {
        return ProcessSignals.isAlive(pid);
    }

    @Override
    public boolean awaitExit(long pid, Duration timeout) {
        Optional<ProcessHandle> handle = ProcessHandle.of(pid);
        if (handle.isEmpty()) {
            return true;
        }
        try {
            handle.get().onExit().get(timeout.toMillis(), TimeUnit.MILLISECONDS);
            return true;
        } catch (TimeoutException e) {
            return false;
        } catch (ExecutionException e) {
            return !handle.get().isAlive();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return !handle.get().isAlive();
        }
    }
}
