package com.questrail.shepherd.session;

import com.questrail.shepherd.client.ShepherdClient;
import com.questrail.shepherd.internal.time.Cancellable;
import com.questrail.shepherd.protocol.model.Exit;
import com.questrail.shepherd.protocol.model.Spawn;

import java.nio.file.Path;
import java.time.Instant;

/**
 * Registry entry for one session.
 *
 * <p>Mutable state is confined to the manager's serial callback context. The
 * fields read by {@link #info()} from other threads are volatile.</p>
 */
final class ManagedSession {
    final String id;
    final Path socketPath;
    final ShepherdClient client;
    final RestartPolicy policy;
    /** Replacement worker request, {@code null} for reconnected sessions. */
    final Spawn respawn;
    final Instant createdAt;

    volatile long pid;
    volatile long startTime;
    volatile int restartCount;
    volatile boolean restartOnExit;

    boolean registered;
    boolean removed;
    /** EXIT seen for the current worker; cleared when a replacement is spawned. */
    boolean exitSeen;

    /** Events that arrived while the handshake was still in progress. */
    Exit pendingExit;
    boolean pendingClose;

    Cancellable restartTimer;
    Cancellable resetTimer;

    ManagedSession(String id, Path socketPath, ShepherdClient client, RestartPolicy policy,
                   Spawn respawn, Instant createdAt) {
        this.id = id;
        this.socketPath = socketPath;
        this.client = client;
        this.policy = policy;
        this.respawn = respawn;
        this.createdAt = createdAt;
        this.restartOnExit = policy.restartOnExit() && respawn != null;
    }

    void cancelTimers() {
        if (restartTimer != null) {
            restartTimer.cancel();
            restartTimer = null;
        }
        if (resetTimer != null) {
            resetTimer.cancel();
            resetTimer = null;
        }
    }

    SessionInfo info() {
        return new SessionInfo(id, pid, startTime, socketPath, createdAt, restartOnExit, restartCount);
    }

    @Override
    public String toString() {
        return "ManagedSession{" + id + ", pid=" + pid + ", restarts=" + restartCount + "}";
    }
}
