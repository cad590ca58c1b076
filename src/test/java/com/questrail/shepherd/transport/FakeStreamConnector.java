package com.questrail.shepherd.transport;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Connector whose connections are opened, refused and fed by the test.
 *
 * <p>{@link #connect} only records the attempt; call {@link #accept()} or
 * {@link #refuse()} to decide its outcome.</p>
 */
public final class FakeStreamConnector implements StreamConnector {
    private final Map<Path, Boolean> probeResults = new HashMap<>();

    private StreamConnectionListener listener;
    private CompletableFuture<StreamConnection> pending;
    private FakeStreamConnection connection;
    private int connectAttempts;

    @Override
    public synchronized CompletableFuture<StreamConnection> connect(Path socketPath, StreamConnectionListener listener) {
        connectAttempts++;
        this.listener = listener;
        this.pending = new CompletableFuture<>();
        return pending;
    }

    @Override
    public synchronized CompletableFuture<Boolean> probe(Path socketPath, Duration timeout) {
        return CompletableFuture.completedFuture(probeResults.getOrDefault(socketPath, false));
    }

    public synchronized void setProbeResult(Path socketPath, boolean alive) {
        probeResults.put(socketPath, alive);
    }

    /** Open the pending connection; the listener sees onOpen first. */
    public FakeStreamConnection accept() {
        FakeStreamConnection conn;
        CompletableFuture<StreamConnection> future;
        synchronized (this) {
            conn = new FakeStreamConnection(listener);
            connection = conn;
            future = pending;
        }
        listener.onOpen(conn);
        future.complete(conn);
        return conn;
    }

    public void refuse() {
        CompletableFuture<StreamConnection> future;
        synchronized (this) {
            future = pending;
        }
        future.completeExceptionally(new IOException("Connection refused"));
    }

    public synchronized FakeStreamConnection connection() {
        return connection;
    }

    public synchronized int connectAttempts() {
        return connectAttempts;
    }
}
