package com.questrail.shepherd.transport;

import java.nio.file.Path;
import java.time.Duration;
import java.util.concurrent.CompletableFuture;

/**
 * StreamConnector
 * -----------------------------------------------------------------------------
 * Client side of the socket transport.
 */
public interface StreamConnector
{
    /**
     * Connect to a listening socket.
     *
     * <p>The future fails if nothing accepts the connection (missing file,
     * refused). After it succeeds all further news arrives through the
     * listener.</p>
     */
    CompletableFuture<StreamConnection> connect(Path socketPath, StreamConnectionListener listener);

    /**
     * Check whether anything is accepting connections on a socket path.
     *
     * <p>Completes with {@code true} when a connection is established within
     * {@code timeout} (the connection is closed again immediately), with
     * {@code false} on refusal, any other failure or timeout. Never completes
     * exceptionally.</p>
     */
    CompletableFuture<Boolean> probe(Path socketPath, Duration timeout);
}
