package com.questrail.shepherd.transport;

import java.io.IOException;
import java.nio.file.Path;
import java.util.function.Supplier;

/**
 * StreamBinder
 * -----------------------------------------------------------------------------
 * Server side of the socket transport.
 */
public interface StreamBinder
{
    /**
     * Bind and listen on a socket path.
     *
     * <p>Blocks until the socket file exists and is accepting. Each accepted
     * connection gets a fresh listener from {@code listeners}.</p>
     *
     * @throws IOException if the bind fails (path in use, directory missing,
     *         permissions)
     */
    StreamServer bind(Path socketPath, Supplier<? extends StreamConnectionListener> listeners) throws IOException;
}
