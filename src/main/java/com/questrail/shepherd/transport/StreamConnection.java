package com.questrail.shepherd.transport;

/**
 * StreamConnection
 * -----------------------------------------------------------------------------
 * One established Unix-domain-socket connection, seen from either end.
 *
 * <p>Writes are queued and flushed in call order. A send on a closed
 * connection is silently discarded; the owner learns about the close through
 * {@link StreamConnectionListener#onClosed(StreamConnection, Throwable)}.</p>
 */
public interface StreamConnection
{
    void send(byte[] bytes);

    /**
     * Close the connection. Idempotent. The listener's {@code onClosed} fires
     * once, asynchronously.
     */
    void close();

    boolean isOpen();
}
