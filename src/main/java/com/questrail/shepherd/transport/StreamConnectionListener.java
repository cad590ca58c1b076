package com.questrail.shepherd.transport;

/**
 * StreamConnectionListener
 * -----------------------------------------------------------------------------
 * Callback sink for a {@link StreamConnection}.
 *
 * <p>Implementations deliver callbacks serially and in this order: one
 * {@link #onOpen}, any number of {@link #onBytes}, then exactly one
 * {@link #onClosed}. Bytes are a stream: a chunk may hold part of a frame or
 * several frames.</p>
 */
public interface StreamConnectionListener
{
    void onOpen(StreamConnection connection);

    void onBytes(StreamConnection connection, byte[] bytes);

    /**
     * @param cause the failure that tore the connection down, or {@code null}
     *              for an orderly close by either peer
     */
    void onClosed(StreamConnection connection, Throwable cause);
}
