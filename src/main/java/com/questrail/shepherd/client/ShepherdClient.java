package com.questrail.shepherd.client;

import com.questrail.shepherd.protocol.model.Exit;
import com.questrail.shepherd.protocol.model.Spawn;
import com.questrail.shepherd.protocol.model.Welcome;

import java.nio.file.Path;
import java.util.concurrent.CompletableFuture;
import java.util.function.Consumer;

/**
 * ShepherdClient
 * =============================================================================
 * A controller's connection to one shepherd.
 *
 * <h2>Handlers</h2>
 * Each notification has a single handler slot; setting a handler replaces the
 * previous one and {@code null} clears it. Handlers run on the transport's
 * callback thread and must not block. A handler that throws is logged and
 * otherwise ignored.
 * <ul>
 *   <li>{@code data}: worker output, including output buffered during the
 *       handshake, in production order</li>
 *   <li>{@code exit}: the shepherd reported that the worker exited</li>
 *   <li>{@code close}: the connection went away after the handshake began</li>
 *   <li>{@code error}: a post-handshake failure; dropped with a log line when
 *       no handler is installed</li>
 *   <li>{@code versionWarning}: the shepherd is older than this controller</li>
 * </ul>
 *
 * <h2>Sends</h2>
 * {@link #write}, {@link #resize}, {@link #kill}, {@link #spawn} and
 * {@link #ping} are dropped unless the client is CONNECTED.
 */
public interface ShepherdClient
{
    /**
     * Open the socket and perform the HELLO/WELCOME handshake.
     *
     * <p>The future completes with the WELCOME once the client is CONNECTED
     * and every frame received before WELCOME has been delivered. It fails
     * with {@link ShepherdConnectException} (or its subtype
     * {@link VersionMismatchException}) otherwise. May be called once.</p>
     */
    CompletableFuture<Welcome> connect();

    void write(byte[] bytes);

    void resize(int cols, int rows);

    /**
     * Ask the shepherd to signal its worker and mark this connection as
     * detached: a close that follows is expected, not a failure.
     */
    void kill(int signal);

    void spawn(Spawn request);

    void ping();

    /**
     * Close the connection. Idempotent.
     */
    void disconnect();

    /**
     * Replay bytes from WELCOME, or {@code null} before WELCOME arrived.
     */
    byte[] getReplayData();

    ClientState state();

    default boolean isConnected()
    {
        return state() == ClientState.CONNECTED;
    }

    boolean isDetached();

    Path socketPath();

    void onData(Consumer<byte[]> handler);

    void onExit(Consumer<Exit> handler);

    void onClose(Runnable handler);

    void onError(Consumer<Throwable> handler);

    void onVersionWarning(Consumer<VersionWarning> handler);
}
