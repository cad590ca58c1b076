package com.questrail.shepherd.client;

import com.questrail.shepherd.protocol.ShepherdProtocol;
import com.questrail.shepherd.protocol.ShepherdWire;
import com.questrail.shepherd.protocol.VersionCheck;
import com.questrail.shepherd.protocol.codec.FramingException;
import com.questrail.shepherd.protocol.internal.decode.ShepherdDecodeException;
import com.questrail.shepherd.protocol.internal.frame.FrameType;
import com.questrail.shepherd.protocol.internal.frame.ShepherdFrame;
import com.questrail.shepherd.protocol.model.*;
import com.questrail.shepherd.transport.StreamConnection;
import com.questrail.shepherd.transport.StreamConnectionListener;
import com.questrail.shepherd.transport.StreamConnector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.ArrayDeque;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Consumer;

/**
 * DefaultShepherdClient
 * =============================================================================
 * {@link ShepherdClient} over a {@link StreamConnector}.
 *
 * <h2>Handshake</h2>
 * <ol>
 *   <li>The socket opens; the client moves to HANDSHAKING and sends HELLO.</li>
 *   <li>Frames arriving before WELCOME are held in a bounded FIFO.</li>
 *   <li>WELCOME is decoded and the versions negotiated. On success the client
 *       becomes CONNECTED, then drains the FIFO through the same dispatch path
 *       as live frames, then completes the connect future. Frames that arrive
 *       later are dispatched after the drained ones.</li>
 * </ol>
 *
 * <h2>Threading</h2>
 * Inbound processing runs on the connector's callback thread. State is an
 * atomic reference so that sends and {@link #disconnect()} may be called from
 * any thread.
 */
public final class DefaultShepherdClient implements ShepherdClient
{
    private static final Logger log = LoggerFactory.getLogger(DefaultShepherdClient.class);

    public static final int DEFAULT_MAX_PENDING_FRAMES = 1024;

    private final Path socketPath;
    private final StreamConnector connector;
    private final int clientVersion;
    private final int maxPendingFrames;

    private final ShepherdWire wire = new ShepherdWire();
    private final AtomicReference<ClientState> state = new AtomicReference<>(ClientState.DISCONNECTED);
    private final AtomicBoolean closeReported = new AtomicBoolean();
    private final CompletableFuture<Welcome> connected = new CompletableFuture<>();

    /** Touched only on the callback thread. */
    private final ArrayDeque<ShepherdFrame> pending = new ArrayDeque<>();

    private volatile StreamConnection connection;
    private volatile byte[] replay;
    private volatile boolean detached;

    private volatile Consumer<byte[]> dataHandler;
    private volatile Consumer<Exit> exitHandler;
    private volatile Runnable closeHandler;
    private volatile Consumer<Throwable> errorHandler;
    private volatile Consumer<VersionWarning> versionWarningHandler;

    public DefaultShepherdClient(Path socketPath, StreamConnector connector)
    {
        this(socketPath, connector, ShepherdProtocol.PROTOCOL_VERSION, DEFAULT_MAX_PENDING_FRAMES);
    }

    public DefaultShepherdClient(Path socketPath, StreamConnector connector, int clientVersion, int maxPendingFrames)
    {
        this.socketPath = Objects.requireNonNull(socketPath, "socketPath");
        this.connector = Objects.requireNonNull(connector, "connector");
        if (maxPendingFrames <= 0) {
            throw new IllegalArgumentException("maxPendingFrames must be > 0");
        }
        this.clientVersion = clientVersion;
        this.maxPendingFrames = maxPendingFrames;
    }

    // -------------------------------------------------------------------------
    // Lifecycle
    // -------------------------------------------------------------------------

    @Override
    public CompletableFuture<Welcome> connect()
    {
        if (!transition(ClientState.DISCONNECTED, ClientState.CONNECTING)) {
            return CompletableFuture.failedFuture(
                    new IllegalStateException("connect() already called; state=" + state.get()));
        }

        final CompletableFuture<StreamConnection> opened;
        try {
            opened = connector.connect(socketPath, new Listener());
        }
        catch (RuntimeException e) {
            abortHandshake(new ShepherdConnectException("cannot connect to " + socketPath, e));
            return connected;
        }

        opened.whenComplete((conn, failure) -> {
            if (failure != null) {
                abortHandshake(new ShepherdConnectException("cannot connect to " + socketPath, unwrap(failure)));
            }
        });
        return connected;
    }

    @Override
    public void disconnect()
    {
        ClientState prev = state.getAndSet(ClientState.CLOSED);
        if (prev == ClientState.CLOSED) {
            return;
        }
        StreamConnection c = connection;
        if (c != null) {
            c.close();
        }
        connected.completeExceptionally(new ShepherdConnectException("disconnected before handshake completed"));
        if (prev.handshakeBegun()) {
            reportClose();
        }
    }

    @Override
    public ClientState state()
    {
        return state.get();
    }

    @Override
    public boolean isDetached()
    {
        return detached;
    }

    @Override
    public Path socketPath()
    {
        return socketPath;
    }

    @Override
    public byte[] getReplayData()
    {
        byte[] r = replay;
        return (r == null) ? null : r.clone();
    }

    // -------------------------------------------------------------------------
    // Sends
    // -------------------------------------------------------------------------

    @Override
    public void write(byte[] bytes)
    {
        Objects.requireNonNull(bytes, "bytes");
        send(new WriteInput(bytes));
    }

    @Override
    public void resize(int cols, int rows)
    {
        send(new Resize(cols, rows));
    }

    @Override
    public void kill(int signal)
    {
        detached = true;
        send(new Kill(signal));
    }

    @Override
    public void spawn(Spawn request)
    {
        Objects.requireNonNull(request, "request");
        send(request);
    }

    @Override
    public void ping()
    {
        send(new Ping());
    }

    private void send(ClientMessage message)
    {
        StreamConnection c = connection;
        if (state.get() != ClientState.CONNECTED || c == null) {
            log.debug("dropping {} to {}: not connected", message.getClass().getSimpleName(), socketPath);
            return;
        }
        c.send(wire.encode(message));
    }

    // -------------------------------------------------------------------------
    // Handlers
    // -------------------------------------------------------------------------

    @Override
    public void onData(Consumer<byte[]> handler)
    {
        this.dataHandler = handler;
    }

    @Override
    public void onExit(Consumer<Exit> handler)
    {
        this.exitHandler = handler;
    }

    @Override
    public void onClose(Runnable handler)
    {
        this.closeHandler = handler;
    }

    @Override
    public void onError(Consumer<Throwable> handler)
    {
        this.errorHandler = handler;
    }

    @Override
    public void onVersionWarning(Consumer<VersionWarning> handler)
    {
        this.versionWarningHandler = handler;
    }

    /**
     * The single path for post-handshake errors. Never throws.
     */
    private void emitError(Throwable error)
    {
        Consumer<Throwable> h = errorHandler;
        if (h == null) {
            log.warn("shepherd client {} error (no handler installed): {}", socketPath, error.toString());
            return;
        }
        invoke("error", () -> h.accept(error));
    }

    private void reportClose()
    {
        if (!closeReported.compareAndSet(false, true)) {
            return;
        }
        Runnable h = closeHandler;
        if (h != null) {
            invoke("close", h);
        }
    }

    private void invoke(String slot, Runnable call)
    {
        try {
            call.run();
        }
        catch (RuntimeException e) {
            log.error("{} handler of shepherd client {} threw", slot, socketPath, e);
        }
    }

    // -------------------------------------------------------------------------
    // Inbound
    // -------------------------------------------------------------------------

    private boolean transition(ClientState from, ClientState to)
    {
        if (!from.canTransitionTo(to)) {
            throw new IllegalArgumentException(from + " -> " + to);
        }
        return state.compareAndSet(from, to);
    }

    /**
     * Fail the connect attempt and tear down. No-op once CONNECTED or CLOSED.
     */
    private void abortHandshake(ShepherdConnectException cause)
    {
        ClientState prev = state.get();
        while (prev == ClientState.CONNECTING || prev == ClientState.HANDSHAKING) {
            if (state.compareAndSet(prev, ClientState.CLOSED)) {
                log.debug("connect to {} failed: {}", socketPath, cause.getMessage());
                pending.clear();
                StreamConnection c = connection;
                if (c != null) {
                    c.close();
                }
                connected.completeExceptionally(cause);
                if (prev.handshakeBegun()) {
                    reportClose();
                }
                return;
            }
            prev = state.get();
        }
    }

    private void onFrames(List<ShepherdFrame> frames)
    {
        for (ShepherdFrame frame : frames) {
            ClientState s = state.get();
            if (s == ClientState.HANDSHAKING) {
                if (frame.type().filter(t -> t == FrameType.WELCOME).isPresent()) {
                    completeHandshake(frame);
                }
                else if (pending.size() >= maxPendingFrames) {
                    abortHandshake(new ShepherdConnectException(
                            "more than " + maxPendingFrames + " frames received before WELCOME"));
                    return;
                }
                else {
                    pending.addLast(frame);
                }
            }
            else if (s == ClientState.CONNECTED) {
                dispatch(frame);
            }
            else {
                return;
            }
        }
    }

    private void completeHandshake(ShepherdFrame frame)
    {
        final Welcome welcome;
        try {
            Optional<ServerMessage> decoded = wire.messages().decodeServer(frame);
            welcome = (Welcome) decoded.orElseThrow();
        }
        catch (ShepherdDecodeException e) {
            abortHandshake(new ShepherdConnectException("invalid WELCOME from " + socketPath, e));
            return;
        }

        VersionCheck check = ShepherdProtocol.negotiate(clientVersion, welcome.protocolVersion());
        if (check == VersionCheck.REJECT) {
            log.warn("shepherd at {} speaks protocol {} > {}: {}", socketPath,
                    welcome.protocolVersion(), clientVersion, ShepherdProtocol.STALE_SHEPHERD_MESSAGE);
            abortHandshake(new VersionMismatchException(clientVersion, welcome.protocolVersion()));
            return;
        }

        replay = welcome.replay();
        if (!transition(ClientState.HANDSHAKING, ClientState.CONNECTED)) {
            return;
        }

        if (check == VersionCheck.WARN) {
            log.warn("shepherd at {} speaks older protocol {} (client {})", socketPath,
                    welcome.protocolVersion(), clientVersion);
            Consumer<VersionWarning> h = versionWarningHandler;
            if (h != null) {
                VersionWarning warning = new VersionWarning(clientVersion, welcome.protocolVersion());
                invoke("version-warning", () -> h.accept(warning));
            }
        }

        while (!pending.isEmpty() && state.get() == ClientState.CONNECTED) {
            dispatch(pending.removeFirst());
        }
        pending.clear();

        connected.complete(welcome);
    }

    private void dispatch(ShepherdFrame frame)
    {
        final Optional<ServerMessage> decoded;
        try {
            decoded = wire.messages().decodeServer(frame);
        }
        catch (ShepherdDecodeException e) {
            emitError(e);
            return;
        }
        if (decoded.isEmpty()) {
            return;
        }

        ServerMessage message = decoded.get();
        if (message instanceof Data data) {
            Consumer<byte[]> h = dataHandler;
            if (h != null) {
                invoke("data", () -> h.accept(data.bytes()));
            }
        }
        else if (message instanceof Exit exit) {
            Consumer<Exit> h = exitHandler;
            if (h != null) {
                invoke("exit", () -> h.accept(exit));
            }
        }
        else if (message instanceof Pong) {
            log.trace("pong from {}", socketPath);
        }
        // A second WELCOME is ignored.
    }

    private static Throwable unwrap(Throwable t)
    {
        Throwable c = t;
        while (c instanceof java.util.concurrent.CompletionException && c.getCause() != null) {
            c = c.getCause();
        }
        return c;
    }

    /**
     * Transport callbacks; all delivered serially.
     */
    private final class Listener implements StreamConnectionListener
    {
        @Override
        public void onOpen(StreamConnection conn)
        {
            connection = conn;
            if (!transition(ClientState.CONNECTING, ClientState.HANDSHAKING)) {
                // disconnect() won the race.
                conn.close();
                return;
            }
            conn.send(wire.encode(new Hello(clientVersion)));
        }

        @Override
        public void onBytes(StreamConnection conn, byte[] bytes)
        {
            final List<ShepherdFrame> frames;
            try {
                frames = wire.frames(bytes);
            }
            catch (FramingException e) {
                if (state.get() == ClientState.CONNECTED) {
                    emitError(e);
                    disconnect();
                }
                else {
                    abortHandshake(new ShepherdConnectException("framing error during handshake", e));
                }
                return;
            }
            onFrames(frames);
        }

        @Override
        public void onClosed(StreamConnection conn, Throwable cause)
        {
            ClientState prev = state.get();
            if (prev == ClientState.CONNECTING || prev == ClientState.HANDSHAKING) {
                abortHandshake(new ShepherdConnectException("connection closed during handshake", cause));
                return;
            }

            prev = state.getAndSet(ClientState.CLOSED);
            if (prev == ClientState.CONNECTED) {
                if (cause != null) {
                    emitError(cause);
                }
                reportClose();
            }
        }
    }
}
