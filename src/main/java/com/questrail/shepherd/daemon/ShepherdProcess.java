package com.questrail.shepherd.daemon;

import com.questrail.shepherd.daemon.pty.WorkerCommand;
import com.questrail.shepherd.daemon.pty.WorkerPty;
import com.questrail.shepherd.daemon.pty.WorkerPtyFactory;
import com.questrail.shepherd.daemon.pty.WorkerPtyListener;
import com.questrail.shepherd.internal.os.ProcessStartTimes;
import com.questrail.shepherd.protocol.ShepherdProtocol;
import com.questrail.shepherd.protocol.ShepherdWire;
import com.questrail.shepherd.protocol.codec.FramingException;
import com.questrail.shepherd.protocol.internal.decode.ShepherdDecodeException;
import com.questrail.shepherd.protocol.internal.frame.FrameType;
import com.questrail.shepherd.protocol.internal.frame.ShepherdFrame;
import com.questrail.shepherd.protocol.model.*;
import com.questrail.shepherd.transport.StreamBinder;
import com.questrail.shepherd.transport.StreamConnection;
import com.questrail.shepherd.transport.StreamConnectionListener;
import com.questrail.shepherd.transport.StreamServer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.PosixFilePermissions;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * ShepherdProcess
 * =============================================================================
 * The testable core of the shepherd daemon: owns one worker on a PTY and
 * serves it to one controller at a time over a Unix domain socket.
 *
 * <h2>Connection model</h2>
 * <ul>
 *   <li>Frames received before HELLO are ignored.</li>
 *   <li>HELLO is always answered with WELCOME, whatever version it names;
 *       compatibility is the controller's decision.</li>
 *   <li>A later HELLO on another connection replaces (closes) the current
 *       controller.</li>
 *   <li>A connection that sends a malformed frame is closed; the worker and
 *       the other connections are unaffected.</li>
 * </ul>
 *
 * <h2>Worker model</h2>
 * The shepherd never restarts the worker on its own. A new worker is started
 * only by SPAWN, which first terminates a worker that is still running and
 * clears the replay buffer. Output and exit of a replaced worker are ignored.
 *
 * <h2>Threading</h2>
 * Connection callbacks arrive on the transport thread, worker callbacks on
 * the PTY reader thread. Both are serialised on this object's monitor.
 */
public final class ShepherdProcess
{
    private static final Logger log = LoggerFactory.getLogger(ShepherdProcess.class);

    /** Exit code reported when a SPAWN names a command that cannot be started. */
    static final int SPAWN_FAILED_EXIT_CODE = 127;

    private final WorkerPtyFactory ptyFactory;
    private final StreamBinder binder;
    private final Path socketPath;
    private final ShepherdProcessObserver observer;
    private final ReplayBuffer replay;

    private final long shepherdPid;
    private final long startTime;

    private final Set<Connection> connections = new LinkedHashSet<>();
    private Connection controller;

    private WorkerPty worker;
    private int generation;
    private boolean exited;
    private Integer exitCode;
    private String exitSignal;

    private int cols;
    private int rows;

    private StreamServer server;
    private boolean shutdown;

    public ShepherdProcess(WorkerPtyFactory ptyFactory,
                           StreamBinder binder,
                           Path socketPath,
                           int replayBufferLines,
                           ShepherdProcessObserver observer)
    {
        this.ptyFactory = Objects.requireNonNull(ptyFactory, "ptyFactory");
        this.binder = Objects.requireNonNull(binder, "binder");
        this.socketPath = Objects.requireNonNull(socketPath, "socketPath");
        this.observer = (observer == null) ? ShepherdProcessObserver.NOOP : observer;
        this.replay = new ReplayBuffer(replayBufferLines);
        this.shepherdPid = ProcessHandle.current().pid();
        this.startTime = ProcessStartTimes.currentProcessStartMillis();
    }

    /**
     * Start the first worker, then bind the socket and restrict it to the
     * owner.
     *
     * @throws IOException if the worker cannot be started or the bind fails.
     *         A worker that was already started is terminated.
     */
    public void start(WorkerCommand command, int cols, int rows) throws IOException
    {
        Objects.requireNonNull(command, "command");

        synchronized (this) {
            if (server != null || shutdown) {
                throw new IllegalStateException("shepherd already started");
            }
            this.cols = cols;
            this.rows = rows;
            spawnWorker(command);
        }

        final StreamServer bound;
        try {
            bound = binder.bind(socketPath, Connection::new);
        }
        catch (IOException e) {
            synchronized (this) {
                if (worker != null && worker.isAlive()) {
                    worker.kill(ShepherdProtocol.SIGTERM);
                }
            }
            throw e;
        }

        try {
            Files.setPosixFilePermissions(socketPath, PosixFilePermissions.fromString("rw-------"));
        }
        catch (IOException | UnsupportedOperationException e) {
            log.warn("could not restrict permissions of {}: {}", socketPath, e.toString());
        }

        synchronized (this) {
            server = bound;
        }
        log.info("shepherd listening on {} (pid={}, workerPid={})", socketPath, shepherdPid, workerPid());
    }

    /**
     * Terminate the worker, drop every connection and stop listening.
     * Idempotent.
     */
    public void shutdown()
    {
        final StreamServer toClose;
        final List<Connection> toDrop;
        synchronized (this) {
            if (shutdown) {
                return;
            }
            shutdown = true;
            if (worker != null && !exited) {
                worker.kill(ShepherdProtocol.SIGTERM);
            }
            toDrop = List.copyOf(connections);
            connections.clear();
            controller = null;
            toClose = server;
            server = null;
        }

        toDrop.forEach(c -> c.connection().ifPresent(StreamConnection::close));
        if (toClose != null) {
            toClose.close();
        }
        try {
            Files.deleteIfExists(socketPath);
        }
        catch (IOException e) {
            log.warn("could not remove socket {}: {}", socketPath, e.toString());
        }
        log.info("shepherd on {} shut down", socketPath);
    }

    public long shepherdPid()
    {
        return shepherdPid;
    }

    public long startTime()
    {
        return startTime;
    }

    public synchronized long workerPid()
    {
        return (worker == null) ? -1L : worker.pid();
    }

    public synchronized boolean hasExited()
    {
        return exited;
    }

    public synchronized byte[] replaySnapshot()
    {
        return replay.snapshot();
    }

    public Path socketPath()
    {
        return socketPath;
    }

    // -------------------------------------------------------------------------
    // Worker
    // -------------------------------------------------------------------------

    /** Caller holds the monitor. */
    private void spawnWorker(WorkerCommand command) throws IOException
    {
        final int gen = ++generation;
        exited = false;
        exitCode = null;
        exitSignal = null;
        worker = null;
        worker = ptyFactory.spawn(command, cols, rows, new WorkerBinding(gen));
        observer.onSpawn(worker.pid());
    }

    /**
     * Routes callbacks of one worker generation; callbacks from a replaced
     * worker are dropped.
     */
    private final class WorkerBinding implements WorkerPtyListener
    {
        private final int gen;

        private WorkerBinding(int gen)
        {
            this.gen = gen;
        }

        @Override
        public void onData(byte[] bytes)
        {
            synchronized (ShepherdProcess.this) {
                if (gen != generation || shutdown) {
                    return;
                }
                replay.append(bytes);
                if (controller != null) {
                    controller.send(new Data(bytes));
                }
            }
        }

        @Override
        public void onExit(Integer code, String signal)
        {
            synchronized (ShepherdProcess.this) {
                if (gen != generation) {
                    return;
                }
                recordExit(code, signal);
            }
        }
    }

    /** Caller holds the monitor. */
    private void recordExit(Integer code, String signal)
    {
        exited = true;
        exitCode = code;
        exitSignal = signal;
        log.info("worker exited: code={}, signal={}", code, signal);
        if (controller != null) {
            controller.send(new Exit(code, signal));
        }
        observer.onWorkerExit(code, signal);
    }

    // -------------------------------------------------------------------------
    // Connections
    // -------------------------------------------------------------------------

    /** Caller holds the monitor. */
    private void handle(Connection conn, ClientMessage message)
    {
        if (message instanceof Hello hello) {
            acceptHello(conn, hello);
            return;
        }
        if (conn != controller) {
            // Pre-HELLO frames and frames from a replaced controller.
            return;
        }

        if (message instanceof WriteInput m) {
            if (worker != null && !exited) {
                worker.write(m.bytes());
            }
        }
        else if (message instanceof Resize m) {
            cols = m.cols();
            rows = m.rows();
            if (worker != null && !exited) {
                worker.resize(m.cols(), m.rows());
            }
        }
        else if (message instanceof Kill m) {
            if (!ShepherdProtocol.isAllowedSignal(m.signal())) {
                log.warn("rejected KILL with signal {}: not in allowlist", m.signal());
                observer.onProtocolError("signal " + m.signal() + " not in allowlist");
                return;
            }
            if (worker != null && !exited) {
                worker.kill(m.signal());
            }
        }
        else if (message instanceof Spawn m) {
            respawn(m);
        }
        else if (message instanceof Ping) {
            conn.send(new Pong());
        }
    }

    /** Caller holds the monitor. */
    private void acceptHello(Connection conn, Hello hello)
    {
        if (conn == controller) {
            return;
        }
        log.info("HELLO: version={}", hello.version());

        if (controller != null) {
            log.info("replacing existing controller connection");
            Connection previous = controller;
            connections.remove(previous);
            previous.connection().ifPresent(StreamConnection::close);
        }
        controller = conn;

        conn.send(new Welcome(
                ShepherdProtocol.PROTOCOL_VERSION,
                shepherdPid,
                (worker == null) ? -1L : worker.pid(),
                startTime,
                cols,
                rows,
                replay.snapshot()));

        // A controller attaching after the worker died still learns about it.
        if (exited) {
            conn.send(new Exit(exitCode, exitSignal));
        }
        observer.onHello(hello.version());
    }

    /** Caller holds the monitor. */
    private void respawn(Spawn spawn)
    {
        long oldPid = (worker == null) ? -1L : worker.pid();
        log.info("SPAWN: command={}, replacing worker pid={}", spawn.command(), oldPid);

        if (worker != null && !exited) {
            worker.kill(ShepherdProtocol.SIGTERM);
        }
        replay.clear();

        try {
            spawnWorker(new WorkerCommand(spawn.command(), spawn.args(), spawn.cwd(), spawn.env()));
        }
        catch (IOException | RuntimeException e) {
            log.error("SPAWN of {} failed", spawn.command(), e);
            recordExit(SPAWN_FAILED_EXIT_CODE, null);
        }
    }

    /** Caller holds the monitor. */
    private void protocolError(Connection conn, String reason, Throwable cause)
    {
        log.warn("protocol error, closing connection: {}", reason, cause);
        observer.onProtocolError(reason);
        connections.remove(conn);
        if (controller == conn) {
            controller = null;
        }
        conn.connection().ifPresent(StreamConnection::close);
    }

    /**
     * Connection
     * -------------------------------------------------------------------------
     * Per-connection decoder state. One instance per accepted socket.
     */
    private final class Connection implements StreamConnectionListener
    {
        private final ShepherdWire wire = new ShepherdWire();
        private StreamConnection connection;

        Optional<StreamConnection> connection()
        {
            return Optional.ofNullable(connection);
        }

        void send(ServerMessage message)
        {
            if (connection != null) {
                connection.send(wire.encode(message));
            }
        }

        @Override
        public void onOpen(StreamConnection connection)
        {
            synchronized (ShepherdProcess.this) {
                this.connection = connection;
                if (shutdown) {
                    connection.close();
                    return;
                }
                connections.add(this);
            }
            log.debug("connection accepted");
        }

        @Override
        public void onBytes(StreamConnection connection, byte[] bytes)
        {
            synchronized (ShepherdProcess.this) {
                if (shutdown || !connections.contains(this)) {
                    return;
                }

                final List<ShepherdFrame> frames;
                try {
                    frames = wire.frames(bytes);
                }
                catch (FramingException e) {
                    protocolError(this, e.getMessage(), null);
                    return;
                }

                for (ShepherdFrame frame : frames) {
                    if (!connections.contains(this)) {
                        return;
                    }
                    // Before HELLO nothing is even decoded.
                    if (this != controller && frame.type().filter(t -> t == FrameType.HELLO).isEmpty()) {
                        continue;
                    }
                    final Optional<ClientMessage> message;
                    try {
                        message = wire.messages().decodeClient(frame);
                    }
                    catch (ShepherdDecodeException e) {
                        protocolError(this, e.getMessage(), e);
                        return;
                    }
                    message.ifPresent(m -> handle(this, m));
                }
            }
        }

        @Override
        public void onClosed(StreamConnection connection, Throwable cause)
        {
            synchronized (ShepherdProcess.this) {
                connections.remove(this);
                if (controller == this) {
                    controller = null;
                    log.info("controller disconnected{}", (cause == null) ? "" : ": " + cause);
                }
            }
        }
    }
}
