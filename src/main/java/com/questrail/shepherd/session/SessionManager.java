package com.questrail.shepherd.session;

import com.questrail.shepherd.client.DefaultShepherdClient;
import com.questrail.shepherd.client.ShepherdClient;
import com.questrail.shepherd.client.VersionMismatchException;
import com.questrail.shepherd.client.VersionWarning;
import com.questrail.shepherd.daemon.ShepherdLaunchConfig;
import com.questrail.shepherd.internal.exec.SerialExecutor;
import com.questrail.shepherd.internal.os.ProcessStartTimes;
import com.questrail.shepherd.internal.time.MonotonicClock;
import com.questrail.shepherd.internal.time.MonotonicScheduler;
import com.questrail.shepherd.internal.time.ScheduledExecutorScheduler;
import com.questrail.shepherd.internal.time.SystemMonotonicClock;
import com.questrail.shepherd.internal.time.SystemWallClock;
import com.questrail.shepherd.internal.time.WallClock;
import com.questrail.shepherd.observability.RemovalReason;
import com.questrail.shepherd.observability.SessionErrorEvent;
import com.questrail.shepherd.observability.SessionErrorKind;
import com.questrail.shepherd.observability.SessionEventSink;
import com.questrail.shepherd.observability.SessionExitEvent;
import com.questrail.shepherd.observability.SessionRemovedEvent;
import com.questrail.shepherd.observability.SessionRestartEvent;
import com.questrail.shepherd.protocol.ShepherdProtocol;
import com.questrail.shepherd.protocol.model.Exit;
import com.questrail.shepherd.protocol.model.Spawn;
import com.questrail.shepherd.protocol.model.Welcome;
import com.questrail.shepherd.transport.StreamConnector;
import com.questrail.shepherd.transport.netty.NettyDomainSocketTransport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.Path;
import java.nio.file.attribute.BasicFileAttributes;
import java.nio.file.attribute.PosixFilePermission;
import java.nio.file.attribute.PosixFilePermissions;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalLong;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;
import java.util.function.Supplier;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * SessionManager
 * =============================================================================
 * Controller-side registry of shepherd sessions.
 *
 * <h2>Lifecycle</h2>
 * A session enters the registry through {@link #createSession} (new shepherd)
 * or {@link #reconnectSession} (shepherd left running by a previous
 * controller). It leaves through exactly one of:
 * <ul>
 *   <li>{@link #killSession}: intentional;</li>
 *   <li>a worker exit with restart disabled or no restarts left;</li>
 *   <li>a connection close that was not preceded by EXIT.</li>
 * </ul>
 * All three funnel through {@code removeDeadSession}, which cancels timers,
 * drops the registry entry and unlinks the socket file.
 * {@link #shutdown()} only detaches: shepherds keep running headless and are
 * picked up again with {@link #reconnectSession} on the next start.
 *
 * <h2>Threading</h2>
 * Client callbacks and restart/reset timers all run on one serial callback
 * context, which is the only place session state changes. Public operations
 * hop onto it for registry mutations. Operations that wait (process launch,
 * socket poll, handshake, kill escalation, stale-socket probes) block the
 * calling thread and throw {@link IllegalStateException} when called from the
 * callback context.
 */
public final class SessionManager implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(SessionManager.class);

    /** Allowed difference between a recorded and an observed process start time. */
    public static final Duration START_TIME_TOLERANCE = Duration.ofSeconds(2);

    static final String SOCKET_PREFIX = "shepherd-";
    static final String SOCKET_SUFFIX = ".sock";

    private static final Pattern SESSION_ID = Pattern.compile("[A-Za-z0-9._-]{1,128}");
    private static final Set<PosixFilePermission> DIR_PERMISSIONS = PosixFilePermissions.fromString("rwx------");
    private static final Set<PosixFilePermission> SOCKET_PERMISSIONS = PosixFilePermissions.fromString("rw-------");

    private final SessionManagerConfig config;
    private final ShepherdClientFactory clientFactory;
    private final SerialExecutor executor;
    private final MonotonicScheduler scheduler;
    private final MonotonicClock clock;
    private final WallClock wallClock;
    private final StreamConnector prober;
    private final AutoCloseable ownedTransport;
    private final SessionEventSink sink;

    /** Mutated only on the serial callback context. */
    private final Map<String, ManagedSession> sessions = new ConcurrentHashMap<>();
    private final AtomicBoolean closed = new AtomicBoolean();

    SessionManager(SessionManagerConfig config,
                   ShepherdClientFactory clientFactory,
                   SerialExecutor executor,
                   MonotonicScheduler scheduler,
                   MonotonicClock clock,
                   WallClock wallClock,
                   StreamConnector prober,
                   AutoCloseable ownedTransport) {
        this.config = Objects.requireNonNull(config, "config");
        this.clientFactory = Objects.requireNonNull(clientFactory, "clientFactory");
        this.executor = Objects.requireNonNull(executor, "executor");
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.wallClock = Objects.requireNonNull(wallClock, "wallClock");
        this.prober = Objects.requireNonNull(prober, "prober");
        this.ownedTransport = ownedTransport;
        this.sink = config.eventSink();
    }

    /**
     * Build a manager that owns a Netty domain-socket transport. Its single
     * event loop is the serial callback context for clients and timers.
     */
    public static SessionManager create(SessionManagerConfig config) {
        Objects.requireNonNull(config, "config");
        NettyDomainSocketTransport transport = NettyDomainSocketTransport.create("shepherd-manager");
        MonotonicClock clock = SystemMonotonicClock.INSTANCE;
        return new SessionManager(
            config,
            path -> new DefaultShepherdClient(path, transport, config.clientProtocolVersion(), config.maxPendingFrames()),
            transport.serialExecutor(),
            new ScheduledExecutorScheduler(transport.callbackScheduler(), clock),
            clock,
            SystemWallClock.INSTANCE,
            transport,
            transport);
    }

    // -------------------------------------------------------------------------
    // Create / reconnect
    // -------------------------------------------------------------------------

    /**
     * Launch a shepherd running {@code command} and connect to it.
     *
     * <p>On failure the launched process is killed with SIGKILL and any socket
     * file it left is deleted before the exception is thrown.</p>
     */
    public SessionHandle createSession(String command, CreateSessionOptions options) throws SessionStartException {
        Objects.requireNonNull(command, "command");
        Objects.requireNonNull(options, "options");
        requireCallerThread("createSession");
        requireOpen("createSession");

        String sessionId = (options.sessionId() != null) ? options.sessionId() : UUID.randomUUID().toString();
        validateSessionId(sessionId);
        if (sessions.containsKey(sessionId)) {
            throw new SessionStartException("Session " + sessionId + " already exists");
        }

        Path socketPath = socketPathFor(sessionId);
        try {
            prepareSocketDir(config.socketDir());
            removeLeftoverSocket(socketPath);
        } catch (IOException | UnsupportedOperationException e) {
            throw new SessionStartException("Cannot prepare socket " + socketPath, e);
        }

        ShepherdLaunchConfig launchConfig = new ShepherdLaunchConfig(
            command, options.args(), options.cwd(), options.env(),
            options.cols(), options.rows(), socketPath.toString(), options.replayBufferLines());

        LaunchedShepherd launched;
        try {
            launched = config.launcher().launch(launchConfig);
        } catch (IOException e) {
            deleteSocketQuietly(socketPath);
            throw new SessionStartException("Failed to launch shepherd for session " + sessionId, e);
        }

        ShepherdClient client = null;
        try {
            awaitSocketFile(socketPath);
            ensureSocketMode(socketPath);

            client = clientFactory.create(socketPath);
            ManagedSession session = new ManagedSession(
                sessionId, socketPath, client, options.restartPolicy(),
                new Spawn(command, options.args(), options.cwd(), options.env()),
                wallClock.now());
            session.pid = launched.pid();
            session.startTime = launched.startTime();

            if (options.dataHandler() != null) {
                client.onData(options.dataHandler());
            }
            if (options.versionWarningHandler() != null) {
                client.onVersionWarning(options.versionWarningHandler());
            }
            attachHandlers(session);

            Welcome welcome = awaitHandshake(client);
            register(session);

            log.info("Created session {} (shepherd pid {}, socket {})", sessionId, launched.pid(), socketPath);
            return new SessionHandle(session.info(), client, welcome.replay());
        } catch (SessionStartException e) {
            rollback(sessionId, launched, client, socketPath);
            throw e;
        } catch (RuntimeException e) {
            rollback(sessionId, launched, client, socketPath);
            throw new SessionStartException("Failed to start session " + sessionId, e);
        }
    }

    /**
     * Attach to a shepherd left running by an earlier controller.
     *
     * <p>The socket is probed with a real handshake. If that fails and nothing
     * is listening on the socket any more, the file is deleted; either way the
     * result is empty. Reconnected sessions never restart: their first worker
     * exit removes them.</p>
     *
     * @throws SessionStartException if the id is already registered or the
     *                               shepherd speaks a newer protocol
     */
    public Optional<SessionHandle> reconnectSession(String sessionId, Path socketPath) throws SessionStartException {
        return reconnectSession(sessionId, socketPath, null);
    }

    /**
     * As {@link #reconnectSession(String, Path)}, installing
     * {@code versionWarningHandler} (may be {@code null}) before the handshake
     * so a warning raised by WELCOME reaches the caller.
     *
     * <p>A shepherd that accepts the connection but does not complete the
     * handshake keeps its socket file: it is deleted only when nothing is
     * listening on it any more.</p>
     */
    public Optional<SessionHandle> reconnectSession(String sessionId, Path socketPath,
                                                    Consumer<VersionWarning> versionWarningHandler)
        throws SessionStartException {
        Objects.requireNonNull(socketPath, "socketPath");
        requireCallerThread("reconnectSession");
        requireOpen("reconnectSession");
        validateSessionId(sessionId);
        if (sessions.containsKey(sessionId)) {
            throw new SessionStartException("Session " + sessionId + " already exists");
        }
        if (!isSocketFile(socketPath)) {
            log.debug("No socket at {} for session {}", socketPath, sessionId);
            return Optional.empty();
        }

        ShepherdClient client = clientFactory.create(socketPath);
        ManagedSession session = new ManagedSession(
            sessionId, socketPath, client, RestartPolicy.disabled(), null, wallClock.now());
        if (versionWarningHandler != null) {
            client.onVersionWarning(versionWarningHandler);
        }
        attachHandlers(session);

        Welcome welcome;
        try {
            welcome = awaitHandshake(client);
        } catch (SessionStartException e) {
            client.disconnect();
            if (e.getCause() instanceof VersionMismatchException) {
                throw e;
            }
            if (prober.probe(socketPath, config.probeTimeout()).join()) {
                log.warn("Shepherd for session {} is listening on {} but did not complete the handshake ({}); "
                    + "keeping the socket", sessionId, socketPath, e.getMessage());
                return Optional.empty();
            }
            log.info("Shepherd for session {} is gone ({}); removing {}", sessionId, e.getMessage(), socketPath);
            deleteSocketQuietly(socketPath);
            return Optional.empty();
        }

        session.pid = welcome.pid();
        session.startTime = welcome.startTime();
        try {
            register(session);
        } catch (SessionStartException e) {
            client.disconnect();
            throw e;
        }

        log.info("Reconnected session {} (shepherd pid {})", sessionId, welcome.pid());
        return Optional.of(new SessionHandle(session.info(), client, welcome.replay()));
    }

    /**
     * Reconnect after checking that {@code pid} is alive and is still the
     * process that was recorded, by comparing start times. An unknown start
     * time does not block the reconnect.
     */
    public Optional<SessionHandle> reconnectSession(String sessionId, Path socketPath, long pid, long startTime)
        throws SessionStartException {
        if (!config.signaller().isAlive(pid)) {
            log.info("Shepherd pid {} for session {} is not running", pid, sessionId);
            return Optional.empty();
        }
        OptionalLong actual = getProcessStartTime(pid);
        if (actual.isPresent() && Math.abs(actual.getAsLong() - startTime) > START_TIME_TOLERANCE.toMillis()) {
            log.warn("Pid {} for session {} was reused (started {} ms, expected {} ms)",
                pid, sessionId, actual.getAsLong(), startTime);
            return Optional.empty();
        }
        return reconnectSession(sessionId, socketPath);
    }

    // -------------------------------------------------------------------------
    // Kill / shutdown
    // -------------------------------------------------------------------------

    public boolean killSession(String sessionId) {
        return killSession(sessionId, ShepherdProtocol.SIGTERM);
    }

    /**
     * Remove a session and terminate its shepherd.
     *
     * <p>The session leaves the registry, with any pending restart cancelled,
     * before the shepherd is signalled. If it is still alive after the kill
     * timeout it receives SIGKILL.</p>
     *
     * @return {@code false} if no such session is registered
     */
    public boolean killSession(String sessionId, int signal) {
        requireCallerThread("killSession");
        requireOpen("killSession");

        ManagedSession session = callOnLoop(() -> {
            ManagedSession s = sessions.get(sessionId);
            if (s != null) {
                removeDeadSession(s, RemovalReason.KILLED);
            }
            return s;
        });
        if (session == null) {
            return false;
        }

        ProcessSignaller signaller = config.signaller();
        long pid = session.pid;
        if (!signaller.signal(pid, signal)) {
            log.debug("{} not delivered to shepherd pid {} of session {}",
                ShepherdProtocol.signalName(signal), pid, sessionId);
        }
        if (!signaller.awaitExit(pid, config.killTimeout())) {
            log.warn("Shepherd pid {} of session {} survived {} for {} ms, sending SIGKILL",
                pid, sessionId, ShepherdProtocol.signalName(signal), config.killTimeout().toMillis());
            signaller.signal(pid, ShepherdProtocol.SIGKILL);
        }

        session.client.disconnect();
        deleteSocketQuietly(session.socketPath);
        log.info("Killed session {}", sessionId);
        return true;
    }

    /**
     * Detach from every session: cancel timers, disconnect clients, clear the
     * registry. No process is signalled.
     */
    public void shutdown() {
        if (closed.get()) {
            return;
        }
        List<ManagedSession> detached = callOnLoop(() -> {
            List<ManagedSession> all = new ArrayList<>(sessions.values());
            for (ManagedSession s : all) {
                s.removed = true;
                s.restartOnExit = false;
                s.cancelTimers();
            }
            sessions.clear();
            return all;
        });
        for (ManagedSession s : detached) {
            s.client.disconnect();
        }
        log.info("Detached from {} session(s)", detached.size());
    }

    /**
     * {@link #shutdown()} and release the transport owned by this manager.
     */
    @Override
    public void close() {
        shutdown();
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        if (ownedTransport != null) {
            try {
                ownedTransport.close();
            } catch (Exception e) {
                log.warn("Failed to close session transport", e);
            }
        }
    }

    // -------------------------------------------------------------------------
    // Queries
    // -------------------------------------------------------------------------

    public Map<String, ShepherdClient> listSessions() {
        return sessions.values().stream()
            .collect(Collectors.toUnmodifiableMap(s -> s.id, s -> s.client));
    }

    public Optional<SessionInfo> getSessionInfo(String sessionId) {
        return Optional.ofNullable(sessions.get(sessionId)).map(ManagedSession::info);
    }

    public Optional<ShepherdClient> getClient(String sessionId) {
        return Optional.ofNullable(sessions.get(sessionId)).map(s -> s.client);
    }

    public Path socketPathFor(String sessionId) {
        return config.socketDir().resolve(SOCKET_PREFIX + sessionId + SOCKET_SUFFIX);
    }

    // -------------------------------------------------------------------------
    // Stale sockets
    // -------------------------------------------------------------------------

    public int cleanupStaleSockets() {
        return cleanupStaleSockets(config.socketDir());
    }

    /**
     * Delete {@code shepherd-*.sock} files in {@code socketDir} that no shepherd
     * is listening on.
     *
     * <p>Symlinks, non-socket files and sockets of registered sessions are left
     * alone. Every candidate is probed with a bounded connection attempt, all
     * probes in parallel.</p>
     *
     * @return the number of files deleted
     */
    public int cleanupStaleSockets(Path socketDir) {
        requireCallerThread("cleanupStaleSockets");
        requireOpen("cleanupStaleSockets");
        if (!Files.isDirectory(socketDir, LinkOption.NOFOLLOW_LINKS)) {
            return 0;
        }

        Set<Path> owned = sessions.values().stream()
            .map(s -> s.socketPath.toAbsolutePath().normalize())
            .collect(Collectors.toSet());

        List<Path> candidates = new ArrayList<>();
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(socketDir, SOCKET_PREFIX + "*" + SOCKET_SUFFIX)) {
            for (Path path : stream) {
                if (owned.contains(path.toAbsolutePath().normalize())) {
                    continue;
                }
                if (!isSocketFile(path)) {
                    log.debug("Skipping {}: not a socket", path);
                    continue;
                }
                candidates.add(path);
            }
        } catch (IOException e) {
            log.warn("Cannot list {}: {}", socketDir, e.toString());
            return 0;
        }

        Map<Path, CompletableFuture<Boolean>> probes = new LinkedHashMap<>();
        for (Path path : candidates) {
            probes.put(path, prober.probe(path, config.probeTimeout()));
        }

        int deleted = 0;
        for (Map.Entry<Path, CompletableFuture<Boolean>> probe : probes.entrySet()) {
            if (probe.getValue().join()) {
                continue;
            }
            if (deleteSocketQuietly(probe.getKey())) {
                deleted++;
            }
        }
        if (deleted > 0) {
            log.info("Removed {} stale shepherd socket(s) from {}", deleted, socketDir);
        }
        return deleted;
    }

    /**
     * Start time of a process in epoch milliseconds. Empty when the process is
     * gone or the platform cannot tell.
     */
    public static OptionalLong getProcessStartTime(long pid) {
        return ProcessStartTimes.startTime(pid)
            .map(Instant::toEpochMilli)
            .map(OptionalLong::of)
            .orElseGet(OptionalLong::empty);
    }

    // -------------------------------------------------------------------------
    // Callback context
    // -------------------------------------------------------------------------

    private void attachHandlers(ManagedSession session) {
        ShepherdClient client = session.client;
        client.onExit(exit -> runOnLoop(() -> handleExit(session, exit)));
        client.onClose(() -> runOnLoop(() -> handleClose(session)));
        client.onError(error -> runOnLoop(() -> handleError(session, error)));
    }

    private void register(ManagedSession session) throws SessionStartException {
        boolean added = callOnLoop(() -> {
            if (sessions.putIfAbsent(session.id, session) != null) {
                return false;
            }
            session.registered = true;
            if (session.restartOnExit) {
                startResetTimer(session);
            }
            if (session.pendingExit != null) {
                Exit exit = session.pendingExit;
                session.pendingExit = null;
                handleExit(session, exit);
            }
            if (session.pendingClose) {
                session.pendingClose = false;
                handleClose(session);
            }
            return true;
        });
        if (!added) {
            throw new SessionStartException("Session " + session.id + " already exists");
        }
    }

    private void handleExit(ManagedSession session, Exit exit) {
        if (session.removed) {
            return;
        }
        if (!session.registered) {
            session.pendingExit = exit;
            return;
        }
        session.exitSeen = true;
        emit(() -> sink.onSessionExit(new SessionExitEvent(wallClock.now(), session.id, exit.code(), exit.signal())));

        if (!session.restartOnExit) {
            removeDeadSession(session, RemovalReason.EXITED);
            reapIdleShepherd(session);
            return;
        }

        if (session.resetTimer != null) {
            session.resetTimer.cancel();
            session.resetTimer = null;
        }

        RestartPolicy policy = session.policy;
        if (session.restartCount >= policy.maxRestarts()) {
            removeDeadSession(session, RemovalReason.RESTART_BUDGET_EXHAUSTED);
            RestartBudgetExhaustedException cause = new RestartBudgetExhaustedException(session.id, policy.maxRestarts());
            emit(() -> sink.onSessionError(new SessionErrorEvent(
                wallClock.now(), session.id, SessionErrorKind.RESTART_BUDGET_EXHAUSTED, cause.getMessage(), cause)));
            reapIdleShepherd(session);
            return;
        }

        session.restartCount++;
        int count = session.restartCount;
        emit(() -> sink.onSessionRestart(new SessionRestartEvent(
            wallClock.now(), session.id, count, policy.maxRestarts(), policy.restartDelay())));
        session.restartTimer = scheduler.scheduleAfter(policy.restartDelay(), clock, () -> respawn(session));
    }

    private void respawn(ManagedSession session) {
        session.restartTimer = null;
        if (session.removed || !session.restartOnExit) {
            return;
        }
        log.info("Respawning worker of session {} ({}/{})",
            session.id, session.restartCount, session.policy.maxRestarts());
        session.exitSeen = false;
        session.client.spawn(session.respawn);
        startResetTimer(session);
    }

    private void startResetTimer(ManagedSession session) {
        if (session.resetTimer != null) {
            session.resetTimer.cancel();
        }
        session.resetTimer = scheduler.scheduleAfter(session.policy.effectiveResetWindow(), clock, () -> {
            session.resetTimer = null;
            if (!session.removed && session.restartCount > 0) {
                log.debug("Session {} stable, clearing {} restart(s)", session.id, session.restartCount);
                session.restartCount = 0;
            }
        });
    }

    private void handleClose(ManagedSession session) {
        if (session.removed) {
            return;
        }
        if (!session.registered) {
            session.pendingClose = true;
            return;
        }
        boolean expected = session.exitSeen || session.client.isDetached();
        removeDeadSession(session, RemovalReason.DISCONNECTED);
        if (!expected) {
            emit(() -> sink.onSessionError(new SessionErrorEvent(
                wallClock.now(), session.id, SessionErrorKind.DISCONNECTED_UNEXPECTEDLY,
                "Shepherd disconnected unexpectedly", null)));
        }
    }

    private void handleError(ManagedSession session, Throwable error) {
        if (session.removed) {
            log.debug("Ignoring error from removed session {}: {}", session.id, error.toString());
            return;
        }
        emit(() -> sink.onSessionError(new SessionErrorEvent(
            wallClock.now(), session.id, SessionErrorKind.CLIENT_ERROR, String.valueOf(error.getMessage()), error)));
    }

    private void removeDeadSession(ManagedSession session, RemovalReason reason) {
        if (session.removed) {
            return;
        }
        session.removed = true;
        session.restartOnExit = false;
        session.cancelTimers();
        sessions.remove(session.id, session);
        deleteSocketQuietly(session.socketPath);
        emit(() -> sink.onSessionRemoved(new SessionRemovedEvent(wallClock.now(), session.id, reason)));
    }

    /**
     * A shepherd whose session was dropped after its worker exited has nothing
     * left to do and no socket file to be found by.
     */
    private void reapIdleShepherd(ManagedSession session) {
        session.client.disconnect();
        if (!config.signaller().signal(session.pid, ShepherdProtocol.SIGTERM)) {
            log.debug("Shepherd pid {} of session {} already gone", session.pid, session.id);
        }
    }

    private void emit(Runnable notification) {
        try {
            notification.run();
        } catch (RuntimeException e) {
            log.warn("Session event sink failed", e);
        }
    }

    private void runOnLoop(Runnable task) {
        if (executor.inSerialContext()) {
            task.run();
        } else {
            executor.execute(task);
        }
    }

    private <T> T callOnLoop(Supplier<T> task) {
        if (executor.inSerialContext()) {
            return task.get();
        }
        return CompletableFuture.supplyAsync(task, executor).join();
    }

    private void requireOpen(String operation) {
        if (closed.get()) {
            throw new IllegalStateException(operation + " called on a closed SessionManager");
        }
    }

    private void requireCallerThread(String operation) {
        if (executor.inSerialContext()) {
            throw new IllegalStateException(operation + " blocks and must not run on the session callback thread");
        }
    }

    // -------------------------------------------------------------------------
    // Blocking helpers
    // -------------------------------------------------------------------------

    private Welcome awaitHandshake(ShepherdClient client) throws SessionStartException {
        long timeoutMs = config.connectTimeout().toMillis();
        try {
            return client.connect().get(timeoutMs, TimeUnit.MILLISECONDS);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            throw new SessionStartException("Handshake with " + client.socketPath() + " failed: " + cause.getMessage(), cause);
        } catch (TimeoutException e) {
            client.disconnect();
            throw new SessionStartException("Handshake with " + client.socketPath() + " timed out after " + timeoutMs + " ms", e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            client.disconnect();
            throw new SessionStartException("Interrupted during handshake with " + client.socketPath(), e);
        }
    }

    private void awaitSocketFile(Path socketPath) throws SessionStartException {
        MonotonicClock waitClock = SystemMonotonicClock.INSTANCE;
        long deadline = waitClock.nowNanos() + config.socketWaitTimeout().toNanos();
        while (!Files.exists(socketPath, LinkOption.NOFOLLOW_LINKS)) {
            if (waitClock.nowNanos() - deadline >= 0) {
                throw new SessionStartException("Socket " + socketPath + " did not appear within "
                    + config.socketWaitTimeout().toMillis() + " ms");
            }
            try {
                Thread.sleep(config.socketPollInterval().toMillis());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new SessionStartException("Interrupted while waiting for " + socketPath, e);
            }
        }
    }

    private static void ensureSocketMode(Path socketPath) throws SessionStartException {
        try {
            Set<PosixFilePermission> perms = Files.getPosixFilePermissions(socketPath, LinkOption.NOFOLLOW_LINKS);
            if (!perms.equals(SOCKET_PERMISSIONS)) {
                log.warn("Socket {} had mode {}, restricting to owner", socketPath, PosixFilePermissions.toString(perms));
                Files.setPosixFilePermissions(socketPath, SOCKET_PERMISSIONS);
            }
        } catch (UnsupportedOperationException e) {
            log.debug("No POSIX permissions on {}", socketPath);
        } catch (IOException e) {
            throw new SessionStartException("Cannot restrict permissions of " + socketPath, e);
        }
    }

    private void rollback(String sessionId, LaunchedShepherd launched, ShepherdClient client, Path socketPath) {
        log.warn("Rolling back session {}: killing shepherd pid {}", sessionId, launched.pid());
        if (client != null) {
            client.disconnect();
        }
        config.signaller().signal(launched.pid(), ShepherdProtocol.SIGKILL);
        deleteSocketQuietly(socketPath);
    }

    private static void validateSessionId(String sessionId) {
        Objects.requireNonNull(sessionId, "sessionId");
        if (!SESSION_ID.matcher(sessionId).matches()) {
            throw new IllegalArgumentException("Invalid session id: " + sessionId);
        }
    }

    static void prepareSocketDir(Path dir) throws IOException {
        if (!Files.isDirectory(dir)) {
            Files.createDirectories(dir);
        }
        if (!Files.getPosixFilePermissions(dir).equals(DIR_PERMISSIONS)) {
            Files.setPosixFilePermissions(dir, DIR_PERMISSIONS);
        }
    }

    private static void removeLeftoverSocket(Path socketPath) throws IOException {
        if (!Files.exists(socketPath, LinkOption.NOFOLLOW_LINKS)) {
            return;
        }
        if (!isSocketFile(socketPath)) {
            throw new IOException(socketPath + " exists and is not a socket");
        }
        log.debug("Removing leftover socket {}", socketPath);
        Files.delete(socketPath);
    }

    static boolean isSocketFile(Path path) {
        try {
            BasicFileAttributes attrs = Files.readAttributes(path, BasicFileAttributes.class, LinkOption.NOFOLLOW_LINKS);
            return attrs.isOther() && !attrs.isSymbolicLink();
        } catch (IOException e) {
            return false;
        }
    }

    private static boolean deleteSocketQuietly(Path socketPath) {
        try {
            return Files.deleteIfExists(socketPath);
        } catch (IOException e) {
            log.warn("Failed to delete socket {}: {}", socketPath, e.toString());
            return false;
        }
    }
}
