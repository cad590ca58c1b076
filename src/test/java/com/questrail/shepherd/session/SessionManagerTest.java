package com.questrail.shepherd.session;

import com.questrail.shepherd.client.ShepherdConnectException;
import com.questrail.shepherd.client.VersionMismatchException;
import com.questrail.shepherd.client.VersionWarning;
import com.questrail.shepherd.daemon.ShepherdLaunchConfig;
import com.questrail.shepherd.internal.exec.DirectSerialExecutor;
import com.questrail.shepherd.internal.exec.SerialExecutor;
import com.questrail.shepherd.observability.RecordingSessionEventSink;
import com.questrail.shepherd.observability.RemovalReason;
import com.questrail.shepherd.observability.SessionErrorEvent;
import com.questrail.shepherd.observability.SessionErrorKind;
import com.questrail.shepherd.observability.SessionEventSink;
import com.questrail.shepherd.observability.SessionExitEvent;
import com.questrail.shepherd.observability.SessionRemovedEvent;
import com.questrail.shepherd.observability.SessionRestartEvent;
import com.questrail.shepherd.protocol.ShepherdProtocol;
import com.questrail.shepherd.protocol.model.Exit;
import com.questrail.shepherd.protocol.model.Welcome;
import com.questrail.shepherd.time.DeterministicScheduler;
import com.questrail.shepherd.time.ManualMonotonicClock;
import com.questrail.shepherd.transport.FakeStreamConnector;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.EnabledOnOs;
import org.junit.jupiter.api.condition.OS;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.net.StandardProtocolFamily;
import java.net.UnixDomainSocketAddress;
import java.nio.channels.ServerSocketChannel;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.PosixFilePermissions;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Function;

import static org.junit.jupiter.api.Assertions.*;

/**
 * SessionManagerTest
 * -----------------------------------------------------------------------------
 * Registry, restart and teardown behaviour with scripted clients, a fake
 * launcher and deterministic time. All callbacks run on the test thread.
 */
class SessionManagerTest {

    private static final Duration DELAY = Duration.ofSeconds(2);

    @TempDir
    Path dir;

    private final ManualMonotonicClock clock = new ManualMonotonicClock();
    private final DeterministicScheduler scheduler = new DeterministicScheduler(clock);
    private final FakeShepherdLauncher launcher = new FakeShepherdLauncher();
    private final FakeProcessSignaller signaller = new FakeProcessSignaller();
    private final RecordingSessionEventSink sink = new RecordingSessionEventSink();
    private final FakeStreamConnector prober = new FakeStreamConnector();
    private final List<FakeShepherdClient> clients = new ArrayList<>();

    private Function<Path, FakeShepherdClient> clientSupplier;
    private Path socketDir;
    private SessionManager manager;

    @BeforeEach
    void setUp() {
        socketDir = dir.resolve("sockets");
        clientSupplier = path -> new FakeShepherdClient(path, welcome(launcher.lastPid(), "replayed"));
        manager = newManager(sink, new DirectSerialExecutor());
    }

    private SessionManager newManager(SessionEventSink eventSink, SerialExecutor executor) {
        SessionManagerConfig config = SessionManagerConfig.builder()
            .withSocketDir(socketDir)
            .withLauncher(launcher)
            .withSignaller(signaller)
            .withEventSink(eventSink)
            .withSocketWaitTimeout(Duration.ofMillis(200))
            .withSocketPollInterval(Duration.ofMillis(10))
            .build();
        ShepherdClientFactory factory = path -> {
            FakeShepherdClient client = clientSupplier.apply(path);
            clients.add(client);
            return client;
        };
        return new SessionManager(config, factory, executor, scheduler, clock,
            () -> Instant.parse("2026-01-01T00:00:00Z"), prober, null);
    }

    // -------------------------------------------------------------------------
    // createSession
    // -------------------------------------------------------------------------

    @Test
    void createSessionRegistersAndReturnsReplay() throws Exception {
        SessionHandle handle = create("s1", RestartPolicy.disabled());

        assertEquals("s1", handle.sessionId());
        assertEquals("replayed", new String(handle.replay(), StandardCharsets.UTF_8));
        assertEquals(launcher.lastPid(), handle.info().pid());
        assertEquals(socketDir.resolve("shepherd-s1.sock"), handle.info().socketPath());
        assertEquals(List.of("s1"), List.copyOf(manager.listSessions().keySet()));
        assertSame(handle.client(), manager.getClient("s1").orElseThrow());
        assertTrue(clients.get(0).hasHandlers());
    }

    @Test
    void createSessionPassesLaunchSpec() throws Exception {
        manager.createSession("/bin/bash", CreateSessionOptions.builder()
            .withSessionId("s1")
            .withArgs(List.of("-l"))
            .withCwd("/work")
            .withSize(132, 43)
            .build());

        ShepherdLaunchConfig launched = launcher.launches.get(0);
        assertEquals("/bin/bash", launched.command());
        assertEquals(List.of("-l"), launched.args());
        assertEquals("/work", launched.cwd());
        assertEquals(132, launched.cols());
        assertEquals(43, launched.rows());
        assertEquals(socketDir.resolve("shepherd-s1.sock").toString(), launched.socketPath());
    }

    @Test
    void createSessionRestrictsSocketAndDirectory() throws Exception {
        SessionHandle handle = create("s1", RestartPolicy.disabled());

        assertEquals(PosixFilePermissions.fromString("rwx------"), Files.getPosixFilePermissions(socketDir));
        assertEquals(PosixFilePermissions.fromString("rw-------"),
            Files.getPosixFilePermissions(handle.info().socketPath()));
    }

    @Test
    void generatedSessionIdIsUuid() throws Exception {
        SessionHandle handle = manager.createSession("/bin/sh", CreateSessionOptions.builder().build());

        UUID.fromString(handle.sessionId());
        assertTrue(handle.info().socketPath().getFileName().toString().contains(handle.sessionId()));
    }

    @Test
    void dataHandlerIsInstalledBeforeHandshake() throws Exception {
        List<String> output = new ArrayList<>();
        clientSupplier = path -> new FakeShepherdClient(path, welcome(launcher.lastPid(), ""))
            .duringHandshake(c -> c.fireData("early".getBytes(StandardCharsets.UTF_8)));

        manager.createSession("/bin/sh", CreateSessionOptions.builder()
            .withSessionId("s1")
            .withDataHandler(b -> output.add(new String(b, StandardCharsets.UTF_8)))
            .build());

        assertEquals(List.of("early"), output);
    }

    @Test
    void versionWarningReachesCallerDuringCreate() throws Exception {
        List<VersionWarning> warnings = new ArrayList<>();
        clientSupplier = path -> new FakeShepherdClient(path, welcome(launcher.lastPid(), ""))
            .duringHandshake(c -> c.fireVersionWarning(new VersionWarning(2, 1)));

        manager.createSession("/bin/sh", CreateSessionOptions.builder()
            .withSessionId("s1")
            .withVersionWarningHandler(warnings::add)
            .build());

        assertEquals(List.of(new VersionWarning(2, 1)), warnings);
        assertTrue(manager.getSessionInfo("s1").isPresent());
    }

    @Test
    void duplicateSessionIdIsRejected() throws Exception {
        create("s1", RestartPolicy.disabled());

        assertThrows(SessionStartException.class, () -> create("s1", RestartPolicy.disabled()));
        assertEquals(1, launcher.launches.size());
    }

    @Test
    void unsafeSessionIdIsRejected() {
        assertThrows(IllegalArgumentException.class, () -> create("../escape", RestartPolicy.disabled()));
    }

    @Test
    void failedHandshakeKillsShepherdAndRemovesSocket() {
        clientSupplier = path -> new FakeShepherdClient(path, null)
            .failingWith(new ShepherdConnectException("refused"));

        assertThrows(SessionStartException.class, () -> create("s1", RestartPolicy.disabled()));

        assertEquals(List.of(ShepherdProtocol.SIGKILL), signaller.signalsTo(launcher.lastPid()));
        assertFalse(Files.exists(socketDir.resolve("shepherd-s1.sock")));
        assertTrue(manager.listSessions().isEmpty());
        assertEquals(1, clients.get(0).disconnects());
    }

    @Test
    void versionMismatchDuringCreateRollsBack() {
        clientSupplier = path -> new FakeShepherdClient(path, null)
            .failingWith(new VersionMismatchException(1, 2));

        SessionStartException e = assertThrows(SessionStartException.class,
            () -> create("s1", RestartPolicy.disabled()));

        assertInstanceOf(VersionMismatchException.class, e.getCause());
        assertEquals(List.of(ShepherdProtocol.SIGKILL), signaller.signalsTo(launcher.lastPid()));
    }

    @Test
    void socketThatNeverAppearsTimesOutAndKills() {
        launcher.createSocketFile = false;

        assertThrows(SessionStartException.class, () -> create("s1", RestartPolicy.disabled()));

        assertEquals(List.of(ShepherdProtocol.SIGKILL), signaller.signalsTo(launcher.lastPid()));
        assertTrue(clients.isEmpty());
    }

    @Test
    void launchFailureSignalsNothing() {
        launcher.failure = new IOException("no java");

        assertThrows(SessionStartException.class, () -> create("s1", RestartPolicy.disabled()));

        assertTrue(signaller.sent.isEmpty());
        assertTrue(manager.listSessions().isEmpty());
    }

    @Test
    void blockingOperationsRefuseCallbackThread() {
        SerialExecutor loop = new SerialExecutor() {
            @Override
            public void execute(Runnable task) {
                task.run();
            }

            @Override
            public boolean inSerialContext() {
                return true;
            }
        };
        SessionManager onLoop = newManager(sink, loop);

        assertThrows(IllegalStateException.class, () -> onLoop.createSession("/bin/sh", CreateSessionOptions.builder().build()));
        assertThrows(IllegalStateException.class, () -> onLoop.killSession("x"));
        assertThrows(IllegalStateException.class, onLoop::cleanupStaleSockets);
    }

    // -------------------------------------------------------------------------
    // Exit and restart
    // -------------------------------------------------------------------------

    @Test
    void exitWithoutRestartRemovesSessionAndReapsShepherd() throws Exception {
        SessionHandle handle = create("s1", RestartPolicy.disabled());
        FakeShepherdClient client = clients.get(0);

        client.fireExit(new Exit(0, null));

        assertTrue(manager.listSessions().isEmpty());
        assertEquals(List.of(RemovalReason.EXITED), sink.removals());
        assertEquals(1, sink.eventsOfType(SessionExitEvent.class).size());
        assertTrue(sink.eventsOfType(SessionErrorEvent.class).isEmpty());
        assertEquals(List.of(ShepherdProtocol.SIGTERM), signaller.signalsTo(handle.info().pid()));
        assertFalse(Files.exists(handle.info().socketPath()));
    }

    @Test
    void restartBudgetAllowsExactlyMaxRestarts() throws Exception {
        create("s1", restartPolicy(2, DELAY, Duration.ofMinutes(5)));
        FakeShepherdClient client = clients.get(0);

        client.fireExit(new Exit(1, null));
        assertTrue(client.spawns.isEmpty(), "SPAWN waits for the restart delay");
        scheduler.advance(DELAY);
        assertEquals(1, client.spawns.size());

        client.fireExit(new Exit(1, null));
        scheduler.advance(DELAY);
        assertEquals(2, client.spawns.size());

        client.fireExit(new Exit(1, null));
        scheduler.advance(Duration.ofSeconds(30));

        assertEquals(2, client.spawns.size());
        assertTrue(manager.listSessions().isEmpty());
        assertEquals(List.of(RemovalReason.RESTART_BUDGET_EXHAUSTED), sink.removals());

        List<SessionErrorEvent> exhausted = sink.errors(SessionErrorKind.RESTART_BUDGET_EXHAUSTED);
        assertEquals(1, exhausted.size());
        assertInstanceOf(RestartBudgetExhaustedException.class, exhausted.get(0).cause());
        assertTrue(sink.errors(SessionErrorKind.DISCONNECTED_UNEXPECTEDLY).isEmpty());

        List<SessionRestartEvent> restarts = sink.eventsOfType(SessionRestartEvent.class);
        assertEquals(List.of(1, 2), restarts.stream().map(SessionRestartEvent::restartCount).toList());
    }

    @Test
    void respawnUsesOriginalCommand() throws Exception {
        manager.createSession("/bin/zsh", CreateSessionOptions.builder()
            .withSessionId("s1")
            .withArgs(List.of("-i"))
            .withCwd("/home/me")
            .withRestartPolicy(restartPolicy(5, DELAY, Duration.ofMinutes(5)))
            .build());
        FakeShepherdClient client = clients.get(0);

        client.fireExit(new Exit(0, null));
        scheduler.advance(DELAY);

        assertEquals("/bin/zsh", client.spawns.get(0).command());
        assertEquals(List.of("-i"), client.spawns.get(0).args());
        assertEquals("/home/me", client.spawns.get(0).cwd());
    }

    @Test
    void resetWindowIsAtLeastTheRestartDelay() throws Exception {
        Duration delay = Duration.ofSeconds(5);
        create("s1", restartPolicy(1, delay, Duration.ofSeconds(1)));
        FakeShepherdClient client = clients.get(0);

        client.fireExit(new Exit(1, null));
        scheduler.advance(delay);
        assertEquals(1, client.spawns.size());

        scheduler.advance(Duration.ofSeconds(4));
        assertEquals(1, manager.getSessionInfo("s1").orElseThrow().restartCount());

        scheduler.advance(Duration.ofSeconds(1));
        assertEquals(0, manager.getSessionInfo("s1").orElseThrow().restartCount());

        // The budget is available again.
        client.fireExit(new Exit(1, null));
        scheduler.advance(delay);
        assertEquals(2, client.spawns.size());
        assertTrue(manager.getSessionInfo("s1").isPresent());
    }

    @Test
    void exitBeforeRegistrationIsHandledAfterIt() throws Exception {
        clientSupplier = path -> new FakeShepherdClient(path, welcome(launcher.lastPid(), ""))
            .duringHandshake(c -> c.fireExit(new Exit(0, null)));

        create("s1", RestartPolicy.disabled());

        assertTrue(manager.listSessions().isEmpty());
        assertEquals(List.of(RemovalReason.EXITED), sink.removals());
    }

    @Test
    void exitBeforeRegistrationStillRestarts() throws Exception {
        clientSupplier = path -> new FakeShepherdClient(path, welcome(launcher.lastPid(), ""))
            .duringHandshake(c -> c.fireExit(new Exit(1, null)));

        create("s1", restartPolicy(3, DELAY, Duration.ofMinutes(5)));
        scheduler.advance(DELAY);

        assertEquals(1, clients.get(0).spawns.size());
        assertEquals(1, manager.getSessionInfo("s1").orElseThrow().restartCount());
    }

    // -------------------------------------------------------------------------
    // Close and errors
    // -------------------------------------------------------------------------

    @Test
    void closeWithoutExitReportsExactlyOneDisconnect() throws Exception {
        SessionHandle handle = create("s1", RestartPolicy.disabled());
        FakeShepherdClient client = clients.get(0);

        client.fireClose();
        client.fireClose();

        assertEquals(1, sink.errors(SessionErrorKind.DISCONNECTED_UNEXPECTEDLY).size());
        assertEquals(List.of(RemovalReason.DISCONNECTED), sink.removals());
        assertTrue(manager.listSessions().isEmpty());
        assertFalse(Files.exists(handle.info().socketPath()));
        assertTrue(signaller.sent.isEmpty());
    }

    @Test
    void closeDuringRestartBackoffRemovesWithoutDisconnectNotice() throws Exception {
        create("s1", restartPolicy(3, DELAY, Duration.ofMinutes(5)));
        FakeShepherdClient client = clients.get(0);

        client.fireExit(new Exit(1, null));
        client.fireClose();
        scheduler.advance(DELAY);

        assertTrue(client.spawns.isEmpty());
        assertTrue(manager.listSessions().isEmpty());
        assertTrue(sink.errors(SessionErrorKind.DISCONNECTED_UNEXPECTEDLY).isEmpty());
    }

    @Test
    void closeBeforeRegistrationRemovesAfterIt() throws Exception {
        clientSupplier = path -> new FakeShepherdClient(path, welcome(launcher.lastPid(), ""))
            .duringHandshake(FakeShepherdClient::fireClose);

        create("s1", RestartPolicy.disabled());

        assertTrue(manager.listSessions().isEmpty());
        assertEquals(1, sink.errors(SessionErrorKind.DISCONNECTED_UNEXPECTEDLY).size());
    }

    @Test
    void clientErrorIsReportedAndSessionStays() throws Exception {
        create("s1", RestartPolicy.disabled());

        clients.get(0).fireError(new IllegalStateException("bad frame"));

        List<SessionErrorEvent> errors = sink.errors(SessionErrorKind.CLIENT_ERROR);
        assertEquals(1, errors.size());
        assertEquals("bad frame", errors.get(0).message());
        assertTrue(manager.getSessionInfo("s1").isPresent());
    }

    @Test
    void throwingSinkDoesNotBreakRemoval() throws Exception {
        SessionEventSink exploding = new SessionEventSink() {
            @Override
            public void onSessionExit(SessionExitEvent event) {
                throw new IllegalStateException("sink bug");
            }

            @Override
            public void onSessionRestart(SessionRestartEvent event) {
                throw new IllegalStateException("sink bug");
            }

            @Override
            public void onSessionError(SessionErrorEvent event) {
                throw new IllegalStateException("sink bug");
            }

            @Override
            public void onSessionRemoved(SessionRemovedEvent event) {
                throw new IllegalStateException("sink bug");
            }
        };
        manager = newManager(exploding, new DirectSerialExecutor());
        create("s1", RestartPolicy.disabled());

        assertDoesNotThrow(() -> clients.get(0).fireClose());
        assertTrue(manager.listSessions().isEmpty());
    }

    // -------------------------------------------------------------------------
    // Kill and shutdown
    // -------------------------------------------------------------------------

    @Test
    void killRemovesBeforeSignallingAndCleansUp() throws Exception {
        SessionHandle handle = create("s1", RestartPolicy.disabled());
        long pid = handle.info().pid();

        assertTrue(manager.killSession("s1"));

        assertTrue(manager.listSessions().isEmpty());
        assertEquals(List.of(ShepherdProtocol.SIGTERM), signaller.signalsTo(pid));
        assertEquals(List.of(pid), signaller.awaited);
        assertEquals(1, clients.get(0).disconnects());
        assertFalse(Files.exists(handle.info().socketPath()));
        assertEquals(List.of(RemovalReason.KILLED), sink.removals());
        assertTrue(sink.eventsOfType(SessionErrorEvent.class).isEmpty());
    }

    @Test
    void killEscalatesWhenShepherdSurvives() throws Exception {
        SessionHandle handle = create("s1", RestartPolicy.disabled());
        signaller.exitsWhenSignalled = false;

        manager.killSession("s1");

        assertEquals(List.of(ShepherdProtocol.SIGTERM, ShepherdProtocol.SIGKILL),
            signaller.signalsTo(handle.info().pid()));
    }

    @Test
    void killWithExplicitSignal() throws Exception {
        SessionHandle handle = create("s1", RestartPolicy.disabled());

        manager.killSession("s1", ShepherdProtocol.SIGHUP);

        assertEquals(List.of(ShepherdProtocol.SIGHUP), signaller.signalsTo(handle.info().pid()));
    }

    @Test
    void killDuringBackoffPreventsSpawn() throws Exception {
        create("s1", restartPolicy(5, DELAY, Duration.ofMinutes(5)));
        FakeShepherdClient client = clients.get(0);

        client.fireExit(new Exit(1, null));
        assertTrue(manager.killSession("s1"));
        scheduler.advance(Duration.ofSeconds(10));

        assertTrue(client.spawns.isEmpty());
        assertEquals(0, scheduler.pendingTasks());
    }

    @Test
    void killUnknownSessionReturnsFalse() {
        assertFalse(manager.killSession("nope"));
        assertTrue(signaller.sent.isEmpty());
    }

    @Test
    void shutdownDetachesWithoutSignalling() throws Exception {
        SessionHandle a = create("a", restartPolicy(5, DELAY, Duration.ofMinutes(5)));
        create("b", RestartPolicy.disabled());
        clients.get(0).fireExit(new Exit(1, null));

        manager.shutdown();
        scheduler.advance(Duration.ofMinutes(10));

        assertTrue(manager.listSessions().isEmpty());
        assertTrue(signaller.sent.isEmpty());
        assertTrue(clients.get(0).spawns.isEmpty());
        assertEquals(1, clients.get(0).disconnects());
        assertEquals(1, clients.get(1).disconnects());
        assertTrue(Files.exists(a.info().socketPath()), "socket stays for the next controller");
        assertTrue(sink.removals().isEmpty());
        assertTrue(sink.eventsOfType(SessionErrorEvent.class).isEmpty());
    }

    @Test
    void closedManagerRejectsOperations() throws Exception {
        create("s1", RestartPolicy.disabled());
        manager.close();

        assertThrows(IllegalStateException.class, () -> create("s2", RestartPolicy.disabled()));
        assertThrows(IllegalStateException.class, () -> manager.killSession("s1"));
        assertThrows(IllegalStateException.class,
            () -> manager.reconnectSession("s1", socketDir.resolve("shepherd-s1.sock")));
        assertThrows(IllegalStateException.class, manager::cleanupStaleSockets);
        assertEquals(1, launcher.launches.size());
        assertTrue(signaller.sent.isEmpty());
    }

    // -------------------------------------------------------------------------
    // reconnectSession
    // -------------------------------------------------------------------------

    @Test
    void reconnectWithoutSocketFileIsEmpty() throws Exception {
        assertTrue(manager.reconnectSession("s1", socketDir.resolve("shepherd-s1.sock")).isEmpty());
        assertTrue(clients.isEmpty());
    }

    @Test
    @EnabledOnOs({ OS.LINUX, OS.MAC })
    void reconnectSeedsReplayAndNeverRestarts() throws Exception {
        Path socket = abandonedSocket("s1");
        clientSupplier = path -> new FakeShepherdClient(path, welcome(4242, "scrollback"));

        SessionHandle handle = manager.reconnectSession("s1", socket).orElseThrow();

        assertEquals(4242, handle.info().pid());
        assertFalse(handle.info().restartOnExit());
        assertEquals("scrollback", new String(handle.replay(), StandardCharsets.UTF_8));

        clients.get(0).fireExit(new Exit(0, null));
        scheduler.advance(Duration.ofMinutes(1));

        assertTrue(manager.listSessions().isEmpty());
        assertTrue(clients.get(0).spawns.isEmpty());
        assertEquals(List.of(ShepherdProtocol.SIGTERM), signaller.signalsTo(4242));
    }

    @Test
    @EnabledOnOs({ OS.LINUX, OS.MAC })
    void reconnectToDeadShepherdDeletesSocket() throws Exception {
        Path socket = abandonedSocket("s1");
        clientSupplier = path -> new FakeShepherdClient(path, null)
            .failingWith(new ShepherdConnectException("refused"));

        assertTrue(manager.reconnectSession("s1", socket).isEmpty());
        assertFalse(Files.exists(socket));
    }

    @Test
    @EnabledOnOs({ OS.LINUX, OS.MAC })
    void reconnectToNewerShepherdFailsAndKeepsSocket() throws Exception {
        Path socket = abandonedSocket("s1");
        clientSupplier = path -> new FakeShepherdClient(path, null)
            .failingWith(new VersionMismatchException(1, 2));

        assertThrows(SessionStartException.class, () -> manager.reconnectSession("s1", socket));
        assertTrue(Files.exists(socket));
    }

    @Test
    @EnabledOnOs({ OS.LINUX, OS.MAC })
    void reconnectKeepsSocketOfShepherdThatStillListens() throws Exception {
        Path socket = abandonedSocket("s1");
        prober.setProbeResult(socket, true);
        clientSupplier = path -> new FakeShepherdClient(path, null)
            .failingWith(new ShepherdConnectException("Handshake timed out"));

        assertTrue(manager.reconnectSession("s1", socket).isEmpty());
        assertTrue(Files.exists(socket));
        assertEquals(1, clients.get(0).disconnects());
    }

    @Test
    @EnabledOnOs({ OS.LINUX, OS.MAC })
    void versionWarningReachesCallerDuringReconnect() throws Exception {
        Path socket = abandonedSocket("s1");
        List<VersionWarning> warnings = new ArrayList<>();
        clientSupplier = path -> new FakeShepherdClient(path, welcome(4242, ""))
            .duringHandshake(c -> c.fireVersionWarning(new VersionWarning(2, 1)));

        assertTrue(manager.reconnectSession("s1", socket, warnings::add).isPresent());

        assertEquals(List.of(new VersionWarning(2, 1)), warnings);
    }

    @Test
    void reconnectRejectsDeadPid() throws Exception {
        Optional<SessionHandle> result = manager.reconnectSession("s1", socketDir.resolve("shepherd-s1.sock"),
            99_999, 0);

        assertTrue(result.isEmpty());
        assertTrue(clients.isEmpty());
    }

    @Test
    @EnabledOnOs({ OS.LINUX, OS.MAC })
    void reconnectRejectsReusedPid() throws Exception {
        Path socket = abandonedSocket("s1");
        long pid = ProcessHandle.current().pid();
        signaller.alive.add(pid);
        long actualStart = SessionManager.getProcessStartTime(pid).orElseThrow();

        assertTrue(manager.reconnectSession("s1", socket, pid, actualStart - 3_600_000).isEmpty());
        assertTrue(clients.isEmpty());

        clientSupplier = path -> new FakeShepherdClient(path, welcome(pid, ""));
        assertTrue(manager.reconnectSession("s1", socket, pid, actualStart + 500).isPresent());
    }

    @Test
    void processStartTimeOfMissingPidIsEmpty() {
        assertTrue(SessionManager.getProcessStartTime(Long.MAX_VALUE).isEmpty());
    }

    // -------------------------------------------------------------------------

    private SessionHandle create(String id, RestartPolicy policy) throws SessionStartException {
        return manager.createSession("/bin/sh", CreateSessionOptions.builder()
            .withSessionId(id)
            .withCwd("/tmp")
            .withRestartPolicy(policy)
            .build());
    }

    private static RestartPolicy restartPolicy(int maxRestarts, Duration delay, Duration resetAfter) {
        return RestartPolicy.builder()
            .withRestartOnExit(true)
            .withMaxRestarts(maxRestarts)
            .withRestartDelay(delay)
            .withRestartResetAfter(resetAfter)
            .build();
    }

    private static Welcome welcome(long pid, String replay) {
        return new Welcome(ShepherdProtocol.PROTOCOL_VERSION, pid, pid + 1, 1_700_000_000_000L, 80, 24,
            replay.getBytes(StandardCharsets.UTF_8));
    }

    private Path abandonedSocket(String id) throws IOException {
        Files.createDirectories(socketDir);
        Path path = socketDir.resolve("shepherd-" + id + ".sock");
        try (ServerSocketChannel channel = ServerSocketChannel.open(StandardProtocolFamily.UNIX)) {
            channel.bind(UnixDomainSocketAddress.of(path));
        }
        return path;
    }
}
