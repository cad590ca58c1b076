package com.questrail.shepherd.session;

import com.questrail.shepherd.observability.RecordingSessionEventSink;
import com.questrail.shepherd.observability.SessionErrorKind;
import com.questrail.shepherd.observability.SessionRestartEvent;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.EnabledOnOs;
import org.junit.jupiter.api.condition.OS;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.function.BooleanSupplier;

import static org.junit.jupiter.api.Assertions.*;

/**
 * End to end: real shepherd JVMs running /bin/sh under a PTY.
 */
@EnabledOnOs(OS.LINUX)
class SessionManagerEndToEndTest {

    private static final Duration WAIT = Duration.ofSeconds(20);

    @TempDir
    Path dir;

    private final RecordingSessionEventSink sink = new RecordingSessionEventSink();
    private final List<Long> launched = new ArrayList<>();

    @AfterEach
    void killLeftovers() {
        for (long pid : launched) {
            ProcessHandle.of(pid).ifPresent(ProcessHandle::destroyForcibly);
        }
    }

    @Test
    void sessionOutlivesControllerAndCanBeReattached() throws Exception {
        SessionManagerConfig config = config();
        StringBuffer output = new StringBuffer();

        SessionHandle handle;
        try (SessionManager first = SessionManager.create(config)) {
            handle = first.createSession("/bin/sh", CreateSessionOptions.builder()
                .withSessionId("e2e")
                .withArgs(List.of("-c", "echo shepherd-ready; sleep 60"))
                .withDataHandler(bytes -> output.append(new String(bytes, StandardCharsets.UTF_8)))
                .build());
            launched.add(handle.info().pid());

            awaitTrue(() -> output.indexOf("shepherd-ready") >= 0, "worker output");
        }

        long pid = handle.info().pid();
        Path socket = handle.info().socketPath();
        assertTrue(isAlive(pid), "shepherd survives controller shutdown");
        assertTrue(Files.exists(socket));

        try (SessionManager second = SessionManager.create(config)) {
            SessionHandle again = second.reconnectSession("e2e", socket, pid, handle.info().startTime()).orElseThrow();

            assertEquals(pid, again.info().pid());
            assertTrue(new String(again.replay(), StandardCharsets.UTF_8).contains("shepherd-ready"));

            assertTrue(second.killSession("e2e"));
            awaitTrue(() -> !isAlive(pid), "shepherd exit");
            assertFalse(Files.exists(socket));
            assertTrue(second.listSessions().isEmpty());
        }
    }

    @Test
    void inputIsEchoedBackThroughTheShepherd() throws Exception {
        StringBuffer output = new StringBuffer();
        try (SessionManager manager = SessionManager.create(config())) {
            SessionHandle handle = manager.createSession("/bin/cat", CreateSessionOptions.builder()
                .withSessionId("echo")
                .withDataHandler(bytes -> output.append(new String(bytes, StandardCharsets.UTF_8)))
                .build());
            launched.add(handle.info().pid());
            Path socket = handle.info().socketPath();

            handle.client().write("ping\n".getBytes(StandardCharsets.UTF_8));

            // The terminal turns the newline into CRLF on output.
            awaitTrue(() -> output.toString().replace("\r", "").contains("ping\n"), "echoed input");

            assertTrue(manager.killSession("echo"));
            assertTrue(manager.listSessions().isEmpty());
            assertFalse(Files.exists(socket));
            awaitTrue(() -> !isAlive(handle.info().pid()), "shepherd exit");
        }
    }

    @Test
    void crashingWorkerExhaustsRestartBudget() throws Exception {
        try (SessionManager manager = SessionManager.create(config())) {
            SessionHandle handle = manager.createSession("/bin/sh", CreateSessionOptions.builder()
                .withSessionId("crashy")
                .withArgs(List.of("-c", "exit 1"))
                .withRestartPolicy(RestartPolicy.builder()
                    .withRestartOnExit(true)
                    .withMaxRestarts(2)
                    .withRestartDelay(Duration.ofMillis(100))
                    .withRestartResetAfter(Duration.ofMinutes(1))
                    .build())
                .build());
            launched.add(handle.info().pid());

            awaitTrue(() -> !sink.errors(SessionErrorKind.RESTART_BUDGET_EXHAUSTED).isEmpty(), "budget exhausted");

            assertEquals(2, sink.eventsOfType(SessionRestartEvent.class).size());
            assertTrue(manager.listSessions().isEmpty());
            assertFalse(Files.exists(handle.info().socketPath()));
        }
    }

    private SessionManagerConfig config() {
        return SessionManagerConfig.builder()
            .withSocketDir(dir.resolve("sockets"))
            .withLauncher(new ProcessShepherdLauncher(dir.resolve("shepherd.log"), WAIT))
            .withSocketWaitTimeout(WAIT)
            .withConnectTimeout(WAIT)
            .withEventSink(sink)
            .build();
    }

    private static boolean isAlive(long pid) {
        return ProcessHandle.of(pid).map(ProcessHandle::isAlive).orElse(false);
    }

    private static void awaitTrue(BooleanSupplier condition, String what) throws InterruptedException {
        long deadline = System.nanoTime() + WAIT.toNanos();
        while (!condition.getAsBoolean()) {
            if (System.nanoTime() - deadline >= 0) {
                fail("Timed out waiting for " + what);
            }
            Thread.sleep(25);
        }
    }
}
