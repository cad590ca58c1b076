package com.questrail.shepherd.session;

import com.questrail.shepherd.daemon.ShepherdInfo;
import com.questrail.shepherd.daemon.ShepherdLaunchConfig;
import com.questrail.shepherd.daemon.ShepherdMain;
import com.questrail.shepherd.protocol.internal.json.ProtocolJson;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.File;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * ProcessShepherdLauncher
 * =============================================================================
 * Starts {@link ShepherdMain} in a new JVM using the current runtime and class
 * path.
 *
 * <p>The child is placed in its own session with {@code setsid} when that
 * utility exists, so terminal hangups aimed at the controller do not reach
 * it. Its stdin is {@code /dev/null}, its stderr goes to the shepherd log
 * file and its stdout carries exactly one line: the {@link ShepherdInfo}.</p>
 */
public final class ProcessShepherdLauncher implements ShepherdLauncher {
    private static final Logger log = LoggerFactory.getLogger(ProcessShepherdLauncher.class);

    public static final Duration DEFAULT_READY_TIMEOUT = Duration.ofSeconds(10);

    private static final List<Path> SETSID_LOCATIONS = List.of(Path.of("/usr/bin/setsid"), Path.of("/bin/setsid"));

    private final Path logFile;
    private final Duration readyTimeout;

    public ProcessShepherdLauncher() {
        this(Path.of(System.getProperty("java.io.tmpdir"), "shepherd.log"), DEFAULT_READY_TIMEOUT);
    }

    public ProcessShepherdLauncher(Path logFile, Duration readyTimeout) {
        this.logFile = Objects.requireNonNull(logFile, "logFile");
        this.readyTimeout = Objects.requireNonNull(readyTimeout, "readyTimeout");
    }

    @Override
    public LaunchedShepherd launch(ShepherdLaunchConfig config) throws IOException {
        ProcessBuilder pb = new ProcessBuilder(command(config))
            .redirectInput(ProcessBuilder.Redirect.from(new File("/dev/null")))
            .redirectError(ProcessBuilder.Redirect.appendTo(logFile.toFile()));

        Process process = pb.start();
        log.debug("Started shepherd launcher process {} for {}", process.pid(), config.socketPath());

        try {
            ShepherdInfo info = awaitInfo(process);
            return new LaunchedShepherd(info.pid(), info.startTime());
        } catch (IOException e) {
            // Also unblocks the reader thread by closing the child's stdout.
            process.destroyForcibly();
            throw e;
        }
    }

    List<String> command(ShepherdLaunchConfig config) {
        List<String> cmd = new ArrayList<>();
        SETSID_LOCATIONS.stream()
            .filter(Files::isExecutable)
            .findFirst()
            .ifPresent(p -> cmd.add(p.toString()));
        cmd.add(Path.of(System.getProperty("java.home"), "bin", "java").toString());
        cmd.add("-cp");
        cmd.add(System.getProperty("java.class.path"));
        cmd.add("-Dlog4j2.configurationFile=shepherd-log4j2.xml");
        cmd.add("-Dshepherd.log.file=" + logFile);
        cmd.add(ShepherdMain.class.getName());
        cmd.add(config.toJson());
        return cmd;
    }

    private ShepherdInfo awaitInfo(Process process) throws IOException {
        BufferedReader reader = new BufferedReader(
            new InputStreamReader(process.getInputStream(), StandardCharsets.UTF_8));

        CompletableFuture<String> line = new CompletableFuture<>();
        Thread readerThread = new Thread(() -> {
            try {
                line.complete(reader.readLine());
            } catch (IOException e) {
                line.completeExceptionally(e);
            }
        }, "shepherd-launch-reader");
        readerThread.setDaemon(true);
        readerThread.start();

        String text;
        try {
            text = line.get(readyTimeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            throw new IOException("Shepherd did not report ready within " + readyTimeout.toMillis() + " ms", e);
        } catch (ExecutionException e) {
            throw new IOException("Failed to read shepherd info", e.getCause());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IOException("Interrupted while waiting for shepherd", e);
        }
        // The reader thread has finished, so closing cannot block on its lock.
        reader.close();

        if (text == null) {
            throw new IOException("Shepherd exited before reporting ready (see " + logFile + ")");
        }
        return ProtocolJson.mapper().readValue(text, ShepherdInfo.class);
    }
}
