package com.questrail.shepherd.daemon;

import com.questrail.shepherd.daemon.pty.Pty4jWorkerPtyFactory;
import com.questrail.shepherd.protocol.internal.json.ProtocolJson;
import com.questrail.shepherd.transport.netty.NettyDomainSocketTransport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.Path;
import java.nio.file.attribute.BasicFileAttributes;
import java.nio.file.attribute.PosixFilePermission;
import java.nio.file.attribute.PosixFilePermissions;
import java.util.Set;
import java.util.concurrent.CountDownLatch;

/**
 * ShepherdMain
 * =============================================================================
 * Entry point of the detached shepherd daemon.
 *
 * <pre>
 *   java -cp ... com.questrail.shepherd.daemon.ShepherdMain '&lt;json-config&gt;'
 * </pre>
 *
 * <p>Startup sequence:</p>
 * <ol>
 *   <li>Create the socket directory owner-only (0700)</li>
 *   <li>Remove a stale socket file at the socket path</li>
 *   <li>Start the worker, bind the socket, restrict it to 0600</li>
 *   <li>Print {@code {"pid":..,"startTime":..}} on stdout and close stdout</li>
 *   <li>Wait for SIGTERM, then stop the worker and remove the socket</li>
 * </ol>
 *
 * <p>Any startup failure is logged to the daemon log file and ends the
 * process with exit status 1.</p>
 */
public final class ShepherdMain
{
    private static final Logger log = LoggerFactory.getLogger(ShepherdMain.class);

    private ShepherdMain() {
    }

    public static void main(String[] args)
    {
        if (args.length != 1) {
            log.error("usage: ShepherdMain <json-config>");
            System.exit(1);
            return;
        }

        final ShepherdLaunchConfig config;
        try {
            config = ShepherdLaunchConfig.parse(args[0]);
        }
        catch (IOException e) {
            log.error("invalid launch config", e);
            System.exit(1);
            return;
        }

        final Path socketPath = config.socket();
        final NettyDomainSocketTransport transport;
        try {
            transport = NettyDomainSocketTransport.create("shepherd-io");
        }
        catch (RuntimeException e) {
            log.error("no usable socket transport", e);
            System.exit(1);
            return;
        }

        final ShepherdProcess shepherd = new ShepherdProcess(
                new Pty4jWorkerPtyFactory(), transport, socketPath, config.replayBufferLines(), null);

        try {
            prepareSocketPath(socketPath);
            shepherd.start(config.workerCommand(), config.cols(), config.rows());
        }
        catch (IOException | RuntimeException e) {
            log.error("shepherd failed to start on {}", socketPath, e);
            shepherd.shutdown();
            transport.close();
            System.exit(1);
            return;
        }

        final CountDownLatch stopped = new CountDownLatch(1);
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            log.info("shutdown requested");
            shepherd.shutdown();
            transport.close();
            stopped.countDown();
        }, "shepherd-shutdown"));

        announce(new ShepherdInfo(shepherd.shepherdPid(), shepherd.startTime()));

        // Netty and PTY threads are daemons; this thread keeps the JVM up.
        boolean interrupted = false;
        while (stopped.getCount() > 0) {
            try {
                stopped.await();
            }
            catch (InterruptedException e) {
                interrupted = true;
            }
        }
        if (interrupted) {
            Thread.currentThread().interrupt();
        }
    }

    /**
     * Ensure the parent directory exists owner-only and no stale socket file
     * blocks the bind. Regular files and symlinks at the path are left alone;
     * the bind then fails.
     */
    static void prepareSocketPath(Path socketPath) throws IOException
    {
        Path dir = socketPath.toAbsolutePath().getParent();
        if (dir != null && !Files.isDirectory(dir)) {
            Set<PosixFilePermission> owner = PosixFilePermissions.fromString("rwx------");
            Files.createDirectories(dir, PosixFilePermissions.asFileAttribute(owner));
            Files.setPosixFilePermissions(dir, owner);
        }

        if (Files.exists(socketPath, LinkOption.NOFOLLOW_LINKS)) {
            BasicFileAttributes attrs = Files.readAttributes(socketPath, BasicFileAttributes.class, LinkOption.NOFOLLOW_LINKS);
            if (attrs.isOther()) {
                Files.delete(socketPath);
                log.info("removed stale socket {}", socketPath);
            }
        }
    }

    private static void announce(ShepherdInfo info)
    {
        try {
            System.out.println(ProtocolJson.mapper().writeValueAsString(info));
        }
        catch (IOException e) {
            throw new IllegalStateException("Failed to serialize shepherd info", e);
        }
        System.out.flush();
        System.out.close();
    }
}
