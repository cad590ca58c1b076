package com.questrail.shepherd.internal.os;

import com.questrail.shepherd.protocol.ShepherdProtocol;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.Optional;
import java.util.concurrent.TimeUnit;

/**
 * Signal delivery by process id.
 *
 * <p>SIGTERM and SIGKILL go through {@link ProcessHandle}; any other signal is
 * delivered with the system {@code kill} utility. The calling process and
 * pids below 2 are never signalled.</p>
 */
public final class ProcessSignals
{
    private static final Logger log = LoggerFactory.getLogger(ProcessSignals.class);

    private static final long KILL_COMMAND_TIMEOUT_MS = 2_000;

    private ProcessSignals() {
    }

    /**
     * Deliver a signal.
     *
     * @return {@code true} if the signal was handed to the target process
     */
    public static boolean send(long pid, int signal)
    {
        if (pid < 2 || pid == ProcessHandle.current().pid()) {
            log.warn("refusing to send {} to pid {}", ShepherdProtocol.signalName(signal), pid);
            return false;
        }

        Optional<ProcessHandle> handle = ProcessHandle.of(pid);
        if (handle.isEmpty()) {
            return false;
        }

        if (signal == ShepherdProtocol.SIGTERM) {
            return handle.get().destroy();
        }
        if (signal == ShepherdProtocol.SIGKILL) {
            return handle.get().destroyForcibly();
        }
        return runKill(pid, signal);
    }

    public static boolean isAlive(long pid)
    {
        return ProcessHandle.of(pid).map(ProcessHandle::isAlive).orElse(false);
    }

    private static boolean runKill(long pid, int signal)
    {
        ProcessBuilder pb = new ProcessBuilder("kill", "-" + signal, Long.toString(pid))
                .redirectErrorStream(true)
                .redirectOutput(ProcessBuilder.Redirect.DISCARD);
        try {
            Process p = pb.start();
            if (!p.waitFor(KILL_COMMAND_TIMEOUT_MS, TimeUnit.MILLISECONDS)) {
                p.destroyForcibly();
                log.warn("kill -{} {} did not finish in time", signal, pid);
                return false;
            }
            return p.exitValue() == 0;
        }
        catch (IOException e) {
            log.warn("kill -{} {} failed: {}", signal, pid, e.toString());
            return false;
        }
        catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }
}
