package com.questrail.shepherd.internal.os;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.Optional;

/**
 * Best-effort process start time lookup.
 *
 * <p>Used to detect pid reuse: a pid whose start time no longer matches the
 * recorded one belongs to a different process.</p>
 */
public final class ProcessStartTimes
{
    private static final Logger log = LoggerFactory.getLogger(ProcessStartTimes.class);

    private ProcessStartTimes() {
    }

    /**
     * Start time of a live process. Empty if the process does not exist, the
     * platform does not report it or the lookup fails for any reason.
     */
    public static Optional<Instant> startTime(long pid)
    {
        try {
            return ProcessHandle.of(pid).flatMap(h -> h.info().startInstant());
        }
        catch (RuntimeException e) {
            log.debug("start time lookup for pid {} failed: {}", pid, e.toString());
            return Optional.empty();
        }
    }

    /**
     * Start time of the calling JVM in epoch milliseconds, falling back to
     * the current time.
     */
    public static long currentProcessStartMillis()
    {
        return ProcessHandle.current().info().startInstant()
                .map(Instant::toEpochMilli)
                .orElseGet(System::currentTimeMillis);
    }
}
