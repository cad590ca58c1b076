package com.questrail.shepherd.protocol.model;

import java.util.Optional;
import java.util.OptionalInt;

/**
 * The worker has exited.
 *
 * @param code   exit status, or {@code null} when the worker was terminated by
 *               a signal and no status is available
 * @param signal name of the terminating signal (for example {@code "SIGTERM"}),
 *               or {@code null} when the worker exited normally
 */
public record Exit(Integer code, String signal) implements ServerMessage
{
    public OptionalInt exitCode() {
        return (code == null) ? OptionalInt.empty() : OptionalInt.of(code);
    }

    public Optional<String> signalName() {
        return Optional.ofNullable(signal);
    }
}
