package com.questrail.shepherd.protocol.model;

import java.util.Objects;

/**
 * Handshake answer.
 *
 * <p>
 * Sent once per accepted HELLO. Carries everything a reconnecting controller
 * needs to resume a session: the shepherd's identity (so the controller can
 * later signal it and detect PID reuse), the current terminal size and the
 * replay buffer contents.
 * </p>
 *
 * @param protocolVersion protocol version spoken by the shepherd
 * @param pid             process id of the shepherd itself
 * @param workerPid       process id of the current worker, or -1 if none is running
 * @param startTime       shepherd start time in epoch milliseconds
 * @param cols            current terminal columns
 * @param rows            current terminal rows
 * @param replay          buffered recent worker output, possibly empty
 */
public record Welcome(
        int protocolVersion,
        long pid,
        long workerPid,
        long startTime,
        int cols,
        int rows,
        byte[] replay
) implements ServerMessage
{
    public Welcome {
        replay = Objects.requireNonNull(replay, "replay").clone();
    }

    @Override
    public byte[] replay() {
        return replay.clone();
    }
}
