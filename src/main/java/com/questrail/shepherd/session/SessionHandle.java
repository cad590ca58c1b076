package com.questrail.shepherd.session;

import com.questrail.shepherd.client.ShepherdClient;

import java.util.Objects;

/**
 * Result of creating or reconnecting a session.
 *
 * @param replay the shepherd's replay buffer at handshake time, possibly empty
 */
public record SessionHandle(SessionInfo info, ShepherdClient client, byte[] replay) {
    public SessionHandle {
        Objects.requireNonNull(info, "info");
        Objects.requireNonNull(client, "client");
        replay = Objects.requireNonNull(replay, "replay").clone();
    }

    public String sessionId() {
        return info.sessionId();
    }

    @Override
    public byte[] replay() {
        return replay.clone();
    }
}
