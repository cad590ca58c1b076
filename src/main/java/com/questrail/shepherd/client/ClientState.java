package com.questrail.shepherd.client;

/**
 * Lifecycle state of a {@link ShepherdClient} connection.
 *
 * <pre>
 *   DISCONNECTED ──connect()──▶ CONNECTING ──socket open──▶ HANDSHAKING ──WELCOME ok──▶ CONNECTED
 *        │                          │                            │                          │
 *        └──────────────────────────┴────────────────────────────┴──────────────────────────┴──▶ CLOSED
 * </pre>
 *
 * <p>CLOSED is terminal; a client is never reused. Frames other than WELCOME
 * are queued only while HANDSHAKING.</p>
 */
public enum ClientState
{
    DISCONNECTED,
    CONNECTING,
    HANDSHAKING,
    CONNECTED,
    CLOSED;

    public boolean canTransitionTo(ClientState next)
    {
        switch (this) {
            case DISCONNECTED: return next == CONNECTING || next == CLOSED;
            case CONNECTING:   return next == HANDSHAKING || next == CLOSED;
            case HANDSHAKING:  return next == CONNECTED || next == CLOSED;
            case CONNECTED:    return next == CLOSED;
            default:           return false;
        }
    }

    /**
     * {@code true} once HELLO may have reached the shepherd; a teardown from
     * here on is reported to the close handler.
     */
    public boolean handshakeBegun()
    {
        return this == HANDSHAKING || this == CONNECTED;
    }
}
