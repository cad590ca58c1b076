package com.questrail.shepherd.protocol.internal.frame;

import java.util.Optional;

/**
 * FrameType
 * -----------------------------------------------------------------------------
 * The one-byte type codes carried in the first byte of every shepherd frame.
 *
 * <p>Codes are part of the wire contract and must never be renumbered. Codes
 * not listed here are legal on the wire and are ignored by both peers, which
 * lets a newer shepherd introduce frame types without breaking older
 * controllers.</p>
 */
public enum FrameType
{
    /** Worker output, shepherd to client. Raw bytes. */
    DATA(0x01),

    /** Terminal size change, client to shepherd. JSON {@code {cols, rows}}. */
    RESIZE(0x02),

    /** Signal the worker, client to shepherd. JSON {@code {signal}}. */
    KILL(0x03),

    /** Worker exited, shepherd to client. JSON {@code {code, signal}}. */
    EXIT(0x04),

    /** Keepalive request, client to shepherd. Empty. */
    PING(0x06),

    /** Keepalive answer, shepherd to client. Empty. */
    PONG(0x07),

    /** Handshake opener, client to shepherd. JSON {@code {version}}. */
    HELLO(0x08),

    /** Handshake answer, shepherd to client. JSON, see {@code Welcome}. */
    WELCOME(0x09),

    /** Relaunch the worker on the open socket, client to shepherd. JSON. */
    SPAWN(0x0A),

    /** Worker input, client to shepherd. Raw bytes. */
    WRITE(0x0B);

    private final int code;

    FrameType(int code)
    {
        this.code = code;
    }

    public int code()
    {
        return code;
    }

    public static Optional<FrameType> fromCode(int code)
    {
        for (FrameType type : values()) {
            if (type.code == code) {
                return Optional.of(type);
            }
        }
        return Optional.empty();
    }
}
