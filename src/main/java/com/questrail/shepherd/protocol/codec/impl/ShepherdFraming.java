package com.questrail.shepherd.protocol.codec.impl;

/**
 * ShepherdFraming
 * -----------------------------------------------------------------------------
 * Layout constants for the shepherd frame header.
 *
 * <pre>
 *   +--------+----------------------------+-----------------+
 *   | type   | payload length (BE uint32) | payload ...     |
 *   | 1 byte | 4 bytes                    | length bytes    |
 *   +--------+----------------------------+-----------------+
 * </pre>
 *
 * <p>There is no preamble, terminator, escaping or checksum: the stream is
 * binary from the first byte and integrity is the socket's responsibility.</p>
 */
public final class ShepherdFraming
{
    /** Type byte plus four length bytes. */
    public static final int HEADER_SIZE = 5;

    /** Largest payload either peer will accept (16 MiB). */
    public static final int MAX_PAYLOAD_SIZE = 16 * 1024 * 1024;

    private ShepherdFraming() {
    }

    static int readLength(byte[] buf, int offset)
    {
        return ((buf[offset] & 0xFF) << 24)
                | ((buf[offset + 1] & 0xFF) << 16)
                | ((buf[offset + 2] & 0xFF) << 8)
                | (buf[offset + 3] & 0xFF);
    }

    static void writeLength(byte[] buf, int offset, int length)
    {
        buf[offset]     = (byte) (length >>> 24);
        buf[offset + 1] = (byte) (length >>> 16);
        buf[offset + 2] = (byte) (length >>> 8);
        buf[offset + 3] = (byte) length;
    }
}
