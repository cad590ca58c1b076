package com.questrail.shepherd.protocol.codec;

/**
 * Raised when the inbound byte stream violates the frame layout
 * (oversized length prefix, data after a previous framing failure).
 *
 * <p>A framing failure is fatal for the connection it occurred on: the
 * stream position is no longer trustworthy, so the connection must be
 * closed. It is never fatal for the process hosting the connection.</p>
 */
public final class FramingException extends Exception
{
    public FramingException(String message)
    {
        super(message);
    }
}
