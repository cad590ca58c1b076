package com.questrail.shepherd.protocol.codec;

import com.questrail.shepherd.protocol.internal.frame.ShepherdFrame;

import java.util.List;

/**
 * ShepherdFrameDecoder
 * -----------------------------------------------------------------------------
 * Streaming byte-level decoder for the shepherd socket protocol.
 *
 * <p>Unlike a datagram codec, a stream socket delivers bytes in arbitrary
 * chunks: one read may hold half a header, another may hold several frames.
 * Implementations therefore accumulate input across calls and are
 * <strong>stateful</strong>; one decoder instance belongs to exactly one
 * connection.</p>
 *
 * <p>The decoder is responsible only for:</p>
 * <ul>
 *   <li>Reassembling frames across read boundaries</li>
 *   <li>Enforcing the maximum payload size</li>
 *   <li>Constructing {@link ShepherdFrame}s in arrival order</li>
 * </ul>
 *
 * <p>It does not interpret payloads, does not drop unknown frame types and
 * does not know about the handshake.</p>
 */
public interface ShepherdFrameDecoder
{
    /**
     * Feed the next chunk of bytes read from the socket.
     *
     * @param chunk bytes exactly as read; may be empty
     * @return every frame completed by this chunk, in wire order; possibly empty
     * @throws FramingException if the stream is malformed. The decoder stays
     *         failed afterwards and rejects all further input.
     */
    List<ShepherdFrame> decode(byte[] chunk) throws FramingException;

    /**
     * Number of bytes held back waiting for the rest of a frame.
     */
    int bufferedBytes();
}
