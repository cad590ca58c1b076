package com.questrail.shepherd.protocol.codec;

import com.questrail.shepherd.protocol.internal.frame.ShepherdFrame;

/**
 * ShepherdFrameEncoder
 * -----------------------------------------------------------------------------
 * Byte-level encoder for the shepherd socket protocol.
 *
 * <p>This encoder does NOT decide what message to send and does not build
 * payloads. It only applies the mechanical frame layout. The semantic step
 * (message to frame) is performed by
 * {@code com.questrail.shepherd.protocol.internal.encode.ShepherdMessageEncoder}.</p>
 */
public interface ShepherdFrameEncoder
{
    /**
     * Encode a frame into wire-ready bytes suitable for a single socket write.
     */
    byte[] encode(ShepherdFrame frame);
}
