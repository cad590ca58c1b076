package com.questrail.shepherd.protocol.codec.impl;

import com.questrail.shepherd.protocol.codec.ShepherdFrameEncoder;
import com.questrail.shepherd.protocol.internal.frame.ShepherdFrame;

import java.util.Objects;

/**
 * DefaultShepherdFrameEncoder
 * -----------------------------------------------------------------------------
 * Concrete implementation of {@link ShepherdFrameEncoder}.
 *
 * <p>Writes the type byte, the big-endian payload length and the payload. A
 * payload larger than {@link ShepherdFraming#MAX_PAYLOAD_SIZE} is refused here
 * so that a peer never has to reject it.</p>
 */
public final class DefaultShepherdFrameEncoder implements ShepherdFrameEncoder
{
    @Override
    public byte[] encode(ShepherdFrame frame)
    {
        Objects.requireNonNull(frame, "frame");

        final byte[] payload = frame.payload();
        if (payload.length > ShepherdFraming.MAX_PAYLOAD_SIZE) {
            throw new IllegalArgumentException("payload of " + payload.length
                    + " bytes exceeds maximum " + ShepherdFraming.MAX_PAYLOAD_SIZE);
        }

        byte[] out = new byte[ShepherdFraming.HEADER_SIZE + payload.length];
        out[0] = (byte) frame.typeCode();
        ShepherdFraming.writeLength(out, 1, payload.length);
        System.arraycopy(payload, 0, out, ShepherdFraming.HEADER_SIZE, payload.length);
        return out;
    }
}
