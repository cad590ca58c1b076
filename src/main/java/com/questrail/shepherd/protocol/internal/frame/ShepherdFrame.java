package com.questrail.shepherd.protocol.internal.frame;

import java.util.Optional;

/**
 * ShepherdFrame
 * -----------------------------------------------------------------------------
 * A single length-delimited frame after the byte-level framing has been
 * removed.
 *
 * <p>A frame is <strong>not</strong> a message: the payload is still raw
 * bytes (terminal output, or a JSON control document). Turning a frame into a
 * semantic message is the job of
 * {@code com.questrail.shepherd.protocol.internal.decode.ShepherdMessageDecoder}.</p>
 *
 * <p>The type is kept as the raw wire code so that frames of unknown type can
 * travel up to the point where they are deliberately ignored.</p>
 */
public final class ShepherdFrame
{
    private final int typeCode;

    /**
     * Payload bytes (may be empty, never null).
     */
    private final byte[] payload;

    public ShepherdFrame(int typeCode, byte[] payload)
    {
        if (typeCode < 0 || typeCode > 0xFF) {
            throw new IllegalArgumentException("frame type must fit in one byte: " + typeCode);
        }
        this.typeCode = typeCode;
        this.payload = (payload == null) ? new byte[0] : payload.clone();
    }

    public ShepherdFrame(FrameType type, byte[] payload)
    {
        this(type.code(), payload);
    }

    /**
     * Returns the raw one-byte type code as received on the wire.
     */
    public int typeCode()
    {
        return typeCode;
    }

    /**
     * Returns the known frame type, or empty for codes this build does not know.
     */
    public Optional<FrameType> type()
    {
        return FrameType.fromCode(typeCode);
    }

    /**
     * Returns a copy of the payload bytes.
     */
    public byte[] payload()
    {
        return payload.clone();
    }

    public int payloadLength()
    {
        return payload.length;
    }

    @Override
    public String toString()
    {
        return "ShepherdFrame[" +
                "type=" + type().map(Enum::name).orElse("0x" + Integer.toHexString(typeCode)) +
                ", payloadLength=" + payload.length +
                ']';
    }
}
