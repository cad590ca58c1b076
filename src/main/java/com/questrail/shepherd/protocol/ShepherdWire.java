package com.questrail.shepherd.protocol;

import com.questrail.shepherd.protocol.codec.FramingException;
import com.questrail.shepherd.protocol.codec.ShepherdFrameDecoder;
import com.questrail.shepherd.protocol.codec.ShepherdFrameEncoder;
import com.questrail.shepherd.protocol.codec.impl.DefaultShepherdFrameDecoder;
import com.questrail.shepherd.protocol.codec.impl.DefaultShepherdFrameEncoder;
import com.questrail.shepherd.protocol.internal.decode.ShepherdMessageDecoder;
import com.questrail.shepherd.protocol.internal.encode.ShepherdMessageEncoder;
import com.questrail.shepherd.protocol.internal.frame.ShepherdFrame;
import com.questrail.shepherd.protocol.model.ShepherdMessage;

import java.util.List;

/**
 * ShepherdWire
 * -----------------------------------------------------------------------------
 * Composition of the two codec layers for one side of one connection.
 *
 * <pre>
 *   outbound: ShepherdMessage → ShepherdMessageEncoder → ShepherdFrame → bytes
 *   inbound:  bytes → ShepherdFrameDecoder → ShepherdFrame → ShepherdMessageDecoder
 * </pre>
 *
 * <p>Inbound decoding is split into two steps so callers can tell a framing
 * failure (stream unusable) from a malformed single frame.</p>
 *
 * <p>An instance holds the streaming decoder state of its connection and is
 * not thread-safe.</p>
 */
public final class ShepherdWire
{
    private final ShepherdFrameDecoder frameDecoder;
    private final ShepherdFrameEncoder frameEncoder = new DefaultShepherdFrameEncoder();
    private final ShepherdMessageDecoder messageDecoder = new ShepherdMessageDecoder();
    private final ShepherdMessageEncoder messageEncoder = new ShepherdMessageEncoder();

    public ShepherdWire()
    {
        this(new DefaultShepherdFrameDecoder());
    }

    public ShepherdWire(ShepherdFrameDecoder frameDecoder)
    {
        this.frameDecoder = frameDecoder;
    }

    public byte[] encode(ShepherdMessage message)
    {
        return frameEncoder.encode(messageEncoder.encode(message));
    }

    public List<ShepherdFrame> frames(byte[] chunk) throws FramingException
    {
        return frameDecoder.decode(chunk);
    }

    public ShepherdMessageDecoder messages()
    {
        return messageDecoder;
    }
}
