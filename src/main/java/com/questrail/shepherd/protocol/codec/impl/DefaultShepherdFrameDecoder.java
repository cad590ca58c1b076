package com.questrail.shepherd.protocol.codec.impl;

import com.questrail.shepherd.protocol.codec.FramingException;
import com.questrail.shepherd.protocol.codec.ShepherdFrameDecoder;
import com.questrail.shepherd.protocol.internal.frame.ShepherdFrame;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * DefaultShepherdFrameDecoder
 * -----------------------------------------------------------------------------
 * Concrete implementation of {@link ShepherdFrameDecoder}.
 *
 * <p>Input is appended to an internal accumulation buffer. After each append
 * the decoder repeatedly:</p>
 * <ol>
 *   <li>Waits until a full header is buffered</li>
 *   <li>Validates the declared payload length against {@link ShepherdFraming#MAX_PAYLOAD_SIZE}</li>
 *   <li>Waits until the full payload is buffered</li>
 *   <li>Emits a {@link ShepherdFrame} and compacts the buffer</li>
 * </ol>
 *
 * <p>An oversized length is rejected as soon as the header is visible, before
 * any payload is buffered. After a failure the decoder refuses further input.</p>
 *
 * <p>Not thread-safe. Each connection owns its own instance.</p>
 */
public final class DefaultShepherdFrameDecoder implements ShepherdFrameDecoder
{
    private byte[] buffer = new byte[256];
    private int size;
    private boolean failed;

    @Override
    public List<ShepherdFrame> decode(byte[] chunk) throws FramingException
    {
        if (failed) {
            throw new FramingException("decoder already failed; stream is unusable");
        }
        if (chunk == null || chunk.length == 0) {
            return Collections.emptyList();
        }

        append(chunk);

        List<ShepherdFrame> frames = new ArrayList<>();
        int offset = 0;
        while (size - offset >= ShepherdFraming.HEADER_SIZE) {
            final int type = buffer[offset] & 0xFF;
            final int length = ShepherdFraming.readLength(buffer, offset + 1);

            // Lengths above 2^31 arrive negative after the shift.
            if (length < 0 || length > ShepherdFraming.MAX_PAYLOAD_SIZE) {
                failed = true;
                throw new FramingException("frame payload length " + Integer.toUnsignedString(length)
                        + " exceeds maximum " + ShepherdFraming.MAX_PAYLOAD_SIZE);
            }

            final int frameEnd = offset + ShepherdFraming.HEADER_SIZE + length;
            if (frameEnd > size) {
                break;
            }

            byte[] payload = Arrays.copyOfRange(buffer, offset + ShepherdFraming.HEADER_SIZE, frameEnd);
            frames.add(new ShepherdFrame(type, payload));
            offset = frameEnd;
        }

        compact(offset);
        return frames;
    }

    @Override
    public int bufferedBytes()
    {
        return size;
    }

    private void append(byte[] chunk)
    {
        int needed = size + chunk.length;
        if (needed > buffer.length) {
            int capacity = buffer.length;
            while (capacity < needed) {
                capacity = capacity << 1;
            }
            buffer = Arrays.copyOf(buffer, capacity);
        }
        System.arraycopy(chunk, 0, buffer, size, chunk.length);
        size = needed;
    }

    private void compact(int consumed)
    {
        if (consumed == 0) {
            return;
        }
        int remaining = size - consumed;
        System.arraycopy(buffer, consumed, buffer, 0, remaining);
        size = remaining;
    }
}
