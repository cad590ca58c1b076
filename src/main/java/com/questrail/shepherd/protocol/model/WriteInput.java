package com.questrail.shepherd.protocol.model;

import java.util.Objects;

/**
 * Bytes to be written to the worker's terminal input, unmodified.
 */
public record WriteInput(byte[] bytes) implements ClientMessage
{
    public WriteInput {
        bytes = Objects.requireNonNull(bytes, "bytes").clone();
    }

    @Override
    public byte[] bytes() {
        return bytes.clone();
    }
}
