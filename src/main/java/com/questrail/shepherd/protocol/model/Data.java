package com.questrail.shepherd.protocol.model;

import java.util.Objects;

/**
 * A chunk of worker output, in the order the worker produced it.
 */
public record Data(byte[] bytes) implements ServerMessage
{
    public Data {
        bytes = Objects.requireNonNull(bytes, "bytes").clone();
    }

    @Override
    public byte[] bytes() {
        return bytes.clone();
    }
}
