package com.questrail.shepherd.protocol.model;

/**
 * New terminal dimensions for the worker's PTY.
 */
public record Resize(int cols, int rows) implements ClientMessage
{
    public Resize {
        if (cols <= 0 || rows <= 0) {
            throw new IllegalArgumentException("cols and rows must be positive: " + cols + "x" + rows);
        }
    }
}
