package com.questrail.shepherd.daemon;

import java.io.ByteArrayOutputStream;
import java.util.ArrayDeque;
import java.util.Arrays;
import java.util.Deque;

/**
 * ReplayBuffer
 * -----------------------------------------------------------------------------
 * Recent worker output, kept as the raw chunks the worker produced so escape
 * sequences survive intact.
 *
 * <p>Bounded by line count ({@code '\n'} bytes). When over the limit the
 * oldest whole chunks are evicted first; if a single remaining chunk still
 * holds too many lines it is trimmed from the front, just past the newline
 * that ends the oldest surplus line.</p>
 *
 * <p>Not thread-safe; the shepherd guards it with its own monitor.</p>
 */
public final class ReplayBuffer
{
    public static final int DEFAULT_MAX_LINES = 10_000;

    private final int maxLines;
    private final Deque<Chunk> chunks = new ArrayDeque<>();
    private long totalBytes;
    private long lineCount;

    public ReplayBuffer()
    {
        this(DEFAULT_MAX_LINES);
    }

    public ReplayBuffer(int maxLines)
    {
        if (maxLines <= 0) {
            throw new IllegalArgumentException("maxLines must be > 0");
        }
        this.maxLines = maxLines;
    }

    public void append(byte[] data)
    {
        if (data == null || data.length == 0) {
            return;
        }

        Chunk chunk = new Chunk(data.clone());
        chunks.addLast(chunk);
        totalBytes += chunk.bytes.length;
        lineCount += chunk.lines;

        while (lineCount > maxLines && chunks.size() > 1) {
            Chunk oldest = chunks.removeFirst();
            totalBytes -= oldest.bytes.length;
            lineCount -= oldest.lines;
        }

        if (lineCount > maxLines && chunks.size() == 1) {
            Chunk only = chunks.removeFirst();
            long skip = lineCount - maxLines;
            int offset = 0;
            while (skip > 0 && offset < only.bytes.length) {
                if (only.bytes[offset] == '\n') {
                    skip--;
                }
                offset++;
            }
            Chunk trimmed = new Chunk(Arrays.copyOfRange(only.bytes, offset, only.bytes.length));
            chunks.addLast(trimmed);
            totalBytes = trimmed.bytes.length;
            lineCount = trimmed.lines;
        }
    }

    /**
     * All buffered output, oldest first.
     */
    public byte[] snapshot()
    {
        ByteArrayOutputStream out = new ByteArrayOutputStream((int) Math.min(Integer.MAX_VALUE, totalBytes));
        for (Chunk c : chunks) {
            out.write(c.bytes, 0, c.bytes.length);
        }
        return out.toByteArray();
    }

    public void clear()
    {
        chunks.clear();
        totalBytes = 0;
        lineCount = 0;
    }

    public long size()
    {
        return totalBytes;
    }

    public long lines()
    {
        return lineCount;
    }

    public int maxLines()
    {
        return maxLines;
    }

    private static final class Chunk
    {
        final byte[] bytes;
        final int lines;

        Chunk(byte[] bytes)
        {
            this.bytes = bytes;
            int n = 0;
            for (byte b : bytes) {
                if (b == '\n') {
                    n++;
                }
            }
            this.lines = n;
        }
    }
}
