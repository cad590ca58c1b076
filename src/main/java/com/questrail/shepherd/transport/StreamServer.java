package com.questrail.shepherd.transport;

import java.nio.file.Path;

/**
 * A bound, listening socket. Closing it stops accepting; connections already
 * accepted are left alone.
 */
public interface StreamServer extends AutoCloseable
{
    Path socketPath();

    @Override
    void close();
}
