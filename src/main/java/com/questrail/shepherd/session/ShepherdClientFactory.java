package com.questrail.shepherd.session;

import com.questrail.shepherd.client.ShepherdClient;

import java.nio.file.Path;

/**
 * Creates unconnected clients for shepherd sockets.
 */
@FunctionalInterface
public interface ShepherdClientFactory {
    ShepherdClient create(Path socketPath);
}
