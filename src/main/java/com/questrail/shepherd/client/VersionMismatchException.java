package com.questrail.shepherd.client;

import com.questrail.shepherd.protocol.ShepherdProtocol;

/**
 * The shepherd speaks a newer protocol than this controller; the controller
 * must be upgraded before it can reattach. The shepherd itself is healthy and
 * its socket must not be treated as stale.
 */
public final class VersionMismatchException extends ShepherdConnectException
{
    private final int clientVersion;
    private final int shepherdVersion;

    public VersionMismatchException(int clientVersion, int shepherdVersion)
    {
        super(ShepherdProtocol.STALE_SHEPHERD_MESSAGE
                + " (client version " + clientVersion + ", shepherd version " + shepherdVersion + ")");
        this.clientVersion = clientVersion;
        this.shepherdVersion = shepherdVersion;
    }

    public int clientVersion()
    {
        return clientVersion;
    }

    public int shepherdVersion()
    {
        return shepherdVersion;
    }
}
