package com.questrail.shepherd.client;

/**
 * Raised when a controller attaches to a shepherd speaking an older protocol
 * than its own. The connection stays up.
 */
public record VersionWarning(int clientVersion, int shepherdVersion)
{
}
