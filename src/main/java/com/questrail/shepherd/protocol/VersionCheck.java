package com.questrail.shepherd.protocol;

/**
 * Outcome of comparing the controller's protocol version with the one a
 * shepherd announced in its WELCOME.
 */
public enum VersionCheck
{
    /** Versions match. */
    PROCEED,

    /**
     * The controller is newer than the shepherd. The connection is kept and a
     * non-fatal warning is raised.
     */
    WARN,

    /**
     * The controller is older than the shepherd. The connection must be
     * abandoned; the controller has to be upgraded before it can reattach.
     */
    REJECT
}
