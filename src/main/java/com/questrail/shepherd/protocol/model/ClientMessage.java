package com.questrail.shepherd.protocol.model;

/**
 * Marker interface for all controller → shepherd messages.
 */
public sealed interface ClientMessage extends ShepherdMessage
        permits
        Hello,
        WriteInput,
        Resize,
        Kill,
        Spawn,
        Ping
{
}
