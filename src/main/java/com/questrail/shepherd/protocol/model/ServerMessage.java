package com.questrail.shepherd.protocol.model;

/**
 * Marker interface for all shepherd → controller messages.
 */
public sealed interface ServerMessage extends ShepherdMessage
        permits
        Welcome,
        Data,
        Exit,
        Pong
{
}
