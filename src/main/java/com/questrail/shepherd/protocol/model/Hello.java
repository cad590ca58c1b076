package com.questrail.shepherd.protocol.model;

/**
 * Handshake opener. The first frame a controller sends on a new connection;
 * everything it sends before HELLO is ignored by the shepherd.
 *
 * @param version the protocol version the controller speaks
 */
public record Hello(int version) implements ClientMessage
{
}
