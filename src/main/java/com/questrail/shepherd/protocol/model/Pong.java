package com.questrail.shepherd.protocol.model;

/**
 * Keepalive answer to a {@link Ping}.
 */
public record Pong() implements ServerMessage
{
}
