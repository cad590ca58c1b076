package com.questrail.shepherd.protocol.model;

/**
 * Keepalive request. Answered with {@link Pong}.
 */
public record Ping() implements ClientMessage
{
}
