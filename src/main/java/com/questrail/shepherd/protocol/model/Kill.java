package com.questrail.shepherd.protocol.model;

/**
 * Request to deliver a signal to the worker.
 *
 * <p>The signal number is carried as sent; whether it is honoured is decided
 * by the shepherd against its allowlist.</p>
 */
public record Kill(int signal) implements ClientMessage
{
}
