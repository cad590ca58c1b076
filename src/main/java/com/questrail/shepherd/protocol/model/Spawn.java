package com.questrail.shepherd.protocol.model;

import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Request to launch a fresh worker on the same shepherd socket.
 *
 * <p>If a worker is still running the shepherd terminates it first, then
 * clears its replay buffer before the new worker produces output.</p>
 *
 * @param command executable to run
 * @param args    arguments, never null
 * @param cwd     working directory
 * @param env     environment overlay, never null
 */
public record Spawn(
        String command,
        List<String> args,
        String cwd,
        Map<String, String> env
) implements ClientMessage
{
    public Spawn {
        Objects.requireNonNull(command, "command");
        Objects.requireNonNull(cwd, "cwd");
        args = (args == null) ? List.of() : List.copyOf(args);
        env = (env == null) ? Map.of() : Map.copyOf(env);
    }
}
