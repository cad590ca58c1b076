package com.questrail.shepherd.daemon.pty;

import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * What to run on a pseudo-terminal.
 *
 * @param command executable
 * @param args    arguments, never null
 * @param cwd     working directory
 * @param env     environment overlay applied on top of the shepherd's own
 *                environment, never null
 */
public record WorkerCommand(
        String command,
        List<String> args,
        String cwd,
        Map<String, String> env
)
{
    public WorkerCommand {
        Objects.requireNonNull(command, "command");
        Objects.requireNonNull(cwd, "cwd");
        args = (args == null) ? List.of() : List.copyOf(args);
        env = (env == null) ? Map.of() : Map.copyOf(env);
    }
}
