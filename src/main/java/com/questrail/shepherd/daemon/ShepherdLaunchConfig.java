package com.questrail.shepherd.daemon;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.questrail.shepherd.daemon.pty.WorkerCommand;
import com.questrail.shepherd.protocol.internal.json.ProtocolJson;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * ShepherdLaunchConfig
 * =============================================================================
 * The single JSON argument a shepherd daemon is started with.
 *
 * <pre>
 * {"command":"/bin/bash","args":["-l"],"cwd":"/home/me","env":{"FOO":"1"},
 *  "cols":120,"rows":40,"socketPath":"/run/user/1000/shepherd/shepherd-abc.sock",
 *  "replayBufferLines":10000}
 * </pre>
 *
 * <p>Missing {@code args} and {@code env} default to empty, missing terminal
 * dimensions to 80x24 and a missing {@code replayBufferLines} to
 * {@link ReplayBuffer#DEFAULT_MAX_LINES}.</p>
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ShepherdLaunchConfig(
        String command,
        List<String> args,
        String cwd,
        Map<String, String> env,
        int cols,
        int rows,
        String socketPath,
        int replayBufferLines
)
{
    public static final int DEFAULT_COLS = 80;
    public static final int DEFAULT_ROWS = 24;

    public ShepherdLaunchConfig {
        Objects.requireNonNull(command, "command");
        Objects.requireNonNull(cwd, "cwd");
        Objects.requireNonNull(socketPath, "socketPath");
        args = (args == null) ? List.of() : List.copyOf(args);
        env = (env == null) ? Map.of() : Map.copyOf(env);
        if (cols <= 0) cols = DEFAULT_COLS;
        if (rows <= 0) rows = DEFAULT_ROWS;
        if (replayBufferLines <= 0) replayBufferLines = ReplayBuffer.DEFAULT_MAX_LINES;
    }

    public WorkerCommand workerCommand() {
        return new WorkerCommand(command, args, cwd, env);
    }

    public Path socket() {
        return Path.of(socketPath);
    }

    public String toJson() {
        try {
            return ProtocolJson.mapper().writeValueAsString(this);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize launch config", e);
        }
    }

    /**
     * @throws IOException if the text is not JSON or a required field is missing
     */
    public static ShepherdLaunchConfig parse(String json) throws IOException {
        return ProtocolJson.mapper().readValue(json, ShepherdLaunchConfig.class);
    }
}
