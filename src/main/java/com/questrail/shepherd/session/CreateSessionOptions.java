package com.questrail.shepherd.session;

import com.questrail.shepherd.client.VersionWarning;
import com.questrail.shepherd.daemon.ReplayBuffer;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Consumer;

/**
 * Options for {@link SessionManager#createSession}.
 *
 * <p>{@code sessionId} may be {@code null}, in which case a random UUID is
 * used. {@code dataHandler} and {@code versionWarningHandler} may be
 * {@code null}; when set they are installed on the client before the
 * handshake, so output produced while connecting and a warning raised by
 * WELCOME are not lost.</p>
 */
public record CreateSessionOptions(
    String sessionId,
    List<String> args,
    String cwd,
    Map<String, String> env,
    int cols,
    int rows,
    int replayBufferLines,
    RestartPolicy restartPolicy,
    Consumer<byte[]> dataHandler,
    Consumer<VersionWarning> versionWarningHandler
) {
    public CreateSessionOptions {
        Objects.requireNonNull(cwd, "cwd");
        Objects.requireNonNull(restartPolicy, "restartPolicy");
        args = (args == null) ? List.of() : List.copyOf(args);
        env = (env == null) ? Map.of() : Map.copyOf(env);
        if (cols <= 0 || rows <= 0) {
            throw new IllegalArgumentException("cols and rows must be positive");
        }
        if (replayBufferLines <= 0) {
            throw new IllegalArgumentException("replayBufferLines must be positive");
        }
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private String sessionId;
        private List<String> args = List.of();
        private String cwd = System.getProperty("user.dir");
        private Map<String, String> env = Map.of();
        private int cols = 80;
        private int rows = 24;
        private int replayBufferLines = ReplayBuffer.DEFAULT_MAX_LINES;
        private RestartPolicy restartPolicy = RestartPolicy.disabled();
        private Consumer<byte[]> dataHandler;
        private Consumer<VersionWarning> versionWarningHandler;

        public Builder withSessionId(String sessionId) {
            this.sessionId = sessionId;
            return this;
        }

        public Builder withArgs(List<String> args) {
            this.args = args;
            return this;
        }

        public Builder withCwd(String cwd) {
            this.cwd = cwd;
            return this;
        }

        public Builder withEnv(Map<String, String> env) {
            this.env = env;
            return this;
        }

        public Builder withSize(int cols, int rows) {
            this.cols = cols;
            this.rows = rows;
            return this;
        }

        public Builder withReplayBufferLines(int replayBufferLines) {
            this.replayBufferLines = replayBufferLines;
            return this;
        }

        public Builder withRestartPolicy(RestartPolicy restartPolicy) {
            this.restartPolicy = restartPolicy;
            return this;
        }

        public Builder withDataHandler(Consumer<byte[]> dataHandler) {
            this.dataHandler = dataHandler;
            return this;
        }

        public Builder withVersionWarningHandler(Consumer<VersionWarning> versionWarningHandler) {
            this.versionWarningHandler = versionWarningHandler;
            return this;
        }

        public CreateSessionOptions build() {
            return new CreateSessionOptions(sessionId, args, cwd, env, cols, rows,
                replayBufferLines, restartPolicy, dataHandler, versionWarningHandler);
        }
    }
}
