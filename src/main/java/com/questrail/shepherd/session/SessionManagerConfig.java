package com.questrail.shepherd.session;

import com.questrail.shepherd.client.DefaultShepherdClient;
import com.questrail.shepherd.observability.SessionEventSink;
import com.questrail.shepherd.observability.Slf4jSessionEventSink;
import com.questrail.shepherd.protocol.ShepherdProtocol;

import java.nio.file.Path;
import java.time.Duration;
import java.util.Objects;

/**
 * Configuration for a {@link SessionManager}.
 *
 * @param socketDir             directory holding {@code shepherd-<id>.sock} files
 * @param launcher              starts shepherd processes
 * @param signaller             signals shepherd processes
 * @param socketWaitTimeout     how long {@code createSession} polls for the socket file
 * @param socketPollInterval    interval of that poll
 * @param connectTimeout        bound on a client handshake
 * @param probeTimeout          bound on each stale-socket probe
 * @param killTimeout           wait after the kill signal before escalating to SIGKILL
 * @param clientProtocolVersion version announced in HELLO
 * @param maxPendingFrames      frames a client may buffer before WELCOME
 * @param eventSink             receives session notifications
 */
public record SessionManagerConfig(
    Path socketDir,
    ShepherdLauncher launcher,
    ProcessSignaller signaller,
    Duration socketWaitTimeout,
    Duration socketPollInterval,
    Duration connectTimeout,
    Duration probeTimeout,
    Duration killTimeout,
    int clientProtocolVersion,
    int maxPendingFrames,
    SessionEventSink eventSink
) {
    public static final Duration DEFAULT_SOCKET_WAIT_TIMEOUT = Duration.ofSeconds(5);
    public static final Duration DEFAULT_SOCKET_POLL_INTERVAL = Duration.ofMillis(50);
    public static final Duration DEFAULT_CONNECT_TIMEOUT = Duration.ofSeconds(5);
    public static final Duration DEFAULT_PROBE_TIMEOUT = Duration.ofSeconds(2);
    public static final Duration DEFAULT_KILL_TIMEOUT = Duration.ofSeconds(5);

    public SessionManagerConfig {
        Objects.requireNonNull(socketDir, "socketDir");
        Objects.requireNonNull(launcher, "launcher");
        Objects.requireNonNull(signaller, "signaller");
        Objects.requireNonNull(socketWaitTimeout, "socketWaitTimeout");
        Objects.requireNonNull(socketPollInterval, "socketPollInterval");
        Objects.requireNonNull(connectTimeout, "connectTimeout");
        Objects.requireNonNull(probeTimeout, "probeTimeout");
        Objects.requireNonNull(killTimeout, "killTimeout");
        Objects.requireNonNull(eventSink, "eventSink");
        if (socketPollInterval.isZero() || socketPollInterval.isNegative()) {
            throw new IllegalArgumentException("socketPollInterval must be positive");
        }
        if (maxPendingFrames <= 0) {
            throw new IllegalArgumentException("maxPendingFrames must be positive");
        }
    }

    public static Path defaultSocketDir() {
        return Path.of(System.getProperty("user.home"), ".shepherd", "sockets");
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private Path socketDir = defaultSocketDir();
        private ShepherdLauncher launcher = new ProcessShepherdLauncher();
        private ProcessSignaller signaller = OsProcessSignaller.INSTANCE;
        private Duration socketWaitTimeout = DEFAULT_SOCKET_WAIT_TIMEOUT;
        private Duration socketPollInterval = DEFAULT_SOCKET_POLL_INTERVAL;
        private Duration connectTimeout = DEFAULT_CONNECT_TIMEOUT;
        private Duration probeTimeout = DEFAULT_PROBE_TIMEOUT;
        private Duration killTimeout = DEFAULT_KILL_TIMEOUT;
        private int clientProtocolVersion = ShepherdProtocol.PROTOCOL_VERSION;
        private int maxPendingFrames = DefaultShepherdClient.DEFAULT_MAX_PENDING_FRAMES;
        private SessionEventSink eventSink = new Slf4jSessionEventSink();

        public Builder withSocketDir(Path socketDir) {
            this.socketDir = socketDir;
            return this;
        }

        public Builder withLauncher(ShepherdLauncher launcher) {
            this.launcher = launcher;
            return this;
        }

        public Builder withSignaller(ProcessSignaller signaller) {
            this.signaller = signaller;
            return this;
        }

        public Builder withSocketWaitTimeout(Duration socketWaitTimeout) {
            this.socketWaitTimeout = socketWaitTimeout;
            return this;
        }

        public Builder withSocketPollInterval(Duration socketPollInterval) {
            this.socketPollInterval = socketPollInterval;
            return this;
        }

        public Builder withConnectTimeout(Duration connectTimeout) {
            this.connectTimeout = connectTimeout;
            return this;
        }

        public Builder withProbeTimeout(Duration probeTimeout) {
            this.probeTimeout = probeTimeout;
            return this;
        }

        public Builder withKillTimeout(Duration killTimeout) {
            this.killTimeout = killTimeout;
            return this;
        }

        public Builder withClientProtocolVersion(int clientProtocolVersion) {
            this.clientProtocolVersion = clientProtocolVersion;
            return this;
        }

        public Builder withMaxPendingFrames(int maxPendingFrames) {
            this.maxPendingFrames = maxPendingFrames;
            return this;
        }

        public Builder withEventSink(SessionEventSink eventSink) {
            this.eventSink = eventSink;
            return this;
        }

        public SessionManagerConfig build() {
            return new SessionManagerConfig(socketDir, launcher, signaller, socketWaitTimeout,
                socketPollInterval, connectTimeout, probeTimeout, killTimeout,
                clientProtocolVersion, maxPendingFrames, eventSink);
        }
    }
}
