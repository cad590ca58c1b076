package com.questrail.shepherd.session;

import java.time.Duration;
import java.util.Objects;

/**
 * RestartPolicy
 * =============================================================================
 * Auto-restart settings for one session.
 *
 * <h2>Circuit breaker</h2>
 * Each worker exit consumes one restart until {@code maxRestarts} have been
 * used; the next exit removes the session. The counter returns to zero once a
 * restarted worker has stayed up for {@link #effectiveResetWindow()}.
 *
 * @param restartOnExit     restart the worker when it exits
 * @param restartDelay      wait between EXIT and the SPAWN that replaces the worker
 * @param maxRestarts       restarts allowed before the session is given up
 * @param restartResetAfter uptime after which the restart counter is cleared
 */
public record RestartPolicy(
    boolean restartOnExit,
    Duration restartDelay,
    int maxRestarts,
    Duration restartResetAfter
) {
    public static final Duration DEFAULT_RESTART_DELAY = Duration.ofSeconds(2);
    public static final int DEFAULT_MAX_RESTARTS = 50;
    public static final Duration DEFAULT_RESTART_RESET_AFTER = Duration.ofMinutes(5);

    public RestartPolicy {
        Objects.requireNonNull(restartDelay, "restartDelay");
        Objects.requireNonNull(restartResetAfter, "restartResetAfter");
        if (restartDelay.isNegative()) {
            throw new IllegalArgumentException("restartDelay must be >= 0");
        }
        if (restartResetAfter.isNegative()) {
            throw new IllegalArgumentException("restartResetAfter must be >= 0");
        }
        if (maxRestarts < 0) {
            throw new IllegalArgumentException("maxRestarts must be >= 0");
        }
    }

    /**
     * No restarts: the first exit removes the session.
     */
    public static RestartPolicy disabled() {
        return builder().build();
    }

    /**
     * Restart on exit with the default delay, budget and reset window.
     */
    public static RestartPolicy defaults() {
        return builder().withRestartOnExit(true).build();
    }

    /**
     * The reset window never ends before a pending restart could have fired.
     */
    public Duration effectiveResetWindow() {
        return restartResetAfter.compareTo(restartDelay) >= 0 ? restartResetAfter : restartDelay;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private boolean restartOnExit;
        private Duration restartDelay = DEFAULT_RESTART_DELAY;
        private int maxRestarts = DEFAULT_MAX_RESTARTS;
        private Duration restartResetAfter = DEFAULT_RESTART_RESET_AFTER;

        public Builder withRestartOnExit(boolean restartOnExit) {
            this.restartOnExit = restartOnExit;
            return this;
        }

        public Builder withRestartDelay(Duration restartDelay) {
            this.restartDelay = restartDelay;
            return this;
        }

        public Builder withMaxRestarts(int maxRestarts) {
            this.maxRestarts = maxRestarts;
            return this;
        }

        public Builder withRestartResetAfter(Duration restartResetAfter) {
            this.restartResetAfter = restartResetAfter;
            return this;
        }

        public RestartPolicy build() {
            return new RestartPolicy(restartOnExit, restartDelay, maxRestarts, restartResetAfter);
        }
    }
}
