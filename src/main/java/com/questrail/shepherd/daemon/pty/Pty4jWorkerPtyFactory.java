package com.questrail.shepherd.daemon.pty;

import com.pty4j.PtyProcess;
import com.pty4j.PtyProcessBuilder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Starts workers on a real pseudo-terminal through pty4j.
 *
 * <p>The worker environment is the shepherd's environment overlaid with the
 * command's {@code env}. {@code TERM} defaults to {@code xterm-256color}.</p>
 */
public final class Pty4jWorkerPtyFactory implements WorkerPtyFactory
{
    private static final Logger log = LoggerFactory.getLogger(Pty4jWorkerPtyFactory.class);

    static final String DEFAULT_TERM = "xterm-256color";

    @Override
    public WorkerPty spawn(WorkerCommand command, int cols, int rows, WorkerPtyListener listener) throws IOException
    {
        Objects.requireNonNull(command, "command");
        Objects.requireNonNull(listener, "listener");

        List<String> argv = new ArrayList<>(1 + command.args().size());
        argv.add(command.command());
        argv.addAll(command.args());

        Map<String, String> env = new HashMap<>(System.getenv());
        env.putIfAbsent("TERM", DEFAULT_TERM);
        env.putAll(command.env());

        PtyProcess process = new PtyProcessBuilder(argv.toArray(new String[0]))
                .setEnvironment(env)
                .setDirectory(command.cwd())
                .setInitialColumns(cols)
                .setInitialRows(rows)
                .setRedirectErrorStream(true)
                .start();

        log.info("worker started: pid={}, command={}, cols={}, rows={}", process.pid(), command.command(), cols, rows);

        Pty4jWorkerPty pty = new Pty4jWorkerPty(process, listener);
        pty.startReader();
        return pty;
    }
}
