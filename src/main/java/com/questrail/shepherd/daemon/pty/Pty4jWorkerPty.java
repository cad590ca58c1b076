package com.questrail.shepherd.daemon.pty;

import com.pty4j.PtyProcess;
import com.pty4j.WinSize;
import com.questrail.shepherd.internal.os.ProcessSignals;
import com.questrail.shepherd.protocol.ShepherdProtocol;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.util.Arrays;

/**
 * pty4j-backed {@link WorkerPty}.
 *
 * <p>A dedicated daemon thread drains the terminal output. End of stream (or
 * the read error Linux reports once the slave side closes) means the worker is
 * gone; the thread then reaps it and reports the exit.</p>
 */
final class Pty4jWorkerPty implements WorkerPty
{
    private static final Logger log = LoggerFactory.getLogger(Pty4jWorkerPty.class);

    private static final int READ_BUFFER_SIZE = 8192;

    private final PtyProcess process;
    private final WorkerPtyListener listener;
    private final OutputStream input;

    /** Last signal we delivered; used to attribute a nonzero exit. */
    private volatile int lastSignal;

    Pty4jWorkerPty(PtyProcess process, WorkerPtyListener listener)
    {
        this.process = process;
        this.listener = listener;
        this.input = process.getOutputStream();
    }

    void startReader()
    {
        Thread reader = new Thread(this::pump, "worker-pty-" + process.pid());
        reader.setDaemon(true);
        reader.start();
    }

    @Override
    public long pid()
    {
        return process.pid();
    }

    @Override
    public void write(byte[] bytes)
    {
        if (!process.isAlive()) {
            return;
        }
        try {
            input.write(bytes);
            input.flush();
        }
        catch (IOException e) {
            log.warn("write to worker {} failed: {}", process.pid(), e.toString());
        }
    }

    @Override
    public void resize(int cols, int rows)
    {
        if (!process.isAlive()) {
            return;
        }
        process.setWinSize(new WinSize(cols, rows));
    }

    @Override
    public void kill(int signal)
    {
        if (!process.isAlive()) {
            return;
        }
        lastSignal = signal;
        if (!ProcessSignals.send(process.pid(), signal)) {
            log.warn("could not deliver {} to worker {}", ShepherdProtocol.signalName(signal), process.pid());
        }
    }

    @Override
    public boolean isAlive()
    {
        return process.isAlive();
    }

    private void pump()
    {
        byte[] buf = new byte[READ_BUFFER_SIZE];
        try (InputStream out = process.getInputStream()) {
            int n;
            while ((n = out.read(buf)) != -1) {
                if (n > 0) {
                    listener.onData(Arrays.copyOf(buf, n));
                }
            }
        }
        catch (IOException e) {
            log.debug("worker {} output closed: {}", process.pid(), e.toString());
        }

        int code;
        try {
            code = process.waitFor();
        }
        catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            listener.onExit(null, null);
            return;
        }

        String signal = (code != 0 && lastSignal != 0) ? ShepherdProtocol.signalName(lastSignal) : null;
        log.info("worker {} exited: code={}, signal={}", process.pid(), code, signal);
        listener.onExit(code, signal);
    }
}
