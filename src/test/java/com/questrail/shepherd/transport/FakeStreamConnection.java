package com.questrail.shepherd.transport;

import java.util.ArrayList;
import java.util.List;

/**
 * In-memory connection. Records outbound bytes; the test injects inbound
 * bytes and remote closes through the owning {@link FakeStreamConnector}.
 */
public final class FakeStreamConnection implements StreamConnection {
    private final StreamConnectionListener listener;
    private final List<byte[]> sent = new ArrayList<>();
    private boolean open = true;

    FakeStreamConnection(StreamConnectionListener listener) {
        this.listener = listener;
    }

    @Override
    public synchronized void send(byte[] bytes) {
        if (open) {
            sent.add(bytes.clone());
        }
    }

    @Override
    public void close() {
        closeWith(null);
    }

    @Override
    public synchronized boolean isOpen() {
        return open;
    }

    public synchronized List<byte[]> sent() {
        return new ArrayList<>(sent);
    }

    /** Deliver bytes as if the peer had written them. */
    public void receive(byte[] bytes) {
        listener.onBytes(this, bytes);
    }

    /** Simulate the peer going away. */
    public void closeRemotely(Throwable cause) {
        closeWith(cause);
    }

    private void closeWith(Throwable cause) {
        synchronized (this) {
            if (!open) {
                return;
            }
            open = false;
        }
        listener.onClosed(this, cause);
    }
}
