package com.questrail.shepherd.session;

import com.questrail.shepherd.client.ClientState;
import com.questrail.shepherd.client.ShepherdClient;
import com.questrail.shepherd.client.VersionWarning;
import com.questrail.shepherd.protocol.model.Exit;
import com.questrail.shepherd.protocol.model.Spawn;
import com.questrail.shepherd.protocol.model.Welcome;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.function.Consumer;

/**
 * Scriptable {@link ShepherdClient}. {@link #connect()} answers with the
 * configured outcome; the test fires exit, close and error notifications.
 */
final class FakeShepherdClient implements ShepherdClient {
    private final Path socketPath;
    private Welcome welcome;
    private Throwable connectFailure;
    private Consumer<FakeShepherdClient> duringHandshake = c -> { };

    private ClientState state = ClientState.DISCONNECTED;
    private boolean detached;
    private boolean closeFired;
    private int disconnects;

    final List<Spawn> spawns = new ArrayList<>();
    final List<Integer> kills = new ArrayList<>();

    private Consumer<byte[]> dataHandler;
    private Consumer<Exit> exitHandler;
    private Runnable closeHandler;
    private Consumer<Throwable> errorHandler;
    private Consumer<VersionWarning> versionWarningHandler;

    FakeShepherdClient(Path socketPath, Welcome welcome) {
        this.socketPath = socketPath;
        this.welcome = welcome;
    }

    FakeShepherdClient failingWith(Throwable failure) {
        this.connectFailure = failure;
        return this;
    }

    /** Runs after HELLO would have been sent and before WELCOME is processed. */
    FakeShepherdClient duringHandshake(Consumer<FakeShepherdClient> action) {
        this.duringHandshake = action;
        return this;
    }

    @Override
    public CompletableFuture<Welcome> connect() {
        state = ClientState.HANDSHAKING;
        if (connectFailure != null) {
            state = ClientState.CLOSED;
            return CompletableFuture.failedFuture(connectFailure);
        }
        duringHandshake.accept(this);
        state = ClientState.CONNECTED;
        return CompletableFuture.completedFuture(welcome);
    }

    void fireData(byte[] bytes) {
        if (dataHandler != null) {
            dataHandler.accept(bytes);
        }
    }

    void fireExit(Exit exit) {
        if (exitHandler != null) {
            exitHandler.accept(exit);
        }
    }

    /** The connection went away (shepherd died or closed it). */
    void fireClose() {
        state = ClientState.CLOSED;
        if (!closeFired && closeHandler != null) {
            closeFired = true;
            closeHandler.run();
        }
    }

    void fireError(Throwable error) {
        if (errorHandler != null) {
            errorHandler.accept(error);
        }
    }

    void fireVersionWarning(VersionWarning warning) {
        if (versionWarningHandler != null) {
            versionWarningHandler.accept(warning);
        }
    }

    int disconnects() {
        return disconnects;
    }

    boolean hasHandlers() {
        return exitHandler != null && closeHandler != null && errorHandler != null;
    }

    @Override
    public void write(byte[] bytes) {
    }

    @Override
    public void resize(int cols, int rows) {
    }

    @Override
    public void kill(int signal) {
        detached = true;
        kills.add(signal);
    }

    @Override
    public void spawn(Spawn request) {
        spawns.add(request);
    }

    @Override
    public void ping() {
    }

    @Override
    public void disconnect() {
        disconnects++;
        boolean wasOpen = state == ClientState.CONNECTED || state == ClientState.HANDSHAKING;
        state = ClientState.CLOSED;
        if (wasOpen) {
            fireClose();
        }
    }

    @Override
    public byte[] getReplayData() {
        return (state == ClientState.CONNECTED && welcome != null) ? welcome.replay() : null;
    }

    @Override
    public ClientState state() {
        return state;
    }

    @Override
    public boolean isDetached() {
        return detached;
    }

    @Override
    public Path socketPath() {
        return socketPath;
    }

    @Override
    public void onData(Consumer<byte[]> handler) {
        this.dataHandler = handler;
    }

    @Override
    public void onExit(Consumer<Exit> handler) {
        this.exitHandler = handler;
    }

    @Override
    public void onClose(Runnable handler) {
        this.closeHandler = handler;
    }

    @Override
    public void onError(Consumer<Throwable> handler) {
        this.errorHandler = handler;
    }

    @Override
    public void onVersionWarning(Consumer<VersionWarning> handler) {
        this.versionWarningHandler = handler;
    }
}
