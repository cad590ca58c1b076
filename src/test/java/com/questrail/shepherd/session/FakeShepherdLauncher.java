package com.questrail.shepherd.session;

import com.questrail.shepherd.daemon.ShepherdLaunchConfig;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.PosixFilePermissions;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Pretends to start shepherds. By default it creates the socket file (as a
 * plain, group-readable file) and reports a fresh pid.
 */
final class FakeShepherdLauncher implements ShepherdLauncher {
    final List<ShepherdLaunchConfig> launches = new ArrayList<>();
    private final AtomicLong nextPid = new AtomicLong(70_000);

    boolean createSocketFile = true;
    IOException failure;

    @Override
    public LaunchedShepherd launch(ShepherdLaunchConfig config) throws IOException {
        launches.add(config);
        if (failure != null) {
            throw failure;
        }
        if (createSocketFile) {
            Path socket = config.socket();
            Files.createFile(socket, PosixFilePermissions.asFileAttribute(PosixFilePermissions.fromString("rw-r-----")));
        }
        return new LaunchedShepherd(nextPid.getAndIncrement(), 1_700_000_000_000L);
    }

    long lastPid() {
        return nextPid.get() - 1;
    }
}
