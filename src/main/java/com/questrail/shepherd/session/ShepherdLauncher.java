package com.questrail.shepherd.session;

import com.questrail.shepherd.daemon.ShepherdLaunchConfig;

import java.io.IOException;

/**
 * Starts detached shepherd processes.
 */
@FunctionalInterface
public interface ShepherdLauncher {
    /**
     * Start a shepherd and wait until it reports its identity.
     *
     * <p>Blocking. If the process started but did not report in time the
     * implementation kills it before throwing.</p>
     *
     * @throws IOException if the process could not be started or did not report
     */
    LaunchedShepherd launch(ShepherdLaunchConfig config) throws IOException;
}
