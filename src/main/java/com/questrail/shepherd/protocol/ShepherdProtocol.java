package com.questrail.shepherd.protocol;

import com.questrail.shepherd.protocol.codec.impl.ShepherdFraming;

import java.util.Set;

/**
 * ShepherdProtocol
 * =============================================================================
 * Protocol-wide constants and rules shared by the shepherd daemon and its
 * controllers.
 *
 * <h2>Version negotiation</h2>
 * <p>The controller sends its version in HELLO; the shepherd answers with its
 * own in WELCOME and never refuses a HELLO. The controller decides:</p>
 * <ul>
 *   <li>controller &lt; shepherd: {@link VersionCheck#REJECT}</li>
 *   <li>controller &gt; shepherd: {@link VersionCheck#WARN}</li>
 *   <li>equal: {@link VersionCheck#PROCEED}</li>
 * </ul>
 *
 * <h2>Signal allowlist</h2>
 * <p>KILL requests are honoured only for the signals in
 * {@link #ALLOWED_SIGNALS}.</p>
 */
public final class ShepherdProtocol
{
    public static final int PROTOCOL_VERSION = 1;

    public static final int MAX_FRAME_SIZE = ShepherdFraming.MAX_PAYLOAD_SIZE;

    public static final int SIGHUP = 1;
    public static final int SIGINT = 2;
    public static final int SIGKILL = 9;
    public static final int SIGTERM = 15;
    public static final int SIGWINCH = 28;

    public static final Set<Integer> ALLOWED_SIGNALS = Set.of(SIGHUP, SIGINT, SIGKILL, SIGTERM, SIGWINCH);

    /** Error text used when a controller finds a newer shepherd. */
    public static final String STALE_SHEPHERD_MESSAGE = "stale shepherd, reconnect after upgrade";

    private ShepherdProtocol() {
    }

    public static VersionCheck negotiate(int clientVersion, int shepherdVersion)
    {
        if (clientVersion < shepherdVersion) {
            return VersionCheck.REJECT;
        }
        if (clientVersion > shepherdVersion) {
            return VersionCheck.WARN;
        }
        return VersionCheck.PROCEED;
    }

    public static boolean isAllowedSignal(int signal)
    {
        return ALLOWED_SIGNALS.contains(signal);
    }

    /**
     * Conventional name for a signal number, {@code "SIG<n>"} for numbers
     * without one.
     */
    public static String signalName(int signal)
    {
        switch (signal) {
            case SIGHUP:   return "SIGHUP";
            case SIGINT:   return "SIGINT";
            case 3:        return "SIGQUIT";
            case 6:        return "SIGABRT";
            case SIGKILL:  return "SIGKILL";
            case 13:       return "SIGPIPE";
            case 14:       return "SIGALRM";
            case SIGTERM:  return "SIGTERM";
            case SIGWINCH: return "SIGWINCH";
            default:       return "SIG" + signal;
        }
    }
}
