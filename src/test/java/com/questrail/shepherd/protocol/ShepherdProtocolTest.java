package com.questrail.shepherd.protocol;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

final class ShepherdProtocolTest
{
    @Test
    void olderControllerIsRejected()
    {
        assertEquals(VersionCheck.REJECT, ShepherdProtocol.negotiate(1, 2));
    }

    @Test
    void newerControllerWarns()
    {
        assertEquals(VersionCheck.WARN, ShepherdProtocol.negotiate(3, 2));
    }

    @Test
    void equalVersionsProceed()
    {
        assertEquals(VersionCheck.PROCEED,
                ShepherdProtocol.negotiate(ShepherdProtocol.PROTOCOL_VERSION, ShepherdProtocol.PROTOCOL_VERSION));
    }

    @Test
    void onlyAllowlistedSignalsAreAccepted()
    {
        for (int signal : new int[] { 1, 2, 9, 15, 28 }) {
            assertTrue(ShepherdProtocol.isAllowedSignal(signal), "signal " + signal);
        }
        assertFalse(ShepherdProtocol.isAllowedSignal(3));
        assertFalse(ShepherdProtocol.isAllowedSignal(19));
        assertFalse(ShepherdProtocol.isAllowedSignal(0));
    }

    @Test
    void signalNamesFallBackToNumber()
    {
        assertEquals("SIGTERM", ShepherdProtocol.signalName(15));
        assertEquals("SIGWINCH", ShepherdProtocol.signalName(28));
        assertEquals("SIG40", ShepherdProtocol.signalName(40));
    }
}
