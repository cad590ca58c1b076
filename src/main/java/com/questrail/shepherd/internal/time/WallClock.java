package com.questrail.shepherd.internal.time;

import java.time.Instant;

/**
 * WallClock
 * =============================================================================
 * Wall-clock source for session creation times and event timestamps.
 *
 * <p>
 * May jump due to NTP or manual adjustment; never used to decide when a
 * restart or reset fires.
 * </p>
 */
public interface WallClock
{
    Instant now();
}
