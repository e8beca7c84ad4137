package com.questrail.wfs.osc.internal.time;

import java.time.Instant;

/**
 * Wall-clock source used only to timestamp traffic log entries.
 */
public interface WallClock
{
    Instant now();
}
