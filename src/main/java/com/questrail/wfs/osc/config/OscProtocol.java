package com.questrail.wfs.osc.config;

/**
 * Protocol dialect spoken with a target.
 *
 * <p>{@link #OSC} and {@link #REMOTE} have full translation support. The other
 * dialects are configuration values only: they take part in activity checks
 * and loop prevention, but no dialect-specific messages are produced.</p>
 */
public enum OscProtocol {
    DISABLED,
    OSC,
    REMOTE,
    ADM_OSC,
    OSC_QUERY,
    PSN,
    RTTRP,
    QLAB
}
