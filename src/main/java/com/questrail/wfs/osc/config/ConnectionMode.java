package com.questrail.wfs.osc.config;

/**
 * Transport used to reach a target, and the transport a packet arrived on.
 */
public enum ConnectionMode {
    UDP,
    TCP
}
