package com.questrail.wfs.osc.connection;

/**
 * Lifecycle state of one target connection.
 *
 * <pre>
 *   DISCONNECTED → CONNECTING → CONNECTED | ERROR
 *   CONNECTED → DISCONNECTED   (explicit disconnect, or TCP write failure)
 *   ERROR stays until the next connect() or configure()
 * </pre>
 *
 * UDP connects skip {@code CONNECTING}.
 */
public enum ConnectionStatus
{
    DISCONNECTED,
    CONNECTING,
    CONNECTED,
    ERROR
}
