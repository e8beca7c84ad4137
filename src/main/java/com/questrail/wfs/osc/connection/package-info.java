/**
 * Per-target outbound connections.
 *
 * <p>One {@link com.questrail.wfs.osc.connection.OscConnection} exists for each
 * target slot. It owns at most one {@link com.questrail.wfs.osc.transport.OscLink}
 * at a time and publishes every status change to the manager.</p>
 */
package com.questrail.wfs.osc.connection;
