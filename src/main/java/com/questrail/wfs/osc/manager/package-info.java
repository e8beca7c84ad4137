/**
 * Integration of the network layer with application state.
 *
 * <p>{@link com.questrail.wfs.osc.manager.OscManager} is the entry point. The
 * application supplies a {@link com.questrail.wfs.osc.manager.ParameterStore}
 * and reports its own changes back through
 * {@code OscManager.onParameterChanged}; the manager handles everything
 * between that store and the network, including the REMOTE heartbeat and
 * stage constraints.</p>
 */
package com.questrail.wfs.osc.manager;
