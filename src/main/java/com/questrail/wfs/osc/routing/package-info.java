/**
 * Translation between OSC addresses and typed application parameters.
 *
 * <p>{@link com.questrail.wfs.osc.routing.ParameterId} is the single address
 * table; {@link com.questrail.wfs.osc.routing.OscMessageRouter} parses with it
 * and {@link com.questrail.wfs.osc.routing.OscMessageBuilder} builds with it.
 * Both are stateless.</p>
 */
package com.questrail.wfs.osc.routing;
