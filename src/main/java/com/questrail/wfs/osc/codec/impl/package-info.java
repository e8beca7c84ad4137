/**
 * OSC 1.0 binary codec implementation.
 *
 * <p>{@link com.questrail.wfs.osc.codec.impl.OscWireCodec} holds all wire
 * rules; the {@code Default*} classes adapt it to the codec ports.
 * {@link com.questrail.wfs.osc.codec.impl.OscStreamFraming} defines the TCP
 * length prefix.</p>
 */
package com.questrail.wfs.osc.codec.impl;
