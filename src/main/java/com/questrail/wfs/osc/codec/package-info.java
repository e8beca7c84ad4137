/**
 * OSC Codec Ports
 * =============================================================================
 *
 * <p>This package defines the <strong>codec layer</strong> boundary for OSC 1.0
 * binary packets. The layer sits <strong>below</strong> routing and
 * <strong>above</strong> transport I/O:</p>
 *
 * <pre>
 *   byte[] datagram / TCP frame
 *        → OscPacketDecoder      (padding, type tags, bundle elements)
 *            → OscPacket         (OscMessage | OscBundle)
 *                → OscMessageRouter
 *                    → parameter updates
 * </pre>
 *
 * <p>All byte-level mechanics live in {@code codec.impl}. Nothing above this
 * package sees padding, type tag strings or element size prefixes.</p>
 */
package com.questrail.wfs.osc.codec;
