/**
 * OSC Transport Ports
 * =============================================================================
 *
 * Framework-agnostic boundary between concrete networking (Netty UDP and TCP,
 * or a test double) and the rest of the network layer.
 *
 * <h2>Inbound</h2>
 * <pre>
 *   DatagramEndpoint / TCP frame decoder
 *        → byte[] payload + sender address
 *            → OscPacketDispatcher (decode, count parse errors)
 *                → OscPacketListener.onMessage / onBundle
 * </pre>
 *
 * <h2>Outbound</h2>
 * <pre>
 *   OscConnection.send(packet)
 *        → OscPacketEncoder
 *            → OscLink.write(byte[])   (TCP links add the length prefix)
 * </pre>
 *
 * <h2>Architectural constraints (binding)</h2>
 * Everything above these ports sees only {@code byte[]} payloads, standard
 * {@link java.net.InetSocketAddress} values and lifecycle signals. Netty types
 * never leave the {@code netty} sub-packages. Implementations perform I/O
 * only: no OSC routing, no retries, no timers.
 */
package com.questrail.wfs.osc.transport;
