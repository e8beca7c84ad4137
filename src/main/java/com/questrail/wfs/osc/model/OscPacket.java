package com.questrail.wfs.osc.model;

/**
 * Root of the immutable OSC packet model.
 *
 * <h2>Purpose</h2>
 * <p>
 * An {@code OscPacket} is a fully decoded OSC 1.0 packet: either a single
 * {@link OscMessage} or an {@link OscBundle} of further packets. Everything
 * above the codec layer (receivers, router, rate limiter, manager) reasons
 * about packets in this form only; padding, type tags and size prefixes never
 * leave {@code codec.impl}.
 * </p>
 *
 * <p>
 * The hierarchy is closed so that dispatch code can switch exhaustively over
 * the two shapes a packet may take.
 * </p>
 */
public sealed interface OscPacket permits OscMessage, OscBundle
{
}
