package com.questrail.wfs.osc.model;

import java.util.List;
import java.util.Objects;

/**
 * OscBundle
 * -----------------------------------------------------------------------------
 * An ordered list of OSC packets (messages or nested bundles).
 *
 * <p>The OSC timetag is not modelled. Bundles are always encoded with the
 * "immediate" timetag and any timetag received on the wire is ignored.</p>
 */
public record OscBundle(List<OscPacket> elements) implements OscPacket
{
    public OscBundle {
        Objects.requireNonNull(elements, "elements");
        elements = List.copyOf(elements);
    }

    public static OscBundle of(OscPacket... elements) {
        return new OscBundle(List.of(elements));
    }

    public int size() {
        return elements.size();
    }
}
