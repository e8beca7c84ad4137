package com.questrail.wfs.osc.model;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * OscMessage
 * -----------------------------------------------------------------------------
 * A single OSC message: an address pattern and an ordered argument list.
 *
 * <p>The address must start with {@code '/'}. This is enforced at construction
 * so that no component above the codec can hold an unroutable message.</p>
 */
public record OscMessage(String address, List<OscArgument> arguments) implements OscPacket
{
    public OscMessage {
        Objects.requireNonNull(address, "address");
        Objects.requireNonNull(arguments, "arguments");
        if (!address.startsWith("/")) {
            throw new IllegalArgumentException("OSC address must start with '/': " + address);
        }
        arguments = List.copyOf(arguments);
    }

    public static OscMessage of(String address, OscArgument... arguments) {
        return new OscMessage(address, Arrays.asList(arguments));
    }

    public int size() {
        return arguments.size();
    }

    public OscArgument argument(int index) {
        return arguments.get(index);
    }

    /**
     * Returns the first argument as an int when it is an {@code int32}.
     * Used to build channel-scoped coalescing keys.
     */
    public Optional<Integer> firstIntArgument() {
        if (!arguments.isEmpty() && arguments.get(0) instanceof OscArgument.Int32 i) {
            return Optional.of(i.value());
        }
        return Optional.empty();
    }

    /**
     * Returns a copy of this message with the given argument appended.
     */
    public OscMessage with(OscArgument argument) {
        List<OscArgument> copy = new ArrayList<>(arguments);
        copy.add(Objects.requireNonNull(argument, "argument"));
        return new OscMessage(address, copy);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder(address);
        for (OscArgument a : arguments) {
            sb.append(' ').append(a.render());
        }
        return sb.toString();
    }
}
