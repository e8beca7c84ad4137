package com.questrail.wfs.osc.routing;

import com.questrail.wfs.osc.model.OscMessage;
import org.junit.jupiter.api.Test;

import java.util.HashSet;
import java.util.Optional;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

/**
 * ParameterTableSymmetryTest
 * -----------------------------------------------------------------------------
 * Every parameter the builder can emit is understood by the router as the
 * same parameter, channel and value.
 */
final class ParameterTableSymmetryTest
{
    private static ParameterValue sample(ParameterId parameter)
    {
        switch (parameter.kind()) {
            case INT:
                return ParameterValue.of(3);
            case STRING:
                return ParameterValue.of("Cello");
            default:
                return ParameterValue.of(1.25f);
        }
    }

    @Test
    void addressesAreUnique()
    {
        Set<String> osc = new HashSet<>();
        Set<String> remote = new HashSet<>();
        for (ParameterId p : ParameterId.values()) {
            assertTrue(osc.add(p.oscAddress()), "duplicate " + p.oscAddress());
            p.remoteAddress().ifPresent(a -> assertTrue(remote.add(a), "duplicate " + a));
            assertEquals(Optional.of(p), ParameterId.fromOscAddress(p.oscAddress()));
        }
    }

    @Test
    void standardChannelMessagesRoundTrip()
    {
        for (ParameterId p : ParameterId.values()) {
            if (p.scope() == ParameterScope.CONFIG || p.isBanded()) {
                continue;
            }
            ParameterValue value = sample(p);
            OscMessage built = build(p, 7, value).orElseThrow(() -> new AssertionError("no message for " + p));

            ChannelParameterMessage parsed = parse(built).orElseThrow(() -> new AssertionError("not parsed: " + p));

            assertEquals(p, parsed.parameter());
            assertEquals(7, parsed.channelId());
            assertEquals(value, parsed.value(), p.name());
            assertFalse(parsed.hasBand());
        }
    }

    @Test
    void bandMessagesRoundTrip()
    {
        int banded = 0;
        for (ParameterId p : ParameterId.values()) {
            if (!p.isBanded()) {
                continue;
            }
            banded++;
            ParameterValue value = sample(p);
            OscMessage built = OscMessageBuilder.buildBandMessage(p, 2, 4, value).orElseThrow();

            ChannelParameterMessage parsed = parse(built).orElseThrow(() -> new AssertionError("not parsed: " + p));

            assertEquals(p, parsed.parameter());
            assertEquals(2, parsed.channelId());
            assertEquals(4, parsed.band());
            assertEquals(value, parsed.value());
        }
        assertTrue(banded > 0);
    }

    @Test
    void configMessagesRoundTrip()
    {
        for (ParameterId p : ParameterId.values()) {
            if (p.scope() != ParameterScope.CONFIG) {
                continue;
            }
            ParameterValue value = sample(p);
            OscMessage built = OscMessageBuilder.buildConfigMessage(p, value).orElseThrow();

            assertEquals(AddressFamily.CONFIG, OscMessageRouter.classify(built.address()));
            ConfigParameterMessage parsed = OscMessageRouter.parseConfigMessage(built).orElseThrow();
            assertEquals(p, parsed.parameter());
            assertEquals(value, parsed.value());
        }
    }

    @Test
    void remoteMessagesRoundTrip()
    {
        for (ParameterId p : ParameterId.values()) {
            if (p.remoteAddress().isEmpty() || p.isBanded()) {
                assertTrue(OscMessageBuilder.buildRemoteOutputMessage(p, 1, sample(p)).isEmpty(), p.name());
                continue;
            }
            ParameterValue value = sample(p);
            OscMessage built = OscMessageBuilder.buildRemoteOutputMessage(p, 5, value).orElseThrow();

            assertEquals(AddressFamily.REMOTE_INPUT, OscMessageRouter.classify(built.address()), p.name());
            RemoteCommand parsed = OscMessageRouter.parseRemoteInputMessage(built)
                    .orElseThrow(() -> new AssertionError("not parsed: " + p));

            assertEquals(new RemoteCommand.ParameterSet(p, 5, value), parsed, p.name());
        }
    }

    private static Optional<OscMessage> build(ParameterId p, int channelId, ParameterValue value)
    {
        switch (p.scope()) {
            case INPUT:
                return OscMessageBuilder.buildInputMessage(p, channelId, value);
            case OUTPUT:
                return OscMessageBuilder.buildOutputMessage(p, channelId, value);
            default:
                return OscMessageBuilder.buildReverbMessage(p, channelId, value);
        }
    }

    private static Optional<ChannelParameterMessage> parse(OscMessage message)
    {
        switch (OscMessageRouter.classify(message.address())) {
            case INPUT:
                return OscMessageRouter.parseInputMessage(message);
            case OUTPUT:
                return OscMessageRouter.parseOutputMessage(message);
            case REVERB:
                return OscMessageRouter.parseReverbMessage(message);
            default:
                return Optional.empty();
        }
    }
}
