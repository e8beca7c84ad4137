package com.questrail.wfs.osc.routing;

import com.questrail.wfs.osc.model.OscArgument;
import com.questrail.wfs.osc.model.OscMessage;
import org.junit.jupiter.api.Test;

import java.util.OptionalInt;

import static org.junit.jupiter.api.Assertions.*;

final class OscMessageRouterTest
{
    @Test
    void classifiesEveryFamily()
    {
        assertEquals(AddressFamily.INPUT, OscMessageRouter.classify("/wfs/input/positionX"));
        assertEquals(AddressFamily.OUTPUT, OscMessageRouter.classify("/wfs/output/attenuation"));
        assertEquals(AddressFamily.REVERB, OscMessageRouter.classify("/wfs/reverb/EQgain"));
        assertEquals(AddressFamily.CONFIG, OscMessageRouter.classify("/wfs/config/stage/width"));
        assertEquals(AddressFamily.REMOTE_INPUT, OscMessageRouter.classify("/remoteInput/inputNumber"));
        assertEquals(AddressFamily.REMOTE_INPUT, OscMessageRouter.classify("/remoteInput/output/name"));
        assertEquals(AddressFamily.ARRAY_ADJUST, OscMessageRouter.classify("/arrayAdjust/delayLatency"));
        assertEquals(AddressFamily.CLUSTER_MOVE, OscMessageRouter.classify("/cluster/move"));
        assertEquals(AddressFamily.CLUSTER_MOVE, OscMessageRouter.classify("/cluster/barycenter/move"));
        assertEquals(AddressFamily.REMOTE_PING, OscMessageRouter.classify("/remote/ping"));
        assertEquals(AddressFamily.REMOTE_PONG, OscMessageRouter.classify("/remote/pong"));
        assertEquals(AddressFamily.UNKNOWN, OscMessageRouter.classify("/cluster/scale"));
        assertEquals(AddressFamily.UNKNOWN, OscMessageRouter.classify("/wfs"));
    }

    @Test
    void inputMessageCoercesNumbersToTheParameterKind()
    {
        OscMessage message = OscMessage.of("/wfs/input/cluster", OscArgument.of(4), OscArgument.of(2.0f));

        ChannelParameterMessage parsed = OscMessageRouter.parseInputMessage(message).orElseThrow();

        assertEquals(ParameterId.INPUT_CLUSTER, parsed.parameter());
        assertEquals(4, parsed.channelId());
        assertEquals(ParameterValue.of(2), parsed.value());
    }

    @Test
    void booleanArgumentBecomesOneOrZero()
    {
        OscMessage message = OscMessage.of("/wfs/input/trackingActive", OscArgument.of(1), OscArgument.of(true));

        assertEquals(ParameterValue.of(1), OscMessageRouter.parseInputMessage(message).orElseThrow().value());
    }

    @Test
    void malformedStandardMessagesAreRejected()
    {
        // text for a float parameter
        assertTrue(OscMessageRouter.parseInputMessage(OscMessage.of("/wfs/input/attenuation",
                OscArgument.of(1), OscArgument.of("loud"))).isEmpty());
        // missing value
        assertTrue(OscMessageRouter.parseInputMessage(OscMessage.of("/wfs/input/attenuation",
                OscArgument.of(1))).isEmpty());
        // non-numeric channel
        assertTrue(OscMessageRouter.parseInputMessage(OscMessage.of("/wfs/input/attenuation",
                OscArgument.of("one"), OscArgument.of(1.0f))).isEmpty());
        // output address parsed as input
        assertTrue(OscMessageRouter.parseInputMessage(OscMessage.of("/wfs/output/attenuation",
                OscArgument.of(1), OscArgument.of(1.0f))).isEmpty());
        // unknown parameter name
        assertTrue(OscMessageRouter.parseInputMessage(OscMessage.of("/wfs/input/volume",
                OscArgument.of(1), OscArgument.of(1.0f))).isEmpty());
    }

    @Test
    void bandedMessageNeedsABand()
    {
        OscMessage withBand = OscMessage.of("/wfs/output/EQgain",
                OscArgument.of(3), OscArgument.of(2), OscArgument.of(-4.5f));
        OscMessage withoutBand = OscMessage.of("/wfs/output/EQgain", OscArgument.of(3), OscArgument.of(-4.5f));

        ChannelParameterMessage parsed = OscMessageRouter.parseOutputMessage(withBand).orElseThrow();
        assertEquals(2, parsed.band());
        assertTrue(OscMessageRouter.parseOutputMessage(withoutBand).isEmpty());
    }

    @Test
    void remoteChannelSelect()
    {
        RemoteCommand command = OscMessageRouter.parseRemoteInputMessage(
                OscMessage.of("/remoteInput/inputNumber", OscArgument.of(12))).orElseThrow();

        assertEquals(new RemoteCommand.ChannelSelect(12), command);
    }

    @Test
    void remotePositionXY()
    {
        RemoteCommand command = OscMessageRouter.parseRemoteInputMessage(OscMessage.of("/remoteInput/positionXY",
                OscArgument.of(2), OscArgument.of(1.5f), OscArgument.of(-3.0f))).orElseThrow();

        assertEquals(new RemoteCommand.PositionXY(2, 1.5f, -3.0f), command);
        assertTrue(OscMessageRouter.parseRemoteInputMessage(OscMessage.of("/remoteInput/positionXY",
                OscArgument.of(2), OscArgument.of(1.5f))).isEmpty());
    }

    @Test
    void remoteIncrementAndDecrement()
    {
        RemoteCommand inc = OscMessageRouter.parseRemoteInputMessage(OscMessage.of("/remoteInput/positionX",
                OscArgument.of(1), OscArgument.of("inc"), OscArgument.of(0.5f))).orElseThrow();
        RemoteCommand dec = OscMessageRouter.parseRemoteInputMessage(OscMessage.of("/remoteInput/attenuation",
                OscArgument.of(1), OscArgument.of("DEC"))).orElseThrow();

        RemoteCommand.ParameterDelta incDelta = (RemoteCommand.ParameterDelta) inc;
        assertEquals(ParameterId.INPUT_POSITION_X, incDelta.parameter());
        assertEquals(Axis.X, incDelta.axis());
        assertEquals(0.5f, incDelta.signedAmount());

        RemoteCommand.ParameterDelta decDelta = (RemoteCommand.ParameterDelta) dec;
        assertNull(decDelta.axis());
        assertEquals(-1.0f, decDelta.signedAmount());
    }

    @Test
    void incOnTextParameterIsTakenLiterally()
    {
        RemoteCommand command = OscMessageRouter.parseRemoteInputMessage(OscMessage.of("/remoteInput/inputName",
                OscArgument.of(1), OscArgument.of("inc"))).orElseThrow();

        assertEquals(new RemoteCommand.ParameterSet(ParameterId.INPUT_NAME, 1, ParameterValue.of("inc")), command);
    }

    @Test
    void standardOnlyParameterHasNoRemoteForm()
    {
        assertTrue(OscMessageRouter.parseRemoteInputMessage(OscMessage.of("/remoteInput/otomoX",
                OscArgument.of(1), OscArgument.of(1.0f))).isEmpty());
    }

    @Test
    void arrayAdjust()
    {
        ArrayAdjust adjust = OscMessageRouter.parseArrayAdjustMessage(OscMessage.of("/arrayAdjust/attenuation",
                OscArgument.of(2), OscArgument.of(-3.0f))).orElseThrow();

        assertEquals(new ArrayAdjust(ParameterId.OUTPUT_ATTENUATION, 2, -3.0f), adjust);
        assertTrue(OscMessageRouter.parseArrayAdjustMessage(OscMessage.of("/arrayAdjust/pitch",
                OscArgument.of(2), OscArgument.of(1.0f))).isEmpty());
    }

    @Test
    void clusterMoveValidatesClusterId()
    {
        ClusterMove move = OscMessageRouter.parseClusterMoveMessage(OscMessage.of("/cluster/barycenter/move",
                OscArgument.of(10), OscArgument.of(0.5f), OscArgument.of(-0.5f))).orElseThrow();

        assertEquals(new ClusterMove(ClusterMove.Kind.BARYCENTER, 10, 0.5f, -0.5f), move);
        assertTrue(OscMessageRouter.parseClusterMoveMessage(OscMessage.of("/cluster/move",
                OscArgument.of(0), OscArgument.of(0.5f), OscArgument.of(0.5f))).isEmpty());
        assertTrue(OscMessageRouter.parseClusterMoveMessage(OscMessage.of("/cluster/move",
                OscArgument.of(11), OscArgument.of(0.5f), OscArgument.of(0.5f))).isEmpty());
    }

    @Test
    void heartbeatSequenceMustBeInt()
    {
        assertEquals(OptionalInt.of(42), OscMessageRouter.parseHeartbeatSequence(
                OscMessageBuilder.buildPong(42)));
        assertTrue(OscMessageRouter.parseHeartbeatSequence(OscMessage.of("/remote/ping",
                OscArgument.of(42.0f))).isEmpty());
        assertTrue(OscMessageRouter.parseHeartbeatSequence(OscMessage.of("/remote/ping")).isEmpty());
    }
}
