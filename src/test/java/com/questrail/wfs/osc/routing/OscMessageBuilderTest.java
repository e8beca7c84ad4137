package com.questrail.wfs.osc.routing;

import com.questrail.wfs.osc.model.OscArgument;
import com.questrail.wfs.osc.model.OscMessage;
import org.junit.jupiter.api.Test;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

final class OscMessageBuilderTest
{
    @Test
    void standardFormCarriesNumbersAsFloat()
    {
        OscMessage message = OscMessageBuilder.buildInputMessage(
                ParameterId.INPUT_COORDINATE_MODE, 3, ParameterValue.of(2)).orElseThrow();

        assertEquals(OscMessage.of("/wfs/input/coordinateMode", OscArgument.of(3), OscArgument.of(2.0f)), message);
    }

    @Test
    void remoteFormKeepsIntegersAsInt()
    {
        OscMessage message = OscMessageBuilder.buildRemoteOutputMessage(
                ParameterId.INPUT_LS_ACTIVE, 3, ParameterValue.of(1)).orElseThrow();

        assertEquals(OscMessage.of("/remoteInput/liveSourceActive", OscArgument.of(3), OscArgument.of(1)), message);
    }

    @Test
    void wrongScopeBuildsNothing()
    {
        assertTrue(OscMessageBuilder.buildOutputMessage(
                ParameterId.INPUT_ATTENUATION, 1, ParameterValue.of(0.0f)).isEmpty());
        assertTrue(OscMessageBuilder.buildConfigMessage(
                ParameterId.INPUT_ATTENUATION, ParameterValue.of(0.0f)).isEmpty());
        assertTrue(OscMessageBuilder.buildBandMessage(
                ParameterId.OUTPUT_ATTENUATION, 1, 1, ParameterValue.of(0.0f)).isEmpty());
    }

    @Test
    void textForNumericParameterBuildsNothing()
    {
        assertTrue(OscMessageBuilder.buildInputMessage(
                ParameterId.INPUT_ATTENUATION, 1, ParameterValue.of("x")).isEmpty());
    }

    @Test
    void stageConfigListsGeometryThenInputCount()
    {
        StageGeometry stage = new StageGeometry(1, 20.0f, 10.0f, 5.0f, 15.0f, 0.5f, -1.0f, 0.0f);

        List<OscMessage> messages = OscMessageBuilder.buildStageConfig(stage, 24);

        assertEquals(List.of("/stage/originX", "/stage/originY", "/stage/originZ", "/stage/width",
                        "/stage/depth", "/stage/height", "/stage/shape", "/stage/diameter", "/inputs"),
                messages.stream().map(OscMessage::address).collect(Collectors.toList()));
        assertEquals(OscArgument.of(1), messages.get(6).argument(0));
        assertEquals(OscArgument.of(15.0f), messages.get(7).argument(0));
        assertEquals(OscArgument.of(24), messages.get(8).argument(0));
    }

    @Test
    void channelDumpSkipsParametersWithoutRemoteForm()
    {
        Map<ParameterId, ParameterValue> values = new EnumMap<>(ParameterId.class);
        values.put(ParameterId.INPUT_POSITION_Y, ParameterValue.of(2.0f));
        values.put(ParameterId.INPUT_ATTENUATION, ParameterValue.of(-6.0f));
        values.put(ParameterId.INPUT_OTOMO_X, ParameterValue.of(1.0f));

        List<OscMessage> dump = OscMessageBuilder.buildRemoteChannelDump(4, values);

        assertEquals(List.of(
                OscMessage.of("/remoteInput/attenuation", OscArgument.of(4), OscArgument.of(-6.0f)),
                OscMessage.of("/remoteInput/positionY", OscArgument.of(4), OscArgument.of(2.0f))), dump);
    }

    @Test
    void heartbeatAndFindDevice()
    {
        assertEquals(OscMessage.of("/remote/ping", OscArgument.of(5)), OscMessageBuilder.buildPing(5));
        assertEquals(OscMessage.of("/findDevice", OscArgument.of("secret")),
                OscMessageBuilder.buildFindDevice("secret"));
    }
}
