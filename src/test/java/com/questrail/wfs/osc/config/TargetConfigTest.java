package com.questrail.wfs.osc.config;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

final class TargetConfigTest
{
    private static TargetConfig.Builder osc()
    {
        return TargetConfig.builder().withProtocol(OscProtocol.OSC).withIpAddress("192.168.1.20").withPort(9000);
    }

    @Test
    void disabledTargetHasDefaults()
    {
        TargetConfig config = TargetConfig.disabled();

        assertEquals(OscProtocol.DISABLED, config.protocol());
        assertEquals(TargetConfig.DEFAULT_IP_ADDRESS, config.ipAddress());
        assertEquals(TargetConfig.DEFAULT_PORT, config.port());
        assertEquals(ConnectionMode.UDP, config.mode());
        assertTrue(config.rxEnabled());
        assertTrue(config.txEnabled());
        assertFalse(config.isValid());
        assertFalse(config.shouldTransmit());
    }

    @Test
    void validityNeedsProtocolAddressAndPort()
    {
        assertTrue(osc().build().isValid());
        assertFalse(osc().withIpAddress(" ").build().isValid());
        assertFalse(osc().withPort(0).build().isValid());
        assertFalse(osc().withPort(65536).build().isValid());
        assertTrue(osc().withPort(65535).build().isValid());
    }

    @Test
    void qlabIsActiveEvenWithTrafficOff()
    {
        TargetConfig silentOsc = osc().withRxEnabled(false).withTxEnabled(false).build();
        TargetConfig silentQlab = silentOsc.toBuilder().withProtocol(OscProtocol.QLAB).build();

        assertFalse(silentOsc.isActive());
        assertTrue(silentQlab.isActive());
        assertTrue(osc().withTxEnabled(false).build().isActive());
    }

    @Test
    void transmitNeedsProtocolAndTx()
    {
        assertTrue(osc().build().shouldTransmit());
        assertFalse(osc().withTxEnabled(false).build().shouldTransmit());
        assertFalse(osc().withProtocol(OscProtocol.DISABLED).build().shouldTransmit());
    }

    @Test
    void endpointComparesAddressPortAndMode()
    {
        TargetConfig base = osc().build();

        assertFalse(base.endpointDiffers(base.toBuilder().withName("renamed").withRxEnabled(false).build()));
        assertTrue(base.endpointDiffers(base.toBuilder().withPort(9001).build()));
        assertTrue(base.endpointDiffers(base.toBuilder().withIpAddress("192.168.1.21").build()));
        assertTrue(base.endpointDiffers(base.toBuilder().withMode(ConnectionMode.TCP).build()));
        assertTrue(base.endpointDiffers(null));
    }

    @Test
    void toBuilderRoundTrips()
    {
        TargetConfig config = osc().withName("Desk").withMode(ConnectionMode.TCP).withQlabPatchNumber(3).build();

        assertEquals(config, config.toBuilder().build());
    }
}
