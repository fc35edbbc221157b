package org.shapes.core.model;

import org.junit.Test;

import static org.junit.Assert.*;

public class PortTypeTest {

    @Test
    public void everyTypeSurvivesTokenRoundTrip() {
        for (PortType type : PortType.values()) {
            assertEquals(type, PortType.fromToken(type.toToken()));
        }
        assertEquals(9, PortType.values().length);
    }

    @Test
    public void tokensAreUpperSnakeCase() {
        assertEquals("THRUSTER_IN", PortType.THRUSTER_IN.toToken());
        assertEquals("WEAPON_OUT", PortType.WEAPON_OUT.toToken());
        assertEquals("DEFAULT", PortType.DEFAULT.toToken());
    }

    @Test
    public void unknownTokenFallsBackToDefault() {
        assertEquals(PortType.DEFAULT, PortType.fromToken("BOGUS"));
        assertEquals(PortType.DEFAULT, PortType.fromToken(""));
        assertEquals(PortType.DEFAULT, PortType.fromToken(null));
    }

    @Test
    public void lookupIsCaseSensitiveButTrimsSpaces() {
        assertEquals(PortType.MISSILE, PortType.fromToken(" MISSILE "));
        assertEquals(PortType.DEFAULT, PortType.fromToken("thruster_out"));
        assertEquals(PortType.DEFAULT, PortType.fromToken("Thruster_Out"));
    }

    @Test
    public void portWithoutTypeIsDefault() {
        Port port = new Port(2, 0.25, null);
        assertEquals(PortType.DEFAULT, port.portType);
        assertFalse(port.isTyped());
        assertTrue(new Port(0, 0.5, PortType.ROOT).isTyped());
    }
}
