package me.golemcore.turnguard.domain.model;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class TemperatureBandTest {

    @Test
    void shouldValidateBounds() {
        assertTrue(new TemperatureBand(0.0, 2.0).isValid());
        assertTrue(new TemperatureBand(0.5, 0.5).isValid());
        assertFalse(new TemperatureBand(0.8, 0.2).isValid());
        assertFalse(new TemperatureBand(-0.1, 0.5).isValid());
        assertFalse(new TemperatureBand(0.1, 2.1).isValid());
        assertFalse(new TemperatureBand(Double.NaN, 1.0).isValid());
    }

    @Test
    void shouldClampIntoBand() {
        TemperatureBand band = new TemperatureBand(0.2, 0.7);

        assertEquals(0.2, band.clamp(0.0));
        assertEquals(0.7, band.clamp(1.5));
        assertEquals(0.4, band.clamp(0.4));
    }

    @Test
    void shouldRenderBounds() {
        assertEquals("[0.2, 1.0]", new TemperatureBand(0.2, 1.0).toString());
    }
}
