package com.trueform.common.infra;

import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class EnvUtilsTest {

    @Test
    void parseBoolean_recognisedValues() {
        assertEquals(Boolean.TRUE, EnvUtils.parseBoolean("Yes"));
        assertEquals(Boolean.FALSE, EnvUtils.parseBoolean(" off "));
        assertNull(EnvUtils.parseBoolean("perhaps"));
        assertNull(EnvUtils.parseBoolean(""));
    }

    @Test
    void isTruthy() {
        assertTrue(EnvUtils.isTruthy("1"));
        assertFalse(EnvUtils.isTruthy("0"));
        assertFalse(EnvUtils.isTruthy(null));
    }

    @Test
    void read_trimsAndTreatsBlankAsUnset() {
        Map<String, String> env = Map.of("A", "  value ", "B", "   ");
        assertEquals("value", EnvUtils.read(env::get, "A"));
        assertNull(EnvUtils.read(env::get, "B"));
        assertNull(EnvUtils.read(env::get, "C"));
        assertNull(EnvUtils.read(null, "A"));
    }
}
