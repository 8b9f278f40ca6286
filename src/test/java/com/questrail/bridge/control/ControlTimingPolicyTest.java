package com.questrail.bridge.control;

import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class ControlTimingPolicyTest {

    @Test
    void defaultsToThreeSeconds() {
        assertEquals(Duration.ofSeconds(3), ControlTimingPolicy.defaults().callTimeout());
    }

    @Test
    void rejectsNonPositiveTimeout() {
        assertThrows(IllegalArgumentException.class, () -> new ControlTimingPolicy(Duration.ZERO));
        assertThrows(IllegalArgumentException.class, () -> new ControlTimingPolicy(Duration.ofMillis(-1)));
        assertThrows(NullPointerException.class, () -> new ControlTimingPolicy(null));
    }
}
