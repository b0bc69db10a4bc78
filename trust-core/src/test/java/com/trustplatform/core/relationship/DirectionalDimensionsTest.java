package com.trustplatform.core.relationship;

import com.trustplatform.core.path.DirectionalPath;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class DirectionalDimensionsTest {

    private static final double EPS = 1e-9;

    @Test
    @DisplayName("defaults: warmth 0.2, the rest 0")
    void defaults() {
        DirectionalDimensions dims = new DirectionalDimensions();
        assertEquals(0.2, dims.warmth().effective(), EPS);
        assertEquals(0.0, dims.resentment().effective(), EPS);
        assertEquals(0.0, dims.dependence().effective(), EPS);
        assertEquals(0.0, dims.attraction().effective(), EPS);
        assertEquals(0.0, dims.attachment().effective(), EPS);
        assertEquals(0.0, dims.jealousy().effective(), EPS);
        assertEquals(0.0, dims.fear().effective(), EPS);
        assertEquals(0.0, dims.obligation().effective(), EPS);
    }

    @Test
    @DisplayName("attachment and obligation are slow, jealousy and fear fast, the rest 14 days")
    void halfLives() {
        DirectionalDimensions dims = new DirectionalDimensions();
        Map<DirectionalPath, Duration> expected = Map.of(
            DirectionalPath.WARMTH,     Duration.ofDays(14),
            DirectionalPath.RESENTMENT, Duration.ofDays(14),
            DirectionalPath.DEPENDENCE, Duration.ofDays(14),
            DirectionalPath.ATTRACTION, Duration.ofDays(14),
            DirectionalPath.ATTACHMENT, Duration.ofDays(30),
            DirectionalPath.OBLIGATION, Duration.ofDays(30),
            DirectionalPath.JEALOUSY,   Duration.ofDays(7),
            DirectionalPath.FEAR,       Duration.ofDays(7));

        expected.forEach((path, halfLife) -> {
            assertTrue(dims.tracks(path), path.name());
            assertEquals(halfLife, dims.get(path).getHalfLife().orElseThrow(), path.name());
        });
    }

    @Test
    @DisplayName("a fear delta halves after seven days while attachment keeps most of it")
    void decayRates() {
        DirectionalDimensions dims = new DirectionalDimensions();
        dims.addDelta(DirectionalPath.FEAR, 0.4);
        dims.addDelta(DirectionalPath.ATTACHMENT, 0.4);
        dims.applyDecay(Duration.ofDays(7));

        assertEquals(0.2, dims.effective(DirectionalPath.FEAR), EPS);
        assertTrue(dims.effective(DirectionalPath.ATTACHMENT) > 0.3);
    }

    @Test
    @DisplayName("resetDeltas restores every default")
    void reset() {
        DirectionalDimensions dims = new DirectionalDimensions();
        dims.addDelta(DirectionalPath.WARMTH, 0.5);
        dims.addDelta(DirectionalPath.RESENTMENT, 0.3);
        dims.resetDeltas();

        assertEquals(new DirectionalDimensions(), dims);
    }

    @Test
    @DisplayName("trust and risk paths are not directional dimensions")
    void nonDimensionPaths() {
        DirectionalDimensions dims = new DirectionalDimensions();
        assertFalse(dims.tracks(DirectionalPath.PERCEIVED_RISK));
        assertThrows(IllegalArgumentException.class, () -> dims.get(DirectionalPath.COMPETENCE));
    }
}
