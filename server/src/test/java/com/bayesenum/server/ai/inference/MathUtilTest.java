package com.bayesenum.server.ai.inference;

import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class MathUtilTest {

    @Test
    void normalizeKeepsOrder() {
        Map<String, Double> scores = new LinkedHashMap<>();
        scores.put("b", 0.18);
        scores.put("a", 0.16);

        Map<String, Double> p = MathUtil.normalize(scores, MathUtil.sum(scores));
        assertEquals(List.of("b", "a"), List.copyOf(p.keySet()));
        assertEquals(1.0, MathUtil.sum(p), 1e-12);
        assertThrows(IllegalArgumentException.class, () -> MathUtil.normalize(scores, 0.0));
    }

    @Test
    void argmaxPrefersFirstOnTies() {
        Map<String, Double> p = new LinkedHashMap<>();
        p.put("x", 0.5);
        p.put("y", 0.5);
        assertEquals("x", MathUtil.argmax(p));
        assertNull(MathUtil.argmax(Map.of()));
    }

    @Test
    void entropy() {
        assertEquals(0.0, MathUtil.entropy(Map.of("a", 1.0, "b", 0.0)), 1e-12);
        assertEquals(Math.log(2), MathUtil.entropy(Map.of("a", 0.5, "b", 0.5)), 1e-12);
    }
}
