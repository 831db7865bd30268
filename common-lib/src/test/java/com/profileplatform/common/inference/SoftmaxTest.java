package com.profileplatform.common.inference;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class SoftmaxTest {

    @Test
    @DisplayName("equal scores → uniform distribution")
    void uniform() {
        Map<String, Double> p = Softmax.normalize(Map.of("a", 0.0, "b", 0.0, "c", 0.0, "d", 0.0));
        p.values().forEach(v -> assertEquals(0.25, v, 1e-12));
    }

    @Test
    @DisplayName("large scores do not overflow")
    void stable() {
        Map<String, Double> scores = new LinkedHashMap<>();
        scores.put("a", 1000.0);
        scores.put("b", 999.0);
        Map<String, Double> p = Softmax.normalize(scores);
        assertEquals(1.0, p.get("a") + p.get("b"), 1e-12);
        assertEquals(1.0 / (1.0 + Math.exp(-1)), p.get("a"), 1e-12);
    }

    @Test
    @DisplayName("empty in → empty out")
    void empty() {
        assertTrue(Softmax.normalize(Map.of()).isEmpty());
    }
}
