package com.profileplatform.claims.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.profileplatform.common.config.InferenceConfig;
import com.profileplatform.common.model.GroupKind;
import com.profileplatform.common.model.Intent;
import com.profileplatform.common.model.Role;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.core.io.DefaultResourceLoader;

import static org.junit.jupiter.api.Assertions.*;

class InferenceConfigLoaderTest {

    private final InferenceConfigLoader loader =
        new InferenceConfigLoader(new DefaultResourceLoader(), new ObjectMapper());

    @Test
    @DisplayName("bundled config matches the built-in defaults")
    void bundledConfig() {
        InferenceConfig loaded = loader.load("classpath:inference/inference.v0.5.1.json");
        assertEquals(InferenceConfig.defaults(), loaded);
    }

    @Test
    @DisplayName("custom gating and partial priors")
    void customConfig() {
        InferenceConfig loaded = loader.load("classpath:inference/inference.strict.json");
        assertEquals("v-test-strict", loaded.version());
        assertEquals(2, loaded.gating().minNonMembershipEvidence());
        assertEquals(0.5, loaded.gating().minClaimConfidence());
        assertEquals(2.0, loaded.rolePriorsFor(GroupKind.BD).get(Role.BD));
        assertEquals(2.0, loaded.intentPriorsFor(GroupKind.BD).get(Intent.NETWORKING));
        assertTrue(loaded.rolePriorsFor(GroupKind.WORK).isEmpty());
    }

    @Test
    @DisplayName("unknown group kind is rejected")
    void unknownGroupKind() {
        InferenceConfigException ex = assertThrows(InferenceConfigException.class,
            () -> loader.load("classpath:inference/inference.bad-kind.json"));
        assertTrue(ex.getMessage().contains("trading_floor"));
        assertEquals("classpath:inference/inference.bad-kind.json", ex.getLocation());
    }

    @Test
    @DisplayName("missing gating thresholds are rejected")
    void missingGating() {
        InferenceConfigException ex = assertThrows(InferenceConfigException.class,
            () -> loader.load("classpath:inference/inference.no-gating.json"));
        assertTrue(ex.getMessage().contains("missing gating thresholds"));
    }

    @Test
    @DisplayName("fractional evidence threshold is rejected, not truncated")
    void fractionalEvidenceThreshold() {
        InferenceConfigException ex = assertThrows(InferenceConfigException.class,
            () -> loader.load("classpath:inference/inference.fractional-evidence.json"));
        assertTrue(ex.getMessage().contains("minNonMembershipEvidence must be an integer, got 1.5"));
    }

    @Test
    @DisplayName("missing resource is rejected")
    void missingResource() {
        assertThrows(InferenceConfigException.class,
            () -> loader.load("classpath:inference/does-not-exist.json"));
    }
}
