package com.profileplatform.common.config;

import com.profileplatform.common.model.GroupKind;
import com.profileplatform.common.model.Intent;
import com.profileplatform.common.model.Role;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;

/**
 * Versioned scoring configuration: group-context priors plus gating thresholds.
 *
 * <p>Loaded once per scoring run and passed by value into every
 * {@code InferenceEngine.scoreUser} call, so two runs with different versions
 * can be compared side by side. The {@code version} string becomes the
 * {@code model_version} of every claim and abstention written for the run.
 *
 * <p>Prior maps are deep-copied into unmodifiable {@link EnumMap}s; iteration
 * follows enum declaration order, which keeps membership evidence ordering
 * deterministic. A group kind with no configured priors contributes nothing.
 */
public record InferenceConfig(
    String version,
    String description,
    GatingPolicy gating,
    Map<GroupKind, Map<Role, Double>> rolePriors,
    Map<GroupKind, Map<Intent, Double>> intentPriors
) {
    public static final String DEFAULT_VERSION = "v0.5.1";

    public InferenceConfig {
        Objects.requireNonNull(version, "version");
        if (version.isBlank()) {
            throw new IllegalArgumentException("config version must not be blank");
        }
        description  = description == null ? "" : description;
        gating       = gating == null ? GatingPolicy.DEFAULT : gating;
        rolePriors   = freeze(rolePriors, Role.class);
        intentPriors = freeze(intentPriors, Intent.class);
    }

    public Map<Role, Double> rolePriorsFor(GroupKind kind) {
        return rolePriors.getOrDefault(kind, Map.of());
    }

    public Map<Intent, Double> intentPriorsFor(GroupKind kind) {
        return intentPriors.getOrDefault(kind, Map.of());
    }

    /** Same priors and version, different thresholds. */
    public InferenceConfig withGating(GatingPolicy newGating) {
        return new InferenceConfig(version, description, newGating, rolePriors, intentPriors);
    }

    /**
     * Built-in priors matching the bundled {@code inference.v0.5.1.json}.
     * Weights are un-normalized; the engine applies softmax.
     */
    public static InferenceConfig defaults() {
        Map<GroupKind, Map<Role, Double>> roles = new EnumMap<>(GroupKind.class);
        roles.put(GroupKind.BD, roleWeights(
            Role.BD, 3.0, Role.FOUNDER_EXEC, 1.5, Role.INVESTOR_ANALYST, 1.0, Role.VENDOR_AGENCY, 0.8,
            Role.BUILDER, 0.5, Role.COMMUNITY, 0.3, Role.RECRUITER, 0.3));
        roles.put(GroupKind.WORK, roleWeights(
            Role.BUILDER, 3.0, Role.FOUNDER_EXEC, 1.5, Role.BD, 0.5, Role.COMMUNITY, 0.5,
            Role.INVESTOR_ANALYST, 0.3, Role.VENDOR_AGENCY, 0.3, Role.RECRUITER, 0.3));
        roles.put(GroupKind.GENERAL_CHAT, roleWeights(
            Role.COMMUNITY, 3.0, Role.BUILDER, 1.0, Role.BD, 0.5, Role.FOUNDER_EXEC, 0.5,
            Role.INVESTOR_ANALYST, 0.3, Role.VENDOR_AGENCY, 0.3, Role.RECRUITER, 0.3));
        roles.put(GroupKind.UNKNOWN, roleWeights(
            Role.COMMUNITY, 0.5, Role.BUILDER, 0.5, Role.BD, 0.3, Role.FOUNDER_EXEC, 0.3,
            Role.INVESTOR_ANALYST, 0.2, Role.VENDOR_AGENCY, 0.2, Role.RECRUITER, 0.2));

        Map<GroupKind, Map<Intent, Double>> intents = new EnumMap<>(GroupKind.class);
        intents.put(GroupKind.BD, intentWeights(
            Intent.NETWORKING, 3.0, Intent.EVALUATING, 2.0, Intent.SELLING, 1.5, Intent.HIRING, 0.5,
            Intent.BROADCASTING, 0.5, Intent.SUPPORT_SEEKING, 0.3, Intent.SUPPORT_GIVING, 0.3));
        intents.put(GroupKind.WORK, intentWeights(
            Intent.SUPPORT_SEEKING, 2.0, Intent.SUPPORT_GIVING, 2.0, Intent.BROADCASTING, 1.0,
            Intent.NETWORKING, 0.5, Intent.EVALUATING, 0.5, Intent.SELLING, 0.3, Intent.HIRING, 0.3));
        intents.put(GroupKind.GENERAL_CHAT, intentWeights(
            Intent.NETWORKING, 2.0, Intent.BROADCASTING, 1.5, Intent.SUPPORT_SEEKING, 1.0,
            Intent.SUPPORT_GIVING, 1.0, Intent.EVALUATING, 0.5, Intent.SELLING, 0.3, Intent.HIRING, 0.3));
        intents.put(GroupKind.UNKNOWN, intentWeights(
            Intent.NETWORKING, 0.5, Intent.BROADCASTING, 0.5, Intent.SUPPORT_SEEKING, 0.3,
            Intent.SUPPORT_GIVING, 0.3, Intent.EVALUATING, 0.3, Intent.SELLING, 0.2, Intent.HIRING, 0.2));

        return new InferenceConfig(DEFAULT_VERSION,
            "Evidence-gated priors; directory override and message-affiliation precedence",
            GatingPolicy.DEFAULT, roles, intents);
    }

    // ── helpers ────────────────────────────────────────────────────────────

    private static <L extends Enum<L>> Map<GroupKind, Map<L, Double>> freeze(
            Map<GroupKind, Map<L, Double>> priors, Class<L> labelType) {
        Map<GroupKind, Map<L, Double>> copy = new EnumMap<>(GroupKind.class);
        if (priors != null) {
            priors.forEach((kind, weights) -> {
                if (kind == null || weights == null) return;
                Map<L, Double> inner = new EnumMap<>(labelType);
                weights.forEach((label, weight) -> {
                    if (label != null && weight != null) inner.put(label, weight);
                });
                copy.put(kind, Collections.unmodifiableMap(inner));
            });
        }
        return Collections.unmodifiableMap(copy);
    }

    private static Map<Role, Double> roleWeights(Object... pairs) {
        Map<Role, Double> m = new EnumMap<>(Role.class);
        for (int i = 0; i < pairs.length; i += 2) {
            m.put((Role) pairs[i], (Double) pairs[i + 1]);
        }
        return m;
    }

    private static Map<Intent, Double> intentWeights(Object... pairs) {
        Map<Intent, Double> m = new EnumMap<>(Intent.class);
        for (int i = 0; i < pairs.length; i += 2) {
            m.put((Intent) pairs[i], (Double) pairs[i + 1]);
        }
        return m;
    }
}
