package com.profileplatform.claims.config;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.profileplatform.common.config.GatingPolicy;
import com.profileplatform.common.config.InferenceConfig;
import com.profileplatform.common.model.GroupKind;
import com.profileplatform.common.model.Intent;
import com.profileplatform.common.model.Role;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.util.EnumMap;
import java.util.Iterator;
import java.util.Map;
import java.util.function.Function;

/**
 * Reads a versioned inference config document.
 *
 * <pre>
 * {
 *   "version": "v0.5.1",
 *   "description": "...",
 *   "gating": { "minNonMembershipEvidence": 1, "minClaimConfidence": 0.15 },
 *   "rolePriors":   { "&lt;group_kind&gt;": { "&lt;role&gt;": weight, ... }, ... },
 *   "intentPriors": { "&lt;group_kind&gt;": { "&lt;intent&gt;": weight, ... }, ... }
 * }
 * </pre>
 *
 * <p>The {@code version} string becomes the {@code model_version} of every
 * claim and abstention written with this config. Unknown group kinds or
 * labels are rejected rather than silently ignored.
 */
@Component
public class InferenceConfigLoader {

    private static final Logger log = LoggerFactory.getLogger(InferenceConfigLoader.class);

    private final ResourceLoader resourceLoader;
    private final ObjectMapper objectMapper;

    public InferenceConfigLoader(ResourceLoader resourceLoader, ObjectMapper objectMapper) {
        this.resourceLoader = resourceLoader;
        this.objectMapper   = objectMapper;
    }

    /**
     * @param location Spring resource location, e.g. {@code classpath:inference/inference.v0.5.1.json}
     * @throws InferenceConfigException if the document is missing, unreadable or invalid
     */
    public InferenceConfig load(String location) {
        Resource resource = resourceLoader.getResource(location);
        if (!resource.exists()) {
            throw new InferenceConfigException(location, "resource not found");
        }

        JsonNode root;
        try (InputStream in = resource.getInputStream()) {
            root = objectMapper.readTree(in);
        } catch (IOException e) {
            throw new InferenceConfigException(location, "unreadable JSON", e);
        }
        if (root == null || !root.isObject()) {
            throw new InferenceConfigException(location, "document is not a JSON object");
        }

        InferenceConfig config = parse(location, root);
        log.info("[InferenceConfig] Loaded. version={} location={} minEvidence={} minConfidence={}",
            config.version(), location,
            config.gating().minNonMembershipEvidence(), config.gating().minClaimConfidence());
        return config;
    }

    private InferenceConfig parse(String location, JsonNode root) {
        String version = root.path("version").asText("");
        if (version.isBlank()) {
            throw new InferenceConfigException(location, "missing \"version\"");
        }

        JsonNode gating = root.path("gating");
        JsonNode minEvidence   = gating.path("minNonMembershipEvidence");
        JsonNode minConfidence = gating.path("minClaimConfidence");
        if (!minEvidence.isNumber() || !minConfidence.isNumber()) {
            throw new InferenceConfigException(location, "missing gating thresholds");
        }
        if (!minEvidence.isIntegralNumber()) {
            throw new InferenceConfigException(location,
                "minNonMembershipEvidence must be an integer, got " + minEvidence.asText());
        }

        JsonNode rolePriors   = root.path("rolePriors");
        JsonNode intentPriors = root.path("intentPriors");
        if (!rolePriors.isObject() || !intentPriors.isObject()) {
            throw new InferenceConfigException(location, "missing priors");
        }

        try {
            GatingPolicy policy = new GatingPolicy(minEvidence.asInt(), minConfidence.asDouble());
            return new InferenceConfig(version, root.path("description").asText(""), policy,
                priors(location, rolePriors, Role.class, Role::fromLabel),
                priors(location, intentPriors, Intent.class, Intent::fromLabel));
        } catch (IllegalArgumentException e) {
            throw new InferenceConfigException(location, e.getMessage(), e);
        }
    }

    private static <L extends Enum<L>> Map<GroupKind, Map<L, Double>> priors(
            String location, JsonNode node, Class<L> labelType, Function<String, L> byLabel) {
        Map<GroupKind, Map<L, Double>> out = new EnumMap<>(GroupKind.class);
        Iterator<Map.Entry<String, JsonNode>> kinds = node.fields();
        while (kinds.hasNext()) {
            Map.Entry<String, JsonNode> kindEntry = kinds.next();
            GroupKind kind = groupKind(location, kindEntry.getKey());

            Map<L, Double> weights = new EnumMap<>(labelType);
            Iterator<Map.Entry<String, JsonNode>> labels = kindEntry.getValue().fields();
            while (labels.hasNext()) {
                Map.Entry<String, JsonNode> labelEntry = labels.next();
                L label = byLabel.apply(labelEntry.getKey());
                if (label == null) {
                    throw new InferenceConfigException(location,
                        "unknown " + labelType.getSimpleName().toLowerCase() + " \"" + labelEntry.getKey()
                            + "\" under group kind " + kind.label());
                }
                if (!labelEntry.getValue().isNumber()) {
                    throw new InferenceConfigException(location,
                        "prior weight for " + kind.label() + "/" + labelEntry.getKey() + " is not a number");
                }
                weights.put(label, labelEntry.getValue().asDouble());
            }
            out.put(kind, weights);
        }
        return out;
    }

    // GroupKind.fromLabel falls back to UNKNOWN; a config typo must not.
    private static GroupKind groupKind(String location, String key) {
        for (GroupKind kind : GroupKind.values()) {
            if (kind.label().equals(key)) return kind;
        }
        throw new InferenceConfigException(location, "unknown group kind \"" + key + "\"");
    }
}
