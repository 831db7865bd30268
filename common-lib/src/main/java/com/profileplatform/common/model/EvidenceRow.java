package com.profileplatform.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/**
 * One weighted justification for part of a label's score.
 *
 * <p>{@code evidenceRef} encodes the rule tag and, for message evidence, the hit
 * count, e.g. {@code msg:bd_action:count=3}. Weights may be negative for
 * explicit penalty rules.
 */
public record EvidenceRow(
    @JsonProperty("evidenceType") EvidenceType evidenceType,
    @JsonProperty("evidenceRef")  String evidenceRef,
    @JsonProperty("weight")       double weight
) {
    public EvidenceRow {
        Objects.requireNonNull(evidenceType, "evidenceType");
        Objects.requireNonNull(evidenceRef, "evidenceRef");
        if (Double.isNaN(weight) || Double.isInfinite(weight)) {
            throw new IllegalArgumentException("evidence weight must be finite: " + evidenceRef);
        }
    }

    public static EvidenceRow of(EvidenceType type, String ref, double weight) {
        return new EvidenceRow(type, ref, weight);
    }

    /** Key used when deduplicating evidence for persistence. */
    public String dedupKey() {
        return evidenceType.label() + "::" + evidenceRef;
    }
}
