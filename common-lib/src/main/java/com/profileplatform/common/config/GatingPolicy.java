package com.profileplatform.common.config;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Thresholds that decide whether a top-ranked label may be emitted as a claim.
 *
 * <pre>
 *   nonMembershipEvidence &lt; minNonMembershipEvidence → GATED (insufficient_evidence)
 *   probability           &lt; minClaimConfidence       → GATED (low_confidence)
 *   otherwise                                         → claim emitted
 * </pre>
 */
public record GatingPolicy(
    @JsonProperty("minNonMembershipEvidence") int minNonMembershipEvidence,
    @JsonProperty("minClaimConfidence")       double minClaimConfidence
) {
    public static final GatingPolicy DEFAULT = new GatingPolicy(1, 0.15);

    public GatingPolicy {
        if (minNonMembershipEvidence < 0) {
            throw new IllegalArgumentException(
                "minNonMembershipEvidence must be >= 0, got " + minNonMembershipEvidence);
        }
        if (Double.isNaN(minClaimConfidence) || minClaimConfidence < 0.0 || minClaimConfidence > 1.0) {
            throw new IllegalArgumentException(
                "minClaimConfidence must be within [0, 1], got " + minClaimConfidence);
        }
    }
}
