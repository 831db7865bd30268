package com.profileplatform.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Engine output for one candidate label of one dimension.
 *
 * <p>{@code score} is the additive total of every evidence weight (priors
 * included); {@code probability} is the softmax of that score within its
 * dimension.
 */
public record ScoredLabel<T>(
    @JsonProperty("label")       T label,
    @JsonProperty("score")       double score,
    @JsonProperty("probability") double probability,
    @JsonProperty("evidence")    List<EvidenceRow> evidence
) {
    public ScoredLabel {
        evidence = evidence == null ? List.of() : List.copyOf(evidence);
    }

    /** Number of evidence rows that did not come from group membership priors. */
    public long nonMembershipEvidenceCount() {
        return evidence.stream()
            .filter(e -> e.evidenceType() != EvidenceType.MEMBERSHIP)
            .count();
    }
}
