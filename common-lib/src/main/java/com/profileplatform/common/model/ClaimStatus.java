package com.profileplatform.common.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Display status of an emitted claim. Derived from probability against a
 * display threshold that is looser than the gating threshold, so an emitted
 * claim can still be {@link #TENTATIVE}.
 */
public enum ClaimStatus {
    TENTATIVE("tentative"),
    SUPPORTED("supported");

    private final String label;

    ClaimStatus(String label) {
        this.label = label;
    }

    @JsonValue
    public String label() {
        return label;
    }

    public static ClaimStatus fromProbability(double probability, double supportedThreshold) {
        return probability >= supportedThreshold ? SUPPORTED : TENTATIVE;
    }
}
