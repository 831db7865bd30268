package com.profileplatform.claims.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Active inference config, returned by {@code GET /api/v1/profiles/config}.
 */
public record ConfigSummaryDTO(
    @JsonProperty("version")                  String version,
    @JsonProperty("description")              String description,
    @JsonProperty("dictionaryVersion")        String dictionaryVersion,
    @JsonProperty("minNonMembershipEvidence") int minNonMembershipEvidence,
    @JsonProperty("minClaimConfidence")       double minClaimConfidence,
    @JsonProperty("supportedThreshold")       double supportedThreshold
) {}
