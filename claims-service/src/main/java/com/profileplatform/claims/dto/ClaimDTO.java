package com.profileplatform.claims.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.LocalDateTime;
import java.util.List;

/**
 * A persisted claim with its evidence, as returned by
 * {@code GET /api/v1/profiles/{userId}/claims}.
 */
public record ClaimDTO(
    @JsonProperty("id")            long id,
    @JsonProperty("subjectUserId") long subjectUserId,
    @JsonProperty("predicate")     String predicate,
    @JsonProperty("objectValue")   String objectValue,
    @JsonProperty("status")        String status,
    @JsonProperty("confidence")    double confidence,
    @JsonProperty("modelVersion")  String modelVersion,
    @JsonProperty("generatedAt")   LocalDateTime generatedAt,
    @JsonProperty("evidence")      List<EvidenceDTO> evidence
) {
    public record EvidenceDTO(
        @JsonProperty("evidenceType") String evidenceType,
        @JsonProperty("evidenceRef")  String evidenceRef,
        @JsonProperty("weight")       double weight
    ) {}
}
