package com.profileplatform.claims.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.LocalDateTime;

public record AbstentionDTO(
    @JsonProperty("subjectUserId") long subjectUserId,
    @JsonProperty("predicate")     String predicate,
    @JsonProperty("reasonCode")    String reasonCode,
    @JsonProperty("details")       String details,
    @JsonProperty("modelVersion")  String modelVersion,
    @JsonProperty("generatedAt")   LocalDateTime generatedAt
) {}
