package com.profileplatform.claims.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.profileplatform.common.model.UserInferenceResult;

/**
 * Result of scoring and persisting one user.
 *
 * @param claimsWritten      role, intent, affiliation and org-type claims upserted
 * @param abstentionsWritten gating notes logged to the abstention log
 */
public record InferenceOutcomeDTO(
    @JsonProperty("userId")             long userId,
    @JsonProperty("modelVersion")       String modelVersion,
    @JsonProperty("claimsWritten")      int claimsWritten,
    @JsonProperty("abstentionsWritten") int abstentionsWritten,
    @JsonProperty("result")             UserInferenceResult result
) {}
