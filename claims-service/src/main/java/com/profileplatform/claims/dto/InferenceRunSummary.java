package com.profileplatform.claims.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Counts for one population run. A failed user is rolled back on its own and
 * does not stop the run.
 */
public record InferenceRunSummary(
    @JsonProperty("modelVersion")       String modelVersion,
    @JsonProperty("usersProcessed")     int usersProcessed,
    @JsonProperty("usersFailed")        int usersFailed,
    @JsonProperty("claimsWritten")      int claimsWritten,
    @JsonProperty("abstentionsWritten") int abstentionsWritten,
    @JsonProperty("failedUserIds")      List<Long> failedUserIds,
    @JsonProperty("durationMs")         long durationMs
) {
    public InferenceRunSummary {
        failedUserIds = failedUserIds == null ? List.of() : List.copyOf(failedUserIds);
    }
}
