package com.profileplatform.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Scored snapshot for one user.
 *
 * <p>{@code roleClaim} / {@code intentClaim} are null exactly when gating refused
 * to emit for that dimension; {@code gatingNotes} then explains why. The full
 * ranked lists are kept for auditing and regression comparison.
 */
public record UserInferenceResult(
    @JsonProperty("userId")        long userId,
    @JsonProperty("roleClaim")     ScoredLabel<Role> roleClaim,
    @JsonProperty("intentClaim")   ScoredLabel<Intent> intentClaim,
    @JsonProperty("affiliations")  List<AffiliationResult> affiliations,
    @JsonProperty("orgTypes")      List<OrgTypeResult> orgTypes,
    @JsonProperty("gatingNotes")   List<String> gatingNotes,
    @JsonProperty("rankedRoles")   List<ScoredLabel<Role>> rankedRoles,
    @JsonProperty("rankedIntents") List<ScoredLabel<Intent>> rankedIntents
) {
    public UserInferenceResult {
        affiliations  = affiliations  == null ? List.of() : List.copyOf(affiliations);
        orgTypes      = orgTypes      == null ? List.of() : List.copyOf(orgTypes);
        gatingNotes   = gatingNotes   == null ? List.of() : List.copyOf(gatingNotes);
        rankedRoles   = rankedRoles   == null ? List.of() : List.copyOf(rankedRoles);
        rankedIntents = rankedIntents == null ? List.of() : List.copyOf(rankedIntents);
    }

    /** Scored entry for {@code role}; null only for {@link Role#UNKNOWN}, which is never ranked. */
    public ScoredLabel<Role> role(Role role) {
        return rankedRoles.stream().filter(s -> s.label() == role).findFirst().orElse(null);
    }

    public ScoredLabel<Intent> intent(Intent intent) {
        return rankedIntents.stream().filter(s -> s.label() == intent).findFirst().orElse(null);
    }
}
