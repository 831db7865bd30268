package com.profileplatform.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * A validated, self-declared organization name and the channel it came from.
 * The source decides precedence when two channels yield the same organization.
 */
public record AffiliationResult(
    @JsonProperty("name")   String name,
    @JsonProperty("source") EvidenceType source,
    @JsonProperty("tag")    String tag
) {}
