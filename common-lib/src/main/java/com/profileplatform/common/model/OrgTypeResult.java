package com.profileplatform.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

public record OrgTypeResult(
    @JsonProperty("orgType") OrgType orgType,
    @JsonProperty("source")  EvidenceType source,
    @JsonProperty("tag")     String tag
) {}
