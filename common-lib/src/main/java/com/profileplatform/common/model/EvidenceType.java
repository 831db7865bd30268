package com.profileplatform.common.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;
import java.util.Locale;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Source channel of a single piece of evidence. Also used as the source of
 * affiliation and org-type side-claims.
 */
public enum EvidenceType {
    MEMBERSHIP("membership"),
    BIO("bio"),
    DISPLAY_NAME("display_name"),
    MESSAGE("message"),
    FEATURE("feature");

    private static final Map<String, EvidenceType> BY_LABEL = Arrays.stream(values())
        .collect(Collectors.toUnmodifiableMap(EvidenceType::label, Function.identity()));

    private final String label;

    EvidenceType(String label) {
        this.label = label;
    }

    @JsonValue
    public String label() {
        return label;
    }

    @JsonCreator
    public static EvidenceType fromLabel(String label) {
        return label == null ? null : BY_LABEL.get(label.trim().toLowerCase(Locale.ROOT));
    }
}
