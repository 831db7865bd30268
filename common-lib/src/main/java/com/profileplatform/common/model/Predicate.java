package com.profileplatform.common.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;
import java.util.Locale;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

/** Claim predicates written by the inference run. */
public enum Predicate {
    HAS_ROLE("has_role"),
    HAS_INTENT("has_intent"),
    AFFILIATED_WITH("affiliated_with"),
    HAS_ORG_TYPE("has_org_type");

    private static final Map<String, Predicate> BY_LABEL = Arrays.stream(values())
        .collect(Collectors.toUnmodifiableMap(Predicate::label, Function.identity()));

    private final String label;

    Predicate(String label) {
        this.label = label;
    }

    @JsonValue
    public String label() {
        return label;
    }

    @JsonCreator
    public static Predicate fromLabel(String label) {
        return label == null ? null : BY_LABEL.get(label.trim().toLowerCase(Locale.ROOT));
    }
}
