package com.profileplatform.common.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;
import java.util.Locale;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Group-context tag attached to every group a user belongs to.
 * Priors are keyed by this value.
 */
public enum GroupKind {
    BD("bd"),
    WORK("work"),
    GENERAL_CHAT("general_chat"),
    UNKNOWN("unknown");

    private static final Map<String, GroupKind> BY_LABEL = Arrays.stream(values())
        .collect(Collectors.toUnmodifiableMap(GroupKind::label, Function.identity()));

    private final String label;

    GroupKind(String label) {
        this.label = label;
    }

    @JsonValue
    public String label() {
        return label;
    }

    /**
     * Unrecognized group kinds fall back to {@link #UNKNOWN} rather than failing,
     * so a new group category upstream never breaks scoring.
     */
    @JsonCreator
    public static GroupKind fromLabel(String label) {
        if (label == null) return UNKNOWN;
        return BY_LABEL.getOrDefault(label.trim().toLowerCase(Locale.ROOT), UNKNOWN);
    }
}
