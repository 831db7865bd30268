package com.profileplatform.common.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;
import java.util.Locale;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * What a participant appears to be trying to do in the groups they are in.
 * Declaration order is the ranking tie-break order; {@link #UNKNOWN} is never ranked.
 */
public enum Intent {
    NETWORKING("networking"),
    EVALUATING("evaluating"),
    SELLING("selling"),
    HIRING("hiring"),
    SUPPORT_SEEKING("support_seeking"),
    SUPPORT_GIVING("support_giving"),
    BROADCASTING("broadcasting"),
    UNKNOWN("unknown");

    private static final Map<String, Intent> BY_LABEL = Arrays.stream(values())
        .collect(Collectors.toUnmodifiableMap(Intent::label, Function.identity()));

    private final String label;

    Intent(String label) {
        this.label = label;
    }

    @JsonValue
    public String label() {
        return label;
    }

    @JsonCreator
    public static Intent fromLabel(String label) {
        return label == null ? null : BY_LABEL.get(label.trim().toLowerCase(Locale.ROOT));
    }
}
