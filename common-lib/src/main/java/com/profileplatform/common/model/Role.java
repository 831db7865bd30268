package com.profileplatform.common.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;
import java.util.Locale;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Functional role a participant plays in group conversations.
 *
 * <p>Declaration order is significant: ranking breaks probability ties by
 * this order, so reordering constants changes near-tie outcomes.
 * {@link #UNKNOWN} is a display fallback and never ranked.
 */
public enum Role {
    BD("bd"),
    BUILDER("builder"),
    FOUNDER_EXEC("founder_exec"),
    INVESTOR_ANALYST("investor_analyst"),
    RECRUITER("recruiter"),
    VENDOR_AGENCY("vendor_agency"),
    COMMUNITY("community"),
    MEDIA_KOL("media_kol"),
    MARKET_MAKER("market_maker"),
    UNKNOWN("unknown");

    private static final Map<String, Role> BY_LABEL = Arrays.stream(values())
        .collect(Collectors.toUnmodifiableMap(Role::label, Function.identity()));

    private final String label;

    Role(String label) {
        this.label = label;
    }

    @JsonValue
    public String label() {
        return label;
    }

    /**
     * Resolves a stored label such as {@code "founder_exec"}.
     * Returns null for unrecognized labels.
     */
    @JsonCreator
    public static Role fromLabel(String label) {
        return label == null ? null : BY_LABEL.get(label.trim().toLowerCase(Locale.ROOT));
    }
}
