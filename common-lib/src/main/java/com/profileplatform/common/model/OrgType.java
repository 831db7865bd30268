package com.profileplatform.common.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;
import java.util.Locale;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Kind of organization a participant represents.
 *
 * <p>Independent of {@link Role}: a person can do BD at a market-making firm.
 * Org types are detected as a side channel and never enter role/intent scoring.
 */
public enum OrgType {
    EXCHANGE("exchange"),
    MARKET_MAKER("market_maker"),
    VC_FUND("vc_fund"),
    AGENCY("agency"),
    LAUNCHPAD("launchpad"),
    SECURITY_AUDIT("security_audit"),
    MEDIA("media"),
    INFRASTRUCTURE("infrastructure");

    private static final Map<String, OrgType> BY_LABEL = Arrays.stream(values())
        .collect(Collectors.toUnmodifiableMap(OrgType::label, Function.identity()));

    private final String label;

    OrgType(String label) {
        this.label = label;
    }

    @JsonValue
    public String label() {
        return label;
    }

    @JsonCreator
    public static OrgType fromLabel(String label) {
        return label == null ? null : BY_LABEL.get(label.trim().toLowerCase(Locale.ROOT));
    }
}
