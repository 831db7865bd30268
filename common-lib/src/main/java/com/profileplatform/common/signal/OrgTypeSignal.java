package com.profileplatform.common.signal;

import com.profileplatform.common.model.OrgType;

import java.util.Objects;
import java.util.regex.Pattern;

public record OrgTypeSignal(Pattern pattern, OrgType orgType, String tag) {

    public OrgTypeSignal {
        Objects.requireNonNull(pattern, "pattern");
        Objects.requireNonNull(orgType, "orgType");
        Objects.requireNonNull(tag, "tag");
    }

    public static OrgTypeSignal of(String regex, OrgType orgType, String tag) {
        return new OrgTypeSignal(Pattern.compile(regex, Pattern.CASE_INSENSITIVE), orgType, tag);
    }

    public static OrgTypeSignal caseSensitive(String regex, OrgType orgType, String tag) {
        return new OrgTypeSignal(Pattern.compile(regex), orgType, tag);
    }

    public boolean matches(String text) {
        return text != null && pattern.matcher(text).find();
    }
}
