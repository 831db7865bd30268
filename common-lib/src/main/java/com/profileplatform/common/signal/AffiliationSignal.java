package com.profileplatform.common.signal;

import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Capture pattern for a self-declared organization. Group 1 holds the raw
 * org candidate, which must still pass the org-candidate validator.
 */
public record AffiliationSignal(Pattern pattern, String tag) {

    public AffiliationSignal {
        Objects.requireNonNull(pattern, "pattern");
        Objects.requireNonNull(tag, "tag");
    }

    public static AffiliationSignal of(String regex, String tag) {
        return new AffiliationSignal(Pattern.compile(regex), tag);
    }

    public static AffiliationSignal ignoringCase(String regex, String tag) {
        return new AffiliationSignal(Pattern.compile(regex, Pattern.CASE_INSENSITIVE), tag);
    }

    /**
     * First match in {@code text} whose capture group is non-empty, or null.
     */
    public Capture capture(String text) {
        if (text == null) return null;
        Matcher m = pattern.matcher(text);
        if (!m.find()) return null;
        String raw = m.group(1);
        if (raw == null || raw.isBlank()) return null;
        return new Capture(raw, m.group(), m.start());
    }

    /**
     * @param raw        the captured org candidate (group 1)
     * @param fullMatch  the whole matched segment (group 0)
     * @param matchStart offset of the whole match within the source text
     */
    public record Capture(String raw, String fullMatch, int matchStart) {}
}
