package com.profileplatform.common.affiliation;

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Normalization of organization names for deduplication.
 *
 * <p>"Gate.io", "gate" and "GATE Exchange" all normalize to {@code gate}.
 * Only used as a comparison key; the displayed name is never normalized.
 */
public final class OrgNames {

    private static final Pattern QUOTES        = Pattern.compile("['‘’\"“”]");
    private static final Pattern NON_ALNUM     = Pattern.compile("[^a-z0-9\\s.]");
    private static final Pattern TLD_SUFFIX    = Pattern.compile("\\.(?:exchange|io|xyz|com|org|net|gg|fi)$");
    private static final Pattern ENTITY_SUFFIX =
        Pattern.compile("\\b(?:inc|ltd|corp|labs?|protocol|network|finance|exchange)\\b");
    private static final Pattern WHITESPACE    = Pattern.compile("\\s+");

    private OrgNames() {}

    public static String normalize(String name) {
        if (name == null) return "";
        String n = name.toLowerCase(Locale.ROOT);
        n = QUOTES.matcher(n).replaceAll("");
        n = NON_ALNUM.matcher(n).replaceAll("");
        n = TLD_SUFFIX.matcher(n).replaceAll("");
        n = ENTITY_SUFFIX.matcher(n).replaceAll("");
        n = WHITESPACE.matcher(n).replaceAll(" ");
        return n.trim();
    }

    public static boolean sameOrganization(String a, String b) {
        return normalize(a).equals(normalize(b));
    }
}
