package com.profileplatform.common.affiliation;

import com.profileplatform.common.signal.OrgCandidateRules;
import com.profileplatform.common.signal.SignalDictionaries;

import java.util.Arrays;
import java.util.Locale;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Quality gate for organization-name candidates captured by affiliation patterns.
 *
 * <p>Every extraction path (bio, display name, message) calls the same
 * {@link #validate(String)}, so a candidate is judged identically wherever it
 * was found.
 *
 * <h3>Pipeline</h3>
 * <ol>
 *   <li>Strip trailing clause bleed ("Acme right now" → "Acme")</li>
 *   <li>Clamp network qualifiers ("Acme on Solana" → "Acme")</li>
 *   <li>Clamp definitional clauses ("Acme is a wallet" → "Acme")</li>
 *   <li>Truncate at the first lowercase-starting word after the first</li>
 *   <li>Reject if shorter than {@value #MIN_LENGTH} characters</li>
 *   <li>Reject if the first word is a structural stopword</li>
 *   <li>Reject if it starts lowercase</li>
 *   <li>Reject a bare role/title word</li>
 *   <li>Reject entries of the general reject set</li>
 *   <li>Reject on any reject pattern (events, conferences, pure digits)</li>
 *   <li>Reject generic phrase openers ("all ", "various ")</li>
 * </ol>
 *
 * <p>Stages only shorten or reject, so {@code validate(validate(x))} is either
 * {@code validate(x)} or null. Stateless and thread-safe.
 */
public final class OrgCandidateValidator {

    static final int MIN_LENGTH = 3;

    private static final Pattern WHITESPACE = Pattern.compile("\\s+");
    private static final Pattern STARTS_LOWERCASE = Pattern.compile("^[a-z]");

    private final OrgCandidateRules rules;

    public OrgCandidateValidator(OrgCandidateRules rules) {
        this.rules = Objects.requireNonNull(rules, "rules");
    }

    public static OrgCandidateValidator defaults() {
        return new OrgCandidateValidator(SignalDictionaries.defaults().orgCandidateRules());
    }

    /**
     * @param raw captured substring, may be null
     * @return the cleaned organization name, or null when rejected
     */
    public String validate(String raw) {
        if (raw == null) return null;
        String name = raw.trim();

        name = rules.trailingClause().matcher(name).replaceFirst("").trim();
        name = rules.chainClamp().matcher(name).replaceFirst("").trim();
        name = rules.definitionalClamp().matcher(name).replaceFirst("").trim();
        name = truncateAtLowercaseWord(name);

        if (name.length() < MIN_LENGTH) return null;

        String lower = name.toLowerCase(Locale.ROOT);
        String firstWord = WHITESPACE.split(lower, 2)[0];
        if (rules.stopwords().contains(firstWord)) return null;

        if (STARTS_LOWERCASE.matcher(name).find()) return null;
        if (rules.bareTitles().contains(lower)) return null;
        if (rules.rejectSet().contains(lower)) return null;

        for (Pattern reject : rules.rejectPatterns()) {
            if (reject.matcher(name).find()) return null;
        }

        if (rules.genericPhrase().matcher(name).find()) return null;

        return name;
    }

    // Org names are capitalised (SolidityScan, Gate.io); a lowercase word means prose.
    private static String truncateAtLowercaseWord(String name) {
        if (name.isEmpty()) return name;
        String[] words = WHITESPACE.split(name);
        int cut = words.length;
        for (int i = 1; i < words.length; i++) {
            if (STARTS_LOWERCASE.matcher(words[i]).find()) {
                cut = i;
                break;
            }
        }
        return String.join(" ", Arrays.copyOfRange(words, 0, cut));
    }
}
