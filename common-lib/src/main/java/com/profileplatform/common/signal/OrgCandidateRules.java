package com.profileplatform.common.signal;

import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Cleaning patterns and reject lists consulted by the org-candidate validator.
 *
 * <p>All sets hold lower-case entries and are matched against the lower-cased
 * candidate. Reject patterns are matched anywhere in the cleaned candidate.
 */
public record OrgCandidateRules(
    Pattern trailingClause,
    Pattern chainClamp,
    Pattern definitionalClamp,
    Set<String> stopwords,
    Set<String> bareTitles,
    Set<String> rejectSet,
    List<Pattern> rejectPatterns,
    Pattern genericPhrase
) {
    public OrgCandidateRules {
        Objects.requireNonNull(trailingClause, "trailingClause");
        Objects.requireNonNull(chainClamp, "chainClamp");
        Objects.requireNonNull(definitionalClamp, "definitionalClamp");
        Objects.requireNonNull(genericPhrase, "genericPhrase");
        stopwords      = lowerCased(stopwords);
        bareTitles     = lowerCased(bareTitles);
        rejectSet      = lowerCased(rejectSet);
        rejectPatterns = rejectPatterns == null ? List.of() : List.copyOf(rejectPatterns);
    }

    private static final int CI = Pattern.CASE_INSENSITIVE;

    static OrgCandidateRules defaults() {
        return new OrgCandidateRules(
            // conjunctions / time adverbs: the capture ran on into a sentence clause
            Pattern.compile("\\s+(?:and|but|so|because|since|while|where|which|who|right\\s+now|now|today"
                + "|currently|these\\s+days|nowadays|lately|recently|anymore|too|also|as\\s+well)\\b.*$", CI),
            // "Acme on Solana" / "Acme built on Base"
            Pattern.compile("\\s+(?:built\\s+on|deployed\\s+on|live\\s+on|on)\\s+\\S.*$", CI),
            // "Acme is a ..." / "Acme, a ..."
            Pattern.compile("(?:\\s+(?:is|are|was)\\s+(?:a|an|the)|\\s*,\\s*(?:a|an|the))\\b.*$", CI),
            Set.of(
                "the", "a", "an", "my", "our", "their", "his", "her", "its", "your",
                "this", "that", "these", "those", "each", "every", "some", "any", "all", "no",
                "both", "many", "most", "several", "other", "another",
                "in", "on", "at", "for", "from", "with", "by", "of", "to", "into", "via", "about", "as",
                "and", "or", "but", "here", "there", "we", "i", "you", "they", "it"),
            Set.of(
                "trader", "founder", "cofounder", "co-founder", "ceo", "cto", "coo", "cfo", "cmo",
                "bd", "bizdev", "biz dev", "vp", "director", "head", "lead", "manager",
                "engineer", "developer", "dev", "builder", "investor", "analyst", "recruiter",
                "advisor", "consultant", "partner", "intern", "researcher", "designer",
                "marketer", "kol", "ambassador", "influencer", "moderator", "admin", "mod",
                "community manager", "freelancer", "degen", "student"),
            Set.of(
                // locations
                "dubai", "singapore", "london", "new york", "nyc", "hong kong", "hk", "san francisco", "sf",
                "berlin", "paris", "lisbon", "bangkok", "seoul", "tokyo", "istanbul", "india", "usa", "uk",
                "uae", "europe", "asia", "south asia", "southeast asia", "sea", "latam", "africa", "apac",
                "emea", "remote", "home",
                // industry verticals and buzzwords
                "web3", "web 3", "crypto", "defi", "nft", "nfts", "blockchain", "ai", "gamefi", "dao", "daos",
                "fintech", "metaverse", "rwa", "depin", "socialfi", "tradfi", "layer 1", "layer 2", "l1", "l2",
                // bare functions
                "business", "business development", "marketing", "partnerships", "growth", "sales", "operations",
                "engineering", "research", "product", "community", "design", "web3 marketing",
                // platforms
                "telegram", "twitter", "discord", "linkedin"),
            List.of(
                Pattern.compile("\\b(?:token\\s*2049|eth\\s*denver|ethcc|devcon|devconnect|consensus\\s*20\\d\\d"
                    + "|breakpoint|permissionless|kbw|korea\\s+blockchain\\s+week|summit|conference"
                    + "|hackathon|meetup|expo)\\b", CI),
                Pattern.compile("^\\d+$"),
                Pattern.compile("^(?:q[1-4]|20\\d\\d)\\b", CI)),
            Pattern.compile("^(?:all|any|some|each|every|most|many|few|several|different|various|other"
                + "|certain|specific|particular)\\s", CI));
    }

    private static Set<String> lowerCased(Set<String> words) {
        if (words == null) return Set.of();
        return words.stream()
            .map(w -> w.toLowerCase(Locale.ROOT))
            .collect(Collectors.toUnmodifiableSet());
    }
}
