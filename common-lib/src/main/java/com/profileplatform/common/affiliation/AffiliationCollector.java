package com.profileplatform.common.affiliation;

import com.profileplatform.common.model.AffiliationResult;
import com.profileplatform.common.model.EvidenceType;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Accumulates validated affiliations for one user, deduplicated by
 * {@link OrgNames#normalize normalized name}.
 *
 * <h3>Source precedence</h3>
 * <pre>
 *   message &gt; display_name &gt; bio
 * </pre>
 * A candidate whose normalized name is already present replaces the existing
 * entry (in place, keeping list position) when its source ranks higher. Between
 * two message captures the later one wins; any other candidate is dropped.
 * Distinct organizations always coexist.
 *
 * <p>Not thread-safe; one instance per scoring call.
 */
public final class AffiliationCollector {

    private static final Map<EvidenceType, Integer> SOURCE_RANK = Map.of(
        EvidenceType.BIO,          1,
        EvidenceType.DISPLAY_NAME, 2,
        EvidenceType.MESSAGE,      3
    );

    private final List<AffiliationResult> affiliations = new ArrayList<>();

    /**
     * @return true if the list changed (appended or replaced)
     */
    public boolean offer(String name, EvidenceType source, String tag) {
        if (OrgNames.normalize(name).isEmpty()) return false;

        for (int i = 0; i < affiliations.size(); i++) {
            AffiliationResult existing = affiliations.get(i);
            if (!OrgNames.sameOrganization(existing.name(), name)) continue;
            if (supersedes(source, existing.source())) {
                affiliations.set(i, new AffiliationResult(name, source, tag));
                return true;
            }
            return false;
        }
        affiliations.add(new AffiliationResult(name, source, tag));
        return true;
    }

    public boolean hasSource(EvidenceType source) {
        return affiliations.stream().anyMatch(a -> a.source() == source);
    }

    public List<AffiliationResult> results() {
        return List.copyOf(affiliations);
    }

    private static boolean supersedes(EvidenceType candidate, EvidenceType existing) {
        if (candidate == EvidenceType.MESSAGE && existing == EvidenceType.MESSAGE) return true;
        return rank(candidate) > rank(existing);
    }

    private static int rank(EvidenceType source) {
        return SOURCE_RANK.getOrDefault(source, 0);
    }
}
