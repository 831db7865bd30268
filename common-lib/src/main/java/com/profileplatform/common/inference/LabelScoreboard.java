package com.profileplatform.common.inference;

import com.profileplatform.common.model.EvidenceRow;
import com.profileplatform.common.model.ScoredLabel;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Score and evidence accumulator for one dimension (roles or intents).
 *
 * <p>Pre-seeded with every rankable label of the enum (the {@code excluded}
 * sentinel is left out), so a lookup can never miss. Every score change goes
 * through {@link #add}, which records exactly one {@link EvidenceRow}; the
 * score of a label is therefore always the sum of its evidence weights.
 *
 * <p>Not thread-safe; one instance per scoring call.
 */
final class LabelScoreboard<L extends Enum<L>> {

    private final Map<L, Double> scores;
    private final Map<L, List<EvidenceRow>> evidence;

    LabelScoreboard(Class<L> labelType, L excluded) {
        this.scores   = new EnumMap<>(labelType);
        this.evidence = new EnumMap<>(labelType);
        Set<L> labels = EnumSet.allOf(labelType);
        labels.remove(excluded);
        for (L label : labels) {
            scores.put(label, 0.0);
            evidence.put(label, new ArrayList<>());
        }
    }

    /** Adds {@code row.weight()} to {@code label}. Ignored for the excluded sentinel. */
    void add(L label, EvidenceRow row) {
        if (!scores.containsKey(label)) return;
        scores.merge(label, row.weight(), Double::sum);
        evidence.get(label).add(row);
    }

    /** Drops all score and evidence of {@code label}. */
    void clear(L label) {
        if (!scores.containsKey(label)) return;
        scores.put(label, 0.0);
        evidence.get(label).clear();
    }

    /**
     * Normalizes the scores with {@link Softmax} and returns every label sorted by
     * probability, highest first. Ties keep enum declaration order.
     */
    List<ScoredLabel<L>> rank() {
        Map<L, Double> probabilities = Softmax.normalize(scores);
        List<ScoredLabel<L>> ranked = new ArrayList<>(scores.size());
        for (Map.Entry<L, Double> e : scores.entrySet()) {
            L label = e.getKey();
            ranked.add(new ScoredLabel<>(label, e.getValue(),
                probabilities.getOrDefault(label, 0.0), evidence.get(label)));
        }
        // List.sort is stable: equal probabilities stay in declaration order
        ranked.sort(Comparator.comparingDouble((ScoredLabel<L> s) -> s.probability()).reversed());
        return ranked;
    }
}
