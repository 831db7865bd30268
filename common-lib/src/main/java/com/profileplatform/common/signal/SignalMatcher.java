package com.profileplatform.common.signal;

import java.util.ArrayList;
import java.util.List;

/**
 * The single rule evaluator shared by every dictionary.
 *
 * <p>Every rule is tested independently against the text; all matching rules
 * are returned, in dictionary order. No rule suppresses another here; override
 * interactions live in the engine where they are recorded as evidence.
 *
 * <p>Pure static utility: no state, no logging.
 */
public final class SignalMatcher {

    private SignalMatcher() {}

    public static <T> List<KeywordSignal<T>> matching(List<KeywordSignal<T>> rules, String text) {
        if (text == null || text.isBlank() || rules.isEmpty()) {
            return List.of();
        }
        List<KeywordSignal<T>> hits = new ArrayList<>();
        for (KeywordSignal<T> rule : rules) {
            if (rule.matches(text)) {
                hits.add(rule);
            }
        }
        return hits;
    }

    /**
     * Tallies, per rule index, how many texts each rule matched. A rule counts
     * at most once per text.
     *
     * @return array aligned with {@code rules}; entry {@code i} is the hit count of rule {@code i}
     */
    public static <T> int[] tally(List<KeywordSignal<T>> rules, List<String> texts) {
        int[] counts = new int[rules.size()];
        for (String text : texts) {
            if (text == null || text.isBlank()) continue;
            for (int i = 0; i < rules.size(); i++) {
                if (rules.get(i).matches(text)) {
                    counts[i]++;
                }
            }
        }
        return counts;
    }
}
