package com.profileplatform.common.inference;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Numerically stable softmax.
 *
 * <pre>
 *   p(label) = exp(score − max) / Σ exp(score_j − max)
 * </pre>
 * Subtracting the maximum keeps every exponent ≤ 0, so large scores cannot
 * overflow. Output iteration order follows the input map.
 */
public final class Softmax {

    private Softmax() {}

    public static <K> Map<K, Double> normalize(Map<K, Double> scores) {
        Map<K, Double> probabilities = new LinkedHashMap<>();
        if (scores.isEmpty()) return probabilities;

        double max = Double.NEGATIVE_INFINITY;
        for (double s : scores.values()) {
            max = Math.max(max, s);
        }

        double sumExp = 0.0;
        Map<K, Double> exps = new LinkedHashMap<>();
        for (Map.Entry<K, Double> e : scores.entrySet()) {
            double exp = Math.exp(e.getValue() - max);
            exps.put(e.getKey(), exp);
            sumExp += exp;
        }

        for (Map.Entry<K, Double> e : exps.entrySet()) {
            probabilities.put(e.getKey(), e.getValue() / sumExp);
        }
        return probabilities;
    }
}
