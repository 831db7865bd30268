package com.profileplatform.common.signal;

import java.util.Objects;
import java.util.regex.Pattern;

/**
 * A text rule binding a pattern to a label with a weight and a short tag.
 * The tag becomes part of the evidence reference ({@code bio:founder_title}).
 *
 * @param <T> label type ({@code Role} or {@code Intent})
 */
public record KeywordSignal<T>(Pattern pattern, T label, double weight, String tag) {

    public KeywordSignal {
        Objects.requireNonNull(pattern, "pattern");
        Objects.requireNonNull(label, "label");
        Objects.requireNonNull(tag, "tag");
        if (weight < 0.0 || Double.isNaN(weight)) {
            throw new IllegalArgumentException("keyword weight must be >= 0: " + tag);
        }
    }

    /** Case-insensitive rule; the default for every dictionary. */
    public static <T> KeywordSignal<T> of(String regex, T label, double weight, String tag) {
        return new KeywordSignal<>(Pattern.compile(regex, Pattern.CASE_INSENSITIVE), label, weight, tag);
    }

    /** Case-sensitive rule, for acronyms that collide with ordinary words. */
    public static <T> KeywordSignal<T> caseSensitive(String regex, T label, double weight, String tag) {
        return new KeywordSignal<>(Pattern.compile(regex), label, weight, tag);
    }

    public boolean matches(String text) {
        return text != null && pattern.matcher(text).find();
    }
}
