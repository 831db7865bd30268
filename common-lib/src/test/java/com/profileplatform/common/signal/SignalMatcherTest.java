package com.profileplatform.common.signal;

import com.profileplatform.common.model.Role;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class SignalMatcherTest {

    private final List<KeywordSignal<Role>> rules = List.of(
        KeywordSignal.of("\\bshipped\\b", Role.BUILDER, 1.0, "builder_action"),
        KeywordSignal.of("\\bdeal\\b", Role.BD, 1.0, "bd_action"),
        KeywordSignal.caseSensitive("\\bMM\\b", Role.MARKET_MAKER, 3.0, "dn_mm"));

    @Test
    @DisplayName("all matching rules returned in dictionary order")
    void matchingOrder() {
        List<KeywordSignal<Role>> hits = SignalMatcher.matching(rules, "Closed the DEAL and SHIPPED it");
        assertEquals(List.of("builder_action", "bd_action"), hits.stream().map(KeywordSignal::tag).toList());
    }

    @Test
    @DisplayName("case-sensitive rules ignore other casings")
    void caseSensitive() {
        assertTrue(SignalMatcher.matching(rules, "mm, not sure").isEmpty());
        assertEquals(1, SignalMatcher.matching(rules, "Acme MM desk").size());
    }

    @Test
    @DisplayName("blank text matches nothing")
    void blank() {
        assertTrue(SignalMatcher.matching(rules, null).isEmpty());
        assertTrue(SignalMatcher.matching(rules, " ").isEmpty());
    }

    @Test
    @DisplayName("tally counts each rule at most once per text")
    void tally() {
        int[] counts = SignalMatcher.tally(rules, List.of("shipped shipped shipped", "deal", "shipped a deal", ""));
        assertArrayEquals(new int[] {2, 2, 0}, counts);
    }

    @Test
    @DisplayName("negative rule weight is rejected")
    void negativeWeight() {
        assertThrows(IllegalArgumentException.class,
            () -> KeywordSignal.of("x", Role.BD, -1.0, "bad"));
    }

    @Test
    @DisplayName("default dictionaries carry the directory and marketplace rules")
    void defaultDictionaries() {
        SignalDictionaries d = SignalDictionaries.defaults();
        List<String> tags = d.messageRoleSignals().stream().map(KeywordSignal::tag).toList();
        assertTrue(tags.contains(SignalTags.VENDOR_DIRECTORY));
        assertTrue(tags.contains(SignalTags.VENDOR_MARKETPLACE));
        assertSame(d, SignalDictionaries.defaults());
    }
}
