package com.profileplatform.common.affiliation;

import com.profileplatform.common.model.AffiliationResult;
import com.profileplatform.common.model.EvidenceType;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class AffiliationCollectorTest {

    @Test
    @DisplayName("higher-ranked source replaces in place")
    void higherSourceReplaces() {
        AffiliationCollector c = new AffiliationCollector();
        c.offer("Acme Labs", EvidenceType.BIO, "affiliation_at");
        c.offer("Other", EvidenceType.BIO, "affiliation_at");
        assertTrue(c.offer("Acme", EvidenceType.MESSAGE, "msg_affiliation_work"));

        assertEquals(List.of(
            new AffiliationResult("Acme", EvidenceType.MESSAGE, "msg_affiliation_work"),
            new AffiliationResult("Other", EvidenceType.BIO, "affiliation_at")), c.results());
    }

    @Test
    @DisplayName("equal or lower source is dropped")
    void lowerSourceDropped() {
        AffiliationCollector c = new AffiliationCollector();
        c.offer("Gate.io", EvidenceType.DISPLAY_NAME, "dn_affiliation_pipe");
        assertFalse(c.offer("Gate", EvidenceType.BIO, "affiliation_at"));
        assertFalse(c.offer("GATE", EvidenceType.DISPLAY_NAME, "dn_affiliation_at"));

        assertEquals(1, c.results().size());
        assertEquals("Gate.io", c.results().get(0).name());
    }

    @Test
    @DisplayName("a later message capture of the same organization replaces the earlier one")
    void laterMessageWins() {
        AffiliationCollector c = new AffiliationCollector();
        c.offer("Acme", EvidenceType.MESSAGE, "msg_affiliation_work");
        c.offer("Other", EvidenceType.MESSAGE, "msg_affiliation_self");
        assertTrue(c.offer("Acme Labs", EvidenceType.MESSAGE, "msg_affiliation_team"));

        assertEquals(List.of(
            new AffiliationResult("Acme Labs", EvidenceType.MESSAGE, "msg_affiliation_team"),
            new AffiliationResult("Other", EvidenceType.MESSAGE, "msg_affiliation_self")), c.results());
    }

    @Test
    @DisplayName("display name upgrades a bio entry")
    void displayNameOverBio() {
        AffiliationCollector c = new AffiliationCollector();
        c.offer("Acme", EvidenceType.BIO, "affiliation_title");
        c.offer("Acme Labs", EvidenceType.DISPLAY_NAME, "dn_affiliation_pipe");

        assertTrue(c.hasSource(EvidenceType.DISPLAY_NAME));
        assertFalse(c.hasSource(EvidenceType.BIO));
    }

    @Test
    @DisplayName("names that normalize to empty are ignored")
    void emptyKey() {
        AffiliationCollector c = new AffiliationCollector();
        assertFalse(c.offer("Labs", EvidenceType.MESSAGE, "msg_affiliation_work"));
        assertTrue(c.results().isEmpty());
    }
}
