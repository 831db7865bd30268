package com.profileplatform.common.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Locale;

import static org.junit.jupiter.api.Assertions.*;

class LabelLookupTest {

    @Test
    @DisplayName("upper-case labels resolve regardless of the default locale")
    void localeIndependent() {
        Locale previous = Locale.getDefault();
        Locale.setDefault(new Locale("tr", "TR"));
        try {
            assertEquals(Intent.HIRING, Intent.fromLabel("HIRING"));
            assertEquals(Role.INVESTOR_ANALYST, Role.fromLabel("INVESTOR_ANALYST"));
            assertEquals(GroupKind.UNKNOWN, GroupKind.fromLabel("UNKNOWN"));
            assertEquals(OrgType.INFRASTRUCTURE, OrgType.fromLabel("INFRASTRUCTURE"));
            assertEquals(Predicate.AFFILIATED_WITH, Predicate.fromLabel("AFFILIATED_WITH"));
            assertEquals(EvidenceType.DISPLAY_NAME, EvidenceType.fromLabel("DISPLAY_NAME"));
        } finally {
            Locale.setDefault(previous);
        }
    }

    @Test
    @DisplayName("unknown labels resolve to null, group kinds to UNKNOWN")
    void unknownLabels() {
        assertNull(Role.fromLabel("wizard"));
        assertNull(Intent.fromLabel(null));
        assertEquals(GroupKind.UNKNOWN, GroupKind.fromLabel("lounge"));
    }
}
