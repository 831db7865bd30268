package com.profileplatform.common.affiliation;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class OrgNamesTest {

    @Test
    @DisplayName("TLD and entity suffixes are dropped")
    void suffixes() {
        assertEquals("gate", OrgNames.normalize("Gate.io"));
        assertEquals("acme", OrgNames.normalize("Acme Labs"));
        assertEquals("acme", OrgNames.normalize("ACME Inc"));
        assertEquals("uniswap", OrgNames.normalize("Uniswap Protocol"));
    }

    @Test
    @DisplayName("quotes and punctuation stripped, whitespace collapsed")
    void punctuation() {
        assertEquals("bobs shop", OrgNames.normalize("Bob’s   Shop!"));
    }

    @Test
    @DisplayName("null normalizes to empty")
    void nullSafe() {
        assertEquals("", OrgNames.normalize(null));
    }

    @Test
    @DisplayName("same organization across spellings")
    void sameOrganization() {
        assertTrue(OrgNames.sameOrganization("Gate.io", "GATE Exchange"));
        assertFalse(OrgNames.sameOrganization("Gate.io", "RealCo"));
    }
}
