package com.profileplatform.common.affiliation;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class OrgCandidateValidatorTest {

    private final OrgCandidateValidator validator = OrgCandidateValidator.defaults();

    @Nested
    @DisplayName("cleaning stages")
    class CleaningTests {

        @Test
        @DisplayName("trailing clause is stripped")
        void trailingClause() {
            assertEquals("Acme", validator.validate("Acme right now"));
            assertEquals("Acme Labs", validator.validate("Acme Labs and friends"));
        }

        @Test
        @DisplayName("network qualifier is clamped")
        void chainClamp() {
            assertEquals("Acme", validator.validate("Acme on Solana"));
            assertEquals("Acme", validator.validate("Acme built on Base"));
        }

        @Test
        @DisplayName("definitional clause is clamped")
        void definitionalClamp() {
            assertEquals("Acme", validator.validate("Acme is a wallet"));
            assertEquals("Acme", validator.validate("Acme, the best DEX"));
        }

        @Test
        @DisplayName("truncates at the first lowercase word")
        void lowercaseTruncation() {
            assertEquals("Acme Labs", validator.validate("Acme Labs building stuff"));
            assertEquals("SolidityScan", validator.validate("  SolidityScan  "));
        }
    }

    @Nested
    @DisplayName("rejections")
    class RejectTests {

        @Test
        @DisplayName("null and too short")
        void tooShort() {
            assertNull(validator.validate(null));
            assertNull(validator.validate("AB"));
            assertNull(validator.validate("   "));
        }

        @Test
        @DisplayName("structural stopword as first word")
        void stopword() {
            assertNull(validator.validate("The Graph"));
            assertNull(validator.validate("Our Team"));
        }

        @Test
        @DisplayName("starts lowercase")
        void startsLowercase() {
            assertNull(validator.validate("acme"));
        }

        @Test
        @DisplayName("bare titles")
        void bareTitle() {
            assertNull(validator.validate("Founder"));
            assertNull(validator.validate("Community Manager"));
        }

        @Test
        @DisplayName("locations, verticals, functions, platforms")
        void rejectSet() {
            for (String s : List.of("Dubai", "South Asia", "Web3", "DeFi", "Marketing", "Business", "Telegram")) {
                assertNull(validator.validate(s), s);
            }
        }

        @Test
        @DisplayName("events, numbers and quarters")
        void rejectPatterns() {
            assertNull(validator.validate("Token 2049"));
            assertNull(validator.validate("ETHDenver"));
            assertNull(validator.validate("2024"));
            assertNull(validator.validate("Q3 Roadmap"));
        }

        @Test
        @DisplayName("generic phrase opener")
        void genericPhrase() {
            assertNull(validator.validate("Various Partners"));
        }
    }

    @Test
    @DisplayName("validate is idempotent")
    void idempotent() {
        List<String> inputs = List.of("Acme right now", "Acme on Solana", "Gate.io", "Acme Labs building stuff",
            "Acme, the best DEX", "RealCo", "Binance Labs", "Dubai", "the thing");
        for (String in : inputs) {
            String once = validator.validate(in);
            if (once != null) {
                assertEquals(once, validator.validate(once), in);
            }
        }
    }
}
