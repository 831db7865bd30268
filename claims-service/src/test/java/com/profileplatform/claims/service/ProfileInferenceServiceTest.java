package com.profileplatform.claims.service;

import com.profileplatform.claims.dto.ConfigSummaryDTO;
import com.profileplatform.claims.dto.InferenceOutcomeDTO;
import com.profileplatform.claims.dto.InferenceRunSummary;
import com.profileplatform.claims.model.AbstentionRecord;
import com.profileplatform.claims.repository.AbstentionRepository;
import com.profileplatform.claims.repository.ClaimEvidenceRepository;
import com.profileplatform.claims.repository.ClaimRepository;
import com.profileplatform.common.config.InferenceConfig;
import com.profileplatform.common.inference.InferenceEngine;
import com.profileplatform.common.model.ClaimStatus;
import com.profileplatform.common.model.EvidenceRow;
import com.profileplatform.common.model.EvidenceType;
import com.profileplatform.common.model.Predicate;
import com.profileplatform.common.model.UserInferenceInput;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.mockito.Mockito;
import org.springframework.transaction.reactive.TransactionalOperator;
import reactor.core.publisher.Mono;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyDouble;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class ProfileInferenceServiceTest {

    private static final String VERSION = "v0.5.1";

    private ClaimPersistenceGateway gateway;
    private TransactionalOperator tx;
    private ProfileInferenceService service;

    @BeforeEach
    @SuppressWarnings("unchecked")
    void setUp() {
        gateway = Mockito.mock(ClaimPersistenceGateway.class);
        tx      = Mockito.mock(TransactionalOperator.class);
        when(tx.transactional(any(Mono.class))).thenAnswer(inv -> inv.getArgument(0));

        when(gateway.writeClaim(anyLong(), any(), anyString(), anyDouble(), any(), anyList(), anyString(), any()))
            .thenReturn(Mono.just(1L));
        when(gateway.writeAbstention(anyLong(), any(), anyString(), anyString(), anyString()))
            .thenReturn(Mono.empty());
        when(gateway.clearSubject(anyLong(), anyString())).thenReturn(Mono.empty());

        service = new ProfileInferenceService(InferenceEngine.defaults(), InferenceConfig.defaults(), gateway,
            Mockito.mock(ClaimRepository.class), Mockito.mock(ClaimEvidenceRepository.class),
            Mockito.mock(AbstentionRepository.class), tx, 0.3, 2);
    }

    private static UserInferenceInput founder(long userId) {
        return UserInferenceInput.of(userId, null, "Founder & CEO at Acme Labs", List.of(), List.of());
    }

    @Nested
    @DisplayName("infer()")
    class InferTests {

        @Test
        @DisplayName("role claim, affiliation claim and intent abstention in one transaction")
        void fullWriteSequence() {
            InferenceOutcomeDTO outcome = service.infer(founder(1L)).block();

            assertNotNull(outcome);
            assertEquals(2, outcome.claimsWritten());
            assertEquals(1, outcome.abstentionsWritten());
            assertEquals(VERSION, outcome.modelVersion());

            verify(gateway).writeClaim(eq(1L), eq(Predicate.HAS_ROLE), eq("founder_exec"), eq(0.7152),
                eq(ClaimStatus.SUPPORTED), anyList(), eq(VERSION), isNull());
            verify(gateway).writeClaim(1L, Predicate.AFFILIATED_WITH, "Acme Labs", 0.9, ClaimStatus.SUPPORTED,
                List.of(EvidenceRow.of(EvidenceType.BIO, "bio:affiliation:affiliation_at", 3.0)), VERSION, null);
            verify(gateway).writeAbstention(1L, Predicate.HAS_INTENT, "insufficient_evidence",
                "intent:networking GATED — only 0 non-membership evidence (need ≥1)", VERSION);
            verify(gateway).clearSubject(1L, VERSION);
            verify(tx).transactional(any(Mono.class));
        }

        @Test
        @DisplayName("probability below the supported threshold → tentative")
        void tentativeStatus() {
            UserInferenceInput replier = new UserInferenceInput(5L, null, null, List.of(), List.of(),
                10, 5, 0, 0.0, 0.0, 0);
            service.infer(replier).block();

            verify(gateway).writeClaim(eq(5L), eq(Predicate.HAS_INTENT), eq("support_giving"), eq(0.2513),
                eq(ClaimStatus.TENTATIVE), anyList(), eq(VERSION), isNull());
            verify(gateway).writeAbstention(eq(5L), eq(Predicate.HAS_ROLE), eq("insufficient_evidence"),
                anyString(), eq(VERSION));
        }

        @Test
        @DisplayName("display-name org type → has_org_type claim")
        void orgTypeClaim() {
            service.infer(UserInferenceInput.of(6L, "Alice | Gate.io BD", null, List.of(), List.of())).block();

            verify(gateway).writeClaim(6L, Predicate.HAS_ORG_TYPE, "exchange", 0.8, ClaimStatus.SUPPORTED,
                List.of(EvidenceRow.of(EvidenceType.DISPLAY_NAME, "display_name:org_type:org_exchange", 3.0)),
                VERSION, null);
        }

        @Test
        @DisplayName("score() never writes")
        void scoreIsReadOnly() {
            assertNotNull(service.score(founder(1L)).roleClaim());
            verify(gateway, never()).writeClaim(anyLong(), any(), anyString(), anyDouble(), any(), anyList(),
                anyString(), any());
        }
    }

    @Nested
    @DisplayName("re-running the same version")
    class RerunTests {

        private final List<String> writes = new ArrayList<>();
        private ProfileInferenceService rerunService;

        @BeforeEach
        void wireGatewayOverRepositories() {
            ClaimRepository claims           = Mockito.mock(ClaimRepository.class);
            ClaimEvidenceRepository evidence = Mockito.mock(ClaimEvidenceRepository.class);
            AbstentionRepository abstentions = Mockito.mock(AbstentionRepository.class);

            when(claims.deleteBySubjectAndVersion(anyLong(), anyString())).thenAnswer(inv -> {
                writes.add("clear-claims:" + inv.getArgument(0));
                return Mono.just(0);
            });
            when(abstentions.deleteBySubjectAndVersion(anyLong(), anyString())).thenAnswer(inv -> {
                writes.add("clear-abstentions:" + inv.getArgument(0));
                return Mono.just(0);
            });
            when(claims.upsertClaim(anyLong(), anyString(), anyString(), anyDouble(), anyString(), anyString(), any()))
                .thenAnswer(inv -> {
                    writes.add("claim:" + inv.getArgument(1) + ":" + inv.getArgument(2));
                    return Mono.just(9L);
                });
            when(evidence.deleteByClaimId(anyLong())).thenReturn(Mono.just(0));
            when(evidence.insertEvidence(anyLong(), anyString(), anyString(), anyDouble())).thenReturn(Mono.just(1));
            when(abstentions.save(any(AbstentionRecord.class))).thenAnswer(inv -> {
                writes.add("abstention:" + ((AbstentionRecord) inv.getArgument(0)).getPredicate());
                return Mono.just(inv.getArgument(0));
            });

            rerunService = new ProfileInferenceService(InferenceEngine.defaults(), InferenceConfig.defaults(),
                new ClaimPersistenceGateway(claims, evidence, abstentions), claims, evidence, abstentions,
                tx, 0.3, 2);
        }

        @Test
        @DisplayName("identical runs clear the version before writing abstentions again")
        void identicalRuns() {
            UserInferenceInput enthusiast = UserInferenceInput.of(1L, null, "crypto enthusiast", List.of(), List.of());
            rerunService.infer(enthusiast).block();
            rerunService.infer(enthusiast).block();

            List<String> oneRun = List.of("clear-claims:1", "clear-abstentions:1",
                "abstention:has_role", "abstention:has_intent");
            List<String> expected = new ArrayList<>(oneRun);
            expected.addAll(oneRun);
            assertEquals(expected, writes);
        }

        @Test
        @DisplayName("a changed top role is written after the previous claim was cleared")
        void changedRole() {
            rerunService.infer(UserInferenceInput.of(2L, null, "BD lead", List.of(), List.of())).block();
            rerunService.infer(UserInferenceInput.of(2L, null, "Solidity engineer", List.of(), List.of())).block();

            int staleClaim  = writes.indexOf("claim:has_role:bd");
            int secondClear = writes.lastIndexOf("clear-claims:2");
            int newClaim    = writes.indexOf("claim:has_role:builder");
            assertTrue(staleClaim >= 0 && newClaim >= 0, writes::toString);
            assertTrue(staleClaim < secondClear && secondClear < newClaim, writes::toString);
        }
    }

    @Nested
    @DisplayName("scoreAll()")
    class ScoreAllTests {

        @Test
        @DisplayName("a failing user is counted and skipped")
        void failureIsolated() {
            when(gateway.writeClaim(eq(2L), any(), anyString(), anyDouble(), any(), anyList(), anyString(), any()))
                .thenReturn(Mono.error(new IllegalStateException("db down")));

            InferenceRunSummary summary = service.scoreAll(List.of(founder(1L), founder(2L), founder(3L))).block();

            assertNotNull(summary);
            assertEquals(2, summary.usersProcessed());
            assertEquals(1, summary.usersFailed());
            assertEquals(List.of(2L), summary.failedUserIds());
            assertEquals(4, summary.claimsWritten());
            assertEquals(2, summary.abstentionsWritten());
            assertEquals(VERSION, summary.modelVersion());
        }

        @Test
        @DisplayName("empty population → zero summary")
        void empty() {
            InferenceRunSummary summary = service.scoreAll(List.of()).block();
            assertNotNull(summary);
            assertEquals(0, summary.usersProcessed());
            assertTrue(summary.failedUserIds().isEmpty());
        }
    }

    @Test
    @DisplayName("gating notes map to predicate and reason code")
    void noteParsing() {
        assertEquals(Predicate.HAS_INTENT, ProfileInferenceService.predicateOf("intent:hiring GATED — x"));
        assertEquals(Predicate.HAS_ROLE, ProfileInferenceService.predicateOf("role:bd GATED — x"));
        assertEquals(0.1235, ProfileInferenceService.roundConfidence(0.123456));
    }

    @Test
    @DisplayName("config summary reports the active version and thresholds")
    void configSummary() {
        ConfigSummaryDTO summary = service.getConfigSummary();
        assertEquals(VERSION, summary.version());
        assertEquals(1, summary.minNonMembershipEvidence());
        assertEquals(0.15, summary.minClaimConfidence());
        assertEquals(0.3, summary.supportedThreshold());
    }
}
