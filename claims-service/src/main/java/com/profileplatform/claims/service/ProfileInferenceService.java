package com.profileplatform.claims.service;

import com.profileplatform.claims.dto.AbstentionDTO;
import com.profileplatform.claims.dto.ClaimDTO;
import com.profileplatform.claims.dto.ConfigSummaryDTO;
import com.profileplatform.claims.dto.InferenceOutcomeDTO;
import com.profileplatform.claims.dto.InferenceRunSummary;
import com.profileplatform.claims.model.AbstentionRecord;
import com.profileplatform.claims.model.Claim;
import com.profileplatform.claims.repository.AbstentionRepository;
import com.profileplatform.claims.repository.ClaimEvidenceRepository;
import com.profileplatform.claims.repository.ClaimRepository;
import com.profileplatform.common.config.InferenceConfig;
import com.profileplatform.common.inference.EvidenceGate;
import com.profileplatform.common.inference.InferenceEngine;
import com.profileplatform.common.model.AffiliationResult;
import com.profileplatform.common.model.ClaimStatus;
import com.profileplatform.common.model.EvidenceRow;
import com.profileplatform.common.model.OrgTypeResult;
import com.profileplatform.common.model.Predicate;
import com.profileplatform.common.model.ScoredLabel;
import com.profileplatform.common.model.UserInferenceInput;
import com.profileplatform.common.model.UserInferenceResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.transaction.reactive.TransactionalOperator;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.ArrayList;
import java.util.List;

/**
 * Scores users with the {@link InferenceEngine} and persists the outcome.
 *
 * <p>Per user, inside one transaction:
 * <ol>
 *   <li>delete the user's claims and abstentions for the active config version</li>
 *   <li>role claim and intent claim, when not gated</li>
 *   <li>one {@code affiliated_with} claim per affiliation (p = 0.9, supported)</li>
 *   <li>one {@code has_org_type} claim per org type (p = 0.8, supported)</li>
 *   <li>one abstention per gating note</li>
 * </ol>
 * A failure rolls back that user only. Re-running the same config version
 * leaves exactly the rows of the latest run.
 */
@Service
public class ProfileInferenceService {

    private static final Logger log = LoggerFactory.getLogger(ProfileInferenceService.class);

    static final double AFFILIATION_CONFIDENCE = 0.9;
    static final double ORG_TYPE_CONFIDENCE    = 0.8;
    static final double SIDE_CLAIM_WEIGHT      = 3.0;

    private final InferenceEngine engine;
    private final InferenceConfig config;
    private final ClaimPersistenceGateway gateway;
    private final ClaimRepository claimRepository;
    private final ClaimEvidenceRepository evidenceRepository;
    private final AbstentionRepository abstentionRepository;
    private final TransactionalOperator transactionalOperator;
    private final double supportedThreshold;
    private final int runParallelism;

    public ProfileInferenceService(InferenceEngine engine,
                                   InferenceConfig config,
                                   ClaimPersistenceGateway gateway,
                                   ClaimRepository claimRepository,
                                   ClaimEvidenceRepository evidenceRepository,
                                   AbstentionRepository abstentionRepository,
                                   TransactionalOperator transactionalOperator,
                                   @Value("${inference.supported-threshold:0.3}") double supportedThreshold,
                                   @Value("${inference.run.parallelism:4}") int runParallelism) {
        this.engine                = engine;
        this.config                = config;
        this.gateway               = gateway;
        this.claimRepository       = claimRepository;
        this.evidenceRepository    = evidenceRepository;
        this.abstentionRepository  = abstentionRepository;
        this.transactionalOperator = transactionalOperator;
        this.supportedThreshold    = supportedThreshold;
        this.runParallelism        = Math.max(1, runParallelism);
    }

    /** Scores without writing anything. */
    public UserInferenceResult score(UserInferenceInput input) {
        return engine.scoreUser(input, config);
    }

    /** Scores one user and persists claims and abstentions in one transaction. */
    public Mono<InferenceOutcomeDTO> infer(UserInferenceInput input) {
        return Mono.fromCallable(() -> score(input))
            .flatMap(result -> persist(result)
                .as(transactionalOperator::transactional)
                .doOnSuccess(outcome -> log.info(
                    "[Inference] User persisted. userId={} role={} intent={} claims={} abstentions={} version={}",
                    result.userId(), labelOrGated(result.roleClaim()), labelOrGated(result.intentClaim()),
                    outcome.claimsWritten(), outcome.abstentionsWritten(), config.version())));
    }

    /**
     * Population run. Users are processed concurrently up to the configured
     * parallelism; a failing user is logged, counted and skipped.
     */
    public Mono<InferenceRunSummary> scoreAll(List<UserInferenceInput> inputs) {
        long started = System.currentTimeMillis();
        log.info("[InferenceRun] Starting. users={} parallelism={} version={}",
            inputs.size(), runParallelism, config.version());

        return Flux.fromIterable(inputs)
            .flatMap(input -> infer(input)
                .map(UserRun::success)
                .onErrorResume(e -> {
                    log.warn("[InferenceRun] User failed (non-fatal). userId={} reason={}",
                        input.userId(), e.getMessage());
                    return Mono.just(UserRun.failure(input.userId()));
                }), runParallelism)
            .collectList()
            .map(runs -> summarize(runs, System.currentTimeMillis() - started))
            .doOnNext(summary -> log.info(
                "[InferenceRun] Complete. processed={} failed={} claims={} abstentions={} durationMs={} version={}",
                summary.usersProcessed(), summary.usersFailed(), summary.claimsWritten(),
                summary.abstentionsWritten(), summary.durationMs(), summary.modelVersion()));
    }

    // ── read side ──────────────────────────────────────────────────────────

    public Flux<ClaimDTO> getClaims(long userId, String modelVersion) {
        Flux<Claim> claims = modelVersion == null || modelVersion.isBlank()
            ? claimRepository.findBySubject(userId)
            : claimRepository.findBySubjectAndVersion(userId, modelVersion);
        return claims.concatMap(claim -> evidenceRepository.findByClaimId(claim.getId())
            .map(e -> new ClaimDTO.EvidenceDTO(e.getEvidenceType(), e.getEvidenceRef(), e.getWeight()))
            .collectList()
            .map(evidence -> toDto(claim, evidence)));
    }

    public Flux<AbstentionDTO> getAbstentions(long userId, String modelVersion) {
        Flux<AbstentionRecord> rows = modelVersion == null || modelVersion.isBlank()
            ? abstentionRepository.findBySubject(userId)
            : abstentionRepository.findBySubjectAndVersion(userId, modelVersion);
        return rows.map(r -> new AbstentionDTO(r.getSubjectUserId(), r.getPredicate(), r.getReasonCode(),
            r.getDetails(), r.getModelVersion(), r.getGeneratedAt()));
    }

    public ConfigSummaryDTO getConfigSummary() {
        return new ConfigSummaryDTO(config.version(), config.description(), engine.dictionaries().version(),
            config.gating().minNonMembershipEvidence(), config.gating().minClaimConfidence(), supportedThreshold);
    }

    // ── persistence ────────────────────────────────────────────────────────

    private Mono<InferenceOutcomeDTO> persist(UserInferenceResult result) {
        long userId    = result.userId();
        String version = config.version();
        List<Mono<Void>> writes = new ArrayList<>();
        writes.add(gateway.clearSubject(userId, version));
        int claims = 0;

        if (result.roleClaim() != null) {
            writes.add(writeScored(userId, Predicate.HAS_ROLE, result.roleClaim().label().label(), result.roleClaim()).then());
            claims++;
        }
        if (result.intentClaim() != null) {
            writes.add(writeScored(userId, Predicate.HAS_INTENT, result.intentClaim().label().label(), result.intentClaim()).then());
            claims++;
        }
        for (AffiliationResult aff : result.affiliations()) {
            EvidenceRow row = EvidenceRow.of(aff.source(),
                aff.source().label() + ":affiliation:" + aff.tag(), SIDE_CLAIM_WEIGHT);
            writes.add(gateway.writeClaim(userId, Predicate.AFFILIATED_WITH, aff.name(),
                AFFILIATION_CONFIDENCE, ClaimStatus.SUPPORTED, List.of(row), version, null).then());
            claims++;
        }
        for (OrgTypeResult org : result.orgTypes()) {
            EvidenceRow row = EvidenceRow.of(org.source(),
                org.source().label() + ":org_type:" + org.tag(), SIDE_CLAIM_WEIGHT);
            writes.add(gateway.writeClaim(userId, Predicate.HAS_ORG_TYPE, org.orgType().label(),
                ORG_TYPE_CONFIDENCE, ClaimStatus.SUPPORTED, List.of(row), version, null).then());
            claims++;
        }
        for (String note : result.gatingNotes()) {
            writes.add(gateway.writeAbstention(userId, predicateOf(note),
                EvidenceGate.reasonOf(note).code(), note, version));
        }

        InferenceOutcomeDTO outcome =
            new InferenceOutcomeDTO(userId, version, claims, result.gatingNotes().size(), result);
        return Flux.concat(writes).then(Mono.just(outcome));
    }

    private Mono<Long> writeScored(long userId, Predicate predicate, String label, ScoredLabel<?> claim) {
        double p = claim.probability();
        return gateway.writeClaim(userId, predicate, label, roundConfidence(p),
            ClaimStatus.fromProbability(p, supportedThreshold), claim.evidence(), config.version(), null);
    }

    static Predicate predicateOf(String gatingNote) {
        return gatingNote != null && gatingNote.startsWith("intent:") ? Predicate.HAS_INTENT : Predicate.HAS_ROLE;
    }

    static double roundConfidence(double p) {
        return Math.round(p * 10_000.0) / 10_000.0;
    }

    private static String labelOrGated(ScoredLabel<?> claim) {
        return claim == null ? "GATED" : String.valueOf(claim.label());
    }

    private static ClaimDTO toDto(Claim c, List<ClaimDTO.EvidenceDTO> evidence) {
        return new ClaimDTO(c.getId(), c.getSubjectUserId(), c.getPredicate(), c.getObjectValue(), c.getStatus(),
            c.getConfidence(), c.getModelVersion(), c.getGeneratedAt(), evidence);
    }

    private InferenceRunSummary summarize(List<UserRun> runs, long durationMs) {
        int claims = 0;
        int abstentions = 0;
        List<Long> failed = new ArrayList<>();
        for (UserRun run : runs) {
            if (run.outcome() == null) {
                failed.add(run.userId());
            } else {
                claims      += run.outcome().claimsWritten();
                abstentions += run.outcome().abstentionsWritten();
            }
        }
        return new InferenceRunSummary(config.version(), runs.size() - failed.size(), failed.size(),
            claims, abstentions, failed, durationMs);
    }

    private record UserRun(long userId, InferenceOutcomeDTO outcome) {

        static UserRun success(InferenceOutcomeDTO outcome) {
            return new UserRun(outcome.userId(), outcome);
        }

        static UserRun failure(long userId) {
            return new UserRun(userId, null);
        }
    }
}
