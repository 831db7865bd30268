package com.profileplatform.claims.service;

import com.profileplatform.claims.model.AbstentionRecord;
import com.profileplatform.claims.repository.AbstentionRepository;
import com.profileplatform.claims.repository.ClaimEvidenceRepository;
import com.profileplatform.claims.repository.ClaimRepository;
import com.profileplatform.common.model.ClaimStatus;
import com.profileplatform.common.model.EvidenceRow;
import com.profileplatform.common.model.Predicate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Writes claims with their evidence and abstentions.
 *
 * <h3>Claim write</h3>
 * <ol>
 *   <li>Upsert on (subject, predicate, object, modelVersion); the id is stable.</li>
 *   <li>Delete every evidence row of that claim.</li>
 *   <li>Insert the deduplicated evidence set: one row per
 *       (evidenceType, evidenceRef), the highest weight wins.</li>
 * </ol>
 * The three steps are not atomic on their own; callers run them inside a
 * transaction (see {@link ProfileInferenceService}).
 *
 * <p>Abstentions are append-only within a run. {@link #clearSubject} removes a
 * subject's claims and abstentions for one model version before it is re-scored.
 */
@Service
public class ClaimPersistenceGateway {

    private static final Logger log = LoggerFactory.getLogger(ClaimPersistenceGateway.class);

    private final ClaimRepository claimRepository;
    private final ClaimEvidenceRepository evidenceRepository;
    private final AbstentionRepository abstentionRepository;

    public ClaimPersistenceGateway(ClaimRepository claimRepository,
                                   ClaimEvidenceRepository evidenceRepository,
                                   AbstentionRepository abstentionRepository) {
        this.claimRepository      = claimRepository;
        this.evidenceRepository   = evidenceRepository;
        this.abstentionRepository = abstentionRepository;
    }

    /**
     * @return id of the upserted claim
     */
    public Mono<Long> writeClaim(long subjectUserId, Predicate predicate, String objectValue,
                                 double confidence, ClaimStatus status, List<EvidenceRow> evidence,
                                 String modelVersion, String notes) {
        List<EvidenceRow> deduped = dedupEvidence(evidence);
        return claimRepository.upsertClaim(subjectUserId, predicate.label(), objectValue,
                confidence, status.label(), modelVersion, notes)
            .flatMap(claimId -> evidenceRepository.deleteByClaimId(claimId)
                .thenMany(Flux.fromIterable(deduped)
                    .concatMap(e -> evidenceRepository.insertEvidence(claimId,
                        e.evidenceType().label(), e.evidenceRef(), roundWeight(e.weight()))))
                .then(Mono.just(claimId)))
            .doOnNext(claimId -> log.debug(
                "[Gateway] Claim upserted. claimId={} subject={} predicate={} object={} status={} evidence={} version={}",
                claimId, subjectUserId, predicate.label(), objectValue, status.label(), deduped.size(), modelVersion))
            .doOnError(e -> log.error("[Gateway] Claim write failed. subject={} predicate={} object={}",
                subjectUserId, predicate.label(), objectValue, e));
    }

    /**
     * Deletes the subject's claims (with their evidence) and abstentions for
     * {@code modelVersion}. Other versions are untouched.
     */
    public Mono<Void> clearSubject(long subjectUserId, String modelVersion) {
        return claimRepository.deleteBySubjectAndVersion(subjectUserId, modelVersion)
            .flatMap(claims -> abstentionRepository.deleteBySubjectAndVersion(subjectUserId, modelVersion)
                .doOnNext(abstentions -> log.debug(
                    "[Gateway] Subject cleared. subject={} claims={} abstentions={} version={}",
                    subjectUserId, claims, abstentions, modelVersion)))
            .then();
    }

    public Mono<Void> writeAbstention(long subjectUserId, Predicate predicate, String reasonCode,
                                      String details, String modelVersion) {
        AbstentionRecord record = new AbstentionRecord();
        record.setSubjectUserId(subjectUserId);
        record.setPredicate(predicate.label());
        record.setReasonCode(reasonCode);
        record.setDetails(details);
        record.setModelVersion(modelVersion);
        record.setGeneratedAt(LocalDateTime.now(ZoneOffset.UTC));

        return abstentionRepository.save(record)
            .doOnNext(saved -> log.debug("[Gateway] Abstention logged. subject={} predicate={} reason={} version={}",
                subjectUserId, predicate.label(), reasonCode, modelVersion))
            .then();
    }

    /**
     * One row per {@link EvidenceRow#dedupKey()}, keeping the highest weight.
     * First-seen order is preserved.
     */
    static List<EvidenceRow> dedupEvidence(List<EvidenceRow> evidence) {
        if (evidence == null || evidence.isEmpty()) return List.of();
        Map<String, EvidenceRow> byKey = new LinkedHashMap<>();
        for (EvidenceRow e : evidence) {
            byKey.merge(e.dedupKey(), e, (kept, next) -> next.weight() > kept.weight() ? next : kept);
        }
        return new ArrayList<>(byKey.values());
    }

    // stored weights keep three decimals
    static double roundWeight(double weight) {
        return Math.round(weight * 1000.0) / 1000.0;
    }
}
