package com.profileplatform.claims.repository;

import com.profileplatform.claims.model.Claim;
import org.springframework.data.r2dbc.repository.Modifying;
import org.springframework.data.r2dbc.repository.Query;
import org.springframework.data.repository.reactive.ReactiveCrudRepository;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

@Repository
public interface ClaimRepository extends ReactiveCrudRepository<Claim, Long> {

    /**
     * Atomic UPSERT on the 4-part key. On conflict only confidence, status,
     * notes and the timestamp change; the row id is stable across re-runs.
     *
     * @return id of the inserted or updated claim
     */
    @Query("""
        INSERT INTO claims
            (subject_user_id, predicate, object_value, confidence, status,
             model_version, notes, generated_at)
        VALUES
            (:subjectUserId, :predicate, :objectValue, :confidence, :status,
             :modelVersion, :notes, NOW())
        ON CONFLICT (subject_user_id, predicate, object_value, model_version) DO UPDATE SET
            confidence   = EXCLUDED.confidence,
            status       = EXCLUDED.status,
            notes        = EXCLUDED.notes,
            generated_at = NOW()
        RETURNING id
        """)
    Mono<Long> upsertClaim(Long subjectUserId, String predicate, String objectValue,
                           double confidence, String status, String modelVersion, String notes);

    /**
     * Removes the subject's inferred claims for one model version; evidence rows
     * go with them (ON DELETE CASCADE).
     */
    @Modifying
    @Query("""
        DELETE FROM claims
        WHERE subject_user_id = :subjectUserId
          AND model_version   = :modelVersion
          AND predicate IN ('has_role', 'has_intent', 'affiliated_with', 'has_org_type')
        """)
    Mono<Integer> deleteBySubjectAndVersion(Long subjectUserId, String modelVersion);

    @Query("""
        SELECT * FROM claims
        WHERE subject_user_id = :subjectUserId
        ORDER BY model_version DESC, predicate, confidence DESC
        """)
    Flux<Claim> findBySubject(Long subjectUserId);

    @Query("""
        SELECT * FROM claims
        WHERE subject_user_id = :subjectUserId
          AND model_version   = :modelVersion
        ORDER BY predicate, confidence DESC
        """)
    Flux<Claim> findBySubjectAndVersion(Long subjectUserId, String modelVersion);
}
