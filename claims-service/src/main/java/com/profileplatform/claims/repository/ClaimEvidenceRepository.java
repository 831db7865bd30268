package com.profileplatform.claims.repository;

import com.profileplatform.claims.model.ClaimEvidence;
import org.springframework.data.r2dbc.repository.Modifying;
import org.springframework.data.r2dbc.repository.Query;
import org.springframework.data.repository.reactive.ReactiveCrudRepository;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

@Repository
public interface ClaimEvidenceRepository extends ReactiveCrudRepository<ClaimEvidence, Long> {

    @Modifying
    @Query("DELETE FROM claim_evidence WHERE claim_id = :claimId")
    Mono<Integer> deleteByClaimId(Long claimId);

    @Modifying
    @Query("""
        INSERT INTO claim_evidence (claim_id, evidence_type, evidence_ref, weight)
        VALUES (:claimId, :evidenceType, :evidenceRef, :weight)
        ON CONFLICT (claim_id, evidence_type, evidence_ref) DO NOTHING
        """)
    Mono<Integer> insertEvidence(Long claimId, String evidenceType, String evidenceRef, double weight);

    @Query("SELECT * FROM claim_evidence WHERE claim_id = :claimId ORDER BY weight DESC, evidence_ref")
    Flux<ClaimEvidence> findByClaimId(Long claimId);
}
