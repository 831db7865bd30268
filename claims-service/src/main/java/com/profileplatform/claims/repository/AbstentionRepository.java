package com.profileplatform.claims.repository;

import com.profileplatform.claims.model.AbstentionRecord;
import org.springframework.data.r2dbc.repository.Modifying;
import org.springframework.data.r2dbc.repository.Query;
import org.springframework.data.repository.reactive.ReactiveCrudRepository;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

@Repository
public interface AbstentionRepository extends ReactiveCrudRepository<AbstentionRecord, Long> {

    @Query("SELECT * FROM abstention_log WHERE subject_user_id = :subjectUserId ORDER BY generated_at DESC, id DESC")
    Flux<AbstentionRecord> findBySubject(Long subjectUserId);

    @Query("""
        SELECT * FROM abstention_log
        WHERE subject_user_id = :subjectUserId
          AND model_version   = :modelVersion
        ORDER BY generated_at DESC, id DESC
        """)
    Flux<AbstentionRecord> findBySubjectAndVersion(Long subjectUserId, String modelVersion);

    @Modifying
    @Query("DELETE FROM abstention_log WHERE subject_user_id = :subjectUserId AND model_version = :modelVersion")
    Mono<Integer> deleteBySubjectAndVersion(Long subjectUserId, String modelVersion);
}
