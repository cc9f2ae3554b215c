package com.userintel.profile.repository;

import com.userintel.profile.model.DimensionScoreRecord;
import org.springframework.data.r2dbc.repository.Modifying;
import org.springframework.data.r2dbc.repository.Query;
import org.springframework.data.repository.reactive.ReactiveCrudRepository;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.LocalDateTime;

@Repository
public interface DimensionScoreRepository extends ReactiveCrudRepository<DimensionScoreRecord, Long> {

    Flux<DimensionScoreRecord> findByUserId(String userId);

    /**
     * Atomic UPSERT of a newly inferred value for (user, domain).
     * Only called after the overwrite rule has accepted the new value.
     */
    @Modifying
    @Query("""
        INSERT INTO dimension_score
            (user_id, domain, value, confidence, decay_rate, sources, last_updated, last_decayed_at)
        VALUES
            (:userId, :domain, :value, :confidence, :decayRate, :sources, :now, :now)
        ON CONFLICT (user_id, domain) DO UPDATE SET
            value           = EXCLUDED.value,
            confidence      = EXCLUDED.confidence,
            decay_rate      = EXCLUDED.decay_rate,
            sources         = EXCLUDED.sources,
            last_updated    = EXCLUDED.last_updated,
            last_decayed_at = EXCLUDED.last_decayed_at
        """)
    Mono<Integer> upsertScore(String userId, String domain, String value, double confidence,
                              double decayRate, String sources, LocalDateTime now);

    /** Folds elapsed decay into the stored confidence. The value is left untouched. */
    @Modifying
    @Query("""
        UPDATE dimension_score
        SET confidence = :confidence, last_decayed_at = :decayedAt
        WHERE user_id = :userId AND domain = :domain
        """)
    Mono<Integer> applyDecay(String userId, String domain, double confidence, LocalDateTime decayedAt);

    @Modifying
    @Query("DELETE FROM dimension_score WHERE user_id = :userId")
    Mono<Integer> deleteByUserId(String userId);
}
