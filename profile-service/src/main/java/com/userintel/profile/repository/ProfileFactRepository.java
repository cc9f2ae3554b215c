package com.userintel.profile.repository;

import com.userintel.profile.model.ProfileFactRecord;
import org.springframework.data.r2dbc.repository.Modifying;
import org.springframework.data.r2dbc.repository.Query;
import org.springframework.data.repository.reactive.ReactiveCrudRepository;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.LocalDateTime;

@Repository
public interface ProfileFactRepository extends ReactiveCrudRepository<ProfileFactRecord, Long> {

    Flux<ProfileFactRecord> findByUserId(String userId);

    /**
     * Atomic UPSERT keyed on (user, fact type, key). An explicit fact is never
     * replaced by an inferred one.
     */
    @Modifying
    @Query("""
        INSERT INTO profile_fact
            (user_id, domain, fact_type, fact_key, fact_value, source, explicit, confidence, updated_at)
        VALUES
            (:userId, :domain, :factType, :factKey, :factValue, :source, :explicit, :confidence, :now)
        ON CONFLICT (user_id, fact_type, fact_key) DO UPDATE SET
            domain     = EXCLUDED.domain,
            fact_value = EXCLUDED.fact_value,
            source     = EXCLUDED.source,
            explicit   = EXCLUDED.explicit,
            confidence = EXCLUDED.confidence,
            updated_at = EXCLUDED.updated_at
        WHERE profile_fact.explicit = false OR EXCLUDED.explicit = true
        """)
    Mono<Integer> upsertFact(String userId, String domain, String factType, String factKey,
                             String factValue, String source, boolean explicit, double confidence,
                             LocalDateTime now);
}
