package com.userintel.profile.repository;

import com.userintel.profile.model.SignalRecord;
import org.springframework.data.r2dbc.repository.Modifying;
import org.springframework.data.r2dbc.repository.Query;
import org.springframework.data.repository.reactive.ReactiveCrudRepository;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.LocalDateTime;
import java.util.Collection;

@Repository
public interface SignalRecordRepository extends ReactiveCrudRepository<SignalRecord, Long> {

    /** Oldest first, so a capped batch never skips older evidence. */
    @Query("""
        SELECT * FROM profile_signal
        WHERE user_id = :userId AND processed = false
        ORDER BY observed_at ASC, id ASC
        LIMIT :limit
        """)
    Flux<SignalRecord> findUnprocessed(String userId, int limit);

    @Query("SELECT COUNT(*) FROM profile_signal WHERE user_id = :userId AND processed = false")
    Mono<Long> countUnprocessed(String userId);

    @Modifying
    @Query("""
        UPDATE profile_signal
        SET processed = true, processed_at = :processedAt
        WHERE id IN (:ids) AND processed = false
        """)
    Mono<Integer> markProcessed(Collection<Long> ids, LocalDateTime processedAt);
}
