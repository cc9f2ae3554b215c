package com.userintel.profile.repository;

import com.userintel.profile.model.UserProfile;
import org.springframework.data.r2dbc.repository.Modifying;
import org.springframework.data.r2dbc.repository.Query;
import org.springframework.data.repository.reactive.ReactiveCrudRepository;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.LocalDateTime;

@Repository
public interface UserProfileRepository extends ReactiveCrudRepository<UserProfile, Long> {

    Mono<UserProfile> findByUserId(String userId);

    /**
     * Coarse pre-filter for the batch sweep: tier B/C profiles that are either
     * due by schedule or hold at least one unprocessed signal. The exact
     * eligibility rule is applied afterwards per profile.
     */
    @Query("""
        SELECT p.* FROM user_profile p
        WHERE p.privacy_tier <> 'A'
          AND (p.next_reflection_at <= :now
               OR EXISTS (SELECT 1 FROM profile_signal s
                          WHERE s.user_id = p.user_id AND s.processed = false))
        ORDER BY p.next_reflection_at ASC NULLS FIRST
        LIMIT :limit
        """)
    Flux<UserProfile> findSweepCandidates(LocalDateTime now, int limit);

    // Counters and markers are updated in place so concurrent requests for the
    // same user never overwrite each other's columns.

    @Modifying
    @Query("""
        UPDATE user_profile
        SET session_count = session_count + 1, updated_at = :now
        WHERE user_id = :userId
        """)
    Mono<Integer> incrementSessionCount(String userId, LocalDateTime now);

    @Modifying
    @Query("""
        UPDATE user_profile
        SET signal_count = signal_count + :count, updated_at = :now
        WHERE user_id = :userId
        """)
    Mono<Integer> addSignalCount(String userId, long count, LocalDateTime now);

    @Modifying
    @Query("""
        UPDATE user_profile
        SET last_reflection_at = :reflectedAt, next_reflection_at = :nextAt, updated_at = :reflectedAt
        WHERE user_id = :userId
        """)
    Mono<Integer> markReflected(String userId, LocalDateTime reflectedAt, LocalDateTime nextAt);

    /**
     * Claims the session's single elicitation slot.
     * @return 1 when claimed, 0 when a question was already served in that session
     */
    @Modifying
    @Query("""
        UPDATE user_profile
        SET last_question_session = :session, updated_at = :now
        WHERE user_id = :userId
          AND (last_question_session IS NULL OR last_question_session <> :session)
        """)
    Mono<Integer> claimQuestionSlot(String userId, int session, LocalDateTime now);

    @Modifying
    @Query("""
        UPDATE user_profile
        SET questions_asked = questions_asked + 1, last_question_session = :session, updated_at = :now
        WHERE user_id = :userId
        """)
    Mono<Integer> recordQuestionAsked(String userId, int session, LocalDateTime now);

    @Modifying
    @Query("""
        UPDATE user_profile
        SET privacy_tier = :tier, updated_at = :now
        WHERE user_id = :userId
        """)
    Mono<Integer> updatePrivacyTier(String userId, String tier, LocalDateTime now);
}
