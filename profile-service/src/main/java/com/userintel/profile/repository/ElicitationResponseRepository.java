package com.userintel.profile.repository;

import com.userintel.profile.model.ElicitationResponseRecord;
import org.springframework.data.repository.reactive.ReactiveCrudRepository;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Flux;

@Repository
public interface ElicitationResponseRepository extends ReactiveCrudRepository<ElicitationResponseRecord, Long> {

    Flux<ElicitationResponseRecord> findByUserIdOrderByAskedAtDesc(String userId);
}
