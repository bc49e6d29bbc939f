package com.communitychallenge.platform.repository.impl;

import com.communitychallenge.platform.model.ProgressReceipt;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.Optional;

@Repository
public interface ProgressReceiptJpaRepository extends JpaRepository<ProgressReceipt, Long> {
    Optional<ProgressReceipt> findByChallengeIdAndContributorIdAndIdempotencyKey(
            Long challengeId, String contributorId, String idempotencyKey);

    @Modifying
    @Query("delete from ProgressReceipt r where r.challengeId = :challengeId")
    int deleteAllByChallengeId(@Param("challengeId") Long challengeId);

    @Modifying
    @Query("delete from ProgressReceipt r where r.receivedAt < :cutoff")
    int deleteAllReceivedBefore(@Param("cutoff") Instant cutoff);
}
