package com.communitychallenge.platform.repository.impl;

import com.communitychallenge.platform.model.RewardGrant;
import com.communitychallenge.platform.model.RewardGrantStatus;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

@Repository
public interface RewardGrantJpaRepository extends JpaRepository<RewardGrant, Long> {
    Optional<RewardGrant> findByChallengeIdAndContributorId(Long challengeId, String contributorId);

    List<RewardGrant> findByChallengeIdAndStatusInOrderByUpdatedAtAsc(Long challengeId, Collection<RewardGrantStatus> statuses);

    @Modifying
    @Query("delete from RewardGrant g where g.challengeId = :challengeId")
    int deleteAllByChallengeId(@Param("challengeId") Long challengeId);
}
