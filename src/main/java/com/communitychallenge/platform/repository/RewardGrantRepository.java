package com.communitychallenge.platform.repository;

import com.communitychallenge.platform.model.RewardGrant;
import com.communitychallenge.platform.model.RewardGrantStatus;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

public interface RewardGrantRepository {
    RewardGrant save(RewardGrant grant);
    Optional<RewardGrant> findByChallengeIdAndContributorId(Long challengeId, String contributorId);
    List<RewardGrant> findByChallengeIdAndStatusIn(Long challengeId, Collection<RewardGrantStatus> statuses);
    int deleteByChallengeId(Long challengeId);
}
