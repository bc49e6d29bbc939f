package com.communitychallenge.platform.repository;

import com.communitychallenge.platform.model.ContributionEntry;

import java.util.List;
import java.util.Optional;

public interface ContributionRepository {
    ContributionEntry save(ContributionEntry entry);
    Optional<ContributionEntry> findByChallengeIdAndContributorId(Long challengeId, String contributorId);

    /**
     * Entries in leaderboard order: amount descending, earliest first contribution, contributor id.
     */
    List<ContributionEntry> findByChallengeId(Long challengeId);

    int deleteByChallengeId(Long challengeId);
}
