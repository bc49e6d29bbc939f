package com.communitychallenge.platform.repository;

import com.communitychallenge.platform.model.RankedContributor;

import java.time.Instant;
import java.util.List;

/**
 * Fast ranking cache mirroring the contribution ledger. Never the source of truth.
 */
public interface LeaderboardCacheRepository {

    /**
     * Largest contributor total a sorted-set score holds exactly (2^53). Larger totals are not mirrored.
     */
    long MAX_EXACT_AMOUNT = 1L << 53;

    void updateContribution(Long challengeId, int generation, String contributorId,
                            long amountContributed, Instant firstContributedAt);
    List<RankedContributor> getTopN(Long challengeId, int generation, int limit);
    Long getTotalContributors(Long challengeId, int generation);

    /**
     * Sum of every mirrored contributor total of one generation, 0 when nothing was mirrored.
     */
    long getMirroredTotal(Long challengeId, int generation);
    void deleteLeaderboard(Long challengeId, int generation);
    boolean isEnabled();
    boolean isAvailable();
}
