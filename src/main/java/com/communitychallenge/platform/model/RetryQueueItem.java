package com.communitychallenge.platform.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Leaderboard cache update that could not be applied and waits for a retry.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RetryQueueItem {
    private Long challengeId;
    private Integer generation;
    private String contributorId;
    private Long amountContributed;
    private Instant firstContributedAt;
    private Instant createdAt;
    private Integer retryCount;

    public boolean targetsSameEntry(RetryQueueItem other) {
        return other != null
            && java.util.Objects.equals(challengeId, other.challengeId)
            && java.util.Objects.equals(generation, other.generation)
            && java.util.Objects.equals(contributorId, other.contributorId);
    }
}
