package com.communitychallenge.platform.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Outcome of one progress report against one challenge.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ProgressResult {
    private Long challengeId;
    private String contributorId;
    private boolean accepted;
    private boolean duplicate;
    private long amount;
    private long newTotal;
    private long targetAmount;
    private boolean crossedThreshold;
    private long contributorTotal;
    private Instant firstContributedAt;
    private int generation;

    public static ProgressResult duplicate(Challenge challenge, String contributorId, long amount) {
        return ProgressResult.builder()
            .challengeId(challenge.getId())
            .contributorId(contributorId)
            .accepted(false)
            .duplicate(true)
            .amount(amount)
            .newTotal(challenge.getCurrentAmount())
            .targetAmount(challenge.getTargetAmount())
            .crossedThreshold(false)
            .generation(challenge.getGeneration())
            .build();
    }
}
