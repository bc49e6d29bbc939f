package com.communitychallenge.platform.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class LeaderboardView {
    private Long challengeId;
    private String name;
    private long currentAmount;
    private long targetAmount;
    private ChallengeStatus status;
    private List<RankedContributor> contributors;
    private long totalContributors;
}
