package com.communitychallenge.platform.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ProgressSnapshot {
    private Long challengeId;
    private String name;
    private String description;
    private ChallengeType challengeType;
    private long currentAmount;
    private long targetAmount;
    private ChallengeStatus status;
    private int percentComplete;
    private String progressBar;
}
