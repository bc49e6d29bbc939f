package com.communitychallenge.platform.dto;

import com.communitychallenge.platform.model.ChallengeStatus;
import com.communitychallenge.platform.model.RankedContributor;
import com.fasterxml.jackson.annotation.JsonFormat;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class LeaderboardResponse {
    private Long challengeId;
    private String name;
    private long currentAmount;
    private long targetAmount;
    private ChallengeStatus status;
    private List<RankedContributor> contributors;
    private Long totalContributors;

    @JsonFormat(shape = JsonFormat.Shape.STRING, pattern = "yyyy-MM-dd'T'HH:mm:ss.SSS'Z'", timezone = "UTC")
    private Instant retrievedAt;
}
