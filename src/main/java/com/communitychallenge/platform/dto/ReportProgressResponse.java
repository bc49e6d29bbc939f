package com.communitychallenge.platform.dto;

import com.communitychallenge.platform.model.ProgressResult;
import com.fasterxml.jackson.annotation.JsonFormat;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ReportProgressResponse {
    private Long challengeId;
    private String contributorId;
    private boolean accepted;
    private boolean duplicate;
    private long amount;
    private long currentAmount;
    private long targetAmount;
    private boolean targetReached;
    private long contributorTotal;

    @JsonFormat(shape = JsonFormat.Shape.STRING, pattern = "yyyy-MM-dd'T'HH:mm:ss.SSS'Z'", timezone = "UTC")
    private Instant reportedAt;

    public static ReportProgressResponse from(ProgressResult result) {
        return ReportProgressResponse.builder()
            .challengeId(result.getChallengeId())
            .contributorId(result.getContributorId())
            .accepted(result.isAccepted())
            .duplicate(result.isDuplicate())
            .amount(result.getAmount())
            .currentAmount(result.getNewTotal())
            .targetAmount(result.getTargetAmount())
            .targetReached(result.isCrossedThreshold())
            .contributorTotal(result.getContributorTotal())
            .reportedAt(Instant.now())
            .build();
    }
}
