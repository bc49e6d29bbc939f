package com.communitychallenge.platform.dto;

import com.communitychallenge.platform.model.ChallengeType;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class ReportProgressByTypeRequest {
    @NotNull(message = "Challenge type cannot be null")
    private ChallengeType challengeType;

    @NotBlank(message = "ContributorId cannot be null or empty")
    @Size(max = 64, message = "ContributorId cannot exceed 64 characters")
    private String contributorId;

    @NotNull(message = "Amount cannot be null")
    @Min(value = 1, message = "Amount must be greater than 0")
    private Long amount;

    @Size(max = 128, message = "Idempotency key cannot exceed 128 characters")
    private String idempotencyKey;
}
