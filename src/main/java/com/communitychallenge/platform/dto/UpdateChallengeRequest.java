package com.communitychallenge.platform.dto;

import com.communitychallenge.platform.model.ChallengeType;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Partial update; null fields are left unchanged.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class UpdateChallengeRequest {
    @Size(min = 1, max = 64, message = "Name must be between 1 and 64 characters")
    private String name;

    @Size(max = 256, message = "Description cannot exceed 256 characters")
    private String description;

    private ChallengeType challengeType;

    @Min(value = 1, message = "Target amount must be greater than 0")
    private Long targetAmount;

    @Size(max = 128, message = "Reward item cannot exceed 128 characters")
    private String rewardItem;

    @Min(value = 0, message = "Reward quantity cannot be negative")
    private Integer rewardQuantity;

    private Boolean enabled;
}
