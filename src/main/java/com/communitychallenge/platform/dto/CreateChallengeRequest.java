package com.communitychallenge.platform.dto;

import com.communitychallenge.platform.model.ChallengeType;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CreateChallengeRequest {
    @NotBlank(message = "Name cannot be null or empty")
    @Size(max = 64, message = "Name cannot exceed 64 characters")
    private String name;

    @Size(max = 256, message = "Description cannot exceed 256 characters")
    private String description;

    @NotNull(message = "Challenge type cannot be null")
    private ChallengeType challengeType;

    @NotNull(message = "Target amount cannot be null")
    @Min(value = 1, message = "Target amount must be greater than 0")
    private Long targetAmount;

    @Size(max = 128, message = "Reward item cannot exceed 128 characters")
    private String rewardItem;

    @Min(value = 0, message = "Reward quantity cannot be negative")
    private Integer rewardQuantity;

    // Defaults to enabled when omitted
    private Boolean enabled;
}
