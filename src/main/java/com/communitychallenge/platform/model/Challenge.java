package com.communitychallenge.platform.model;

import com.fasterxml.jackson.annotation.JsonFormat;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Entity
@Table(name = "challenges", indexes = {
    @Index(name = "idx_challenge_type_status", columnList = "challenge_type,status"),
    @Index(name = "idx_challenge_status", columnList = "status")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Challenge {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "challenge_id")
    private Long id;

    @Column(name = "name", nullable = false, length = 64)
    private String name;

    @Column(name = "description", length = 256)
    private String description;

    @Enumerated(EnumType.STRING)
    @Column(name = "challenge_type", nullable = false, length = 16)
    private ChallengeType challengeType;

    @Column(name = "target_amount", nullable = false)
    private long targetAmount;

    @Column(name = "reward_item", length = 128)
    private String rewardItem;

    @Column(name = "reward_quantity", nullable = false)
    private int rewardQuantity;

    @Column(name = "enabled", nullable = false)
    private boolean enabled;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 16)
    private ChallengeStatus status;

    @Column(name = "current_amount", nullable = false)
    private long currentAmount;

    /**
     * Bumped on every reset; leaderboard cache entries are keyed by it.
     */
    @Column(name = "generation", nullable = false)
    private int generation;

    @Column(name = "created_at", nullable = false)
    @JsonFormat(shape = JsonFormat.Shape.STRING, pattern = "yyyy-MM-dd'T'HH:mm:ss.SSS'Z'", timezone = "UTC")
    private Instant createdAt;

    @Column(name = "updated_at")
    @JsonFormat(shape = JsonFormat.Shape.STRING, pattern = "yyyy-MM-dd'T'HH:mm:ss.SSS'Z'", timezone = "UTC")
    private Instant updatedAt;

    @Column(name = "completion_started_at")
    @JsonFormat(shape = JsonFormat.Shape.STRING, pattern = "yyyy-MM-dd'T'HH:mm:ss.SSS'Z'", timezone = "UTC")
    private Instant completionStartedAt;

    @Column(name = "announced_at")
    @JsonFormat(shape = JsonFormat.Shape.STRING, pattern = "yyyy-MM-dd'T'HH:mm:ss.SSS'Z'", timezone = "UTC")
    private Instant announcedAt;

    @Column(name = "completed_at")
    @JsonFormat(shape = JsonFormat.Shape.STRING, pattern = "yyyy-MM-dd'T'HH:mm:ss.SSS'Z'", timezone = "UTC")
    private Instant completedAt;

    public boolean hasReachedTarget() {
        return currentAmount >= targetAmount;
    }

    public boolean isAcceptingProgress() {
        return enabled && status == ChallengeStatus.ACTIVE;
    }
}
