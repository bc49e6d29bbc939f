package com.communitychallenge.platform.model;

import com.fasterxml.jackson.annotation.JsonFormat;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Outcome of granting one contributor the reward of a completed challenge.
 * A GRANTED row is never dispatched again; FAILED rows are kept for manual remediation.
 */
@Entity
@Table(name = "challenge_reward_grants",
    uniqueConstraints = {
        @UniqueConstraint(name = "uk_reward_grant_challenge_contributor",
            columnNames = {"challenge_id", "contributor_id"})
    },
    indexes = {
        @Index(name = "idx_reward_grant_challenge_status", columnList = "challenge_id,status")
    })
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RewardGrant {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "grant_id")
    private Long grantId;

    @Column(name = "challenge_id", nullable = false)
    private Long challengeId;

    @Column(name = "contributor_id", nullable = false, length = 64)
    private String contributorId;

    @Column(name = "reward_item", length = 128)
    private String rewardItem;

    @Column(name = "reward_quantity", nullable = false)
    private int rewardQuantity;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 16)
    private RewardGrantStatus status;

    @Column(name = "attempts", nullable = false)
    private int attempts;

    @Column(name = "last_error", length = 512)
    private String lastError;

    @Column(name = "granted_at")
    @JsonFormat(shape = JsonFormat.Shape.STRING, pattern = "yyyy-MM-dd'T'HH:mm:ss.SSS'Z'", timezone = "UTC")
    private Instant grantedAt;

    @Column(name = "updated_at", nullable = false)
    @JsonFormat(shape = JsonFormat.Shape.STRING, pattern = "yyyy-MM-dd'T'HH:mm:ss.SSS'Z'", timezone = "UTC")
    private Instant updatedAt;
}
