package com.communitychallenge.platform.service;

import com.communitychallenge.platform.dto.CreateChallengeRequest;
import com.communitychallenge.platform.dto.UpdateChallengeRequest;
import com.communitychallenge.platform.dto.UpdateSettingsRequest;
import com.communitychallenge.platform.exception.InvalidRequestException;
import com.communitychallenge.platform.model.Challenge;
import com.communitychallenge.platform.model.ChallengeSettings;
import com.communitychallenge.platform.model.ChallengeStatus;
import com.communitychallenge.platform.model.RewardGrant;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.List;

/**
 * Administrative configuration of challenges and of the global settings.
 */
@Service
public class ChallengeAdminService {

    private static final Logger logger = LoggerFactory.getLogger(ChallengeAdminService.class);

    private final ChallengeStore challengeStore;
    private final CompletionCoordinator completionCoordinator;
    private final LeaderboardMirror leaderboardMirror;

    @Autowired
    public ChallengeAdminService(
            ChallengeStore challengeStore,
            CompletionCoordinator completionCoordinator,
            LeaderboardMirror leaderboardMirror) {
        this.challengeStore = challengeStore;
        this.completionCoordinator = completionCoordinator;
        this.leaderboardMirror = leaderboardMirror;
    }

    public Challenge createChallenge(CreateChallengeRequest request) {
        validateCreateRequest(request);

        Instant now = Instant.now();
        int rewardQuantity = request.getRewardQuantity() != null ? request.getRewardQuantity() : 0;
        Challenge challenge = Challenge.builder()
            .name(request.getName().trim())
            .description(request.getDescription())
            .challengeType(request.getChallengeType())
            .targetAmount(request.getTargetAmount())
            .rewardItem(request.getRewardItem())
            .rewardQuantity(rewardQuantity)
            .enabled(request.getEnabled() == null || request.getEnabled())
            .status(ChallengeStatus.ACTIVE)
            .currentAmount(0L)
            .generation(0)
            .createdAt(now)
            .updatedAt(now)
            .build();

        return challengeStore.createChallenge(challenge);
    }

    private void validateCreateRequest(CreateChallengeRequest request) {
        if (request.getName() == null || request.getName().trim().isEmpty()) {
            throw new InvalidRequestException("Name cannot be null or empty");
        }
        if (request.getChallengeType() == null) {
            throw new InvalidRequestException("Challenge type cannot be null");
        }
        if (request.getTargetAmount() == null || request.getTargetAmount() <= 0) {
            throw new InvalidRequestException("Target amount must be greater than 0");
        }
        int rewardQuantity = request.getRewardQuantity() != null ? request.getRewardQuantity() : 0;
        validateReward(request.getRewardItem(), rewardQuantity);
    }

    private void validateReward(String rewardItem, int rewardQuantity) {
        if (rewardQuantity < 0) {
            throw new InvalidRequestException("Reward quantity cannot be negative");
        }
        if (rewardQuantity > 0 && (rewardItem == null || rewardItem.trim().isEmpty())) {
            throw new InvalidRequestException("Reward item is required when a reward quantity is set");
        }
    }

    /**
     * Applies the non-null fields of the request. Lowering the target to or below the current
     * total of an ACTIVE challenge starts its completion.
     */
    public Challenge updateChallenge(Long challengeId, UpdateChallengeRequest request) {
        if (request.getName() != null && request.getName().trim().isEmpty()) {
            throw new InvalidRequestException("Name cannot be empty");
        }
        if (request.getTargetAmount() != null && request.getTargetAmount() <= 0) {
            throw new InvalidRequestException("Target amount must be greater than 0");
        }

        Challenge updated = challengeStore.updateChallenge(challengeId, challenge -> {
            if (request.getName() != null) {
                challenge.setName(request.getName().trim());
            }
            if (request.getDescription() != null) {
                challenge.setDescription(request.getDescription());
            }
            if (request.getChallengeType() != null) {
                challenge.setChallengeType(request.getChallengeType());
            }
            if (request.getTargetAmount() != null) {
                challenge.setTargetAmount(request.getTargetAmount());
            }
            if (request.getRewardItem() != null) {
                challenge.setRewardItem(request.getRewardItem());
            }
            if (request.getRewardQuantity() != null) {
                challenge.setRewardQuantity(request.getRewardQuantity());
            }
            if (request.getEnabled() != null) {
                challenge.setEnabled(request.getEnabled());
            }
            validateReward(challenge.getRewardItem(), challenge.getRewardQuantity());
        }, Instant.now());

        logger.info("Updated challenge {} - target: {}, enabled: {}",
            challengeId, updated.getTargetAmount(), updated.isEnabled());
        signalIfReached(updated);
        return updated;
    }

    public Challenge setEnabled(Long challengeId, boolean enabled) {
        Challenge updated = challengeStore.updateChallenge(
            challengeId, challenge -> challenge.setEnabled(enabled), Instant.now());
        logger.info("Challenge {} {}", challengeId, enabled ? "enabled" : "disabled");
        signalIfReached(updated);
        return updated;
    }

    private void signalIfReached(Challenge challenge) {
        if (challenge.isAcceptingProgress() && challenge.hasReachedTarget()) {
            logger.info("Challenge {} already meets its target of {}, starting completion",
                challenge.getId(), challenge.getTargetAmount());
            completionCoordinator.onThresholdCrossed(challenge.getId());
        }
    }

    /**
     * Clears all progress and reward grants of a challenge and reopens it.
     */
    public Challenge resetChallenge(Long challengeId) {
        Challenge reset = challengeStore.resetChallenge(challengeId, Instant.now());
        leaderboardMirror.dropGeneration(challengeId, reset.getGeneration() - 1);
        return reset;
    }

    public void deleteChallenge(Long challengeId) {
        Challenge deleted = challengeStore.deleteChallenge(challengeId);
        leaderboardMirror.dropGeneration(challengeId, deleted.getGeneration());
    }

    public ChallengeSettings getSettings() {
        return challengeStore.getOrCreateSettings();
    }

    public ChallengeSettings updateSettings(UpdateSettingsRequest request) {
        ChallengeSettings settings = challengeStore.updateSettings(current -> {
            if (request.getEnabled() != null) {
                current.setEnabled(request.getEnabled());
            }
            if (request.isClearAnnouncementChannel()) {
                current.setAnnouncementChannelId(null);
            } else if (request.getAnnouncementChannelId() != null) {
                current.setAnnouncementChannelId(request.getAnnouncementChannelId());
            }
        }, Instant.now());

        logger.info("Updated challenge settings - enabled: {}, announcement channel: {}",
            settings.isEnabled(), settings.getAnnouncementChannelId());
        return settings;
    }

    public List<RewardGrant> retryFailedRewards(Long challengeId) {
        return completionCoordinator.retryFailedRewards(challengeId);
    }
}
