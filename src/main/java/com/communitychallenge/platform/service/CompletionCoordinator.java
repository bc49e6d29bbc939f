package com.communitychallenge.platform.service;

import com.communitychallenge.platform.config.ChallengeProperties;
import com.communitychallenge.platform.exception.ChallengeStateException;
import com.communitychallenge.platform.exception.RewardDispatchException;
import com.communitychallenge.platform.model.Challenge;
import com.communitychallenge.platform.model.ChallengeSettings;
import com.communitychallenge.platform.model.ChallengeStatus;
import com.communitychallenge.platform.model.ContributionEntry;
import com.communitychallenge.platform.model.RecoverySummary;
import com.communitychallenge.platform.model.RewardGrant;
import com.communitychallenge.platform.model.RewardGrantStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.TaskExecutor;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.retry.support.RetryTemplate;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Drives a challenge from ACTIVE through COMPLETING to COMPLETED.
 * <p>
 * Only the caller that wins the ACTIVE to COMPLETING transition runs the workflow. Every step of
 * the workflow leaves a durable marker (reward grant rows, {@code announcedAt}) so a workflow
 * interrupted by a crash can be resumed by {@link #recoverStalled(boolean)} without granting or
 * announcing twice.
 */
@Service
public class CompletionCoordinator {

    private static final Logger logger = LoggerFactory.getLogger(CompletionCoordinator.class);

    private static final int MAX_ERROR_LENGTH = 512;

    private final ChallengeStore challengeStore;
    private final RewardDispatcher rewardDispatcher;
    private final Announcer announcer;
    private final RetryTemplate rewardRetryTemplate;
    private final TaskExecutor completionExecutor;
    private final ChallengeProperties properties;

    private final Set<Long> inFlight = ConcurrentHashMap.newKeySet();

    @Autowired
    public CompletionCoordinator(
            ChallengeStore challengeStore,
            RewardDispatcher rewardDispatcher,
            Announcer announcer,
            @Qualifier("rewardRetryTemplate") RetryTemplate rewardRetryTemplate,
            @Qualifier("completionExecutor") TaskExecutor completionExecutor,
            ChallengeProperties properties) {
        this.challengeStore = challengeStore;
        this.rewardDispatcher = rewardDispatcher;
        this.announcer = announcer;
        this.rewardRetryTemplate = rewardRetryTemplate;
        this.completionExecutor = completionExecutor;
        this.properties = properties;
    }

    /**
     * Schedules completion of a challenge whose total just crossed its target.
     */
    public void onThresholdCrossed(Long challengeId) {
        try {
            completionExecutor.execute(() -> completeIfReached(challengeId));
        } catch (TaskRejectedException e) {
            logger.warn("Completion executor rejected challenge {}, the recovery sweep will complete it",
                challengeId, e);
        }
    }

    /**
     * Claims the challenge and runs the completion workflow if the claim succeeded.
     *
     * @return true if this call won the claim
     */
    public boolean completeIfReached(Long challengeId) {
        if (!challengeStore.claimCompletion(challengeId, Instant.now())) {
            logger.debug("Challenge {} not claimed for completion", challengeId);
            return false;
        }
        runWorkflow(challengeId);
        return true;
    }

    void runWorkflow(Long challengeId) {
        if (!inFlight.add(challengeId)) {
            logger.debug("Completion workflow for challenge {} already running", challengeId);
            return;
        }

        try {
            Challenge challenge = challengeStore.findChallenge(challengeId).orElse(null);
            if (challenge == null || challenge.getStatus() != ChallengeStatus.COMPLETING) {
                logger.debug("Challenge {} is no longer completing, nothing to do", challengeId);
                return;
            }

            List<ContributionEntry> contributors = challengeStore.snapshotContributions(challengeId);
            grantRewards(challenge, contributors);
            announceCompletion(challenge, contributors.size());

            if (challengeStore.markCompleted(challengeId, Instant.now())) {
                logger.info("Challenge {} '{}' completed - total: {}, contributors: {}",
                    challengeId, challenge.getName(), challenge.getCurrentAmount(), contributors.size());
            }
        } catch (Exception e) {
            logger.error("Completion workflow for challenge {} failed, it stays COMPLETING until recovered",
                challengeId, e);
        } finally {
            inFlight.remove(challengeId);
        }
    }

    private void grantRewards(Challenge challenge, List<ContributionEntry> contributors) {
        if (challenge.getRewardQuantity() <= 0) {
            logger.info("Challenge {} has no reward configured, skipping reward grants", challenge.getId());
            return;
        }

        int granted = 0;
        int failed = 0;
        for (ContributionEntry entry : contributors) {
            Optional<RewardGrant> existing = challengeStore.findRewardGrant(challenge.getId(), entry.getContributorId());
            if (existing.isPresent() && existing.get().getStatus() == RewardGrantStatus.GRANTED) {
                continue;
            }

            RewardGrant outcome = grantReward(challenge, entry.getContributorId());
            if (outcome.getStatus() == RewardGrantStatus.GRANTED) {
                granted++;
            } else {
                failed++;
            }
        }

        logger.info("Reward grants for challenge {} - granted: {}, failed: {}", challenge.getId(), granted, failed);
    }

    private RewardGrant grantReward(Challenge challenge, String contributorId) {
        AtomicInteger attempts = new AtomicInteger();
        RewardGrant.RewardGrantBuilder outcome = RewardGrant.builder()
            .challengeId(challenge.getId())
            .contributorId(contributorId)
            .rewardItem(challenge.getRewardItem())
            .rewardQuantity(challenge.getRewardQuantity());

        try {
            rewardRetryTemplate.execute(context -> {
                attempts.incrementAndGet();
                dispatch(contributorId, challenge.getRewardItem(), challenge.getRewardQuantity());
                return null;
            });
            Instant now = Instant.now();
            outcome.status(RewardGrantStatus.GRANTED).grantedAt(now).updatedAt(now);
        } catch (RewardDispatchException e) {
            logger.error("Failed to grant reward of challenge {} to {} after {} attempts",
                challenge.getId(), contributorId, attempts.get(), e);
            outcome.status(RewardGrantStatus.FAILED).lastError(truncate(e.getMessage())).updatedAt(Instant.now());
        }

        return challengeStore.recordRewardGrant(outcome.attempts(attempts.get()).build());
    }

    private void dispatch(String contributorId, String rewardItem, int rewardQuantity) {
        boolean granted;
        try {
            granted = rewardDispatcher.grant(contributorId, rewardItem, rewardQuantity);
        } catch (RuntimeException e) {
            throw new RewardDispatchException("Reward dispatch to " + contributorId + " failed: " + e.getMessage(), e);
        }
        if (!granted) {
            throw new RewardDispatchException("Reward dispatcher declined grant to " + contributorId);
        }
    }

    private void announceCompletion(Challenge challenge, int contributorCount) {
        if (challenge.getAnnouncedAt() != null) {
            logger.debug("Challenge {} already announced at {}", challenge.getId(), challenge.getAnnouncedAt());
            return;
        }

        ChallengeSettings settings = challengeStore.loadSettings();
        Long channelId = settings.getAnnouncementChannelId();
        if (channelId == null) {
            logger.info("No announcement channel configured, skipping announcement of challenge {}", challenge.getId());
        } else {
            announceWithRetry(channelId, challenge, contributorCount);
        }

        challengeStore.markAnnounced(challenge.getId(), Instant.now());
    }

    private void announceWithRetry(Long channelId, Challenge challenge, int contributorCount) {
        try {
            announcer.announce(channelId, challenge.getName(), challenge.getCurrentAmount(), contributorCount);
        } catch (RuntimeException first) {
            logger.warn("Announcement of challenge {} failed, retrying once", challenge.getId(), first);
            try {
                announcer.announce(channelId, challenge.getName(), challenge.getCurrentAmount(), contributorCount);
            } catch (RuntimeException second) {
                logger.error("Announcement of challenge {} failed twice, completing without it",
                    challenge.getId(), second);
            }
        }
    }

    /**
     * Resumes abandoned workflows and claims challenges that reached their target without being
     * claimed. At startup every COMPLETING challenge counts as abandoned.
     */
    public RecoverySummary recoverStalled(boolean startup) {
        Instant now = Instant.now();
        Instant cutoff = startup ? now : now.minus(properties.getRecovery().getStaleAfter());

        int resumed = 0;
        for (Challenge challenge : challengeStore.findCompletingStartedBefore(cutoff)) {
            if (inFlight.contains(challenge.getId())) {
                continue;
            }
            logger.warn("Resuming completion of challenge {} claimed at {}",
                challenge.getId(), challenge.getCompletionStartedAt());
            runWorkflow(challenge.getId());
            resumed++;
        }

        int claimed = 0;
        for (Challenge challenge : challengeStore.findReachedButUnclaimed()) {
            if (completeIfReached(challenge.getId())) {
                claimed++;
            }
        }

        return new RecoverySummary(resumed, claimed);
    }

    /**
     * Re-dispatches every FAILED reward of a completed challenge. Each grant is claimed first, so
     * concurrent retries never dispatch the same reward twice.
     *
     * @return the new outcome of each grant this call retried
     * @throws ChallengeStateException if the challenge is not COMPLETED
     */
    public List<RewardGrant> retryFailedRewards(Long challengeId) {
        Challenge challenge = challengeStore.getChallenge(challengeId);
        if (challenge.getStatus() != ChallengeStatus.COMPLETED) {
            throw new ChallengeStateException(
                "Challenge " + challengeId + " is " + challenge.getStatus() + ", rewards can only be retried once completed");
        }

        List<RewardGrant> outcomes = new ArrayList<>();
        for (RewardGrant failure : challengeStore.findRewardFailures(challengeId)) {
            Instant now = Instant.now();
            Instant staleBefore = now.minus(properties.getRecovery().getStaleAfter());
            if (!challengeStore.claimRewardRetry(challengeId, failure.getContributorId(), now, staleBefore)) {
                logger.debug("Reward of challenge {} for {} is already being retried",
                    challengeId, failure.getContributorId());
                continue;
            }
            outcomes.add(grantReward(challenge, failure.getContributorId()));
        }
        logger.info("Retried {} failed rewards of challenge {}", outcomes.size(), challengeId);
        return outcomes;
    }

    private String truncate(String message) {
        if (message == null || message.length() <= MAX_ERROR_LENGTH) {
            return message;
        }
        return message.substring(0, MAX_ERROR_LENGTH);
    }
}
