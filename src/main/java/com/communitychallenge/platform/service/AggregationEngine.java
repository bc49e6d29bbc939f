package com.communitychallenge.platform.service;

import com.communitychallenge.platform.exception.ChallengeNotFoundException;
import com.communitychallenge.platform.exception.InvalidRequestException;
import com.communitychallenge.platform.model.Challenge;
import com.communitychallenge.platform.model.ChallengeType;
import com.communitychallenge.platform.model.ProgressResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Entry point for progress reports.
 * <p>
 * Each report commits in its own transaction before any follow-up work happens: the completion
 * hand-off and the leaderboard mirror update only ever see committed totals.
 */
@Service
public class AggregationEngine {

    private static final Logger logger = LoggerFactory.getLogger(AggregationEngine.class);

    private static final int MAX_CONTRIBUTOR_ID_LENGTH = 64;
    private static final int MAX_IDEMPOTENCY_KEY_LENGTH = 128;

    private final ChallengeStore challengeStore;
    private final CompletionCoordinator completionCoordinator;
    private final LeaderboardMirror leaderboardMirror;

    @Autowired
    public AggregationEngine(
            ChallengeStore challengeStore,
            CompletionCoordinator completionCoordinator,
            LeaderboardMirror leaderboardMirror) {
        this.challengeStore = challengeStore;
        this.completionCoordinator = completionCoordinator;
        this.leaderboardMirror = leaderboardMirror;
    }

    /**
     * Adds progress to one challenge.
     *
     * @throws ChallengeNotFoundException if the challenge does not exist
     * @throws InvalidRequestException if the report is malformed or the challenge is not accepting progress
     */
    public ProgressResult reportProgress(Long challengeId, String contributorId, long amount, String idempotencyKey) {
        validateReport(contributorId, amount);
        if (challengeId == null) {
            throw new InvalidRequestException("Challenge id cannot be null");
        }

        ProgressResult result = challengeStore.applyProgress(
            challengeId, contributorId, amount, normalizeKey(idempotencyKey), Instant.now());

        if (result.isAccepted()) {
            logger.info("Accepted progress - challenge: {}, contributor: {}, amount: {}, total: {}/{}",
                challengeId, contributorId, amount, result.getNewTotal(), result.getTargetAmount());
            leaderboardMirror.publish(result);
        }

        if (result.isCrossedThreshold()) {
            logger.info("Challenge {} reached its target of {}", challengeId, result.getTargetAmount());
            completionCoordinator.onThresholdCrossed(challengeId);
        }

        return result;
    }

    /**
     * Adds progress to every enabled ACTIVE challenge of the given type. Challenges that stop
     * accepting progress between lookup and report are skipped.
     */
    public List<ProgressResult> reportProgressByType(ChallengeType challengeType, String contributorId,
                                                     long amount, String idempotencyKey) {
        validateReport(contributorId, amount);
        if (challengeType == null) {
            throw new InvalidRequestException("Challenge type cannot be null");
        }
        String key = normalizeKey(idempotencyKey);
        if (!challengeStore.loadSettings().isEnabled()) {
            throw new InvalidRequestException("Community challenges are currently disabled");
        }

        List<Challenge> challenges = challengeStore.findAcceptingChallenges(challengeType);
        List<ProgressResult> results = new ArrayList<>();
        for (Challenge challenge : challenges) {
            try {
                results.add(reportProgress(challenge.getId(), contributorId, amount, key));
            } catch (InvalidRequestException | ChallengeNotFoundException e) {
                logger.debug("Skipping challenge {} for {} report: {}", challenge.getId(), challengeType, e.getMessage());
            }
        }

        logger.debug("Reported {} {} for {} to {} of {} matching challenges",
            amount, challengeType, contributorId, results.size(), challenges.size());
        return results;
    }

    private void validateReport(String contributorId, long amount) {
        if (contributorId == null || contributorId.trim().isEmpty()) {
            throw new InvalidRequestException("ContributorId cannot be null or empty");
        }
        if (contributorId.length() > MAX_CONTRIBUTOR_ID_LENGTH) {
            throw new InvalidRequestException("ContributorId cannot exceed " + MAX_CONTRIBUTOR_ID_LENGTH + " characters");
        }
        if (amount <= 0) {
            throw new InvalidRequestException("Amount must be greater than 0");
        }
    }

    private String normalizeKey(String idempotencyKey) {
        if (idempotencyKey == null || idempotencyKey.trim().isEmpty()) {
            return null;
        }
        String key = idempotencyKey.trim();
        if (key.length() > MAX_IDEMPOTENCY_KEY_LENGTH) {
            throw new InvalidRequestException("Idempotency key cannot exceed " + MAX_IDEMPOTENCY_KEY_LENGTH + " characters");
        }
        return key;
    }
}
