package com.communitychallenge.platform.service;

import com.communitychallenge.platform.model.Challenge;
import com.communitychallenge.platform.model.ProgressResult;
import com.communitychallenge.platform.model.RankedContributor;
import com.communitychallenge.platform.model.RetryQueueItem;
import com.communitychallenge.platform.repository.LeaderboardCacheRepository;
import com.communitychallenge.platform.repository.RetryQueueRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Keeps the Redis leaderboard in step with the ledger after each accepted report.
 * Failed updates go to the retry queue; the database stays the source of truth throughout.
 */
@Service
public class LeaderboardMirror {

    private static final Logger logger = LoggerFactory.getLogger(LeaderboardMirror.class);

    private final LeaderboardCacheRepository cacheRepository;
    private final RetryQueueRepository retryQueueRepository;
    private final ChallengeStore challengeStore;

    @Autowired
    public LeaderboardMirror(
            LeaderboardCacheRepository cacheRepository,
            RetryQueueRepository retryQueueRepository,
            ChallengeStore challengeStore) {
        this.cacheRepository = cacheRepository;
        this.retryQueueRepository = retryQueueRepository;
        this.challengeStore = challengeStore;
    }

    /**
     * Publishes the contributor's committed total. Never throws.
     */
    public void publish(ProgressResult result) {
        if (!cacheRepository.isEnabled() || !result.isAccepted()) {
            return;
        }
        if (result.getContributorTotal() > LeaderboardCacheRepository.MAX_EXACT_AMOUNT) {
            logger.debug("Total {} of {} is too large to mirror, challenge {} leaderboard is served from the database",
                result.getContributorTotal(), result.getContributorId(), result.getChallengeId());
            return;
        }

        if (!cacheRepository.isAvailable()) {
            logger.warn("Redis is not available, queueing leaderboard update for retry");
            queueUpdate(result);
            return;
        }

        try {
            cacheRepository.updateContribution(result.getChallengeId(), result.getGeneration(),
                result.getContributorId(), result.getContributorTotal(), result.getFirstContributedAt());
            logger.debug("Mirrored contribution - challenge: {}, contributor: {}, total: {}",
                result.getChallengeId(), result.getContributorId(), result.getContributorTotal());
        } catch (Exception e) {
            logger.warn("Failed to update Redis leaderboard, queueing for retry", e);
            queueUpdate(result);
        }
    }

    /**
     * Top entries from Redis, or null when the cache cannot answer.
     */
    public List<RankedContributor> readTopN(Long challengeId, int generation, int limit) {
        if (!cacheRepository.isEnabled() || !cacheRepository.isAvailable()) {
            return null;
        }

        try {
            List<RankedContributor> topN = cacheRepository.getTopN(challengeId, generation, limit);
            logger.debug("Retrieved top {} contributors from Redis for challenge {} - found {}",
                limit, challengeId, topN.size());
            return topN;
        } catch (Exception e) {
            logger.warn("Failed to read leaderboard from Redis, falling back to the database", e);
            return null;
        }
    }

    /**
     * Sum of the mirrored totals, or null when the cache cannot answer.
     */
    public Long readMirroredTotal(Long challengeId, int generation) {
        if (!cacheRepository.isEnabled() || !cacheRepository.isAvailable()) {
            return null;
        }

        try {
            return cacheRepository.getMirroredTotal(challengeId, generation);
        } catch (Exception e) {
            logger.warn("Failed to read mirrored total from Redis for challenge {}", challengeId, e);
            return null;
        }
    }

    public Long countContributors(Long challengeId, int generation) {
        try {
            return cacheRepository.getTotalContributors(challengeId, generation);
        } catch (Exception e) {
            logger.warn("Failed to count contributors in Redis for challenge {}", challengeId, e);
            return null;
        }
    }

    /**
     * Best-effort removal of the cached leaderboard of a finished generation.
     */
    public void dropGeneration(Long challengeId, int generation) {
        if (!cacheRepository.isEnabled() || !cacheRepository.isAvailable()) {
            return;
        }

        try {
            cacheRepository.deleteLeaderboard(challengeId, generation);
            logger.info("Dropped cached leaderboard - challenge: {}, generation: {}", challengeId, generation);
        } catch (Exception e) {
            logger.warn("Failed to drop cached leaderboard - challenge: {}, generation: {}",
                challengeId, generation, e);
        }
    }

    private void queueUpdate(ProgressResult result) {
        try {
            RetryQueueItem item = RetryQueueItem.builder()
                .challengeId(result.getChallengeId())
                .generation(result.getGeneration())
                .contributorId(result.getContributorId())
                .amountContributed(result.getContributorTotal())
                .firstContributedAt(result.getFirstContributedAt())
                .createdAt(Instant.now())
                .retryCount(0)
                .build();

            retryQueueRepository.enqueue(item);
            logger.info("Queued leaderboard update for retry: challengeId={}, contributorId={}",
                result.getChallengeId(), result.getContributorId());
        } catch (Exception e) {
            logger.error("Failed to queue leaderboard update for retry", e);
        }
    }

    /**
     * Replays queued cache updates. Updates for a generation that was reset or deleted since are dropped.
     */
    public void processRetryQueue() {
        if (!cacheRepository.isEnabled() || !cacheRepository.isAvailable()) {
            logger.debug("Redis is not available, skipping retry queue processing");
            return;
        }

        List<RetryQueueItem> items = retryQueueRepository.dequeue(100);
        if (items.isEmpty()) {
            return;
        }

        logger.info("Processing {} items from retry queue", items.size());
        Map<Long, Optional<Integer>> liveGenerations = new HashMap<>();
        for (RetryQueueItem item : items) {
            Optional<Integer> liveGeneration = liveGenerations.computeIfAbsent(item.getChallengeId(),
                challengeId -> challengeStore.findChallenge(challengeId).map(Challenge::getGeneration));
            if (liveGeneration.isEmpty() || !liveGeneration.get().equals(item.getGeneration())) {
                logger.info("Dropping queued leaderboard update of a finished generation: challengeId={}, generation={}",
                    item.getChallengeId(), item.getGeneration());
                continue;
            }
            processRetryQueueItem(item);
        }
    }

    private void processRetryQueueItem(RetryQueueItem item) {
        try {
            cacheRepository.updateContribution(item.getChallengeId(), item.getGeneration(),
                item.getContributorId(), item.getAmountContributed(), item.getFirstContributedAt());
            retryQueueRepository.remove(item);
            logger.info("Successfully retried leaderboard update: challengeId={}, contributorId={}",
                item.getChallengeId(), item.getContributorId());
        } catch (Exception e) {
            handleRetryFailure(item, e);
        }
    }

    private void handleRetryFailure(RetryQueueItem item, Exception e) {
        logger.warn("Failed to retry leaderboard update, will retry later: challengeId={}, contributorId={}",
            item.getChallengeId(), item.getContributorId(), e);

        item.setRetryCount(item.getRetryCount() + 1);
        if (item.getRetryCount() < 5) {
            retryQueueRepository.enqueue(item);
        } else {
            logger.error("Max retry count exceeded for item: challengeId={}, contributorId={}",
                item.getChallengeId(), item.getContributorId());
        }
    }
}
