package com.communitychallenge.platform.service;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Instant;

/**
 * Periodic housekeeping: expired idempotency receipts and queued leaderboard mirror updates.
 */
@Component
public class ChallengeMaintenanceTasks {

    private static final Logger logger = LoggerFactory.getLogger(ChallengeMaintenanceTasks.class);

    private final ChallengeStore challengeStore;
    private final LeaderboardMirror leaderboardMirror;

    @Autowired
    public ChallengeMaintenanceTasks(ChallengeStore challengeStore, LeaderboardMirror leaderboardMirror) {
        this.challengeStore = challengeStore;
        this.leaderboardMirror = leaderboardMirror;
    }

    /**
     * Deletes idempotency receipts that fell out of the dedup window.
     */
    @Scheduled(fixedDelayString = "${challenge.progress.receipt-cleanup-interval-ms:3600000}")
    public void purgeExpiredReceipts() {
        try {
            int purged = challengeStore.purgeExpiredReceipts(Instant.now());
            if (purged > 0) {
                logger.info("Purged {} expired progress receipts", purged);
            }
        } catch (Exception e) {
            logger.error("Error purging expired progress receipts", e);
        }
    }

    @Scheduled(fixedRate = 30000)
    public void replayMirrorUpdates() {
        try {
            leaderboardMirror.processRetryQueue();
        } catch (Exception e) {
            logger.error("Error replaying queued leaderboard updates", e);
        }
    }
}
