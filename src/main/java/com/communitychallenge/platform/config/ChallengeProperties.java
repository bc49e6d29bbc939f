package com.communitychallenge.platform.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Tuning for progress ingestion, the completion workflow and its recovery sweep.
 */
@Getter
@Setter
@Component
@ConfigurationProperties(prefix = "challenge")
public class ChallengeProperties {

    private Progress progress = new Progress();
    private Reward reward = new Reward();
    private Completion completion = new Completion();
    private Recovery recovery = new Recovery();
    private Leaderboard leaderboard = new Leaderboard();

    @Getter
    @Setter
    public static class Progress {
        /**
         * How long an idempotency key is remembered per contributor and challenge.
         */
        private Duration dedupWindow = Duration.ofHours(24);
        private long receiptCleanupIntervalMs = 3_600_000;
    }

    @Getter
    @Setter
    public static class Reward {
        private int maxAttempts = 3;
        private long initialBackoffMs = 500;
        private double backoffMultiplier = 2.0;
        private long maxBackoffMs = 10_000;
    }

    @Getter
    @Setter
    public static class Completion {
        private int corePoolSize = 2;
        private int maxPoolSize = 4;
        private int queueCapacity = 100;
    }

    @Getter
    @Setter
    public static class Recovery {
        /**
         * A COMPLETING challenge claimed longer ago than this is considered abandoned by its worker.
         */
        private Duration staleAfter = Duration.ofMinutes(10);
        private long intervalMs = 60_000;
    }

    @Getter
    @Setter
    public static class Leaderboard {
        private int defaultLimit = 10;
        private int maxLimit = 1000;
    }
}
