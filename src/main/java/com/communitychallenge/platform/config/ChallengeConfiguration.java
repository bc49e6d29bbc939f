package com.communitychallenge.platform.config;

import com.communitychallenge.platform.exception.RewardDispatchException;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.retry.support.RetryTemplate;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

@Configuration
public class ChallengeConfiguration {

    /**
     * Bounded retry with exponential backoff around a single reward grant.
     */
    @Bean
    public RetryTemplate rewardRetryTemplate(ChallengeProperties properties) {
        ChallengeProperties.Reward reward = properties.getReward();
        return RetryTemplate.builder()
            .maxAttempts(reward.getMaxAttempts())
            .exponentialBackoff(reward.getInitialBackoffMs(), reward.getBackoffMultiplier(), reward.getMaxBackoffMs())
            .retryOn(RewardDispatchException.class)
            .build();
    }

    /**
     * Runs completion workflows off the reporting threads.
     */
    @Bean
    public ThreadPoolTaskExecutor completionExecutor(ChallengeProperties properties) {
        ChallengeProperties.Completion completion = properties.getCompletion();
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(completion.getCorePoolSize());
        executor.setMaxPoolSize(completion.getMaxPoolSize());
        executor.setQueueCapacity(completion.getQueueCapacity());
        executor.setThreadNamePrefix("challenge-completion-");
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(30);
        executor.initialize();
        return executor;
    }
}
