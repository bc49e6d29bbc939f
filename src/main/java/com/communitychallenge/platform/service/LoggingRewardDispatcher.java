package com.communitychallenge.platform.service;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Default dispatcher; a host application overrides it with a {@code @Primary} bean. Only logs.
 */
@Component
public class LoggingRewardDispatcher implements RewardDispatcher {

    private static final Logger logger = LoggerFactory.getLogger(LoggingRewardDispatcher.class);

    @Override
    public boolean grant(String contributorId, String rewardItem, int rewardQuantity) {
        logger.info("Granting reward - contributor: {}, item: {}, quantity: {}",
            contributorId, rewardItem, rewardQuantity);
        return true;
    }
}
