package com.communitychallenge.platform.service;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

@Component
public class LoggingAnnouncer implements Announcer {

    private static final Logger logger = LoggerFactory.getLogger(LoggingAnnouncer.class);

    @Override
    public void announce(Long channelId, String challengeName, long totalReached, int contributorCount) {
        logger.info("Challenge '{}' completed with {} from {} contributors (channel: {})",
            challengeName, totalReached, contributorCount, channelId);
    }
}
