package com.communitychallenge.platform.service;

/**
 * Broadcasts a challenge completion. Implemented by the host application.
 */
public interface Announcer {
    void announce(Long channelId, String challengeName, long totalReached, int contributorCount);
}
