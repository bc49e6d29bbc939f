package com.communitychallenge.platform.service;

/**
 * Hands a challenge reward to a contributor. Implemented by the host application.
 */
public interface RewardDispatcher {

    /**
     * @return true if the reward was delivered; false or an exception counts as a failed attempt
     */
    boolean grant(String contributorId, String rewardItem, int rewardQuantity);
}
