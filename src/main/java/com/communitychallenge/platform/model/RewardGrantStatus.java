package com.communitychallenge.platform.model;

public enum RewardGrantStatus {
    GRANTED,
    FAILED,
    /**
     * Claimed by an administrative retry that is dispatching right now.
     */
    RETRYING
}
