package com.communitychallenge.platform.model;

/**
 * Lifecycle of a challenge. Moves only forward; an administrative reset is the one way back to ACTIVE.
 */
public enum ChallengeStatus {
    ACTIVE,
    COMPLETING,
    COMPLETED
}
