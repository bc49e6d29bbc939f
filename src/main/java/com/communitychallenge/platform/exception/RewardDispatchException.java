package com.communitychallenge.platform.exception;

/**
 * A single reward grant attempt failed. Retried by the completion workflow, never surfaced over HTTP.
 */
public class RewardDispatchException extends ChallengeException {
    public RewardDispatchException(String message) {
        super(message, "REWARD_DISPATCH_FAILED");
    }

    public RewardDispatchException(String message, Throwable cause) {
        super(message, "REWARD_DISPATCH_FAILED", cause);
    }
}
