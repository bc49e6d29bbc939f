package com.communitychallenge.platform.exception;

/**
 * An administrative operation conflicts with the current lifecycle state of a challenge.
 */
public class ChallengeStateException extends ChallengeException {
    public ChallengeStateException(String message) {
        super(message, "INVALID_STATE");
    }
}
