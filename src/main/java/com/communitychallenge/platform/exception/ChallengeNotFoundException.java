package com.communitychallenge.platform.exception;

public class ChallengeNotFoundException extends ChallengeException {
    public ChallengeNotFoundException(Long challengeId) {
        super("Challenge not found with id: " + challengeId, "CHALLENGE_NOT_FOUND");
    }
}
