package com.communitychallenge.platform.exception;

public class InvalidRequestException extends ChallengeException {
    public InvalidRequestException(String message) {
        super(message, "INVALID_REQUEST");
    }
}
