package com.communitychallenge.platform.exception;

public class ChallengeException extends RuntimeException {
    private final String errorCode;
    
    public ChallengeException(String message) {
        super(message);
        this.errorCode = "CHALLENGE_ERROR";
    }
    
    public ChallengeException(String message, String errorCode) {
        super(message);
        this.errorCode = errorCode;
    }
    
    public ChallengeException(String message, Throwable cause) {
        super(message, cause);
        this.errorCode = "CHALLENGE_ERROR";
    }
    
    public ChallengeException(String message, String errorCode, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }
    
    public String getErrorCode() {
        return errorCode;
    }
}
