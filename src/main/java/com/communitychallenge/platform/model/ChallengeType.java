package com.communitychallenge.platform.model;

import com.fasterxml.jackson.annotation.JsonCreator;

/**
 * Player action a challenge counts. Deciding that the action happened is up to the reporting caller.
 */
public enum ChallengeType {
    COLLECT,
    TRADE,
    CRAFT,
    CATCH,
    DONATE;

    @JsonCreator
    public static ChallengeType fromValue(String value) {
        if (value == null || value.trim().isEmpty()) {
            return null;
        }
        for (ChallengeType type : values()) {
            if (type.name().equalsIgnoreCase(value.trim())) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown challenge type: " + value);
    }
}
