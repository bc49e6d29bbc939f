package com.communitychallenge.platform.repository;

import com.communitychallenge.platform.model.Challenge;
import com.communitychallenge.platform.model.ChallengeType;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

public interface ChallengeRepository {
    Challenge save(Challenge challenge);
    Optional<Challenge> findById(Long challengeId);

    /**
     * Loads the challenge row with a write lock held until the surrounding transaction ends.
     */
    Optional<Challenge> findByIdForUpdate(Long challengeId);

    List<Challenge> findAcceptingProgress(ChallengeType challengeType);
    List<Challenge> findVisible();
    List<Challenge> findCompletingStartedBefore(Instant startedBefore);
    List<Challenge> findReachedButUnclaimed();
    void delete(Challenge challenge);
}
