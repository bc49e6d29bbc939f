package com.communitychallenge.platform.repository.impl;

import com.communitychallenge.platform.model.Challenge;
import com.communitychallenge.platform.model.ChallengeStatus;
import com.communitychallenge.platform.model.ChallengeType;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

@Repository
public interface ChallengeJpaRepository extends JpaRepository<Challenge, Long> {

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("select c from Challenge c where c.id = :challengeId")
    Optional<Challenge> findByIdForUpdate(@Param("challengeId") Long challengeId);

    List<Challenge> findByChallengeTypeAndStatusAndEnabledTrueOrderByCreatedAtAsc(
            ChallengeType challengeType, ChallengeStatus status);

    List<Challenge> findByEnabledTrueAndStatusNotOrderByCreatedAtDesc(ChallengeStatus status);

    List<Challenge> findByStatusAndCompletionStartedAtBeforeOrderByCompletionStartedAtAsc(
            ChallengeStatus status, Instant startedBefore);

    @Query("select c from Challenge c where c.status = :status and c.enabled = true "
            + "and c.currentAmount >= c.targetAmount order by c.updatedAt asc")
    List<Challenge> findReachedTarget(@Param("status") ChallengeStatus status);
}
