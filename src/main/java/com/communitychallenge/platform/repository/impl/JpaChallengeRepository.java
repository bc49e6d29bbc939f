package com.communitychallenge.platform.repository.impl;

import com.communitychallenge.platform.model.Challenge;
import com.communitychallenge.platform.model.ChallengeStatus;
import com.communitychallenge.platform.model.ChallengeType;
import com.communitychallenge.platform.repository.ChallengeRepository;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

@Repository
public class JpaChallengeRepository implements ChallengeRepository {
    
    private final ChallengeJpaRepository jpaRepository;
    
    @Autowired
    public JpaChallengeRepository(ChallengeJpaRepository jpaRepository) {
        this.jpaRepository = jpaRepository;
    }
    
    @Override
    public Challenge save(Challenge challenge) {
        return jpaRepository.save(challenge);
    }
    
    @Override
    public Optional<Challenge> findById(Long challengeId) {
        return jpaRepository.findById(challengeId);
    }
    
    @Override
    public Optional<Challenge> findByIdForUpdate(Long challengeId) {
        return jpaRepository.findByIdForUpdate(challengeId);
    }
    
    @Override
    public List<Challenge> findAcceptingProgress(ChallengeType challengeType) {
        return jpaRepository.findByChallengeTypeAndStatusAndEnabledTrueOrderByCreatedAtAsc(
            challengeType, ChallengeStatus.ACTIVE);
    }
    
    @Override
    public List<Challenge> findVisible() {
        return jpaRepository.findByEnabledTrueAndStatusNotOrderByCreatedAtDesc(ChallengeStatus.COMPLETED);
    }
    
    @Override
    public List<Challenge> findCompletingStartedBefore(Instant startedBefore) {
        return jpaRepository.findByStatusAndCompletionStartedAtBeforeOrderByCompletionStartedAtAsc(
            ChallengeStatus.COMPLETING, startedBefore);
    }
    
    @Override
    public List<Challenge> findReachedButUnclaimed() {
        return jpaRepository.findReachedTarget(ChallengeStatus.ACTIVE);
    }
    
    @Override
    public void delete(Challenge challenge) {
        jpaRepository.delete(challenge);
    }
}
