package com.communitychallenge.platform.repository.impl;

import com.communitychallenge.platform.model.RewardGrant;
import com.communitychallenge.platform.model.RewardGrantStatus;
import com.communitychallenge.platform.repository.RewardGrantRepository;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

@Repository
public class JpaRewardGrantRepository implements RewardGrantRepository {
    
    private final RewardGrantJpaRepository jpaRepository;
    
    @Autowired
    public JpaRewardGrantRepository(RewardGrantJpaRepository jpaRepository) {
        this.jpaRepository = jpaRepository;
    }
    
    @Override
    public RewardGrant save(RewardGrant grant) {
        return jpaRepository.save(grant);
    }
    
    @Override
    public Optional<RewardGrant> findByChallengeIdAndContributorId(Long challengeId, String contributorId) {
        return jpaRepository.findByChallengeIdAndContributorId(challengeId, contributorId);
    }
    
    @Override
    public List<RewardGrant> findByChallengeIdAndStatusIn(Long challengeId, Collection<RewardGrantStatus> statuses) {
        return jpaRepository.findByChallengeIdAndStatusInOrderByUpdatedAtAsc(challengeId, statuses);
    }
    
    @Override
    public int deleteByChallengeId(Long challengeId) {
        return jpaRepository.deleteAllByChallengeId(challengeId);
    }
}
