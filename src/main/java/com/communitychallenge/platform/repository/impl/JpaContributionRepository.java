package com.communitychallenge.platform.repository.impl;

import com.communitychallenge.platform.model.ContributionEntry;
import com.communitychallenge.platform.repository.ContributionRepository;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public class JpaContributionRepository implements ContributionRepository {
    
    private final ContributionJpaRepository jpaRepository;
    
    @Autowired
    public JpaContributionRepository(ContributionJpaRepository jpaRepository) {
        this.jpaRepository = jpaRepository;
    }
    
    @Override
    public ContributionEntry save(ContributionEntry entry) {
        return jpaRepository.save(entry);
    }
    
    @Override
    public Optional<ContributionEntry> findByChallengeIdAndContributorId(Long challengeId, String contributorId) {
        return jpaRepository.findByChallengeIdAndContributorId(challengeId, contributorId);
    }
    
    @Override
    public List<ContributionEntry> findByChallengeId(Long challengeId) {
        return jpaRepository.findByChallengeIdOrderByAmountContributedDescFirstContributedAtAscContributorIdAsc(challengeId);
    }
    
    @Override
    public int deleteByChallengeId(Long challengeId) {
        return jpaRepository.deleteAllByChallengeId(challengeId);
    }
}
