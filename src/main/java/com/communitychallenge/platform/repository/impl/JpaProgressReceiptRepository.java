package com.communitychallenge.platform.repository.impl;

import com.communitychallenge.platform.model.ProgressReceipt;
import com.communitychallenge.platform.repository.ProgressReceiptRepository;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.Optional;

@Repository
public class JpaProgressReceiptRepository implements ProgressReceiptRepository {
    
    private final ProgressReceiptJpaRepository jpaRepository;
    
    @Autowired
    public JpaProgressReceiptRepository(ProgressReceiptJpaRepository jpaRepository) {
        this.jpaRepository = jpaRepository;
    }
    
    @Override
    public ProgressReceipt save(ProgressReceipt receipt) {
        return jpaRepository.save(receipt);
    }
    
    @Override
    public Optional<ProgressReceipt> findByKey(Long challengeId, String contributorId, String idempotencyKey) {
        return jpaRepository.findByChallengeIdAndContributorIdAndIdempotencyKey(challengeId, contributorId, idempotencyKey);
    }
    
    @Override
    public int deleteByChallengeId(Long challengeId) {
        return jpaRepository.deleteAllByChallengeId(challengeId);
    }
    
    @Override
    public int deleteReceivedBefore(Instant cutoff) {
        return jpaRepository.deleteAllReceivedBefore(cutoff);
    }
}
