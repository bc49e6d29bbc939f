package com.communitychallenge.platform.repository;

import com.communitychallenge.platform.model.ProgressReceipt;

import java.time.Instant;
import java.util.Optional;

public interface ProgressReceiptRepository {
    ProgressReceipt save(ProgressReceipt receipt);
    Optional<ProgressReceipt> findByKey(Long challengeId, String contributorId, String idempotencyKey);
    int deleteByChallengeId(Long challengeId);
    int deleteReceivedBefore(Instant cutoff);
}
