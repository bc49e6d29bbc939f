package com.communitychallenge.platform.service;

import com.communitychallenge.platform.config.ChallengeProperties;
import com.communitychallenge.platform.model.ContributionEntry;
import com.communitychallenge.platform.model.ProgressReceipt;
import com.communitychallenge.platform.repository.ContributionRepository;
import com.communitychallenge.platform.repository.ProgressReceiptRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Per-contributor accounting for each challenge, with idempotency-key deduplication.
 * <p>
 * Every mutating method must run inside the transaction that holds the challenge row lock
 * (see {@link ChallengeStore}); the ledger itself takes no locks.
 */
@Component
public class ProgressLedger {

    private static final Logger logger = LoggerFactory.getLogger(ProgressLedger.class);

    private final ContributionRepository contributionRepository;
    private final ProgressReceiptRepository receiptRepository;
    private final ChallengeProperties properties;

    @Autowired
    public ProgressLedger(
            ContributionRepository contributionRepository,
            ProgressReceiptRepository receiptRepository,
            ChallengeProperties properties) {
        this.contributionRepository = contributionRepository;
        this.receiptRepository = receiptRepository;
        this.properties = properties;
    }

    /**
     * Whether the key was already seen for this contributor and challenge inside the dedup window.
     * A report without a key is never a duplicate.
     */
    public boolean isDuplicate(Long challengeId, String contributorId, String idempotencyKey, Instant now) {
        if (idempotencyKey == null) {
            return false;
        }
        return receiptRepository.findByKey(challengeId, contributorId, idempotencyKey)
            .map(receipt -> !isExpired(receipt, now))
            .orElse(false);
    }

    /**
     * Adds {@code amount} to the contributor's entry, creating it on first contribution,
     * and remembers the idempotency key when one is given.
     */
    public ContributionEntry record(Long challengeId, String contributorId, long amount,
                                    String idempotencyKey, Instant now) {
        if (idempotencyKey != null) {
            rememberKey(challengeId, contributorId, idempotencyKey, amount, now);
        }

        ContributionEntry entry = contributionRepository.findByChallengeIdAndContributorId(challengeId, contributorId)
            .orElseGet(() -> ContributionEntry.builder()
                .challengeId(challengeId)
                .contributorId(contributorId)
                .amountContributed(0L)
                .firstContributedAt(now)
                .build());

        entry.setAmountContributed(entry.getAmountContributed() + amount);
        entry.setLastContributedAt(now);
        return contributionRepository.save(entry);
    }

    private void rememberKey(Long challengeId, String contributorId, String idempotencyKey, long amount, Instant now) {
        Optional<ProgressReceipt> existing = receiptRepository.findByKey(challengeId, contributorId, idempotencyKey);
        ProgressReceipt receipt = existing.orElseGet(() -> ProgressReceipt.builder()
            .challengeId(challengeId)
            .contributorId(contributorId)
            .idempotencyKey(idempotencyKey)
            .build());
        receipt.setAmount(amount);
        receipt.setReceivedAt(now);
        receiptRepository.save(receipt);
    }

    private boolean isExpired(ProgressReceipt receipt, Instant now) {
        return receipt.getReceivedAt().isBefore(now.minus(properties.getProgress().getDedupWindow()));
    }

    public List<ContributionEntry> entriesFor(Long challengeId) {
        return contributionRepository.findByChallengeId(challengeId);
    }

    /**
     * Drops every entry and receipt of a challenge.
     */
    public void clear(Long challengeId) {
        int entries = contributionRepository.deleteByChallengeId(challengeId);
        int receipts = receiptRepository.deleteByChallengeId(challengeId);
        logger.info("Cleared ledger for challenge {} - entries: {}, receipts: {}", challengeId, entries, receipts);
    }

    public int purgeExpiredReceipts(Instant now) {
        return receiptRepository.deleteReceivedBefore(now.minus(properties.getProgress().getDedupWindow()));
    }
}
