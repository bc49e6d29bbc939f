package com.communitychallenge.platform.service;

import com.communitychallenge.platform.exception.ChallengeNotFoundException;
import com.communitychallenge.platform.exception.ChallengeStateException;
import com.communitychallenge.platform.exception.InvalidRequestException;
import com.communitychallenge.platform.model.Challenge;
import com.communitychallenge.platform.model.ChallengeSettings;
import com.communitychallenge.platform.model.ChallengeStatus;
import com.communitychallenge.platform.model.ChallengeType;
import com.communitychallenge.platform.model.ContributionEntry;
import com.communitychallenge.platform.model.LeaderboardSnapshot;
import com.communitychallenge.platform.model.ProgressResult;
import com.communitychallenge.platform.model.RewardGrant;
import com.communitychallenge.platform.model.RewardGrantStatus;
import com.communitychallenge.platform.repository.ChallengeRepository;
import com.communitychallenge.platform.repository.ChallengeSettingsRepository;
import com.communitychallenge.platform.repository.RewardGrantRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Isolation;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.EnumSet;
import java.util.List;
import java.util.Optional;
import java.util.function.Consumer;

/**
 * Durable state of challenges, their ledgers, reward grants and the global settings.
 * <p>
 * Every write to a challenge, its ledger or its reward grants runs in one transaction that first
 * takes the challenge row lock, so writers of the same challenge are serialized and writers of
 * different challenges never wait on each other.
 */
@Service
public class ChallengeStore {

    private static final Logger logger = LoggerFactory.getLogger(ChallengeStore.class);

    private final ChallengeRepository challengeRepository;
    private final ChallengeSettingsRepository settingsRepository;
    private final RewardGrantRepository rewardGrantRepository;
    private final ProgressLedger ledger;

    @Autowired
    public ChallengeStore(
            ChallengeRepository challengeRepository,
            ChallengeSettingsRepository settingsRepository,
            RewardGrantRepository rewardGrantRepository,
            ProgressLedger ledger) {
        this.challengeRepository = challengeRepository;
        this.settingsRepository = settingsRepository;
        this.rewardGrantRepository = rewardGrantRepository;
        this.ledger = ledger;
    }

    @Transactional
    public Challenge createChallenge(Challenge challenge) {
        Challenge saved = challengeRepository.save(challenge);
        logger.info("Created challenge {} '{}' - type: {}, target: {}",
            saved.getId(), saved.getName(), saved.getChallengeType(), saved.getTargetAmount());
        return saved;
    }

    @Transactional(readOnly = true)
    public Optional<Challenge> findChallenge(Long challengeId) {
        return challengeRepository.findById(challengeId);
    }

    @Transactional(readOnly = true)
    public Challenge getChallenge(Long challengeId) {
        return challengeRepository.findById(challengeId)
            .orElseThrow(() -> new ChallengeNotFoundException(challengeId));
    }

    /**
     * Applies one progress report: dedup check, ledger upsert and total increment in a single
     * transaction under the challenge row lock.
     *
     * @throws ChallengeNotFoundException if the challenge does not exist
     * @throws InvalidRequestException if challenges are switched off, or this one is disabled or not ACTIVE
     */
    @Transactional
    public ProgressResult applyProgress(Long challengeId, String contributorId, long amount,
                                        String idempotencyKey, Instant now) {
        if (!readSettings().isEnabled()) {
            throw new InvalidRequestException("Community challenges are currently disabled");
        }

        Challenge challenge = lockChallenge(challengeId);
        if (!challenge.isEnabled()) {
            throw new InvalidRequestException("Challenge " + challengeId + " is disabled");
        }
        if (challenge.getStatus() != ChallengeStatus.ACTIVE) {
            throw new InvalidRequestException(
                "Challenge " + challengeId + " is not accepting progress (status: " + challenge.getStatus() + ")");
        }

        if (ledger.isDuplicate(challengeId, contributorId, idempotencyKey, now)) {
            logger.info("Duplicate progress report ignored - challenge: {}, contributor: {}, key: {}",
                challengeId, contributorId, idempotencyKey);
            return ProgressResult.duplicate(challenge, contributorId, amount);
        }

        long previousTotal = challenge.getCurrentAmount();
        if (amount > Long.MAX_VALUE - previousTotal) {
            throw new InvalidRequestException("Amount would overflow the total of challenge " + challengeId);
        }
        long newTotal = previousTotal + amount;

        ContributionEntry entry = ledger.record(challengeId, contributorId, amount, idempotencyKey, now);
        challenge.setCurrentAmount(newTotal);
        challenge.setUpdatedAt(now);
        challengeRepository.save(challenge);

        boolean crossed = previousTotal < challenge.getTargetAmount() && newTotal >= challenge.getTargetAmount();

        return ProgressResult.builder()
            .challengeId(challengeId)
            .contributorId(contributorId)
            .accepted(true)
            .duplicate(false)
            .amount(amount)
            .newTotal(newTotal)
            .targetAmount(challenge.getTargetAmount())
            .crossedThreshold(crossed)
            .contributorTotal(entry.getAmountContributed())
            .firstContributedAt(entry.getFirstContributedAt())
            .generation(challenge.getGeneration())
            .build();
    }

    /**
     * Moves an enabled ACTIVE challenge that reached its target to COMPLETING.
     *
     * @return true only for the caller whose transaction performed the transition
     */
    @Transactional
    public boolean claimCompletion(Long challengeId, Instant now) {
        Challenge challenge = challengeRepository.findByIdForUpdate(challengeId).orElse(null);
        if (challenge == null
                || !challenge.isEnabled()
                || challenge.getStatus() != ChallengeStatus.ACTIVE
                || !challenge.hasReachedTarget()) {
            return false;
        }

        challenge.setStatus(ChallengeStatus.COMPLETING);
        challenge.setCompletionStartedAt(now);
        challenge.setUpdatedAt(now);
        challengeRepository.save(challenge);
        logger.info("Challenge {} claimed for completion - total: {}, target: {}",
            challengeId, challenge.getCurrentAmount(), challenge.getTargetAmount());
        return true;
    }

    @Transactional(readOnly = true)
    public List<ContributionEntry> snapshotContributions(Long challengeId) {
        return ledger.entriesFor(challengeId);
    }

    @Transactional(readOnly = true)
    public Optional<RewardGrant> findRewardGrant(Long challengeId, String contributorId) {
        return rewardGrantRepository.findByChallengeIdAndContributorId(challengeId, contributorId);
    }

    /**
     * Grants that did not go through: FAILED ones and those an administrative retry is working on.
     */
    @Transactional(readOnly = true)
    public List<RewardGrant> findRewardFailures(Long challengeId) {
        return rewardGrantRepository.findByChallengeIdAndStatusIn(challengeId,
            EnumSet.of(RewardGrantStatus.FAILED, RewardGrantStatus.RETRYING));
    }

    /**
     * Claims a failed grant of a COMPLETED challenge for re-dispatch by moving it to RETRYING.
     * A RETRYING grant can be claimed again once its last update is older than {@code staleBefore},
     * which covers a retry that died mid-dispatch.
     *
     * @return true only for the caller whose transaction made the claim
     */
    @Transactional
    public boolean claimRewardRetry(Long challengeId, String contributorId, Instant now, Instant staleBefore) {
        Challenge challenge = lockChallenge(challengeId);
        if (challenge.getStatus() != ChallengeStatus.COMPLETED) {
            return false;
        }

        RewardGrant grant = rewardGrantRepository.findByChallengeIdAndContributorId(challengeId, contributorId)
            .orElse(null);
        if (grant == null) {
            return false;
        }
        boolean claimable = grant.getStatus() == RewardGrantStatus.FAILED
            || (grant.getStatus() == RewardGrantStatus.RETRYING && grant.getUpdatedAt().isBefore(staleBefore));
        if (!claimable) {
            return false;
        }

        grant.setStatus(RewardGrantStatus.RETRYING);
        grant.setUpdatedAt(now);
        rewardGrantRepository.save(grant);
        return true;
    }

    /**
     * Stores the outcome of a reward dispatch, replacing any earlier outcome for the same contributor.
     * A GRANTED row is never downgraded.
     */
    @Transactional
    public RewardGrant recordRewardGrant(RewardGrant outcome) {
        Optional<RewardGrant> existing = rewardGrantRepository.findByChallengeIdAndContributorId(
            outcome.getChallengeId(), outcome.getContributorId());

        if (existing.isPresent()) {
            RewardGrant grant = existing.get();
            if (grant.getStatus() == RewardGrantStatus.GRANTED) {
                return grant;
            }
            grant.setRewardItem(outcome.getRewardItem());
            grant.setRewardQuantity(outcome.getRewardQuantity());
            grant.setStatus(outcome.getStatus());
            grant.setAttempts(grant.getAttempts() + outcome.getAttempts());
            grant.setLastError(outcome.getLastError());
            grant.setGrantedAt(outcome.getGrantedAt());
            grant.setUpdatedAt(outcome.getUpdatedAt());
            return rewardGrantRepository.save(grant);
        }

        return rewardGrantRepository.save(outcome);
    }

    @Transactional
    public void markAnnounced(Long challengeId, Instant now) {
        challengeRepository.findByIdForUpdate(challengeId)
            .filter(challenge -> challenge.getStatus() == ChallengeStatus.COMPLETING)
            .filter(challenge -> challenge.getAnnouncedAt() == null)
            .ifPresent(challenge -> {
                challenge.setAnnouncedAt(now);
                challengeRepository.save(challenge);
            });
    }

    /**
     * @return true if the challenge moved from COMPLETING to COMPLETED
     */
    @Transactional
    public boolean markCompleted(Long challengeId, Instant now) {
        Challenge challenge = challengeRepository.findByIdForUpdate(challengeId).orElse(null);
        if (challenge == null || challenge.getStatus() != ChallengeStatus.COMPLETING) {
            return false;
        }

        challenge.setStatus(ChallengeStatus.COMPLETED);
        challenge.setCompletedAt(now);
        challenge.setUpdatedAt(now);
        challengeRepository.save(challenge);
        return true;
    }

    /**
     * Clears all progress of a challenge and starts a new generation.
     *
     * @throws ChallengeStateException while a completion workflow is in flight
     */
    @Transactional
    public Challenge resetChallenge(Long challengeId, Instant now) {
        Challenge challenge = lockChallenge(challengeId);
        requireNotCompleting(challenge, "reset");

        ledger.clear(challengeId);
        int grants = rewardGrantRepository.deleteByChallengeId(challengeId);

        challenge.setCurrentAmount(0L);
        challenge.setStatus(ChallengeStatus.ACTIVE);
        challenge.setGeneration(challenge.getGeneration() + 1);
        challenge.setCompletionStartedAt(null);
        challenge.setAnnouncedAt(null);
        challenge.setCompletedAt(null);
        challenge.setUpdatedAt(now);
        Challenge saved = challengeRepository.save(challenge);

        logger.info("Reset challenge {} - generation: {}, reward grants removed: {}",
            challengeId, saved.getGeneration(), grants);
        return saved;
    }

    @Transactional
    public Challenge deleteChallenge(Long challengeId) {
        Challenge challenge = lockChallenge(challengeId);
        requireNotCompleting(challenge, "deleted");

        ledger.clear(challengeId);
        rewardGrantRepository.deleteByChallengeId(challengeId);
        challengeRepository.delete(challenge);
        logger.info("Deleted challenge {} '{}'", challengeId, challenge.getName());
        return challenge;
    }

    /**
     * Applies an administrative change to a challenge under its row lock.
     *
     * @throws ChallengeStateException while a completion workflow is in flight
     */
    @Transactional
    public Challenge updateChallenge(Long challengeId, Consumer<Challenge> changes, Instant now) {
        Challenge challenge = lockChallenge(challengeId);
        requireNotCompleting(challenge, "modified");

        changes.accept(challenge);
        challenge.setUpdatedAt(now);
        return challengeRepository.save(challenge);
    }

    /**
     * Current settings, or the defaults when none were ever stored. Never writes.
     */
    @Transactional(readOnly = true)
    public ChallengeSettings loadSettings() {
        return readSettings();
    }

    @Transactional
    public ChallengeSettings getOrCreateSettings() {
        return settingsRepository.findSettings()
            .orElseGet(() -> {
                logger.info("No challenge settings stored, creating defaults");
                return settingsRepository.save(ChallengeSettings.defaults());
            });
    }

    @Transactional
    public ChallengeSettings updateSettings(Consumer<ChallengeSettings> changes, Instant now) {
        ChallengeSettings settings = getOrCreateSettings();
        changes.accept(settings);
        settings.setUpdatedAt(now);
        return settingsRepository.save(settings);
    }

    @Transactional(readOnly = true)
    public List<Challenge> findAcceptingChallenges(ChallengeType challengeType) {
        return challengeRepository.findAcceptingProgress(challengeType);
    }

    @Transactional(readOnly = true)
    public List<Challenge> findVisibleChallenges() {
        return challengeRepository.findVisible();
    }

    @Transactional(readOnly = true)
    public List<Challenge> findCompletingStartedBefore(Instant cutoff) {
        return challengeRepository.findCompletingStartedBefore(cutoff);
    }

    @Transactional(readOnly = true)
    public List<Challenge> findReachedButUnclaimed() {
        return challengeRepository.findReachedButUnclaimed();
    }

    /**
     * Reads the challenge and its ordered ledger from one snapshot, so the entries always sum
     * to the returned total.
     */
    @Transactional(readOnly = true, isolation = Isolation.REPEATABLE_READ)
    public LeaderboardSnapshot readLeaderboard(Long challengeId) {
        Challenge challenge = challengeRepository.findById(challengeId)
            .orElseThrow(() -> new ChallengeNotFoundException(challengeId));
        return new LeaderboardSnapshot(challenge, ledger.entriesFor(challengeId));
    }

    @Transactional
    public int purgeExpiredReceipts(Instant now) {
        return ledger.purgeExpiredReceipts(now);
    }

    private ChallengeSettings readSettings() {
        return settingsRepository.findSettings().orElseGet(ChallengeSettings::defaults);
    }

    private Challenge lockChallenge(Long challengeId) {
        return challengeRepository.findByIdForUpdate(challengeId)
            .orElseThrow(() -> new ChallengeNotFoundException(challengeId));
    }

    private void requireNotCompleting(Challenge challenge, String action) {
        if (challenge.getStatus() == ChallengeStatus.COMPLETING) {
            throw new ChallengeStateException(
                "Challenge " + challenge.getId() + " is completing and cannot be " + action);
        }
    }
}
