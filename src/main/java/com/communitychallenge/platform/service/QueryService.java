package com.communitychallenge.platform.service;

import com.communitychallenge.platform.config.ChallengeProperties;
import com.communitychallenge.platform.exception.InvalidRequestException;
import com.communitychallenge.platform.model.Challenge;
import com.communitychallenge.platform.model.ContributionEntry;
import com.communitychallenge.platform.model.LeaderboardSnapshot;
import com.communitychallenge.platform.model.LeaderboardView;
import com.communitychallenge.platform.model.ProgressSnapshot;
import com.communitychallenge.platform.model.RankedContributor;
import com.communitychallenge.platform.model.RewardGrant;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Read side: progress snapshots, leaderboards and the active-challenge listing. Never locks.
 */
@Service
public class QueryService {

    private static final Logger logger = LoggerFactory.getLogger(QueryService.class);

    static final int PROGRESS_BAR_WIDTH = 10;

    private final ChallengeStore challengeStore;
    private final LeaderboardMirror leaderboardMirror;
    private final ChallengeProperties properties;

    @Autowired
    public QueryService(
            ChallengeStore challengeStore,
            LeaderboardMirror leaderboardMirror,
            ChallengeProperties properties) {
        this.challengeStore = challengeStore;
        this.leaderboardMirror = leaderboardMirror;
        this.properties = properties;
    }

    public ProgressSnapshot getProgress(Long challengeId) {
        return toSnapshot(challengeStore.getChallenge(challengeId));
    }

    /**
     * Every enabled challenge that has not completed yet, newest first. Empty while challenges
     * are switched off globally.
     */
    public List<ProgressSnapshot> listActiveChallenges() {
        if (!challengeStore.loadSettings().isEnabled()) {
            logger.debug("Community challenges are disabled, no active challenges to list");
            return Collections.emptyList();
        }
        return challengeStore.findVisibleChallenges().stream()
            .map(this::toSnapshot)
            .toList();
    }

    /**
     * Top contributors of a challenge. The Redis mirror answers when it agrees with the stored
     * total; otherwise the ledger is read from the database.
     *
     * @param requestedLimit number of entries, or null for the configured default
     */
    public LeaderboardView getLeaderboard(Long challengeId, Integer requestedLimit) {
        int limit = requestedLimit != null ? requestedLimit : properties.getLeaderboard().getDefaultLimit();
        validateLimit(limit);

        Challenge challenge = challengeStore.getChallenge(challengeId);
        LeaderboardView cached = tryLeaderboardFromCache(challenge, limit);
        if (cached != null) {
            return cached;
        }

        return leaderboardFromStorage(challengeId, limit);
    }

    private void validateLimit(int limit) {
        if (limit <= 0) {
            throw new InvalidRequestException("Limit must be greater than 0");
        }
        int maxLimit = properties.getLeaderboard().getMaxLimit();
        if (limit > maxLimit) {
            throw new InvalidRequestException("Limit cannot exceed " + maxLimit);
        }
    }

    /**
     * Mirrored contributor totals only ever lag the ledger and only grow. When the mirrored running
     * total, read before the entries, equals the stored total read after them, every contributor was
     * mirrored and nothing changed in between; any other answer is partial.
     */
    private LeaderboardView tryLeaderboardFromCache(Challenge challenge, int limit) {
        Long mirroredTotal = leaderboardMirror.readMirroredTotal(challenge.getId(), challenge.getGeneration());
        if (mirroredTotal == null) {
            return null;
        }
        List<RankedContributor> topN = leaderboardMirror.readTopN(challenge.getId(), challenge.getGeneration(), limit);
        if (topN == null) {
            return null;
        }
        Long totalContributors = leaderboardMirror.countContributors(challenge.getId(), challenge.getGeneration());

        Challenge current = challengeStore.findChallenge(challenge.getId()).orElse(null);
        if (current == null || current.getGeneration() != challenge.getGeneration()) {
            logger.debug("Challenge {} was reset while reading Redis, using the database", challenge.getId());
            return null;
        }

        if (mirroredTotal.longValue() != current.getCurrentAmount()) {
            logger.debug("Redis leaderboard of challenge {} covers {} of {}, using the database",
                challenge.getId(), mirroredTotal, current.getCurrentAmount());
            return null;
        }
        long cachedSum = topN.stream().mapToLong(RankedContributor::getAmountContributed).sum();
        if (cachedSum > current.getCurrentAmount()) {
            logger.warn("Redis leaderboard of challenge {} disagrees with the stored total ({} > {}), using the database",
                challenge.getId(), cachedSum, current.getCurrentAmount());
            return null;
        }
        if (topN.isEmpty() && current.getCurrentAmount() > 0) {
            logger.debug("Redis leaderboard of challenge {} is empty, using the database", challenge.getId());
            return null;
        }

        return LeaderboardView.builder()
            .challengeId(current.getId())
            .name(current.getName())
            .currentAmount(current.getCurrentAmount())
            .targetAmount(current.getTargetAmount())
            .status(current.getStatus())
            .contributors(topN)
            .totalContributors(Math.max(totalContributors != null ? totalContributors : 0L, topN.size()))
            .build();
    }

    private LeaderboardView leaderboardFromStorage(Long challengeId, int limit) {
        logger.debug("Retrieving top {} contributors from the database for challenge {}", limit, challengeId);
        LeaderboardSnapshot snapshot = challengeStore.readLeaderboard(challengeId);
        Challenge challenge = snapshot.getChallenge();
        List<ContributionEntry> entries = snapshot.getContributions();

        return LeaderboardView.builder()
            .challengeId(challenge.getId())
            .name(challenge.getName())
            .currentAmount(challenge.getCurrentAmount())
            .targetAmount(challenge.getTargetAmount())
            .status(challenge.getStatus())
            .contributors(rank(entries, limit))
            .totalContributors(entries.size())
            .build();
    }

    private List<RankedContributor> rank(List<ContributionEntry> entries, int limit) {
        List<RankedContributor> sorted = entries.stream()
            .map(entry -> RankedContributor.builder()
                .contributorId(entry.getContributorId())
                .amountContributed(entry.getAmountContributed())
                .firstContributedAt(entry.getFirstContributedAt())
                .build())
            .sorted(RankedContributor.LEADERBOARD_ORDER)
            .limit(limit)
            .toList();

        List<RankedContributor> ranked = new ArrayList<>(sorted.size());
        for (int i = 0; i < sorted.size(); i++) {
            RankedContributor contributor = sorted.get(i);
            contributor.setRank(i + 1);
            ranked.add(contributor);
        }
        return ranked;
    }

    public List<RewardGrant> getRewardFailures(Long challengeId) {
        challengeStore.getChallenge(challengeId);
        return challengeStore.findRewardFailures(challengeId);
    }

    private ProgressSnapshot toSnapshot(Challenge challenge) {
        int percent = percentComplete(challenge.getCurrentAmount(), challenge.getTargetAmount());
        return ProgressSnapshot.builder()
            .challengeId(challenge.getId())
            .name(challenge.getName())
            .description(challenge.getDescription())
            .challengeType(challenge.getChallengeType())
            .currentAmount(challenge.getCurrentAmount())
            .targetAmount(challenge.getTargetAmount())
            .status(challenge.getStatus())
            .percentComplete(percent)
            .progressBar(renderProgressBar(challenge.getCurrentAmount(), challenge.getTargetAmount()))
            .build();
    }

    /**
     * Whole percent towards the target, capped at 100.
     */
    static int percentComplete(long currentAmount, long targetAmount) {
        if (targetAmount <= 0) {
            return 100;
        }
        double ratio = Math.min(1.0, (double) currentAmount / targetAmount);
        return (int) Math.floor(ratio * 100);
    }

    /**
     * Renders e.g. {@code [█████░░░░░] 50% (50/100)}.
     */
    static String renderProgressBar(long currentAmount, long targetAmount) {
        int percent = percentComplete(currentAmount, targetAmount);
        int filled = percent * PROGRESS_BAR_WIDTH / 100;
        StringBuilder bar = new StringBuilder("[");
        for (int i = 0; i < PROGRESS_BAR_WIDTH; i++) {
            bar.append(i < filled ? '█' : '░');
        }
        return bar.append("] ")
            .append(percent).append("% (")
            .append(currentAmount).append('/').append(targetAmount).append(')')
            .toString();
    }
}
