package com.communitychallenge.platform.service;

import com.communitychallenge.platform.config.ChallengeProperties;
import com.communitychallenge.platform.exception.InvalidRequestException;
import com.communitychallenge.platform.model.Challenge;
import com.communitychallenge.platform.model.ChallengeSettings;
import com.communitychallenge.platform.model.ChallengeStatus;
import com.communitychallenge.platform.model.ChallengeType;
import com.communitychallenge.platform.model.ContributionEntry;
import com.communitychallenge.platform.model.LeaderboardSnapshot;
import com.communitychallenge.platform.model.LeaderboardView;
import com.communitychallenge.platform.model.ProgressSnapshot;
import com.communitychallenge.platform.model.RankedContributor;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class QueryServiceTest {

    @Mock
    private ChallengeStore challengeStore;

    @Mock
    private LeaderboardMirror leaderboardMirror;

    private QueryService queryService;

    private Challenge challenge;
    private final Long challengeId = 31L;
    private final Instant start = Instant.parse("2024-05-01T12:00:00Z");

    @BeforeEach
    void setUp() {
        queryService = new QueryService(challengeStore, leaderboardMirror, new ChallengeProperties());
        challenge = Challenge.builder()
            .id(challengeId)
            .name("Harvest Festival")
            .challengeType(ChallengeType.COLLECT)
            .targetAmount(100L)
            .enabled(true)
            .status(ChallengeStatus.ACTIVE)
            .currentAmount(110L)
            .generation(2)
            .createdAt(start)
            .build();
    }

    private RankedContributor ranked(int rank, String contributorId, long amount, Instant first) {
        return RankedContributor.builder()
            .rank(rank)
            .contributorId(contributorId)
            .amountContributed(amount)
            .firstContributedAt(first)
            .build();
    }

    private ContributionEntry entry(String contributorId, long amount, Instant first) {
        return ContributionEntry.builder()
            .challengeId(challengeId)
            .contributorId(contributorId)
            .amountContributed(amount)
            .firstContributedAt(first)
            .lastContributedAt(first)
            .build();
    }

    @Test
    void testRenderProgressBar() {
        assertEquals("[█████░░░░░] 50% (50/100)", QueryService.renderProgressBar(50, 100));
        assertEquals("[░░░░░░░░░░] 0% (0/100)", QueryService.renderProgressBar(0, 100));
        assertEquals("[███░░░░░░░] 33% (1/3)", QueryService.renderProgressBar(1, 3));
        assertEquals("[██████████] 100% (150/100)", QueryService.renderProgressBar(150, 100));
    }

    @Test
    void testGetProgress() {
        challenge.setCurrentAmount(25L);
        when(challengeStore.getChallenge(challengeId)).thenReturn(challenge);

        ProgressSnapshot snapshot = queryService.getProgress(challengeId);

        assertEquals(25, snapshot.getPercentComplete());
        assertEquals(25L, snapshot.getCurrentAmount());
        assertEquals("[██░░░░░░░░] 25% (25/100)", snapshot.getProgressBar());
    }

    @Test
    void testGetLeaderboard_LimitOutOfRange() {
        assertThrows(InvalidRequestException.class, () -> queryService.getLeaderboard(challengeId, 0));
        assertThrows(InvalidRequestException.class, () -> queryService.getLeaderboard(challengeId, 1001));
        verifyNoInteractions(challengeStore);
    }

    @Test
    void testGetLeaderboard_ConsistentCacheIsUsed() {
        // Arrange
        when(challengeStore.getChallenge(challengeId)).thenReturn(challenge);
        when(challengeStore.findChallenge(challengeId)).thenReturn(Optional.of(challenge));
        when(leaderboardMirror.readMirroredTotal(challengeId, 2)).thenReturn(110L);
        when(leaderboardMirror.readTopN(challengeId, 2, 10)).thenReturn(List.of(
            ranked(1, "alice", 60L, start),
            ranked(2, "bob", 50L, start.plusSeconds(5))));
        when(leaderboardMirror.countContributors(challengeId, 2)).thenReturn(2L);

        // Act
        LeaderboardView view = queryService.getLeaderboard(challengeId, null);

        // Assert
        assertEquals(2, view.getContributors().size());
        assertEquals("alice", view.getContributors().get(0).getContributorId());
        assertEquals(2L, view.getTotalContributors());
        verify(challengeStore, never()).readLeaderboard(anyLong());
    }

    @Test
    void testGetLeaderboard_CacheAheadOfDatabaseFallsBack() {
        // Arrange - cached amounts exceed the stored total, e.g. left over from a reset
        when(challengeStore.getChallenge(challengeId)).thenReturn(challenge);
        when(challengeStore.findChallenge(challengeId)).thenReturn(Optional.of(challenge));
        when(leaderboardMirror.readMirroredTotal(challengeId, 2)).thenReturn(500L);
        when(leaderboardMirror.readTopN(challengeId, 2, 10)).thenReturn(List.of(ranked(1, "carol", 500L, start)));
        when(challengeStore.readLeaderboard(challengeId)).thenReturn(new LeaderboardSnapshot(challenge, List.of(
            entry("alice", 60L, start),
            entry("bob", 50L, start.plusSeconds(5)))));

        // Act
        LeaderboardView view = queryService.getLeaderboard(challengeId, 10);

        // Assert
        assertEquals(2, view.getContributors().size());
        assertEquals("alice", view.getContributors().get(0).getContributorId());
        assertEquals(1, view.getContributors().get(0).getRank());
        assertEquals("bob", view.getContributors().get(1).getContributorId());
        assertEquals(2, view.getContributors().get(1).getRank());
    }

    @Test
    void testGetLeaderboard_PartialCacheFallsBack() {
        // Arrange - Redis lost alice and bob, only carol was mirrored again
        challenge.setCurrentAmount(115L);
        when(challengeStore.getChallenge(challengeId)).thenReturn(challenge);
        when(challengeStore.findChallenge(challengeId)).thenReturn(Optional.of(challenge));
        when(leaderboardMirror.readMirroredTotal(challengeId, 2)).thenReturn(5L);
        when(leaderboardMirror.readTopN(challengeId, 2, 10)).thenReturn(List.of(ranked(1, "carol", 5L, start)));
        when(leaderboardMirror.countContributors(challengeId, 2)).thenReturn(1L);
        when(challengeStore.readLeaderboard(challengeId)).thenReturn(new LeaderboardSnapshot(challenge, List.of(
            entry("carol", 5L, start.plusSeconds(20)),
            entry("alice", 60L, start),
            entry("bob", 50L, start.plusSeconds(5)))));

        // Act
        LeaderboardView view = queryService.getLeaderboard(challengeId, 10);

        // Assert
        assertEquals(3, view.getContributors().size());
        assertEquals("alice", view.getContributors().get(0).getContributorId());
        assertEquals("bob", view.getContributors().get(1).getContributorId());
        assertEquals("carol", view.getContributors().get(2).getContributorId());
        assertEquals(3, view.getContributors().get(2).getRank());
        assertEquals(3L, view.getTotalContributors());
    }

    @Test
    void testGetLeaderboard_UnavailableCacheSkipsRedisReads() {
        // Arrange
        when(challengeStore.getChallenge(challengeId)).thenReturn(challenge);
        when(leaderboardMirror.readMirroredTotal(challengeId, 2)).thenReturn(null);
        when(challengeStore.readLeaderboard(challengeId)).thenReturn(new LeaderboardSnapshot(challenge, List.of(
            entry("alice", 60L, start),
            entry("bob", 50L, start.plusSeconds(5)))));

        // Act
        LeaderboardView view = queryService.getLeaderboard(challengeId, 10);

        // Assert
        assertEquals(2L, view.getTotalContributors());
        verify(leaderboardMirror, never()).readTopN(anyLong(), anyInt(), anyInt());
    }

    @Test
    void testGetLeaderboard_ResetDuringCacheReadFallsBack() {
        // Arrange
        Challenge afterReset = Challenge.builder()
            .id(challengeId)
            .name("Harvest Festival")
            .targetAmount(100L)
            .status(ChallengeStatus.ACTIVE)
            .currentAmount(0L)
            .generation(3)
            .build();
        when(challengeStore.getChallenge(challengeId)).thenReturn(challenge);
        when(leaderboardMirror.readMirroredTotal(challengeId, 2)).thenReturn(60L);
        when(leaderboardMirror.readTopN(challengeId, 2, 10)).thenReturn(List.of(ranked(1, "alice", 60L, start)));
        when(challengeStore.findChallenge(challengeId)).thenReturn(Optional.of(afterReset));
        when(challengeStore.readLeaderboard(challengeId)).thenReturn(new LeaderboardSnapshot(afterReset, List.of()));

        // Act
        LeaderboardView view = queryService.getLeaderboard(challengeId, 10);

        // Assert
        assertTrue(view.getContributors().isEmpty());
        assertEquals(0L, view.getCurrentAmount());
    }

    @Test
    void testGetLeaderboard_DatabaseTieBreaks() {
        // Arrange
        when(challengeStore.getChallenge(challengeId)).thenReturn(challenge);
        when(leaderboardMirror.readMirroredTotal(challengeId, 2)).thenReturn(null);
        when(challengeStore.readLeaderboard(challengeId)).thenReturn(new LeaderboardSnapshot(challenge, List.of(
            entry("zed", 30L, start.plusSeconds(10)),
            entry("amy", 30L, start.plusSeconds(10)),
            entry("early", 30L, start),
            entry("small", 20L, start))));

        // Act
        LeaderboardView view = queryService.getLeaderboard(challengeId, 3);

        // Assert - equal amounts: earliest first contribution, then contributor id
        List<RankedContributor> contributors = view.getContributors();
        assertEquals(3, contributors.size());
        assertEquals("early", contributors.get(0).getContributorId());
        assertEquals("amy", contributors.get(1).getContributorId());
        assertEquals("zed", contributors.get(2).getContributorId());
        assertEquals(4L, view.getTotalContributors());
    }

    @Test
    void testListActiveChallenges_DisabledSettingsListsNothing() {
        // Arrange
        ChallengeSettings settings = ChallengeSettings.defaults();
        settings.setEnabled(false);
        when(challengeStore.loadSettings()).thenReturn(settings);

        // Act & Assert
        assertTrue(queryService.listActiveChallenges().isEmpty());
        verify(challengeStore, never()).findVisibleChallenges();
    }

    @Test
    void testListActiveChallenges_RendersProgress() {
        // Arrange
        challenge.setCurrentAmount(50L);
        when(challengeStore.loadSettings()).thenReturn(ChallengeSettings.defaults());
        when(challengeStore.findVisibleChallenges()).thenReturn(List.of(challenge));

        // Act
        List<ProgressSnapshot> active = queryService.listActiveChallenges();

        // Assert
        assertEquals(1, active.size());
        assertEquals("[█████░░░░░] 50% (50/100)", active.get(0).getProgressBar());
    }
}
