package com.communitychallenge.platform.service;

import com.communitychallenge.platform.exception.ChallengeNotFoundException;
import com.communitychallenge.platform.exception.InvalidRequestException;
import com.communitychallenge.platform.model.Challenge;
import com.communitychallenge.platform.model.ChallengeSettings;
import com.communitychallenge.platform.model.ChallengeStatus;
import com.communitychallenge.platform.model.ChallengeType;
import com.communitychallenge.platform.model.ProgressResult;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class AggregationEngineTest {

    @Mock
    private ChallengeStore challengeStore;

    @Mock
    private CompletionCoordinator completionCoordinator;

    @Mock
    private LeaderboardMirror leaderboardMirror;

    @InjectMocks
    private AggregationEngine aggregationEngine;

    private ProgressResult accepted(Long challengeId, long newTotal, boolean crossed) {
        return ProgressResult.builder()
            .challengeId(challengeId)
            .contributorId("player-1")
            .accepted(true)
            .amount(10L)
            .newTotal(newTotal)
            .targetAmount(100L)
            .crossedThreshold(crossed)
            .contributorTotal(10L)
            .firstContributedAt(Instant.now())
            .build();
    }

    private Challenge challenge(Long id) {
        return Challenge.builder()
            .id(id)
            .name("Challenge " + id)
            .challengeType(ChallengeType.CRAFT)
            .targetAmount(100L)
            .enabled(true)
            .status(ChallengeStatus.ACTIVE)
            .build();
    }

    @Test
    void testReportProgress_AcceptedIsMirrored() {
        // Arrange
        ProgressResult result = accepted(1L, 40L, false);
        when(challengeStore.applyProgress(eq(1L), eq("player-1"), eq(10L), eq("event-1"), any(Instant.class)))
            .thenReturn(result);

        // Act
        ProgressResult actual = aggregationEngine.reportProgress(1L, "player-1", 10L, " event-1 ");

        // Assert
        assertSame(result, actual);
        verify(leaderboardMirror).publish(result);
        verifyNoInteractions(completionCoordinator);
    }

    @Test
    void testReportProgress_CrossingHandsOffToCoordinator() {
        // Arrange
        ProgressResult result = accepted(1L, 105L, true);
        when(challengeStore.applyProgress(eq(1L), eq("player-1"), eq(10L), isNull(), any(Instant.class)))
            .thenReturn(result);

        // Act
        aggregationEngine.reportProgress(1L, "player-1", 10L, null);

        // Assert
        verify(completionCoordinator).onThresholdCrossed(1L);
    }

    @Test
    void testReportProgress_DuplicateNotMirrored() {
        // Arrange
        Challenge challenge = challenge(1L);
        challenge.setCurrentAmount(40L);
        when(challengeStore.applyProgress(eq(1L), eq("player-1"), eq(10L), eq("event-1"), any(Instant.class)))
            .thenReturn(ProgressResult.duplicate(challenge, "player-1", 10L));

        // Act
        ProgressResult result = aggregationEngine.reportProgress(1L, "player-1", 10L, "event-1");

        // Assert
        assertTrue(result.isDuplicate());
        assertEquals(40L, result.getNewTotal());
        verifyNoInteractions(leaderboardMirror, completionCoordinator);
    }

    @Test
    void testReportProgress_BlankContributorRejected() {
        assertThrows(InvalidRequestException.class, () -> aggregationEngine.reportProgress(1L, "  ", 10L, null));
        verifyNoInteractions(challengeStore);
    }

    @Test
    void testReportProgress_NonPositiveAmountRejected() {
        assertThrows(InvalidRequestException.class, () -> aggregationEngine.reportProgress(1L, "player-1", 0L, null));
        assertThrows(InvalidRequestException.class, () -> aggregationEngine.reportProgress(1L, "player-1", -5L, null));
        verifyNoInteractions(challengeStore);
    }

    @Test
    void testReportProgress_OversizedKeyRejected() {
        String key = "k".repeat(129);

        assertThrows(InvalidRequestException.class, () -> aggregationEngine.reportProgress(1L, "player-1", 1L, key));
        verifyNoInteractions(challengeStore);
    }

    @Test
    void testReportProgressByType_ReportsEveryMatchingChallenge() {
        // Arrange
        when(challengeStore.loadSettings()).thenReturn(ChallengeSettings.defaults());
        when(challengeStore.findAcceptingChallenges(ChallengeType.CRAFT)).thenReturn(List.of(challenge(1L), challenge(2L)));
        when(challengeStore.applyProgress(eq(1L), eq("player-1"), eq(10L), isNull(), any(Instant.class)))
            .thenReturn(accepted(1L, 20L, false));
        when(challengeStore.applyProgress(eq(2L), eq("player-1"), eq(10L), isNull(), any(Instant.class)))
            .thenReturn(accepted(2L, 30L, false));

        // Act
        List<ProgressResult> results = aggregationEngine.reportProgressByType(ChallengeType.CRAFT, "player-1", 10L, null);

        // Assert
        assertEquals(2, results.size());
        assertEquals(1L, results.get(0).getChallengeId());
        assertEquals(2L, results.get(1).getChallengeId());
    }

    @Test
    void testReportProgressByType_SkipsChallengesThatStoppedAccepting() {
        // Arrange
        when(challengeStore.loadSettings()).thenReturn(ChallengeSettings.defaults());
        when(challengeStore.findAcceptingChallenges(ChallengeType.CRAFT))
            .thenReturn(List.of(challenge(1L), challenge(2L), challenge(3L)));
        when(challengeStore.applyProgress(eq(1L), anyString(), anyLong(), any(), any(Instant.class)))
            .thenThrow(new InvalidRequestException("Challenge 1 is not accepting progress (status: COMPLETING)"));
        when(challengeStore.applyProgress(eq(2L), anyString(), anyLong(), any(), any(Instant.class)))
            .thenThrow(new ChallengeNotFoundException(2L));
        when(challengeStore.applyProgress(eq(3L), anyString(), anyLong(), any(), any(Instant.class)))
            .thenReturn(accepted(3L, 15L, false));

        // Act
        List<ProgressResult> results = aggregationEngine.reportProgressByType(ChallengeType.CRAFT, "player-1", 10L, null);

        // Assert
        assertEquals(1, results.size());
        assertEquals(3L, results.get(0).getChallengeId());
    }

    @Test
    void testReportProgressByType_NoMatchesIsEmpty() {
        when(challengeStore.loadSettings()).thenReturn(ChallengeSettings.defaults());
        when(challengeStore.findAcceptingChallenges(ChallengeType.DONATE)).thenReturn(List.of());

        List<ProgressResult> results = aggregationEngine.reportProgressByType(ChallengeType.DONATE, "player-1", 1L, null);

        assertTrue(results.isEmpty());
    }

    @Test
    void testReportProgressByType_SettingsDisabled() {
        // Arrange
        ChallengeSettings settings = ChallengeSettings.defaults();
        settings.setEnabled(false);
        when(challengeStore.loadSettings()).thenReturn(settings);

        // Act & Assert
        assertThrows(InvalidRequestException.class,
            () -> aggregationEngine.reportProgressByType(ChallengeType.CATCH, "player-1", 1L, null));
        verify(challengeStore, never()).findAcceptingChallenges(any());
    }
}
