package com.communitychallenge.platform.service;

import com.communitychallenge.platform.config.ChallengeProperties;
import com.communitychallenge.platform.exception.ChallengeStateException;
import com.communitychallenge.platform.exception.RewardDispatchException;
import com.communitychallenge.platform.model.Challenge;
import com.communitychallenge.platform.model.ChallengeSettings;
import com.communitychallenge.platform.model.ChallengeStatus;
import com.communitychallenge.platform.model.ChallengeType;
import com.communitychallenge.platform.model.ContributionEntry;
import com.communitychallenge.platform.model.RecoverySummary;
import com.communitychallenge.platform.model.RewardGrant;
import com.communitychallenge.platform.model.RewardGrantStatus;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.core.task.TaskExecutor;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.retry.support.RetryTemplate;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class CompletionCoordinatorTest {

    @Mock
    private ChallengeStore challengeStore;

    @Mock
    private RewardDispatcher rewardDispatcher;

    @Mock
    private Announcer announcer;

    private ChallengeProperties properties;
    private CompletionCoordinator coordinator;

    private Challenge challenge;
    private final Long challengeId = 21L;
    private final Instant created = Instant.parse("2024-05-01T12:00:00Z");

    @BeforeEach
    void setUp() {
        properties = new ChallengeProperties();
        properties.getRecovery().setStaleAfter(Duration.ofMinutes(10));
        coordinator = newCoordinator(Runnable::run);

        challenge = Challenge.builder()
            .id(challengeId)
            .name("Harvest Festival")
            .challengeType(ChallengeType.COLLECT)
            .targetAmount(100L)
            .rewardItem("Golden Hoe")
            .rewardQuantity(2)
            .enabled(true)
            .status(ChallengeStatus.COMPLETING)
            .currentAmount(110L)
            .createdAt(created)
            .completionStartedAt(created.plusSeconds(60))
            .build();
    }

    private CompletionCoordinator newCoordinator(TaskExecutor executor) {
        RetryTemplate retryTemplate = RetryTemplate.builder()
            .maxAttempts(3)
            .noBackoff()
            .retryOn(RewardDispatchException.class)
            .build();
        return new CompletionCoordinator(challengeStore, rewardDispatcher, announcer, retryTemplate, executor, properties);
    }

    private List<ContributionEntry> contributors() {
        return List.of(
            ContributionEntry.builder().challengeId(challengeId).contributorId("alice")
                .amountContributed(60L).firstContributedAt(created).build(),
            ContributionEntry.builder().challengeId(challengeId).contributorId("bob")
                .amountContributed(50L).firstContributedAt(created.plusSeconds(5)).build());
    }

    private void stubWorkflow(Long announcementChannelId) {
        when(challengeStore.claimCompletion(eq(challengeId), any(Instant.class))).thenReturn(true);
        when(challengeStore.findChallenge(challengeId)).thenReturn(Optional.of(challenge));
        when(challengeStore.snapshotContributions(challengeId)).thenReturn(contributors());
        ChallengeSettings settings = ChallengeSettings.defaults();
        settings.setAnnouncementChannelId(announcementChannelId);
        when(challengeStore.loadSettings()).thenReturn(settings);
        when(challengeStore.markCompleted(eq(challengeId), any(Instant.class))).thenReturn(true);
    }

    @Test
    void testCompleteIfReached_ClaimLostDoesNothing() {
        // Arrange
        when(challengeStore.claimCompletion(eq(challengeId), any(Instant.class))).thenReturn(false);

        // Act
        boolean won = coordinator.completeIfReached(challengeId);

        // Assert
        assertFalse(won);
        verifyNoInteractions(rewardDispatcher, announcer);
        verify(challengeStore, never()).markCompleted(anyLong(), any());
    }

    @Test
    void testCompleteIfReached_GrantsEveryContributorAndAnnounces() {
        // Arrange
        stubWorkflow(42L);
        when(challengeStore.findRewardGrant(eq(challengeId), anyString())).thenReturn(Optional.empty());
        when(rewardDispatcher.grant(anyString(), eq("Golden Hoe"), eq(2))).thenReturn(true);
        when(challengeStore.recordRewardGrant(any(RewardGrant.class))).thenAnswer(invocation -> invocation.getArgument(0));

        // Act
        boolean won = coordinator.completeIfReached(challengeId);

        // Assert
        assertTrue(won);
        verify(rewardDispatcher).grant("alice", "Golden Hoe", 2);
        verify(rewardDispatcher).grant("bob", "Golden Hoe", 2);
        verify(announcer).announce(42L, "Harvest Festival", 110L, 2);
        verify(challengeStore).markAnnounced(eq(challengeId), any(Instant.class));
        verify(challengeStore).markCompleted(eq(challengeId), any(Instant.class));

        ArgumentCaptor<RewardGrant> captor = ArgumentCaptor.forClass(RewardGrant.class);
        verify(challengeStore, times(2)).recordRewardGrant(captor.capture());
        captor.getAllValues().forEach(grant -> {
            assertEquals(RewardGrantStatus.GRANTED, grant.getStatus());
            assertEquals(1, grant.getAttempts());
            assertNotNull(grant.getGrantedAt());
        });
    }

    @Test
    void testRunWorkflow_SkipsContributorsAlreadyGranted() {
        // Arrange - resuming after a crash that happened between two grants
        stubWorkflow(null);
        RewardGrant aliceGrant = RewardGrant.builder()
            .challengeId(challengeId)
            .contributorId("alice")
            .status(RewardGrantStatus.GRANTED)
            .build();
        when(challengeStore.findRewardGrant(challengeId, "alice")).thenReturn(Optional.of(aliceGrant));
        when(challengeStore.findRewardGrant(challengeId, "bob")).thenReturn(Optional.empty());
        when(rewardDispatcher.grant("bob", "Golden Hoe", 2)).thenReturn(true);
        when(challengeStore.recordRewardGrant(any(RewardGrant.class))).thenAnswer(invocation -> invocation.getArgument(0));

        // Act
        coordinator.completeIfReached(challengeId);

        // Assert
        verify(rewardDispatcher, never()).grant(eq("alice"), anyString(), anyInt());
        verify(rewardDispatcher).grant("bob", "Golden Hoe", 2);
    }

    @Test
    void testRunWorkflow_ExhaustedRetriesRecordFailureAndComplete() {
        // Arrange
        stubWorkflow(null);
        when(challengeStore.findRewardGrant(eq(challengeId), anyString())).thenReturn(Optional.empty());
        when(rewardDispatcher.grant("alice", "Golden Hoe", 2)).thenThrow(new IllegalStateException("inventory full"));
        when(rewardDispatcher.grant("bob", "Golden Hoe", 2)).thenReturn(true);
        when(challengeStore.recordRewardGrant(any(RewardGrant.class))).thenAnswer(invocation -> invocation.getArgument(0));

        // Act
        coordinator.completeIfReached(challengeId);

        // Assert
        verify(rewardDispatcher, times(3)).grant("alice", "Golden Hoe", 2);
        ArgumentCaptor<RewardGrant> captor = ArgumentCaptor.forClass(RewardGrant.class);
        verify(challengeStore, times(2)).recordRewardGrant(captor.capture());

        RewardGrant aliceOutcome = captor.getAllValues().get(0);
        assertEquals("alice", aliceOutcome.getContributorId());
        assertEquals(RewardGrantStatus.FAILED, aliceOutcome.getStatus());
        assertEquals(3, aliceOutcome.getAttempts());
        assertTrue(aliceOutcome.getLastError().contains("inventory full"));

        assertEquals(RewardGrantStatus.GRANTED, captor.getAllValues().get(1).getStatus());
        verify(challengeStore).markCompleted(eq(challengeId), any(Instant.class));
    }

    @Test
    void testRunWorkflow_DeclinedGrantIsRetried() {
        // Arrange
        stubWorkflow(null);
        when(challengeStore.findRewardGrant(eq(challengeId), anyString())).thenReturn(Optional.empty());
        when(rewardDispatcher.grant("alice", "Golden Hoe", 2)).thenReturn(false, true);
        when(rewardDispatcher.grant("bob", "Golden Hoe", 2)).thenReturn(true);
        when(challengeStore.recordRewardGrant(any(RewardGrant.class))).thenAnswer(invocation -> invocation.getArgument(0));

        // Act
        coordinator.completeIfReached(challengeId);

        // Assert
        ArgumentCaptor<RewardGrant> captor = ArgumentCaptor.forClass(RewardGrant.class);
        verify(challengeStore, times(2)).recordRewardGrant(captor.capture());
        assertEquals(RewardGrantStatus.GRANTED, captor.getAllValues().get(0).getStatus());
        assertEquals(2, captor.getAllValues().get(0).getAttempts());
    }

    @Test
    void testRunWorkflow_AnnouncementFailureDoesNotBlockCompletion() {
        // Arrange
        challenge.setRewardQuantity(0);
        stubWorkflow(42L);
        doThrow(new IllegalStateException("chat offline"))
            .when(announcer).announce(anyLong(), anyString(), anyLong(), anyInt());

        // Act
        coordinator.completeIfReached(challengeId);

        // Assert - one retry, then move on
        verify(announcer, times(2)).announce(42L, "Harvest Festival", 110L, 2);
        verify(challengeStore).markAnnounced(eq(challengeId), any(Instant.class));
        verify(challengeStore).markCompleted(eq(challengeId), any(Instant.class));
        verifyNoInteractions(rewardDispatcher);
    }

    @Test
    void testRunWorkflow_NoChannelSkipsAnnouncement() {
        // Arrange
        challenge.setRewardQuantity(0);
        stubWorkflow(null);

        // Act
        coordinator.completeIfReached(challengeId);

        // Assert
        verifyNoInteractions(announcer);
        verify(challengeStore).markAnnounced(eq(challengeId), any(Instant.class));
    }

    @Test
    void testRunWorkflow_AlreadyAnnouncedNotRepeated() {
        // Arrange
        challenge.setRewardQuantity(0);
        challenge.setAnnouncedAt(created.plusSeconds(90));
        when(challengeStore.claimCompletion(eq(challengeId), any(Instant.class))).thenReturn(true);
        when(challengeStore.findChallenge(challengeId)).thenReturn(Optional.of(challenge));
        when(challengeStore.snapshotContributions(challengeId)).thenReturn(contributors());
        when(challengeStore.markCompleted(eq(challengeId), any(Instant.class))).thenReturn(true);

        // Act
        coordinator.completeIfReached(challengeId);

        // Assert
        verifyNoInteractions(announcer);
        verify(challengeStore, never()).loadSettings();
        verify(challengeStore, never()).markAnnounced(anyLong(), any());
    }

    @Test
    void testRecoverStalled_StartupResumesAndClaims() {
        // Arrange
        Challenge reached = Challenge.builder()
            .id(22L)
            .name("Trade Week")
            .challengeType(ChallengeType.TRADE)
            .targetAmount(10L)
            .rewardQuantity(0)
            .enabled(true)
            .status(ChallengeStatus.COMPLETING)
            .currentAmount(12L)
            .announcedAt(created)
            .build();
        challenge.setRewardQuantity(0);
        challenge.setAnnouncedAt(created);

        when(challengeStore.findCompletingStartedBefore(any(Instant.class))).thenReturn(List.of(challenge));
        when(challengeStore.findReachedButUnclaimed()).thenReturn(List.of(reached));
        when(challengeStore.claimCompletion(eq(22L), any(Instant.class))).thenReturn(true);
        when(challengeStore.findChallenge(challengeId)).thenReturn(Optional.of(challenge));
        when(challengeStore.findChallenge(22L)).thenReturn(Optional.of(reached));
        when(challengeStore.snapshotContributions(anyLong())).thenReturn(List.of());
        when(challengeStore.markCompleted(anyLong(), any(Instant.class))).thenReturn(true);

        // Act
        RecoverySummary summary = coordinator.recoverStalled(true);

        // Assert
        assertEquals(1, summary.getResumed());
        assertEquals(1, summary.getClaimed());
        verify(challengeStore).markCompleted(eq(challengeId), any(Instant.class));
        verify(challengeStore).markCompleted(eq(22L), any(Instant.class));
    }

    @Test
    void testRecoverStalled_PeriodicOnlyLooksAtStaleClaims() {
        // Arrange
        when(challengeStore.findCompletingStartedBefore(any(Instant.class))).thenReturn(List.of());
        when(challengeStore.findReachedButUnclaimed()).thenReturn(List.of());
        Instant before = Instant.now();

        // Act
        RecoverySummary summary = coordinator.recoverStalled(false);

        // Assert
        assertFalse(summary.hasWork());
        ArgumentCaptor<Instant> cutoff = ArgumentCaptor.forClass(Instant.class);
        verify(challengeStore).findCompletingStartedBefore(cutoff.capture());
        assertFalse(cutoff.getValue().isAfter(before.minus(Duration.ofMinutes(10)).plusSeconds(5)));
    }

    @Test
    void testRetryFailedRewards_RequiresCompletedChallenge() {
        when(challengeStore.getChallenge(challengeId)).thenReturn(challenge);

        assertThrows(ChallengeStateException.class, () -> coordinator.retryFailedRewards(challengeId));
        verifyNoInteractions(rewardDispatcher);
    }

    @Test
    void testRetryFailedRewards_RedispatchesFailures() {
        // Arrange
        challenge.setStatus(ChallengeStatus.COMPLETED);
        RewardGrant failed = RewardGrant.builder()
            .challengeId(challengeId)
            .contributorId("bob")
            .status(RewardGrantStatus.FAILED)
            .attempts(3)
            .build();
        when(challengeStore.getChallenge(challengeId)).thenReturn(challenge);
        when(challengeStore.findRewardFailures(challengeId)).thenReturn(List.of(failed));
        when(challengeStore.claimRewardRetry(eq(challengeId), eq("bob"), any(Instant.class), any(Instant.class)))
            .thenReturn(true);
        when(rewardDispatcher.grant("bob", "Golden Hoe", 2)).thenReturn(true);
        when(challengeStore.recordRewardGrant(any(RewardGrant.class))).thenAnswer(invocation -> invocation.getArgument(0));

        // Act
        List<RewardGrant> outcomes = coordinator.retryFailedRewards(challengeId);

        // Assert
        assertEquals(1, outcomes.size());
        assertEquals(RewardGrantStatus.GRANTED, outcomes.get(0).getStatus());
    }

    @Test
    void testRetryFailedRewards_GrantClaimedElsewhereIsNotDispatched() {
        // Arrange
        challenge.setStatus(ChallengeStatus.COMPLETED);
        RewardGrant failed = RewardGrant.builder()
            .challengeId(challengeId)
            .contributorId("alice")
            .status(RewardGrantStatus.FAILED)
            .attempts(3)
            .build();
        when(challengeStore.getChallenge(challengeId)).thenReturn(challenge);
        when(challengeStore.findRewardFailures(challengeId)).thenReturn(List.of(failed));
        when(challengeStore.claimRewardRetry(eq(challengeId), eq("alice"), any(Instant.class), any(Instant.class)))
            .thenReturn(false);

        // Act
        List<RewardGrant> outcomes = coordinator.retryFailedRewards(challengeId);

        // Assert
        assertTrue(outcomes.isEmpty());
        verifyNoInteractions(rewardDispatcher);
        verify(challengeStore, never()).recordRewardGrant(any());
    }

    @Test
    void testRetryFailedRewards_StaleRetryCutoffUsesRecoveryWindow() {
        // Arrange
        challenge.setStatus(ChallengeStatus.COMPLETED);
        RewardGrant failed = RewardGrant.builder()
            .challengeId(challengeId)
            .contributorId("alice")
            .status(RewardGrantStatus.RETRYING)
            .build();
        when(challengeStore.getChallenge(challengeId)).thenReturn(challenge);
        when(challengeStore.findRewardFailures(challengeId)).thenReturn(List.of(failed));
        ArgumentCaptor<Instant> now = ArgumentCaptor.forClass(Instant.class);
        ArgumentCaptor<Instant> staleBefore = ArgumentCaptor.forClass(Instant.class);
        when(challengeStore.claimRewardRetry(eq(challengeId), eq("alice"), now.capture(), staleBefore.capture()))
            .thenReturn(false);

        // Act
        coordinator.retryFailedRewards(challengeId);

        // Assert
        assertEquals(Duration.ofMinutes(10), Duration.between(staleBefore.getValue(), now.getValue()));
    }

    @Test
    void testOnThresholdCrossed_RejectedExecutionLeftToRecovery() {
        // Arrange
        CompletionCoordinator saturated = newCoordinator(task -> {
            throw new TaskRejectedException("queue full");
        });

        // Act & Assert
        assertDoesNotThrow(() -> saturated.onThresholdCrossed(challengeId));
        verifyNoInteractions(challengeStore);
    }
}
