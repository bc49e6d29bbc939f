package com.communitychallenge.platform.repository.impl;

import com.communitychallenge.platform.model.RetryQueueItem;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class JsonRetryQueueRepositoryTest {

    @TempDir
    Path dataDirectory;

    private RetryQueueItem item(String contributorId, long amount) {
        return RetryQueueItem.builder()
            .challengeId(1L)
            .generation(0)
            .contributorId(contributorId)
            .amountContributed(amount)
            .firstContributedAt(Instant.parse("2024-05-01T12:00:00Z"))
            .build();
    }

    @Test
    void testEnqueue_KeepsOnlyNewestTotalPerContributor() {
        JsonRetryQueueRepository repository = new JsonRetryQueueRepository(dataDirectory.toString());

        repository.enqueue(item("alice", 10L));
        repository.enqueue(item("alice", 25L));
        repository.enqueue(item("alice", 15L));
        repository.enqueue(item("bob", 5L));

        List<RetryQueueItem> items = repository.dequeue(10);
        assertEquals(2, items.size());
        RetryQueueItem alice = items.stream()
            .filter(queued -> queued.getContributorId().equals("alice"))
            .findFirst()
            .orElseThrow();
        assertEquals(25L, alice.getAmountContributed());
    }

    @Test
    void testEnqueue_DefaultsRetryCountAndCreatedAt() {
        JsonRetryQueueRepository repository = new JsonRetryQueueRepository(dataDirectory.toString());

        repository.enqueue(item("alice", 10L));

        RetryQueueItem queued = repository.dequeue(1).get(0);
        assertEquals(0, queued.getRetryCount());
        assertNotNull(queued.getCreatedAt());
    }

    @Test
    void testQueueSurvivesRestart() {
        // Arrange
        JsonRetryQueueRepository first = new JsonRetryQueueRepository(dataDirectory.toString());
        first.enqueue(item("alice", 10L));
        first.enqueue(item("bob", 20L));

        // Act
        JsonRetryQueueRepository reloaded = new JsonRetryQueueRepository(dataDirectory.toString());

        // Assert
        assertEquals(2, reloaded.size());
    }

    @Test
    void testDequeue_SkipsItemsPastMaxRetries() {
        JsonRetryQueueRepository repository = new JsonRetryQueueRepository(dataDirectory.toString());
        RetryQueueItem exhausted = item("alice", 10L);
        exhausted.setRetryCount(JsonRetryQueueRepository.MAX_RETRY_COUNT);
        repository.enqueue(exhausted);
        repository.enqueue(item("bob", 20L));

        List<RetryQueueItem> items = repository.dequeue(10);

        assertEquals(1, items.size());
        assertEquals("bob", items.get(0).getContributorId());
        assertEquals(0, repository.size());
    }

    @Test
    void testEnqueue_NullRejected() {
        JsonRetryQueueRepository repository = new JsonRetryQueueRepository(dataDirectory.toString());

        assertThrows(IllegalArgumentException.class, () -> repository.enqueue(null));
    }
}
