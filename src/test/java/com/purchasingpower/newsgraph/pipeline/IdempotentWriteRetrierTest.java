package com.purchasingpower.newsgraph.pipeline;

import com.purchasingpower.newsgraph.config.NewsGraphProperties;
import com.purchasingpower.newsgraph.exception.BackendUnavailableException;
import com.purchasingpower.newsgraph.exception.QueryRejectedException;
import com.purchasingpower.newsgraph.graph.BackendType;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

@DisplayName("Idempotent write retries")
class IdempotentWriteRetrierTest {

    private final List<Long> sleeps = new ArrayList<>();
    private NewsGraphProperties.Retry settings;

    @BeforeEach
    void setUp() {
        settings = new NewsGraphProperties.Retry();
        settings.setMaxAttempts(4);
        settings.setBackoffMs(500);
        settings.setMaxBackoffMs(1500);
        settings.setMultiplier(2.0);
    }

    @Test
    @DisplayName("Should grow the delay exponentially up to the cap")
    void cappedExponentialDelay() {
        IdempotentWriteRetrier retrier = new IdempotentWriteRetrier(settings, sleeps::add);

        assertEquals(500, retrier.delayMs(0));
        assertEquals(1000, retrier.delayMs(1));
        assertEquals(1500, retrier.delayMs(2));
        assertEquals(1500, retrier.delayMs(5));
    }

    @Test
    @DisplayName("Should retry while the backend is unavailable and return the eventual result")
    void retriesUntilSuccess() {
        // Given
        AtomicInteger calls = new AtomicInteger();
        IdempotentWriteRetrier retrier = new IdempotentWriteRetrier(settings, sleeps::add);

        // When
        String result = retrier.call("upsertArticle tg-1001", () -> {
            if (calls.incrementAndGet() < 3) {
                throw new BackendUnavailableException(BackendType.BOLT, "Connection reset");
            }
            return "done";
        });

        // Then
        assertEquals("done", result);
        assertEquals(3, calls.get());
        assertEquals(List.of(500L, 1000L), sleeps);
    }

    @Test
    @DisplayName("Should rethrow after the last attempt")
    void givesUp() {
        // Given
        AtomicInteger calls = new AtomicInteger();
        BackendUnavailableException failure = new BackendUnavailableException(BackendType.QUERY_API, "503");
        IdempotentWriteRetrier retrier = new IdempotentWriteRetrier(settings, sleeps::add);

        // When
        BackendUnavailableException thrown = assertThrows(BackendUnavailableException.class,
                () -> retrier.run("attachTopics tg-1003", () -> {
                    calls.incrementAndGet();
                    throw failure;
                }));

        // Then
        assertSame(failure, thrown);
        assertEquals(4, calls.get());
        assertEquals(List.of(500L, 1000L, 1500L), sleeps);
    }

    @Test
    @DisplayName("Should not retry rejected queries")
    void rejectedIsNotRetried() {
        // Given
        AtomicInteger calls = new AtomicInteger();
        IdempotentWriteRetrier retrier = new IdempotentWriteRetrier(settings, sleeps::add);

        // When / Then
        assertThrows(QueryRejectedException.class, () -> retrier.run("upsertArticle tg-1001", () -> {
            calls.incrementAndGet();
            throw new QueryRejectedException(BackendType.BOLT, "Invalid input", (String) null);
        }));
        assertEquals(1, calls.get());
        assertTrue(sleeps.isEmpty());
    }

    @Test
    @DisplayName("Should stop retrying and keep the interrupt flag when interrupted")
    void interrupted() {
        // Given
        IdempotentWriteRetrier retrier = new IdempotentWriteRetrier(settings, millis -> {
            throw new InterruptedException("shutdown");
        });

        // When
        BackendUnavailableException thrown = assertThrows(BackendUnavailableException.class,
                () -> retrier.run("upsertArticle tg-1001", () -> {
                    throw new BackendUnavailableException(BackendType.BOLT, "Connection reset");
                }));

        // Then
        assertTrue(Thread.interrupted());
        assertEquals(1, thrown.getSuppressed().length);
    }
}
