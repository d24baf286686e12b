package com.purchasingpower.newsgraph.pipeline;

import com.purchasingpower.newsgraph.config.NewsGraphProperties;
import com.purchasingpower.newsgraph.exception.BackendUnavailableException;
import lombok.extern.slf4j.Slf4j;

import java.util.function.Supplier;

/**
 * Retries idempotent graph operations while the backend is unavailable.
 *
 * <p>For attempt N (starting at 0) the delay before the next attempt is
 * {@code min(backoffMs * multiplier^N, maxBackoffMs)}. Only {@link BackendUnavailableException} is retried;
 * after the last attempt it is rethrown.
 */
@Slf4j
public class IdempotentWriteRetrier {

    @FunctionalInterface
    interface Sleeper {
        void sleep(long millis) throws InterruptedException;
    }

    private final NewsGraphProperties.Retry settings;
    private final Sleeper sleeper;

    public IdempotentWriteRetrier(NewsGraphProperties.Retry settings) {
        this(settings, Thread::sleep);
    }

    IdempotentWriteRetrier(NewsGraphProperties.Retry settings, Sleeper sleeper) {
        this.settings = settings;
        this.sleeper = sleeper;
    }

    public void run(String operation, Runnable action) {
        call(operation, () -> {
            action.run();
            return null;
        });
    }

    public <T> T call(String operation, Supplier<T> action) {
        int maxAttempts = Math.max(1, settings.getMaxAttempts());
        for (int attempt = 0; ; attempt++) {
            try {
                return action.get();
            } catch (BackendUnavailableException e) {
                if (attempt + 1 >= maxAttempts) {
                    log.error("❌ {} failed after {} attempt(s): {}", operation, attempt + 1, e.getMessage());
                    throw e;
                }
                long delay = delayMs(attempt);
                log.warn("⚠️  {} failed (attempt {}/{}): {}. Retrying in {}ms",
                        operation, attempt + 1, maxAttempts, e.getMessage(), delay);
                pause(delay, e);
            }
        }
    }

    long delayMs(int attempt) {
        double delay = settings.getBackoffMs() * Math.pow(settings.getMultiplier(), attempt);
        return (long) Math.min(delay, settings.getMaxBackoffMs());
    }

    private void pause(long delay, BackendUnavailableException cause) {
        try {
            sleeper.sleep(delay);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            cause.addSuppressed(e);
            throw cause;
        }
    }
}
