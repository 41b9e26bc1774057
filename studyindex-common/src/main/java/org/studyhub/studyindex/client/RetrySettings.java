package org.studyhub.studyindex.client;

import java.time.Duration;

/**
 * Attempt budgets for the three store retry policies.
 *
 * @param connectionAttempts heartbeat attempts per connection check
 * @param collectionAttempts attempts for collection lookup/creation on transport errors
 * @param searchAttempts     attempts per similarity query, reconnecting before each retry
 * @param baseDelay          wait before the first retry; doubles afterwards
 */
public record RetrySettings(int connectionAttempts, int collectionAttempts, int searchAttempts, Duration baseDelay) {

    public static RetrySettings defaults() {
        return new RetrySettings(3, 3, 7, Duration.ofMillis(500));
    }
}
