package org.studyhub.studyindex.client;

import org.junit.jupiter.api.Test;
import org.springframework.web.client.ResourceAccessException;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;

class RetryPolicyTest {

    private static final Duration FAST = Duration.ofMillis(1);

    @Test
    void defaultBackoffDoublesFromHalfASecond() {
        RetryPolicy policy = new RetryPolicy("heartbeat", 3, RetrySettings.defaults().baseDelay(), e -> true);

        assertEquals(500L, policy.backoff().apply(1));
        assertEquals(1000L, policy.backoff().apply(2));
        assertEquals(2000L, policy.backoff().apply(3));
    }

    @Test
    void retriesUntilSuccessAndRunsHookBeforeEachRetry() {
        AtomicInteger calls = new AtomicInteger();
        AtomicInteger hooks = new AtomicInteger();
        RetryPolicy policy = new RetryPolicy("test", 3, FAST, e -> true);

        String result = policy.execute(() -> {
            if (calls.incrementAndGet() < 3) {
                throw new ResourceAccessException("Connection refused");
            }
            return "ok";
        }, hooks::incrementAndGet);

        assertEquals("ok", result);
        assertEquals(3, calls.get());
        assertEquals(2, hooks.get());
    }

    @Test
    void rethrowsNonRetryableFailureWithoutRetrying() {
        AtomicInteger calls = new AtomicInteger();
        IllegalStateException logical = new IllegalStateException("bad request");
        RetryPolicy policy = new RetryPolicy("test", 5, FAST, e -> e instanceof ResourceAccessException);

        IllegalStateException thrown = assertThrows(IllegalStateException.class, () -> policy.execute(() -> {
            calls.incrementAndGet();
            throw logical;
        }, null));

        assertSame(logical, thrown);
        assertEquals(1, calls.get());
    }

    @Test
    void rethrowsLastFailureOnceBudgetIsExhausted() {
        AtomicInteger calls = new AtomicInteger();
        RetryPolicy policy = new RetryPolicy("test", 4, FAST, e -> true);

        assertThrows(ResourceAccessException.class, () -> policy.run(() -> {
            calls.incrementAndGet();
            throw new ResourceAccessException("Broken pipe");
        }, null));
        assertEquals(4, calls.get());
    }

    @Test
    void rejectsInvalidBudgets() {
        assertThrows(IllegalArgumentException.class, () -> new RetryPolicy("x", 0, FAST, e -> true));
        assertThrows(IllegalArgumentException.class, () -> new RetryPolicy("x", 1, Duration.ZERO, e -> true));
    }
}
