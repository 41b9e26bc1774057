package org.studyhub.studyindex.client;

import io.github.resilience4j.core.IntervalFunction;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.Objects;
import java.util.function.Predicate;
import java.util.function.Supplier;

/**
 * Single retry wrapper shared by every store round trip.
 *
 * <p>Waits double after each failed attempt, starting at {@code baseDelay}
 * (0.5s, 1s, 2s, ... with the default delay). Failures rejected by {@code retryable}
 * are rethrown immediately; once {@code maxAttempts} is used up the last failure is rethrown.</p>
 *
 * @param name        policy name, used in log output
 * @param maxAttempts total attempts including the first call
 * @param baseDelay   wait before the first retry
 * @param retryable   decides whether a failure is worth another attempt
 */
@Slf4j
public record RetryPolicy(String name, int maxAttempts, Duration baseDelay, Predicate<Throwable> retryable) {

    private static final double BACKOFF_MULTIPLIER = 2.0d;

    public RetryPolicy {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(baseDelay, "baseDelay");
        Objects.requireNonNull(retryable, "retryable");
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be >= 1, got " + maxAttempts);
        }
        if (baseDelay.isNegative() || baseDelay.isZero()) {
            throw new IllegalArgumentException("baseDelay must be positive, got " + baseDelay);
        }
    }

    /**
     * Wait schedule between attempts; {@code backoff().apply(n)} is the delay in millis after attempt {@code n}.
     */
    public IntervalFunction backoff() {
        return IntervalFunction.ofExponentialBackoff(baseDelay, BACKOFF_MULTIPLIER);
    }

    /**
     * Runs {@code call} under this policy.
     *
     * @param call        the operation
     * @param beforeRetry hook run before every retry (not before the first attempt), may be {@code null}
     */
    public <T> T execute(Supplier<T> call, Runnable beforeRetry) {
        Retry retry = Retry.of(name, RetryConfig.custom()
                .maxAttempts(maxAttempts)
                .intervalFunction(backoff())
                .retryOnException(retryable)
                .build());

        retry.getEventPublisher().onRetry(event -> log.warn(
                "{}: attempt {}/{} failed ({}), retrying in {}ms",
                name, event.getNumberOfRetryAttempts(), maxAttempts,
                describe(event.getLastThrowable()), event.getWaitInterval().toMillis()));

        boolean[] firstAttempt = {true};
        Supplier<T> attempt = () -> {
            if (!firstAttempt[0] && beforeRetry != null) {
                beforeRetry.run();
            }
            firstAttempt[0] = false;
            return call.get();
        };
        return Retry.decorateSupplier(retry, attempt).get();
    }

    public void run(Runnable call, Runnable beforeRetry) {
        execute(() -> {
            call.run();
            return null;
        }, beforeRetry);
    }

    private static String describe(Throwable t) {
        if (t == null) {
            return "unknown";
        }
        return t.getClass().getSimpleName() + ": " + t.getMessage();
    }
}
