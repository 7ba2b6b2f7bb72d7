package org.carball.tuner.replica;

import lombok.Builder;
import lombok.Value;

import java.time.Duration;

/**
 * Bounded exponential backoff for transient oracle failures.
 */
@Value
@Builder
public class RetryPolicy {
    @Builder.Default
    int maxAttempts = 3;
    @Builder.Default
    Duration initialBackoff = Duration.ofMillis(200);
    @Builder.Default
    double multiplier = 2.0;

    public static RetryPolicy defaults() {
        return RetryPolicy.builder().build();
    }

    public static RetryPolicy noRetries() {
        return RetryPolicy.builder().maxAttempts(1).build();
    }

    public Duration backoffBefore(int attempt) {
        // attempt is 1-based; the first attempt never waits
        if (attempt <= 1) {
            return Duration.ZERO;
        }
        return Duration.ofMillis((long) (initialBackoff.toMillis() * Math.pow(multiplier, attempt - 2)));
    }
}
