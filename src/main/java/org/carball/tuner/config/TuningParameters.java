package org.carball.tuner.config;

import lombok.Builder;
import lombok.Data;
import lombok.extern.slf4j.Slf4j;

@Data
@Builder(toBuilder = true)
@Slf4j
public class TuningParameters {

    // Routing skew tolerance in [0, 1]
    @Builder.Default
    private double threshold = 0.5;

    // Advisor limits, per replica
    @Builder.Default
    private long spaceBudgetBytes = 6_000_000_000L;

    @Builder.Default
    private int maxIndexWidth = 2;

    // Convergence guards
    @Builder.Default
    private int maxTuneIterations = 50;

    @Builder.Default
    private int maxRefineIterations = 100;

    // Oracle access
    @Builder.Default
    private int parallelism = 1;

    @Builder.Default
    private int retryAttempts = 3;

    @Builder.Default
    private long retryBackoffMillis = 200;

    @Builder.Default
    private int queryTimeoutSeconds = 30;

    public static TuningParameters defaults() {
        return TuningParameters.builder().build();
    }

    /**
     * Rejects values the tuner cannot run with and logs warnings for values that are legal but unusual.
     */
    public void validate() {
        if (!(threshold >= 0.0 && threshold <= 1.0)) {
            throw new IllegalArgumentException("Threshold must be within [0, 1], got " + threshold);
        }
        if (spaceBudgetBytes < 0) {
            throw new IllegalArgumentException("Space budget must not be negative, got " + spaceBudgetBytes);
        }
        if (maxIndexWidth < 1) {
            throw new IllegalArgumentException("Maximum index width must be at least 1, got " + maxIndexWidth);
        }
        if (maxTuneIterations < 1 || maxRefineIterations < 1) {
            throw new IllegalArgumentException("Iteration caps must be at least 1, got "
                    + maxTuneIterations + " and " + maxRefineIterations);
        }
        if (parallelism < 1) {
            throw new IllegalArgumentException("Parallelism must be at least 1, got " + parallelism);
        }
        if (retryAttempts < 1) {
            throw new IllegalArgumentException("Retry attempts must be at least 1, got " + retryAttempts);
        }
        if (queryTimeoutSeconds < 1) {
            throw new IllegalArgumentException("Query timeout must be at least 1 second, got " + queryTimeoutSeconds);
        }

        if (spaceBudgetBytes == 0) {
            log.warn("Space budget is 0 bytes; every replica will be tuned without indexes");
        }
        if (maxIndexWidth > 4) {
            log.warn("Maximum index width {} makes candidate sets grow quickly", maxIndexWidth);
        }
        if (threshold == 0.0) {
            log.info("Threshold 0 routes every query to its cheapest replica");
        }

        log.debug("Using parameters - {}", getConfigurationSummary());
    }

    public String getConfigurationSummary() {
        return String.format("Threshold: %.2f | Budget: %,d bytes | Max width: %d | Parallelism: %d | Retries: %d",
                threshold, spaceBudgetBytes, maxIndexWidth, parallelism, retryAttempts);
    }
}
