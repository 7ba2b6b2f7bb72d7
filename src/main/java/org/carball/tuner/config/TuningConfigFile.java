package org.carball.tuner.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;

/**
 * YAML tuning file. Absent keys leave the corresponding parameter untouched.
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class TuningConfigFile {

    @JsonProperty("threshold")
    private Double threshold;

    @JsonProperty("space_budget_bytes")
    private Long spaceBudgetBytes;

    @JsonProperty("max_index_width")
    private Integer maxIndexWidth;

    @JsonProperty("max_tune_iterations")
    private Integer maxTuneIterations;

    @JsonProperty("max_refine_iterations")
    private Integer maxRefineIterations;

    @JsonProperty("parallelism")
    private Integer parallelism;

    @JsonProperty("retry_attempts")
    private Integer retryAttempts;

    @JsonProperty("retry_backoff_millis")
    private Long retryBackoffMillis;

    @JsonProperty("query_timeout_seconds")
    private Integer queryTimeoutSeconds;

    public void applyTo(TuningParameters.TuningParametersBuilder builder) {
        if (threshold != null) {
            builder.threshold(threshold);
        }
        if (spaceBudgetBytes != null) {
            builder.spaceBudgetBytes(spaceBudgetBytes);
        }
        if (maxIndexWidth != null) {
            builder.maxIndexWidth(maxIndexWidth);
        }
        if (maxTuneIterations != null) {
            builder.maxTuneIterations(maxTuneIterations);
        }
        if (maxRefineIterations != null) {
            builder.maxRefineIterations(maxRefineIterations);
        }
        if (parallelism != null) {
            builder.parallelism(parallelism);
        }
        if (retryAttempts != null) {
            builder.retryAttempts(retryAttempts);
        }
        if (retryBackoffMillis != null) {
            builder.retryBackoffMillis(retryBackoffMillis);
        }
        if (queryTimeoutSeconds != null) {
            builder.queryTimeoutSeconds(queryTimeoutSeconds);
        }
    }
}
