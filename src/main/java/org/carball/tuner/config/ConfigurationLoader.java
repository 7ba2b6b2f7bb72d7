package org.carball.tuner.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.function.Consumer;

@Slf4j
public class ConfigurationLoader {

    private final Map<String, String> environment;

    public ConfigurationLoader() {
        this(System.getenv());
    }

    public ConfigurationLoader(Map<String, String> environment) {
        this.environment = environment;
    }

    /**
     * Loads configuration using the hierarchy: CLI args > env vars > defaults
     */
    public TuningParameters loadConfiguration(String[] args) {
        return loadConfiguration(null, args);
    }

    /**
     * Loads configuration using the hierarchy: CLI args > env vars > YAML file > defaults
     */
    public TuningParameters loadConfiguration(Path configFile, String[] args) {
        log.debug("Loading configuration");

        TuningParameters.TuningParametersBuilder builder = TuningParameters.builder();

        // 1. YAML file
        applyConfigFile(builder, configFile);

        // 2. Environment variables
        applyEnvironmentVariables(builder);

        // 3. CLI arguments (highest priority)
        applyCLIArguments(builder, args);

        TuningParameters parameters = builder.build();
        parameters.validate();

        log.info("Configuration loaded: {}", parameters.getConfigurationSummary());
        return parameters;
    }

    private void applyConfigFile(TuningParameters.TuningParametersBuilder builder, Path configFile) {
        if (configFile == null) {
            return;
        }
        if (!Files.exists(configFile)) {
            log.warn("Tuning config file not found: {}, using defaults", configFile);
            return;
        }

        try {
            ObjectMapper mapper = new ObjectMapper(new YAMLFactory());
            TuningConfigFile file = mapper.readValue(configFile.toFile(), TuningConfigFile.class);
            if (file != null) {
                file.applyTo(builder);
            }
            log.info("Loaded tuning configuration from: {}", configFile);
        } catch (IOException e) {
            log.error("Failed to load tuning config from {}: {}, using defaults", configFile, e.getMessage());
        }
    }

    private void applyEnvironmentVariables(TuningParameters.TuningParametersBuilder builder) {
        applyVariable("TUNER_THRESHOLD", v -> builder.threshold(Double.parseDouble(v)));
        applyVariable("TUNER_SPACE_BUDGET", v -> builder.spaceBudgetBytes(parseBytes(v)));
        applyVariable("TUNER_MAX_INDEX_WIDTH", v -> builder.maxIndexWidth(Integer.parseInt(v)));
        applyVariable("TUNER_PARALLELISM", v -> builder.parallelism(Integer.parseInt(v)));
        applyVariable("TUNER_RETRY_ATTEMPTS", v -> builder.retryAttempts(Integer.parseInt(v)));
        applyVariable("TUNER_QUERY_TIMEOUT", v -> builder.queryTimeoutSeconds(Integer.parseInt(v)));
    }

    private void applyVariable(String name, Consumer<String> setter) {
        String value = environment.get(name);
        if (value == null) {
            return;
        }
        try {
            setter.accept(value.trim());
        } catch (NumberFormatException e) {
            log.warn("Invalid numeric value for {}: {}", name, value);
        }
    }

    private void applyCLIArguments(TuningParameters.TuningParametersBuilder builder, String[] args) {
        for (int i = 0; i < args.length - 1; i++) {
            String arg = args[i];
            String value = args[i + 1];

            try {
                switch (arg) {
                    case "--threshold":
                    case "-t":
                        builder.threshold(Double.parseDouble(value));
                        break;
                    case "--space-budget":
                    case "-b":
                        builder.spaceBudgetBytes(parseBytes(value));
                        break;
                    case "--max-index-width":
                    case "-w":
                        builder.maxIndexWidth(Integer.parseInt(value));
                        break;
                    case "--parallelism":
                        builder.parallelism(Integer.parseInt(value));
                        break;
                    case "--max-tune-iterations":
                        builder.maxTuneIterations(Integer.parseInt(value));
                        break;
                    case "--max-refine-iterations":
                        builder.maxRefineIterations(Integer.parseInt(value));
                        break;
                    case "--retry-attempts":
                        builder.retryAttempts(Integer.parseInt(value));
                        break;
                    case "--query-timeout":
                        builder.queryTimeoutSeconds(Integer.parseInt(value));
                        break;
                }
            } catch (NumberFormatException e) {
                log.warn("Invalid numeric value for {}: {}", arg, value);
            }
        }
    }

    /**
     * Accepts plain integers and scientific notation such as {@code 6e9}.
     */
    static long parseBytes(String value) {
        try {
            return Long.parseLong(value.trim());
        } catch (NumberFormatException e) {
            return (long) Double.parseDouble(value.trim());
        }
    }

    /**
     * Returns help text for tuning configuration options.
     */
    public static String getConfigurationHelp() {
        return """
            Tuning Options:
              --threshold, -t <0..1>        Load-skew tolerance for routing (default: 0.5)
              --space-budget, -b <bytes>    Index space budget per replica (default: 6e9)
              --max-index-width, -w <num>   Widest index the advisor may recommend (default: 2)
              --parallelism <num>           Replicas evaluated concurrently (default: 1)
              --max-tune-iterations <num>   Iteration cap for cluster-and-tune (default: 50)
              --max-refine-iterations <num> Iteration cap for refinement (default: 100)
              --retry-attempts <num>        Attempts per oracle call (default: 3)
              --query-timeout <seconds>     Timeout per oracle call (default: 30)

            Environment Variables:
              TUNER_THRESHOLD               Same as --threshold
              TUNER_SPACE_BUDGET            Same as --space-budget
              TUNER_MAX_INDEX_WIDTH         Same as --max-index-width
              TUNER_PARALLELISM             Same as --parallelism
              TUNER_RETRY_ATTEMPTS          Same as --retry-attempts
              TUNER_QUERY_TIMEOUT           Same as --query-timeout

            Priority Order (highest to lowest):
              1. CLI arguments
              2. Environment variables
              3. --config YAML file
              4. Built-in defaults
            """;
    }
}
