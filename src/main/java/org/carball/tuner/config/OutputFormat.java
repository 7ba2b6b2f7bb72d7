package org.carball.tuner.config;

public enum OutputFormat {
    JSON,
    MARKDOWN,
    BOTH
}
