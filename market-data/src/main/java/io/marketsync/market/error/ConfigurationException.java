package io.marketsync.market.error;

import java.util.List;

/**
 * Missing or invalid settings. Raised before any ticker is processed.
 */
public class ConfigurationException extends RuntimeException {
    private final List<String> problems;

    public ConfigurationException(List<String> problems) {
        super("invalid configuration: " + String.join("; ", problems));
        this.problems = List.copyOf(problems);
    }

    public ConfigurationException(String problem) {
        this(List.of(problem));
    }

    public List<String> problems() { return problems; }
}
