package work.lcod.pipeline.config;

import java.util.List;

/**
 * Invalid or unreadable pipeline configuration. Fatal for the whole run.
 *
 * <p>Validation reports every problem it found at once; {@link #problems()} lists them
 * and the message joins them after {@link #summary()}.
 */
public class ConfigurationException extends RuntimeException {
    private final String summary;
    private final List<String> problems;

    public ConfigurationException(String message) {
        this(message, (Throwable) null);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
        this.summary = message;
        this.problems = List.of(message);
    }

    public ConfigurationException(String summary, List<String> problems) {
        super(summary + ": " + String.join("; ", problems));
        this.summary = summary;
        this.problems = List.copyOf(problems);
    }

    public String summary() {
        return summary;
    }

    public List<String> problems() {
        return problems;
    }
}
