package work.lcod.pipeline.config;

import java.util.Locale;

/**
 * Where workflow steps find the pipeline's composite actions.
 */
public enum ActionSourceMode {
    /** {@code ./.github/actions/<name>} inside the repository. */
    LOCAL,
    /** Published actions, {@code <repository>/actions/<name>@<version>}. */
    REMOTE,
    /** {@code ./actions/<name>}, for the repository that develops the actions. */
    SOURCE;

    public static ActionSourceMode from(String value) {
        if (value == null || value.isBlank()) {
            return LOCAL;
        }
        try {
            return ActionSourceMode.valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException ex) {
            throw new ConfigurationException("Unsupported actionSourceMode: " + value);
        }
    }
}
