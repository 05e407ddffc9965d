package work.lcod.pipeline.compose;

import java.util.List;
import java.util.Objects;

/**
 * Serialized document plus how it was obtained.
 */
public record ComposeResult(String text, MergeStatus status, List<String> warnings) {
    public ComposeResult {
        Objects.requireNonNull(text, "text");
        Objects.requireNonNull(status, "status");
        warnings = List.copyOf(warnings);
    }
}
