package work.lcod.pipeline.api;

import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import work.lcod.pipeline.compose.MergeStatus;

/**
 * Result for one target document. {@code mergeStatus} and {@code content} are null on failure;
 * {@code error} is null on success.
 */
public record DocumentOutcome(
    Path path,
    MergeStatus mergeStatus,
    boolean written,
    List<String> warnings,
    String content,
    String error
) {
    public DocumentOutcome {
        warnings = List.copyOf(warnings);
    }

    public static DocumentOutcome success(Path path, MergeStatus status, boolean written, List<String> warnings, String content) {
        return new DocumentOutcome(path, status, written, warnings, content, null);
    }

    public static DocumentOutcome failure(Path path, String error) {
        return new DocumentOutcome(path, null, false, List.of(), null, error);
    }

    public boolean failed() {
        return error != null;
    }

    public Map<String, Object> toSerializableMap() {
        Map<String, Object> serializable = new LinkedHashMap<>();
        serializable.put("path", path.toString());
        serializable.put("status", failed() ? "failed" : mergeStatus.tag());
        serializable.put("written", written);
        if (!warnings.isEmpty()) {
            serializable.put("warnings", warnings);
        }
        if (failed()) {
            serializable.put("error", error);
        }
        return serializable;
    }
}
