package work.lcod.pipeline.merge;

/**
 * A required operation could not be applied because part of its path is not a mapping.
 */
public class StructuralException extends RuntimeException {
    private final String path;

    public StructuralException(String path, String message) {
        super(message);
        this.path = path;
    }

    public String path() {
        return path;
    }
}
