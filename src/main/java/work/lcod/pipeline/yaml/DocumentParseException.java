package work.lcod.pipeline.yaml;

/**
 * Raised when existing workflow text cannot be read as a mapping document.
 */
public class DocumentParseException extends Exception {
    public DocumentParseException(String message) {
        super(message);
    }

    public DocumentParseException(String message, Throwable cause) {
        super(message, cause);
    }
}
