package work.lcod.pipeline.compose;

import java.util.Locale;

/**
 * How a document was produced. Used for reporting only.
 */
public enum MergeStatus {
    /** No previous file. */
    CREATED,
    /** Previous file merged, its custom region kept. */
    MERGED,
    /** Previous file merged; it had no custom region, so the example was written. */
    UPDATED,
    /** Generated from scratch over a previous file, recovering its custom jobs. */
    REBUILT;

    public String tag() {
        return name().toLowerCase(Locale.ROOT);
    }
}
