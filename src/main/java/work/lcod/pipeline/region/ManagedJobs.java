package work.lcod.pipeline.region;

import java.util.List;
import java.util.Set;

/**
 * Jobs owned outright by the generator. Any other job under {@code jobs} belongs to the user.
 */
public final class ManagedJobs {
    public static final String CHANGES = "changes";
    public static final String VERSION = "version";
    public static final String GATE = "gate";
    public static final String TAG = "tag";
    public static final String PROMOTE = "promote";
    public static final String RELEASE = "release";

    /** Entry after which the custom region is written. */
    public static final List<String> REGION_ANCHOR = List.of("jobs", VERSION);

    private static final Set<String> NAMES = Set.of(CHANGES, VERSION, GATE, TAG, PROMOTE, RELEASE);

    private ManagedJobs() {}

    public static boolean isManaged(String jobName) {
        return NAMES.contains(jobName);
    }
}
