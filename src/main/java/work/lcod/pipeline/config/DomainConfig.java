package work.lcod.pipeline.config;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * One domain of the repository: the paths that belong to it and the job prefixes
 * it wants placeholders for.
 *
 * @param prefixes declared prefixes, or {@code null} when the legacy flags apply
 */
public record DomainConfig(
    List<String> paths,
    String description,
    List<String> prefixes,
    boolean testable,
    boolean deployable,
    boolean remoteTestable
) {
    public DomainConfig {
        paths = List.copyOf(Objects.requireNonNull(paths, "paths"));
        description = description == null ? "" : description;
        prefixes = prefixes == null ? null : List.copyOf(prefixes);
    }

    public static DomainConfig of(List<String> paths, List<String> prefixes) {
        return new DomainConfig(paths, "", prefixes, false, false, false);
    }

    /**
     * Declared prefixes, or those implied by the legacy flags in the order
     * {@code test}, {@code deploy}, {@code remote-test}.
     */
    public List<String> effectivePrefixes() {
        if (prefixes != null) {
            return prefixes;
        }
        var derived = new ArrayList<String>();
        if (testable) {
            derived.add("test");
        }
        if (deployable) {
            derived.add("deploy");
        }
        if (remoteTestable) {
            derived.add("remote-test");
        }
        return List.copyOf(derived);
    }
}
