package work.lcod.pipeline.region;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.lcod.pipeline.yaml.YamlEmitter;
import work.lcod.pipeline.yaml.YamlMapping;

/**
 * Turns user jobs found outside the markers into custom region text so a rebuild
 * does not drop them. Each job is serialized on its own, with its comments.
 */
public final class JobDemoter {
    private static final Logger log = LoggerFactory.getLogger(JobDemoter.class);

    public record Demoted(List<String> names, List<String> blocks) {}

    /**
     * @param jobs  the {@code jobs} mapping of the previous document
     * @param taken job names already present in the custom region
     */
    public Demoted demote(YamlMapping jobs, Set<String> taken) {
        var names = new ArrayList<String>();
        var blocks = new ArrayList<String>();
        for (var entry : jobs.entries()) {
            var name = entry.getKey();
            if (ManagedJobs.isManaged(name) || taken.contains(name)) {
                continue;
            }
            names.add(name);
            blocks.add(YamlEmitter.emitEntry(name, entry.getValue(), CustomRegion.INDENT.length()));
        }
        if (!names.isEmpty()) {
            log.debug("Moving {} custom job(s) into the custom region: {}", names.size(), String.join(", ", names));
        }
        return new Demoted(List.copyOf(names), List.copyOf(blocks));
    }
}
