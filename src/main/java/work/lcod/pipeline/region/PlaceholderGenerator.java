package work.lcod.pipeline.region;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.lcod.pipeline.config.DomainConfig;

/**
 * Derives placeholder jobs from the domain configuration and merges the new ones
 * into a custom region.
 */
public final class PlaceholderGenerator {
    private static final Logger log = LoggerFactory.getLogger(PlaceholderGenerator.class);

    /**
     * One entry per declared prefix of every domain, sorted by prefix then domain.
     */
    public List<PlaceholderEntry> generate(Map<String, DomainConfig> domains) {
        var entries = new ArrayList<PlaceholderEntry>();
        domains.forEach((domain, config) -> {
            log.trace("Domain {}: prefixes {}", domain, config.effectivePrefixes());
            for (var prefix : config.effectivePrefixes()) {
                entries.add(new PlaceholderEntry(prefix, domain));
            }
        });
        entries.sort(PlaceholderEntry.ORDER);
        return entries;
    }

    /**
     * Appends the entries whose name is not in {@code taken}. An existing name means the
     * user already owns that job.
     */
    public CustomRegion merge(CustomRegion region, List<PlaceholderEntry> entries, Set<String> taken) {
        var fresh = new ArrayList<String>();
        var skipped = new ArrayList<String>();
        for (var entry : entries) {
            if (taken.contains(entry.name())) {
                skipped.add(entry.name());
            } else {
                fresh.add(entry.render());
            }
        }
        if (!skipped.isEmpty()) {
            log.debug("Skipped {} existing placeholder job(s): {}", skipped.size(), String.join(", ", skipped));
        }
        log.debug("Adding {} new placeholder job(s)", fresh.size());
        return region.append(fresh);
    }
}
