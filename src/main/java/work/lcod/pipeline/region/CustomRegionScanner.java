package work.lcod.pipeline.region;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.lcod.pipeline.yaml.DocumentParseException;
import work.lcod.pipeline.yaml.YamlMapping;
import work.lcod.pipeline.yaml.YamlParser;

/**
 * Locates the custom jobs markers in raw workflow text.
 *
 * <p>A marker is any comment line carrying the marker token, whatever its
 * indentation or number of {@code #} characters. Works on text only, so the
 * markers are found even when the rest of the document does not parse.
 */
public final class CustomRegionScanner {
    private static final Logger log = LoggerFactory.getLogger(CustomRegionScanner.class);
    private static final Pattern START = markerPattern(CustomRegion.START_MARKER);
    private static final Pattern END = markerPattern(CustomRegion.END_MARKER);
    private static final Pattern JOB_LINE = Pattern.compile("^ {2}([A-Za-z0-9_-]+):");

    private record Markers(int start, int end) {
        boolean complete() {
            return start >= 0 && end > start;
        }
    }

    /**
     * Text between the markers, or empty when either marker is missing or they
     * appear in the wrong order.
     */
    public Optional<CustomRegion> extract(String text) {
        var lines = lines(text);
        var markers = find(lines);
        if (markers.complete()) {
            log.debug("Found custom region between lines {} and {}", markers.start() + 1, markers.end() + 1);
            return Optional.of(new CustomRegion(String.join("\n", lines.subList(markers.start() + 1, markers.end()))));
        }
        if (markers.start() >= 0 || markers.end() >= 0) {
            log.warn("Custom jobs markers are unpaired (start line {}, end line {}); ignoring the custom region",
                markers.start() + 1, markers.end() + 1);
        }
        return Optional.empty();
    }

    /**
     * The text with the region and its markers removed. Unpaired markers are removed
     * on their own so they are not duplicated on output.
     */
    public String strip(String text) {
        var lines = lines(text);
        var markers = find(lines);
        var kept = new ArrayList<String>(lines.size());
        for (int i = 0; i < lines.size(); i++) {
            if (markers.complete() && i >= markers.start() && i <= markers.end()) {
                continue;
            }
            var line = lines.get(i);
            if (START.matcher(line).matches() || END.matcher(line).matches()) {
                continue;
            }
            kept.add(line);
        }
        return String.join("\n", kept);
    }

    /**
     * Names of the jobs declared in region text. The region is read as a YAML
     * fragment; text that does not parse falls back to scanning for job keys.
     */
    public Set<String> jobNames(CustomRegion region) {
        if (region.isEmpty()) {
            return Set.of();
        }
        try {
            var node = YamlParser.parseNode(region.content());
            if (node instanceof YamlMapping mapping) {
                return new LinkedHashSet<>(mapping.keys());
            }
        } catch (DocumentParseException | RuntimeException ex) {
            log.debug("Custom region is not a YAML mapping ({}); scanning job keys", ex.getMessage());
        }
        var names = new LinkedHashSet<String>();
        for (var line : lines(region.content())) {
            var matcher = JOB_LINE.matcher(line);
            if (matcher.find()) {
                names.add(matcher.group(1));
            }
        }
        return names;
    }

    private static Markers find(List<String> lines) {
        int start = -1;
        int end = -1;
        for (int i = 0; i < lines.size(); i++) {
            var line = lines.get(i);
            if (start < 0 && START.matcher(line).matches()) {
                start = i;
            } else if (END.matcher(line).matches() && (end < 0 || end < start)) {
                end = i;
            }
        }
        return new Markers(start, end);
    }

    private static List<String> lines(String text) {
        return List.of(text.split("\n", -1));
    }

    private static Pattern markerPattern(String token) {
        return Pattern.compile("^.*#+\\s*" + Pattern.quote(token) + "\\s*$");
    }
}
