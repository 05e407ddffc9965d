package work.lcod.pipeline.workflow;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.lcod.pipeline.merge.Operation;
import work.lcod.pipeline.region.ManagedJobs;
import work.lcod.pipeline.yaml.YamlMapping;
import work.lcod.pipeline.yaml.YamlNode;
import work.lcod.pipeline.yaml.YamlScalar;
import work.lcod.pipeline.yaml.YamlValues;

/**
 * Gate in front of {@code tag}: lets the release jobs run only when every earlier job
 * succeeded or was skipped. An existing gate belongs to the user and is left as is.
 */
public final class GateJob {
    private static final Logger log = LoggerFactory.getLogger(GateJob.class);
    private static final List<String> COMMENT = Operation.commentLines("""
        =============================================================================
         GATE (Managed by Pipecraft - do not modify)
        =============================================================================
         Gate job that ensures prior jobs succeed before allowing tag/promote/release.
         Uses pattern: allow only SUCCESS or SKIPPED results (failures block progression).
        """);
    private static final String STEPS = """
        - name: Gate passed
          run: echo "All prerequisite jobs succeeded or were skipped - gate allows progression"
        """;

    private GateJob() {}

    /**
     * @param root        document root; its {@code jobs} entry must already be a mapping
     * @param regionJobs  names of the jobs kept in the custom region
     */
    public static void ensure(YamlMapping root, List<String> regionJobs) {
        if (!(root.get("jobs") instanceof YamlMapping jobs)) {
            log.warn("Unable to update gate job: 'jobs' is not a mapping");
            return;
        }

        var existing = jobs.get(ManagedJobs.GATE);
        if (existing instanceof YamlMapping) {
            return;
        }
        var gate = new YamlMapping();
        if (existing != null) {
            gate.adoptFormatting(existing);
        } else {
            gate.setSpaceBefore(true);
        }
        if (gate.commentLines().isEmpty()) {
            gate.setCommentLines(COMMENT);
        }
        jobs.putBefore(ManagedJobs.TAG, ManagedJobs.GATE, gate);

        var prerequisites = prerequisites(jobs, regionJobs);
        gate.put("needs", YamlValues.of(prerequisites));
        gate.put("if", YamlScalar.doubleQuoted(condition(prerequisites)));
        gate.put("runs-on", YamlScalar.of("ubuntu-latest"));
        gate.put("steps", YamlValues.fromText(STEPS));
        log.debug("Gate job needs {}", prerequisites);
    }

    static List<String> prerequisites(YamlMapping jobs, List<String> regionJobs) {
        var names = new LinkedHashSet<String>();
        for (var entry : jobs.entries()) {
            if (entry.getKey().equals(ManagedJobs.GATE)) {
                break;
            }
            if (enabled(entry.getValue())) {
                names.add(entry.getKey());
            }
        }
        names.addAll(regionJobs);
        names.remove(ManagedJobs.GATE);
        return new ArrayList<>(names);
    }

    static String condition(List<String> jobs) {
        if (jobs.isEmpty()) {
            return "${{ always() }}";
        }
        return "${{ always() && " + jobs.stream()
            .map(name -> "(needs['" + name + "'].result == 'success' || needs['" + name + "'].result == 'skipped')")
            .collect(Collectors.joining(" && ")) + " }}";
    }

    private static boolean enabled(YamlNode job) {
        if (!(job instanceof YamlMapping mapping)) {
            return false;
        }
        if (!(mapping.get("if") instanceof YamlScalar condition)) {
            return true;
        }
        var value = condition.value().trim();
        return !value.equals("false") && !value.equals("${{ false }}");
    }
}
