package work.lcod.pipeline.workflow;

import java.util.List;
import work.lcod.pipeline.config.PipelineConfig;
import work.lcod.pipeline.merge.Operation;
import work.lcod.pipeline.region.ManagedJobs;
import work.lcod.pipeline.yaml.YamlDocument;
import work.lcod.pipeline.yaml.YamlEmitter;
import work.lcod.pipeline.yaml.YamlMapping;
import work.lcod.pipeline.yaml.YamlScalar;
import work.lcod.pipeline.yaml.YamlSequence;
import work.lcod.pipeline.yaml.YamlValues;

/**
 * Change detection job. The domain definitions are embedded in the job so the
 * detect-changes action needs no access to the configuration file.
 */
public final class ChangesJob {
    private static final String CHECKOUT = """
        uses: actions/checkout@v4
        with:
          ref: ${{ inputs.commitSha || github.sha }}
          fetch-depth: ${{ env.FETCH_DEPTH_AFFECTED }}
        """;

    private ChangesJob() {}

    public static Operation create(PipelineConfig config) {
        var detect = new YamlMapping()
            .put("uses", YamlScalar.of(ActionReferences.resolve(ActionReferences.DETECT_CHANGES, config)))
            .put("id", YamlScalar.of("detect"))
            .put("with", new YamlMapping()
                .put("baseRef", YamlScalar.plain("${{ inputs.baseRef || '" + config.finalBranch() + "' }}"))
                .put("domains-config", new YamlScalar(domainsConfig(config), YamlScalar.Style.LITERAL)));

        var outputs = new YamlMapping();
        config.domains().keySet().forEach(domain ->
            outputs.put(domain, YamlScalar.plain("${{ steps.detect.outputs." + domain + " }}")));

        var job = new YamlMapping()
            .put("runs-on", YamlScalar.of("ubuntu-latest"))
            .put("steps", new YamlSequence().add(YamlValues.fromText(CHECKOUT)).add(detect));
        if (!outputs.isEmpty()) {
            job.put("outputs", outputs);
        }

        return Operation.set("jobs." + ManagedJobs.CHANGES)
            .value(job)
            .required()
            .spaceBefore()
            .comment("""
                =============================================================================
                 CHANGES (Managed by Pipecraft - do not modify)
                =============================================================================
                 Detects which domains changed so downstream jobs run only when needed.
                """)
            .build();
    }

    static String domainsConfig(PipelineConfig config) {
        if (config.domains().isEmpty()) {
            return "{}\n";
        }
        var root = new YamlMapping();
        config.domains().forEach((name, domain) ->
            root.put(name, new YamlMapping().put("paths", YamlValues.of(domain.paths()))));
        return YamlEmitter.emit(new YamlDocument(root, List.of(), List.of()));
    }
}
