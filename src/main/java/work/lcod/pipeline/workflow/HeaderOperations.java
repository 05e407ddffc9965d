package work.lcod.pipeline.workflow;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import work.lcod.pipeline.config.PipelineConfig;
import work.lcod.pipeline.merge.Operation;
import work.lcod.pipeline.yaml.YamlScalar;

/**
 * Workflow name, run name, environment defaults and triggers.
 */
public final class HeaderOperations {
    private static final List<String> DISPATCH_INPUTS = List.of("version", "baseRef", "run_number", "commitSha");
    private static final Map<String, String> INPUT_DESCRIPTIONS = Map.of(
        "version", "The version to deploy",
        "baseRef", "The base reference for comparison",
        "run_number", "The original run number from develop branch",
        "commitSha", "The exact commit SHA to checkout and test"
    );

    /** Banner written above a freshly generated workflow. */
    public static final List<String> DOCUMENT_HEADER = List.of(
        "#=============================================================================",
        "# PIPECRAFT MANAGED WORKFLOW",
        "#=============================================================================",
        "#",
        "# YOU CAN CUSTOMIZE:",
        "#   - Custom jobs between the '# <--START CUSTOM JOBS-->' and '# <--END CUSTOM JOBS-->' comment markers",
        "#   - Workflow name and env defaults",
        "#",
        "# PIPECRAFT MANAGES (do not modify):",
        "#   - Workflow triggers, job dependencies, and conditionals",
        "#   - Changes detection, version calculation, and tag creation",
        "#   - Tag, promote, and release jobs",
        "#",
        "# Running 'lcod-pipeline' updates managed sections while preserving",
        "# your customizations in the custom jobs section.",
        "#============================================================================="
    );

    private HeaderOperations() {}

    public static List<Operation> create(PipelineConfig config) {
        var branchFlow = config.branchFlow();
        var branchList = String.join(",", branchFlow);
        var operations = new ArrayList<Operation>();

        operations.add(Operation.preserve("name").value("Pipeline").required().build());
        operations.add(Operation.preserve("run-name")
            .value(YamlScalar.doubleQuoted(
                "${{ github.event_name == 'pull_request' && !contains('" + branchList
                    + "', github.head_ref) && github.event.pull_request.title || github.ref_name }}"
                    + " #${{ inputs.run_number || github.run_number }}"
                    + "${{ inputs.version && format(' - {0}', inputs.version) || '' }}"
            ))
            .required()
            .spaceBefore()
            .build());

        operations.add(Operation.preserve("env")
            .value(Map.of())
            .required()
            .spaceBefore()
            .comment("""
                 Git fetch depth configuration
                  - FETCH_DEPTH_AFFECTED: For change detection
                    Lower values (50-100) improve performance, higher values (200+) improve accuracy
                    Use 0 for complete history if your branches diverge significantly
                  - FETCH_DEPTH_VERSIONING: For semantic version calculation (needs git tags)
                    Should almost always be 0 to access all tags

                 Runtime versions
                  Update these to match your project's requirements without regenerating workflows
                """)
            .build());
        operations.add(Operation.preserve("env.FETCH_DEPTH_AFFECTED").value("100").required().build());
        operations.add(Operation.preserve("env.FETCH_DEPTH_VERSIONING").value("0").required().build());
        operations.add(Operation.preserve("env.NODE_VERSION").value("22").required().build());
        operations.add(Operation.preserve("env.PNPM_VERSION").value("9").required().build());

        operations.add(Operation.set("on").value(Map.of()).required().spaceBefore().build());
        for (var trigger : List.of("workflow_dispatch", "workflow_call")) {
            for (var input : DISPATCH_INPUTS) {
                var definition = new LinkedHashMap<String, Object>();
                definition.put("description", INPUT_DESCRIPTIONS.get(input));
                definition.put("required", false);
                definition.put("type", "string");
                operations.add(Operation.set("on." + trigger + ".inputs." + input).value(definition).required().build());
            }
        }
        operations.add(Operation.set("on.push.branches").value(branchFlow).required().build());
        operations.add(Operation.set("on.pull_request.types")
            .value(List.of("opened", "synchronize", "reopened"))
            .required()
            .build());
        operations.add(Operation.set("on.pull_request.branches")
            .value(List.of(config.initialBranch()))
            .required()
            .build());

        operations.add(Operation.preserve("jobs").value(Map.of()).required().spaceBefore().build());
        return operations;
    }
}
