package work.lcod.pipeline.workflow;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import work.lcod.pipeline.config.PipelineConfig;
import work.lcod.pipeline.merge.Operation;
import work.lcod.pipeline.region.ManagedJobs;
import work.lcod.pipeline.yaml.YamlScalar;
import work.lcod.pipeline.yaml.YamlValues;

/**
 * Tag, promote and release jobs. The tag job's {@code needs} and {@code if} are
 * written once and then belong to the user.
 */
public final class ReleaseJobs {
    private static final String CHECKOUT = """
          - uses: actions/checkout@v4
            with:
              ref: ${{ inputs.commitSha || github.sha }}
              fetch-depth: ${{ env.FETCH_DEPTH_VERSIONING }}
        """;

    private static final String TAG_STEPS = CHECKOUT + """
          - uses: %s
            with:
              version: ${{ needs.version.outputs.version }}
        """;

    private static final String PROMOTE = """
        needs: [ version, tag ]
        if: ${{ always() && (github.event_name == 'push' || github.event_name == 'workflow_dispatch') && needs.version.result == 'success' && needs.version.outputs.version != '' && (needs.tag.result == 'success' || needs.tag.result == 'skipped') && (%s) }}
        runs-on: ubuntu-latest
        steps:
        """ + CHECKOUT + """
          - uses: %s
            with:
              version: ${{ needs.version.outputs.version }}
              sourceBranch: ${{ github.ref_name }}
              targetBranch: ${{ %s }}
              autoPromote: ${{ %s }}
              run_number: ${{ inputs.run_number || github.run_number }}
        """;

    private static final String RELEASE = """
        needs: [ tag, version ]
        if: ${{ always() && github.ref_name == '%s' && needs.version.result == 'success' && needs.version.outputs.version != '' && (needs.tag.result == 'success' || needs.tag.result == 'skipped') }}
        runs-on: ubuntu-latest
        steps:
        """ + CHECKOUT + """
          - uses: %s
            with:
              version: ${{ needs.version.outputs.version }}
        """;

    private ReleaseJobs() {}

    public static List<Operation> create(PipelineConfig config) {
        var branchFlow = config.branchFlow();
        var operations = new ArrayList<Operation>();
        var tag = "jobs." + ManagedJobs.TAG;

        operations.add(Operation.preserve(tag)
            .value(Map.of())
            .spaceBefore()
            .comment("""
                =============================================================================
                 TAG (Managed by Pipecraft - customizable needs and if)
                =============================================================================
                 Creates git tags and promotes code through branch flow.
                 The 'needs' and 'if' fields are customizable and will be preserved.
                 All other fields (runs-on, steps) are managed by Pipecraft.
                """)
            .build());
        operations.add(Operation.preserve(tag + ".needs")
            .value(YamlValues.flowList(List.of(ManagedJobs.VERSION, ManagedJobs.GATE)))
            .build());
        operations.add(Operation.preserve(tag + ".if")
            .value(YamlScalar.plain("${{ " + String.join(" && ",
                "always()",
                "github.event_name != 'pull_request'",
                "github.ref_name == '" + config.initialBranch() + "'",
                "needs.version.result == 'success'",
                "needs.version.outputs.version != ''",
                "needs.gate.result == 'success'") + " }}"))
            .build());
        operations.add(Operation.set(tag + ".runs-on").value("ubuntu-latest").build());
        operations.add(Operation.set(tag + ".steps")
            .yaml(TAG_STEPS.formatted(ActionReferences.resolve(ActionReferences.CREATE_TAG, config)))
            .build());

        operations.add(Operation.set("jobs." + ManagedJobs.PROMOTE)
            .yaml(PROMOTE.formatted(
                promotableBranchesCondition(branchFlow),
                ActionReferences.resolve(ActionReferences.PROMOTE_BRANCH, config),
                targetBranchExpression(branchFlow),
                autoPromoteExpression(branchFlow, config.autoPromote())))
            .spaceBefore()
            .comment("""
                =============================================================================
                 PROMOTE (Managed by Pipecraft - do not modify)
                =============================================================================
                 Promotes code to the next branch of the flow via PR.
                """)
            .build());

        operations.add(Operation.set("jobs." + ManagedJobs.RELEASE)
            .yaml(RELEASE.formatted(
                config.finalBranch(),
                ActionReferences.resolve(ActionReferences.CREATE_RELEASE, config)))
            .spaceBefore()
            .comment("""
                =============================================================================
                 RELEASE (Managed by Pipecraft - do not modify)
                =============================================================================
                 Creates a release for the version.
                """)
            .build());
        return operations;
    }

    /**
     * Every branch but the last can promote; a single-branch flow never does.
     */
    static String promotableBranchesCondition(List<String> branchFlow) {
        if (branchFlow.size() < 2) {
            return "false";
        }
        return branchFlow.subList(0, branchFlow.size() - 1).stream()
            .map(branch -> "github.ref_name == '" + branch + "'")
            .collect(Collectors.joining(" || "));
    }

    static String targetBranchExpression(List<String> branchFlow) {
        var expression = new StringBuilder();
        for (int i = 0; i < branchFlow.size() - 1; i++) {
            expression.append("github.ref_name == '").append(branchFlow.get(i)).append("' && '")
                .append(branchFlow.get(i + 1)).append("' || ");
        }
        return expression.append("''").toString();
    }

    static String autoPromoteExpression(List<String> branchFlow, Map<String, Boolean> autoPromote) {
        if (autoPromote.isEmpty() || branchFlow.size() < 2) {
            return "'false'";
        }
        var clauses = new ArrayList<String>();
        for (int i = 0; i < branchFlow.size() - 1; i++) {
            var enabled = Boolean.TRUE.equals(autoPromote.get(branchFlow.get(i + 1)));
            clauses.add("(github.ref_name == '" + branchFlow.get(i) + "' && '" + enabled + "')");
        }
        return String.join(" || ", clauses) + " || 'false'";
    }
}
