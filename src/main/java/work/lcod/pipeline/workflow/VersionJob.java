package work.lcod.pipeline.workflow;

import work.lcod.pipeline.config.PipelineConfig;
import work.lcod.pipeline.merge.Operation;
import work.lcod.pipeline.region.ManagedJobs;

/**
 * Semantic version calculation. Its entry is the anchor of the custom region.
 */
public final class VersionJob {
    private static final String TEMPLATE = """
        needs: [ changes ]
        if: ${{ always() && github.event_name != 'pull_request' }}
        runs-on: ubuntu-latest
        steps:
          - uses: actions/checkout@v4
            with:
              ref: ${{ inputs.commitSha || github.sha }}
              fetch-depth: ${{ env.FETCH_DEPTH_VERSIONING }}
          - uses: %s
            id: version
            with:
              baseRef: ${{ inputs.baseRef || '%s' }}
              version: ${{ inputs.version }}
              node-version: ${{ env.NODE_VERSION }}
              commitSha: ${{ inputs.commitSha }}
        outputs:
          version: ${{ steps.version.outputs.version }}
        """;

    private VersionJob() {}

    public static Operation create(PipelineConfig config) {
        var actionRef = ActionReferences.resolve(ActionReferences.CALCULATE_VERSION, config);
        return Operation.set("jobs." + ManagedJobs.VERSION)
            .yaml(TEMPLATE.formatted(actionRef, config.finalBranch()))
            .required()
            .spaceBefore()
            .comment("""
                =============================================================================
                 VERSIONING (Managed by Pipecraft - do not modify)
                =============================================================================
                 Calculates the next semantic version based on conventional commits.
                 Only runs on push events (skipped on pull requests).
                """)
            .build();
    }
}
