package work.lcod.pipeline.workflow;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import org.junit.jupiter.api.Test;
import work.lcod.pipeline.config.ActionSourceMode;
import work.lcod.pipeline.config.PipelineConfig;
import work.lcod.pipeline.merge.Operation;
import work.lcod.pipeline.merge.OperationKind;

class ReleaseJobsTest {
    private static final List<String> FLOW = List.of("develop", "staging", "main");

    @Test
    void everyBranchButTheLastPromotes() {
        assertEquals("github.ref_name == 'develop' || github.ref_name == 'staging'",
            ReleaseJobs.promotableBranchesCondition(FLOW));
        assertEquals("false", ReleaseJobs.promotableBranchesCondition(List.of("main")));
    }

    @Test
    void targetBranchFollowsTheFlow() {
        assertEquals(
            "github.ref_name == 'develop' && 'staging' || github.ref_name == 'staging' && 'main' || ''",
            ReleaseJobs.targetBranchExpression(FLOW));
        assertEquals("''", ReleaseJobs.targetBranchExpression(List.of("main")));
    }

    @Test
    void autoPromoteLooksAtTheTargetBranch() {
        assertEquals(
            "(github.ref_name == 'develop' && 'true') || (github.ref_name == 'staging' && 'false') || 'false'",
            ReleaseJobs.autoPromoteExpression(FLOW, Map.of("staging", true)));
        assertEquals("'false'", ReleaseJobs.autoPromoteExpression(FLOW, Map.of()));
    }

    @Test
    void tagNeedsAndConditionBelongToTheUser() {
        var operations = ReleaseJobs.create(PipelineConfig.builder().branchFlow(FLOW).build());

        var byPath = operations.stream().collect(Collectors.toMap(Operation::path, Operation::kind));
        assertEquals(OperationKind.PRESERVE, byPath.get("jobs.tag.needs"));
        assertEquals(OperationKind.PRESERVE, byPath.get("jobs.tag.if"));
        assertEquals(OperationKind.SET, byPath.get("jobs.tag.steps"));
        assertEquals(OperationKind.SET, byPath.get("jobs.promote"));
        assertEquals(OperationKind.SET, byPath.get("jobs.release"));
    }

    @Test
    void remoteActionsArePinned() {
        var config = PipelineConfig.builder()
            .actionSourceMode(ActionSourceMode.REMOTE)
            .actionRepository("acme/pipeline")
            .actionVersion("v1")
            .build();

        assertEquals("acme/pipeline/actions/create-tag@v1", ActionReferences.resolve(ActionReferences.CREATE_TAG, config));
        assertTrue(ActionReferences.resolve(ActionReferences.CREATE_TAG, PipelineConfig.builder().build())
            .startsWith("./.github/actions/"));
    }
}
