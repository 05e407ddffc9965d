package work.lcod.pipeline.workflow;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import org.junit.jupiter.api.Test;
import work.lcod.pipeline.config.DomainConfig;
import work.lcod.pipeline.config.PipelineConfig;
import work.lcod.pipeline.merge.MergeApplier;
import work.lcod.pipeline.yaml.YamlMapping;
import work.lcod.pipeline.yaml.YamlScalar;
import work.lcod.pipeline.yaml.YamlSequence;

class WorkflowOperationsTest {
    private final PipelineConfig config = PipelineConfig.builder()
        .branchFlow(List.of("develop", "main"))
        .domain("api", DomainConfig.of(List.of("apps/api/**"), List.of("test")))
        .build();

    @Test
    void buildsManagedJobsInOrder() {
        var root = new YamlMapping();
        new MergeApplier().apply(root, WorkflowOperations.plan(config));

        assertEquals(List.of("name", "run-name", "env", "on", "jobs"), List.copyOf(root.keys()));
        var jobs = (YamlMapping) root.get("jobs");
        assertEquals(List.of("changes", "version", "tag", "promote", "release"), List.copyOf(jobs.keys()));
    }

    @Test
    void changesJobExposesOneOutputPerDomain() {
        var root = new YamlMapping();
        new MergeApplier().apply(root, WorkflowOperations.plan(config));

        var changes = (YamlMapping) ((YamlMapping) root.get("jobs")).get("changes");
        var outputs = (YamlMapping) changes.get("outputs");
        assertEquals("${{ steps.detect.outputs.api }}", ((YamlScalar) outputs.get("api")).value());
    }

    @Test
    void embedsDomainPathsForChangeDetection() {
        assertEquals("api:\n  paths:\n    - apps/api/**\n", ChangesJob.domainsConfig(config));
    }

    @Test
    void pullRequestsTargetTheInitialBranch() {
        var root = new YamlMapping();
        new MergeApplier().apply(root, HeaderOperations.create(config));

        var on = (YamlMapping) root.get("on");
        assertTrue(on.containsKey("workflow_dispatch"));
        assertTrue(on.containsKey("workflow_call"));
        var pullRequest = (YamlMapping) on.get("pull_request");
        var branches = (YamlSequence) pullRequest.get("branches");
        assertEquals(List.of("develop"), branches.items().stream().map(item -> ((YamlScalar) item).value()).toList());
    }
}
