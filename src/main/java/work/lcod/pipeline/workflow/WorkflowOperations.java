package work.lcod.pipeline.workflow;

import java.util.ArrayList;
import java.util.List;
import work.lcod.pipeline.config.PipelineConfig;
import work.lcod.pipeline.merge.Operation;

/**
 * Full operation list of the pipeline workflow, in document order.
 */
public final class WorkflowOperations {
    private WorkflowOperations() {}

    public static List<Operation> plan(PipelineConfig config) {
        var operations = new ArrayList<Operation>();
        operations.addAll(HeaderOperations.create(config));
        operations.add(ChangesJob.create(config));
        operations.add(VersionJob.create(config));
        operations.addAll(ReleaseJobs.create(config));
        return List.copyOf(operations);
    }
}
