package work.lcod.pipeline.workflow;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;

import java.util.List;
import org.junit.jupiter.api.Test;
import work.lcod.pipeline.yaml.YamlMapping;
import work.lcod.pipeline.yaml.YamlScalar;
import work.lcod.pipeline.yaml.YamlSequence;

class GateJobTest {
    @Test
    void gateIsInsertedBeforeTag() {
        var root = new YamlMapping().put("jobs", jobs());

        GateJob.ensure(root, List.of("test-api"));

        var jobs = (YamlMapping) root.get("jobs");
        assertEquals(List.of("changes", "version", "lint", "gate", "tag"), List.copyOf(jobs.keys()));
        var gate = (YamlMapping) jobs.get("gate");
        var needs = assertInstanceOf(YamlSequence.class, gate.get("needs"));
        assertEquals(List.of("changes", "version", "lint", "test-api"),
            needs.items().stream().map(item -> ((YamlScalar) item).value()).toList());
        assertEquals(YamlScalar.Style.DOUBLE_QUOTED, ((YamlScalar) gate.get("if")).style());
    }

    @Test
    void existingGateIsLeftAlone() {
        var jobs = jobs();
        jobs.putBefore("tag", "gate", new YamlMapping().put("needs", YamlScalar.of("lint")));
        var root = new YamlMapping().put("jobs", jobs);

        GateJob.ensure(root, List.of("test-api"));

        var gate = (YamlMapping) jobs.get("gate");
        assertEquals("lint", ((YamlScalar) gate.get("needs")).value());
        assertEquals(1, gate.size());
    }

    @Test
    void nullGateIsReplaced() {
        var jobs = jobs();
        jobs.putBefore("tag", "gate", YamlScalar.plain(""));
        var root = new YamlMapping().put("jobs", jobs);

        GateJob.ensure(root, List.of());

        var gate = assertInstanceOf(YamlMapping.class, jobs.get("gate"));
        assertEquals(List.of("changes", "version", "lint"), List.copyOf(jobs.keys()).subList(0, 3));
        assertInstanceOf(YamlSequence.class, gate.get("needs"));
    }

    @Test
    void disabledJobsAreNotPrerequisites() {
        var jobs = jobs();
        ((YamlMapping) jobs.get("lint")).put("if", YamlScalar.plain("false"));

        assertEquals(List.of("changes", "version"), GateJob.prerequisites(jobs, List.of()));
    }

    @Test
    void conditionAllowsSuccessOrSkipped() {
        assertEquals(
            "${{ always() && (needs['a'].result == 'success' || needs['a'].result == 'skipped') }}",
            GateJob.condition(List.of("a")));
        assertEquals("${{ always() }}", GateJob.condition(List.of()));
    }

    private static YamlMapping jobs() {
        return new YamlMapping()
            .put("changes", new YamlMapping())
            .put("version", new YamlMapping())
            .put("lint", new YamlMapping())
            .put("tag", new YamlMapping());
    }
}
