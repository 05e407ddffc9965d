package work.lcod.pipeline.api;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import work.lcod.pipeline.compose.MergeStatus;
import work.lcod.pipeline.config.DomainConfig;
import work.lcod.pipeline.config.PipelineConfig;

class PipelineGeneratorTest {
    private final PipelineConfig config = PipelineConfig.builder()
        .branchFlow(List.of("develop", "main"))
        .domain("api", DomainConfig.of(List.of("apps/api/**"), List.of("test")))
        .build();

    @Test
    void writesDefaultWorkflowAndLeavesItUnchangedOnRerun(@TempDir Path dir) throws Exception {
        var request = GenerationRequest.builder().config(config).workingDirectory(dir).build();

        var first = new PipelineGenerator().generate(request);
        var target = dir.resolve(GenerationRequest.DEFAULT_OUTPUT);
        assertEquals(GenerationResult.Status.SUCCESS, first.status());
        assertEquals(MergeStatus.CREATED, first.documents().get(0).mergeStatus());
        assertTrue(first.documents().get(0).written());
        assertEquals(first.documents().get(0).content(), Files.readString(target));

        var second = new PipelineGenerator().generate(request);
        assertEquals(MergeStatus.MERGED, second.documents().get(0).mergeStatus());
        assertFalse(second.documents().get(0).written());
    }

    @Test
    void dryRunDoesNotTouchTheFileSystem(@TempDir Path dir) throws Exception {
        var request = GenerationRequest.builder().config(config).workingDirectory(dir).dryRun(true).build();

        var result = new PipelineGenerator().generate(request);

        assertTrue(result.documents().get(0).content().contains("test-api:"));
        assertFalse(Files.exists(dir.resolve(GenerationRequest.DEFAULT_OUTPUT)));
        try (var files = Files.list(dir)) {
            assertEquals(0, files.count());
        }
    }

    @Test
    void failureOnOneDocumentDoesNotStopTheOthers(@TempDir Path dir) throws Exception {
        var broken = dir.resolve("broken.yml");
        Files.writeString(broken, "jobs:\n  - build\n");
        var request = GenerationRequest.builder()
            .config(config)
            .workingDirectory(dir)
            .outputs(List.of(Path.of("broken.yml"), Path.of("ok.yml")))
            .build();

        var result = new PipelineGenerator().generate(request);

        assertEquals(GenerationResult.Status.FAILURE, result.status());
        assertEquals(1, result.status().exitCode());
        assertTrue(result.documents().get(0).failed());
        assertNull(result.documents().get(0).content());
        assertEquals("jobs:\n  - build\n", Files.readString(broken));
        assertFalse(result.documents().get(1).failed());
        assertTrue(Files.exists(dir.resolve("ok.yml")));
        assertTrue(result.toPrettyJson().contains("\"status\" : \"failure\""));
    }

    @Test
    void replacesFilesWithoutLeavingTemporaries(@TempDir Path dir) throws Exception {
        var target = dir.resolve("pipeline.yml");
        Files.writeString(target, "old");

        PipelineGenerator.writeAtomically(target, "new\n");

        assertEquals("new\n", Files.readString(target));
        try (var files = Files.list(dir)) {
            assertEquals(List.of(target), files.toList());
        }
    }
}
