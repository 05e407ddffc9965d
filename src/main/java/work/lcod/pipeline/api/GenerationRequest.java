package work.lcod.pipeline.api;

import java.nio.file.Path;
import java.util.List;
import java.util.Objects;
import work.lcod.pipeline.config.PipelineConfig;

/**
 * Immutable input of a {@link PipelineGenerator} run. Relative outputs resolve
 * against {@code workingDirectory}.
 */
public record GenerationRequest(
    PipelineConfig config,
    Path workingDirectory,
    List<Path> outputs,
    boolean force,
    boolean dryRun
) {
    public static final Path DEFAULT_OUTPUT = Path.of(".github", "workflows", "pipeline.yml");

    public GenerationRequest {
        Objects.requireNonNull(config, "config");
        Objects.requireNonNull(workingDirectory, "workingDirectory");
        outputs = outputs == null || outputs.isEmpty() ? List.of(DEFAULT_OUTPUT) : List.copyOf(outputs);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private PipelineConfig config;
        private Path workingDirectory = Path.of("");
        private List<Path> outputs = List.of();
        private boolean force;
        private boolean dryRun;

        public Builder config(PipelineConfig config) {
            this.config = config;
            return this;
        }

        public Builder workingDirectory(Path workingDirectory) {
            this.workingDirectory = workingDirectory;
            return this;
        }

        public Builder outputs(List<Path> outputs) {
            this.outputs = outputs;
            return this;
        }

        public Builder force(boolean force) {
            this.force = force;
            return this;
        }

        public Builder dryRun(boolean dryRun) {
            this.dryRun = dryRun;
            return this;
        }

        public GenerationRequest build() {
            return new GenerationRequest(config, workingDirectory, outputs, force, dryRun);
        }
    }
}
