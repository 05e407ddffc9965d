package work.lcod.pipeline.api;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Instant;
import java.util.ArrayList;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.lcod.pipeline.compose.DocumentComposer;

/**
 * Public entry point for generating pipeline workflows.
 *
 * <p>Every output is an independent document: it is read at most once, written at
 * most once, and a failure on one does not stop the others. The new content goes to
 * a temporary sibling first and replaces the target in a single move, so a failure
 * leaves the previous file as it was.
 */
public final class PipelineGenerator {
    private static final Logger log = LoggerFactory.getLogger(PipelineGenerator.class);

    private final DocumentComposer composer;

    public PipelineGenerator() {
        this(new DocumentComposer());
    }

    PipelineGenerator(DocumentComposer composer) {
        this.composer = composer;
    }

    public GenerationResult generate(GenerationRequest request) {
        var started = Instant.now();
        var outcomes = new ArrayList<DocumentOutcome>();
        for (var output : request.outputs()) {
            outcomes.add(generateOne(request, request.workingDirectory().resolve(output)));
        }
        return new GenerationResult(outcomes, started, Instant.now());
    }

    private DocumentOutcome generateOne(GenerationRequest request, Path target) {
        try {
            String existing = Files.isRegularFile(target) ? Files.readString(target, StandardCharsets.UTF_8) : null;
            var result = composer.compose(request.config(), existing, request.force());
            boolean changed = !result.text().equals(existing);
            boolean written = false;
            if (request.dryRun()) {
                log.info("{} {} (dry run, not written)", result.status().tag(), target);
            } else if (changed) {
                writeAtomically(target, result.text());
                written = true;
                log.info("{} {}", result.status().tag(), target);
            } else {
                log.info("{} {} (unchanged)", result.status().tag(), target);
            }
            return DocumentOutcome.success(target, result.status(), written, result.warnings(), result.text());
        } catch (IOException | RuntimeException ex) {
            var message = ex.getMessage() != null && !ex.getMessage().isBlank()
                ? ex.getMessage()
                : ex.getClass().getSimpleName();
            log.error("Failed to generate {}: {}", target, message);
            if (Boolean.getBoolean("lcod.debug")) {
                log.error("Stack trace", ex);
            }
            return DocumentOutcome.failure(target, message);
        }
    }

    static void writeAtomically(Path target, String content) throws IOException {
        var parent = target.toAbsolutePath().getParent();
        Files.createDirectories(parent);
        var temp = Files.createTempFile(parent, "." + target.getFileName(), ".tmp");
        try {
            Files.writeString(temp, content, StandardCharsets.UTF_8);
            try {
                Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException ex) {
                Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING);
            }
        } finally {
            Files.deleteIfExists(temp);
        }
    }
}
