package work.lcod.pipeline.compose;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.lcod.pipeline.config.PipelineConfig;
import work.lcod.pipeline.merge.MergeApplier;
import work.lcod.pipeline.merge.Operation;
import work.lcod.pipeline.region.CustomRegion;
import work.lcod.pipeline.region.CustomRegionScanner;
import work.lcod.pipeline.region.JobDemoter;
import work.lcod.pipeline.region.ManagedJobs;
import work.lcod.pipeline.region.PlaceholderGenerator;
import work.lcod.pipeline.shared.ConditionFormatter;
import work.lcod.pipeline.workflow.GateJob;
import work.lcod.pipeline.workflow.HeaderOperations;
import work.lcod.pipeline.workflow.WorkflowOperations;
import work.lcod.pipeline.yaml.DocumentParseException;
import work.lcod.pipeline.yaml.YamlDocument;
import work.lcod.pipeline.yaml.YamlEmitter;
import work.lcod.pipeline.yaml.YamlMapping;
import work.lcod.pipeline.yaml.YamlParser;

/**
 * Produces the text of one pipeline workflow from the configuration and, when there
 * is one, the previous version of the file.
 *
 * <ul>
 *   <li>no previous file: the skeleton plus a custom region holding the placeholders ({@link MergeStatus#CREATED})</li>
 *   <li>previous file: operations are applied to the parsed file and the custom region is carried over
 *       ({@link MergeStatus#MERGED}), or the example region is written when it had none ({@link MergeStatus#UPDATED})</li>
 *   <li>force, or a previous file that does not parse: the skeleton is rebuilt and user jobs found outside
 *       the markers are moved into the custom region ({@link MergeStatus#REBUILT})</li>
 * </ul>
 *
 * The custom region is reinserted verbatim after the version job. Entries nobody changed keep their
 * original text; only generated text is reflowed.
 */
public final class DocumentComposer {
    private static final Logger log = LoggerFactory.getLogger(DocumentComposer.class);

    private final MergeApplier applier = new MergeApplier();
    private final CustomRegionScanner scanner = new CustomRegionScanner();
    private final PlaceholderGenerator placeholders = new PlaceholderGenerator();
    private final JobDemoter demoter = new JobDemoter();

    /**
     * @param existingText previous file content, or {@code null} when there is no file
     * @param force        rebuild even when the previous file could be merged
     */
    public ComposeResult compose(PipelineConfig config, String existingText, boolean force) {
        var operations = WorkflowOperations.plan(config);
        var entries = placeholders.generate(config.domains());
        var warnings = new ArrayList<String>();

        if (existingText == null) {
            log.debug("Creating new workflow");
            var document = skeleton(operations);
            var region = placeholders.merge(CustomRegion.empty(), entries, jobKeys(document));
            GateJob.ensure(document.root(), jobNames(region));
            return render(document, region, MergeStatus.CREATED, warnings);
        }

        var text = existingText.replace("\r\n", "\n");
        var extracted = scanner.extract(text);
        YamlParser.Result parsed = null;
        try {
            parsed = YamlParser.parseDocument(scanner.strip(text));
            if (parsed.commentsDropped()) {
                warn(warnings, "Comments of the existing workflow could not be read and were dropped");
            }
        } catch (DocumentParseException ex) {
            warn(warnings, ex.getMessage() + "; rebuilding the workflow from the configuration");
        }

        if (!force && parsed != null) {
            log.debug("Merging into existing workflow");
            var document = parsed.document();
            applier.apply(document.root(), operations);
            var base = extracted.orElseGet(CustomRegion::example);
            var region = placeholders.merge(base, entries, union(scanner.jobNames(base), jobKeys(document)));
            GateJob.ensure(document.root(), jobNames(region));
            return render(document, region, extracted.isPresent() ? MergeStatus.MERGED : MergeStatus.UPDATED, warnings);
        }

        log.debug("Rebuilding workflow from scratch");
        var document = skeleton(operations);
        var base = extracted.orElseGet(CustomRegion::empty);
        if (parsed != null) {
            var previous = parsed.document().root();
            carryUnmanagedKeys(previous, document.root());
            if (previous.get("jobs") instanceof YamlMapping previousJobs) {
                var demoted = demoter.demote(previousJobs, scanner.jobNames(base));
                base = base.append(demoted.blocks());
            }
        }
        var region = placeholders.merge(base, entries, union(scanner.jobNames(base), jobKeys(document)));
        GateJob.ensure(document.root(), jobNames(region));
        return render(document, region, MergeStatus.REBUILT, warnings);
    }

    private YamlDocument skeleton(List<Operation> operations) {
        var document = new YamlDocument();
        document.setHeader(HeaderOperations.DOCUMENT_HEADER);
        applier.apply(document.root(), operations);
        return document;
    }

    private ComposeResult render(YamlDocument document, CustomRegion region, MergeStatus status, List<String> warnings) {
        var output = YamlEmitter.emit(document, ManagedJobs.REGION_ANCHOR, ConditionFormatter::format);
        if (!output.anchored()) {
            warn(warnings, "Version job not found; custom jobs section appended at the end");
        }
        var tail = output.tail();

        var text = new StringBuilder(output.head())
            .append('\n')
            .append(region.render());
        if (!tail.isEmpty() && !tail.startsWith("\n")) {
            text.append('\n');
        }
        text.append(tail);
        log.debug("Workflow {} ({} custom region)", status.tag(), region.isEmpty() ? "empty" : "non-empty");
        return new ComposeResult(text.toString(), status, warnings);
    }

    /**
     * Root keys the operations do not produce (permissions, concurrency, ...) survive a rebuild.
     */
    private static void carryUnmanagedKeys(YamlMapping previous, YamlMapping rebuilt) {
        for (var entry : previous.entries()) {
            if (!rebuilt.containsKey(entry.getKey())) {
                log.debug("Keeping top-level key '{}'", entry.getKey());
                rebuilt.put(entry.getKey(), entry.getValue().copy());
            }
        }
    }

    private List<String> jobNames(CustomRegion region) {
        return List.copyOf(scanner.jobNames(region));
    }

    private static Set<String> jobKeys(YamlDocument document) {
        return document.root().get("jobs") instanceof YamlMapping jobs ? jobs.keys() : Set.of();
    }

    private static Set<String> union(Set<String> first, Set<String> second) {
        var all = new LinkedHashSet<String>(first);
        all.addAll(second);
        return all;
    }

    private static void warn(List<String> warnings, String message) {
        log.warn("{}", message);
        warnings.add(message);
    }
}
