package work.lcod.pipeline.merge;

import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.lcod.pipeline.yaml.YamlMapping;
import work.lcod.pipeline.yaml.YamlNode;
import work.lcod.pipeline.yaml.YamlScalar;
import work.lcod.pipeline.yaml.YamlSequence;

/**
 * Applies an ordered operation list to a document root in place.
 *
 * <p>Missing parents are created as block mappings appended to their parent; an
 * empty or {@code null} scalar standing where a parent mapping is needed is
 * replaced by one. Nodes no operation addresses are left untouched.
 */
public final class MergeApplier {
    private static final Logger log = LoggerFactory.getLogger(MergeApplier.class);

    public void apply(YamlMapping root, List<Operation> operations) {
        for (var operation : operations) {
            apply(root, operation);
        }
    }

    public void apply(YamlMapping root, Operation operation) {
        var segments = operation.segments();
        var parent = resolveParent(root, operation, segments);
        if (parent == null) {
            return;
        }
        var key = segments.get(segments.size() - 1);
        var existing = parent.get(key);

        if (operation.kind() == OperationKind.PRESERVE && existing != null) {
            log.trace("Keeping existing value at {}", operation.path());
            return;
        }

        var value = operation.value().copy();
        if (existing != null) {
            value.adoptFormatting(existing);
        }
        if (operation.spaceBefore()) {
            value.setSpaceBefore(true);
        }
        if (!operation.commentBefore().isEmpty()) {
            value.setCommentLines(operation.commentBefore());
        }
        parent.put(key, value);
        log.trace("{} {}", operation.kind() == OperationKind.SET ? "Set" : "Initialized", operation.path());
    }

    private YamlMapping resolveParent(YamlMapping root, Operation operation, List<String> segments) {
        var current = root;
        for (int i = 0; i < segments.size() - 1; i++) {
            var segment = segments.get(i);
            var child = current.get(segment);
            if (child == null || (child instanceof YamlScalar scalar && scalar.isNull())) {
                var created = new YamlMapping();
                if (child != null) {
                    created.adoptFormatting(child);
                }
                current.put(segment, created);
                current = created;
            } else if (child instanceof YamlMapping mapping) {
                current = mapping;
            } else {
                var where = String.join(".", segments.subList(0, i + 1));
                var message = "Cannot apply '" + operation.path() + "': '" + where + "' is a "
                    + describe(child) + ", expected a mapping";
                if (operation.required()) {
                    throw new StructuralException(operation.path(), message);
                }
                log.warn("{}; skipping", message);
                return null;
            }
        }
        return current;
    }

    private static String describe(YamlNode node) {
        if (node instanceof YamlSequence) {
            return "sequence";
        }
        return "scalar";
    }
}
