package work.lcod.pipeline.merge;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import work.lcod.pipeline.yaml.YamlMapping;
import work.lcod.pipeline.yaml.YamlNode;
import work.lcod.pipeline.yaml.YamlValues;

/**
 * Declarative description of one node of a managed document.
 *
 * @param path          dotted address into the document, e.g. {@code on.push.branches}
 * @param kind          merge behaviour
 * @param value         node installed at {@code path}
 * @param required      whether an unresolvable path is an error instead of a skip
 * @param spaceBefore   blank line before the node
 * @param commentBefore comment lines above the node, each starting with {@code #}
 */
public record Operation(
    String path,
    OperationKind kind,
    YamlNode value,
    boolean required,
    boolean spaceBefore,
    List<String> commentBefore
) {
    public Operation {
        Objects.requireNonNull(path, "path");
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(value, "value");
        if (path.isBlank() || path.startsWith(".") || path.endsWith(".") || path.contains("..")) {
            throw new IllegalArgumentException("Invalid operation path: '" + path + "'");
        }
        commentBefore = List.copyOf(commentBefore);
    }

    public List<String> segments() {
        return List.of(path.split("\\."));
    }

    /**
     * Turns a text block into comment lines, one {@code #} line per text line.
     */
    public static List<String> commentLines(String text) {
        var lines = new ArrayList<String>();
        for (var line : text.replaceFirst("^\\n+", "").stripTrailing().split("\n", -1)) {
            lines.add("#" + line.stripTrailing());
        }
        return List.copyOf(lines);
    }

    public static Builder set(String path) {
        return new Builder(path, OperationKind.SET);
    }

    public static Builder preserve(String path) {
        return new Builder(path, OperationKind.PRESERVE);
    }

    public static final class Builder {
        private final String path;
        private final OperationKind kind;
        private YamlNode value = new YamlMapping();
        private boolean required;
        private boolean spaceBefore;
        private List<String> commentBefore = List.of();

        private Builder(String path, OperationKind kind) {
            this.path = path;
            this.kind = kind;
        }

        public Builder value(Object value) {
            this.value = YamlValues.of(value);
            return this;
        }

        public Builder yaml(String snippet) {
            this.value = YamlValues.fromText(snippet);
            return this;
        }

        public Builder required() {
            this.required = true;
            return this;
        }

        public Builder spaceBefore() {
            this.spaceBefore = true;
            return this;
        }

        /**
         * Comment block above the node, see {@link Operation#commentLines(String)}.
         */
        public Builder comment(String text) {
            this.commentBefore = commentLines(text);
            return this;
        }

        public Operation build() {
            return new Operation(path, kind, value, required, spaceBefore, commentBefore);
        }
    }
}
