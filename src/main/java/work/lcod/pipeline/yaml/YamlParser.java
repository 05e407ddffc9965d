package work.lcod.pipeline.yaml;

import java.io.StringReader;
import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.DumperOptions;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.comments.CommentLine;
import org.yaml.snakeyaml.comments.CommentType;
import org.yaml.snakeyaml.error.YAMLException;
import org.yaml.snakeyaml.nodes.MappingNode;
import org.yaml.snakeyaml.nodes.Node;
import org.yaml.snakeyaml.nodes.NodeTuple;
import org.yaml.snakeyaml.nodes.ScalarNode;
import org.yaml.snakeyaml.nodes.SequenceNode;

/**
 * Reads workflow text into the {@link YamlDocument} tree, keeping comments and
 * blank lines attached to the node that follows them.
 *
 * <p>SnakeYAML composes the node graph; nothing SnakeYAML-specific escapes this class.
 */
public final class YamlParser {
    private static final Logger log = LoggerFactory.getLogger(YamlParser.class);
    private static final Pattern LINE_BREAKS = Pattern.compile("\\r(?!\\n)|[\\u0085\\u2028\\u2029]");

    private YamlParser() {}

    /**
     * Outcome of {@link #parseDocument(String)}. {@code commentsDropped} is set when the
     * comment-aware pass failed and the text had to be read without comments.
     */
    public record Result(YamlDocument document, boolean commentsDropped) {}

    public static Result parseDocument(String text) throws DocumentParseException {
        Node root;
        boolean commentsDropped = false;
        try {
            root = compose(text, true);
        } catch (RuntimeException withComments) {
            try {
                root = compose(text, false);
            } catch (YAMLException plain) {
                throw new DocumentParseException("Invalid YAML: " + firstLine(plain.getMessage()), plain);
            }
            log.warn("Comment-aware parsing failed ({}); comments will not be preserved", firstLine(withComments.getMessage()));
            commentsDropped = true;
        }
        return new Result(new Reader(text, true).toDocument(root), commentsDropped);
    }

    /**
     * Parses a standalone fragment (mapping, sequence or scalar) such as a job body.
     * Fragments do not remember their source text.
     */
    public static YamlNode parseNode(String text) throws DocumentParseException {
        Node node;
        try {
            node = compose(text, true);
        } catch (YAMLException ex) {
            throw new DocumentParseException("Invalid YAML fragment: " + firstLine(ex.getMessage()), ex);
        }
        if (node == null) {
            throw new DocumentParseException("Empty YAML fragment");
        }
        return new Reader(text, false).convert(node);
    }

    private static Node compose(String text, boolean comments) {
        var options = new LoaderOptions();
        options.setProcessComments(comments);
        options.setAllowDuplicateKeys(true);
        return new Yaml(options).compose(new StringReader(text));
    }

    /**
     * Lines of one block mapping entry: from its key down to the last non-blank line
     * indented deeper than the key. Comment lines after the value's last content line
     * are its trailing comments.
     */
    private static final class Span {
        final int keyLine;
        final int keyColumn;
        final int endLine;
        final List<String> trailing = new ArrayList<>();

        Span(int keyLine, int keyColumn, int endLine) {
            this.keyLine = keyLine;
            this.keyColumn = keyColumn;
            this.endLine = endLine;
        }
    }

    private record Attachment(YamlNode value, String key, Span span) {}

    /**
     * One conversion of a SnakeYAML graph into the tree.
     */
    private static final class Reader {
        private final List<String> lines;
        private final Map<NodeTuple, Span> spans = new IdentityHashMap<>();
        private final Map<Integer, Span> owners = new TreeMap<>();
        private final Set<NodeTuple> attached = Collections.newSetFromMap(new IdentityHashMap<>());
        private final List<Attachment> attachments = new ArrayList<>();
        private final boolean trackSources;

        Reader(String text, boolean trackSources) {
            // SnakeYAML counts these as line breaks too; line numbers would not match
            this.trackSources = trackSources && !LINE_BREAKS.matcher(text).find();
            var split = new ArrayList<String>();
            for (var line : text.split("\n", -1)) {
                split.add(line.endsWith("\r") ? line.substring(0, line.length() - 1) : line);
            }
            this.lines = List.copyOf(split);
        }

        YamlDocument toDocument(Node node) throws DocumentParseException {
            if (node == null) {
                return new YamlDocument();
            }
            if (!(node instanceof MappingNode mappingNode)) {
                throw new DocumentParseException("Workflow root must be a mapping, found " + kind(node));
            }
            if (trackSources) {
                measureAll(mappingNode);
            }
            var converted = convertMapping(mappingNode);
            var root = new YamlMapping();
            converted.entries().forEach(entry -> root.put(entry.getKey(), entry.getValue()));

            var leading = new ArrayList<>(commentLines(mappingNode.getBlockComments()));
            List<String> header = List.of();
            if (root.isEmpty()) {
                header = trimBlankEdges(leading, false);
            } else {
                var first = root.get(root.keys().iterator().next());
                leading.addAll(rawComments(first));
                int start = 0;
                while (start < leading.size() && leading.get(start).isEmpty()) {
                    start++;
                }
                int blank = leading.subList(start, leading.size()).indexOf("");
                if (blank > 0) {
                    header = new ArrayList<>(leading.subList(start, start + blank));
                    applyBlockComments(first, leading.subList(start + blank, leading.size()));
                } else {
                    applyBlockComments(first, leading.subList(start, leading.size()));
                }
            }

            var trailer = trimBlankEdges(commentLines(mappingNode.getEndComments()), true);
            attachSources();
            return new YamlDocument(root, header, trailer);
        }

        YamlNode convert(Node node) throws DocumentParseException {
            if (node instanceof MappingNode mapping) {
                return convertMapping(mapping);
            }
            if (node instanceof SequenceNode sequence) {
                return convertSequence(sequence);
            }
            if (node instanceof ScalarNode scalar) {
                var converted = new YamlScalar(scalar.getValue(), style(scalar.getScalarStyle()));
                converted.setInlineComment(inline(scalar.getInLineComments()));
                return converted;
            }
            throw new DocumentParseException("Unsupported YAML node: " + kind(node));
        }

        private YamlMapping convertMapping(MappingNode node) throws DocumentParseException {
            var mapping = new YamlMapping(node.getFlowStyle() == DumperOptions.FlowStyle.FLOW);
            for (var tuple : node.getValue()) {
                if (!(tuple.getKeyNode() instanceof ScalarNode keyNode)) {
                    throw new DocumentParseException(
                        "Unsupported complex mapping key at line " + (tuple.getKeyNode().getStartMark().getLine() + 1)
                    );
                }
                var valueNode = tuple.getValueNode();
                var value = convert(valueNode);

                var comments = new ArrayList<>(commentLines(keyNode.getBlockComments()));
                if (!(valueNode instanceof ScalarNode)) {
                    comments.addAll(commentLines(valueNode.getBlockComments()));
                }
                applyBlockComments(value, comments);

                var keyInline = inline(keyNode.getInLineComments());
                var valueInline = value.inlineComment() != null ? value.inlineComment() : inline(valueNode.getInLineComments());
                value.setInlineComment(keyInline != null ? keyInline : valueInline);
                mapping.put(keyNode.getValue(), value);

                // an alias reuses the tuples of its anchor; only the first occurrence is where they were written
                var span = spans.get(tuple);
                if (span != null && attached.add(tuple)) {
                    attachments.add(new Attachment(value, keyNode.getValue(), span));
                }
            }
            return mapping;
        }

        private YamlSequence convertSequence(SequenceNode node) throws DocumentParseException {
            var sequence = new YamlSequence(node.getFlowStyle() == DumperOptions.FlowStyle.FLOW);
            for (var item : node.getValue()) {
                var converted = convert(item);
                var comments = new ArrayList<>(commentLines(item.getBlockComments()));
                if (converted instanceof YamlMapping mapping && !mapping.isEmpty() && !mapping.flow()) {
                    // the first key carries what was written above the dash
                    var first = mapping.get(mapping.keys().iterator().next());
                    comments.addAll(rawComments(first));
                    first.setSpaceBefore(false);
                    first.setCommentLines(List.of());
                }
                applyBlockComments(converted, comments);
                sequence.add(converted);
            }
            return sequence;
        }

        private void measureAll(Node node) {
            if (node instanceof MappingNode mapping) {
                for (var tuple : mapping.getValue()) {
                    if (mapping.getFlowStyle() != DumperOptions.FlowStyle.FLOW) {
                        measure(tuple);
                    }
                    measureAll(tuple.getValueNode());
                }
            } else if (node instanceof SequenceNode sequence) {
                for (var item : sequence.getValue()) {
                    measureAll(item);
                }
            }
        }

        /**
         * Records the span of one entry. Entries are measured outside-in, so a trailing
         * comment ends up owned by the innermost entry it follows.
         */
        private void measure(NodeTuple tuple) {
            var key = tuple.getKeyNode();
            int keyLine = key.getStartMark().getLine();
            int keyColumn = key.getStartMark().getColumn();
            if (keyLine >= lines.size() || keyColumn > lines.get(keyLine).length()
                || !lines.get(keyLine).substring(0, keyColumn).isBlank()) {
                return;
            }

            var last = deepestLast(tuple.getValueNode());
            // sequence items may sit at the key's own column; everything up to the last one belongs here
            int lastStart = Math.max(keyLine, last.getStartMark().getLine());
            int end = keyLine;
            for (int line = keyLine + 1; line < lines.size(); line++) {
                var text = lines.get(line);
                if (text.isBlank()) {
                    continue;
                }
                if (line > lastStart && indentation(text) <= keyColumn) {
                    break;
                }
                end = line;
            }

            int content = Math.max(lastStart, last.getEndMark().getLine());
            if (last instanceof ScalarNode scalar && isBlock(scalar)) {
                content = blockScalarEnd(scalar);
                end = Math.max(end, content);
            }
            content = Math.min(content, end);

            var span = new Span(keyLine, keyColumn, end);
            spans.put(tuple, span);
            for (int line = content + 1; line <= end; line++) {
                owners.put(line, span);
            }
        }

        /**
         * Last line of a literal or folded scalar, counting the blank lines a keep
         * indicator holds on to.
         */
        private int blockScalarEnd(ScalarNode scalar) {
            int header = scalar.getStartMark().getLine();
            var value = scalar.getValue();
            if (value.isBlank()) {
                return header + Math.max(0, trailingBreaks(value) - 1);
            }
            int contentIndent = -1;
            int last = header;
            for (int line = header + 1; line < lines.size(); line++) {
                var text = lines.get(line);
                if (text.isBlank()) {
                    continue;
                }
                int indent = indentation(text);
                if (contentIndent < 0) {
                    contentIndent = indent;
                } else if (indent < contentIndent) {
                    break;
                }
                last = line;
            }
            return Math.min(lines.size() - 1, last + Math.max(0, trailingBreaks(value) - 1));
        }

        private void attachSources() {
            owners.forEach((line, span) -> {
                var text = lines.get(line).strip();
                if (text.startsWith("#")) {
                    span.trailing.add(text);
                }
            });
            for (var attachment : attachments) {
                var value = attachment.value();
                var span = attachment.span();
                value.setTrailingComments(span.trailing);
                int start = span.keyLine - value.commentLines().size();
                if (start >= 0) {
                    value.attachSource(new YamlNode.Source(lines, attachment.key(), start, span.keyColumn, span.endLine));
                }
            }
        }

        private boolean owned(CommentLine comment) {
            return comment.getStartMark() != null && owners.containsKey(comment.getStartMark().getLine());
        }

        private List<String> commentLines(List<CommentLine> comments) {
            if (comments == null || comments.isEmpty()) {
                return List.of();
            }
            var result = new ArrayList<String>(comments.size());
            for (var comment : comments) {
                if (owned(comment)) {
                    continue;
                }
                result.add(comment.getCommentType() == CommentType.BLANK_LINE ? "" : "#" + comment.getValue());
            }
            return result;
        }

        private String inline(List<CommentLine> comments) {
            if (comments == null) {
                return null;
            }
            for (var comment : comments) {
                if (comment.getCommentType() != CommentType.BLANK_LINE && !owned(comment)) {
                    return "#" + comment.getValue();
                }
            }
            return null;
        }
    }

    private static Node deepestLast(Node node) {
        var current = node;
        while (true) {
            if (current instanceof MappingNode mapping && mapping.getFlowStyle() != DumperOptions.FlowStyle.FLOW
                && !mapping.getValue().isEmpty()) {
                current = mapping.getValue().get(mapping.getValue().size() - 1).getValueNode();
            } else if (current instanceof SequenceNode sequence && sequence.getFlowStyle() != DumperOptions.FlowStyle.FLOW
                && !sequence.getValue().isEmpty()) {
                current = sequence.getValue().get(sequence.getValue().size() - 1);
            } else {
                return current;
            }
        }
    }

    private static boolean isBlock(ScalarNode scalar) {
        return scalar.getScalarStyle() == DumperOptions.ScalarStyle.LITERAL
            || scalar.getScalarStyle() == DumperOptions.ScalarStyle.FOLDED;
    }

    private static int trailingBreaks(String value) {
        int count = 0;
        while (count < value.length() && value.charAt(value.length() - 1 - count) == '\n') {
            count++;
        }
        return count;
    }

    private static int indentation(String line) {
        int count = 0;
        while (count < line.length() && line.charAt(count) == ' ') {
            count++;
        }
        return count;
    }

    private static List<String> rawComments(YamlNode node) {
        var raw = new ArrayList<String>();
        if (node.spaceBefore()) {
            raw.add("");
        }
        raw.addAll(node.commentLines());
        return raw;
    }

    private static void applyBlockComments(YamlNode node, List<String> lines) {
        int start = 0;
        while (start < lines.size() && lines.get(start).isEmpty()) {
            start++;
        }
        node.setSpaceBefore(start > 0);
        node.setCommentLines(lines.subList(start, lines.size()));
    }

    private static List<String> trimBlankEdges(List<String> lines, boolean keepLeadingBlank) {
        int start = 0;
        int end = lines.size();
        while (start < end && lines.get(start).isEmpty()) {
            start++;
        }
        while (end > start && lines.get(end - 1).isEmpty()) {
            end--;
        }
        var trimmed = new ArrayList<String>();
        if (keepLeadingBlank && start > 0 && start < end) {
            trimmed.add("");
        }
        trimmed.addAll(lines.subList(start, end));
        return trimmed;
    }

    private static YamlScalar.Style style(DumperOptions.ScalarStyle style) {
        if (style == null) {
            return YamlScalar.Style.PLAIN;
        }
        return switch (style) {
            case SINGLE_QUOTED -> YamlScalar.Style.SINGLE_QUOTED;
            case DOUBLE_QUOTED -> YamlScalar.Style.DOUBLE_QUOTED;
            case LITERAL -> YamlScalar.Style.LITERAL;
            case FOLDED -> YamlScalar.Style.FOLDED;
            default -> YamlScalar.Style.PLAIN;
        };
    }

    private static String kind(Node node) {
        return node.getNodeId().name().toLowerCase();
    }

    private static String firstLine(String message) {
        if (message == null) {
            return "unknown error";
        }
        int newline = message.indexOf('\n');
        return newline < 0 ? message : message.substring(0, newline);
    }
}
