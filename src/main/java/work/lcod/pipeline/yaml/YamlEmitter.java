package work.lcod.pipeline.yaml;

import java.io.StringWriter;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.function.UnaryOperator;
import java.util.regex.Pattern;
import org.yaml.snakeyaml.DumperOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.comments.CommentLine;
import org.yaml.snakeyaml.comments.CommentType;
import org.yaml.snakeyaml.nodes.MappingNode;
import org.yaml.snakeyaml.nodes.Node;
import org.yaml.snakeyaml.nodes.NodeId;
import org.yaml.snakeyaml.nodes.NodeTuple;
import org.yaml.snakeyaml.nodes.ScalarNode;
import org.yaml.snakeyaml.nodes.SequenceNode;
import org.yaml.snakeyaml.nodes.Tag;
import org.yaml.snakeyaml.resolver.Resolver;

/**
 * Writes a {@link YamlDocument} through SnakeYAML's serializer with two-space
 * indentation, block collections, sequences indented under their key and no line
 * wrapping.
 *
 * <p>Entries that still hold the text they were read from are not serialized: a
 * placeholder stands in for them and is replaced by the original lines, moved to
 * the placeholder's indentation. Only built or changed nodes get SnakeYAML's layout.
 */
public final class YamlEmitter {
    private static final int INDENT = 2;
    private static final String SPLICE = "lcod-splice-";
    private static final String TRAILER = "lcod-trailer-";
    private static final String ANCHOR = "lcod-region-anchor";
    private static final Pattern SPLICE_LINE = Pattern.compile("^( *)\\S.*: " + SPLICE + "(\\d+)$");
    private static final Pattern TRAILER_LINE = Pattern.compile("^( *)(?:- )?" + TRAILER + "(\\d+)(?:: " + TRAILER + "\\d+)?$");
    private static final Resolver RESOLVER = new Resolver();

    private YamlEmitter() {}

    /**
     * Emitted text split right after the entry at the anchor path. When the anchor
     * was not found, {@code head} holds the whole document and {@code tail} is empty.
     */
    public record Output(String head, String tail, boolean anchored) {
        public String text() {
            return head + tail;
        }
    }

    public static String emit(YamlDocument document) {
        return emit(document, List.of()).text();
    }

    public static Output emit(YamlDocument document, List<String> anchorPath) {
        return emit(document, anchorPath, UnaryOperator.identity());
    }

    /**
     * @param anchorPath entry after which the output is split, empty for none
     * @param reformat   applied to the serialized text before source text is copied back,
     *                   so it only ever sees what this class generated
     */
    public static Output emit(YamlDocument document, List<String> anchorPath, UnaryOperator<String> reformat) {
        var builder = new Builder(anchorPath);
        var leftover = new ArrayList<String>();
        var root = builder.mapping(document.root().entries(), List.of(), false, leftover);
        var lines = builder.splice(reformat.apply(serialize(root)), 0);

        var head = new ArrayList<String>(document.header());
        if (!head.isEmpty()) {
            head.add("");
        }
        var trailer = new ArrayList<String>(leftover);
        trailer.addAll(document.trailer());

        int anchor = -1;
        for (int i = 0; i < lines.size(); i++) {
            if (lines.get(i).strip().equals(ANCHOR + ": " + ANCHOR)) {
                anchor = i;
                break;
            }
        }
        if (anchor < 0) {
            head.addAll(lines);
            head.addAll(trailer);
            return new Output(join(head), "", false);
        }
        head.addAll(lines.subList(0, anchor));
        var tail = new ArrayList<>(lines.subList(anchor + 1, lines.size()));
        tail.addAll(trailer);
        return new Output(join(head), join(tail), true);
    }

    /**
     * Serializes one mapping entry (with the comments above it) at the given indentation,
     * without a trailing newline.
     */
    public static String emitEntry(String key, YamlNode value, int indent) {
        var source = value.source();
        if (source != null && source.key().equals(key)) {
            return String.join("\n", source.text(indent));
        }
        var builder = new Builder(List.of());
        var leftover = new ArrayList<String>();
        var root = builder.mapping(List.of(Map.entry(key, value)), List.of(), false, leftover);
        var lines = builder.splice(serialize(root), indent);
        for (var comment : leftover) {
            lines.add(" ".repeat(indent + INDENT) + comment);
        }
        return String.join("\n", lines);
    }

    private static String serialize(Node root) {
        var options = new DumperOptions();
        options.setDefaultFlowStyle(DumperOptions.FlowStyle.BLOCK);
        options.setProcessComments(true);
        options.setIndent(INDENT);
        options.setIndicatorIndent(INDENT);
        options.setIndentWithIndicator(true);
        options.setWidth(4096);
        options.setSplitLines(false);
        options.setLineBreak(DumperOptions.LineBreak.UNIX);
        var writer = new StringWriter();
        new Yaml(options).serialize(root, writer);
        return writer.toString();
    }

    private static String join(List<String> lines) {
        var builder = new StringBuilder();
        for (var line : lines) {
            builder.append(line).append('\n');
        }
        return builder.toString();
    }

    /**
     * Converts tree nodes into SnakeYAML nodes and remembers which placeholder stands
     * for which source text.
     */
    private static final class Builder {
        private final List<String> anchorPath;
        private final List<YamlNode.Source> sources = new ArrayList<>();
        private final List<List<String>> trailers = new ArrayList<>();

        Builder(List<String> anchorPath) {
            this.anchorPath = anchorPath;
        }

        /**
         * @param item     the mapping is a sequence item, so its first key shares the dash line
         * @param leftover receives trailing comments that found no following entry
         */
        MappingNode mapping(List<Map.Entry<String, YamlNode>> entries, List<String> path, boolean item,
                            List<String> leftover) {
            var tuples = new ArrayList<NodeTuple>();
            var pending = new ArrayList<String>();
            boolean root = path.isEmpty();
            boolean first = true;
            for (var entry : entries) {
                var key = entry.getKey();
                var value = entry.getValue();
                var childPath = append(path, key);
                var keyNode = new ScalarNode(RESOLVER.resolve(NodeId.scalar, key, true), key, null, null,
                    DumperOptions.ScalarStyle.PLAIN);
                boolean dashLine = item && first;

                var comments = new ArrayList<CommentLine>();
                if (!dashLine) {
                    if (value.spaceBefore() && !(root && first)) {
                        comments.add(blankLine());
                    }
                    pending.forEach(line -> comments.add(comment(line, CommentType.BLOCK)));
                    pending.clear();
                }

                Node valueNode;
                var source = value.source();
                if (!dashLine && source != null && source.key().equals(key) && !leadsToAnchor(childPath)) {
                    valueNode = plain(SPLICE + sources.size());
                    sources.add(source);
                } else {
                    if (!dashLine) {
                        for (var line : value.commentLines()) {
                            // SnakeYAML indents a comment that follows a blank line twice below the root
                            if (!line.isEmpty()) {
                                comments.add(comment(line, CommentType.BLOCK));
                            } else if (root) {
                                comments.add(blankLine());
                            }
                        }
                    }
                    var trailing = new ArrayList<String>();
                    valueNode = node(value, childPath, trailing);
                    trailing.addAll(value.trailingComments());
                    if (!trailer(valueNode, trailing)) {
                        pending.addAll(trailing);
                    }
                    if (value.inlineComment() != null) {
                        var inline = List.of(comment(value.inlineComment(), CommentType.IN_LINE));
                        if (valueNode instanceof ScalarNode scalar) {
                            if (!isBlock(scalar)) {
                                scalar.setInLineComments(inline);
                            }
                        } else {
                            keyNode.setInLineComments(inline);
                        }
                    }
                }
                if (!comments.isEmpty()) {
                    keyNode.setBlockComments(comments);
                }
                tuples.add(new NodeTuple(keyNode, valueNode));
                if (childPath.equals(anchorPath)) {
                    tuples.add(new NodeTuple(plain(ANCHOR), plain(ANCHOR)));
                }
                first = false;
            }
            leftover.addAll(pending);
            return new MappingNode(Tag.MAP, tuples, DumperOptions.FlowStyle.BLOCK);
        }

        private boolean leadsToAnchor(List<String> path) {
            return anchorPath.size() > path.size() && anchorPath.subList(0, path.size()).equals(path);
        }

        /**
         * Appends a placeholder as the last child of a block collection; its line becomes
         * the comments, so they stay inside the collection at its children's indentation.
         */
        private boolean trailer(Node node, List<String> comments) {
            if (comments.isEmpty()) {
                return true;
            }
            var marker = TRAILER + trailers.size();
            if (node instanceof MappingNode mapping && mapping.getFlowStyle() == DumperOptions.FlowStyle.BLOCK
                && !mapping.getValue().isEmpty()) {
                mapping.getValue().add(new NodeTuple(plain(marker), plain(marker)));
            } else if (node instanceof SequenceNode sequence && sequence.getFlowStyle() == DumperOptions.FlowStyle.BLOCK
                && !sequence.getValue().isEmpty()) {
                sequence.getValue().add(plain(marker));
            } else {
                return false;
            }
            trailers.add(comments);
            return true;
        }

        private Node node(YamlNode value, List<String> path, List<String> leftover) {
            if (value instanceof YamlMapping mapping) {
                return mapping.flow() ? flow(mapping) : mapping(mapping.entries(), path, false, leftover);
            }
            if (value instanceof YamlSequence sequence) {
                if (sequence.flow()) {
                    return flow(sequence);
                }
                var itemPath = append(path, "-");
                var items = new ArrayList<Node>();
                for (var item : sequence.items()) {
                    if (item instanceof YamlMapping mapping && !mapping.flow()) {
                        items.add(mapping(mapping.entries(), itemPath, true, leftover));
                    } else {
                        items.add(node(item, itemPath, leftover));
                    }
                }
                return new SequenceNode(Tag.SEQ, items, DumperOptions.FlowStyle.BLOCK);
            }
            return scalar((YamlScalar) value);
        }

        /**
         * Replaces placeholder lines with the source text or the trailing comments they
         * stand for and shifts everything right by {@code indent}.
         */
        List<String> splice(String text, int indent) {
            var body = text.endsWith("\n") ? text.substring(0, text.length() - 1) : text;
            var lines = new ArrayList<String>();
            for (var line : body.split("\n", -1)) {
                if (line.isBlank()) {
                    lines.add("");
                    continue;
                }
                var shifted = " ".repeat(indent) + line;
                var placeholder = SPLICE_LINE.matcher(shifted);
                var trailer = TRAILER_LINE.matcher(shifted);
                if (placeholder.matches()) {
                    var source = sources.get(Integer.parseInt(placeholder.group(2)));
                    lines.addAll(source.text(placeholder.group(1).length()));
                } else if (trailer.matches()) {
                    for (var comment : trailers.get(Integer.parseInt(trailer.group(2)))) {
                        lines.add(trailer.group(1) + comment);
                    }
                } else {
                    lines.add(shifted);
                }
            }
            return lines;
        }
    }

    private static Node flow(YamlNode value) {
        if (value instanceof YamlMapping mapping) {
            var tuples = new ArrayList<NodeTuple>();
            for (var entry : mapping.entries()) {
                var key = new ScalarNode(RESOLVER.resolve(NodeId.scalar, entry.getKey(), true), entry.getKey(),
                    null, null, DumperOptions.ScalarStyle.PLAIN);
                tuples.add(new NodeTuple(key, flow(entry.getValue())));
            }
            return new MappingNode(Tag.MAP, tuples, DumperOptions.FlowStyle.FLOW);
        }
        if (value instanceof YamlSequence sequence) {
            var items = new ArrayList<Node>();
            for (var item : sequence.items()) {
                items.add(flow(item));
            }
            return new SequenceNode(Tag.SEQ, items, DumperOptions.FlowStyle.FLOW);
        }
        return scalar((YamlScalar) value);
    }

    private static ScalarNode scalar(YamlScalar scalar) {
        var value = scalar.value();
        return switch (scalar.style()) {
            case PLAIN -> new ScalarNode(RESOLVER.resolve(NodeId.scalar, value, true), value, null, null,
                DumperOptions.ScalarStyle.PLAIN);
            case ANY -> string(value, value.indexOf('\n') >= 0 ? DumperOptions.ScalarStyle.LITERAL : DumperOptions.ScalarStyle.PLAIN);
            case SINGLE_QUOTED -> string(value, DumperOptions.ScalarStyle.SINGLE_QUOTED);
            case DOUBLE_QUOTED -> string(value, DumperOptions.ScalarStyle.DOUBLE_QUOTED);
            case LITERAL -> string(value, DumperOptions.ScalarStyle.LITERAL);
            case FOLDED -> string(value, DumperOptions.ScalarStyle.FOLDED);
        };
    }

    /**
     * A string scalar; SnakeYAML quotes it when the requested style would read back
     * as another type or is not possible for the value.
     */
    private static ScalarNode string(String value, DumperOptions.ScalarStyle style) {
        return new ScalarNode(Tag.STR, value, null, null, style);
    }

    private static ScalarNode plain(String value) {
        return new ScalarNode(Tag.STR, value, null, null, DumperOptions.ScalarStyle.PLAIN);
    }

    private static boolean isBlock(ScalarNode scalar) {
        return scalar.getScalarStyle() == DumperOptions.ScalarStyle.LITERAL
            || scalar.getScalarStyle() == DumperOptions.ScalarStyle.FOLDED;
    }

    private static CommentLine blankLine() {
        return new CommentLine(null, null, "", CommentType.BLANK_LINE);
    }

    private static CommentLine comment(String line, CommentType type) {
        return new CommentLine(null, null, line.startsWith("#") ? line.substring(1) : " " + line, type);
    }

    private static List<String> append(List<String> path, String key) {
        var next = new ArrayList<String>(path.size() + 1);
        next.addAll(path);
        next.add(key);
        return next;
    }
}
