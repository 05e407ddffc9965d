package work.lcod.pipeline.yaml;

import java.util.List;
import java.util.Map;

/**
 * Builds tree nodes from plain Java values or from indented YAML snippets.
 */
public final class YamlValues {
    private YamlValues() {}

    public static YamlNode of(Object value) {
        if (value == null) {
            return YamlScalar.plain("");
        }
        if (value instanceof YamlNode node) {
            return node.copy();
        }
        if (value instanceof String text) {
            return YamlScalar.of(text);
        }
        if (value instanceof Number || value instanceof Boolean) {
            return YamlScalar.plain(String.valueOf(value));
        }
        if (value instanceof List<?> list) {
            var sequence = new YamlSequence();
            list.forEach(item -> sequence.add(of(item)));
            return sequence;
        }
        if (value instanceof Map<?, ?> map) {
            var mapping = new YamlMapping();
            map.forEach((key, item) -> mapping.put(String.valueOf(key), of(item)));
            return mapping;
        }
        throw new IllegalArgumentException("Unsupported value type: " + value.getClass().getName());
    }

    /**
     * Inline sequence of plain names, written as {@code [a, b]}.
     */
    public static YamlSequence flowList(List<String> names) {
        var sequence = new YamlSequence(true);
        names.forEach(name -> sequence.add(YamlScalar.of(name)));
        return sequence;
    }

    /**
     * Parses a YAML snippet after removing the indentation shared by its lines.
     */
    public static YamlNode fromText(String text) {
        try {
            return YamlParser.parseNode(dedent(text));
        } catch (DocumentParseException ex) {
            throw new IllegalArgumentException(ex.getMessage(), ex);
        }
    }

    static String dedent(String text) {
        var lines = text.split("\n", -1);
        int common = Integer.MAX_VALUE;
        for (var line : lines) {
            if (line.isBlank()) {
                continue;
            }
            int indent = 0;
            while (indent < line.length() && line.charAt(indent) == ' ') {
                indent++;
            }
            common = Math.min(common, indent);
        }
        if (common == Integer.MAX_VALUE) {
            return "";
        }
        var builder = new StringBuilder();
        for (var line : lines) {
            builder.append(line.isBlank() ? "" : line.substring(common)).append('\n');
        }
        return builder.toString().strip() + "\n";
    }
}
