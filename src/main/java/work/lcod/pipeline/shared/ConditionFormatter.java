package work.lcod.pipeline.shared;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Spreads long {@code if: ${{ ... }}} expressions over several lines, breaking after
 * each {@code &&} and {@code ||}:
 *
 * <pre>
 * if: ${{
 *     always() &amp;&amp;
 *     needs.version.result == 'success'
 *   }}
 * </pre>
 *
 * The result is a multi-line plain scalar that reads back as the original one-line
 * expression, and already formatted text is left as is. Lines inside block scalars
 * are never touched.
 */
public final class ConditionFormatter {
    public static final int DEFAULT_MIN_LENGTH = 80;

    private static final Pattern IF_LINE = Pattern.compile("^(\\s*(?:- )?)if: \\$\\{\\{(.*)\\}\\}\\s*$");
    private static final Pattern BLOCK_SCALAR_START = Pattern.compile("^(\\s*)(- )?([^#'\"]*:\\s+)?[|>][-+0-9]*\\s*(#.*)?$");

    private ConditionFormatter() {}

    public static String format(String yaml) {
        return format(yaml, DEFAULT_MIN_LENGTH);
    }

    public static String format(String yaml, int minLength) {
        var lines = yaml.split("\n", -1);
        var output = new ArrayList<String>(lines.length);
        int blockParent = -1;
        for (var line : lines) {
            if (blockParent >= 0) {
                if (line.isBlank() || indentation(line) > blockParent) {
                    output.add(line);
                    continue;
                }
                blockParent = -1;
            }
            var blockStart = BLOCK_SCALAR_START.matcher(line);
            if (blockStart.matches()) {
                // inside "- key: |" the key sits two columns right of the dash
                blockParent = indentation(line) + (blockStart.group(2) != null && blockStart.group(3) != null ? 2 : 0);
                output.add(line);
                continue;
            }
            output.addAll(reflow(line, minLength));
        }
        return String.join("\n", output);
    }

    private static List<String> reflow(String line, int minLength) {
        var matcher = IF_LINE.matcher(line);
        if (!matcher.matches()) {
            return List.of(line);
        }
        var prefix = matcher.group(1);
        var condition = matcher.group(2);
        if (condition.length() < minLength || condition.contains("}}") || condition.contains("${{")) {
            return List.of(line);
        }

        var parts = split(condition.trim());
        if (parts.size() < 2) {
            return List.of(line);
        }
        for (var part : parts) {
            // a continuation line must not turn into a comment or a mapping key
            if (part.startsWith("#") || part.contains(" #") || part.contains(": ")
                || part.startsWith("---") || part.startsWith("...")) {
                return List.of(line);
            }
        }

        int keyColumn = prefix.length();
        var result = new ArrayList<String>(parts.size() + 2);
        result.add(prefix + "if: ${{");
        for (var part : parts) {
            result.add(" ".repeat(keyColumn + 4) + part);
        }
        result.add(" ".repeat(keyColumn + 2) + "}}");
        return result;
    }

    /**
     * Splits after every {@code &&} and {@code ||} that stands between whitespace and
     * outside a {@code '...'} literal. A doubled quote inside a literal toggles twice.
     */
    private static List<String> split(String text) {
        var parts = new ArrayList<String>();
        boolean quoted = false;
        int from = 0;
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (c == '\'') {
                quoted = !quoted;
                continue;
            }
            if (quoted || i == 0 || !Character.isWhitespace(text.charAt(i - 1))
                || !(text.startsWith("&&", i) || text.startsWith("||", i))) {
                continue;
            }
            int after = i + 2;
            if (after >= text.length() || !Character.isWhitespace(text.charAt(after))) {
                continue;
            }
            parts.add(text.substring(from, i).stripTrailing() + " " + text.substring(i, after));
            while (after < text.length() && Character.isWhitespace(text.charAt(after))) {
                after++;
            }
            from = after;
            i = after - 1;
        }
        parts.add(text.substring(from));
        return parts;
    }

    private static int indentation(String line) {
        int count = 0;
        while (count < line.length() && line.charAt(count) == ' ') {
            count++;
        }
        return count;
    }
}
