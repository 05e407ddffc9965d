package work.lcod.pipeline.region;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * User-owned text kept between the custom jobs markers. The content excludes the
 * marker lines and has no leading or trailing blank lines.
 */
public record CustomRegion(String content) {
    public static final String START_MARKER = "<--START CUSTOM JOBS-->";
    public static final String END_MARKER = "<--END CUSTOM JOBS-->";

    static final String INDENT = "  ";

    public CustomRegion {
        Objects.requireNonNull(content, "content");
        content = trimBlankLines(content);
    }

    private static final String EXAMPLE = """
          #=============================================================================
          # CUSTOM JOBS SECTION (Add your test, deploy, and remote-test jobs here)
          #=============================================================================
          # This section is preserved across regenerations. Add your custom jobs between
          # the START and END markers.
          #
          # Example: test-gate pattern (recommended for production workflows)
          # Uncomment and customize the example below to prevent deployments when tests fail.

          # test-gate:
          #   needs: [ ]  # Add all test job names (e.g., test-api, test-frontend)
          #   if: always()  # Add failure checks and success conditions
          #   runs-on: ubuntu-latest
          #   steps:
          #     - run: echo "All tests passed"
        """;

    public static CustomRegion empty() {
        return new CustomRegion("");
    }

    /**
     * Commented example written when a document has no custom region yet.
     */
    public static CustomRegion example() {
        return new CustomRegion(EXAMPLE);
    }

    public boolean isEmpty() {
        return content.isEmpty();
    }

    /**
     * Region with the given blocks appended, separated by one blank line.
     */
    public CustomRegion append(List<String> blocks) {
        var parts = new ArrayList<String>();
        if (!isEmpty()) {
            parts.add(content);
        }
        for (var block : blocks) {
            var trimmed = trimBlankLines(block);
            if (!trimmed.isEmpty()) {
                parts.add(trimmed);
            }
        }
        return new CustomRegion(String.join("\n\n", parts));
    }

    /**
     * The region wrapped in its markers, indented as entries of {@code jobs}.
     */
    public String render() {
        var builder = new StringBuilder();
        builder.append(INDENT).append("# ").append(START_MARKER).append("\n\n");
        if (!isEmpty()) {
            builder.append(content).append("\n\n");
        }
        builder.append(INDENT).append("# ").append(END_MARKER).append('\n');
        return builder.toString();
    }

    static String trimBlankLines(String text) {
        var lines = text.split("\n", -1);
        int start = 0;
        int end = lines.length;
        while (start < end && lines[start].isBlank()) {
            start++;
        }
        while (end > start && lines[end - 1].isBlank()) {
            end--;
        }
        return String.join("\n", List.of(lines).subList(start, end));
    }
}
