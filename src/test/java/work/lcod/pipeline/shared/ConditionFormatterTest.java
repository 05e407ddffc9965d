package work.lcod.pipeline.shared;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;

import org.junit.jupiter.api.Test;

class ConditionFormatterTest {
    private static final String LONG_IF =
        "    if: ${{ always() && needs.version.result == 'success' && needs.version.outputs.version != '' }}";

    @Test
    void breaksLongConditionsAfterOperators() {
        assertEquals("""
                if: ${{
                    always() &&
                    needs.version.result == 'success' &&
                    needs.version.outputs.version != ''
                  }}\
            """, ConditionFormatter.format(LONG_IF));
    }

    @Test
    void leavesShortConditionsAlone() {
        var line = "    if: ${{ always() && github.event_name != 'pull_request' }}";
        assertEquals(line, ConditionFormatter.format(line));
    }

    @Test
    void honoursCustomThreshold() {
        var line = "  if: ${{ a && b }}";
        assertEquals("  if: ${{\n      a &&\n      b\n    }}", ConditionFormatter.format(line, 5));
    }

    @Test
    void skipsBlockScalarContent() {
        var text = "    run: |\n" + "  " + LONG_IF + "\n    name: next";
        assertEquals(text, ConditionFormatter.format(text));
    }

    @Test
    void skipsQuotedConditions() {
        var line = "    if: \"${{ always() && needs.version.result == 'success' && needs.version.outputs.version != '' }}\"";
        assertEquals(line, ConditionFormatter.format(line));
    }

    @Test
    void keepsSequenceItemIndentation() {
        var formatted = ConditionFormatter.format("      - if: ${{ a && b }}", 5);
        assertEquals("      - if: ${{\n            a &&\n            b\n          }}", formatted);
    }

    @Test
    void formattingTwiceChangesNothing() {
        var text = "jobs:\n  build:\n" + LONG_IF + "\n    runs-on: ubuntu-latest\n";
        var once = ConditionFormatter.format(text);
        assertNotEquals(text, once);
        assertEquals(once, ConditionFormatter.format(once));
    }

    @Test
    void keepsOperatorsInsideStringLiterals() {
        var line = "  if: ${{ github.event.head_commit.message != 'fix  &&  docs' && needs.version.result == 'success' }}";
        assertEquals("  if: ${{\n"
            + "      github.event.head_commit.message != 'fix  &&  docs' &&\n"
            + "      needs.version.result == 'success'\n"
            + "    }}", ConditionFormatter.format(line, 5));
    }

    @Test
    void ignoresOperatorsAfterEscapedQuotes() {
        var line = "  if: ${{ inputs.note == 'it''s  ||  fine' || inputs.force }}";
        assertEquals("  if: ${{\n      inputs.note == 'it''s  ||  fine' ||\n      inputs.force\n    }}",
            ConditionFormatter.format(line, 5));
    }
}
