package work.lcod.pipeline.yaml;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Base node of the workflow document tree.
 *
 * <p>Formatting metadata lives on the node: a blank line before it, the comment
 * lines written above it (verbatim, including the leading {@code #}; an empty
 * string stands for a blank line inside the block) and an optional trailing
 * inline comment. For a mapping entry the metadata belongs to the entry's value.
 *
 * <p>A value read from a file also remembers the lines its entry occupied there.
 * Any change to the node or to one of its descendants forgets them, so the emitter
 * copies back only what nobody touched.
 */
public abstract class YamlNode {
    private boolean spaceBefore;
    private List<String> commentLines = new ArrayList<>();
    private String inlineComment;
    private List<String> trailingComments = List.of();
    private YamlNode parent;
    private Source source;

    /**
     * Where a mapping entry was read from: the comment lines above the key, the key
     * line and everything down to the last line of the value, comments included.
     */
    record Source(List<String> lines, String key, int startLine, int keyColumn, int endLine) {
        /**
         * The entry's lines moved so that the key starts at {@code indent}.
         */
        List<String> text(int indent) {
            int shift = indent - keyColumn;
            var text = new ArrayList<String>(endLine - startLine + 1);
            for (var line : lines.subList(startLine, endLine + 1)) {
                text.add(shift(line, shift));
            }
            return text;
        }

        private static String shift(String line, int shift) {
            if (shift == 0 || line.isEmpty()) {
                return line;
            }
            if (shift > 0) {
                return " ".repeat(shift) + line;
            }
            int strip = 0;
            while (strip < -shift && strip < line.length() && line.charAt(strip) == ' ') {
                strip++;
            }
            return line.substring(strip);
        }
    }

    public boolean spaceBefore() {
        return spaceBefore;
    }

    public void setSpaceBefore(boolean spaceBefore) {
        this.spaceBefore = spaceBefore;
    }

    public List<String> commentLines() {
        return Collections.unmodifiableList(commentLines);
    }

    public void setCommentLines(List<String> commentLines) {
        this.commentLines = new ArrayList<>(Objects.requireNonNull(commentLines, "commentLines"));
        touch();
    }

    public String inlineComment() {
        return inlineComment;
    }

    public void setInlineComment(String inlineComment) {
        this.inlineComment = inlineComment;
        touch();
    }

    /**
     * Comments that followed the value inside its entry, after its last line.
     */
    public List<String> trailingComments() {
        return trailingComments;
    }

    void setTrailingComments(List<String> trailingComments) {
        this.trailingComments = List.copyOf(trailingComments);
    }

    /**
     * Moves block comments and blank-line state from {@code other} onto this node.
     */
    public void adoptFormatting(YamlNode other) {
        this.spaceBefore = other.spaceBefore;
        this.commentLines = new ArrayList<>(other.commentLines);
        touch();
    }

    public abstract YamlNode copy();

    protected <T extends YamlNode> T copyFormattingInto(T target) {
        target.setSpaceBefore(spaceBefore);
        target.setCommentLines(commentLines);
        target.setInlineComment(inlineComment);
        target.setTrailingComments(trailingComments);
        ((YamlNode) target).source = source;
        return target;
    }

    Source source() {
        return source;
    }

    void attachSource(Source source) {
        this.source = source;
    }

    void setParent(YamlNode parent) {
        this.parent = parent;
    }

    /**
     * Forgets the source text of this node and of every ancestor.
     */
    protected void touch() {
        for (var node = this; node != null; node = node.parent) {
            node.source = null;
        }
    }
}
