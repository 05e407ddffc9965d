package work.lcod.pipeline.yaml;

import java.util.Objects;
import java.util.Set;

/**
 * Scalar leaf. The style records how the scalar was written in the source text,
 * or {@link Style#ANY} when the emitter is free to choose.
 */
public final class YamlScalar extends YamlNode {
    private static final Set<String> NULL_FORMS = Set.of("", "~", "null", "Null", "NULL");

    public enum Style {
        ANY,
        PLAIN,
        SINGLE_QUOTED,
        DOUBLE_QUOTED,
        LITERAL,
        FOLDED
    }

    private final String value;
    private final Style style;

    public YamlScalar(String value, Style style) {
        this.value = Objects.requireNonNull(value, "value");
        this.style = Objects.requireNonNull(style, "style");
    }

    public static YamlScalar of(String value) {
        return new YamlScalar(value, Style.ANY);
    }

    public static YamlScalar plain(String value) {
        return new YamlScalar(value, Style.PLAIN);
    }

    public static YamlScalar doubleQuoted(String value) {
        return new YamlScalar(value, Style.DOUBLE_QUOTED);
    }

    public String value() {
        return value;
    }

    public Style style() {
        return style;
    }

    /**
     * True for an unquoted empty value, {@code ~} or {@code null}.
     */
    public boolean isNull() {
        return style == Style.PLAIN && NULL_FORMS.contains(value);
    }

    @Override
    public YamlScalar copy() {
        return copyFormattingInto(new YamlScalar(value, style));
    }

    @Override
    public String toString() {
        return value;
    }
}
