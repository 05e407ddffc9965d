package work.lcod.pipeline.yaml;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * A parsed workflow file: a leading comment block, the root mapping and any
 * comments left after the last entry.
 */
public final class YamlDocument {
    private final YamlMapping root;
    private List<String> header;
    private List<String> trailer;

    public YamlDocument() {
        this(new YamlMapping(), List.of(), List.of());
    }

    public YamlDocument(YamlMapping root, List<String> header, List<String> trailer) {
        this.root = Objects.requireNonNull(root, "root");
        this.header = new ArrayList<>(header);
        this.trailer = new ArrayList<>(trailer);
    }

    public YamlMapping root() {
        return root;
    }

    public List<String> header() {
        return header;
    }

    public void setHeader(List<String> header) {
        this.header = new ArrayList<>(header);
    }

    public List<String> trailer() {
        return trailer;
    }

    public void setTrailer(List<String> trailer) {
        this.trailer = new ArrayList<>(trailer);
    }
}
