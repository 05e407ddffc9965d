package work.lcod.pipeline.yaml;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

public final class YamlSequence extends YamlNode {
    private final List<YamlNode> items = new ArrayList<>();
    private final boolean flow;

    public YamlSequence() {
        this(false);
    }

    public YamlSequence(boolean flow) {
        this.flow = flow;
    }

    public boolean flow() {
        return flow;
    }

    public List<YamlNode> items() {
        return Collections.unmodifiableList(items);
    }

    public YamlSequence add(YamlNode item) {
        items.add(item);
        item.setParent(this);
        touch();
        return this;
    }

    public int size() {
        return items.size();
    }

    public boolean isEmpty() {
        return items.isEmpty();
    }

    @Override
    public YamlSequence copy() {
        var copy = new YamlSequence(flow);
        for (var item : items) {
            copy.add(item.copy());
        }
        return copyFormattingInto(copy);
    }
}
