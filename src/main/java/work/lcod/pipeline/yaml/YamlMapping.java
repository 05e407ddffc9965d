package work.lcod.pipeline.yaml;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Ordered mapping. Replacing an existing key keeps its position; new keys are
 * appended unless inserted explicitly before a sibling.
 */
public final class YamlMapping extends YamlNode {
    private final LinkedHashMap<String, YamlNode> entries = new LinkedHashMap<>();
    private final boolean flow;

    public YamlMapping() {
        this(false);
    }

    public YamlMapping(boolean flow) {
        this.flow = flow;
    }

    public boolean flow() {
        return flow;
    }

    public YamlNode get(String key) {
        return entries.get(key);
    }

    public boolean containsKey(String key) {
        return entries.containsKey(key);
    }

    public YamlMapping put(String key, YamlNode value) {
        entries.put(key, value);
        value.setParent(this);
        touch();
        return this;
    }

    public YamlNode remove(String key) {
        touch();
        return entries.remove(key);
    }

    /**
     * Inserts {@code key} right before {@code sibling}, or appends when the sibling is absent.
     */
    public void putBefore(String sibling, String key, YamlNode value) {
        if (!entries.containsKey(sibling) || entries.containsKey(key)) {
            put(key, value);
            return;
        }
        value.setParent(this);
        touch();
        var snapshot = new ArrayList<>(entries.entrySet());
        entries.clear();
        for (var entry : snapshot) {
            if (entry.getKey().equals(sibling)) {
                entries.put(key, value);
            }
            entries.put(entry.getKey(), entry.getValue());
        }
    }

    public Set<String> keys() {
        return Collections.unmodifiableSet(entries.keySet());
    }

    public List<Map.Entry<String, YamlNode>> entries() {
        return List.copyOf(entries.entrySet());
    }

    public int size() {
        return entries.size();
    }

    public boolean isEmpty() {
        return entries.isEmpty();
    }

    @Override
    public YamlMapping copy() {
        var copy = new YamlMapping(flow);
        entries.forEach((key, value) -> copy.put(key, value.copy()));
        return copyFormattingInto(copy);
    }
}
