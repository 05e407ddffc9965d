package work.lcod.pipeline.config;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.tomlj.Toml;
import org.tomlj.TomlArray;
import org.tomlj.TomlTable;

/**
 * Reads {@code .pipecraftrc} files. YAML and JSON go through Jackson, TOML through tomlj;
 * both end up as a Jackson tree mapped onto {@link PipelineConfig}. Unknown keys are ignored.
 */
public final class ConfigLoader {
    private static final Logger log = LoggerFactory.getLogger(ConfigLoader.class);
    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());
    private static final ObjectMapper JSON = new ObjectMapper();

    /** Searched in this order. */
    public static final List<String> CANDIDATES = List.of(
        ".pipecraftrc",
        ".pipecraftrc.json",
        ".pipecraftrc.yaml",
        ".pipecraftrc.yml",
        ".pipecraftrc.toml"
    );

    public Optional<Path> locate(Path directory) {
        for (var candidate : CANDIDATES) {
            var path = directory.resolve(candidate);
            if (Files.isRegularFile(path)) {
                return Optional.of(path);
            }
        }
        return Optional.empty();
    }

    public PipelineConfig loadFromDirectory(Path directory) {
        var path = locate(directory).orElseThrow(() -> new ConfigurationException(
            "No configuration found in " + directory.toAbsolutePath() + " (looked for " + String.join(", ", CANDIDATES) + ")"
        ));
        return load(path);
    }

    public PipelineConfig load(Path path) {
        String text;
        try {
            text = Files.readString(path);
        } catch (IOException ex) {
            throw new ConfigurationException("Unable to read configuration " + path + ": " + ex.getMessage(), ex);
        }
        log.debug("Loading configuration from {}", path);
        var fileName = path.getFileName().toString();
        var tree = fileName.endsWith(".toml") ? parseToml(text, path) : parseYaml(text, path);
        return fromTree(tree);
    }

    public PipelineConfig fromTree(JsonNode root) {
        if (root == null || !root.isObject()) {
            throw new ConfigurationException("Configuration must be a mapping");
        }
        var builder = PipelineConfig.builder()
            .branchFlow(stringList(root.get("branchFlow"), "branchFlow"))
            .initialBranch(text(root.get("initialBranch")))
            .finalBranch(text(root.get("finalBranch")))
            .actionSourceMode(ActionSourceMode.from(text(root.get("actionSourceMode"))))
            .actionRepository(text(root.get("actionRepository")))
            .actionVersion(text(root.get("actionVersion")));

        var domains = root.get("domains");
        if (domains != null && !domains.isNull()) {
            if (!domains.isObject()) {
                throw new ConfigurationException("'domains' must be a mapping of domain name to settings");
            }
            var fields = domains.fields();
            while (fields.hasNext()) {
                var entry = fields.next();
                builder.domain(entry.getKey(), domain(entry.getKey(), entry.getValue()));
            }
        }

        var autoPromote = root.get("autoPromote");
        var branchFlow = stringList(root.get("branchFlow"), "branchFlow");
        if (autoPromote != null && autoPromote.isBoolean()) {
            var targets = branchFlow.size() > 1 ? branchFlow.subList(1, branchFlow.size()) : List.<String>of();
            for (var target : targets) {
                builder.autoPromote(target, autoPromote.booleanValue());
            }
        } else if (autoPromote != null && autoPromote.isObject()) {
            var fields = autoPromote.fields();
            while (fields.hasNext()) {
                var entry = fields.next();
                builder.autoPromote(entry.getKey(), entry.getValue().asBoolean(false));
            }
        } else if (autoPromote != null && !autoPromote.isNull()) {
            throw new ConfigurationException("'autoPromote' must be a boolean or a mapping of branch to boolean");
        }
        return builder.build();
    }

    private static DomainConfig domain(String name, JsonNode node) {
        if (node == null || !node.isObject()) {
            throw new ConfigurationException("Domain '" + name + "' must be a mapping");
        }
        var prefixesNode = node.get("prefixes");
        List<String> prefixes = prefixesNode == null || prefixesNode.isNull()
            ? null
            : stringList(prefixesNode, "domains." + name + ".prefixes");
        return new DomainConfig(
            stringList(node.get("paths"), "domains." + name + ".paths"),
            text(node.get("description")),
            prefixes,
            node.path("testable").asBoolean(false),
            node.path("deployable").asBoolean(false),
            node.path("remoteTestable").asBoolean(false)
        );
    }

    private static JsonNode parseYaml(String text, Path path) {
        try {
            return YAML_MAPPER.readTree(text);
        } catch (JsonProcessingException ex) {
            throw new ConfigurationException("Invalid configuration " + path + ": " + ex.getOriginalMessage(), ex);
        }
    }

    private static JsonNode parseToml(String text, Path path) {
        var result = Toml.parse(text);
        if (result.hasErrors()) {
            throw new ConfigurationException("Invalid configuration " + path,
                result.errors().stream().map(Object::toString).toList());
        }
        return JSON.valueToTree(convertTomlTable(result));
    }

    private static Map<String, Object> convertTomlTable(TomlTable table) {
        var converted = new LinkedHashMap<String, Object>();
        for (var key : table.keySet()) {
            converted.put(key, convertTomlValue(table.get(List.of(key))));
        }
        return converted;
    }

    private static Object convertTomlValue(Object value) {
        if (value instanceof TomlTable table) {
            return convertTomlTable(table);
        }
        if (value instanceof TomlArray array) {
            var items = new ArrayList<Object>();
            for (int i = 0; i < array.size(); i++) {
                items.add(convertTomlValue(array.get(i)));
            }
            return items;
        }
        return value;
    }

    private static List<String> stringList(JsonNode node, String field) {
        if (node == null || node.isNull()) {
            return List.of();
        }
        if (!node.isArray()) {
            throw new ConfigurationException("'" + field + "' must be a list of strings");
        }
        var values = new ArrayList<String>();
        for (var item : node) {
            if (!item.isValueNode() || item.isNull()) {
                throw new ConfigurationException("'" + field + "' must be a list of strings");
            }
            values.add(item.asText());
        }
        return values;
    }

    private static String text(JsonNode node) {
        return node == null || node.isNull() ? null : node.asText();
    }
}
