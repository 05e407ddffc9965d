package work.lcod.pipeline.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class ConfigLoaderTest {
    private final ConfigLoader loader = new ConfigLoader();

    @Test
    void loadsYamlConfiguration(@TempDir Path dir) throws Exception {
        Files.writeString(dir.resolve(".pipecraftrc.yml"), """
            branchFlow: [develop, staging, main]
            autoPromote: true
            domains:
              api:
                paths: ["apps/api/**"]
                prefixes: [test, deploy]
              web:
                paths: ["apps/web/**"]
                testable: true
            """);

        var config = loader.loadFromDirectory(dir);

        assertEquals(List.of("develop", "staging", "main"), config.branchFlow());
        assertEquals("develop", config.initialBranch());
        assertEquals("main", config.finalBranch());
        assertEquals(Map.of("staging", true, "main", true), config.autoPromote());
        assertEquals(List.of("test", "deploy"), config.domains().get("api").effectivePrefixes());
        assertEquals(List.of("test"), config.domains().get("web").effectivePrefixes());
        assertEquals(ActionSourceMode.LOCAL, config.actionSourceMode());
    }

    @Test
    void loadsJsonFromExtensionlessFile(@TempDir Path dir) throws Exception {
        Files.writeString(dir.resolve(".pipecraftrc"), """
            {"branchFlow": ["main"], "autoPromote": {"main": false}, "domains": {"core": {"paths": ["src/**"]}}}
            """);

        var config = loader.loadFromDirectory(dir);

        assertEquals(List.of("main"), config.branchFlow());
        assertEquals(Map.of("main", false), config.autoPromote());
        assertTrue(config.domains().get("core").effectivePrefixes().isEmpty());
    }

    @Test
    void loadsTomlConfiguration(@TempDir Path dir) throws Exception {
        Files.writeString(dir.resolve(".pipecraftrc.toml"), """
            branchFlow = ["develop", "main"]
            actionSourceMode = "remote"
            actionRepository = "acme/pipeline"
            actionVersion = "v2"

            [domains.api]
            paths = ["apps/api/**"]
            prefixes = ["test"]
            """);

        var config = loader.loadFromDirectory(dir);

        assertEquals(ActionSourceMode.REMOTE, config.actionSourceMode());
        assertEquals("acme/pipeline", config.actionRepository());
        assertEquals(List.of("apps/api/**"), config.domains().get("api").paths());
    }

    @Test
    void defaultsToSingleMainBranch() {
        var config = PipelineConfig.builder().build();

        assertEquals(List.of("main"), config.branchFlow());
        assertEquals("main", config.initialBranch());
        assertEquals("main", config.finalBranch());
    }

    @Test
    void missingConfigurationIsReported(@TempDir Path dir) {
        var thrown = assertThrows(ConfigurationException.class, () -> loader.loadFromDirectory(dir));
        assertTrue(thrown.getMessage().contains(".pipecraftrc"));
    }

    @Test
    void collectsAllValidationProblems() {
        var thrown = assertThrows(ConfigurationException.class, () -> PipelineConfig.builder()
            .branchFlow(List.of("main", "bad branch"))
            .domain("api", DomainConfig.of(List.of(), List.of("test")))
            .actionSourceMode(ActionSourceMode.REMOTE)
            .build());

        assertEquals("Invalid configuration", thrown.summary());
        assertEquals(4, thrown.problems().size());
        assertTrue(thrown.getMessage().contains("bad branch"));
        assertTrue(thrown.getMessage().contains("domain 'api' needs at least one path"));
        assertTrue(thrown.getMessage().contains("actionRepository"));
    }

    @Test
    void rejectsMalformedDomains(@TempDir Path dir) throws Exception {
        Files.writeString(dir.resolve(".pipecraftrc.yaml"), "domains: [api]\n");

        assertThrows(ConfigurationException.class, () -> loader.loadFromDirectory(dir));
    }

    @Test
    void reportsYamlSyntaxErrors(@TempDir Path dir) throws Exception {
        Files.writeString(dir.resolve(".pipecraftrc.yml"), "branchFlow: [main\ndomains: {\n");

        var thrown = assertThrows(ConfigurationException.class, () -> loader.loadFromDirectory(dir));

        assertTrue(thrown.getMessage().startsWith("Invalid configuration "), thrown.getMessage());
        assertTrue(thrown.getMessage().contains(".pipecraftrc.yml"));
    }

    @Test
    void reportsEveryTomlError(@TempDir Path dir) throws Exception {
        Files.writeString(dir.resolve(".pipecraftrc.toml"), "branchFlow = [\"main\"\nactionVersion = \n");

        var thrown = assertThrows(ConfigurationException.class, () -> loader.loadFromDirectory(dir));

        assertFalse(thrown.problems().isEmpty());
        assertTrue(thrown.summary().contains(".pipecraftrc.toml"));
    }

    @Test
    void rejectsUnknownActionSourceMode() {
        assertThrows(ConfigurationException.class, () -> ActionSourceMode.from("ftp"));
    }
}
