package work.lcod.pipeline.region;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.junit.jupiter.api.Test;
import work.lcod.pipeline.config.DomainConfig;

class PlaceholderGeneratorTest {
    private final PlaceholderGenerator generator = new PlaceholderGenerator();

    @Test
    void sortsByPrefixThenDomain() {
        var domains = new LinkedHashMap<String, DomainConfig>();
        domains.put("web", DomainConfig.of(List.of("apps/web/**"), List.of("test")));
        domains.put("api", DomainConfig.of(List.of("apps/api/**"), List.of("test", "deploy")));

        var names = generator.generate(domains).stream().map(PlaceholderEntry::name).toList();

        assertEquals(List.of("deploy-api", "test-api", "test-web"), names);
    }

    @Test
    void derivesPrefixesFromLegacyFlags() {
        var domain = new DomainConfig(List.of("libs/**"), "shared code", null, true, false, true);

        var names = generator.generate(Map.of("core", domain)).stream().map(PlaceholderEntry::name).toList();

        assertEquals(List.of("remote-test-core", "test-core"), names);
    }

    @Test
    void skipsJobsTheUserAlreadyHas() {
        var entries = List.of(new PlaceholderEntry("deploy", "api"), new PlaceholderEntry("test", "api"));

        var region = generator.merge(new CustomRegion("  test-api:\n    runs-on: custom"), entries, Set.of("test-api"));

        assertTrue(region.content().contains("  deploy-api:"));
        assertTrue(region.content().contains("runs-on: custom"));
        assertEquals(1, region.content().split("test-api:", -1).length - 1);
    }

    @Test
    void placeholderIsAJobOfTheJobsMapping() {
        var text = new PlaceholderEntry("test", "api").render();

        assertTrue(text.startsWith("  test-api:\n    needs: changes\n"));
        assertTrue(text.contains("if: ${{ needs.changes.outputs.api == 'true' }}"));
        assertFalse(text.endsWith("\n"));
    }
}
