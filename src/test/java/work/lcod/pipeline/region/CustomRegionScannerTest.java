package work.lcod.pipeline.region;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import java.util.Set;
import org.junit.jupiter.api.Test;

class CustomRegionScannerTest {
    private static final String WORKFLOW = """
        jobs:
          version:
            runs-on: ubuntu-latest

          # <--START CUSTOM JOBS-->

          test-api:
            runs-on: ubuntu-latest

          # <--END CUSTOM JOBS-->

          tag:
            runs-on: ubuntu-latest
        """;

    private final CustomRegionScanner scanner = new CustomRegionScanner();

    @Test
    void extractsTextBetweenMarkers() {
        var region = scanner.extract(WORKFLOW).orElseThrow();

        assertEquals("  test-api:\n    runs-on: ubuntu-latest", region.content());
    }

    @Test
    void acceptsAnyMarkerIndentationAndHashCount() {
        var text = "a: 1\n### <--START CUSTOM JOBS-->\n  x:\n    y: 1\n        #<--END CUSTOM JOBS-->  \n";

        assertEquals("  x:\n    y: 1", scanner.extract(text).orElseThrow().content());
    }

    @Test
    void stripRemovesRegionAndMarkers() {
        var stripped = scanner.strip(WORKFLOW);

        assertFalse(stripped.contains("CUSTOM JOBS"));
        assertFalse(stripped.contains("test-api"));
        assertTrue(stripped.contains("  tag:"));
    }

    @Test
    void unpairedMarkerMeansNoRegion() {
        var text = "jobs:\n  # <--START CUSTOM JOBS-->\n  build:\n    runs-on: x\n";

        assertTrue(scanner.extract(text).isEmpty());
        assertEquals("jobs:\n  build:\n    runs-on: x\n", scanner.strip(text));
    }

    @Test
    void markersInWrongOrderMeanNoRegion() {
        var text = "# <--END CUSTOM JOBS-->\na: 1\n# <--START CUSTOM JOBS-->\n";

        assertTrue(scanner.extract(text).isEmpty());
    }

    @Test
    void findsJobNamesInRegion() {
        var region = new CustomRegion("""
              test-api:
                runs-on: ubuntu-latest

              # security scanning
              security-scan:
                runs-on: ubuntu-latest
            """);

        assertEquals(Set.of("test-api", "security-scan"), scanner.jobNames(region));
    }

    @Test
    void scansJobKeysWhenRegionDoesNotParse() {
        var region = new CustomRegion("  broken:\n    steps: [\n  other:\n    runs-on: x");

        assertEquals(Set.of("broken", "other"), scanner.jobNames(region));
    }

    @Test
    void exampleRegionDeclaresNoJobs() {
        assertTrue(scanner.jobNames(CustomRegion.example()).isEmpty());
        assertTrue(scanner.jobNames(CustomRegion.empty()).isEmpty());
    }

    @Test
    void rendersRegionBetweenMarkers() {
        var region = CustomRegion.empty().append(List.of("  a:\n    runs-on: x", "\n  b:\n    runs-on: y\n"));

        assertEquals("""
              # <--START CUSTOM JOBS-->

              a:
                runs-on: x

              b:
                runs-on: y

              # <--END CUSTOM JOBS-->
            """, region.render());
        assertEquals("  # <--START CUSTOM JOBS-->\n\n  # <--END CUSTOM JOBS-->\n", CustomRegion.empty().render());
    }
}
