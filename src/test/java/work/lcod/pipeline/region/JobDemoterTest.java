package work.lcod.pipeline.region;

import static org.junit.jupiter.api.Assertions.assertEquals;

import java.util.List;
import java.util.Set;
import org.junit.jupiter.api.Test;
import work.lcod.pipeline.yaml.YamlMapping;
import work.lcod.pipeline.yaml.YamlParser;

class JobDemoterTest {
    @Test
    void demotesOnlyUserJobsWithTheirComments() throws Exception {
        var root = YamlParser.parseDocument("""
            jobs:
              changes:
                runs-on: ubuntu-latest
              # nightly checks
              lint:
                runs-on: ubuntu-latest
              scan:
                runs-on: ubuntu-latest
            """).document().root();

        var demoted = new JobDemoter().demote((YamlMapping) root.get("jobs"), Set.of("scan"));

        assertEquals(List.of("lint"), demoted.names());
        assertEquals(List.of("  # nightly checks\n  lint:\n    runs-on: ubuntu-latest"), demoted.blocks());
    }
}
