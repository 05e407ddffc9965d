package work.lcod.pipeline.region;

import java.util.Comparator;

/**
 * Suggested job for one {@code (prefix, domain)} pair, named {@code prefix-domain}.
 */
public record PlaceholderEntry(String prefix, String domain) {
    public static final Comparator<PlaceholderEntry> ORDER =
        Comparator.comparing(PlaceholderEntry::prefix).thenComparing(PlaceholderEntry::domain);

    public String name() {
        return prefix + "-" + domain;
    }

    /**
     * Job text indented as an entry of {@code jobs}.
     */
    public String render() {
        return """
              %1$s:
                needs: changes
                if: ${{ needs.changes.outputs.%3$s == 'true' }}
                runs-on: ubuntu-latest
                steps:
                  - uses: actions/checkout@v4
                    with:
                      ref: ${{ inputs.commitSha || github.sha }}
                  # TODO: Replace with your %3$s %2$s logic
                  - name: Run %2$s for %3$s
                    run: |
                      echo "Running %2$s for %3$s domain"
                      echo "Replace this with your actual %2$s commands"
                      # Example: npm run %2$s:%3$s\
            """.formatted(name(), prefix, domain);
    }
}
