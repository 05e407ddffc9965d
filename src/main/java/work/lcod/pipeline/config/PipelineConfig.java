package work.lcod.pipeline.config;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Validated pipeline configuration. Missing values take their defaults here, so
 * every generator can rely on a non-empty branch flow.
 */
public record PipelineConfig(
    List<String> branchFlow,
    String initialBranch,
    String finalBranch,
    Map<String, DomainConfig> domains,
    Map<String, Boolean> autoPromote,
    ActionSourceMode actionSourceMode,
    String actionRepository,
    String actionVersion
) {
    public static final String DEFAULT_BRANCH = "main";

    private static final Pattern BRANCH_NAME = Pattern.compile("[A-Za-z0-9._/-]+");
    private static final Pattern IDENTIFIER = Pattern.compile("[A-Za-z0-9_-]+");

    public PipelineConfig {
        branchFlow = branchFlow == null || branchFlow.isEmpty() ? List.of(DEFAULT_BRANCH) : List.copyOf(branchFlow);
        initialBranch = blank(initialBranch) ? branchFlow.get(0) : initialBranch;
        finalBranch = blank(finalBranch) ? branchFlow.get(branchFlow.size() - 1) : finalBranch;
        domains = domains == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(domains));
        autoPromote = autoPromote == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(autoPromote));
        actionSourceMode = actionSourceMode == null ? ActionSourceMode.LOCAL : actionSourceMode;
        validate(branchFlow, initialBranch, finalBranch, domains, actionSourceMode, actionRepository, actionVersion);
    }

    public static Builder builder() {
        return new Builder();
    }

    private static void validate(
        List<String> branchFlow,
        String initialBranch,
        String finalBranch,
        Map<String, DomainConfig> domains,
        ActionSourceMode mode,
        String actionRepository,
        String actionVersion
    ) {
        var problems = new ArrayList<String>();
        for (var branch : branchFlow) {
            if (branch == null || !BRANCH_NAME.matcher(branch).matches()) {
                problems.add("invalid branch name '" + branch + "' in branchFlow");
            }
        }
        if (!BRANCH_NAME.matcher(initialBranch).matches()) {
            problems.add("invalid initialBranch '" + initialBranch + "'");
        }
        if (!BRANCH_NAME.matcher(finalBranch).matches()) {
            problems.add("invalid finalBranch '" + finalBranch + "'");
        }
        domains.forEach((name, domain) -> {
            if (!IDENTIFIER.matcher(name).matches()) {
                problems.add("invalid domain name '" + name + "'");
            }
            if (domain == null || domain.paths().isEmpty()) {
                problems.add("domain '" + name + "' needs at least one path");
                return;
            }
            for (var prefix : domain.effectivePrefixes()) {
                if (prefix == null || !IDENTIFIER.matcher(prefix).matches()) {
                    problems.add("invalid prefix '" + prefix + "' in domain '" + name + "'");
                }
            }
        });
        if (mode == ActionSourceMode.REMOTE && (blank(actionRepository) || blank(actionVersion))) {
            problems.add("actionSourceMode 'remote' requires actionRepository and actionVersion");
        }
        if (!problems.isEmpty()) {
            throw new ConfigurationException("Invalid configuration", problems);
        }
    }

    private static boolean blank(String value) {
        return value == null || value.isBlank();
    }

    public static final class Builder {
        private List<String> branchFlow = List.of();
        private String initialBranch;
        private String finalBranch;
        private final Map<String, DomainConfig> domains = new LinkedHashMap<>();
        private final Map<String, Boolean> autoPromote = new LinkedHashMap<>();
        private ActionSourceMode actionSourceMode = ActionSourceMode.LOCAL;
        private String actionRepository;
        private String actionVersion;

        public Builder branchFlow(List<String> branchFlow) {
            this.branchFlow = branchFlow;
            return this;
        }

        public Builder initialBranch(String initialBranch) {
            this.initialBranch = initialBranch;
            return this;
        }

        public Builder finalBranch(String finalBranch) {
            this.finalBranch = finalBranch;
            return this;
        }

        public Builder domain(String name, DomainConfig domain) {
            this.domains.put(name, domain);
            return this;
        }

        public Builder autoPromote(String targetBranch, boolean enabled) {
            this.autoPromote.put(targetBranch, enabled);
            return this;
        }

        public Builder actionSourceMode(ActionSourceMode actionSourceMode) {
            this.actionSourceMode = actionSourceMode;
            return this;
        }

        public Builder actionRepository(String actionRepository) {
            this.actionRepository = actionRepository;
            return this;
        }

        public Builder actionVersion(String actionVersion) {
            this.actionVersion = actionVersion;
            return this;
        }

        public PipelineConfig build() {
            return new PipelineConfig(
                branchFlow,
                initialBranch,
                finalBranch,
                domains,
                autoPromote,
                actionSourceMode,
                actionRepository,
                actionVersion
            );
        }
    }
}
