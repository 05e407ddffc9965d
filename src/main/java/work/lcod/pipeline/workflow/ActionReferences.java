package work.lcod.pipeline.workflow;

import work.lcod.pipeline.config.PipelineConfig;

/**
 * Resolves the {@code uses:} value of a pipeline action for the configured source mode.
 */
public final class ActionReferences {
    public static final String DETECT_CHANGES = "detect-changes";
    public static final String CALCULATE_VERSION = "calculate-version";
    public static final String CREATE_TAG = "create-tag";
    public static final String PROMOTE_BRANCH = "promote-branch";
    public static final String CREATE_RELEASE = "create-release";

    private ActionReferences() {}

    public static String resolve(String action, PipelineConfig config) {
        return switch (config.actionSourceMode()) {
            case LOCAL -> "./.github/actions/" + action;
            case SOURCE -> "./actions/" + action;
            case REMOTE -> config.actionRepository() + "/actions/" + action + "@" + config.actionVersion();
        };
    }
}
