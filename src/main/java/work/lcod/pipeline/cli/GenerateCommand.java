package work.lcod.pipeline.cli;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import org.yaml.snakeyaml.Yaml;
import picocli.CommandLine;
import work.lcod.pipeline.api.DocumentOutcome;
import work.lcod.pipeline.api.GenerationRequest;
import work.lcod.pipeline.api.GenerationResult;
import work.lcod.pipeline.api.LogLevel;
import work.lcod.pipeline.api.PipelineGenerator;
import work.lcod.pipeline.config.ConfigLoader;
import work.lcod.pipeline.config.PipelineConfig;

@CommandLine.Command(
    name = "lcod-pipeline",
    description = "Generate or update the managed CI pipeline workflow.",
    mixinStandardHelpOptions = true,
    versionProvider = GenerateCommand.Version.class,
    showDefaultValues = true
)
final class GenerateCommand implements Callable<Integer> {
    @CommandLine.Spec
    private CommandLine.Model.CommandSpec spec;

    @CommandLine.Option(
        names = {"-c", "--config"},
        description = "Configuration file (default: first .pipecraftrc* found in the working directory).",
        defaultValue = CommandLine.Option.NULL_VALUE
    )
    private String configPath;

    @CommandLine.Option(
        names = {"-o", "--output"},
        description = "Workflow file(s) to generate, relative to the working directory.",
        arity = "1..*"
    )
    private List<String> outputs = new ArrayList<>();

    @CommandLine.Option(
        names = {"-C", "--directory"},
        description = "Working directory (default: current directory).",
        defaultValue = CommandLine.Option.NULL_VALUE
    )
    private String directory;

    @CommandLine.Option(
        names = {"-f", "--force"},
        description = "Rebuild the workflow; jobs outside the custom markers are moved into the custom section."
    )
    private boolean force;

    @CommandLine.Option(
        names = "--dry-run",
        description = "Print the generated workflow instead of writing it."
    )
    private boolean dryRun;

    @CommandLine.Option(
        names = "--log-level",
        description = "Log threshold (trace|debug|info|warn|error|fatal).",
        defaultValue = CommandLine.Option.NULL_VALUE
    )
    private String logLevelRaw;

    @CommandLine.Option(
        names = {"-v", "--verbose"},
        description = "Shortcut for --log-level debug."
    )
    private boolean verbose;

    @Override
    public Integer call() {
        resolveLogLevel().applyToRootLogger();

        Path workingDir = directory != null
            ? Paths.get(directory).toAbsolutePath().normalize()
            : Paths.get("").toAbsolutePath();
        PipelineConfig config = loadConfig(workingDir);

        var request = GenerationRequest.builder()
            .config(config)
            .workingDirectory(workingDir)
            .outputs(outputs.stream().map(Path::of).toList())
            .force(force)
            .dryRun(dryRun)
            .build();

        GenerationResult result = new PipelineGenerator().generate(request);
        var out = spec.commandLine().getOut();
        if (dryRun) {
            for (DocumentOutcome document : result.documents()) {
                if (!document.failed()) {
                    out.println("# " + document.path());
                    out.print(document.content());
                }
            }
        }
        out.println(result.toPrettyJson());
        out.flush();
        return result.status().exitCode();
    }

    private LogLevel resolveLogLevel() {
        if (logLevelRaw != null) {
            try {
                return LogLevel.from(logLevelRaw);
            } catch (IllegalArgumentException ex) {
                throw new CommandLine.ParameterException(spec.commandLine(), ex.getMessage());
            }
        }
        return verbose ? LogLevel.DEBUG : LogLevel.INFO;
    }

    /**
     * Tool version from the jar manifest, plus the runtime, since the YAML layout of
     * rewritten entries depends on the bundled SnakeYAML.
     */
    static final class Version implements CommandLine.IVersionProvider {
        @Override
        public String[] getVersion() {
            return new String[] {
                "lcod-pipeline " + manifestVersion(GenerateCommand.class, "development"),
                "SnakeYAML " + manifestVersion(Yaml.class, "unknown"),
                "Java " + System.getProperty("java.version")
            };
        }

        private static String manifestVersion(Class<?> type, String fallback) {
            var version = type.getPackage().getImplementationVersion();
            return version != null ? version : fallback;
        }
    }

    private PipelineConfig loadConfig(Path workingDir) {
        var loader = new ConfigLoader();
        if (configPath == null) {
            return loader.loadFromDirectory(workingDir);
        }
        Path path = workingDir.resolve(configPath).normalize();
        if (!path.toFile().isFile()) {
            throw new CommandLine.ParameterException(spec.commandLine(), "Configuration file not found: " + path);
        }
        return loader.load(path);
    }
}
