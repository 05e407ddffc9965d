package work.lcod.pipeline.cli;

import java.util.ArrayList;
import java.util.List;
import picocli.CommandLine;
import work.lcod.pipeline.config.ConfigurationException;

/**
 * Reports a failed run without a stack trace: one line per configuration problem,
 * the exception message otherwise. {@code -Dlcod.debug=true} adds the stack trace.
 */
final class ShortErrorHandler implements CommandLine.IExecutionExceptionHandler {
    @Override
    public int handleExecutionException(
        Exception ex,
        CommandLine commandLine,
        CommandLine.ParseResult parseResult
    ) {
        var err = commandLine.getErr();
        for (var line : describe(ex)) {
            err.println(commandLine.getColorScheme().errorText(line));
        }
        if (Boolean.getBoolean("lcod.debug")) {
            ex.printStackTrace(err);
        }
        return commandLine.getCommandSpec().exitCodeOnExecutionException();
    }

    static List<String> describe(Exception ex) {
        if (ex instanceof ConfigurationException config && config.problems().size() > 1) {
            var lines = new ArrayList<String>();
            lines.add(config.summary() + ":");
            for (var problem : config.problems()) {
                lines.add("  - " + problem);
            }
            return lines;
        }
        var message = ex.getMessage();
        return List.of(message == null || message.isBlank() ? ex.getClass().getSimpleName() : message);
    }
}
