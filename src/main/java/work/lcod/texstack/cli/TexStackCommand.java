package work.lcod.texstack.cli;

import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.concurrent.Callable;
import picocli.CommandLine;
import work.lcod.texstack.api.LogLevel;
import work.lcod.texstack.api.ParseResult;
import work.lcod.texstack.api.TexStackRunner;

@CommandLine.Command(
    name = "texstack-run",
    description = "Reduce an item script to a MathML-shaped tree and print it as JSON.",
    mixinStandardHelpOptions = true,
    versionProvider = VersionProvider.class,
    showDefaultValues = true
)
final class TexStackCommand implements Callable<Integer> {
    @CommandLine.Option(
        names = {"-s", "--script"},
        required = true,
        description = "Item script (JSON or YAML list of steps)."
    )
    private String script;

    @CommandLine.Option(
        names = {"-o", "--options"},
        description = "Parser options file (.toml, .json, .yaml).",
        defaultValue = CommandLine.Option.NULL_VALUE
    )
    private String options;

    @CommandLine.Option(
        names = "--log-level",
        description = "Diagnostic threshold (trace|debug|info|warn|error|fatal).",
        defaultValue = CommandLine.Option.NULL_VALUE
    )
    private String logLevelRaw;

    @Override
    public Integer call() {
        Path scriptPath = existingFile(script, "Script");
        Path optionsPath = options == null ? null : existingFile(options, "Options file");
        LogLevel logLevel = resolveLogLevel();

        ParseResult result = new TexStackRunner().run(scriptPath, optionsPath, logLevel);
        System.out.println(result.toPrettyJson());
        return result.status().exitCode();
    }

    private Path existingFile(String value, String label) {
        Path path = Paths.get(value).toAbsolutePath().normalize();
        if (!Files.isRegularFile(path)) {
            throw new CommandLine.ParameterException(new CommandLine(this), label + " not found: " + path);
        }
        return path;
    }

    private LogLevel resolveLogLevel() {
        if (logLevelRaw == null || logLevelRaw.isBlank()) {
            return null;
        }
        try {
            return LogLevel.from(logLevelRaw);
        } catch (IllegalArgumentException ex) {
            throw new CommandLine.ParameterException(new CommandLine(this), ex.getMessage());
        }
    }
}
