package work.lcod.texstack.api;

import java.nio.file.Path;
import java.time.Instant;
import work.lcod.texstack.config.OptionsLoader;
import work.lcod.texstack.config.ParserOptions;
import work.lcod.texstack.runtime.ParseContext;
import work.lcod.texstack.script.ItemScript;

/**
 * Public entry point for embedding the reduction engine: runs an item script under a set of options.
 */
public final class TexStackRunner {

    public ParseResult run(Path script, Path options, LogLevel logLevel) {
        var started = Instant.now();
        var source = script == null ? "<none>" : script.toString();
        try {
            var parserOptions = options == null ? ParserOptions.defaults() : OptionsLoader.loadOptions(options);
            if (logLevel != null) {
                parserOptions = parserOptions.withLogLevel(logLevel);
            }
            return execute(ItemScript.load(script), parserOptions, source, started);
        } catch (RuntimeException ex) {
            return failure(ex, source, logLevel, started);
        }
    }

    public ParseResult run(ItemScript script, ParserOptions options) {
        return execute(script, options, "<inline>", Instant.now());
    }

    private ParseResult execute(ItemScript script, ParserOptions options, String source, Instant started) {
        try {
            var ctx = new ParseContext(options);
            ctx.log(LogLevel.INFO, "Running " + script.steps().size() + " steps from " + source);
            var tree = script.run(ctx);
            return ParseResult.success(source, options.logLevel(), tree, started);
        } catch (RuntimeException ex) {
            return failure(ex, source, options.logLevel(), started);
        }
    }

    private ParseResult failure(RuntimeException ex, String source, LogLevel logLevel, Instant started) {
        if (Boolean.getBoolean("texstack.debug")) {
            ex.printStackTrace();
        }
        return ParseResult.failure(source, logLevel, ex, started);
    }
}
