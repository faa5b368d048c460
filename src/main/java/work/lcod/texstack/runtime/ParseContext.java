package work.lcod.texstack.runtime;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import work.lcod.texstack.api.LogLevel;
import work.lcod.texstack.config.ParserOptions;
import work.lcod.texstack.item.StackItemFactory;

/**
 * State shared by every reduction of one parse: options, item factory, lookup tables and parse-wide flags.
 * A context belongs to exactly one parse.
 */
public final class ParseContext {
    private final ParserOptions options;
    private final StackItemFactory factory;
    private final NegationTable negations;
    private final Map<String, Object> globals = new LinkedHashMap<>();

    public ParseContext() {
        this(ParserOptions.defaults());
    }

    public ParseContext(ParserOptions options) {
        this(options, NegationTable.defaults());
    }

    public ParseContext(ParserOptions options, NegationTable negations) {
        this.options = Objects.requireNonNull(options, "options");
        this.negations = Objects.requireNonNull(negations, "negations");
        this.factory = new StackItemFactory(options);
    }

    public ParserOptions options() {
        return options;
    }

    public StackItemFactory factory() {
        return factory;
    }

    public NegationTable negations() {
        return negations;
    }

    public Object getGlobal(String key) {
        return globals.get(key);
    }

    public void setGlobal(String key, Object value) {
        if (value == null) {
            globals.remove(key);
        } else {
            globals.put(key, value);
        }
    }

    public Map<String, Object> globals() {
        return globals;
    }

    public boolean isLoggable(LogLevel level) {
        return level.ordinal() >= options.logLevel().ordinal();
    }

    public void log(LogLevel level, String message) {
        if (isLoggable(level)) {
            System.err.println("[texstack " + level.name().toLowerCase() + "] " + message);
        }
    }
}
