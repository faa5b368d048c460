package work.lcod.texstack.config;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import work.lcod.texstack.api.LogLevel;

/**
 * Parser-wide options, fixed for the lifetime of a parse. Built by merging user values over {@link #DEFAULTS}.
 */
public record ParserOptions(
    NumberingMode numberingMode,
    String tagSide,
    String tagIndent,
    String leftDelimiter,
    String rightDelimiter,
    String columnAlign,
    String rowSpacing,
    String columnSpacing,
    LogLevel logLevel
) {
    public static final Map<String, Object> DEFAULTS = Map.of(
        "numbering", Map.of(
            "mode", "none",
            "tagSide", "right",
            "tagIndent", "0.8em"
        ),
        "delimiters", Map.of(
            "left", "(",
            "right", ")"
        ),
        "array", Map.of(
            "columnAlign", "center",
            "rowSpacing", "4pt",
            "columnSpacing", "1em"
        ),
        "logLevel", "warn"
    );

    public ParserOptions {
        Objects.requireNonNull(numberingMode, "numberingMode");
        Objects.requireNonNull(leftDelimiter, "leftDelimiter");
        Objects.requireNonNull(rightDelimiter, "rightDelimiter");
        Objects.requireNonNull(logLevel, "logLevel");
    }

    public static ParserOptions defaults() {
        return fromUserOptions(Map.of());
    }

    /**
     * Merges {@code user} over the defaults; unknown keys fail with {@link IllegalArgumentException}.
     */
    public static ParserOptions fromUserOptions(Map<String, ?> user) {
        Map<String, Object> merged = OptionMerger.defaultOptions(new LinkedHashMap<>(), DEFAULTS);
        Map<String, ?> values = user == null ? Map.of() : user;
        OptionMerger.userOptions(merged, values);
        return fromMergedMap(merged);
    }

    static ParserOptions fromMergedMap(Map<String, Object> merged) {
        Map<?, ?> numbering = section(merged, "numbering");
        Map<?, ?> delimiters = section(merged, "delimiters");
        Map<?, ?> array = section(merged, "array");
        return new ParserOptions(
            NumberingMode.from(string(numbering.get("mode"))),
            string(numbering.get("tagSide")),
            string(numbering.get("tagIndent")),
            string(delimiters.get("left")),
            string(delimiters.get("right")),
            string(array.get("columnAlign")),
            string(array.get("rowSpacing")),
            string(array.get("columnSpacing")),
            LogLevel.from(string(merged.get("logLevel")))
        );
    }

    public ParserOptions withLogLevel(LogLevel level) {
        return new ParserOptions(
            numberingMode,
            tagSide,
            tagIndent,
            leftDelimiter,
            rightDelimiter,
            columnAlign,
            rowSpacing,
            columnSpacing,
            level
        );
    }

    private static Map<?, ?> section(Map<String, Object> merged, String key) {
        Object value = merged.get(key);
        if (value instanceof Map<?, ?> map) {
            return map;
        }
        throw new IllegalArgumentException("Option '" + key + "' must be a table");
    }

    private static String string(Object value) {
        return value == null ? null : String.valueOf(value);
    }
}
