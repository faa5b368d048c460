package work.lcod.texstack.api;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import work.lcod.texstack.error.TexError;
import work.lcod.texstack.tree.MmlNode;
import work.lcod.texstack.tree.NodeCodec;

/**
 * Outcome of a {@link TexStackRunner} execution: the reduced tree on success, the error key, arguments and message
 * on failure.
 *
 * @param script     where the item script came from ({@code <inline>} for in-memory scripts)
 * @param logLevel   effective diagnostic threshold, {@code null} when the options never loaded
 * @param tree       reduced tree, {@code null} on failure
 * @param errorKey   {@link TexError} key, {@code null} for success and for non-TeX failures
 * @param errorArgs  {@link TexError} arguments, empty unless {@code errorKey} is set
 * @param error      failure message, {@code null} on success
 */
public record ParseResult(
    Status status,
    String script,
    LogLevel logLevel,
    MmlNode tree,
    String errorKey,
    List<String> errorArgs,
    String error,
    Instant startedAt,
    Instant finishedAt
) {
    private static final ObjectWriter WRITER = new ObjectMapper().writerWithDefaultPrettyPrinter();

    public ParseResult {
        Objects.requireNonNull(status, "status");
        errorArgs = errorArgs == null ? List.of() : List.copyOf(errorArgs);
    }

    public static ParseResult success(String script, LogLevel logLevel, MmlNode tree, Instant startedAt) {
        return new ParseResult(Status.SUCCESS, script, logLevel, tree, null, List.of(), null, startedAt, Instant.now());
    }

    public static ParseResult failure(String script, LogLevel logLevel, RuntimeException ex, Instant startedAt) {
        String key = null;
        List<String> args = List.of();
        if (ex instanceof TexError texError) {
            key = texError.key();
            args = texError.args().stream().map(String::valueOf).toList();
        }
        String message = ex.getMessage() != null && !ex.getMessage().isBlank()
            ? ex.getMessage()
            : ex.getClass().getSimpleName();
        return new ParseResult(Status.FAILURE, script, logLevel, null, key, args, message, startedAt, Instant.now());
    }

    public boolean isSuccess() {
        return status == Status.SUCCESS;
    }

    /**
     * JSON-ready view; absent fields are left out rather than written as {@code null}.
     */
    public Map<String, Object> toSerializableMap() {
        Map<String, Object> serializable = new LinkedHashMap<>();
        serializable.put("status", status.name().toLowerCase());
        putIfPresent(serializable, "script", script);
        putIfPresent(serializable, "logLevel", logLevel == null ? null : logLevel.name());
        putIfPresent(serializable, "tree", tree == null ? null : NodeCodec.toMap(tree));
        putIfPresent(serializable, "errorKey", errorKey);
        if (errorKey != null) {
            serializable.put("errorArgs", errorArgs);
        }
        putIfPresent(serializable, "error", error);
        putIfPresent(serializable, "startedAt", startedAt == null ? null : startedAt.toString());
        putIfPresent(serializable, "finishedAt", finishedAt == null ? null : finishedAt.toString());
        return serializable;
    }

    public String toPrettyJson() {
        try {
            return WRITER.writeValueAsString(toSerializableMap());
        } catch (JsonProcessingException ex) {
            throw new IllegalStateException("Unable to serialize parse result: " + ex.getOriginalMessage(), ex);
        }
    }

    private static void putIfPresent(Map<String, Object> target, String key, Object value) {
        if (value != null) {
            target.put(key, value);
        }
    }

    public enum Status {
        SUCCESS(0),
        FAILURE(1);

        private final int exitCode;

        Status(int exitCode) {
            this.exitCode = exitCode;
        }

        public int exitCode() {
            return exitCode;
        }
    }
}
