package work.lcod.texstack.error;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Structured parse failure: a stable key, a message template with positional placeholders and its arguments.
 */
public final class TexError extends RuntimeException {
    private final TexErrorKind kind;
    private final List<Object> args;

    public TexError(TexErrorKind kind, Object... args) {
        super(format(Objects.requireNonNull(kind, "kind").template(), args == null ? List.of() : Arrays.asList(args)));
        this.kind = kind;
        this.args = args == null
            ? List.of()
            : Collections.unmodifiableList(new ArrayList<>(Arrays.asList(args)));
    }

    public TexErrorKind kind() {
        return kind;
    }

    public String key() {
        return kind.key();
    }

    public String template() {
        return kind.template();
    }

    public List<Object> args() {
        return args;
    }

    /**
     * Substitutes {@code %1}, {@code %{1}} ... with the matching argument; {@code %%} yields a literal percent.
     * Placeholders without an argument are kept verbatim.
     */
    public static String format(String template, List<?> args) {
        var builder = new StringBuilder();
        int i = 0;
        while (i < template.length()) {
            char ch = template.charAt(i);
            if (ch != '%' || i + 1 >= template.length()) {
                builder.append(ch);
                i++;
                continue;
            }
            char next = template.charAt(i + 1);
            if (next == '%') {
                builder.append('%');
                i += 2;
                continue;
            }
            int start = i + 1;
            boolean braced = next == '{';
            if (braced) {
                start++;
            }
            int end = start;
            while (end < template.length() && Character.isDigit(template.charAt(end))) {
                end++;
            }
            if (end == start || (braced && (end >= template.length() || template.charAt(end) != '}'))) {
                builder.append(ch);
                i++;
                continue;
            }
            int index = Integer.parseInt(template.substring(start, end)) - 1;
            int consumed = braced ? end + 1 : end;
            if (index >= 0 && index < args.size()) {
                builder.append(args.get(index));
            } else {
                builder.append(template, i, consumed);
            }
            i = consumed;
        }
        return builder.toString();
    }
}
