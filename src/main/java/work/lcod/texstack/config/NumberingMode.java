package work.lcod.texstack.config;

import java.util.Locale;

/**
 * Which displayed equations get an automatic number.
 */
public enum NumberingMode {
    NONE,
    AMS,
    ALL;

    public static NumberingMode from(String value) {
        if (value == null || value.isBlank()) {
            return NONE;
        }
        try {
            return NumberingMode.valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException ex) {
            throw new IllegalArgumentException("Unsupported numbering mode: " + value);
        }
    }
}
