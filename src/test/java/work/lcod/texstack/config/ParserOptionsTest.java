package work.lcod.texstack.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.Map;
import org.junit.jupiter.api.Test;
import work.lcod.texstack.api.LogLevel;

class ParserOptionsTest {
    @Test
    void defaultsMatchDocumentedValues() {
        var options = ParserOptions.defaults();
        assertEquals(NumberingMode.NONE, options.numberingMode());
        assertEquals("right", options.tagSide());
        assertEquals("0.8em", options.tagIndent());
        assertEquals("(", options.leftDelimiter());
        assertEquals(")", options.rightDelimiter());
        assertEquals("center", options.columnAlign());
        assertEquals("4pt", options.rowSpacing());
        assertEquals("1em", options.columnSpacing());
        assertEquals(LogLevel.WARN, options.logLevel());
    }

    @Test
    void userValuesOverrideDefaults() {
        var options = ParserOptions.fromUserOptions(Map.of(
            "numbering", Map.of("mode", "ams", "tagIndent", "1em")
        ));
        assertEquals(NumberingMode.AMS, options.numberingMode());
        assertEquals("right", options.tagSide());
        assertEquals("1em", options.tagIndent());
    }

    @Test
    void invalidValuesFail() {
        assertThrows(IllegalArgumentException.class, () -> ParserOptions.fromUserOptions(Map.of("colour", "red")));
        assertThrows(IllegalArgumentException.class,
            () -> ParserOptions.fromUserOptions(Map.of("numbering", Map.of("mode", "roman"))));
        assertThrows(IllegalArgumentException.class, () -> ParserOptions.fromUserOptions(Map.of("logLevel", "loud")));
        assertThrows(IllegalArgumentException.class, () -> ParserOptions.fromUserOptions(Map.of("array", "wide")));
    }

    @Test
    void withLogLevelKeepsOtherValues() {
        var options = ParserOptions.fromUserOptions(Map.of("delimiters", Map.of("left", "[")));
        var verbose = options.withLogLevel(LogLevel.DEBUG);
        assertEquals(LogLevel.DEBUG, verbose.logLevel());
        assertEquals("[", verbose.leftDelimiter());
    }
}
