package work.lcod.texstack.api;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.junit.jupiter.api.Test;

class LogLevelTest {
    @Test
    void parsesCaseInsensitively() {
        assertEquals(LogLevel.DEBUG, LogLevel.from(" Debug "));
        assertEquals(LogLevel.WARN, LogLevel.from(null));
        assertEquals(LogLevel.WARN, LogLevel.from(""));
        assertThrows(IllegalArgumentException.class, () -> LogLevel.from("verbose"));
    }
}
