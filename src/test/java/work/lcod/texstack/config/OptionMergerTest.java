package work.lcod.texstack.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotSame;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class OptionMergerTest {
    @Test
    void nestedMapsMergeKeyByKey() {
        var options = OptionMerger.defaultOptions(new LinkedHashMap<>(), Map.of("a", Map.of("x", 1, "y", 2)));
        OptionMerger.userOptions(options, Map.of("a", Map.of("y", 3)));
        assertEquals(Map.of("x", 1, "y", 3), options.get("a"));
    }

    @Test
    void appendExtendsLists() {
        var options = OptionMerger.defaultOptions(new LinkedHashMap<>(), Map.of("packages", List.of("base")));
        OptionMerger.userOptions(options, Map.of("packages", Map.of(OptionMerger.APPEND, List.of("ams", "color"))));
        assertEquals(List.of("base", "ams", "color"), options.get("packages"));
    }

    @Test
    void listsAreReplacedWithoutAppend() {
        var options = OptionMerger.defaultOptions(new LinkedHashMap<>(), Map.of("packages", List.of("base")));
        OptionMerger.userOptions(options, Map.of("packages", List.of("ams")));
        assertEquals(List.of("ams"), options.get("packages"));
    }

    @Test
    void userOptionsRejectUnknownKeys() {
        var options = OptionMerger.defaultOptions(new LinkedHashMap<>(), Map.of("a", 1));
        var ex = assertThrows(IllegalArgumentException.class, () -> OptionMerger.userOptions(options, Map.of("b", 2)));
        assertEquals("Invalid option 'b' (no default value).", ex.getMessage());
    }

    @Test
    void defaultOptionsAcceptNewKeys() {
        var options = OptionMerger.defaultOptions(new LinkedHashMap<>(), Map.of("a", 1), Map.of("b", 2));
        assertEquals(Map.of("a", 1, "b", 2), options);
    }

    @Test
    void copyIsDeep() {
        Map<String, Object> source = Map.of("list", List.of(Map.of("k", "v")));
        var copy = OptionMerger.copy(source);
        assertEquals(source, copy);
        assertNotSame(source.get("list"), copy.get("list"));
    }

    @Test
    void selectAndSeparate() {
        Map<String, Object> options = Map.of("a", 1, "b", 2, "c", 3);
        assertEquals(Map.of("a", 1, "c", 3), OptionMerger.selectOptions(options, "a", "c"));

        var parts = OptionMerger.separateOptions(options, Map.of("a", true), Map.of("a", true, "b", true));
        assertEquals(3, parts.size());
        assertEquals(Map.of("c", 3), parts.get(0));
        assertEquals(Map.of("a", 1), parts.get(1));
        assertEquals(Map.of("b", 2), parts.get(2));
    }
}
