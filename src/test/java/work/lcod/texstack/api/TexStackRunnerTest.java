package work.lcod.texstack.api;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;
import work.lcod.texstack.config.ParserOptions;
import work.lcod.texstack.script.ItemScript;

class TexStackRunnerTest {
    private static Path resource(String... parts) {
        return Path.of("src/test/resources", parts).toAbsolutePath();
    }

    @Test
    void runsScriptFile() {
        var result = new TexStackRunner().run(resource("scripts", "fraction.yaml"), null, null);
        assertEquals(ParseResult.Status.SUCCESS, result.status());
        assertTrue(result.isSuccess());
        assertEquals("TeXAtom", result.tree().kind());
        assertEquals(LogLevel.WARN, result.logLevel());
        assertNull(result.error());
        var tree = (Map<?, ?>) result.toSerializableMap().get("tree");
        assertEquals("TeXAtom", tree.get("kind"));
    }

    @Test
    void optionsFileAndLogLevelApply() {
        var result = new TexStackRunner().run(
            resource("scripts", "fenced.json"),
            resource("options", "compact.yaml"),
            LogLevel.ERROR
        );
        assertEquals(ParseResult.Status.SUCCESS, result.status());
        assertEquals(LogLevel.ERROR, result.logLevel());
    }

    @Test
    void reductionErrorBecomesFailure() {
        var result = new TexStackRunner().run(resource("scripts", "bad-end.yaml"), null, null);
        assertEquals(ParseResult.Status.FAILURE, result.status());
        assertEquals(1, result.status().exitCode());
        assertEquals("EnvBadEnd", result.errorKey());
        assertEquals(List.of("aligned", "gathered"), result.errorArgs());
        assertEquals("\\begin{aligned} ended with \\end{gathered}", result.error());
        assertNull(result.tree());
    }

    @Test
    void invalidOptionsBecomeFailure() {
        var result = new TexStackRunner().run(
            resource("scripts", "fraction.yaml"),
            resource("options", "unknown.json"),
            null
        );
        assertFalse(result.isSuccess());
        assertNull(result.errorKey());
        assertTrue(result.errorArgs().isEmpty());
        assertNull(result.logLevel());
        assertTrue(result.error().contains("fontSize"));
        assertFalse(result.toSerializableMap().containsKey("errorArgs"));
    }

    @Test
    void runsInlineScript() {
        var script = new ItemScript(List.of(Map.of("kind", "mml", "node", "mi:x")));
        var result = new TexStackRunner().run(script, ParserOptions.defaults());
        assertTrue(result.isSuccess());
        assertEquals("<inline>", result.script());
        assertEquals("mi(x)", result.tree().toString());
    }

    @Test
    void prettyJsonCarriesStatus() {
        var result = new TexStackRunner().run(resource("scripts", "unbalanced.yaml"), null, null);
        var json = result.toPrettyJson();
        assertTrue(json.contains("\"status\" : \"failure\""));
        assertTrue(json.contains("ExtraOpenMissingClose"));
        assertEquals("failure", result.toSerializableMap().get("status"));
    }
}
