package work.lcod.texstack.runtime;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.io.InputStream;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Read-only lookup from a symbol to its dedicated negated glyph (e.g. {@code =} to {@code ≠}).
 */
public final class NegationTable {
    private static final String RESOURCE_PATH = "/tables/not_remap.json";
    private static final ObjectMapper JSON = new ObjectMapper();
    private static final TypeReference<Map<String, String>> MAP_REF = new TypeReference<>() {};
    private static volatile NegationTable defaults;

    private final Map<String, String> remap;

    public NegationTable(Map<String, String> remap) {
        this.remap = Collections.unmodifiableMap(new LinkedHashMap<>(remap));
    }

    /**
     * Table bundled with the library, loaded once per process.
     */
    public static NegationTable defaults() {
        NegationTable table = defaults;
        if (table == null) {
            synchronized (NegationTable.class) {
                table = defaults;
                if (table == null) {
                    table = load();
                    defaults = table;
                }
            }
        }
        return table;
    }

    private static NegationTable load() {
        try (InputStream in = NegationTable.class.getResourceAsStream(RESOURCE_PATH)) {
            if (in == null) {
                throw new IllegalStateException("Missing negation table resource " + RESOURCE_PATH);
            }
            return new NegationTable(JSON.readValue(in, MAP_REF));
        } catch (IOException ex) {
            throw new IllegalStateException("Unable to read negation table: " + ex.getMessage(), ex);
        }
    }

    public Optional<String> lookup(String symbol) {
        return Optional.ofNullable(remap.get(symbol));
    }

    public boolean contains(String symbol) {
        return remap.containsKey(symbol);
    }

    public int size() {
        return remap.size();
    }
}
