package work.lcod.texstack.config;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.stream.Collectors;
import org.tomlj.Toml;
import org.tomlj.TomlArray;
import org.tomlj.TomlParseResult;
import org.tomlj.TomlTable;

/**
 * Reads user option files ({@code .toml}, {@code .json}, {@code .yaml}/{@code .yml}) into plain nested maps.
 */
public final class OptionsLoader {
    private static final ObjectMapper JSON = new ObjectMapper();
    private static final ObjectMapper YAML = new ObjectMapper(new YAMLFactory());
    private static final TypeReference<Map<String, Object>> MAP_REF = new TypeReference<>() {};

    private OptionsLoader() {}

    public static ParserOptions loadOptions(Path path) {
        return ParserOptions.fromUserOptions(load(path));
    }

    public static Map<String, Object> load(Path path) {
        if (path == null || !Files.isRegularFile(path)) {
            throw new IllegalArgumentException("Options file not found: " + path);
        }
        String fileName = path.getFileName().toString().toLowerCase(Locale.ROOT);
        try {
            String text = Files.readString(path);
            if (fileName.endsWith(".toml")) {
                return parseToml(text, path.toString());
            }
            if (fileName.endsWith(".yaml") || fileName.endsWith(".yml")) {
                Map<String, Object> parsed = YAML.readValue(text, MAP_REF);
                return parsed == null ? new LinkedHashMap<>() : new LinkedHashMap<>(parsed);
            }
            return new LinkedHashMap<>(JSON.readValue(text, MAP_REF));
        } catch (IOException ex) {
            throw new IllegalStateException("Failed to read options: " + path, ex);
        }
    }

    public static Map<String, Object> parseToml(String text, String source) {
        TomlParseResult result = Toml.parse(text);
        if (result.hasErrors()) {
            String errors = result.errors().stream().map(Object::toString).collect(Collectors.joining("; "));
            throw new IllegalArgumentException("Invalid TOML options in " + source + ": " + errors);
        }
        return convertTomlTable(result);
    }

    private static Map<String, Object> convertTomlTable(TomlTable table) {
        Map<String, Object> map = new LinkedHashMap<>();
        for (String key : table.keySet()) {
            map.put(key, convertTomlValue(table.get(List.of(key))));
        }
        return map;
    }

    private static Object convertTomlValue(Object value) {
        if (value instanceof TomlTable table) {
            return convertTomlTable(table);
        }
        if (value instanceof TomlArray array) {
            List<Object> list = new ArrayList<>();
            for (int i = 0; i < array.size(); i++) {
                list.add(convertTomlValue(array.get(i)));
            }
            return list;
        }
        return value;
    }
}
