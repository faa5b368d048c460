package work.lcod.texstack.config;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Deep merge of nested option maps.
 *
 * <p>Maps merge key by key, lists and maps coming from a source are copied, and a source value of the form
 * {@code {"$append": [...]}} extends an existing list instead of replacing it.
 */
public final class OptionMerger {
    public static final String APPEND = "$append";

    private OptionMerger() {}

    /**
     * Merges {@code defs} into {@code options}, accepting keys the target does not know yet.
     */
    @SafeVarargs
    public static Map<String, Object> defaultOptions(Map<String, Object> options, Map<String, ?>... defs) {
        for (Map<String, ?> def : defs) {
            insert(options, def, false);
        }
        return options;
    }

    /**
     * Merges {@code defs} into {@code options}, rejecting keys that have no default value.
     */
    @SafeVarargs
    public static Map<String, Object> userOptions(Map<String, Object> options, Map<String, ?>... defs) {
        for (Map<String, ?> def : defs) {
            insert(options, def, true);
        }
        return options;
    }

    public static Map<String, Object> insert(Map<String, Object> dst, Map<String, ?> src, boolean warn) {
        if (src == null) {
            return dst;
        }
        for (Map.Entry<String, ?> entry : src.entrySet()) {
            String key = entry.getKey();
            Object sval = entry.getValue();
            if (warn && dst.get(key) == null) {
                throw new IllegalArgumentException("Invalid option '" + key + "' (no default value).");
            }
            Object dval = dst.get(key);
            if (sval instanceof Map<?, ?> smap && dval != null) {
                if (dval instanceof List<?> dlist && isAppend(smap)) {
                    List<Object> extended = new ArrayList<>(dlist);
                    for (Object value : (List<?>) smap.get(APPEND)) {
                        extended.add(copyValue(value));
                    }
                    dst.put(key, extended);
                    continue;
                }
                if (dval instanceof Map<?, ?> dmap) {
                    Map<String, Object> nested = castMap(dmap);
                    insert(nested, castMap(smap), warn);
                    dst.put(key, nested);
                    continue;
                }
            }
            dst.put(key, copyValue(sval));
        }
        return dst;
    }

    private static boolean isAppend(Map<?, ?> map) {
        return map.size() == 1 && map.get(APPEND) instanceof List<?>;
    }

    public static Map<String, Object> copy(Map<String, ?> def) {
        var result = new LinkedHashMap<String, Object>();
        if (def == null) {
            return result;
        }
        for (Map.Entry<String, ?> entry : def.entrySet()) {
            result.put(entry.getKey(), copyValue(entry.getValue()));
        }
        return result;
    }

    private static Object copyValue(Object value) {
        if (value instanceof Map<?, ?> map) {
            return copy(castMap(map));
        }
        if (value instanceof List<?> list) {
            List<Object> result = new ArrayList<>(list.size());
            for (Object item : list) {
                result.add(copyValue(item));
            }
            return result;
        }
        return value;
    }

    public static Map<String, Object> selectOptions(Map<String, ?> options, String... keys) {
        var subset = new LinkedHashMap<String, Object>();
        for (String key : keys) {
            subset.put(key, options.get(key));
        }
        return subset;
    }

    /**
     * Splits {@code options} by the key sets of {@code objects}: element 0 holds the keys none of them knows,
     * element {@code i} the keys claimed by {@code objects[i-1]} (first claim wins).
     */
    @SafeVarargs
    public static List<Map<String, Object>> separateOptions(Map<String, ?> options, Map<String, ?>... objects) {
        List<Map<String, Object>> results = new ArrayList<>();
        Map<String, Object> remaining = new LinkedHashMap<>(options == null ? Map.of() : options);
        for (Map<String, ?> object : objects) {
            var exists = new LinkedHashMap<String, Object>();
            var missing = new LinkedHashMap<String, Object>();
            for (Map.Entry<String, Object> entry : remaining.entrySet()) {
                if (object.get(entry.getKey()) == null) {
                    missing.put(entry.getKey(), entry.getValue());
                } else {
                    exists.put(entry.getKey(), entry.getValue());
                }
            }
            results.add(exists);
            remaining = missing;
        }
        results.add(0, remaining);
        return results;
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> castMap(Map<?, ?> map) {
        if (map instanceof LinkedHashMap<?, ?>) {
            return (Map<String, Object>) map;
        }
        var result = new LinkedHashMap<String, Object>();
        map.forEach((key, value) -> result.put(String.valueOf(key), value));
        return result;
    }
}
