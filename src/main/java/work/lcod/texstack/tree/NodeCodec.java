package work.lcod.texstack.tree;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Converts trees to and from plain maps so they can travel through Jackson (JSON or YAML).
 *
 * <p>A node literal is either a map {@code {kind, text?, texClass?, attributes?, properties?, children?}}
 * or the shorthand string {@code "kind:text"} for token nodes (e.g. {@code "mi:x"}, {@code "mo:+"}).
 */
public final class NodeCodec {
    private NodeCodec() {}

    public static MmlNode fromLiteral(Object literal) {
        if (literal == null) {
            return null;
        }
        if (literal instanceof MmlNode node) {
            return node;
        }
        if (literal instanceof String shorthand) {
            return fromShorthand(shorthand);
        }
        if (literal instanceof Map<?, ?> map) {
            return fromMap(map);
        }
        throw new IllegalArgumentException("Unsupported node literal: " + literal);
    }

    private static MmlNode fromShorthand(String shorthand) {
        int colon = shorthand.indexOf(':');
        if (colon <= 0) {
            return MmlNode.of(shorthand.trim());
        }
        String kind = shorthand.substring(0, colon).trim();
        String text = shorthand.substring(colon + 1);
        if ("text".equals(kind)) {
            return MmlNode.text(text);
        }
        return Nodes.token(kind, text);
    }

    private static MmlNode fromMap(Map<?, ?> map) {
        Object rawKind = map.get("kind");
        if (!(rawKind instanceof String kind) || kind.isBlank()) {
            throw new IllegalArgumentException("Node literal is missing 'kind': " + map);
        }
        if ("text".equals(kind)) {
            return MmlNode.text(stringValue(map.get("text")));
        }
        MmlNode node = MmlNode.of(kind);
        if (map.get("text") != null) {
            node.appendChild(MmlNode.text(stringValue(map.get("text"))));
        }
        if (map.get("children") instanceof List<?> children) {
            for (int i = 0; i < children.size(); i++) {
                MmlNode child = fromLiteral(children.get(i));
                if (node.children().size() > i) {
                    node.setChild(i, child);
                } else {
                    node.appendChild(child);
                }
            }
        }
        if (map.get("attributes") instanceof Map<?, ?> attributes) {
            attributes.forEach((key, value) -> node.setAttribute(String.valueOf(key), value));
        }
        if (map.get("properties") instanceof Map<?, ?> properties) {
            properties.forEach((key, value) -> node.setProperty(String.valueOf(key), value));
        }
        if (map.get("texClass") instanceof String texClass && !texClass.isBlank()) {
            node.setTexClass(TexClass.valueOf(texClass.trim().toUpperCase(Locale.ROOT)));
        }
        return node;
    }

    public static Map<String, Object> toMap(MmlNode node) {
        if (node == null) {
            return null;
        }
        var map = new LinkedHashMap<String, Object>();
        map.put("kind", node.kind());
        if (node.isText()) {
            map.put("text", node.textValue());
            return map;
        }
        if (node.hasExplicitTexClass()) {
            map.put("texClass", node.texClass().name());
        }
        if (!node.attributes().isEmpty()) {
            map.put("attributes", new LinkedHashMap<>(node.attributes()));
        }
        if (!node.properties().isEmpty()) {
            map.put("properties", new LinkedHashMap<>(node.properties()));
        }
        if (!node.children().isEmpty()) {
            List<Object> children = new ArrayList<>();
            for (MmlNode child : node.children()) {
                children.add(toMap(child));
            }
            map.put("children", children);
        }
        return map;
    }

    private static String stringValue(Object value) {
        return value == null ? "" : String.valueOf(value);
    }
}
