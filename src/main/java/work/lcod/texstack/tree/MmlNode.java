package work.lcod.texstack.tree;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Mutable MathML-shaped tree node produced by stack reduction.
 *
 * <p>Script nodes ({@code msubsup}, {@code munderover} and their reduced forms) keep fixed child
 * slots that may be {@code null}; all other nodes keep a dense child list. Token nodes store their
 * characters as {@code text} children.
 */
public final class MmlNode {
    public static final int BASE = 0;
    public static final int SUB = 1;
    public static final int SUP = 2;

    private final String kind;
    private final String text;
    private final List<MmlNode> children = new ArrayList<>();
    private final Map<String, Object> attributes = new LinkedHashMap<>();
    private final Map<String, Object> properties = new LinkedHashMap<>();
    private TexClass texClass;

    private MmlNode(String kind, String text) {
        this.kind = Objects.requireNonNull(kind, "kind");
        this.text = text;
    }

    public static MmlNode of(String kind) {
        var node = new MmlNode(kind, null);
        if (isScriptKind(kind)) {
            node.children.add(null);
            node.children.add(null);
            node.children.add(null);
        }
        return node;
    }

    public static MmlNode text(String value) {
        return new MmlNode("text", value == null ? "" : value);
    }

    public String kind() {
        return kind;
    }

    public boolean isKind(String candidate) {
        return kind.equals(candidate);
    }

    public boolean isText() {
        return "text".equals(kind);
    }

    public String textValue() {
        return text;
    }

    public List<MmlNode> children() {
        return Collections.unmodifiableList(children);
    }

    public MmlNode child(int index) {
        return index >= 0 && index < children.size() ? children.get(index) : null;
    }

    public MmlNode appendChildren(List<MmlNode> nodes) {
        for (MmlNode node : nodes) {
            children.add(node);
        }
        return this;
    }

    public MmlNode appendChild(MmlNode node) {
        children.add(node);
        return this;
    }

    /**
     * Writes {@code node} into slot {@code index}, growing the child list with empty slots when needed.
     */
    public MmlNode setChild(int index, MmlNode node) {
        while (children.size() <= index) {
            children.add(null);
        }
        children.set(index, node);
        return this;
    }

    public Map<String, Object> attributes() {
        return attributes;
    }

    public Object attribute(String name) {
        return attributes.get(name);
    }

    public MmlNode setAttribute(String name, Object value) {
        if (value == null) {
            attributes.remove(name);
        } else {
            attributes.put(name, value);
        }
        return this;
    }

    public Map<String, Object> properties() {
        return properties;
    }

    public Object property(String name) {
        return properties.get(name);
    }

    public MmlNode setProperty(String name, Object value) {
        if (value == null) {
            properties.remove(name);
        } else {
            properties.put(name, value);
        }
        return this;
    }

    public TexClass texClass() {
        if (texClass != null) {
            return texClass;
        }
        if ("mo".equals(kind)) {
            return TexClass.REL;
        }
        if ("mspace".equals(kind)) {
            return TexClass.NONE;
        }
        return TexClass.ORD;
    }

    public boolean hasExplicitTexClass() {
        return texClass != null;
    }

    public MmlNode setTexClass(TexClass value) {
        this.texClass = value;
        return this;
    }

    /**
     * Concatenated characters of the direct text children.
     */
    public String textContent() {
        if (isText()) {
            return text;
        }
        var builder = new StringBuilder();
        for (MmlNode child : children) {
            if (child != null && child.isText()) {
                builder.append(child.text);
            }
        }
        return builder.toString();
    }

    static boolean isScriptKind(String kind) {
        return "msubsup".equals(kind) || "munderover".equals(kind);
    }

    @Override
    public String toString() {
        if (isText()) {
            return text;
        }
        var builder = new StringBuilder(kind).append('(');
        for (int i = 0; i < children.size(); i++) {
            if (i > 0) {
                builder.append(',');
            }
            MmlNode child = children.get(i);
            builder.append(child == null ? "_" : child.toString());
        }
        return builder.append(')').toString();
    }
}
