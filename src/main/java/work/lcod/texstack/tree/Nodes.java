package work.lcod.texstack.tree;

import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Construction and inspection helpers for {@link MmlNode} trees.
 */
public final class Nodes {
    public static final String APPLY_FUNCTION = "\u2061";

    private static final Set<String> SCRIPT_LIKE = Set.of(
        "msub", "msup", "msubsup", "munder", "mover", "munderover", "mfrac"
    );
    private static final Set<String> ROW_LIKE = Set.of(
        "mrow", "inferredMrow", "TeXAtom", "mstyle", "mpadded", "mphantom"
    );

    private Nodes() {}

    public static MmlNode create(String kind, List<MmlNode> children, Map<String, ?> attributes) {
        var node = MmlNode.of(kind);
        if (children != null) {
            if (MmlNode.isScriptKind(kind)) {
                for (int i = 0; i < children.size(); i++) {
                    node.setChild(i, children.get(i));
                }
            } else {
                node.appendChildren(children);
            }
        }
        if (attributes != null) {
            attributes.forEach(node::setAttribute);
        }
        return node;
    }

    public static MmlNode create(String kind, MmlNode... children) {
        return create(kind, Arrays.asList(children), null);
    }

    public static MmlNode token(String kind, String text) {
        return MmlNode.of(kind).appendChild(MmlNode.text(text));
    }

    public static MmlNode mo(String text, TexClass texClass) {
        return token("mo", text).setTexClass(texClass);
    }

    /**
     * Delimited group: {@code mrow} of class INNER holding stretchy open and close fences.
     */
    public static MmlNode fenced(String open, MmlNode mml, String close) {
        var mrow = MmlNode.of("mrow")
            .setAttribute("open", open)
            .setAttribute("close", close)
            .setTexClass(TexClass.INNER);
        mrow.appendChild(fence(open, TexClass.OPEN));
        appendContent(mrow, mml);
        mrow.appendChild(fence(close, TexClass.CLOSE));
        return mrow;
    }

    /**
     * Delimiters of fixed size around {@code mml}; empty delimiters are left out.
     */
    public static MmlNode fixedFence(String open, MmlNode mml, String close) {
        var mrow = MmlNode.of("mrow").setTexClass(TexClass.ORD);
        if (open != null && !open.isEmpty()) {
            mrow.appendChild(mo(open, TexClass.OPEN).setAttribute("stretchy", false));
        }
        appendContent(mrow, mml);
        if (close != null && !close.isEmpty()) {
            mrow.appendChild(mo(close, TexClass.CLOSE).setAttribute("stretchy", false));
        }
        return mrow;
    }

    private static MmlNode fence(String delim, TexClass texClass) {
        return mo(delim == null ? "" : delim, texClass)
            .setAttribute("fence", true)
            .setAttribute("stretchy", true);
    }

    private static void appendContent(MmlNode target, MmlNode mml) {
        if (mml == null) {
            return;
        }
        if (mml.isKind("inferredMrow")) {
            target.appendChildren(mml.children());
        } else {
            target.appendChild(mml);
        }
    }

    /**
     * Replaces script nodes that have only one of their two script slots filled by the two-child form.
     */
    public static MmlNode cleanSubSup(MmlNode mml) {
        if (mml == null || mml.isText()) {
            return mml;
        }
        var children = mml.children();
        for (int i = 0; i < children.size(); i++) {
            MmlNode child = children.get(i);
            if (child != null) {
                MmlNode cleaned = cleanSubSup(child);
                if (cleaned != child) {
                    mml.setChild(i, cleaned);
                }
            }
        }
        if (!MmlNode.isScriptKind(mml.kind())) {
            return mml;
        }
        MmlNode base = mml.child(MmlNode.BASE);
        MmlNode sub = mml.child(MmlNode.SUB);
        MmlNode sup = mml.child(MmlNode.SUP);
        if (sub != null && sup != null) {
            return mml;
        }
        boolean scripts = mml.isKind("msubsup");
        MmlNode replacement;
        if (sub != null) {
            replacement = create(scripts ? "msub" : "munder", base, sub);
        } else {
            replacement = create(scripts ? "msup" : "mover", base, sup);
        }
        replacement.attributes().putAll(mml.attributes());
        replacement.properties().putAll(mml.properties());
        if (mml.hasExplicitTexClass()) {
            replacement.setTexClass(mml.texClass());
        }
        return replacement;
    }

    public static boolean isEmbellished(MmlNode mml) {
        return coreMO(mml) != null;
    }

    /**
     * The operator an embellished node wraps, or {@code null} when the node is not embellished.
     */
    public static MmlNode coreMO(MmlNode mml) {
        if (mml == null || mml.isText()) {
            return null;
        }
        if (mml.isKind("mo")) {
            return mml;
        }
        if (SCRIPT_LIKE.contains(mml.kind())) {
            return coreMO(mml.child(0));
        }
        if (ROW_LIKE.contains(mml.kind())) {
            MmlNode single = null;
            for (MmlNode child : mml.children()) {
                if (child == null || isSpaceLike(child)) {
                    continue;
                }
                if (single != null) {
                    return null;
                }
                single = child;
            }
            return coreMO(single);
        }
        return null;
    }

    public static boolean isSpaceLike(MmlNode mml) {
        return mml != null && (mml.isKind("mspace") || mml.isKind("mtext") && mml.textContent().isBlank());
    }
}
