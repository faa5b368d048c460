package work.lcod.texstack.item;

import java.util.Optional;
import work.lcod.texstack.runtime.ParseContext;
import work.lcod.texstack.tree.MmlNode;
import work.lcod.texstack.tree.Nodes;
import work.lcod.texstack.tree.TexClass;

/**
 * {@code \not}: negates the next symbol, preferring a dedicated negated glyph when one exists.
 */
public class NotItem extends StackItem {
    static final String COMBINING_SLASH = "\u0338";
    static final String NOT_SLASH = "\u29F8";

    public NotItem() {
        super(ItemKind.NOT);
    }

    @Override
    public CheckResult checkItem(ParseContext ctx, StackItem item) {
        if (item.isKind(ItemKind.OPEN) || item.isKind(ItemKind.LEFT)) {
            return CheckResult.push();
        }
        MmlNode mml = item.first();
        if (item.isKind(ItemKind.MML) && isNegatable(mml)) {
            String c = mml.textContent();
            Optional<String> negated = ctx.negations().lookup(c);
            if (negated.isPresent()) {
                mml.setChild(0, MmlNode.text(negated.get()));
            } else {
                mml.appendChild(MmlNode.text(COMBINING_SLASH));
            }
            return CheckResult.replace(item);
        }
        MmlNode slash = Nodes.create("mpadded", Nodes.token("mtext", NOT_SLASH)).setAttribute("width", 0);
        MmlNode rel = Nodes.create("TeXAtom", slash).setTexClass(TexClass.REL);
        return CheckResult.replace(ctx.factory().mml(rel), item);
    }

    private static boolean isNegatable(MmlNode mml) {
        if (mml == null || !(mml.isKind("mo") || mml.isKind("mi") || mml.isKind("mtext"))) {
            return false;
        }
        return mml.textContent().length() == 1
            && mml.property("movesupsub") == null
            && mml.children().size() == 1;
    }
}
