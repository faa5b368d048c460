package work.lcod.texstack.item;

import work.lcod.texstack.error.TexErrorKind;
import work.lcod.texstack.runtime.ParseContext;
import work.lcod.texstack.tree.MmlNode;
import work.lcod.texstack.tree.Nodes;

/**
 * Brace group. On the matching close the content becomes an atom, which keeps surrounding spacing rules off it.
 */
public class OpenItem extends StackItem {
    public OpenItem() {
        super(ItemKind.OPEN);
        registerCloseError(ItemKind.STOP, TexErrorKind.EXTRA_OPEN_MISSING_CLOSE);
    }

    @Override
    public CheckResult checkItem(ParseContext ctx, StackItem item) {
        if (item.isKind(ItemKind.CLOSE)) {
            MmlNode mml = Nodes.cleanSubSup(toMml());
            return CheckResult.replace(ctx.factory().mml(Nodes.create("TeXAtom", mml)));
        }
        return super.checkItem(ctx, item);
    }
}
