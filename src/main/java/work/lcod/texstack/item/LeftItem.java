package work.lcod.texstack.item;

import work.lcod.texstack.error.TexErrorKind;
import work.lcod.texstack.runtime.ParseContext;
import work.lcod.texstack.tree.Nodes;

/**
 * {@code \left} delimiter, waiting for its {@code \right}.
 */
public class LeftItem extends StackItem {
    private String delim;

    public LeftItem(String delim) {
        super(ItemKind.LEFT);
        this.delim = delim;
        registerCloseError(ItemKind.STOP, TexErrorKind.EXTRA_LEFT_MISSING_RIGHT);
    }

    public String delim() {
        return delim;
    }

    public LeftItem setDelim(String delim) {
        this.delim = delim;
        return this;
    }

    @Override
    public CheckResult checkItem(ParseContext ctx, StackItem item) {
        if (item instanceof RightItem right) {
            return CheckResult.replace(ctx.factory().mml(Nodes.fenced(delim, toMml(), right.delim())));
        }
        return super.checkItem(ctx, item);
    }
}
