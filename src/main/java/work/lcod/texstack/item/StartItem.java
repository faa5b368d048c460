package work.lcod.texstack.item;

import work.lcod.texstack.runtime.ParseContext;

/**
 * Bottom of the stack. Collapses everything collected into one final item when the stop marker arrives.
 */
public class StartItem extends StackItem {
    public StartItem() {
        super(ItemKind.START);
    }

    @Override
    public CheckResult checkItem(ParseContext ctx, StackItem item) {
        if (item.isKind(ItemKind.STOP)) {
            return CheckResult.replace(ctx.factory().mml(toMml()));
        }
        return super.checkItem(ctx, item);
    }
}
