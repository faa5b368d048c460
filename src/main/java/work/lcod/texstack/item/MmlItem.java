package work.lcod.texstack.item;

import work.lcod.texstack.runtime.ParseContext;
import work.lcod.texstack.tree.MmlNode;

/**
 * Wraps exactly one finished tree, ready to be absorbed by the item below it.
 */
public class MmlItem extends StackItem {
    public MmlItem(MmlNode node) {
        super(ItemKind.MML, node);
        if (node == null) {
            throw new IllegalArgumentException("mml item requires a node");
        }
    }

    /**
     * A final item never absorbs anything; whatever arrives is stacked above it.
     */
    @Override
    public CheckResult checkItem(ParseContext ctx, StackItem item) {
        return CheckResult.push();
    }
}
