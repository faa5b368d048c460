package work.lcod.texstack.item;

import java.util.EnumSet;
import java.util.Set;
import work.lcod.texstack.runtime.ParseContext;
import work.lcod.texstack.tree.MmlNode;
import work.lcod.texstack.tree.Nodes;
import work.lcod.texstack.tree.TexClass;

/**
 * Named function ({@code \sin}, {@code \log}, ...) waiting to see its argument. An invisible function-application
 * operator goes between the name and anything that is not itself an operator.
 */
public class FnItem extends StackItem {
    private static final Set<TexClass> NO_APPLY = EnumSet.of(TexClass.BIN, TexClass.REL, TexClass.CLOSE, TexClass.PUNCT);

    public FnItem(MmlNode... nodes) {
        super(ItemKind.FN, nodes);
    }

    @Override
    public CheckResult checkItem(ParseContext ctx, StackItem item) {
        MmlNode top = first();
        if (top == null) {
            return super.checkItem(ctx, item);
        }
        if (item.isOpen()) {
            return CheckResult.push();
        }
        if (!item.isKind(ItemKind.FN)) {
            MmlNode mml = item.first();
            if (!item.isKind(ItemKind.MML) || mml == null || mml.isKind("mspace")) {
                return CheckResult.replace(ctx.factory().mml(top), item);
            }
            if (Nodes.isEmbellished(mml)) {
                mml = Nodes.coreMO(mml);
            }
            if (NO_APPLY.contains(mml.texClass())) {
                return CheckResult.replace(ctx.factory().mml(top), item);
            }
        }
        MmlNode apply = Nodes.mo(Nodes.APPLY_FUNCTION, TexClass.NONE);
        return CheckResult.replace(ctx.factory().mml(top), ctx.factory().mml(apply), item);
    }
}
