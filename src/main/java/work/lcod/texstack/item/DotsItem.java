package work.lcod.texstack.item;

import work.lcod.texstack.runtime.ParseContext;
import work.lcod.texstack.tree.MmlNode;
import work.lcod.texstack.tree.Nodes;
import work.lcod.texstack.tree.TexClass;

/**
 * {@code \dots}: picks low or centered dots once the following symbol is known.
 */
public class DotsItem extends StackItem {
    private MmlNode ldots = Nodes.mo("\u2026", TexClass.INNER);
    private MmlNode cdots = Nodes.mo("\u22EF", TexClass.INNER);

    public DotsItem() {
        super(ItemKind.DOTS);
    }

    public DotsItem setDots(MmlNode ldots, MmlNode cdots) {
        if (ldots != null) {
            this.ldots = ldots;
        }
        if (cdots != null) {
            this.cdots = cdots;
        }
        return this;
    }

    @Override
    public CheckResult checkItem(ParseContext ctx, StackItem item) {
        if (item.isKind(ItemKind.OPEN) || item.isKind(ItemKind.LEFT)) {
            return CheckResult.push();
        }
        MmlNode dots = ldots;
        if (item.isKind(ItemKind.MML) && Nodes.isEmbellished(item.first())) {
            TexClass texClass = Nodes.coreMO(item.first()).texClass();
            if (texClass == TexClass.BIN || texClass == TexClass.REL) {
                dots = cdots;
            }
        }
        return CheckResult.replace(ctx.factory().mml(dots), item);
    }
}
