package work.lcod.texstack.item;

import java.util.ArrayList;
import java.util.List;
import work.lcod.texstack.error.TexErrorKind;
import work.lcod.texstack.runtime.ParseContext;
import work.lcod.texstack.tree.MmlNode;
import work.lcod.texstack.tree.Nodes;

/**
 * Moves the next finished node: vertically ({@code \raise}, {@code \lower}) or by padding it on both sides.
 */
public class PositionItem extends StackItem {
    private Move move = Move.VERTICAL;
    private String dh;
    private String dd;
    private MmlNode left;
    private MmlNode right;

    public PositionItem() {
        super(ItemKind.POSITION);
    }

    public Move move() {
        return move;
    }

    public PositionItem vertical(String dh, String dd) {
        this.move = Move.VERTICAL;
        this.dh = dh;
        this.dd = dd;
        return this;
    }

    public PositionItem horizontal(MmlNode left, MmlNode right) {
        this.move = Move.HORIZONTAL;
        this.left = left;
        this.right = right;
        return this;
    }

    @Override
    public CheckResult checkItem(ParseContext ctx, StackItem item) {
        if (item.isClose()) {
            throw TexErrorKind.MISSING_BOX_FOR.error(name());
        }
        if (item.isFinal()) {
            MmlNode mml = item.toMml();
            if (move == Move.VERTICAL) {
                MmlNode padded = Nodes.create("mpadded", mml)
                    .setAttribute("height", dh)
                    .setAttribute("depth", dd)
                    .setAttribute("voffset", dh);
                return CheckResult.replace(ctx.factory().mml(padded));
            }
            List<StackItem> items = new ArrayList<>();
            if (left != null) {
                items.add(ctx.factory().mml(left));
            }
            items.add(item);
            if (right != null) {
                items.add(ctx.factory().mml(right));
            }
            return CheckResult.replace(items);
        }
        return super.checkItem(ctx, item);
    }

    public enum Move {
        VERTICAL,
        HORIZONTAL
    }
}
