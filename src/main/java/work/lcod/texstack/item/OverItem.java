package work.lcod.texstack.item;

import work.lcod.texstack.error.TexErrorKind;
import work.lcod.texstack.runtime.ParseContext;
import work.lcod.texstack.tree.MmlNode;
import work.lcod.texstack.tree.Nodes;

/**
 * Infix fraction ({@code \over}, {@code \above}, {@code \choose}, ...). The numerator is what the enclosing
 * scope had collected when this item arrived; the denominator is collected until the scope closes.
 */
public class OverItem extends StackItem {
    private MmlNode numerator;
    private String thickness;
    private String open;
    private String close;

    public OverItem() {
        super(ItemKind.OVER);
        setName("\\over");
    }

    public MmlNode numerator() {
        return numerator;
    }

    public OverItem setNumerator(MmlNode numerator) {
        this.numerator = numerator;
        return this;
    }

    public String thickness() {
        return thickness;
    }

    public OverItem setThickness(String thickness) {
        this.thickness = thickness;
        return this;
    }

    public OverItem setDelimiters(String open, String close) {
        this.open = open;
        this.close = close;
        return this;
    }

    public String open() {
        return open;
    }

    public String close() {
        return close;
    }

    @Override
    public CheckResult checkItem(ParseContext ctx, StackItem item) {
        if (item.isKind(ItemKind.OVER)) {
            throw TexErrorKind.AMBIGUOUS_USE_OF.error(item.name());
        }
        if (item.isClose()) {
            MmlNode num = numerator == null ? Nodes.create("mrow") : numerator;
            MmlNode mml = Nodes.create("mfrac", num, toMml(false, false));
            if (thickness != null) {
                mml.setAttribute("linethickness", thickness);
            }
            if (hasText(open) || hasText(close)) {
                mml.setProperty("withDelims", true);
                mml = Nodes.fixedFence(open, mml, close);
            }
            return CheckResult.replace(ctx.factory().mml(mml), item);
        }
        return super.checkItem(ctx, item);
    }

    private static boolean hasText(String value) {
        return value != null && !value.isEmpty();
    }

    @Override
    public String toString() {
        return "over[" + numerator + " / " + data() + "]";
    }
}
