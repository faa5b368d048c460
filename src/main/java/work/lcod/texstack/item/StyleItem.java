package work.lcod.texstack.item;

import java.util.LinkedHashMap;
import java.util.Map;
import work.lcod.texstack.runtime.ParseContext;
import work.lcod.texstack.tree.MmlNode;
import work.lcod.texstack.tree.Nodes;

/**
 * Style switch ({@code \displaystyle}, {@code \scriptstyle}, ...) that applies up to the end of the enclosing scope.
 */
public class StyleItem extends StackItem {
    private final Map<String, Object> styles = new LinkedHashMap<>();

    public StyleItem() {
        super(ItemKind.STYLE);
    }

    public Map<String, Object> styles() {
        return styles;
    }

    public StyleItem setStyle(String name, Object value) {
        styles.put(name, value);
        return this;
    }

    @Override
    public CheckResult checkItem(ParseContext ctx, StackItem item) {
        if (!item.isClose()) {
            return super.checkItem(ctx, item);
        }
        MmlNode mml = Nodes.create("mstyle", data(), styles);
        return CheckResult.replace(ctx.factory().mml(mml), item);
    }
}
