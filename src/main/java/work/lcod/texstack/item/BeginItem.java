package work.lcod.texstack.item;

import java.util.Objects;
import work.lcod.texstack.error.TexErrorKind;
import work.lcod.texstack.runtime.ParseContext;

/**
 * {@code \begin{name}}: collects the environment body until the {@code \end} with the same name.
 */
public class BeginItem extends StackItem {
    private EnvironmentHandler endHandler;

    public BeginItem() {
        super(ItemKind.BEGIN);
    }

    public EnvironmentHandler endHandler() {
        return endHandler;
    }

    public BeginItem setEndHandler(EnvironmentHandler endHandler) {
        this.endHandler = endHandler;
        return this;
    }

    @Override
    public CheckResult checkItem(ParseContext ctx, StackItem item) {
        if (item.isKind(ItemKind.END)) {
            if (!Objects.equals(item.name(), name())) {
                throw TexErrorKind.ENV_BAD_END.error(name(), item.name());
            }
            if (endHandler == null) {
                return CheckResult.replace(ctx.factory().mml(toMml()));
            }
            CheckResult result = endHandler.finish(ctx, this, data());
            if (result == null) {
                throw new IllegalStateException("Environment handler for " + name() + " returned no result");
            }
            return result;
        }
        if (item.isKind(ItemKind.STOP)) {
            throw TexErrorKind.ENV_MISSING_END.error(name());
        }
        return super.checkItem(ctx, item);
    }
}
