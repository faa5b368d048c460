package work.lcod.texstack.item;

import java.util.List;
import work.lcod.texstack.runtime.ParseContext;
import work.lcod.texstack.tree.MmlNode;

/**
 * Finishes an environment when its {@code \end} matches, replacing the begin item on the stack.
 */
@FunctionalInterface
public interface EnvironmentHandler {
    CheckResult finish(ParseContext ctx, BeginItem begin, List<MmlNode> content);
}
