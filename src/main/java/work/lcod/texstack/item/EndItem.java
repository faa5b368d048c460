package work.lcod.texstack.item;

/**
 * {@code \end{name}}.
 */
public class EndItem extends StackItem {
    public EndItem() {
        super(ItemKind.END);
    }
}
