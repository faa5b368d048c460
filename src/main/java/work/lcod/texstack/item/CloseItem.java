package work.lcod.texstack.item;

/**
 * Closing brace.
 */
public class CloseItem extends StackItem {
    public CloseItem() {
        super(ItemKind.CLOSE);
    }
}
